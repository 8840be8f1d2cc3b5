/**
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */
package org.apache.apex.flow.aggregation;

import com.google.common.base.Preconditions;

import org.apache.apex.flow.api.AggregationType;
import org.apache.apex.flow.api.function.ReduceFunction;
import org.apache.apex.flow.record.FieldAccessor;

/**
 * Base of the aggregations computed over one field of the records. Aggregations are reduce functions,
 * the operator executing them holds the running accumulator, per key when the stream is grouped.
 *
 * @param <T> type of the records
 * @since 1.0.0
 */
public abstract class FieldAggregator<T> implements ReduceFunction<T>
{
  protected final AggregationType type;
  protected final FieldAccessor field;

  protected FieldAggregator(AggregationType type, FieldAccessor field)
  {
    this.type = Preconditions.checkNotNull(type, "type");
    this.field = Preconditions.checkNotNull(field, "field");
  }

  public AggregationType getType()
  {
    return type;
  }

  public FieldAccessor getField()
  {
    return field;
  }

  /**
   * @return the aggregator for the type
   * @throws IllegalArgumentException for {@link AggregationType#COUNT}, which does not aggregate a field
   */
  public static <T> FieldAggregator<T> create(AggregationType type, FieldAccessor field, boolean first)
  {
    switch (type) {
      case SUM:
        return new SumAggregator<>(field);
      case MIN:
      case MAX:
      case MIN_BY:
      case MAX_BY:
        return new ComparableAggregator<>(type, field, first);
      default:
        throw new IllegalArgumentException("Aggregation " + type + " is not computed over a field");
    }
  }

  @Override
  public String toString()
  {
    return type + "(" + field + ")";
  }

  private static final long serialVersionUID = 201810191201L;
}

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
import org.apache.apex.flow.record.FieldAccessor;

/**
 * Minimum and maximum of a comparable field.
 * <p>
 * {@link AggregationType#MIN} and {@link AggregationType#MAX} replace the field of the accumulated record
 * with the extremal value. {@link AggregationType#MIN_BY} and {@link AggregationType#MAX_BY} hold the whole
 * record with the extremal value; on equality the record seen first is kept unless {@code first} is false,
 * in which case the latest record wins.
 *
 * @param <T> type of the records
 * @since 1.0.0
 */
public class ComparableAggregator<T> extends FieldAggregator<T>
{
  private final boolean first;

  public ComparableAggregator(AggregationType type, FieldAccessor field, boolean first)
  {
    super(type, field);
    Preconditions.checkArgument(type == AggregationType.MIN || type == AggregationType.MAX || type.isByAggregation(),
        "%s is not a comparison", type);
    this.first = first;
  }

  public boolean isFirst()
  {
    return first;
  }

  @Override
  @SuppressWarnings("unchecked")
  public T reduce(T accumulated, T value)
  {
    Object current = field.get(accumulated);
    Object candidate = field.get(value);
    int c = compare(candidate, current);
    switch (type) {
      case MAX:
        return c > 0 ? (T)field.set(accumulated, candidate) : accumulated;
      case MIN:
        return c < 0 ? (T)field.set(accumulated, candidate) : accumulated;
      case MAX_BY:
        return c > 0 || (c == 0 && !first) ? value : accumulated;
      case MIN_BY:
        return c < 0 || (c == 0 && !first) ? value : accumulated;
      default:
        throw new IllegalStateException(type.toString());
    }
  }

  @SuppressWarnings("unchecked")
  private int compare(Object o1, Object o2)
  {
    if (o1 == null || o2 == null) {
      // nulls first
      return o1 == o2 ? 0 : (o1 == null ? -1 : 1);
    }
    if (!(o1 instanceof Comparable)) {
      throw new IllegalArgumentException("Values of field " + field + " of type " + o1.getClass().getName() + " are not comparable");
    }
    return ((Comparable<Object>)o1).compareTo(o2);
  }

  @Override
  public String toString()
  {
    return type + "(" + field + (type.isByAggregation() ? ", first=" + first : "") + ")";
  }

  private static final long serialVersionUID = 201810191203L;
}

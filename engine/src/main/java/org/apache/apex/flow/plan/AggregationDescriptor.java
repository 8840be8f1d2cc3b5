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
package org.apache.apex.flow.plan;

import java.io.Serializable;

import com.google.common.base.Preconditions;

import org.apache.apex.flow.api.AggregationType;
import org.apache.apex.flow.api.FieldRef;

/**
 * The aggregation computed by an aggregate node: type, aggregated field and, for {@code minBy} and
 * {@code maxBy}, which record is kept on equality.
 *
 * @since 1.0.0
 */
public final class AggregationDescriptor implements Serializable
{
  private final AggregationType type;
  private final FieldRef field;
  private final boolean first;

  public AggregationDescriptor(AggregationType type, FieldRef field, boolean first)
  {
    this.type = Preconditions.checkNotNull(type, "type");
    Preconditions.checkArgument(type == AggregationType.COUNT || field != null, "Aggregation %s requires a field", type);
    this.field = field;
    this.first = first;
  }

  public static AggregationDescriptor count()
  {
    return new AggregationDescriptor(AggregationType.COUNT, null, true);
  }

  public AggregationType getType()
  {
    return type;
  }

  /**
   * @return the aggregated field, null for count
   */
  public FieldRef getField()
  {
    return field;
  }

  public boolean isFirst()
  {
    return first;
  }

  @Override
  public String toString()
  {
    if (field == null) {
      return type.toString();
    }
    return type + "(" + field + (type.isByAggregation() ? ", first=" + first : "") + ")";
  }

  private static final long serialVersionUID = 201810191501L;
}

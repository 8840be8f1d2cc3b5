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

/**
 * Kind of the operator of a graph node.
 *
 * @since 1.0.0
 */
public enum OperatorKind
{
  SOURCE,
  MAP,
  FLAT_MAP,
  FILTER,
  /**
   * Reduce over the whole stream with a single accumulator.
   */
  REDUCE,
  /**
   * Reduce with one accumulator per key.
   */
  GROUPED_REDUCE,
  AGGREGATE,
  GROUPED_AGGREGATE,
  SINK;

  /**
   * @return true for operators holding a single accumulator for the whole stream; they run as a single instance
   */
  public boolean isGlobal()
  {
    return this == REDUCE || this == AGGREGATE;
  }

  public boolean isGrouped()
  {
    return this == GROUPED_REDUCE || this == GROUPED_AGGREGATE;
  }

  String getIdPrefix()
  {
    return name().toLowerCase().replace('_', '-');
  }
}

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
package org.apache.apex.flow.operator;

import org.apache.apex.flow.api.function.Function;

/**
 * Operator consuming the records of its input streams.
 *
 * @param <IN> type of the records received
 * @param <OUT> type of the records emitted
 * @since 1.0.0
 */
public abstract class StreamOperator<IN, OUT> extends AbstractOperator<OUT>
{
  protected StreamOperator(Function function)
  {
    super(function);
  }

  /**
   * Process one record, emitting the results to the output.
   *
   * @param record the record
   * @throws Exception exceptions of the user function
   */
  public abstract void process(IN record) throws Exception;

  private static final long serialVersionUID = 201810191302L;
}

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

import org.apache.apex.flow.api.Context.OperatorContext;
import org.apache.apex.flow.api.function.ReduceFunction;

/**
 * Reduces the whole stream into a single accumulator, emitting the accumulator after every record.
 * Runs as a single instance.
 *
 * @param <T> type of the records
 * @since 1.0.0
 */
public class StreamReduceOperator<T> extends StreamOperator<T, T>
{
  private final ReduceFunction<T> reducer;
  private transient T accumulated;
  private transient boolean initialized;

  public StreamReduceOperator(ReduceFunction<T> reducer)
  {
    super(reducer);
    this.reducer = reducer;
  }

  @Override
  public void setup(OperatorContext context)
  {
    super.setup(context);
    accumulated = null;
    initialized = false;
  }

  @Override
  public void process(T record) throws Exception
  {
    if (initialized) {
      accumulated = reducer.reduce(accumulated, record);
    } else {
      accumulated = record;
      initialized = true;
    }
    output.collect(accumulated);
  }

  private static final long serialVersionUID = 201810191307L;
}

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

import org.apache.apex.flow.api.function.SourceFunction;

/**
 * Emits the records of a source function.
 *
 * @param <T> type of the records
 * @since 1.0.0
 */
public class SourceOperator<T> extends AbstractOperator<T>
{
  private final SourceFunction<T> source;

  public SourceOperator(SourceFunction<T> source)
  {
    super(source);
    this.source = source;
  }

  /**
   * Runs the source until it returns.
   *
   * @throws Exception exceptions of the source function
   */
  public void run() throws Exception
  {
    source.run(output);
  }

  private static final long serialVersionUID = 201810191303L;
}

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
package org.apache.apex.flow.sink;

import java.io.PrintStream;

import org.apache.apex.flow.api.Component;
import org.apache.apex.flow.api.Context.OperatorContext;
import org.apache.apex.flow.api.function.SinkFunction;

/**
 * Prints the records to the standard output, or the standard error. When the sink runs with more than
 * one instance every line is prefixed with the number of the instance.
 *
 * @param <T> type of the records
 * @since 1.0.0
 */
public class PrintSinkFunction<T> implements SinkFunction<T>, Component<OperatorContext>
{
  private final boolean stdErr;
  private transient PrintStream stream;
  private transient String prefix;

  public PrintSinkFunction()
  {
    this(false);
  }

  public PrintSinkFunction(boolean stdErr)
  {
    this.stdErr = stdErr;
  }

  @Override
  public void setup(OperatorContext context)
  {
    stream = stdErr ? System.err : System.out;
    Integer parallelism = context.getValue(OperatorContext.PARALLELISM);
    prefix = parallelism != null && parallelism > 1 ? (context.getInstanceIndex() + 1) + "> " : "";
  }

  @Override
  public void invoke(T record)
  {
    stream.println(prefix + record);
  }

  @Override
  public void teardown()
  {
    stream.flush();
  }

  @Override
  public String toString()
  {
    return stdErr ? "Print to System.err" : "Print to System.out";
  }

  private static final long serialVersionUID = 201810191401L;
}

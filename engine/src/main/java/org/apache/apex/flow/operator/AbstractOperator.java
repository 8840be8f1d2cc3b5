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

import java.io.Serializable;

import org.apache.apex.flow.api.Component;
import org.apache.apex.flow.api.Context.OperatorContext;
import org.apache.apex.flow.api.function.Collector;
import org.apache.apex.flow.api.function.Function;

/**
 * Runtime instance of a graph node. One instance is created per parallel partition of the node, set up
 * before the first record, fed records and torn down at the end of the run.
 * <p>
 * User functions implementing {@link Component} are set up and torn down along with the operator.
 *
 * @param <OUT> type of the records emitted by the operator
 * @since 1.0.0
 */
public abstract class AbstractOperator<OUT> implements Component<OperatorContext>, Serializable
{
  private final Function function;
  protected transient Collector<OUT> output;

  protected AbstractOperator(Function function)
  {
    this.function = function;
  }

  public Function getFunction()
  {
    return function;
  }

  public void setOutput(Collector<OUT> output)
  {
    this.output = output;
  }

  @Override
  @SuppressWarnings("unchecked")
  public void setup(OperatorContext context)
  {
    if (function instanceof Component) {
      ((Component<OperatorContext>)function).setup(context);
    }
  }

  @Override
  @SuppressWarnings("unchecked")
  public void teardown()
  {
    if (function instanceof Component) {
      ((Component<OperatorContext>)function).teardown();
    }
  }

  @Override
  public String toString()
  {
    return getClass().getSimpleName() + "{" + function + "}";
  }

  private static final long serialVersionUID = 201810191301L;
}

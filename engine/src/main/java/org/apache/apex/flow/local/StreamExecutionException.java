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
package org.apache.apex.flow.local;

/**
 * Failure of an operator instance while the graph runs.
 *
 * @since 1.0.0
 */
public class StreamExecutionException extends RuntimeException
{
  private final String operatorName;

  public StreamExecutionException(String operatorName, Throwable cause)
  {
    super("Operator " + operatorName + " failed: " + cause, cause);
    this.operatorName = operatorName;
  }

  /**
   * @return node id and instance index of the failed operator
   */
  public String getOperatorName()
  {
    return operatorName;
  }

  private static final long serialVersionUID = 201810191601L;
}

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
package org.apache.apex.flow.partitioner;

/**
 * Chooses the instance of the consuming operator a record is delivered to.
 *
 * @param <T> type of the records
 * @since 1.0.0
 */
public interface RecordPartitioner<T>
{
  /**
   * Returned by partitioners delivering every record to all instances.
   */
  int ALL_INSTANCES = -1;

  /**
   * @param record the record
   * @param numberOfInstances number of instances of the consuming operator
   * @return index of the instance in {@code [0, numberOfInstances)} or {@link #ALL_INSTANCES}
   * @throws Exception exceptions of the key selector
   */
  int partition(T record, int numberOfInstances) throws Exception;
}

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

import org.apache.apex.flow.api.function.KeySelector;

/**
 * Sends records with equal keys to the same instance.
 */
public class KeyPartitioner<T> implements RecordPartitioner<T>
{
  private final KeySelector<T, ?> keySelector;

  public KeyPartitioner(KeySelector<T, ?> keySelector)
  {
    this.keySelector = keySelector;
  }

  @Override
  public int partition(T record, int numberOfInstances) throws Exception
  {
    Object key = keySelector.getKey(record);
    int hash = key == null ? 0 : key.hashCode();
    return (hash & Integer.MAX_VALUE) % numberOfInstances;
  }

}

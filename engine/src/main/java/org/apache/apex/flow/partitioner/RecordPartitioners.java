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

import org.apache.apex.flow.api.PartitioningStrategy;
import org.apache.apex.flow.api.function.KeySelector;

/**
 * Creates the partitioner realizing a partitioning strategy between a producer instance and the instances
 * of its consumer.
 *
 * @since 1.0.0
 */
public class RecordPartitioners
{
  private RecordPartitioners()
  {
  }

  /**
   * @param strategy strategy of the stream between producer and consumer
   * @param producerIndex index of the producer instance
   * @param producerCount number of producer instances
   * @param consumerCount number of consumer instances
   * @param seed seed of the random choices of shuffled streams
   * @return the partitioner used by the producer instance
   */
  @SuppressWarnings("unchecked")
  public static <T> RecordPartitioner<T> create(PartitioningStrategy strategy, int producerIndex, int producerCount, int consumerCount, long seed)
  {
    switch (strategy.getKind()) {
      case KEY_SELECTOR:
      case FIELDS:
        return new KeyPartitioner<>((KeySelector<T, ?>)strategy.getKeySelector());
      case BROADCAST:
        return new BroadcastPartitioner<>();
      case SHUFFLE:
        return new ShufflePartitioner<>(seed + producerIndex);
      case FORWARD:
        return new ForwardPartitioner<>(producerIndex);
      case DISTRIBUTE:
        return new RoundRobinPartitioner<>(producerIndex);
      case NONE:
        if (producerCount == consumerCount) {
          return new ForwardPartitioner<>(producerIndex);
        }
        return new RoundRobinPartitioner<>(producerIndex);
      default:
        throw new IllegalArgumentException("Unsupported partitioning " + strategy);
    }
  }

}

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
package org.apache.apex.flow.api.function;

/**
 * Extracts the key of a record. Keys decide which parallel instance receives the record and, for
 * grouped streams, which state the record is aggregated with. Keys must implement
 * {@link Object#hashCode()} and {@link Object#equals(Object)} consistently.
 *
 * @param <T> type of the record
 * @param <K> type of the key
 * @since 1.0.0
 */
@FunctionalInterface
public interface KeySelector<T, K> extends Function
{
  K getKey(T value) throws Exception;
}

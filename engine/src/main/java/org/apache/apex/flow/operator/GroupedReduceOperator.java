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

import java.util.HashMap;
import java.util.Map;

import org.apache.apex.flow.api.Context.OperatorContext;
import org.apache.apex.flow.api.function.KeySelector;
import org.apache.apex.flow.api.function.ReduceFunction;

/**
 * Reduces the records of each key independently, emitting the accumulator of the key after every record.
 * The input is partitioned by the same key selector, so each key is held by exactly one instance.
 *
 * @param <T> type of the records
 * @param <K> type of the key
 * @since 1.0.0
 */
public class GroupedReduceOperator<T, K> extends StreamOperator<T, T>
{
  private final ReduceFunction<T> reducer;
  private final KeySelector<T, K> keySelector;
  private transient Map<K, T> accumulated;

  public GroupedReduceOperator(ReduceFunction<T> reducer, KeySelector<T, K> keySelector)
  {
    super(reducer);
    this.reducer = reducer;
    this.keySelector = keySelector;
  }

  @Override
  public void setup(OperatorContext context)
  {
    super.setup(context);
    accumulated = new HashMap<>();
  }

  @Override
  public void process(T record) throws Exception
  {
    K key = keySelector.getKey(record);
    T result;
    if (accumulated.containsKey(key)) {
      result = reducer.reduce(accumulated.get(key), record);
    } else {
      result = record;
    }
    accumulated.put(key, result);
    output.collect(result);
  }

  @Override
  public void teardown()
  {
    accumulated = null;
    super.teardown();
  }

  private static final long serialVersionUID = 201810191308L;
}

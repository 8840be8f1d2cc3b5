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

/**
 * Emits the running number of records received, per key when a key selector is given.
 *
 * @param <T> type of the records
 * @since 1.0.0
 */
public class CountOperator<T> extends StreamOperator<T, Long>
{
  private final KeySelector<T, ?> keySelector;
  private transient long count;
  private transient Map<Object, Long> counts;

  /**
   * @param keySelector the key of the groups, null to count the whole stream
   */
  public CountOperator(KeySelector<T, ?> keySelector)
  {
    super(keySelector);
    this.keySelector = keySelector;
  }

  @Override
  public void setup(OperatorContext context)
  {
    super.setup(context);
    count = 0;
    counts = new HashMap<>();
  }

  @Override
  public void process(T record) throws Exception
  {
    if (keySelector == null) {
      output.collect(++count);
    } else {
      Object key = keySelector.getKey(record);
      Long current = counts.get(key);
      long next = current == null ? 1 : current + 1;
      counts.put(key, next);
      output.collect(next);
    }
  }

  private static final long serialVersionUID = 201810191309L;
}

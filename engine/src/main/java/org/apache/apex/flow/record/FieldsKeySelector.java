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
package org.apache.apex.flow.record;

import java.util.ArrayList;
import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import org.apache.apex.flow.api.function.KeySelector;

/**
 * Key selector made of record fields. The key of a single field is the value of the field, the key of
 * several fields is the list of their values.
 *
 * @param <T> type of the records
 * @since 1.0.0
 */
public class FieldsKeySelector<T> implements KeySelector<T, Object>
{
  private final List<FieldAccessor> fields;

  public FieldsKeySelector(List<FieldAccessor> fields)
  {
    Preconditions.checkArgument(fields != null && !fields.isEmpty(), "At least one field is required");
    this.fields = ImmutableList.copyOf(fields);
  }

  @Override
  public Object getKey(T record)
  {
    if (fields.size() == 1) {
      return fields.get(0).get(record);
    }
    List<Object> key = new ArrayList<>(fields.size());
    for (FieldAccessor field : fields) {
      key.add(field.get(record));
    }
    return key;
  }

  @Override
  public String toString()
  {
    return "FieldsKeySelector" + fields;
  }

  private static final long serialVersionUID = 201810191130L;
}

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

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.List;

import com.google.common.base.Joiner;

import org.apache.apex.flow.common.util.Pair;

/**
 * Writes records as comma separated lines. The components of arrays, lists and pairs become the columns,
 * any other record is written as a single column. Null components are written as empty columns.
 *
 * @param <T> type of the records
 * @since 1.0.0
 */
public class CsvFileSinkFunction<T> extends FileSinkFunction<T>
{
  public static final char FIELD_DELIMITER = ',';
  private static final Joiner JOINER = Joiner.on(FIELD_DELIMITER).useForNull("");

  public CsvFileSinkFunction(String path)
  {
    super(path);
  }

  @Override
  protected String format(T record)
  {
    return JOINER.join(columns(record));
  }

  static List<?> columns(Object record)
  {
    if (record == null) {
      return new ArrayList<>(1);
    } else if (record.getClass().isArray()) {
      int length = Array.getLength(record);
      List<Object> columns = new ArrayList<>(length);
      for (int i = 0; i < length; i++) {
        columns.add(Array.get(record, i));
      }
      return columns;
    } else if (record instanceof List) {
      return (List<?>)record;
    } else if (record instanceof Pair) {
      Pair<?, ?> pair = (Pair<?, ?>)record;
      List<Object> columns = new ArrayList<>(2);
      columns.add(pair.first);
      columns.add(pair.second);
      return columns;
    }
    List<Object> columns = new ArrayList<>(1);
    columns.add(record);
    return columns;
  }

  private static final long serialVersionUID = 201810191404L;
}

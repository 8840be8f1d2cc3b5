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
package org.apache.apex.flow.api;

import java.io.ObjectStreamException;
import java.io.Serializable;

/**
 * Reads an attribute value from its configuration string.
 *
 * @param <T> type of the value
 * @since 1.0.0
 */
public interface StringCodec<T> extends Serializable
{
  /**
   * @param value the configured string
   * @return the decoded value
   * @throws IllegalArgumentException when the string does not denote a value of the type
   */
  T fromString(String value);

  /**
   * Codecs of the value types attributes are declared with. Numbers and booleans ignore surrounding blanks;
   * strings are taken as they are.
   */
  final class Builtin<T> implements StringCodec<T>
  {
    public static final Builtin<String> STRING = new Builtin<>(String.class);
    public static final Builtin<Integer> INTEGER = new Builtin<>(Integer.class);
    public static final Builtin<Long> LONG = new Builtin<>(Long.class);
    public static final Builtin<Boolean> BOOLEAN = new Builtin<>(Boolean.class);

    private final Class<T> type;

    private Builtin(Class<T> type)
    {
      this.type = type;
    }

    /**
     * @return the codec of the type, null when values of the type cannot be configured
     */
    public static StringCodec<?> forType(Class<?> type)
    {
      for (Builtin<?> codec : new Builtin<?>[] {STRING, INTEGER, LONG, BOOLEAN}) {
        if (codec.type == type) {
          return codec;
        }
      }
      return null;
    }

    @Override
    public T fromString(String value)
    {
      if (type == String.class) {
        return type.cast(value);
      }
      String trimmed = value.trim();
      if (type == Integer.class) {
        return type.cast(Integer.valueOf(trimmed));
      } else if (type == Long.class) {
        return type.cast(Long.valueOf(trimmed));
      } else if ("true".equalsIgnoreCase(trimmed) || "false".equalsIgnoreCase(trimmed)) {
        return type.cast(Boolean.valueOf(trimmed));
      }
      throw new IllegalArgumentException("Not a boolean: " + value);
    }

    private Object readResolve() throws ObjectStreamException
    {
      return forType(type);
    }

    @Override
    public String toString()
    {
      return "StringCodec(" + type.getSimpleName() + ")";
    }

    private static final long serialVersionUID = 201810141156L;
  }

}

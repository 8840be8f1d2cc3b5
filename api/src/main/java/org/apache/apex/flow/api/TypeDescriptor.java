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

import java.io.Serializable;

import javax.annotation.Nonnull;

import com.google.common.base.Preconditions;
import com.google.common.primitives.Primitives;

/**
 * Describes the type of the records of a stream. The descriptor is fixed when the stream is created.
 *
 * @param <T> type of the records
 * @since 1.0.0
 */
public final class TypeDescriptor<T> implements Serializable
{
  public static final TypeDescriptor<Long> LONG = of(Long.class);
  private static final TypeDescriptor<Object> GENERIC = of(Object.class);

  private final Class<T> rawType;

  private TypeDescriptor(Class<T> rawType)
  {
    this.rawType = rawType;
  }

  public static <T> TypeDescriptor<T> of(@Nonnull Class<T> rawType)
  {
    Preconditions.checkNotNull(rawType, "type");
    return new TypeDescriptor<>(Primitives.wrap(rawType));
  }

  /**
   * Descriptor of records whose type is not known when the graph is built.
   *
   * @param <T> expected type of the records
   * @return descriptor of {@link Object}
   */
  @SuppressWarnings("unchecked")
  public static <T> TypeDescriptor<T> generic()
  {
    return (TypeDescriptor<T>)GENERIC;
  }

  public Class<T> getRawType()
  {
    return rawType;
  }

  public boolean isGeneric()
  {
    return rawType == Object.class;
  }

  @Override
  public boolean equals(Object o)
  {
    return o instanceof TypeDescriptor && ((TypeDescriptor<?>)o).rawType == rawType;
  }

  @Override
  public int hashCode()
  {
    return rawType.hashCode();
  }

  @Override
  public String toString()
  {
    return rawType.getName();
  }

  private static final long serialVersionUID = 201810181445L;
}

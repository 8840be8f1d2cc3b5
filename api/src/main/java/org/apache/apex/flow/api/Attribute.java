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
import java.util.HashMap;
import java.util.Map;

import com.google.common.base.Preconditions;

/**
 * A typed setting of the stream graph or of one of its nodes.
 * <p>
 * Attributes are declared as fields of the {@link Context} interfaces. They are anonymous until the declaring
 * interface registers them with {@link AttributeRegistry}, which names each attribute after its field and gives
 * it a codec for its default value type when none was declared.
 *
 * @param <T> type of the attribute value
 * @since 1.0.0
 */
public class Attribute<T> implements Serializable
{
  public final T defaultValue;
  private String name;
  private StringCodec<T> codec;

  public Attribute(StringCodec<T> codec)
  {
    this(null, codec);
  }

  public Attribute(T defaultValue)
  {
    this(defaultValue, null);
  }

  public Attribute(T defaultValue, StringCodec<T> codec)
  {
    this.defaultValue = defaultValue;
    this.codec = codec;
  }

  @SuppressWarnings("unchecked")
  void bind(Class<?> scope, String field)
  {
    if (name == null) {
      name = scope.getCanonicalName() + '.' + field;
    }
    if (codec == null && defaultValue != null) {
      codec = (StringCodec<T>)StringCodec.Builtin.forType(defaultValue.getClass());
    }
  }

  /**
   * @return the codec which reads the attribute from configuration, null when the attribute cannot be configured
   */
  public StringCodec<T> getCodec()
  {
    return codec;
  }

  /**
   * @return name of the field declaring the attribute, e.g. <code>DEFAULT_PARALLELISM</code>
   * @throws IllegalStateException when the declaring interface did not register the attribute
   */
  public String getSimpleName()
  {
    Preconditions.checkState(name != null, "Attribute with default %s is not registered", defaultValue);
    return name.substring(name.lastIndexOf('.') + 1);
  }

  /**
   * Name under which the attribute is looked up in configuration properties,
   * e.g. <code>apex.flow.default.parallelism</code> for DEFAULT_PARALLELISM.
   *
   * @return the configuration key of the attribute.
   */
  public String getLongName()
  {
    return Context.ATTRIBUTE_PREFIX + getSimpleName().replace('_', '.').toLowerCase();
  }

  @Override
  public int hashCode()
  {
    return name == null ? System.identityHashCode(this) : name.hashCode();
  }

  @Override
  public boolean equals(Object obj)
  {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass() || name == null) {
      return false;
    }
    return name.equals(((Attribute<?>)obj).name);
  }

  @Override
  public String toString()
  {
    return name == null ? "Attribute(default " + defaultValue + ")" : name;
  }

  private static final long serialVersionUID = 201810181904L;

  /**
   * Values of attributes set on a context. An attribute without an entry takes its value from the
   * enclosing context or its default.
   */
  public interface AttributeMap
  {
    /**
     * @return the value set for the attribute, null when none was set
     */
    <T> T get(Attribute<T> key);

    boolean contains(Attribute<?> key);

    /**
     * @return the previous value of the attribute, null when none was set
     */
    <T> T put(Attribute<T> key, T value);

    class DefaultAttributeMap implements AttributeMap, Serializable
    {
      private final Map<Attribute<?>, Object> values = new HashMap<>();

      @Override
      @SuppressWarnings("unchecked")
      public <T> T get(Attribute<T> key)
      {
        return (T)values.get(key);
      }

      @Override
      public boolean contains(Attribute<?> key)
      {
        return values.containsKey(key);
      }

      @Override
      @SuppressWarnings("unchecked")
      public <T> T put(Attribute<T> key, T value)
      {
        Preconditions.checkNotNull(key, "key");
        return (T)values.put(key, value);
      }

      @Override
      public String toString()
      {
        return values.toString();
      }

      private static final long serialVersionUID = 201810181022L;
    }

  }

}

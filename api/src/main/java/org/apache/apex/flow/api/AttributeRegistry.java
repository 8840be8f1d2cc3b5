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

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Names the attributes declared by the {@link Context} interfaces and remembers which interface declares which.
 * Each interface registers itself from its own initializer:
 * <pre>
 *   long serialVersionUID = AttributeRegistry.register(GraphContext.class);
 * </pre>
 *
 * @since 1.0.0
 */
public final class AttributeRegistry
{
  private static final Map<Class<?>, Set<Attribute<Object>>> declared = new ConcurrentHashMap<>();

  private AttributeRegistry()
  {
  }

  /**
   * Binds the static attribute fields of the scope to their names.
   *
   * @param scope the declaring interface
   * @return a non-zero identity of the scope
   */
  public static long register(Class<?> scope)
  {
    if (!declared.containsKey(scope)) {
      Set<Attribute<Object>> attributes = new LinkedHashSet<>();
      for (Field field : scope.getDeclaredFields()) {
        if (Modifier.isStatic(field.getModifiers()) && Attribute.class.isAssignableFrom(field.getType())) {
          Attribute<Object> attribute = read(field);
          attribute.bind(scope, field.getName());
          attributes.add(attribute);
        }
      }
      declared.put(scope, Collections.unmodifiableSet(attributes));
    }
    return (long)scope.getName().hashCode() << 32 | scope.getDeclaredFields().length;
  }

  /**
   * @param scope the declaring interface, initialized when it was not yet
   * @return the attributes the scope declares, in declaration order
   */
  public static Set<Attribute<Object>> getAttributes(Class<?> scope)
  {
    try {
      Class.forName(scope.getName(), true, scope.getClassLoader());
    } catch (ClassNotFoundException ex) {
      throw new IllegalStateException(ex);
    }
    Set<Attribute<Object>> attributes = declared.get(scope);
    return attributes == null ? Collections.<Attribute<Object>>emptySet() : attributes;
  }

  /**
   * @return the effective value in the context of each attribute the scope declares
   */
  public static Map<Attribute<Object>, Object> getValues(Context context, Class<?> scope)
  {
    Map<Attribute<Object>, Object> values = new LinkedHashMap<>();
    for (Attribute<Object> attribute : getAttributes(scope)) {
      values.put(attribute, context.getValue(attribute));
    }
    return values;
  }

  @SuppressWarnings("unchecked")
  private static Attribute<Object> read(Field field)
  {
    try {
      field.setAccessible(true);
      return (Attribute<Object>)field.get(null);
    } catch (IllegalAccessException ex) {
      throw new IllegalStateException("Cannot read attribute " + field, ex);
    }
  }

}

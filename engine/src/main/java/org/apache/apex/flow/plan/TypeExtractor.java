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
package org.apache.apex.flow.plan;

import java.lang.invoke.SerializedLambda;
import java.lang.reflect.InaccessibleObjectException;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.ParameterizedType;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.apache.xbean.asm9.Type;

import org.apache.apex.flow.api.TypeDescriptor;
import org.apache.apex.flow.api.function.FlatMapFunction;
import org.apache.apex.flow.api.function.MapFunction;
import org.apache.apex.flow.api.function.SourceFunction;

/**
 * Determines the type of the records produced by user functions.
 * <p>
 * Classes implementing the function interface with concrete type arguments reveal them through their
 * generic interfaces. Lambdas only carry erased types; for the functions returning their result, the
 * return type of the serialized form of the lambda is used. Whenever no concrete class is found the
 * records are described as {@link TypeDescriptor#generic()}.
 *
 * @since 1.0.0
 */
public class TypeExtractor
{
  private static final Logger LOG = LoggerFactory.getLogger(TypeExtractor.class);
  private static final String WRITE_REPLACE = "writeReplace";

  private TypeExtractor()
  {
  }

  public static <R> TypeDescriptor<R> getMapReturnType(MapFunction<?, R> mapper)
  {
    return getOutputType(mapper, MapFunction.class, 1, true);
  }

  public static <R> TypeDescriptor<R> getFlatMapReturnType(FlatMapFunction<?, R> flatMapper)
  {
    return getOutputType(flatMapper, FlatMapFunction.class, 1, false);
  }

  public static <T> TypeDescriptor<T> getSourceType(SourceFunction<T> source)
  {
    return getOutputType(source, SourceFunction.class, 0, false);
  }

  @SuppressWarnings("unchecked")
  static <R> TypeDescriptor<R> getOutputType(Object function, Class<?> functionInterface, int typeArgument, boolean returnedByLambda)
  {
    Class<?> type = resolveTypeArgument(function.getClass(), functionInterface, typeArgument);
    if (type == null && returnedByLambda && function.getClass().isSynthetic()) {
      type = resolveLambdaReturnType(function);
    }
    if (type == null) {
      LOG.debug("No concrete output type found for {}", function.getClass().getName());
      return TypeDescriptor.generic();
    }
    return (TypeDescriptor<R>)TypeDescriptor.of(type);
  }

  private static Class<?> resolveTypeArgument(Class<?> clazz, Class<?> functionInterface, int typeArgument)
  {
    for (Class<?> c = clazz; c != null && c != Object.class; c = c.getSuperclass()) {
      for (java.lang.reflect.Type t : c.getGenericInterfaces()) {
        if (t instanceof ParameterizedType && ((ParameterizedType)t).getRawType() == functionInterface) {
          return toClass(((ParameterizedType)t).getActualTypeArguments()[typeArgument]);
        }
      }
    }
    return null;
  }

  private static Class<?> toClass(java.lang.reflect.Type type)
  {
    if (type instanceof Class) {
      return (Class<?>)type;
    } else if (type instanceof ParameterizedType) {
      return (Class<?>)((ParameterizedType)type).getRawType();
    }
    // type variables and wildcards
    return null;
  }

  private static Class<?> resolveLambdaReturnType(Object function)
  {
    try {
      Method writeReplace = function.getClass().getDeclaredMethod(WRITE_REPLACE);
      writeReplace.setAccessible(true);
      Object replacement = writeReplace.invoke(function);
      if (!(replacement instanceof SerializedLambda)) {
        return null;
      }
      Type returnType = Type.getReturnType(((SerializedLambda)replacement).getInstantiatedMethodType());
      String className;
      if (returnType.getSort() == Type.OBJECT) {
        className = returnType.getClassName();
      } else if (returnType.getSort() == Type.ARRAY) {
        className = returnType.getDescriptor().replace('/', '.');
      } else {
        return null;
      }
      if (Object.class.getName().equals(className)) {
        return null;
      }
      return Class.forName(className, false, function.getClass().getClassLoader());
    } catch (NoSuchMethodException | IllegalAccessException | InvocationTargetException | ClassNotFoundException | InaccessibleObjectException ex) {
      LOG.debug("Cannot read the serialized form of {}", function.getClass().getName(), ex);
      return null;
    }
  }

}

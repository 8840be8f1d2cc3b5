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
package org.apache.apex.flow.common.util;

import java.io.IOException;
import java.io.InputStream;
import java.io.Serializable;
import java.lang.reflect.Field;
import java.lang.reflect.InaccessibleObjectException;
import java.lang.reflect.Modifier;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.apache.commons.lang.SerializationException;
import org.apache.commons.lang.SerializationUtils;
import org.apache.xbean.asm9.ClassReader;
import org.apache.xbean.asm9.ClassVisitor;
import org.apache.xbean.asm9.MethodVisitor;
import org.apache.xbean.asm9.Opcodes;

import org.apache.apex.flow.api.NotTransferableException;

/**
 * Prepares user functions to be shipped to the instances executing the graph.
 * <p>
 * Anonymous and inner classes keep a reference to the instance of their enclosing class even when they
 * never use it, dragging the enclosing object, usually not serializable, along with the function. The
 * cleaner reads the bytecode of the function class and clears the enclosing instance reference when no
 * method reads it. Serializable lambdas only capture what they use and are left as they are.
 * <p>
 * Optionally the cleaned function is serialized right away so that a function which cannot be transferred
 * fails while the graph is built rather than when it is deployed.
 *
 * @since 1.0.0
 */
public class ClosureCleaner
{
  private static final Logger LOG = LoggerFactory.getLogger(ClosureCleaner.class);
  private static final String OUTER_REFERENCE_PREFIX = "this$";
  private static final String CONSTRUCTOR_NAME = "<init>";

  private ClosureCleaner()
  {
  }

  /**
   * Clean the function and optionally verify it can be serialized.
   *
   * @param function the function to clean, may be null
   * @param checkSerializable serialize the cleaned function and fail if that is not possible
   * @param <F> type of the function
   * @return the function itself
   * @throws NotTransferableException when checkSerializable is set and the function cannot be serialized
   */
  public static <F> F clean(F function, boolean checkSerializable)
  {
    return clean(function, true, checkSerializable);
  }

  public static <F> F clean(F function, boolean removeOuterReferences, boolean checkSerializable)
  {
    if (function == null) {
      return null;
    }
    if (removeOuterReferences) {
      removeUnusedOuterReferences(function);
    }
    if (checkSerializable) {
      ensureSerializable(function);
    }
    return function;
  }

  /**
   * @param function the object to verify
   * @throws NotTransferableException when the object cannot be serialized
   */
  public static void ensureSerializable(Object function)
  {
    if (!(function instanceof Serializable)) {
      throw new NotTransferableException("Function " + function.getClass().getName() + " does not implement " + Serializable.class.getName());
    }
    try {
      SerializationUtils.serialize((Serializable)function);
    } catch (SerializationException ex) {
      throw new NotTransferableException("Function " + function.getClass().getName() + " is not serializable. "
          + "The object probably contains or references non serializable fields.", ex);
    }
  }

  static boolean isOuterReference(Field field)
  {
    return field.isSynthetic() && !Modifier.isStatic(field.getModifiers()) && field.getName().startsWith(OUTER_REFERENCE_PREFIX);
  }

  private static void removeUnusedOuterReferences(Object function)
  {
    Class<?> clazz = function.getClass();
    for (Field field : clazz.getDeclaredFields()) {
      if (!isOuterReference(field)) {
        continue;
      }
      if (readsField(clazz, field.getName())) {
        LOG.debug("{} uses its enclosing instance through {}", clazz.getName(), field.getName());
        continue;
      }
      try {
        field.setAccessible(true);
        if (field.get(function) != null) {
          field.set(function, null);
          LOG.debug("Removed unused enclosing instance reference {} from {}", field.getName(), clazz.getName());
        }
      } catch (IllegalAccessException | InaccessibleObjectException | SecurityException ex) {
        LOG.warn("Cannot remove enclosing instance reference {} from {}", field.getName(), clazz.getName(), ex);
      }
    }
  }

  /**
   * Whether any method of the class, or of the classes nested in it, reads the given field of the class.
   * Constructors of the class itself are ignored as they only assign the field.
   */
  static boolean readsField(Class<?> clazz, String fieldName)
  {
    String owner = clazz.getName().replace('.', '/');
    ClassLoader classLoader = clazz.getClassLoader() == null ? ClassLoader.getSystemClassLoader() : clazz.getClassLoader();
    Deque<String> pending = new ArrayDeque<>();
    Set<String> visited = new HashSet<>();
    pending.add(owner);
    while (!pending.isEmpty()) {
      String className = pending.poll();
      if (!visited.add(className)) {
        continue;
      }
      try (InputStream is = classLoader.getResourceAsStream(className + ".class")) {
        if (is == null) {
          LOG.debug("Bytecode of {} is not available, assuming {} is used", className, fieldName);
          return true;
        }
        FieldReadFinder finder = new FieldReadFinder(className, owner, fieldName);
        new ClassReader(is).accept(finder, ClassReader.SKIP_DEBUG | ClassReader.SKIP_FRAMES);
        if (finder.found) {
          return true;
        }
        pending.addAll(finder.nestedClasses);
      } catch (IOException ex) {
        LOG.warn("Cannot read bytecode of {}, assuming {} is used", className, fieldName, ex);
        return true;
      }
    }
    return false;
  }

  private static class FieldReadFinder extends ClassVisitor
  {
    private final String className;
    private final String owner;
    private final String fieldName;
    private final Set<String> nestedClasses = new HashSet<>();
    private boolean found;

    FieldReadFinder(String className, String owner, String fieldName)
    {
      super(Opcodes.ASM9);
      this.className = className;
      this.owner = owner;
      this.fieldName = fieldName;
    }

    @Override
    public void visitInnerClass(String name, String outerName, String innerName, int access)
    {
      if (!name.equals(className) && name.startsWith(className + "$")) {
        nestedClasses.add(name);
      }
    }

    @Override
    public MethodVisitor visitMethod(int access, String name, String descriptor, String signature, String[] exceptions)
    {
      if (className.equals(owner) && CONSTRUCTOR_NAME.equals(name)) {
        return null;
      }
      return new MethodVisitor(Opcodes.ASM9)
      {
        @Override
        public void visitFieldInsn(int opcode, String fieldOwner, String name, String descriptor)
        {
          if (opcode == Opcodes.GETFIELD && fieldOwner.equals(owner) && name.equals(fieldName)) {
            found = true;
          }
        }
      };
    }
  }

}

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

import java.io.Serializable;
import java.lang.reflect.Array;
import java.lang.reflect.InvocationTargetException;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.beanutils.PropertyUtils;
import org.apache.commons.lang.SerializationException;
import org.apache.commons.lang.SerializationUtils;

import com.google.common.base.Preconditions;

import org.apache.apex.flow.api.FieldRef;
import org.apache.apex.flow.api.TypeDescriptor;
import org.apache.apex.flow.common.util.Pair;

/**
 * Reads and replaces one field of a record.
 * <p>
 * Positions address the components of arrays, {@link List}s and {@link Pair}s; position 0 of a scalar
 * record (number, string, boolean or character) is the record itself. Expressions are bean property paths
 * resolved with commons-beanutils, which also covers nested properties and {@link java.util.Map} keys.
 * <p>
 * Replacing a field never modifies the record passed in, a copy carrying the new value is returned.
 *
 * @since 1.0.0
 */
public abstract class FieldAccessor implements Serializable
{
  private final FieldRef field;

  private FieldAccessor(FieldRef field)
  {
    this.field = field;
  }

  /**
   * Creates the accessor for the field of records of the given type.
   *
   * @param field the field reference
   * @param recordType type of the records the accessor will be applied to
   * @return the accessor
   * @throws IllegalArgumentException when the field cannot be addressed on records of the type
   */
  public static FieldAccessor create(FieldRef field, TypeDescriptor<?> recordType)
  {
    Preconditions.checkNotNull(field, "field");
    Preconditions.checkNotNull(recordType, "recordType");
    Class<?> type = recordType.getRawType();
    if (field.isPosition()) {
      if (recordType.isGeneric() || isIndexed(type)) {
        return new PositionAccessor(field);
      }
      if (isScalar(type)) {
        Preconditions.checkArgument(field.getPosition() == 0, "Records of type %s only have a field at position 0, got %s", type.getName(), field);
        return new PositionAccessor(field);
      }
      throw new IllegalArgumentException("Field position " + field.getPosition() + " cannot be used on records of type "
          + type.getName() + ", positions are supported on arrays, lists, pairs and scalar values");
    }
    if (type.isArray() || isScalar(type)) {
      throw new IllegalArgumentException("Field expression " + field.getExpression() + " cannot be used on records of type " + type.getName());
    }
    return new ExpressionAccessor(field);
  }

  static boolean isIndexed(Class<?> type)
  {
    return type.isArray() || List.class.isAssignableFrom(type) || Pair.class.isAssignableFrom(type);
  }

  static boolean isScalar(Class<?> type)
  {
    return Number.class.isAssignableFrom(type) || type == String.class || type == Boolean.class || type == Character.class;
  }

  public FieldRef getField()
  {
    return field;
  }

  /**
   * @param record the record
   * @return the value of the field
   * @throws IllegalArgumentException when the record does not have the field
   */
  public abstract Object get(Object record);

  /**
   * @param record the record, left unchanged
   * @param value the new value of the field
   * @return copy of the record with the field replaced
   * @throws IllegalArgumentException when the record does not have the field or cannot be copied
   */
  public abstract Object set(Object record, Object value);

  @Override
  public String toString()
  {
    return field.toString();
  }

  private static class PositionAccessor extends FieldAccessor
  {
    private final int position;

    PositionAccessor(FieldRef field)
    {
      super(field);
      this.position = field.getPosition();
    }

    @Override
    public Object get(Object record)
    {
      if (record != null) {
        if (record.getClass().isArray()) {
          checkBounds(record, Array.getLength(record));
          return Array.get(record, position);
        } else if (record instanceof List) {
          checkBounds(record, ((List<?>)record).size());
          return ((List<?>)record).get(position);
        } else if (record instanceof Pair) {
          checkBounds(record, 2);
          return ((Pair<?, ?>)record).get(position);
        }
      }
      if (position == 0) {
        return record;
      }
      throw new IllegalArgumentException("Record " + record + " has no field at position " + position);
    }

    @Override
    public Object set(Object record, Object value)
    {
      if (record != null) {
        if (record.getClass().isArray()) {
          int length = Array.getLength(record);
          checkBounds(record, length);
          Object copy = Array.newInstance(record.getClass().getComponentType(), length);
          System.arraycopy(record, 0, copy, 0, length);
          Array.set(copy, position, value);
          return copy;
        } else if (record instanceof List) {
          checkBounds(record, ((List<?>)record).size());
          List<Object> copy = new ArrayList<Object>((List<?>)record);
          copy.set(position, value);
          return copy;
        } else if (record instanceof Pair) {
          checkBounds(record, 2);
          return ((Pair<?, ?>)record).with(position, value);
        }
      }
      if (position == 0) {
        return value;
      }
      throw new IllegalArgumentException("Record " + record + " has no field at position " + position);
    }

    private void checkBounds(Object record, int size)
    {
      if (position >= size) {
        throw new IllegalArgumentException("Field position " + position + " is out of bounds for a record of " + size + " fields of type " + record.getClass().getName());
      }
    }

    private static final long serialVersionUID = 201810191105L;
  }

  private static class ExpressionAccessor extends FieldAccessor
  {
    private final String expression;

    ExpressionAccessor(FieldRef field)
    {
      super(field);
      this.expression = field.getExpression();
    }

    @Override
    public Object get(Object record)
    {
      Preconditions.checkArgument(record != null, "Cannot read field %s of a null record", expression);
      try {
        return PropertyUtils.getProperty(record, expression);
      } catch (IllegalAccessException | InvocationTargetException | NoSuchMethodException ex) {
        throw new IllegalArgumentException("Cannot read field " + expression + " of " + record.getClass().getName(), ex);
      }
    }

    @Override
    public Object set(Object record, Object value)
    {
      Preconditions.checkArgument(record != null, "Cannot replace field %s of a null record", expression);
      if (!(record instanceof Serializable)) {
        throw new IllegalArgumentException("Records of type " + record.getClass().getName() + " must be serializable to be aggregated by field expression");
      }
      Object copy;
      try {
        copy = SerializationUtils.clone((Serializable)record);
      } catch (SerializationException ex) {
        throw new IllegalArgumentException("Cannot copy record of type " + record.getClass().getName(), ex);
      }
      try {
        PropertyUtils.setProperty(copy, expression, value);
      } catch (IllegalAccessException | InvocationTargetException | NoSuchMethodException ex) {
        throw new IllegalArgumentException("Cannot replace field " + expression + " of " + record.getClass().getName(), ex);
      }
      return copy;
    }

    private static final long serialVersionUID = 201810191106L;
  }

  private static final long serialVersionUID = 201810191104L;
}

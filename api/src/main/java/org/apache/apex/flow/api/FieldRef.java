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

import com.google.common.base.Preconditions;

/**
 * Reference to a component of a record: either the ordinal position of the component in an indexed
 * record (arrays, lists, pairs) or a named field expression (bean property, nested path or map key).
 *
 * @since 1.0.0
 */
public abstract class FieldRef implements Serializable
{
  public static final String INVALID_FIELD_MESSAGE = "Aggregations are only supported by field position (Integer) or field expression (String)";

  private FieldRef()
  {
  }

  /**
   * Resolve an untyped field argument.
   *
   * @param field an {@link Integer} position, a {@link String} expression or a FieldRef
   * @return the field reference
   * @throws IllegalArgumentException when the argument is of any other type, a negative position or an empty expression
   */
  public static FieldRef of(Object field)
  {
    if (field instanceof FieldRef) {
      return (FieldRef)field;
    } else if (field instanceof Integer) {
      return position((Integer)field);
    } else if (field instanceof String) {
      return expression((String)field);
    }
    throw new IllegalArgumentException(INVALID_FIELD_MESSAGE + ", got " + (field == null ? "null" : field.getClass().getName()));
  }

  public static FieldRef position(int position)
  {
    Preconditions.checkArgument(position >= 0, "Field position must not be negative: %s", position);
    return new Ordinal(position);
  }

  public static FieldRef expression(String expression)
  {
    Preconditions.checkArgument(expression != null && !expression.trim().isEmpty(), "Field expression must not be empty");
    return new Named(expression.trim());
  }

  public abstract boolean isPosition();

  /**
   * @return the position of an ordinal reference
   * @throws IllegalStateException for a named reference
   */
  public abstract int getPosition();

  /**
   * @return the expression of a named reference
   * @throws IllegalStateException for an ordinal reference
   */
  public abstract String getExpression();

  public static final class Ordinal extends FieldRef
  {
    private final int position;

    private Ordinal(int position)
    {
      this.position = position;
    }

    @Override
    public boolean isPosition()
    {
      return true;
    }

    @Override
    public int getPosition()
    {
      return position;
    }

    @Override
    public String getExpression()
    {
      throw new IllegalStateException("Field reference " + this + " is a position");
    }

    @Override
    public boolean equals(Object o)
    {
      return o instanceof Ordinal && ((Ordinal)o).position == position;
    }

    @Override
    public int hashCode()
    {
      return position;
    }

    @Override
    public String toString()
    {
      return "#" + position;
    }

    private static final long serialVersionUID = 201810181431L;
  }

  public static final class Named extends FieldRef
  {
    private final String expression;

    private Named(String expression)
    {
      this.expression = expression;
    }

    @Override
    public boolean isPosition()
    {
      return false;
    }

    @Override
    public int getPosition()
    {
      throw new IllegalStateException("Field reference " + this + " is an expression");
    }

    @Override
    public String getExpression()
    {
      return expression;
    }

    @Override
    public boolean equals(Object o)
    {
      return o instanceof Named && ((Named)o).expression.equals(expression);
    }

    @Override
    public int hashCode()
    {
      return expression.hashCode();
    }

    @Override
    public String toString()
    {
      return expression;
    }

    private static final long serialVersionUID = 201810181432L;
  }

  private static final long serialVersionUID = 201810181430L;
}

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
package org.apache.apex.flow.aggregation;

import java.math.BigDecimal;
import java.math.BigInteger;

import org.apache.apex.flow.api.AggregationType;
import org.apache.apex.flow.record.FieldAccessor;

/**
 * Running sum of a numeric field. The accumulated record keeps the other fields of the first record.
 *
 * @param <T> type of the records
 * @since 1.0.0
 */
public class SumAggregator<T> extends FieldAggregator<T>
{
  public SumAggregator(FieldAccessor field)
  {
    super(AggregationType.SUM, field);
  }

  @Override
  @SuppressWarnings("unchecked")
  public T reduce(T accumulated, T value)
  {
    return (T)field.set(accumulated, add(field.get(accumulated), field.get(value)));
  }

  static Object add(Object augend, Object addend)
  {
    if (!(augend instanceof Number) || !(addend instanceof Number)) {
      throw new IllegalArgumentException("Cannot sum " + describe(augend) + " and " + describe(addend));
    }
    Number a = (Number)augend;
    Number b = (Number)addend;
    if (a instanceof Integer) {
      return a.intValue() + b.intValue();
    } else if (a instanceof Long) {
      return a.longValue() + b.longValue();
    } else if (a instanceof Double) {
      return a.doubleValue() + b.doubleValue();
    } else if (a instanceof Float) {
      return a.floatValue() + b.floatValue();
    } else if (a instanceof Short) {
      return (short)(a.shortValue() + b.shortValue());
    } else if (a instanceof Byte) {
      return (byte)(a.byteValue() + b.byteValue());
    } else if (a instanceof BigInteger) {
      return ((BigInteger)a).add(b instanceof BigInteger ? (BigInteger)b : BigInteger.valueOf(b.longValue()));
    } else if (a instanceof BigDecimal) {
      return ((BigDecimal)a).add(b instanceof BigDecimal ? (BigDecimal)b : new BigDecimal(b.toString()));
    }
    throw new IllegalArgumentException("Summing values of type " + a.getClass().getName() + " is not supported");
  }

  private static String describe(Object value)
  {
    return value == null ? "null" : value + " of type " + value.getClass().getName();
  }

  private static final long serialVersionUID = 201810191202L;
}

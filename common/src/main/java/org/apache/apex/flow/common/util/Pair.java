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

import java.io.Serializable;

/**
 * Immutable two component record. Components are addressable by position, 0 for the first and 1 for
 * the second, when grouping or aggregating streams of pairs.
 *
 * @since 1.0.0
 */
public class Pair<F, S> implements Serializable
{
  private static final long serialVersionUID = 201810181622L;
  public final F first;
  public final S second;

  public Pair(F first, S second)
  {
    this.first = first;
    this.second = second;
  }

  public static <F, S> Pair<F, S> of(F first, S second)
  {
    return new Pair<>(first, second);
  }

  public F getFirst()
  {
    return first;
  }

  public S getSecond()
  {
    return second;
  }

  /**
   * @param position 0 or 1
   * @return the component at the position
   * @throws IndexOutOfBoundsException for any other position
   */
  public Object get(int position)
  {
    switch (position) {
      case 0:
        return first;
      case 1:
        return second;
      default:
        throw new IndexOutOfBoundsException("Pair has no component at position " + position);
    }
  }

  /**
   * @param position 0 or 1
   * @param value the new value of the component
   * @return a pair with the component at the position replaced
   */
  @SuppressWarnings("unchecked")
  public Pair<F, S> with(int position, Object value)
  {
    switch (position) {
      case 0:
        return new Pair<>((F)value, second);
      case 1:
        return new Pair<>(first, (S)value);
      default:
        throw new IndexOutOfBoundsException("Pair has no component at position " + position);
    }
  }

  @Override
  public int hashCode()
  {
    int hash = 7;
    hash = 41 * hash + (this.first != null ? this.first.hashCode() : 0);
    hash = 41 * hash + (this.second != null ? this.second.hashCode() : 0);
    return hash;
  }

  @Override
  public boolean equals(Object obj)
  {
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    @SuppressWarnings("unchecked")
    final Pair<F, S> other = (Pair<F, S>)obj;
    if (this.first != other.first && (this.first == null || !this.first.equals(other.first))) {
      return false;
    }
    return this.second == other.second || (this.second != null && this.second.equals(other.second));
  }

  @Override
  public String toString()
  {
    return "[" + first + "," + second + "]";
  }

}

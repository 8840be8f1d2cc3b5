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
package org.apache.apex.flow.source;

import java.util.ArrayList;
import java.util.Collection;

import com.google.common.base.Preconditions;

import org.apache.apex.flow.api.function.Collector;
import org.apache.apex.flow.api.function.SourceFunction;

/**
 * Emits the elements of a collection, in iteration order. The elements are copied when the source is
 * created and travel with it, so they have to be serializable.
 *
 * @param <T> type of the elements
 * @since 1.0.0
 */
public class CollectionSourceFunction<T> implements SourceFunction<T>
{
  private final ArrayList<T> elements;

  public CollectionSourceFunction(Collection<? extends T> elements)
  {
    Preconditions.checkNotNull(elements, "Collection must not be null.");
    this.elements = new ArrayList<>(elements);
  }

  public int size()
  {
    return elements.size();
  }

  @Override
  public void run(Collector<T> out)
  {
    for (T element : elements) {
      out.collect(element);
    }
  }

  @Override
  public String toString()
  {
    return "CollectionSource{" + elements.size() + " elements}";
  }

  private static final long serialVersionUID = 201810191405L;
}

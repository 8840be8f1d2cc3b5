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
package org.apache.apex.flow.local;

import com.google.common.base.Preconditions;

import org.apache.apex.flow.api.Attribute;
import org.apache.apex.flow.api.Attribute.AttributeMap;
import org.apache.apex.flow.api.Attribute.AttributeMap.DefaultAttributeMap;
import org.apache.apex.flow.api.Context;
import org.apache.apex.flow.api.Context.OperatorContext;

/**
 * Context of an operator instance run by the {@link LocalStreamExecutor}. Attributes not set on the
 * instance are looked up in the parent context, the node of the instance.
 *
 * @since 1.0.0
 */
public class LocalOperatorContext implements OperatorContext
{
  private final String name;
  private final int instanceIndex;
  private final AttributeMap attributes;
  private final Context parentContext;

  public LocalOperatorContext(String name, int instanceIndex, AttributeMap attributes, Context parentContext)
  {
    this.name = Preconditions.checkNotNull(name, "operator name");
    this.instanceIndex = instanceIndex;
    this.attributes = attributes == null ? new DefaultAttributeMap() : attributes;
    this.parentContext = parentContext;
  }

  @Override
  public String getName()
  {
    return name;
  }

  @Override
  public int getInstanceIndex()
  {
    return instanceIndex;
  }

  @Override
  public AttributeMap getAttributes()
  {
    return attributes;
  }

  @Override
  public <T> T getValue(Attribute<T> key)
  {
    T attr = attributes.get(key);
    if (attr != null) {
      return attr;
    }
    return parentContext == null ? key.defaultValue : parentContext.getValue(key);
  }

  @Override
  public String toString()
  {
    return name + "#" + instanceIndex;
  }

}

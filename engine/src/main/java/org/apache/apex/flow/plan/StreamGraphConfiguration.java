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

import java.util.HashSet;
import java.util.Properties;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

import org.apache.apex.flow.api.Attribute;
import org.apache.apex.flow.api.AttributeRegistry;
import org.apache.apex.flow.api.Context;
import org.apache.apex.flow.api.Context.GraphContext;
import org.apache.apex.flow.api.StringCodec;

/**
 * Applies graph attributes given as properties to a stream graph.
 * <p>
 * Attributes are read from {@code apex.flow.<attribute>}, e.g. {@code apex.flow.default.parallelism}, where
 * the attribute name is the lower case name of the attribute field with underscores replaced by dots.
 * Values are decoded with the {@link StringCodec} of the attribute. Keys under
 * {@code apex.flow.local.} belong to the {@link org.apache.apex.flow.local.LocalStreamExecutor}.
 *
 * @since 1.0.0
 */
public class StreamGraphConfiguration
{
  private static final Logger LOG = LoggerFactory.getLogger(StreamGraphConfiguration.class);
  public static final String LOCAL_PREFIX = Context.ATTRIBUTE_PREFIX + "local.";

  private final Properties properties;

  public StreamGraphConfiguration(Properties properties)
  {
    this.properties = Preconditions.checkNotNull(properties, "properties");
  }

  public static StreamGraphConfiguration fromSystemProperties()
  {
    return new StreamGraphConfiguration(System.getProperties());
  }

  /**
   * Applies the graph attributes found in the properties.
   *
   * @param graph the graph to configure
   * @throws IllegalArgumentException when a value cannot be decoded
   */
  public void apply(StreamGraph graph)
  {
    Set<String> applied = new HashSet<>();
    for (Attribute<Object> attribute : AttributeRegistry.getAttributes(GraphContext.class)) {
      String key = attribute.getLongName();
      String value = properties.getProperty(key);
      if (value != null) {
        Object decoded = decode(attribute, key, value);
        graph.setAttribute(attribute, decoded);
        applied.add(key);
        LOG.debug("Set {} of {} to {}", attribute.getSimpleName(), graph.getName(), decoded);
      }
    }
    for (String key : properties.stringPropertyNames()) {
      if (key.startsWith(Context.ATTRIBUTE_PREFIX) && !key.startsWith(LOCAL_PREFIX) && !applied.contains(key)) {
        LOG.warn("Ignoring configuration key {} of graph {}", key, graph.getName());
      }
    }
  }

  private static Object decode(Attribute<Object> attribute, String key, String value)
  {
    StringCodec<Object> codec = attribute.getCodec();
    if (codec == null) {
      throw new IllegalArgumentException("Attribute " + attribute.getSimpleName() + " cannot be configured with " + key);
    }
    try {
      return codec.fromString(value.trim());
    } catch (RuntimeException ex) {
      throw new IllegalArgumentException("Invalid value " + value + " of " + key, ex);
    }
  }

}

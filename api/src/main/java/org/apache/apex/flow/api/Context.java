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

import org.apache.hadoop.classification.InterfaceStability.Evolving;

import org.apache.apex.flow.api.Attribute.AttributeMap;
import org.apache.apex.flow.api.StringCodec.Builtin;

/**
 * The base interface for context for all of the stream graph objects.
 *
 * @since 1.0.0
 */
public interface Context
{
  /**
   * Prefix of every attribute key when attributes are read from properties.
   */
  String ATTRIBUTE_PREFIX = "apex.flow.";

  /**
   * Get the attributes associated with this context.
   * The returned map does not contain any attributes that may have been defined in the parent context of this context.
   *
   * @return attributes defined for the current context.
   */
  AttributeMap getAttributes();

  /**
   * Get the value of the attribute associated with the current key by recursively traversing the contexts upwards to
   * the graph level. If the attribute is not found, then return the defaultValue.
   *
   * @param <T> - Type of the value stored against the attribute
   * @param key - Attribute to identify the attribute.
   * @return The value for the attribute if found or the defaultValue passed in as argument.
   */
  <T> T getValue(Attribute<T> key);

  /**
   * Context of a single node of the stream graph, and of each of its running instances.
   */
  interface OperatorContext extends Context
  {
    /**
     * Number of parallel instances of the operator. When not set on the node the graph's
     * {@link GraphContext#DEFAULT_PARALLELISM} applies.
     */
    Attribute<Integer> PARALLELISM = new Attribute<>(Builtin.INTEGER);
    /**
     * Interval in milliseconds at which buffering sinks flush their output. 0 flushes as records arrive.
     */
    Attribute<Long> FLUSH_INTERVAL_MILLIS = new Attribute<>(0L);

    /**
     * @return identifier of the node the context belongs to.
     */
    String getName();

    /**
     * @return index of the running instance, between 0 and the parallelism of the node.
     */
    @Evolving
    int getInstanceIndex();

    @SuppressWarnings("FieldNameHidesFieldInSuperclass")
    long serialVersionUID = AttributeRegistry.register(OperatorContext.class);
  }

  /**
   * Context of the whole stream graph.
   */
  interface GraphContext extends Context
  {
    /**
     * Name of the application the graph describes.
     */
    Attribute<String> APPLICATION_NAME = new Attribute<>("ApexFlow", Builtin.STRING);
    /**
     * Parallelism of the nodes which do not set their own.
     */
    Attribute<Integer> DEFAULT_PARALLELISM = new Attribute<>(1);
    /**
     * Strip unused enclosing instance references from user functions before they are attached to the graph.
     */
    Attribute<Boolean> CLOSURE_CLEANING = new Attribute<>(true);
    /**
     * Verify that user functions can be serialized when they are attached to the graph.
     */
    Attribute<Boolean> CHECK_SERIALIZABLE = new Attribute<>(true);

    @SuppressWarnings("FieldNameHidesFieldInSuperclass")
    long serialVersionUID = AttributeRegistry.register(GraphContext.class);
  }

}

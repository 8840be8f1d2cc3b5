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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

import org.apache.apex.flow.api.Attribute;
import org.apache.apex.flow.api.Attribute.AttributeMap.DefaultAttributeMap;
import org.apache.apex.flow.api.Context;
import org.apache.apex.flow.api.DataStream;
import org.apache.apex.flow.api.PartitioningStrategy;
import org.apache.apex.flow.api.TypeDescriptor;
import org.apache.apex.flow.api.function.SourceFunction;
import org.apache.apex.flow.common.util.ClosureCleaner;
import org.apache.apex.flow.source.CollectionSourceFunction;

/**
 * The stream graph under construction.
 * <p>
 * The graph is the entry point of the fluent API: streams are created from sources added to the graph and
 * every transformation of a stream adds a node to the graph it belongs to. Nodes are kept in the order they
 * were added, which is a topological order since a node can only consume nodes that already exist.
 * <p>
 * The graph is not thread safe; it is meant to be built by a single thread.
 *
 * @since 1.0.0
 */
public class StreamGraph implements Context.GraphContext
{
  private static final Logger LOG = LoggerFactory.getLogger(StreamGraph.class);
  private static final String SOURCE_ID_PREFIX = "source";
  private static final String PARTITION_ID_PREFIX = "partition";
  private static final String MERGE_ID_PREFIX = "merge";

  private final Attribute.AttributeMap attributes = new DefaultAttributeMap();
  private final Map<String, StreamNode> nodes = new LinkedHashMap<>();
  private int nodeSequence;

  public StreamGraph()
  {
  }

  public StreamGraph(String name)
  {
    setAttribute(APPLICATION_NAME, Preconditions.checkNotNull(name, "name"));
  }

  @Override
  public Attribute.AttributeMap getAttributes()
  {
    return attributes;
  }

  @Override
  public <T> T getValue(Attribute<T> key)
  {
    T val = attributes.get(key);
    if (val == null) {
      return key.defaultValue;
    }

    return val;
  }

  public <T> void setAttribute(Attribute<T> key, T value)
  {
    this.getAttributes().put(key, value);
  }

  public String getName()
  {
    return getValue(APPLICATION_NAME);
  }

  /**
   * Creates a stream of the given elements. The type of the stream is the component type of the array.
   *
   * @param elements the elements, at least one
   * @return the stream
   * @throws org.apache.apex.flow.api.NotTransferableException when the elements are not serializable
   */
  @SafeVarargs
  @SuppressWarnings("unchecked")
  public final <T> DataStream<T> fromElements(T... elements)
  {
    Preconditions.checkNotNull(elements, "Elements must not be null.");
    Preconditions.checkArgument(elements.length > 0, "At least one element is required");
    List<T> list = new ArrayList<>(elements.length);
    for (T element : elements) {
      list.add(Preconditions.checkNotNull(element, "Elements must not contain null."));
    }
    TypeDescriptor<T> type = TypeDescriptor.of((Class<T>)elements.getClass().getComponentType());
    return addSource(new CollectionSourceFunction<>(list), type);
  }

  /**
   * Creates a stream of the elements of the collection. The type of the stream is the class of the first
   * element.
   *
   * @param elements the elements
   * @return the stream
   */
  @SuppressWarnings("unchecked")
  public <T> DataStream<T> fromCollection(Collection<T> elements)
  {
    Preconditions.checkNotNull(elements, "Collection must not be null.");
    TypeDescriptor<T> type = TypeDescriptor.generic();
    Iterator<T> iterator = elements.iterator();
    if (iterator.hasNext()) {
      T first = iterator.next();
      if (first != null) {
        type = TypeDescriptor.of((Class<T>)first.getClass());
      }
    }
    return fromCollection(elements, type);
  }

  public <T> DataStream<T> fromCollection(Collection<T> elements, TypeDescriptor<T> type)
  {
    Preconditions.checkNotNull(elements, "Collection must not be null.");
    return addSource(new CollectionSourceFunction<>(elements), type);
  }

  public <T> DataStream<T> addSource(SourceFunction<T> source)
  {
    Preconditions.checkNotNull(source, "Source function must not be null.");
    return addSource(source, TypeExtractor.getSourceType(source));
  }

  /**
   * Adds a source to the graph.
   *
   * @param source the source function
   * @param type type of the records emitted by the source
   * @return the stream of the records of the source
   */
  public <T> DataStream<T> addSource(SourceFunction<T> source, TypeDescriptor<T> type)
  {
    Preconditions.checkNotNull(source, "Source function must not be null.");
    Preconditions.checkNotNull(type, "Type must not be null.");
    SourceFunction<T> cleaned = clean(source);
    StreamNode node = register(new StreamNode(this, nextId(SOURCE_ID_PREFIX), StreamNode.Role.SOURCE, type,
        PartitioningStrategy.NONE, OperatorDefinition.source(cleaned), Collections.<StreamNode>emptyList()));
    return new LogicalDataStream<>(node);
  }

  /**
   * Prepares a user function to be shipped with the graph, as configured by the {@link #CLOSURE_CLEANING}
   * and {@link #CHECK_SERIALIZABLE} attributes.
   *
   * @param function the function
   * @return the function
   * @throws org.apache.apex.flow.api.NotTransferableException when the function cannot be serialized
   */
  public <F> F clean(F function)
  {
    return ClosureCleaner.clean(function, getValue(CLOSURE_CLEANING), getValue(CHECK_SERIALIZABLE));
  }

  StreamNode addOperator(OperatorDefinition operator, TypeDescriptor<?> type, StreamNode input)
  {
    List<StreamNode> inputs = checkInputs(Collections.singletonList(input));
    return register(new StreamNode(this, nextId(operator.getKind().getIdPrefix()), StreamNode.Role.OPERATOR, type,
        PartitioningStrategy.NONE, operator, inputs));
  }

  /**
   * Attaching a strategy to a partition view replaces the strategy of the view.
   */
  StreamNode addPartition(StreamNode input, PartitioningStrategy partitioning)
  {
    StreamNode base = checkInputs(Collections.singletonList(input)).get(0);
    if (base.getRole() == StreamNode.Role.PARTITION) {
      base = base.getInputs().get(0);
    }
    return register(new StreamNode(this, nextId(PARTITION_ID_PREFIX), StreamNode.Role.PARTITION, base.getType(),
        partitioning, null, Collections.singletonList(base)));
  }

  StreamNode addMerge(List<StreamNode> inputs)
  {
    Preconditions.checkArgument(inputs.size() > 1, "A merge requires at least two streams");
    checkInputs(inputs);
    return register(new StreamNode(this, nextId(MERGE_ID_PREFIX), StreamNode.Role.MERGE, inputs.get(0).getType(),
        PartitioningStrategy.NONE, null, inputs));
  }

  /**
   * Inputs are checked before an id is drawn, so a rejected node leaves no gap in the id sequence.
   */
  private List<StreamNode> checkInputs(List<StreamNode> inputs)
  {
    for (StreamNode input : inputs) {
      Preconditions.checkNotNull(input, "Input stream must not be null.");
      Preconditions.checkArgument(input.getGraph() == this, "Node %s belongs to another graph", input.getId());
    }
    return inputs;
  }

  private String nextId(String prefix)
  {
    return prefix + "-" + (++nodeSequence);
  }

  private StreamNode register(StreamNode node)
  {
    for (StreamNode input : node.getInputs()) {
      input.markConsumed();
    }
    nodes.put(node.getId(), node);
    LOG.debug("Added {} {} {} consuming {}", node.getRole(), node.getId(), node.getOperator() == null ? node.getPartitioning() : node.getOperator(), node.getInputs());
    return node;
  }

  public Collection<StreamNode> getAllNodes()
  {
    return Collections.unmodifiableCollection(nodes.values());
  }

  /**
   * @param id identifier of the node
   * @return the node or null when the graph has no node with the identifier
   */
  public StreamNode getNode(String id)
  {
    return nodes.get(id);
  }

  public List<StreamNode> getSources()
  {
    List<StreamNode> sources = new ArrayList<>();
    for (StreamNode node : nodes.values()) {
      if (node.getRole() == StreamNode.Role.SOURCE) {
        sources.add(node);
      }
    }
    return sources;
  }

  public List<StreamNode> getSinks()
  {
    List<StreamNode> sinks = new ArrayList<>();
    for (StreamNode node : nodes.values()) {
      if (node.isSink()) {
        sinks.add(node);
      }
    }
    return sinks;
  }

  /**
   * @param node a node of this graph
   * @return the nodes consuming the records of the node directly
   */
  public List<StreamNode> getDownstream(StreamNode node)
  {
    List<StreamNode> downstream = new ArrayList<>();
    for (StreamNode candidate : nodes.values()) {
      if (candidate.getInputs().contains(node)) {
        downstream.add(candidate);
      }
    }
    return downstream;
  }

  /**
   * Checks the graph can be executed.
   *
   * @throws IllegalStateException when the graph has no sink or an invalid default parallelism
   */
  public void validate()
  {
    int defaultParallelism = getValue(DEFAULT_PARALLELISM);
    if (defaultParallelism < 1) {
      throw new IllegalStateException("Default parallelism of " + getName() + " must be at least 1, got " + defaultParallelism);
    }
    if (getSinks().isEmpty()) {
      throw new IllegalStateException("Graph " + getName() + " has no sink");
    }
    for (StreamNode node : nodes.values()) {
      if (!node.isConsumed() && !node.isSink()) {
        LOG.debug("Records of {} are not consumed", node.getId());
      }
    }
  }

  @Override
  public String toString()
  {
    return "StreamGraph{" + getName() + ", nodes=" + nodes.keySet() + "}";
  }

}

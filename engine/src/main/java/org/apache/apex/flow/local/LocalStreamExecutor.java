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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.apache.commons.lang.SerializationUtils;

import com.google.common.base.Preconditions;

import org.apache.apex.flow.api.Attribute.AttributeMap;
import org.apache.apex.flow.api.Attribute.AttributeMap.DefaultAttributeMap;
import org.apache.apex.flow.api.Context.OperatorContext;
import org.apache.apex.flow.api.PartitioningStrategy;
import org.apache.apex.flow.api.function.Collector;
import org.apache.apex.flow.common.util.PropertiesHelper;
import org.apache.apex.flow.operator.AbstractOperator;
import org.apache.apex.flow.operator.SourceOperator;
import org.apache.apex.flow.operator.StreamOperator;
import org.apache.apex.flow.partitioner.RecordPartitioner;
import org.apache.apex.flow.partitioner.RecordPartitioners;
import org.apache.apex.flow.plan.OperatorDefinition;
import org.apache.apex.flow.plan.StreamGraph;
import org.apache.apex.flow.plan.StreamNode;

/**
 * Runs a stream graph over bounded sources in the calling thread.
 * <p>
 * Every source node runs as one instance and every operator node as many instances as its parallelism.
 * Each instance works on its own copy of the operator definition, obtained through serialization like
 * on a remote worker. Records are pushed from the sources through the graph, routed between instances
 * according to the partitioning of the streams. Sources run one after the other in the order they were
 * added to the graph. All instances are set up before the first source runs and torn down at the end,
 * also when the run fails.
 * <p>
 * Meant for tests and local debugging of graphs.
 *
 * @since 1.0.0
 */
public class LocalStreamExecutor
{
  private static final Logger LOG = LoggerFactory.getLogger(LocalStreamExecutor.class);
  /**
   * Seed of the random choices of shuffled streams, random by default.
   */
  public static final String SHUFFLE_SEED_PROPERTY = "apex.flow.local.shuffle.seed";
  /**
   * Whether instances get their own copy of the operator definition, true by default.
   */
  public static final String COPY_OPERATORS_PROPERTY = "apex.flow.local.copy.operators";

  private final StreamGraph graph;
  private long shuffleSeed;
  private boolean copyOperators;

  public LocalStreamExecutor(StreamGraph graph)
  {
    this.graph = Preconditions.checkNotNull(graph, "graph");
    this.shuffleSeed = PropertiesHelper.getLong(SHUFFLE_SEED_PROPERTY, System.nanoTime(), Long.MIN_VALUE, Long.MAX_VALUE);
    this.copyOperators = PropertiesHelper.getBoolean(COPY_OPERATORS_PROPERTY, true);
  }

  public long getShuffleSeed()
  {
    return shuffleSeed;
  }

  public void setShuffleSeed(long shuffleSeed)
  {
    this.shuffleSeed = shuffleSeed;
  }

  public boolean isCopyOperators()
  {
    return copyOperators;
  }

  public void setCopyOperators(boolean copyOperators)
  {
    this.copyOperators = copyOperators;
  }

  /**
   * Runs the graph until all sources are exhausted.
   *
   * @throws IllegalStateException when the graph is not valid
   * @throws StreamExecutionException when an operator fails
   */
  public void run()
  {
    graph.validate();
    Map<StreamNode, List<Instance>> instances = deploy();
    LOG.info("Running {} with {} nodes", graph.getName(), instances.size());

    Deque<Instance> active = new ArrayDeque<>();
    RuntimeException failure = null;
    try {
      for (List<Instance> nodeInstances : instances.values()) {
        for (Instance instance : nodeInstances) {
          instance.operator.setup(instance.context);
          active.push(instance);
        }
      }
      for (StreamNode source : graph.getSources()) {
        for (Instance instance : instances.get(source)) {
          instance.runSource();
        }
      }
    } catch (RuntimeException ex) {
      failure = ex;
    }
    failure = teardown(active, failure);
    if (failure != null) {
      LOG.error("Run of {} failed", graph.getName(), failure);
      throw failure;
    }
    LOG.info("Finished {}", graph.getName());
  }

  private static RuntimeException teardown(Deque<Instance> active, RuntimeException failure)
  {
    while (!active.isEmpty()) {
      Instance instance = active.pop();
      try {
        instance.operator.teardown();
      } catch (RuntimeException ex) {
        LOG.warn("Teardown of {} failed", instance, ex);
        if (failure == null) {
          failure = new StreamExecutionException(instance.toString(), ex);
        } else {
          failure.addSuppressed(ex);
        }
      }
    }
    return failure;
  }

  private Map<StreamNode, List<Instance>> deploy()
  {
    Map<StreamNode, List<Instance>> instances = new LinkedHashMap<>();
    for (StreamNode node : graph.getAllNodes()) {
      if (node.isView()) {
        continue;
      }
      int parallelism = node.hasParallelism() ? node.getParallelism() : 1;
      List<Instance> nodeInstances = new ArrayList<>(parallelism);
      for (int i = 0; i < parallelism; i++) {
        nodeInstances.add(new Instance(node, i, parallelism, instantiate(node.getOperator())));
      }
      instances.put(node, nodeInstances);
      LOG.debug("Deployed {} instances of {}", parallelism, node);
    }

    for (Map.Entry<StreamNode, List<Instance>> entry : instances.entrySet()) {
      StreamNode consumer = entry.getKey();
      for (StreamNode input : consumer.getInputs()) {
        for (Edge edge : resolveEdges(input, PartitioningStrategy.NONE, new ArrayList<Edge>())) {
          connect(instances.get(edge.producer), entry.getValue(), edge.partitioning);
        }
      }
    }
    return instances;
  }

  /**
   * Follows the views between the input of a consumer and the operators producing its records. The
   * partitioning of the view closest to the consumer applies.
   */
  private static List<Edge> resolveEdges(StreamNode input, PartitioningStrategy partitioning, List<Edge> edges)
  {
    switch (input.getRole()) {
      case PARTITION:
        PartitioningStrategy effective = partitioning.getKind() == PartitioningStrategy.Kind.NONE ? input.getPartitioning() : partitioning;
        resolveEdges(input.getInputs().get(0), effective, edges);
        break;
      case MERGE:
        for (StreamNode mergedInput : input.getInputs()) {
          resolveEdges(mergedInput, partitioning, edges);
        }
        break;
      default:
        edges.add(new Edge(input, partitioning));
        break;
    }
    return edges;
  }

  private void connect(List<Instance> producers, List<Instance> consumers, PartitioningStrategy partitioning)
  {
    for (Instance producer : producers) {
      RecordPartitioner<Object> partitioner = RecordPartitioners.create(partitioning, producer.index, producers.size(), consumers.size(), shuffleSeed);
      producer.output.routes.add(new Route(partitioner, consumers));
    }
  }

  private AbstractOperator<?> instantiate(OperatorDefinition definition)
  {
    OperatorDefinition copy = copyOperators ? (OperatorDefinition)SerializationUtils.clone(definition) : definition;
    return copy.createOperator();
  }

  private static class Edge
  {
    final StreamNode producer;
    final PartitioningStrategy partitioning;

    Edge(StreamNode producer, PartitioningStrategy partitioning)
    {
      this.producer = producer;
      this.partitioning = partitioning;
    }
  }

  private static class Route
  {
    final RecordPartitioner<Object> partitioner;
    final List<Instance> consumers;

    Route(RecordPartitioner<Object> partitioner, List<Instance> consumers)
    {
      this.partitioner = partitioner;
      this.consumers = consumers;
    }
  }

  private static class InstanceOutput implements Collector<Object>
  {
    final Instance instance;
    final List<Route> routes = new ArrayList<>();

    InstanceOutput(Instance instance)
    {
      this.instance = instance;
    }

    @Override
    public void collect(Object record)
    {
      for (Route route : routes) {
        int target;
        try {
          target = route.partitioner.partition(record, route.consumers.size());
        } catch (Exception ex) {
          throw new StreamExecutionException(instance.toString(), ex);
        }
        if (target == RecordPartitioner.ALL_INSTANCES) {
          for (Instance consumer : route.consumers) {
            consumer.process(record);
          }
        } else {
          route.consumers.get(target).process(record);
        }
      }
    }
  }

  private static class Instance
  {
    final StreamNode node;
    final int index;
    final AbstractOperator<Object> operator;
    final LocalOperatorContext context;
    final InstanceOutput output = new InstanceOutput(this);

    @SuppressWarnings("unchecked")
    Instance(StreamNode node, int index, int parallelism, AbstractOperator<?> operator)
    {
      this.node = node;
      this.index = index;
      this.operator = (AbstractOperator<Object>)operator;
      AttributeMap attributes = new DefaultAttributeMap();
      attributes.put(OperatorContext.PARALLELISM, parallelism);
      this.context = new LocalOperatorContext(node.getId(), index, attributes, node);
      this.operator.setOutput(output);
    }

    @SuppressWarnings("unchecked")
    void process(Object record)
    {
      try {
        ((StreamOperator<Object, Object>)operator).process(record);
      } catch (StreamExecutionException ex) {
        throw ex;
      } catch (Exception ex) {
        throw new StreamExecutionException(toString(), ex);
      }
    }

    void runSource()
    {
      try {
        ((SourceOperator<Object>)operator).run();
      } catch (StreamExecutionException ex) {
        throw ex;
      } catch (Exception ex) {
        throw new StreamExecutionException(toString(), ex);
      }
    }

    @Override
    public String toString()
    {
      return node.getId() + "#" + index;
    }
  }

}

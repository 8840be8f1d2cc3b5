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

import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import org.apache.apex.flow.api.Attribute;
import org.apache.apex.flow.api.Attribute.AttributeMap;
import org.apache.apex.flow.api.Attribute.AttributeMap.DefaultAttributeMap;
import org.apache.apex.flow.api.Context;
import org.apache.apex.flow.api.Context.GraphContext;
import org.apache.apex.flow.api.Context.OperatorContext;
import org.apache.apex.flow.api.PartitioningStrategy;
import org.apache.apex.flow.api.TypeDescriptor;

/**
 * Vertex of the stream graph.
 * <p>
 * Source and operator nodes carry an {@link OperatorDefinition}. Partition nodes are views attaching a
 * partitioning strategy to the records of their single input, merge nodes are views over the union of the
 * records of their inputs; neither executes anything of its own.
 * <p>
 * Apart from the attributes, nodes are immutable. Attributes may be changed until another node consumes
 * the records of this node.
 *
 * @since 1.0.0
 */
public final class StreamNode implements Context
{
  public enum Role
  {
    SOURCE, OPERATOR, PARTITION, MERGE
  }

  private final StreamGraph graph;
  private final String id;
  private final Role role;
  private final TypeDescriptor<?> type;
  private final PartitioningStrategy partitioning;
  private final OperatorDefinition operator;
  private final List<StreamNode> inputs;
  private final AttributeMap attributes = new DefaultAttributeMap();
  private boolean consumed;

  StreamNode(StreamGraph graph, String id, Role role, TypeDescriptor<?> type, PartitioningStrategy partitioning, OperatorDefinition operator, List<StreamNode> inputs)
  {
    this.graph = graph;
    this.id = id;
    this.role = role;
    this.type = type;
    this.partitioning = partitioning;
    this.operator = operator;
    this.inputs = ImmutableList.copyOf(inputs);
  }

  public StreamGraph getGraph()
  {
    return graph;
  }

  public String getId()
  {
    return id;
  }

  public Role getRole()
  {
    return role;
  }

  public TypeDescriptor<?> getType()
  {
    return type;
  }

  /**
   * @return partitioning strategy of partition views, {@link PartitioningStrategy#NONE} for all other nodes
   */
  public PartitioningStrategy getPartitioning()
  {
    return partitioning;
  }

  /**
   * @return the operator of source and operator nodes, null for views
   */
  public OperatorDefinition getOperator()
  {
    return operator;
  }

  public List<StreamNode> getInputs()
  {
    return inputs;
  }

  public boolean isView()
  {
    return role == Role.PARTITION || role == Role.MERGE;
  }

  public boolean isSink()
  {
    return operator != null && operator.getKind() == OperatorKind.SINK;
  }

  /**
   * @return true once another node consumes the records of this node
   */
  public boolean isConsumed()
  {
    return consumed;
  }

  void markConsumed()
  {
    consumed = true;
    if (isView()) {
      // a view passes through the records of its inputs
      for (StreamNode input : inputs) {
        input.markConsumed();
      }
    }
  }

  /**
   * @return whether the parallelism of this node can be configured and queried
   */
  public boolean hasParallelism()
  {
    return role == Role.OPERATOR;
  }

  /**
   * @return number of parallel instances executing this node
   * @throws UnsupportedOperationException for sources and views
   */
  public int getParallelism()
  {
    if (!hasParallelism()) {
      throw new UnsupportedOperationException("Operator " + id + " cannot have parallelism.");
    }
    if (operator.getKind().isGlobal()) {
      return 1;
    }
    Integer parallelism = attributes.get(OperatorContext.PARALLELISM);
    return parallelism != null ? parallelism : graph.getValue(GraphContext.DEFAULT_PARALLELISM);
  }

  /**
   * @param parallelism number of parallel instances executing this node
   * @throws UnsupportedOperationException for sources, views and, for any parallelism other than 1, global reductions
   * @throws IllegalArgumentException when the parallelism is less than 1
   * @throws IllegalStateException when another node already consumes the records of this node
   */
  public void setParallelism(int parallelism)
  {
    if (!hasParallelism()) {
      throw new UnsupportedOperationException("Operator " + id + " cannot have parallelism.");
    }
    Preconditions.checkArgument(parallelism >= 1, "The parallelism of %s must be at least 1, got %s", id, parallelism);
    if (operator.getKind().isGlobal() && parallelism != 1) {
      throw new UnsupportedOperationException("Operator " + id + " of kind " + operator.getKind()
          + " holds a single accumulator for the whole stream and cannot run with parallelism " + parallelism);
    }
    setAttribute(OperatorContext.PARALLELISM, parallelism);
  }

  /**
   * @throws IllegalStateException when another node already consumes the records of this node
   */
  public <T> void setAttribute(Attribute<T> key, T value)
  {
    if (consumed) {
      throw new IllegalStateException("Cannot change " + key.getSimpleName() + " of " + id + " after it was consumed by another node");
    }
    attributes.put(key, value);
  }

  @Override
  public AttributeMap getAttributes()
  {
    return attributes;
  }

  @Override
  public <T> T getValue(Attribute<T> key)
  {
    T value = attributes.get(key);
    return value != null ? value : key.defaultValue;
  }

  @Override
  public String toString()
  {
    return id;
  }

}

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

import java.io.Serializable;

import com.google.common.base.Preconditions;

import org.apache.apex.flow.api.AggregationType;
import org.apache.apex.flow.api.function.FilterFunction;
import org.apache.apex.flow.api.function.FlatMapFunction;
import org.apache.apex.flow.api.function.Function;
import org.apache.apex.flow.api.function.KeySelector;
import org.apache.apex.flow.api.function.MapFunction;
import org.apache.apex.flow.api.function.ReduceFunction;
import org.apache.apex.flow.api.function.SinkFunction;
import org.apache.apex.flow.api.function.SourceFunction;
import org.apache.apex.flow.operator.AbstractOperator;
import org.apache.apex.flow.operator.CountOperator;
import org.apache.apex.flow.operator.FilterOperator;
import org.apache.apex.flow.operator.FlatMapOperator;
import org.apache.apex.flow.operator.GroupedReduceOperator;
import org.apache.apex.flow.operator.MapOperator;
import org.apache.apex.flow.operator.SinkOperator;
import org.apache.apex.flow.operator.SourceOperator;
import org.apache.apex.flow.operator.StreamReduceOperator;

/**
 * Serializable description of the operator of a graph node: the kind of operator, the user function and,
 * for grouped operators, the key selector of the groups. This is what is shipped to the instances
 * executing the node, each of which creates its operator with {@link #createOperator()}.
 *
 * @since 1.0.0
 */
public final class OperatorDefinition implements Serializable
{
  private final OperatorKind kind;
  private final Function function;
  private final KeySelector<?, ?> keySelector;
  private final AggregationDescriptor aggregation;

  private OperatorDefinition(OperatorKind kind, Function function, KeySelector<?, ?> keySelector, AggregationDescriptor aggregation)
  {
    this.kind = kind;
    this.function = function;
    this.keySelector = keySelector;
    this.aggregation = aggregation;
  }

  public static OperatorDefinition source(SourceFunction<?> source)
  {
    return new OperatorDefinition(OperatorKind.SOURCE, Preconditions.checkNotNull(source), null, null);
  }

  public static OperatorDefinition map(MapFunction<?, ?> mapper)
  {
    return new OperatorDefinition(OperatorKind.MAP, Preconditions.checkNotNull(mapper), null, null);
  }

  public static OperatorDefinition flatMap(FlatMapFunction<?, ?> flatMapper)
  {
    return new OperatorDefinition(OperatorKind.FLAT_MAP, Preconditions.checkNotNull(flatMapper), null, null);
  }

  public static OperatorDefinition filter(FilterFunction<?> filter)
  {
    return new OperatorDefinition(OperatorKind.FILTER, Preconditions.checkNotNull(filter), null, null);
  }

  /**
   * @param reducer the reduce function
   * @param groupKey key selector of the groups, null for a reduce over the whole stream
   * @return reduce definition
   */
  public static OperatorDefinition reduce(ReduceFunction<?> reducer, KeySelector<?, ?> groupKey)
  {
    Preconditions.checkNotNull(reducer);
    return new OperatorDefinition(groupKey == null ? OperatorKind.REDUCE : OperatorKind.GROUPED_REDUCE, reducer, groupKey, null);
  }

  /**
   * @param aggregation the aggregation
   * @param aggregator reduce function computing the aggregation, null for count
   * @param groupKey key selector of the groups, null for an aggregation over the whole stream
   * @return aggregate definition
   */
  public static OperatorDefinition aggregate(AggregationDescriptor aggregation, ReduceFunction<?> aggregator, KeySelector<?, ?> groupKey)
  {
    Preconditions.checkNotNull(aggregation);
    Preconditions.checkArgument(aggregation.getType() == AggregationType.COUNT || aggregator != null, "No aggregator for %s", aggregation);
    return new OperatorDefinition(groupKey == null ? OperatorKind.AGGREGATE : OperatorKind.GROUPED_AGGREGATE, aggregator, groupKey, aggregation);
  }

  public static OperatorDefinition sink(SinkFunction<?> sink)
  {
    return new OperatorDefinition(OperatorKind.SINK, Preconditions.checkNotNull(sink), null, null);
  }

  public OperatorKind getKind()
  {
    return kind;
  }

  /**
   * @return the user function, or the aggregator of aggregate definitions; null for count
   */
  public Function getFunction()
  {
    return function;
  }

  /**
   * @return key selector of the groups of grouped definitions, null otherwise
   */
  public KeySelector<?, ?> getKeySelector()
  {
    return keySelector;
  }

  public AggregationDescriptor getAggregation()
  {
    return aggregation;
  }

  /**
   * Creates a new operator instance executing this definition.
   *
   * @return the operator
   */
  @SuppressWarnings({"unchecked", "rawtypes"})
  public AbstractOperator<?> createOperator()
  {
    switch (kind) {
      case SOURCE:
        return new SourceOperator<>((SourceFunction<Object>)function);
      case MAP:
        return new MapOperator<>((MapFunction<Object, Object>)function);
      case FLAT_MAP:
        return new FlatMapOperator<>((FlatMapFunction<Object, Object>)function);
      case FILTER:
        return new FilterOperator<>((FilterFunction<Object>)function);
      case REDUCE:
        return new StreamReduceOperator<>((ReduceFunction<Object>)function);
      case GROUPED_REDUCE:
        return new GroupedReduceOperator<>((ReduceFunction<Object>)function, (KeySelector)keySelector);
      case AGGREGATE:
      case GROUPED_AGGREGATE:
        if (aggregation.getType() == AggregationType.COUNT) {
          return new CountOperator<>((KeySelector<Object, ?>)keySelector);
        }
        if (keySelector == null) {
          return new StreamReduceOperator<>((ReduceFunction<Object>)function);
        }
        return new GroupedReduceOperator<>((ReduceFunction<Object>)function, (KeySelector)keySelector);
      case SINK:
        return new SinkOperator<>((SinkFunction<Object>)function);
      default:
        throw new UnsupportedOperationException("Operator kind " + kind);
    }
  }

  @Override
  public String toString()
  {
    StringBuilder sb = new StringBuilder(kind.name());
    if (aggregation != null) {
      sb.append('[').append(aggregation).append(']');
    }
    return sb.toString();
  }

  private static final long serialVersionUID = 201810191502L;
}

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
import java.util.List;

import com.google.common.base.Preconditions;

import org.apache.apex.flow.aggregation.FieldAggregator;
import org.apache.apex.flow.api.AggregationType;
import org.apache.apex.flow.api.Context.OperatorContext;
import org.apache.apex.flow.api.DataStream;
import org.apache.apex.flow.api.FieldRef;
import org.apache.apex.flow.api.PartitioningStrategy;
import org.apache.apex.flow.api.TypeDescriptor;
import org.apache.apex.flow.api.function.FilterFunction;
import org.apache.apex.flow.api.function.FlatMapFunction;
import org.apache.apex.flow.api.function.KeySelector;
import org.apache.apex.flow.api.function.MapFunction;
import org.apache.apex.flow.api.function.ReduceFunction;
import org.apache.apex.flow.api.function.SinkFunction;
import org.apache.apex.flow.record.FieldAccessor;
import org.apache.apex.flow.record.FieldsKeySelector;
import org.apache.apex.flow.sink.CsvFileSinkFunction;
import org.apache.apex.flow.sink.PrintSinkFunction;
import org.apache.apex.flow.sink.TextFileSinkFunction;

/**
 * {@link DataStream} handle over a node of a {@link StreamGraph}.
 * <p>
 * All arguments are validated, and user functions cleaned, before a node is added, so a failing call
 * leaves the graph unchanged.
 *
 * @param <T> type of the records
 * @since 1.0.0
 */
public class LogicalDataStream<T> implements DataStream<T>
{
  private final StreamNode node;

  LogicalDataStream(StreamNode node)
  {
    this.node = node;
  }

  public StreamNode getNode()
  {
    return node;
  }

  public StreamGraph getGraph()
  {
    return node.getGraph();
  }

  @Override
  @SuppressWarnings("unchecked")
  public TypeDescriptor<T> getType()
  {
    return (TypeDescriptor<T>)node.getType();
  }

  @Override
  public String getId()
  {
    return node.getId();
  }

  @Override
  public DataStream<T> setParallelism(int parallelism)
  {
    node.setParallelism(parallelism);
    return this;
  }

  @Override
  public int getParallelism()
  {
    return node.getParallelism();
  }

  @Override
  @SafeVarargs
  public final DataStream<T> merge(DataStream<T>... streams)
  {
    Preconditions.checkNotNull(streams, "Streams must not be null.");
    Preconditions.checkArgument(streams.length > 0, "At least one stream to merge with is required");
    checkEmitsRecords();
    List<StreamNode> inputs = new ArrayList<>(streams.length + 1);
    inputs.add(node);
    for (DataStream<T> stream : streams) {
      Preconditions.checkNotNull(stream, "Stream must not be null.");
      StreamNode other = nodeOf(stream);
      if (other.isSink()) {
        throw new UnsupportedOperationException("Sink " + other.getId() + " does not emit records");
      }
      inputs.add(other);
    }
    return new LogicalDataStream<>(getGraph().addMerge(inputs));
  }

  private StreamNode nodeOf(DataStream<?> stream)
  {
    Preconditions.checkArgument(stream instanceof LogicalDataStream, "Stream %s was not created by a stream graph", stream);
    StreamNode other = ((LogicalDataStream<?>)stream).node;
    Preconditions.checkArgument(other.getGraph() == getGraph(), "Stream %s belongs to another graph", other.getId());
    return other;
  }

  @Override
  public DataStream<T> groupBy(int... fields)
  {
    return partitionByFields(positions(fields), true);
  }

  @Override
  public DataStream<T> groupBy(String firstField, String... otherFields)
  {
    return partitionByFields(expressions(firstField, otherFields), true);
  }

  @Override
  public <K> DataStream<T> groupBy(KeySelector<T, K> keySelector)
  {
    Preconditions.checkNotNull(keySelector, "Key selector must not be null.");
    return partition(PartitioningStrategy.byKey(getGraph().clean(keySelector), true));
  }

  @Override
  public DataStream<T> partitionBy(int... fields)
  {
    return partitionByFields(positions(fields), false);
  }

  @Override
  public DataStream<T> partitionBy(String firstField, String... otherFields)
  {
    return partitionByFields(expressions(firstField, otherFields), false);
  }

  @Override
  public <K> DataStream<T> partitionBy(KeySelector<T, K> keySelector)
  {
    Preconditions.checkNotNull(keySelector, "Key selector must not be null.");
    return partition(PartitioningStrategy.byKey(getGraph().clean(keySelector), false));
  }

  @Override
  public DataStream<T> broadcast()
  {
    return partition(PartitioningStrategy.broadcast());
  }

  @Override
  public DataStream<T> shuffle()
  {
    return partition(PartitioningStrategy.shuffle());
  }

  @Override
  public DataStream<T> forward()
  {
    return partition(PartitioningStrategy.forward());
  }

  @Override
  public DataStream<T> distribute()
  {
    return partition(PartitioningStrategy.distribute());
  }

  private static List<FieldRef> positions(int... fields)
  {
    Preconditions.checkNotNull(fields, "Fields must not be null.");
    Preconditions.checkArgument(fields.length > 0, "At least one field is required");
    List<FieldRef> refs = new ArrayList<>(fields.length);
    for (int field : fields) {
      refs.add(FieldRef.position(field));
    }
    return refs;
  }

  private static List<FieldRef> expressions(String firstField, String... otherFields)
  {
    Preconditions.checkNotNull(otherFields, "Fields must not be null.");
    List<FieldRef> refs = new ArrayList<>(otherFields.length + 1);
    refs.add(FieldRef.expression(firstField));
    for (String field : otherFields) {
      refs.add(FieldRef.expression(field));
    }
    return refs;
  }

  private DataStream<T> partitionByFields(List<FieldRef> fields, boolean grouping)
  {
    List<FieldAccessor> accessors = new ArrayList<>(fields.size());
    for (FieldRef field : fields) {
      accessors.add(FieldAccessor.create(field, getType()));
    }
    return partition(PartitioningStrategy.byFields(fields, new FieldsKeySelector<T>(accessors), grouping));
  }

  private DataStream<T> partition(PartitioningStrategy partitioning)
  {
    checkEmitsRecords();
    return new LogicalDataStream<>(getGraph().addPartition(node, partitioning));
  }

  @Override
  public DataStream<T> max(Object field)
  {
    return aggregate(AggregationType.MAX, field, true);
  }

  @Override
  public DataStream<T> min(Object field)
  {
    return aggregate(AggregationType.MIN, field, true);
  }

  @Override
  public DataStream<T> sum(Object field)
  {
    return aggregate(AggregationType.SUM, field, true);
  }

  @Override
  public DataStream<T> maxBy(Object field)
  {
    return maxBy(field, true);
  }

  @Override
  public DataStream<T> maxBy(Object field, boolean first)
  {
    return aggregate(AggregationType.MAX_BY, field, first);
  }

  @Override
  public DataStream<T> minBy(Object field)
  {
    return minBy(field, true);
  }

  @Override
  public DataStream<T> minBy(Object field, boolean first)
  {
    return aggregate(AggregationType.MIN_BY, field, first);
  }

  private DataStream<T> aggregate(AggregationType type, Object field, boolean first)
  {
    FieldRef ref = FieldRef.of(field);
    FieldAggregator<T> aggregator = FieldAggregator.create(type, FieldAccessor.create(ref, getType()), first);
    AggregationDescriptor aggregation = new AggregationDescriptor(type, ref, first);
    return transform(OperatorDefinition.aggregate(aggregation, aggregator, groupKey()), getType());
  }

  @Override
  public DataStream<Long> count()
  {
    return transform(OperatorDefinition.aggregate(AggregationDescriptor.count(), null, groupKey()), TypeDescriptor.LONG);
  }

  @Override
  public <R> DataStream<R> map(MapFunction<T, R> mapper)
  {
    Preconditions.checkNotNull(mapper, "Map function must not be null.");
    MapFunction<T, R> cleaned = getGraph().clean(mapper);
    return transform(OperatorDefinition.map(cleaned), TypeExtractor.getMapReturnType(cleaned));
  }

  @Override
  public <R> DataStream<R> map(MapFunction<T, R> mapper, TypeDescriptor<R> outputType)
  {
    Preconditions.checkNotNull(mapper, "Map function must not be null.");
    Preconditions.checkNotNull(outputType, "Output type must not be null.");
    return transform(OperatorDefinition.map(getGraph().clean(mapper)), outputType);
  }

  @Override
  public <R> DataStream<R> flatMap(FlatMapFunction<T, R> flatMapper)
  {
    Preconditions.checkNotNull(flatMapper, "FlatMap function must not be null.");
    FlatMapFunction<T, R> cleaned = getGraph().clean(flatMapper);
    return transform(OperatorDefinition.flatMap(cleaned), TypeExtractor.getFlatMapReturnType(cleaned));
  }

  @Override
  public <R> DataStream<R> flatMap(FlatMapFunction<T, R> flatMapper, TypeDescriptor<R> outputType)
  {
    Preconditions.checkNotNull(flatMapper, "FlatMap function must not be null.");
    Preconditions.checkNotNull(outputType, "Output type must not be null.");
    return transform(OperatorDefinition.flatMap(getGraph().clean(flatMapper)), outputType);
  }

  @Override
  public DataStream<T> filter(FilterFunction<T> filter)
  {
    Preconditions.checkNotNull(filter, "Filter function must not be null.");
    return transform(OperatorDefinition.filter(getGraph().clean(filter)), getType());
  }

  @Override
  public DataStream<T> reduce(ReduceFunction<T> reducer)
  {
    Preconditions.checkNotNull(reducer, "Reduce function must not be null.");
    return transform(OperatorDefinition.reduce(getGraph().clean(reducer), groupKey()), getType());
  }

  /**
   * @return key selector of the groups when this stream is grouped, null otherwise
   */
  private KeySelector<?, ?> groupKey()
  {
    PartitioningStrategy partitioning = node.getPartitioning();
    return partitioning.isGrouping() ? partitioning.getKeySelector() : null;
  }

  @Override
  public DataStream<T> print()
  {
    return sink(new PrintSinkFunction<T>(), 0);
  }

  @Override
  public DataStream<T> writeAsText(String path)
  {
    return writeAsText(path, 0);
  }

  @Override
  public DataStream<T> writeAsText(String path, long millis)
  {
    Preconditions.checkNotNull(path, "Path must not be null.");
    Preconditions.checkArgument(millis >= 0, "Flush interval must not be negative, got %s", millis);
    return sink(new TextFileSinkFunction<T>(path), millis);
  }

  @Override
  public DataStream<T> writeAsCsv(String path)
  {
    return writeAsCsv(path, 0);
  }

  @Override
  public DataStream<T> writeAsCsv(String path, long millis)
  {
    Preconditions.checkNotNull(path, "Path must not be null.");
    Preconditions.checkArgument(millis >= 0, "Flush interval must not be negative, got %s", millis);
    return sink(new CsvFileSinkFunction<T>(path), millis);
  }

  @Override
  public DataStream<T> addSink(SinkFunction<T> sink)
  {
    Preconditions.checkNotNull(sink, "Sink function must not be null.");
    return sink(getGraph().clean(sink), 0);
  }

  private DataStream<T> sink(SinkFunction<T> sink, long flushIntervalMillis)
  {
    LogicalDataStream<T> stream = transform(OperatorDefinition.sink(sink), getType());
    stream.node.setAttribute(OperatorContext.FLUSH_INTERVAL_MILLIS, flushIntervalMillis);
    return stream;
  }

  private <R> LogicalDataStream<R> transform(OperatorDefinition operator, TypeDescriptor<R> type)
  {
    checkEmitsRecords();
    return new LogicalDataStream<>(getGraph().addOperator(operator, type, node));
  }

  private void checkEmitsRecords()
  {
    if (node.isSink()) {
      throw new UnsupportedOperationException("Sink " + node.getId() + " does not emit records");
    }
  }

  @Override
  public String toString()
  {
    return "DataStream{" + node.getId() + ": " + node.getType() + "}";
  }

}

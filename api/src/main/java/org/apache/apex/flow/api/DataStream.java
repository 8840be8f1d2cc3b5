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

import org.apache.hadoop.classification.InterfaceStability;

import org.apache.apex.flow.api.function.FilterFunction;
import org.apache.apex.flow.api.function.FlatMapFunction;
import org.apache.apex.flow.api.function.KeySelector;
import org.apache.apex.flow.api.function.MapFunction;
import org.apache.apex.flow.api.function.ReduceFunction;
import org.apache.apex.flow.api.function.SinkFunction;

/**
 * Handle to a point of the stream graph, i.e. the records produced by one transformation.
 * <p>
 * Handles are immutable: every transformation returns a new handle referring to a new node of the graph
 * whose input is the node of this handle. The only exception is {@link #setParallelism(int)} which
 * configures the node of this handle while it is being built.
 * <p>
 * User functions passed to the transformations are cleaned of unused enclosing state and checked for
 * serializability before the node is created. A function which cannot be serialized fails the call with
 * {@link NotTransferableException}.
 *
 * @param <T> type of the records
 * @since 1.0.0
 */
@InterfaceStability.Evolving
public interface DataStream<T>
{
  /**
   * @return descriptor of the type of the records of this stream
   */
  TypeDescriptor<T> getType();

  /**
   * @return identifier of the graph node of this stream
   */
  String getId();

  /**
   * Sets the parallelism of the operator which produces this stream.
   *
   * @param parallelism number of parallel instances, at least 1
   * @return this stream
   * @throws UnsupportedOperationException when the stream is a source, a partitioned or merged view, or a global aggregation
   * @throws IllegalStateException when the stream was already consumed by another transformation
   */
  DataStream<T> setParallelism(int parallelism);

  /**
   * @return the parallelism of the operator which produces this stream
   * @throws UnsupportedOperationException when the stream has no operator of its own
   */
  int getParallelism();

  /**
   * Creates a new stream by merging the records of this stream with the records of the given streams
   * of the same type. No ordering across the merged streams is guaranteed.
   *
   * @param streams the streams to merge with this one
   * @return the merged stream
   */
  @SuppressWarnings("unchecked")
  DataStream<T> merge(DataStream<T>... streams);

  /**
   * Groups the records by the given positions, for indexed records. The reduce and aggregations applied to
   * the returned stream keep state per key.
   *
   * @param fields positions making up the key
   * @return the grouped stream
   */
  DataStream<T> groupBy(int... fields);

  /**
   * Groups the records by the given field expressions. The reduce and aggregations applied to the
   * returned stream keep state per key.
   *
   * @param firstField first expression
   * @param otherFields remaining expressions
   * @return the grouped stream
   */
  DataStream<T> groupBy(String firstField, String... otherFields);

  /**
   * Groups the records by the key extracted by the selector. The reduce and aggregations applied to the
   * returned stream keep state per key.
   *
   * @param keySelector the key selector
   * @param <K> type of the key
   * @return the grouped stream
   */
  <K> DataStream<T> groupBy(KeySelector<T, K> keySelector);

  /**
   * Routes records with the same values at the given positions to the same instance of the next operator.
   * Only the distribution is affected; following aggregations stay global.
   *
   * @param fields positions making up the key
   * @return the partitioned stream
   */
  DataStream<T> partitionBy(int... fields);

  /**
   * Routes records with the same values of the field expressions to the same instance of the next operator.
   *
   * @param firstField first expression
   * @param otherFields remaining expressions
   * @return the partitioned stream
   */
  DataStream<T> partitionBy(String firstField, String... otherFields);

  /**
   * Routes records with the same key to the same instance of the next operator.
   *
   * @param keySelector the key selector
   * @param <K> type of the key
   * @return the partitioned stream
   */
  <K> DataStream<T> partitionBy(KeySelector<T, K> keySelector);

  /**
   * Sends every record to every parallel instance of the next operator.
   *
   * @return the broadcast stream
   */
  DataStream<T> broadcast();

  /**
   * Sends every record to a random parallel instance of the next operator.
   *
   * @return the shuffled stream
   */
  DataStream<T> shuffle();

  /**
   * Sends records to the local instance of the next operator whenever possible.
   *
   * @return the forwarded stream
   */
  DataStream<T> forward();

  /**
   * Distributes records evenly over the parallel instances of the next operator.
   *
   * @return the distributed stream
   */
  DataStream<T> distribute();

  /**
   * Running maximum at the given field.
   *
   * @param field {@link Integer} position, {@link String} expression or {@link FieldRef}
   * @return stream of records carrying the current maximum at the field
   * @throws IllegalArgumentException when the field is of any other type
   */
  DataStream<T> max(Object field);

  /**
   * Running minimum at the given field.
   *
   * @param field {@link Integer} position, {@link String} expression or {@link FieldRef}
   * @return stream of records carrying the current minimum at the field
   * @throws IllegalArgumentException when the field is of any other type
   */
  DataStream<T> min(Object field);

  /**
   * Running sum at the given field.
   *
   * @param field {@link Integer} position, {@link String} expression or {@link FieldRef}
   * @return stream of records carrying the current sum at the field
   * @throws IllegalArgumentException when the field is of any other type
   */
  DataStream<T> sum(Object field);

  /**
   * The record holding the current maximum at the given field. On equality the first record is kept.
   *
   * @param field {@link Integer} position, {@link String} expression or {@link FieldRef}
   * @return stream of the extremal records
   */
  DataStream<T> maxBy(Object field);

  /**
   * The record holding the current maximum at the given field.
   *
   * @param field {@link Integer} position, {@link String} expression or {@link FieldRef}
   * @param first on equality keep the first record when true, the latest when false
   * @return stream of the extremal records
   */
  DataStream<T> maxBy(Object field, boolean first);

  /**
   * The record holding the current minimum at the given field. On equality the first record is kept.
   *
   * @param field {@link Integer} position, {@link String} expression or {@link FieldRef}
   * @return stream of the extremal records
   */
  DataStream<T> minBy(Object field);

  /**
   * The record holding the current minimum at the given field.
   *
   * @param field {@link Integer} position, {@link String} expression or {@link FieldRef}
   * @param first on equality keep the first record when true, the latest when false
   * @return stream of the extremal records
   */
  DataStream<T> minBy(Object field, boolean first);

  /**
   * Running count of the records received, per key on grouped streams.
   *
   * @return stream of counts
   */
  DataStream<Long> count();

  <R> DataStream<R> map(MapFunction<T, R> mapper);

  <R> DataStream<R> map(MapFunction<T, R> mapper, TypeDescriptor<R> outputType);

  <R> DataStream<R> flatMap(FlatMapFunction<T, R> flatMapper);

  <R> DataStream<R> flatMap(FlatMapFunction<T, R> flatMapper, TypeDescriptor<R> outputType);

  DataStream<T> filter(FilterFunction<T> filter);

  /**
   * Combines the records with an associative reduce function, emitting the running result after every
   * record. On grouped streams the running result is kept per key.
   *
   * @param reducer the reduce function
   * @return stream of running results
   */
  DataStream<T> reduce(ReduceFunction<T> reducer);

  /**
   * Writes the records to the standard output.
   *
   * @return the sink stream
   */
  DataStream<T> print();

  DataStream<T> writeAsText(String path);

  /**
   * Writes the result of toString of every record as a line of the file.
   *
   * @param path file to write
   * @param millis interval between flushes, 0 to flush every record
   * @return the sink stream
   */
  DataStream<T> writeAsText(String path, long millis);

  DataStream<T> writeAsCsv(String path);

  /**
   * Writes every record as a comma separated line of the file.
   *
   * @param path file to write
   * @param millis interval between flushes, 0 to flush every record
   * @return the sink stream
   */
  DataStream<T> writeAsCsv(String path, long millis);

  /**
   * Attaches a terminal consumer to this stream.
   *
   * @param sink the sink function
   * @return the sink stream, which emits no records
   */
  DataStream<T> addSink(SinkFunction<T> sink);
}

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
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Assert;
import org.junit.Test;

import org.apache.apex.flow.api.Context.GraphContext;
import org.apache.apex.flow.api.DataStream;
import org.apache.apex.flow.api.TypeDescriptor;
import org.apache.apex.flow.api.function.Collector;
import org.apache.apex.flow.api.function.SourceFunction;
import org.apache.apex.flow.source.CollectionSourceFunction;
import org.apache.apex.flow.support.CollectingSink;

public class StreamGraphTest
{
  public static class WordSource implements SourceFunction<String>
  {
    @Override
    public void run(Collector<String> out)
    {
      out.collect("hello");
      out.collect("world");
    }

    private static final long serialVersionUID = 201810201001L;
  }

  @Test
  public void testDefaults()
  {
    StreamGraph graph = new StreamGraph();
    Assert.assertEquals(GraphContext.APPLICATION_NAME.defaultValue, graph.getName());
    Assert.assertEquals(Integer.valueOf(1), graph.getValue(GraphContext.DEFAULT_PARALLELISM));
    Assert.assertTrue(graph.getValue(GraphContext.CLOSURE_CLEANING));
    Assert.assertEquals("wordcount", new StreamGraph("wordcount").getName());
    Assert.assertTrue(graph.getAllNodes().isEmpty());
  }

  @Test
  public void testSources()
  {
    StreamGraph graph = new StreamGraph("sources");
    DataStream<String> elements = graph.fromElements("a", "b");
    Assert.assertEquals(TypeDescriptor.of(String.class), elements.getType());
    Assert.assertEquals("source-1", elements.getId());

    DataStream<Long> collection = graph.fromCollection(Arrays.asList(1L, 2L));
    Assert.assertEquals(Long.class, collection.getType().getRawType());

    DataStream<Object> empty = graph.fromCollection(Collections.emptyList());
    Assert.assertTrue(empty.getType().isGeneric());

    DataStream<String> words = graph.addSource(new WordSource());
    Assert.assertEquals(String.class, words.getType().getRawType());
    DataStream<Integer> typed = graph.addSource(out -> out.collect(1), TypeDescriptor.of(Integer.class));
    Assert.assertEquals(Integer.class, typed.getType().getRawType());

    List<StreamNode> sources = graph.getSources();
    Assert.assertEquals(5, sources.size());
    StreamNode first = graph.getNode(elements.getId());
    Assert.assertEquals(StreamNode.Role.SOURCE, first.getRole());
    Assert.assertEquals(OperatorKind.SOURCE, first.getOperator().getKind());
    Assert.assertEquals(2, ((CollectionSourceFunction<?>)first.getOperator().getFunction()).size());
    Assert.assertTrue(first.getInputs().isEmpty());
  }

  @Test
  public void testSourceArguments()
  {
    StreamGraph graph = new StreamGraph();
    try {
      graph.fromElements();
      Assert.fail("no elements");
    } catch (IllegalArgumentException ex) {
      Assert.assertNotNull(ex.getMessage());
    }
    try {
      graph.fromElements("a", null);
      Assert.fail("null element");
    } catch (NullPointerException ex) {
      Assert.assertEquals("Elements must not contain null.", ex.getMessage());
    }
    try {
      graph.fromCollection(null);
      Assert.fail("null collection");
    } catch (NullPointerException ex) {
      Assert.assertEquals("Collection must not be null.", ex.getMessage());
    }
    try {
      graph.addSource(null);
      Assert.fail("null source");
    } catch (NullPointerException ex) {
      Assert.assertEquals("Source function must not be null.", ex.getMessage());
    }
    Assert.assertTrue(graph.getAllNodes().isEmpty());
  }

  @Test
  public void testElementsCopied()
  {
    StreamGraph graph = new StreamGraph();
    List<Integer> elements = new ArrayList<>(Arrays.asList(1, 2));
    DataStream<Integer> stream = graph.fromCollection(elements);
    elements.add(3);
    CollectionSourceFunction<?> source = (CollectionSourceFunction<?>)graph.getNode(stream.getId()).getOperator().getFunction();
    Assert.assertEquals(2, source.size());
  }

  @Test
  public void testQueries()
  {
    StreamGraph graph = new StreamGraph();
    DataStream<Integer> numbers = graph.fromElements(1, 2, 3);
    DataStream<Integer> doubled = numbers.map(value -> value * 2);
    DataStream<Integer> odd = numbers.filter(value -> value % 2 == 1);
    DataStream<Integer> sink = doubled.merge(odd).print();

    StreamNode source = graph.getNode(numbers.getId());
    List<StreamNode> downstream = graph.getDownstream(source);
    Assert.assertEquals(2, downstream.size());
    Assert.assertTrue(downstream.contains(graph.getNode(doubled.getId())));
    Assert.assertTrue(downstream.contains(graph.getNode(odd.getId())));
    Assert.assertEquals(Collections.singletonList(graph.getNode(sink.getId())), graph.getSinks());
    Assert.assertEquals(5, graph.getAllNodes().size());
    Assert.assertNull(graph.getNode("map-42"));
    Assert.assertTrue(source.isConsumed());
    Assert.assertFalse(graph.getNode(sink.getId()).isConsumed());
    Assert.assertTrue(doubled.getId().startsWith("map-"));
    Assert.assertTrue(odd.getId().startsWith("filter-"));
    Assert.assertTrue(sink.getId().startsWith("sink-"));
    graph.validate();
  }

  @Test
  public void testRejectedNodeKeepsIdSequence()
  {
    StreamGraph graph = new StreamGraph();
    StreamGraph other = new StreamGraph();
    DataStream<Integer> numbers = graph.fromElements(1, 2);
    StreamNode foreign = other.getNode(other.fromElements(3).getId());
    try {
      numbers.merge(other.fromElements(4));
      Assert.fail("merge across graphs");
    } catch (IllegalArgumentException ex) {
      Assert.assertTrue(ex.getMessage(), ex.getMessage().contains("another graph"));
    }
    try {
      graph.addPartition(foreign, graph.getNode(numbers.getId()).getPartitioning());
      Assert.fail("partition of a foreign node");
    } catch (IllegalArgumentException ex) {
      Assert.assertTrue(ex.getMessage(), ex.getMessage().contains(foreign.getId()));
    }
    try {
      graph.addMerge(Arrays.asList(graph.getNode(numbers.getId()), foreign));
      Assert.fail("merge with a foreign node");
    } catch (IllegalArgumentException ex) {
      Assert.assertTrue(ex.getMessage(), ex.getMessage().contains(foreign.getId()));
    }
    Assert.assertEquals(1, graph.getAllNodes().size());
    Assert.assertFalse(graph.getNode(numbers.getId()).isConsumed());
    Assert.assertEquals("map-2", numbers.map(value -> value + 1).getId());
  }

  @Test
  public void testValidate()
  {
    StreamGraph graph = new StreamGraph("unfinished");
    graph.fromElements(1).map(value -> value + 1);
    try {
      graph.validate();
      Assert.fail("graph without sink");
    } catch (IllegalStateException ex) {
      Assert.assertTrue(ex.getMessage(), ex.getMessage().contains("no sink"));
    }

    StreamGraph misconfigured = new StreamGraph();
    misconfigured.fromElements(1).addSink(new CollectingSink<Integer>("validate"));
    misconfigured.setAttribute(GraphContext.DEFAULT_PARALLELISM, 0);
    try {
      misconfigured.validate();
      Assert.fail("default parallelism 0");
    } catch (IllegalStateException ex) {
      Assert.assertTrue(ex.getMessage(), ex.getMessage().contains("parallelism"));
    }
  }

}

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

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import org.apache.apex.flow.api.Context.GraphContext;
import org.apache.apex.flow.api.DataStream;
import org.apache.apex.flow.common.util.Pair;
import org.apache.apex.flow.plan.StreamGraph;
import org.apache.apex.flow.support.CollectingSink;
import org.apache.apex.flow.support.Reading;

public class LocalStreamExecutorTest
{
  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  @Before
  public void setup()
  {
    CollectingSink.clear();
  }

  private static void run(StreamGraph graph)
  {
    LocalStreamExecutor executor = new LocalStreamExecutor(graph);
    executor.setShuffleSeed(7);
    executor.run();
  }

  @Test
  public void testMapFilterFlatMap()
  {
    StreamGraph graph = new StreamGraph();
    DataStream<Integer> numbers = graph.fromElements(1, 2, 3, 4);
    numbers.filter(value -> value % 2 == 0).addSink(new CollectingSink<Integer>("even"));
    numbers.map(value -> "#" + value).addSink(new CollectingSink<String>("labels"));
    graph.fromElements("to be", "or").<String>flatMap((line, out) -> {
      for (String word : line.split(" ")) {
        out.collect(word);
      }
    }).addSink(new CollectingSink<String>("words"));
    run(graph);

    Assert.assertEquals(Arrays.asList(2, 4), CollectingSink.get("even"));
    Assert.assertEquals(Arrays.asList("#1", "#2", "#3", "#4"), CollectingSink.get("labels"));
    Assert.assertEquals(Arrays.asList("to", "be", "or"), CollectingSink.get("words"));
    Assert.assertEquals(1, CollectingSink.getTeardowns("even"));
  }

  @Test
  public void testCount()
  {
    StreamGraph graph = new StreamGraph();
    DataStream<String> letters = graph.fromElements("a", "b", "a");
    letters.count().addSink(new CollectingSink<Long>("count"));
    letters.groupBy(value -> value).count().addSink(new CollectingSink<Long>("perKey"));
    run(graph);

    Assert.assertEquals(Arrays.asList(1L, 2L, 3L), CollectingSink.get("count"));
    Assert.assertEquals(Arrays.asList(1L, 1L, 2L), CollectingSink.get("perKey"));
  }

  @Test
  public void testSums()
  {
    StreamGraph graph = new StreamGraph();
    graph.fromElements(1, 2, 3).sum(0).addSink(new CollectingSink<Integer>("total"));
    graph.fromElements(Pair.of("a", 1), Pair.of("b", 2), Pair.of("a", 3))
        .groupBy(0).sum(1).setParallelism(2)
        .addSink(new CollectingSink<Pair<String, Integer>>("perKey"));
    run(graph);

    Assert.assertEquals(Arrays.asList(1, 3, 6), CollectingSink.get("total"));
    Assert.assertEquals(Arrays.asList(Pair.of("a", 1), Pair.of("b", 2), Pair.of("a", 4)), CollectingSink.get("perKey"));
  }

  @Test
  public void testGroupedReduce()
  {
    StreamGraph graph = new StreamGraph();
    graph.fromElements(Pair.of("a", 1), Pair.of("b", 2), Pair.of("a", 3))
        .groupBy(0)
        .reduce((left, right) -> Pair.of(left.first, left.second + right.second))
        .setParallelism(2)
        .addSink(new CollectingSink<Pair<String, Integer>>("reduced"));
    run(graph);

    Assert.assertEquals(Arrays.asList(Pair.of("a", 1), Pair.of("b", 2), Pair.of("a", 4)), CollectingSink.get("reduced"));
  }

  @Test
  public void testMaxBy()
  {
    StreamGraph graph = new StreamGraph();
    DataStream<Reading> readings = graph.fromElements(new Reading(1, 5), new Reading(2, 9), new Reading(3, 9));
    readings.maxBy("v").addSink(new CollectingSink<Reading>("first"));
    readings.maxBy("v", false).addSink(new CollectingSink<Reading>("last"));
    readings.max("v").addSink(new CollectingSink<Reading>("max"));
    run(graph);

    List<Reading> first = CollectingSink.get("first");
    Assert.assertEquals(3, first.size());
    Assert.assertEquals(2, first.get(2).getId());
    List<Reading> last = CollectingSink.get("last");
    Assert.assertEquals(3, last.get(2).getId());
    Assert.assertEquals(Arrays.asList(new Reading(1, 5), new Reading(1, 9), new Reading(1, 9)), CollectingSink.get("max"));
  }

  @Test
  public void testInputsNotMutated()
  {
    Reading[] readings = {new Reading(1, 5), new Reading(2, 9)};
    StreamGraph graph = new StreamGraph();
    graph.fromElements(readings).sum("v").addSink(new CollectingSink<Reading>("sum"));
    LocalStreamExecutor executor = new LocalStreamExecutor(graph);
    executor.setCopyOperators(false);
    executor.run();

    Assert.assertEquals(Arrays.asList(new Reading(1, 5), new Reading(1, 14)), CollectingSink.get("sum"));
    Assert.assertEquals(new Reading(1, 5), readings[0]);
    Assert.assertEquals(new Reading(2, 9), readings[1]);
  }

  @Test
  public void testMerge()
  {
    StreamGraph graph = new StreamGraph();
    DataStream<Integer> odd = graph.fromElements(1, 3, 5);
    DataStream<Integer> even = graph.fromElements(2, 4);
    odd.merge(even).addSink(new CollectingSink<Integer>("merged"));
    run(graph);

    List<Integer> merged = CollectingSink.get("merged");
    Collections.sort(merged);
    Assert.assertEquals(Arrays.asList(1, 2, 3, 4, 5), merged);
  }

  @Test
  public void testKeyedRouting()
  {
    StreamGraph graph = new StreamGraph();
    List<String> words = Arrays.asList("apple", "banana", "cherry", "apple", "date", "banana", "apple", "fig");
    graph.fromCollection(words).groupBy(word -> word).addSink(new CollectingSink<String>("keyed")).setParallelism(3);
    run(graph);

    List<String> received = CollectingSink.get("keyed");
    List<Integer> instances = CollectingSink.getInstances("keyed");
    Assert.assertEquals(words.size(), received.size());
    Map<String, Set<Integer>> instancesOfKey = new HashMap<>();
    for (int i = 0; i < received.size(); i++) {
      instancesOfKey.computeIfAbsent(received.get(i), k -> new HashSet<>()).add(instances.get(i));
    }
    for (Map.Entry<String, Set<Integer>> entry : instancesOfKey.entrySet()) {
      Assert.assertEquals("instances of " + entry.getKey(), 1, entry.getValue().size());
    }
    Assert.assertEquals(3, CollectingSink.getTeardowns("keyed"));
  }

  @Test
  public void testBroadcast()
  {
    StreamGraph graph = new StreamGraph();
    graph.fromElements(1, 2).broadcast().addSink(new CollectingSink<Integer>("all")).setParallelism(3);
    run(graph);

    Assert.assertEquals(6, CollectingSink.get("all").size());
    List<Integer> instances = CollectingSink.getInstances("all");
    for (int index = 0; index < 3; index++) {
      Assert.assertEquals("records of instance " + index, 2, Collections.frequency(instances, index));
    }
  }

  @Test
  public void testDefaultParallelism()
  {
    StreamGraph graph = new StreamGraph();
    graph.setAttribute(GraphContext.DEFAULT_PARALLELISM, 2);
    graph.fromElements(1, 2, 3, 4).map(value -> value * 10).addSink(new CollectingSink<Integer>("scaled"));
    run(graph);

    Assert.assertEquals(Arrays.asList(10, 20, 30, 40), CollectingSink.get("scaled"));
    Assert.assertEquals(Arrays.asList(0, 1, 0, 1), CollectingSink.getInstances("scaled"));
  }

  @Test
  public void testOperatorFailure()
  {
    StreamGraph graph = new StreamGraph();
    graph.fromElements(1, 2, 3).map(value -> {
      if (value == 2) {
        throw new IllegalStateException("cannot map " + value);
      }
      return value;
    }).addSink(new CollectingSink<Integer>("partial"));
    try {
      run(graph);
      Assert.fail("map fails");
    } catch (StreamExecutionException ex) {
      Assert.assertEquals("map-2#0", ex.getOperatorName());
      Assert.assertTrue(ex.getCause() instanceof IllegalStateException);
    }
    Assert.assertEquals(Collections.singletonList(1), CollectingSink.get("partial"));
    Assert.assertEquals("torn down after the failure", 1, CollectingSink.getTeardowns("partial"));
  }

  @Test
  public void testGraphWithoutSink()
  {
    StreamGraph graph = new StreamGraph();
    graph.fromElements(1).map(value -> value);
    try {
      run(graph);
      Assert.fail("no sink");
    } catch (IllegalStateException ex) {
      Assert.assertNotNull(ex.getMessage());
    }
  }

  @Test
  public void testWriteAsCsv() throws Exception
  {
    File csv = new File(folder.getRoot(), "out/pairs.csv");
    File text = new File(folder.getRoot(), "out/pairs.txt");
    StreamGraph graph = new StreamGraph();
    DataStream<Pair<String, Integer>> pairs = graph.fromElements(Pair.of("a", 1), Pair.of("b", (Integer)null));
    pairs.writeAsCsv(csv.getPath());
    pairs.writeAsText(text.getPath(), 1000);
    run(graph);

    Assert.assertEquals(Arrays.asList("a,1", "b,"), Files.readAllLines(csv.toPath(), StandardCharsets.UTF_8));
    Assert.assertEquals(Arrays.asList("[a,1]", "[b,null]"), Files.readAllLines(text.toPath(), StandardCharsets.UTF_8));
  }

  @Test
  public void testParallelFileSink() throws Exception
  {
    File directory = new File(folder.getRoot(), "numbers");
    StreamGraph graph = new StreamGraph();
    graph.fromElements(1, 2, 3).distribute().writeAsText(directory.getPath()).setParallelism(2);
    run(graph);

    Assert.assertTrue(directory.isDirectory());
    List<String> lines = new ArrayList<>(Files.readAllLines(new File(directory, "1").toPath(), StandardCharsets.UTF_8));
    lines.addAll(Files.readAllLines(new File(directory, "2").toPath(), StandardCharsets.UTF_8));
    Collections.sort(lines);
    Assert.assertEquals(Arrays.asList("1", "2", "3"), lines);
  }

}

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
package org.apache.apex.flow.codec;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import org.codehaus.jackson.map.ObjectMapper;
import org.junit.Assert;
import org.junit.Test;

import org.apache.apex.flow.api.Context.GraphContext;
import org.apache.apex.flow.api.DataStream;
import org.apache.apex.flow.common.util.Pair;
import org.apache.apex.flow.plan.StreamGraph;

public class StreamGraphSerializerTest
{
  @Test
  @SuppressWarnings("unchecked")
  public void testConvertToMap()
  {
    StreamGraph graph = new StreamGraph("pairs");
    graph.setAttribute(GraphContext.DEFAULT_PARALLELISM, 2);
    DataStream<Pair<String, Integer>> pairs = graph.fromElements(Pair.of("a", 1));
    pairs.groupBy(0).maxBy(1, false).writeAsText("/tmp/pairs.txt", 500);

    Map<String, Object> map = StreamGraphSerializer.convertToMap(graph);
    Assert.assertEquals("pairs", map.get("name"));
    Map<String, Object> attributes = (Map<String, Object>)map.get("attributes");
    Assert.assertEquals(2, attributes.get("DEFAULT_PARALLELISM"));
    Assert.assertEquals(true, attributes.get("CLOSURE_CLEANING"));

    List<Map<String, Object>> nodes = (List<Map<String, Object>>)map.get("nodes");
    Assert.assertEquals(4, nodes.size());

    Map<String, Object> source = nodes.get(0);
    Assert.assertEquals("source-1", source.get("id"));
    Assert.assertEquals("SOURCE", source.get("role"));
    Assert.assertFalse(source.containsKey("parallelism"));
    Assert.assertEquals(Pair.class.getName(), source.get("type"));

    Map<String, Object> partition = nodes.get(1);
    Assert.assertEquals("PARTITION", partition.get("role"));
    Map<String, Object> partitioning = (Map<String, Object>)partition.get("partitioning");
    Assert.assertEquals("FIELDS", partitioning.get("kind"));
    Assert.assertEquals(true, partitioning.get("grouping"));
    Assert.assertEquals(Arrays.asList("#0"), partitioning.get("fields"));
    Assert.assertEquals(Arrays.asList("source-1"), partition.get("inputs"));

    Map<String, Object> aggregate = nodes.get(2);
    Assert.assertEquals("GROUPED_AGGREGATE", aggregate.get("kind"));
    Assert.assertEquals(2, aggregate.get("parallelism"));
    Map<String, Object> aggregation = (Map<String, Object>)aggregate.get("aggregation");
    Assert.assertEquals("MAX_BY", aggregation.get("type"));
    Assert.assertEquals("#1", aggregation.get("field"));
    Assert.assertEquals(false, aggregation.get("first"));

    Map<String, Object> sink = nodes.get(3);
    Assert.assertEquals("SINK", sink.get("kind"));
    Assert.assertEquals(500L, sink.get("flushIntervalMillis"));
    Assert.assertEquals(Arrays.asList(sink.get("id")), map.get("sinks"));
  }

  @Test
  @SuppressWarnings("unchecked")
  public void testToJson() throws Exception
  {
    StreamGraph graph = new StreamGraph("counting");
    DataStream<Integer> numbers = graph.fromElements(1, 2);
    numbers.merge(graph.fromElements(3)).count().print();

    String json = StreamGraphSerializer.toJson(graph);
    Map<String, Object> parsed = new ObjectMapper().readValue(json, Map.class);
    Assert.assertEquals("counting", parsed.get("name"));
    List<Map<String, Object>> nodes = (List<Map<String, Object>>)parsed.get("nodes");
    Assert.assertEquals(5, nodes.size());
    Map<String, Object> merge = nodes.get(2);
    Assert.assertEquals("MERGE", merge.get("role"));
    Assert.assertEquals(Arrays.asList("source-1", "source-2"), merge.get("inputs"));
    Map<String, Object> count = nodes.get(3);
    Assert.assertEquals("AGGREGATE", count.get("kind"));
    Assert.assertEquals(1, count.get("parallelism"));
    Assert.assertEquals("COUNT", ((Map<String, Object>)count.get("aggregation")).get("type"));
    Assert.assertEquals(Long.class.getName(), count.get("type"));
  }

}

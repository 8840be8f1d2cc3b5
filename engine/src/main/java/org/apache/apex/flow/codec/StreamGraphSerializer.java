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

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.codehaus.jackson.map.ObjectMapper;
import org.codehaus.jackson.map.SerializationConfig;

import org.apache.apex.flow.api.Attribute;
import org.apache.apex.flow.api.AttributeRegistry;
import org.apache.apex.flow.api.Context;
import org.apache.apex.flow.plan.AggregationDescriptor;
import org.apache.apex.flow.plan.StreamGraph;
import org.apache.apex.flow.plan.StreamNode;

/**
 * Describes a stream graph as JSON, for display and debugging.
 * <p>
 * The description lists the graph attributes and the nodes in the order they were added, each with its
 * role, operator kind, record type, parallelism, partitioning, aggregation and the ids of its inputs.
 *
 * @since 1.0.0
 */
public class StreamGraphSerializer
{
  private static final ObjectMapper MAPPER = new ObjectMapper();

  static {
    MAPPER.configure(SerializationConfig.Feature.INDENT_OUTPUT, true);
  }

  private StreamGraphSerializer()
  {
  }

  public static Map<String, Object> convertToMap(StreamGraph graph)
  {
    Map<String, Object> result = new LinkedHashMap<>();
    result.put("name", graph.getName());

    Map<String, Object> graphAttrs = new LinkedHashMap<>();
    for (Map.Entry<Attribute<Object>, Object> e :
        AttributeRegistry.getValues(graph, Context.GraphContext.class).entrySet()) {
      graphAttrs.put(e.getKey().getSimpleName(), e.getValue());
    }
    result.put("attributes", graphAttrs);

    List<Object> nodeArray = new ArrayList<>();
    List<String> sinks = new ArrayList<>();
    for (StreamNode node : graph.getAllNodes()) {
      nodeArray.add(convertToMap(node));
      if (node.isSink()) {
        sinks.add(node.getId());
      }
    }
    result.put("nodes", nodeArray);
    result.put("sinks", sinks);
    return result;
  }

  private static Map<String, Object> convertToMap(StreamNode node)
  {
    Map<String, Object> nodeDetailMap = new LinkedHashMap<>();
    nodeDetailMap.put("id", node.getId());
    nodeDetailMap.put("role", node.getRole().name());
    nodeDetailMap.put("type", node.getType().toString());
    if (node.getOperator() != null) {
      nodeDetailMap.put("kind", node.getOperator().getKind().name());
    }
    if (node.hasParallelism()) {
      nodeDetailMap.put("parallelism", node.getParallelism());
    }
    if (node.getRole() == StreamNode.Role.PARTITION) {
      Map<String, Object> partitioningMap = new LinkedHashMap<>();
      partitioningMap.put("kind", node.getPartitioning().getKind().name());
      partitioningMap.put("grouping", node.getPartitioning().isGrouping());
      if (!node.getPartitioning().getFields().isEmpty()) {
        List<String> fields = new ArrayList<>();
        for (Object field : node.getPartitioning().getFields()) {
          fields.add(field.toString());
        }
        partitioningMap.put("fields", fields);
      }
      nodeDetailMap.put("partitioning", partitioningMap);
    }
    AggregationDescriptor aggregation = node.getOperator() == null ? null : node.getOperator().getAggregation();
    if (aggregation != null) {
      Map<String, Object> aggregationMap = new LinkedHashMap<>();
      aggregationMap.put("type", aggregation.getType().name());
      if (aggregation.getField() != null) {
        aggregationMap.put("field", aggregation.getField().toString());
      }
      if (aggregation.getType().isByAggregation()) {
        aggregationMap.put("first", aggregation.isFirst());
      }
      nodeDetailMap.put("aggregation", aggregationMap);
    }
    if (node.isSink()) {
      nodeDetailMap.put("flushIntervalMillis", node.getValue(Context.OperatorContext.FLUSH_INTERVAL_MILLIS));
    }
    List<String> inputs = new ArrayList<>();
    for (StreamNode input : node.getInputs()) {
      inputs.add(input.getId());
    }
    nodeDetailMap.put("inputs", inputs);
    return nodeDetailMap;
  }

  public static String toJson(StreamGraph graph) throws IOException
  {
    return MAPPER.writeValueAsString(convertToMap(graph));
  }

}

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

import java.util.Arrays;
import java.util.List;

import org.junit.Assert;
import org.junit.Test;

import org.apache.apex.flow.api.TypeDescriptor;
import org.apache.apex.flow.api.function.Collector;
import org.apache.apex.flow.api.function.FlatMapFunction;
import org.apache.apex.flow.api.function.MapFunction;
import org.apache.apex.flow.api.function.SourceFunction;

public class TypeExtractorTest
{
  public static class Length implements MapFunction<String, Integer>
  {
    @Override
    public Integer map(String value)
    {
      return value.length();
    }

    private static final long serialVersionUID = 201810201201L;
  }

  public static class LongerLength extends Length
  {
    private static final long serialVersionUID = 201810201202L;
  }

  public static class Split implements FlatMapFunction<String, List<String>>
  {
    @Override
    public void flatMap(String value, Collector<List<String>> out)
    {
      out.collect(Arrays.asList(value.split(" ")));
    }

    private static final long serialVersionUID = 201810201203L;
  }

  public static class Identity<T> implements MapFunction<T, T>
  {
    @Override
    public T map(T value)
    {
      return value;
    }

    private static final long serialVersionUID = 201810201204L;
  }

  public static class Ticks implements SourceFunction<Long>
  {
    @Override
    public void run(Collector<Long> out)
    {
      out.collect(1L);
    }

    private static final long serialVersionUID = 201810201205L;
  }

  @Test
  public void testClasses()
  {
    Assert.assertEquals(TypeDescriptor.of(Integer.class), TypeExtractor.getMapReturnType(new Length()));
    Assert.assertEquals("inherited", TypeDescriptor.of(Integer.class), TypeExtractor.getMapReturnType(new LongerLength()));
    Assert.assertEquals(List.class, TypeExtractor.getFlatMapReturnType(new Split()).getRawType());
    Assert.assertEquals(Long.class, TypeExtractor.getSourceType(new Ticks()).getRawType());
  }

  @Test
  public void testTypeVariables()
  {
    Assert.assertTrue(TypeExtractor.getMapReturnType(new Identity<String>()).isGeneric());
  }

  @Test
  public void testLambdas()
  {
    MapFunction<Integer, String> describe = value -> "#" + value;
    Assert.assertEquals(String.class, TypeExtractor.getMapReturnType(describe).getRawType());
    MapFunction<String, int[]> codes = value -> value.chars().toArray();
    Assert.assertEquals(int[].class, TypeExtractor.getMapReturnType(codes).getRawType());
    MapFunction<String, Integer> length = String::length;
    Assert.assertEquals(Integer.class, TypeExtractor.getMapReturnType(length).getRawType());
    FlatMapFunction<String, String> words = (value, out) -> out.collect(value);
    Assert.assertTrue(TypeExtractor.getFlatMapReturnType(words).isGeneric());
  }

}

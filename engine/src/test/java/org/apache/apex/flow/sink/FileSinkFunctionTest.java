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
package org.apache.apex.flow.sink;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.mockito.Mockito;

import org.apache.apex.flow.api.Context.OperatorContext;
import org.apache.apex.flow.common.util.Pair;

public class FileSinkFunctionTest
{
  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  private static OperatorContext context(long flushIntervalMillis, int parallelism, int instanceIndex)
  {
    OperatorContext context = Mockito.mock(OperatorContext.class);
    Mockito.when(context.getValue(OperatorContext.FLUSH_INTERVAL_MILLIS)).thenReturn(flushIntervalMillis);
    Mockito.when(context.getValue(OperatorContext.PARALLELISM)).thenReturn(parallelism);
    Mockito.when(context.getInstanceIndex()).thenReturn(instanceIndex);
    return context;
  }

  private static List<String> lines(File file) throws Exception
  {
    return Files.readAllLines(file.toPath(), StandardCharsets.UTF_8);
  }

  @Test
  public void testFlushAfterEveryRecord() throws Exception
  {
    File file = new File(folder.getRoot(), "nested/dir/out.txt");
    TextFileSinkFunction<Integer> sink = new TextFileSinkFunction<>(file.getPath());
    sink.setup(context(0, 1, 0));
    sink.invoke(1);
    Assert.assertEquals(Collections.singletonList("1"), lines(file));
    sink.invoke(2);
    Assert.assertEquals(Arrays.asList("1", "2"), lines(file));
    sink.teardown();
    Assert.assertEquals(Arrays.asList("1", "2"), lines(file));
  }

  @Test
  public void testBufferedUntilTeardown() throws Exception
  {
    File file = new File(folder.getRoot(), "buffered.txt");
    TextFileSinkFunction<String> sink = new TextFileSinkFunction<>(file.getPath());
    sink.setup(context(3600000L, 1, 0));
    sink.invoke("a");
    sink.invoke("b");
    Assert.assertTrue("buffered", lines(file).isEmpty());
    sink.teardown();
    Assert.assertEquals(Arrays.asList("a", "b"), lines(file));
    sink.teardown();
  }

  @Test
  public void testFilePerInstance() throws Exception
  {
    File directory = new File(folder.getRoot(), "parallel");
    TextFileSinkFunction<String> sink = new TextFileSinkFunction<>(directory.getPath());
    sink.setup(context(0, 2, 1));
    sink.invoke("second");
    sink.teardown();
    Assert.assertTrue(directory.isDirectory());
    Assert.assertEquals(Collections.singletonList("second"), lines(new File(directory, "2")));
    Assert.assertFalse(new File(directory, "1").exists());
  }

  @Test
  public void testCsvColumns() throws Exception
  {
    Assert.assertEquals(Arrays.asList(1, 2), CsvFileSinkFunction.columns(new int[] {1, 2}));
    Assert.assertEquals(Arrays.asList("x", null), CsvFileSinkFunction.columns(Arrays.asList("x", null)));
    Assert.assertEquals(Arrays.asList("k", 3), CsvFileSinkFunction.columns(Pair.of("k", 3)));
    Assert.assertEquals(Collections.singletonList("plain"), CsvFileSinkFunction.columns("plain"));

    File file = new File(folder.getRoot(), "out.csv");
    CsvFileSinkFunction<Object[]> sink = new CsvFileSinkFunction<>(file.getPath());
    sink.setup(context(0, 1, 0));
    sink.invoke(new Object[] {"a", 1, null, 2.5});
    sink.teardown();
    Assert.assertEquals(Collections.singletonList("a,1,,2.5"), lines(file));
  }

  @Test
  public void testNullPath()
  {
    try {
      new TextFileSinkFunction<String>(null);
      Assert.fail("null path");
    } catch (NullPointerException ex) {
      Assert.assertEquals("Path must not be null.", ex.getMessage());
    }
  }

}

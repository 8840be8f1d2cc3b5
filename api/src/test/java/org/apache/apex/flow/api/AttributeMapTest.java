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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

import org.junit.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.apache.apex.flow.api.Attribute.AttributeMap.DefaultAttributeMap;
import org.apache.apex.flow.api.Context.GraphContext;
import org.apache.apex.flow.api.Context.OperatorContext;
import org.apache.apex.flow.api.StringCodec.Builtin;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class AttributeMapTest
{
  @Test
  public void testGetAttributes()
  {
    Set<Attribute<Object>> result = AttributeRegistry.getAttributes(GraphContext.class);
    assertTrue("Identity of Interface", GraphContext.serialVersionUID != 0);
    List<String> names = new ArrayList<>();
    for (Attribute<Object> attribute : result) {
      logger.debug("{}", attribute);
      assertTrue(attribute.getLongName(), attribute.getLongName().startsWith(Context.ATTRIBUTE_PREFIX));
      names.add(attribute.getSimpleName());
    }
    assertEquals(Arrays.asList("APPLICATION_NAME", "DEFAULT_PARALLELISM", "CLOSURE_CLEANING", "CHECK_SERIALIZABLE"), names);
    assertTrue("not a context", AttributeRegistry.getAttributes(String.class).isEmpty());
  }

  @Test
  public void testNames()
  {
    assertTrue("Identity of Interface", OperatorContext.serialVersionUID != 0);
    assertEquals("PARALLELISM", OperatorContext.PARALLELISM.getSimpleName());
    assertEquals("apex.flow.default.parallelism", GraphContext.DEFAULT_PARALLELISM.getLongName());
    assertEquals("apex.flow.flush.interval.millis", OperatorContext.FLUSH_INTERVAL_MILLIS.getLongName());
    assertNotEquals(OperatorContext.PARALLELISM, GraphContext.DEFAULT_PARALLELISM);
  }

  @Test
  public void testUnregisteredAttribute()
  {
    Attribute<Integer> loose = new Attribute<>(5);
    assertNull(loose.getCodec());
    assertNotEquals(loose, new Attribute<>(5));
    try {
      loose.getSimpleName();
      fail("unregistered attribute has no name");
    } catch (IllegalStateException ex) {
      assertTrue(ex.getMessage(), ex.getMessage().contains("not registered"));
    }
  }

  @Test
  public void testCodecs()
  {
    assertTrue("Identity of Interface", GraphContext.serialVersionUID != 0);
    assertSame("from the default value", Builtin.INTEGER, GraphContext.DEFAULT_PARALLELISM.getCodec());
    assertSame("from the default value", Builtin.LONG, OperatorContext.FLUSH_INTERVAL_MILLIS.getCodec());
    assertSame("declared", Builtin.INTEGER, OperatorContext.PARALLELISM.getCodec());
    assertEquals(Integer.valueOf(3), GraphContext.DEFAULT_PARALLELISM.getCodec().fromString(" 3 "));
    assertFalse(GraphContext.CLOSURE_CLEANING.getCodec().fromString("FALSE"));
    assertEquals(" name ", Builtin.STRING.fromString(" name "));
    assertNull("no codec for the type", Builtin.forType(Double.class));
    for (String invalid : new String[] {"yes", "", "1"}) {
      try {
        Builtin.BOOLEAN.fromString(invalid);
        fail("boolean " + invalid);
      } catch (IllegalArgumentException ex) {
        assertTrue(ex.getMessage(), ex.getMessage().contains(invalid));
      }
    }
    try {
      Builtin.LONG.fromString("ten");
      fail("long");
    } catch (IllegalArgumentException ex) {
      assertTrue(ex.getMessage(), ex.getMessage().contains("ten"));
    }
  }

  @Test
  public void testDefaultAttributeMap()
  {
    DefaultAttributeMap map = new DefaultAttributeMap();
    assertNull(map.get(OperatorContext.PARALLELISM));
    assertFalse(map.contains(OperatorContext.PARALLELISM));
    assertNull(map.put(OperatorContext.PARALLELISM, 2));
    assertTrue(map.contains(OperatorContext.PARALLELISM));
    assertEquals(Integer.valueOf(2), map.put(OperatorContext.PARALLELISM, 3));
    assertEquals(Integer.valueOf(3), map.get(OperatorContext.PARALLELISM));
    assertFalse(map.contains(GraphContext.DEFAULT_PARALLELISM));
  }

  private static final Logger logger = LoggerFactory.getLogger(AttributeMapTest.class);
}

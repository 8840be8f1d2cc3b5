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
package org.apache.apex.flow.common.util;

import org.junit.After;
import org.junit.Assert;
import org.junit.Test;

public class PropertiesHelperTest
{
  private static final String PROPERTY = "apex.flow.test.property";

  @After
  public void clearProperty()
  {
    System.clearProperty(PROPERTY);
  }

  @Test
  public void testGetLong()
  {
    Assert.assertEquals(5L, PropertiesHelper.getLong(PROPERTY, 5L, 0, 100));
    System.setProperty(PROPERTY, " 42 ");
    Assert.assertEquals(42L, PropertiesHelper.getLong(PROPERTY, 5L, 0, 100));
    System.setProperty(PROPERTY, "0x10");
    Assert.assertEquals(16L, PropertiesHelper.getLong(PROPERTY, 5L, 0, 100));
    System.setProperty(PROPERTY, "101");
    Assert.assertEquals(5L, PropertiesHelper.getLong(PROPERTY, 5L, 0, 100));
    System.setProperty(PROPERTY, "many");
    Assert.assertEquals(5L, PropertiesHelper.getLong(PROPERTY, 5L, 0, 100));
  }

  @Test
  public void testGetBoolean()
  {
    Assert.assertTrue(PropertiesHelper.getBoolean(PROPERTY, true));
    System.setProperty(PROPERTY, "FALSE");
    Assert.assertFalse(PropertiesHelper.getBoolean(PROPERTY, true));
    System.setProperty(PROPERTY, "yes");
    Assert.assertTrue(PropertiesHelper.getBoolean(PROPERTY, true));
  }

}

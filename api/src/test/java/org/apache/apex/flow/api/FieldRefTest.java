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

import org.junit.Assert;
import org.junit.Test;

public class FieldRefTest
{
  @Test
  public void testOf()
  {
    FieldRef position = FieldRef.of(2);
    Assert.assertTrue(position.isPosition());
    Assert.assertEquals(2, position.getPosition());

    FieldRef expression = FieldRef.of(" user.name ");
    Assert.assertFalse(expression.isPosition());
    Assert.assertEquals("user.name", expression.getExpression());
    Assert.assertSame(expression, FieldRef.of(expression));
  }

  @Test
  public void testInvalidFields()
  {
    for (Object field : new Object[] {null, 1.5, 3L, (short)1, (byte)1, 'c', new Object()}) {
      try {
        FieldRef.of(field);
        Assert.fail("field " + field);
      } catch (IllegalArgumentException ex) {
        Assert.assertTrue(ex.getMessage(), ex.getMessage().startsWith(FieldRef.INVALID_FIELD_MESSAGE));
      }
    }
    try {
      FieldRef.of(-1);
      Assert.fail("negative position");
    } catch (IllegalArgumentException ex) {
      Assert.assertTrue(ex.getMessage(), ex.getMessage().contains("negative"));
    }
    try {
      FieldRef.of("  ");
      Assert.fail("blank expression");
    } catch (IllegalArgumentException ex) {
      Assert.assertNotNull(ex.getMessage());
    }
  }

  @Test
  public void testAccessorsOfOtherKind()
  {
    try {
      FieldRef.position(0).getExpression();
      Assert.fail();
    } catch (IllegalStateException ex) {
      Assert.assertNotNull(ex.getMessage());
    }
    try {
      FieldRef.expression("a").getPosition();
      Assert.fail();
    } catch (IllegalStateException ex) {
      Assert.assertNotNull(ex.getMessage());
    }
    Assert.assertNotEquals(FieldRef.position(0), FieldRef.expression("0"));
    Assert.assertEquals("#3", FieldRef.position(3).toString());
  }

}

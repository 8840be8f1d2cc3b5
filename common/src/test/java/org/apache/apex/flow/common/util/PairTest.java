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

import org.junit.Assert;
import org.junit.Test;

public class PairTest
{
  @Test
  public void testPositions()
  {
    Pair<String, Integer> pair = Pair.of("a", 1);
    Assert.assertEquals("a", pair.get(0));
    Assert.assertEquals(1, pair.get(1));
    Assert.assertEquals(Pair.of("a", 5), pair.with(1, 5));
    Assert.assertEquals(Pair.of("b", 1), pair.with(0, "b"));
    Assert.assertEquals(Pair.of("a", 1), pair);
  }

  @Test(expected = IndexOutOfBoundsException.class)
  public void testInvalidPosition()
  {
    Pair.of(null, null).get(2);
  }

}

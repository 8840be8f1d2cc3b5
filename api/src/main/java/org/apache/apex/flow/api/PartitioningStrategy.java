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

import java.io.Serializable;
import java.util.Collections;
import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import org.apache.apex.flow.api.function.KeySelector;

/**
 * Describes how the records of a stream are distributed over the parallel instances of the operator
 * consuming it. Keyed strategies carry the key selector used for routing; grouping strategies, created by
 * {@link DataStream#groupBy}, additionally make the following reduce and aggregation operate per key.
 *
 * @since 1.0.0
 */
public final class PartitioningStrategy implements Serializable
{
  public enum Kind
  {
    /**
     * Records with the same key, as returned by a user key selector, go to the same instance.
     */
    KEY_SELECTOR,
    /**
     * Records with the same values at the selected fields go to the same instance.
     */
    FIELDS,
    /**
     * Every record goes to every instance.
     */
    BROADCAST,
    /**
     * Records go to a randomly chosen instance.
     */
    SHUFFLE,
    /**
     * Records stay with the local instance of the consumer whenever possible.
     */
    FORWARD,
    /**
     * Records are distributed evenly, round robin.
     */
    DISTRIBUTE,
    /**
     * No strategy was attached; the runtime chooses.
     */
    NONE
  }

  public static final PartitioningStrategy NONE = new PartitioningStrategy(Kind.NONE, null, Collections.<FieldRef>emptyList(), false);

  private final Kind kind;
  private final KeySelector<?, ?> keySelector;
  private final List<FieldRef> fields;
  private final boolean grouping;

  private PartitioningStrategy(Kind kind, KeySelector<?, ?> keySelector, List<FieldRef> fields, boolean grouping)
  {
    this.kind = kind;
    this.keySelector = keySelector;
    this.fields = fields;
    this.grouping = grouping;
  }

  public static PartitioningStrategy byKey(KeySelector<?, ?> keySelector, boolean grouping)
  {
    Preconditions.checkNotNull(keySelector, "Key selector must not be null.");
    return new PartitioningStrategy(Kind.KEY_SELECTOR, keySelector, Collections.<FieldRef>emptyList(), grouping);
  }

  /**
   * @param fields the fields the key consists of
   * @param keySelector selector extracting the values of the fields
   * @param grouping whether the strategy groups the stream
   * @return fields based strategy
   */
  public static PartitioningStrategy byFields(List<FieldRef> fields, KeySelector<?, ?> keySelector, boolean grouping)
  {
    Preconditions.checkArgument(fields != null && !fields.isEmpty(), "At least one field is required");
    Preconditions.checkNotNull(keySelector, "Key selector must not be null.");
    return new PartitioningStrategy(Kind.FIELDS, keySelector, ImmutableList.copyOf(fields), grouping);
  }

  public static PartitioningStrategy broadcast()
  {
    return new PartitioningStrategy(Kind.BROADCAST, null, Collections.<FieldRef>emptyList(), false);
  }

  public static PartitioningStrategy shuffle()
  {
    return new PartitioningStrategy(Kind.SHUFFLE, null, Collections.<FieldRef>emptyList(), false);
  }

  public static PartitioningStrategy forward()
  {
    return new PartitioningStrategy(Kind.FORWARD, null, Collections.<FieldRef>emptyList(), false);
  }

  public static PartitioningStrategy distribute()
  {
    return new PartitioningStrategy(Kind.DISTRIBUTE, null, Collections.<FieldRef>emptyList(), false);
  }

  public Kind getKind()
  {
    return kind;
  }

  /**
   * @return the key selector of a keyed strategy, null otherwise
   */
  public KeySelector<?, ?> getKeySelector()
  {
    return keySelector;
  }

  public List<FieldRef> getFields()
  {
    return fields;
  }

  public boolean isKeyed()
  {
    return keySelector != null;
  }

  public boolean isGrouping()
  {
    return grouping;
  }

  @Override
  public String toString()
  {
    StringBuilder sb = new StringBuilder(kind.name());
    if (!fields.isEmpty()) {
      sb.append(fields);
    }
    if (grouping) {
      sb.append("(grouping)");
    }
    return sb.toString();
  }

  private static final long serialVersionUID = 201810181512L;
}

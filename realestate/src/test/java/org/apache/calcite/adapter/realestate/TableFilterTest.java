/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.calcite.adapter.realestate;

import com.google.common.collect.ImmutableMap;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link TableFilter}.
 */
@Tag("unit")
public class TableFilterTest {

  private final TierResult multiple = TierResult.multiple(
      ImmutableMap.of("x", Fixtures.table(2), "y", Fixtures.table(3)));

  @Test void testNoKeyPassesPayloadThrough() {
    assertSame(multiple, TableFilter.apply(multiple, null));
    TierResult single = TierResult.single(Fixtures.table(1));
    assertSame(single, TableFilter.apply(single, null));
  }

  @Test void testKeySelectsSingleTable() {
    TierResult filtered = TableFilter.apply(multiple, "y");

    assertTrue(filtered.isSingle());
    assertEquals(3, filtered.asSingle().getTable().rowCount());
  }

  @Test void testContains() {
    assertTrue(TableFilter.contains(multiple, "x"));
    assertFalse(TableFilter.contains(multiple, "z"));
    assertTrue(TableFilter.contains(TierResult.single(Fixtures.table(1)), null));
    assertFalse(TableFilter.contains(TierResult.single(Fixtures.table(1)), "x"));
  }

  @Test void testSelectingFromSinglePayloadFails() {
    assertThrows(IllegalArgumentException.class,
        () -> TableFilter.apply(TierResult.single(Fixtures.table(1)), "x"));
  }

  @Test void testKeyedWrapsLoneTable() {
    TierResult keyed = TableFilter.keyed(TierResult.single(Fixtures.table(2)), "x", true);

    assertFalse(keyed.isSingle());
    assertTrue(keyed.asMultiple().contains("x"));
    TierResult single = TierResult.single(Fixtures.table(2));
    assertSame(single, TableFilter.keyed(single, "x", false));
    assertSame(single, TableFilter.keyed(single, null, true));
  }
}

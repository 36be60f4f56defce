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
package org.panelkit.etl;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for TableJoiner.
 */
@Tag("unit")
public class TableJoinerTest {

  private static Table calendar() {
    return Table.builder("calendar", Arrays.asList("gvkey", "year"))
        .row("001004", 2015)
        .row("001004", 2016)
        .row("001004", 2017)
        .build();
  }

  @Test void testLeftRowsArePreserved() {
    Table funda = Table.builder("funda", Arrays.asList("gvkey", "fyear", "at"))
        .row("001004", 2015L, 100.0)
        .row("001004", 2017.0, 300.0)
        .row("009999", 2015L, 1.0)
        .build();
    Table joined = new TableJoiner().leftJoin(calendar(), funda,
        Arrays.asList("gvkey", "year"), Arrays.asList("gvkey", "fyear"), "panel");
    assertEquals("panel", joined.getName());
    assertEquals(Arrays.asList("gvkey", "year", "at"), joined.getColumns());
    assertEquals(Arrays.<Object>asList(100.0, null, 300.0), joined.column("at"));
  }

  @Test void testCollidingColumnIsSuffixed() {
    Table left = Table.builder("forecasts", Arrays.asList("ticker", "value"))
        .row("IBM", 12.0)
        .build();
    Table right = Table.builder("actuals", Arrays.asList("ticker", "value"))
        .row("IBM", 13.0)
        .build();
    Table joined = new TableJoiner().leftJoin(left, right, Arrays.asList("ticker"),
        Arrays.asList("ticker"), "joined");
    assertEquals(Arrays.asList("ticker", "value", "value_actuals"), joined.getColumns());
    assertEquals(13.0, joined.getRows().get(0).get("value_actuals"));
  }

  @Test void testNonUniqueRightSideIsRejected() {
    Table right = Table.builder("funda", Arrays.asList("gvkey", "fyear", "at"))
        .row("001004", 2015, 100.0)
        .row("001004", 2015, 101.0)
        .build();
    assertThrows(UniquenessViolationException.class,
        () -> new TableJoiner().leftJoin(calendar(), right,
            Arrays.asList("gvkey", "year"), Arrays.asList("gvkey", "fyear"), "panel"));
  }

  @Test void testMissingLeftKeyNeverMatches() {
    Table left = Table.builder("l", Arrays.asList("k")).row((Object) null).build();
    Table right = Table.builder("r", Arrays.asList("k", "v")).row("x", 1).build();
    Table joined = new TableJoiner().leftJoin(left, right, Arrays.asList("k"),
        Arrays.asList("k"), "j");
    assertEquals(1, joined.size());
    assertNull(joined.getRows().get(0).get("v"));
  }

  @Test void testKeyArityMismatch() {
    assertThrows(IllegalArgumentException.class,
        () -> new TableJoiner().leftJoin(calendar(), calendar(), Arrays.asList("gvkey"),
            Arrays.asList("gvkey", "year"), "j"));
  }
}

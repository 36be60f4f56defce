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

import org.panelkit.etl.expr.Filters;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for FilterStage.
 */
@Tag("unit")
public class FilterStageTest {

  private static Table funda() {
    return Table.builder("funda", Arrays.asList("gvkey", "fyear", "indfmt", "at"))
        .row("001004", 2015L, "INDL", 1500.0)
        .row("001004", 2015L, "FS", 1400.0)
        .row("001013", 1965L, "INDL", 12.0)
        .row(null, 2016L, "INDL", 30.0)
        .build();
  }

  @Test void testFilterAndProject() {
    Table result = new FilterStage().apply(funda(),
        Filters.and(Filters.eq("indfmt", "INDL"), Filters.between("fyear", 1970, 2020),
            Filters.requireNonMissing("gvkey")),
        Arrays.asList("gvkey", "at"), "fundamentals");
    assertEquals("fundamentals", result.getName());
    assertEquals(Arrays.asList("gvkey", "at"), result.getColumns());
    assertEquals(1, result.size());
    assertEquals(1500.0, result.getRows().get(0).get("at"));
  }

  @Test void testEmptyProjectionKeepsAllColumns() {
    Table result = new FilterStage().apply(funda(), null, Collections.<String>emptyList(), "all");
    assertEquals(funda().getColumns(), result.getColumns());
    assertEquals(4, result.size());
  }

  @Test void testUnknownFilterColumnFailsBeforeReading() {
    SchemaException e = assertThrows(SchemaException.class,
        () -> new FilterStage().apply(funda(), Filters.eq("datafmt", "STD")));
    assertEquals(Collections.singletonList("datafmt"), e.getUnknownColumns());
    assertTrue(e.getStage().startsWith("filter:"));
  }

  @Test void testUnknownProjectionColumn() {
    assertThrows(SchemaException.class,
        () -> new FilterStage().project(funda(), Arrays.asList("gvkey", "ceq")));
  }

  @Test void testOutputIsIndependentOfInputRowLayout() {
    Table reordered = Table.builder("funda", Arrays.asList("at", "indfmt", "fyear", "gvkey"))
        .row(1500.0, "INDL", 2015L, "001004")
        .build();
    Table result = new FilterStage().project(reordered, Arrays.asList("gvkey", "fyear"));
    assertEquals(Arrays.asList("gvkey", "fyear"), result.getColumns());
    assertEquals("001004", result.getRows().get(0).get("gvkey"));
  }
}

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

import org.panelkit.etl.expr.DerivedField;
import org.panelkit.etl.expr.FallbackChain;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for MergeEngine.
 */
@Tag("unit")
public class MergeEngineTest {

  private static final List<DerivedField> BOOK_EQUITY = Arrays.asList(
      new DerivedField("pref",
          FallbackChain.of(Arrays.asList("pstkrv", "pstkl", "pstk"), 0)),
      new DerivedField("book_equity",
          FallbackChain.of(Arrays.asList("seq", "ceq + pstk", "at - lt - mib"), null)),
      DerivedField.of("be", "book_equity + coalesce(txditc, 0) - pref"));

  private static Table funda() {
    return Table.builder("funda", Arrays.asList("gvkey", "fyear", "seq", "ceq", "pstk",
            "pstkrv", "pstkl", "at", "lt", "mib", "txditc"))
        .row("A", 2015L, 500.0, null, null, 20.0, null, null, null, null, 5.0)
        .row("B", 2015L, null, 100.0, 10.0, null, null, 900.0, 300.0, 0.0, null)
        .row("C", 2015L, null, null, null, null, null, null, null, null, null)
        .build();
  }

  @Test void testDerivedFieldsChainInOrder() {
    StageContext context = StageContext.sequential();
    Table result = new MergeEngine(context).derive(funda(), BOOK_EQUITY);

    assertEquals(Arrays.asList("pref", "book_equity", "be"),
        result.getColumns().subList(result.getColumns().size() - 3, result.getColumns().size()));
    assertEquals(Arrays.<Object>asList(20.0, 10.0, 0.0), result.column("pref"));
    assertEquals(Arrays.<Object>asList(500.0, 110.0, null), result.column("book_equity"));
    assertEquals(485.0, result.getRows().get(0).get("be"));
    assertEquals(100.0, result.getRows().get(1).get("be"));
    assertNull(result.getRows().get(2).get("be"));
    assertEquals(2L, context.getDiagnostics().count(DiagnosticSummary.Condition.MISSING_OPERAND));
  }

  @Test void testUnknownColumnFailsBeforeAnyRow() {
    SchemaException e = assertThrows(SchemaException.class,
        () -> new MergeEngine(StageContext.sequential()).derive(funda(),
            Collections.singletonList(DerivedField.of("x", "seq + pstkrv2"))));
    assertEquals(Collections.singletonList("pstkrv2"), e.getUnknownColumns());
  }

  @Test void testLaterFieldMayNotReadUndeclaredField() {
    assertThrows(SchemaException.class,
        () -> new MergeEngine(StageContext.sequential()).derive(funda(), Arrays.asList(
            DerivedField.of("be", "book_equity - 1"),
            DerivedField.of("book_equity", "seq"))));
  }

  @Test void testMergeKeepsSpine() {
    Table calendar = Table.builder("calendar", Arrays.asList("gvkey", "year"))
        .row("A", 2014)
        .row("A", 2015)
        .row("B", 2015)
        .build();
    Table merged = new MergeEngine(StageContext.sequential()).merge(calendar,
        Collections.singletonList(MergeEngine.JoinStep.of(funda(),
            Arrays.asList("gvkey", "year"), Arrays.asList("gvkey", "fyear"))),
        "firm_years");
    assertEquals("firm_years", merged.getName());
    assertEquals(3, merged.size());
    assertEquals(Arrays.<Object>asList(null, 500.0, null), merged.column("seq"));
  }
}

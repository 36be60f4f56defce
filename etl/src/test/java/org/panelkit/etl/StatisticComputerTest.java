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
import org.panelkit.etl.expr.ExpressionParser;
import org.panelkit.etl.expr.ValueExpression;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

/**
 * Tests for StatisticComputer.
 */
@Tag("unit")
public class StatisticComputerTest {

  private static Table panel() {
    return Table.builder("panel", Arrays.asList("gvkey", "be", "prcc_f", "csho"))
        .row("A", 100.0, -20.0, 10L)
        .row("B", 50.0, 0.0, 10L)
        .row("C", null, 5.0, 2L)
        .build();
  }

  @Test void testBookToMarket() {
    Map<String, Object> config = new LinkedHashMap<String, Object>();
    config.put("market_equity", "abs(prcc_f) * csho");
    config.put("book_to_market", "ratio(be, market_equity)");
    List<DerivedField> statistics = StatisticComputer.fromConfig(config);

    StageContext context = StageContext.sequential();
    Table result = new StatisticComputer(context).compute(panel(), statistics);
    assertEquals(Arrays.<Object>asList(200.0, 0.0, 10.0), result.column("market_equity"));
    assertEquals(0.5, result.getRows().get(0).get("book_to_market"));
    // zero market equity divides by 1
    assertEquals(50.0, result.getRows().get(1).get("book_to_market"));
    assertNull(result.getRows().get(2).get("book_to_market"));
    assertEquals(1L, context.getDiagnostics().count(DiagnosticSummary.Condition.MISSING_OPERAND));
  }

  @Test void testStrictDivisionLeavesZeroDenominatorMissing() {
    Map<String, Object> config = new LinkedHashMap<String, Object>();
    config.put("market_equity", "abs(prcc_f) * csho");
    config.put("book_to_market", "be / market_equity");
    List<DerivedField> statistics = StatisticComputer.fromConfig(config);

    StageContext context = StageContext.sequential();
    Table result = new StatisticComputer(context).compute(panel(), statistics);
    assertEquals(0.5, result.getRows().get(0).get("book_to_market"));
    assertNull(result.getRows().get(1).get("book_to_market"));
    assertNull(result.getRows().get(2).get("book_to_market"));
    assertEquals(2L, context.getDiagnostics().count(DiagnosticSummary.Condition.MISSING_OPERAND));
  }

  @Test void testZeroAdjustmentFactorIsNeutral() {
    Table prices = Table.builder("prices", Arrays.asList("prc", "cfacshr"))
        .row(-40.0, 0.0)
        .row(-40.0, 2.0)
        .build();
    Map<String, ValueExpression> statistics = new LinkedHashMap<String, ValueExpression>();
    statistics.put("price", ExpressionParser.parse("adj(abs(prc), cfacshr)"));
    Table result = new StatisticComputer(StageContext.sequential()).compute(prices, statistics);
    assertEquals(Arrays.<Object>asList(40.0, 20.0), result.column("price"));
  }
}

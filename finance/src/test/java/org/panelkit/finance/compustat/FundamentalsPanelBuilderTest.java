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
package org.panelkit.finance.compustat;

import org.panelkit.etl.DiagnosticSummary;
import org.panelkit.etl.SchemaException;
import org.panelkit.etl.StageContext;
import org.panelkit.etl.Table;
import org.panelkit.etl.UniquenessViolationException;
import org.panelkit.etl.expr.DerivedField;
import org.panelkit.etl.expr.Filters;
import org.panelkit.finance.FinanceSources;
import org.panelkit.finance.PanelConfig;
import org.panelkit.finance.PanelFixtures;
import org.panelkit.finance.SourceConfig;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.Collections;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for FundamentalsPanelBuilder.
 */
@Tag("unit")
public class FundamentalsPanelBuilderTest {

  private static Table build(PanelConfig config, StageContext context) {
    return new FundamentalsPanelBuilder(config, context).build(PanelFixtures.fundamentals());
  }

  @Test void testOneRowPerFirmYearWithGapsFilled() {
    Table panel = build(PanelFixtures.config(1), StageContext.sequential());

    assertEquals("firm_years", panel.getName());
    assertEquals(Arrays.<Object>asList("A", "A", "A", "A", "B"), panel.column("gvkey"));
    assertEquals(Arrays.<Object>asList(2015, 2016, 2017, 2018, 2016), panel.column("year"));
    assertEquals(Arrays.<Object>asList(2015, 2015, 2015, 2015, 2016), panel.column("year_min"));
    assertEquals(Arrays.<Object>asList(2018, 2018, 2018, 2018, 2016), panel.column("year_max"));

    Map<String, Object> gap = panel.getRows().get(2);
    assertNull(gap.get("datadate"));
    assertNull(gap.get("be"));
    assertNull(gap.get("book_to_market"));
  }

  @Test void testLatestStatementWinsWithinFiscalYear() {
    StageContext context = StageContext.sequential();
    Table panel = build(PanelFixtures.config(1), context);

    Map<String, Object> restated = panel.getRows().get(1);
    assertEquals(LocalDate.of(2016, 12, 31), restated.get("datadate"));
    assertEquals(600.0, restated.get("seq"));
    assertEquals(1L,
        context.getDiagnostics().count(DiagnosticSummary.Condition.DUPLICATE_DROPPED));
  }

  @Test void testBookEquityAndBookToMarket() {
    Table panel = build(PanelFixtures.config(1), StageContext.sequential());

    assertEquals(Arrays.<Object>asList(20.0, 0.0, 0.0, 0.0, 10.0), panel.column("pref"));
    assertEquals(Arrays.<Object>asList(485.0, 600.0, null, 700.0, 100.0), panel.column("be"));
    assertEquals(Arrays.<Object>asList(1000.0, 1200.0, null, 1000.0, 0.0),
        panel.column("market_equity"));
    // B has a zero market value, which divides by 1
    assertEquals(Arrays.<Object>asList(0.485, 0.5, null, 0.7, 100.0),
        panel.column("book_to_market"));
  }

  @Test void testSamplePeriodRestrictsYears() {
    PanelConfig config = PanelConfig.builder().startYear(2016).endYear(2016).build();
    Table panel = build(config, StageContext.sequential());
    assertEquals(Arrays.<Object>asList("A", "B"), panel.column("gvkey"));
    assertEquals(Arrays.<Object>asList(2016, 2016), panel.column("year"));
  }

  @Test void testConfiguredFilterStaysInSamplePeriod() {
    PanelConfig config = PanelConfig.builder()
        .startYear(2015)
        .endYear(2015)
        .source(FinanceSources.FUNDAMENTALS, SourceConfig.builder()
            .filter(Filters.eq("indfmt", "INDL"))
            .build())
        .build();
    Table panel = build(config, StageContext.sequential());
    assertEquals(Collections.<Object>singletonList("A"), panel.column("gvkey"));
    assertEquals(Collections.<Object>singletonList(2015), panel.column("year"));
  }

  @Test void testDuplicateStatementDateFails() {
    Table.Builder builder = Table.builder("fundamentals",
        FinanceSources.FUNDAMENTALS.schema().getColumnNames());
    for (Map<String, Object> row : PanelFixtures.fundamentals().getRows()) {
      builder.add(row);
    }
    builder.add(PanelFixtures.fundamentals().getRows().get(0));
    Table fundamentals = builder.build();
    UniquenessViolationException e = assertThrows(UniquenessViolationException.class,
        () -> new FundamentalsPanelBuilder(PanelFixtures.config(1), StageContext.sequential())
            .build(fundamentals));
    assertEquals("firm_years:fundamentals", e.getStage());
    assertEquals(Integer.valueOf(2),
        e.getDuplicates().get(Arrays.<Object>asList("A", LocalDate.of(2015, 12, 31))));
  }

  @Test void testUnknownStatisticColumnFails() {
    PanelConfig config = PanelConfig.builder()
        .statistics(Collections.singletonList(DerivedField.of("leverage", "lt / atq")))
        .build();
    SchemaException e = assertThrows(SchemaException.class,
        () -> build(config, StageContext.sequential()));
    assertEquals(Collections.singletonList("atq"), e.getUnknownColumns());
  }

  @Test void testStageCounts() {
    FundamentalsPanelBuilder builder =
        new FundamentalsPanelBuilder(PanelFixtures.config(1), StageContext.sequential());
    builder.build(PanelFixtures.fundamentals());
    Map<String, Integer> counts = builder.getStageCounts();
    assertEquals(7, counts.get("firm_years.input"));
    assertEquals(5, counts.get("firm_years.filter"));
    assertEquals(4, counts.get("firm_years.dedup"));
    assertEquals(5, counts.get("firm_years.calendar"));
    assertEquals(5, counts.get("firm_years"));
  }
}

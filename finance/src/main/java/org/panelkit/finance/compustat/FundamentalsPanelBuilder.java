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

import org.panelkit.etl.CalendarBuilder;
import org.panelkit.etl.Deduplicator;
import org.panelkit.etl.MergeEngine;
import org.panelkit.etl.SortKey;
import org.panelkit.etl.StageContext;
import org.panelkit.etl.StatisticComputer;
import org.panelkit.etl.Table;
import org.panelkit.finance.FinanceSources;
import org.panelkit.finance.PanelConfig;
import org.panelkit.finance.SourceFilter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the firm-year fundamentals panel.
 *
 * <ol>
 *   <li>Filter the fundamentals, check them against their declared key
 *       (gvkey, datadate) and project them.</li>
 *   <li>Keep the latest statement per (gvkey, fyear) by datadate.</li>
 *   <li>Expand each firm's fiscal-year span into a gapless calendar and
 *       left-join the statements onto it.</li>
 *   <li>Evaluate the fallback chains (preferred stock, book equity, be).</li>
 *   <li>Compute the statistics (market equity, book-to-market).</li>
 * </ol>
 *
 * <p>The output has one row per (gvkey, year), sorted by both.
 */
public class FundamentalsPanelBuilder {

  private static final Logger LOGGER = LoggerFactory.getLogger(FundamentalsPanelBuilder.class);

  /** Name of the produced table. */
  public static final String OUTPUT = "firm_years";

  static final List<String> FIRM_YEAR = Arrays.asList("gvkey", "fyear");

  private final PanelConfig config;
  private final StageContext context;
  private final Map<String, Integer> stageCounts = new LinkedHashMap<String, Integer>();

  public FundamentalsPanelBuilder(PanelConfig config, StageContext context) {
    this.config = config;
    this.context = context;
  }

  /**
   * Builds the panel.
   *
   * @param fundamentals Raw fundamentals table
   * @return Firm-year panel
   */
  public Table build(Table fundamentals) {
    LOGGER.info("Building firm-year panel from {} fundamentals rows", fundamentals.size());
    stageCounts.put(OUTPUT + ".input", fundamentals.size());

    Table filtered = new SourceFilter(config).apply(fundamentals,
        FinanceSources.FUNDAMENTALS, OUTPUT);
    filtered.requireColumns(OUTPUT, "gvkey", "fyear", "datadate");
    stageCounts.put(OUTPUT + ".filter", filtered.size());

    Table latest = new Deduplicator(context).keepLast(filtered, FIRM_YEAR,
        Collections.singletonList(SortKey.asc("datadate")));
    Deduplicator.requireUnique(latest, FIRM_YEAR, OUTPUT + ":dedup");
    stageCounts.put(OUTPUT + ".dedup", latest.size());

    Table calendar = CalendarBuilder.builder()
        .idColumn("gvkey")
        .dateColumn("fyear")
        .outputName("calendar")
        .build()
        .build(latest, context);
    stageCounts.put(OUTPUT + ".calendar", calendar.size());

    MergeEngine engine = new MergeEngine(context);
    Table merged = engine.merge(calendar,
        Collections.singletonList(MergeEngine.JoinStep.of(latest,
            Arrays.asList("gvkey", "year"), FIRM_YEAR)),
        OUTPUT);
    Table derived = engine.derive(merged, config.getFallbacks());
    Table panel = new StatisticComputer(context).compute(derived, config.getStatistics())
        .sortBy(SortKey.ascending(Arrays.asList("gvkey", "year")));
    Deduplicator.requireUnique(panel, Arrays.asList("gvkey", "year"), OUTPUT);
    stageCounts.put(OUTPUT, panel.size());

    LOGGER.info("Firm-year panel: {} firm-years, {} years filled in without a statement",
        panel.size(), calendar.size() - latest.size());
    return panel;
  }

  /**
   * Returns the row count after each stage of the last build.
   */
  public Map<String, Integer> getStageCounts() {
    return Collections.unmodifiableMap(stageCounts);
  }
}

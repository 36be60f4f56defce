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
package org.panelkit.finance.ibes;

import org.panelkit.etl.Deduplicator;
import org.panelkit.etl.FilterStage;
import org.panelkit.etl.LinkResult;
import org.panelkit.etl.SortKey;
import org.panelkit.etl.StageContext;
import org.panelkit.etl.StatisticComputer;
import org.panelkit.etl.Table;
import org.panelkit.etl.TableJoiner;
import org.panelkit.etl.expr.Filters;
import org.panelkit.finance.FinanceSources;
import org.panelkit.finance.PanelConfig;
import org.panelkit.finance.SourceFilter;
import org.panelkit.finance.SourceTables;
import org.panelkit.finance.crsp.CrspPriceLookup;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the analyst forecast panel: one row per analyst estimate, with the
 * reported actual, the linked permno and the adjusted price at the
 * announcement date.
 *
 * <p>Every source is checked against its declared key after filtering, so
 * duplicated actuals fail at stage {@code forecasts:actuals}. Only the
 * latest estimate an analyst issued for a period no later than the actual
 * was announced is kept. Forecasts for periods without an actual are
 * dropped.
 */
public class AnalystForecastBuilder {

  private static final Logger LOGGER = LoggerFactory.getLogger(AnalystForecastBuilder.class);

  /** Name of the produced table. */
  public static final String OUTPUT = "forecasts";

  /** One estimate per analyst, broker and period. */
  public static final List<String> ESTIMATE_KEY =
      Arrays.asList("ticker", "fpedats", "estimator", "analys");

  private final PanelConfig config;
  private final StageContext context;
  private final FilterStage filterStage = new FilterStage();
  private final SourceFilter sourceFilter;
  private final TableJoiner joiner = new TableJoiner();
  private final Map<String, Integer> stageCounts = new LinkedHashMap<String, Integer>();
  private @Nullable LinkResult linkResult;

  public AnalystForecastBuilder(PanelConfig config, StageContext context) {
    this.config = config;
    this.context = context;
    this.sourceFilter = new SourceFilter(config);
  }

  /**
   * Builds the panel from the forecast, actual, link and price sources.
   */
  public Table build(SourceTables sources) {
    Table forecasts = filter(sources, FinanceSources.FORECASTS);
    forecasts.requireColumns(OUTPUT, "ticker", "fpedats", "estimator", "analys", "anndats",
        "value");
    stageCounts.put(OUTPUT + ".filter", forecasts.size());

    Table actuals = filter(sources, FinanceSources.ACTUALS);
    actuals.requireColumns(OUTPUT, "ticker", "pends", "anndats", "value");
    Map<String, String> renames = new LinkedHashMap<String, String>();
    renames.put("value", "actual");
    renames.put("anndats", "anndats_act");
    Table reported = filterStage.project(actuals,
        Arrays.asList("ticker", "pends", "value", "anndats")).rename(renames);

    Table withActuals = joiner.leftJoin(forecasts, reported,
        Arrays.asList("ticker", "fpedats"), Arrays.asList("ticker", "pends"), OUTPUT);
    Table timely = filterStage.apply(withActuals,
        Filters.compareColumns("anndats", Filters.Operator.LE, "anndats_act"));
    stageCounts.put(OUTPUT + ".actuals", timely.size());
    if (timely.size() < withActuals.size()) {
      LOGGER.info("Dropped {} forecasts without an actual or announced after it",
          withActuals.size() - timely.size());
    }

    Table latest = new Deduplicator(context).keepLast(timely, ESTIMATE_KEY,
        Collections.singletonList(SortKey.asc("anndats")));
    Deduplicator.requireUnique(latest, ESTIMATE_KEY, OUTPUT + ":dedup");
    stageCounts.put(OUTPUT + ".dedup", latest.size());

    linkResult = new TickerPermnoLinker(config.getAcceptedScores())
        .link(filter(sources, FinanceSources.LINKS), context);
    Table mapping = filterStage.project(linkResult.getMapping(),
        Arrays.asList("ticker", "permno"));
    Table linked = joiner.leftJoin(latest, mapping,
        Collections.singletonList("ticker"), Collections.singletonList("ticker"), OUTPUT);

    Table priced = new CrspPriceLookup("anndats", config.getLookback(),
        config.getTieBreakColumn())
        .attach(linked, filter(sources, FinanceSources.PRICES), context);

    Table panel = new StatisticComputer(context)
        .compute(priced, config.getForecastStatistics())
        .withName(OUTPUT)
        .sortBy(SortKey.ascending(ESTIMATE_KEY));
    stageCounts.put(OUTPUT, panel.size());

    LOGGER.info("Analyst forecast panel: {} estimates, {} linked to a permno",
        panel.size(), countPresent(panel, "permno"));
    return panel;
  }

  /**
   * Returns the ticker to permno link result of the last build.
   *
   * @throws IllegalStateException if nothing was built yet
   */
  public LinkResult getLinkResult() {
    if (linkResult == null) {
      throw new IllegalStateException("No forecast panel built yet");
    }
    return linkResult;
  }

  /**
   * Returns the row count after each stage of the last build.
   */
  public Map<String, Integer> getStageCounts() {
    return Collections.unmodifiableMap(stageCounts);
  }

  private Table filter(SourceTables sources, FinanceSources source) {
    return sourceFilter.apply(sources.get(source), source, OUTPUT);
  }

  private static int countPresent(Table table, String column) {
    int n = 0;
    for (Object value : table.column(column)) {
      if (value != null) {
        n++;
      }
    }
    return n;
  }
}

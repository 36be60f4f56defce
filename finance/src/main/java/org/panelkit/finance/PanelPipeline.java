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
package org.panelkit.finance;

import org.panelkit.etl.DiagnosticSummary;
import org.panelkit.etl.LinkResult;
import org.panelkit.etl.StageContext;
import org.panelkit.etl.Table;
import org.panelkit.finance.compustat.FundamentalsPanelBuilder;
import org.panelkit.finance.ibes.AnalystForecastBuilder;
import org.panelkit.finance.ibes.ConsensusBuilder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Runs the configured panels over a set of loaded source tables.
 *
 * <p>Panels produced:
 * <ul>
 *   <li>{@code firm_years} when {@link PanelType#FIRM_YEARS} is selected</li>
 *   <li>{@code forecasts}, {@code ticker_permno} and {@code consensus} when
 *       {@link PanelType#ANALYST_FORECASTS} is selected</li>
 * </ul>
 *
 * <p>A stage that references an unknown column or finds a duplicate key
 * fails the whole run; no partial result is returned. Row-level conditions
 * (ambiguous links, unmatched dates, missing operands, dropped duplicates)
 * become missing values and are counted in the result.
 *
 * <p>Output is a function of the inputs and the configuration only; the
 * configured parallelism does not change it.
 */
public class PanelPipeline {

  private static final Logger LOGGER = LoggerFactory.getLogger(PanelPipeline.class);

  private final PanelConfig config;

  public PanelPipeline(PanelConfig config) {
    this.config = config;
  }

  public PanelConfig getConfig() {
    return config;
  }

  /**
   * Builds every configured panel.
   *
   * @param sources Loaded source tables; must hold every source the
   *     configured panels read
   * @return Output tables and run diagnostics
   */
  public PanelResult run(SourceTables sources) {
    long startTime = System.currentTimeMillis();
    LOGGER.info("Starting panel pipeline '{}' with panels {} (parallelism {})",
        config.getName(), config.getPanels(), config.getParallelism());

    PanelResult.Builder result = PanelResult.builder().pipelineName(config.getName());
    try (StageContext context = StageContext.create(config.getParallelism())) {
      if (config.getPanels().contains(PanelType.FIRM_YEARS)) {
        LOGGER.info("Phase: firm-year panel");
        FundamentalsPanelBuilder builder = new FundamentalsPanelBuilder(config, context);
        result.table(builder.build(sources.get(FinanceSources.FUNDAMENTALS)));
        result.stageCounts(builder.getStageCounts());
      }

      if (config.getPanels().contains(PanelType.ANALYST_FORECASTS)) {
        LOGGER.info("Phase: analyst forecast panel");
        AnalystForecastBuilder builder = new AnalystForecastBuilder(config, context);
        Table forecasts = builder.build(sources);
        LinkResult links = builder.getLinkResult();
        Table consensus = new ConsensusBuilder().build(forecasts, context);
        result.table(forecasts)
            .table(links.getMapping())
            .table(consensus)
            .linkResult(links)
            .stageCounts(builder.getStageCounts());
      }

      Map<DiagnosticSummary.Condition, Long> diagnostics =
          context.getDiagnostics().snapshot();
      result.diagnostics(diagnostics);
      if (!context.getDiagnostics().isClean()) {
        LOGGER.warn("Panel pipeline '{}' absorbed row-level conditions: {}",
            config.getName(), diagnostics);
      }
    }

    PanelResult panelResult = result.elapsedMs(System.currentTimeMillis() - startTime).build();
    LOGGER.info("Panel pipeline '{}' complete: {}", config.getName(), panelResult);
    return panelResult;
  }
}

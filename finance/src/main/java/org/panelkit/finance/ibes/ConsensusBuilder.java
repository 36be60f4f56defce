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

import org.panelkit.etl.Ratios;
import org.panelkit.etl.StageContext;
import org.panelkit.etl.Table;
import org.panelkit.etl.Values;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregates the analyst forecast panel into one consensus row per
 * (ticker, fpedats).
 *
 * <p>Columns: {@code ticker, fpedats, permno, n_analysts, mean_forecast,
 * median_forecast, forecast_dispersion, actual, mean_price,
 * consensus_error}. Dispersion is the sample standard deviation and is
 * missing below two estimates. The consensus error is
 * {@code (actual - mean_forecast) / |mean_price|}, with a zero price
 * treated as 1 and missing when the price is missing.
 */
public class ConsensusBuilder {

  private static final Logger LOGGER = LoggerFactory.getLogger(ConsensusBuilder.class);

  /** Name of the produced table. */
  public static final String OUTPUT = "consensus";

  static final List<String> PERIOD_KEY = Arrays.asList("ticker", "fpedats");

  static final List<String> COLUMNS = Arrays.asList("ticker", "fpedats", "permno",
      "n_analysts", "mean_forecast", "median_forecast", "forecast_dispersion", "actual",
      "mean_price", "consensus_error");

  private final String valueColumn;
  private final String priceColumn;

  public ConsensusBuilder() {
    this("value", "price");
  }

  /**
   * @param valueColumn Column holding each estimate
   * @param priceColumn Column holding the adjusted price per estimate
   */
  public ConsensusBuilder(String valueColumn, String priceColumn) {
    this.valueColumn = valueColumn;
    this.priceColumn = priceColumn;
  }

  /**
   * Builds the consensus table, sorted by (ticker, fpedats).
   */
  public Table build(Table forecasts, StageContext context) {
    forecasts.requireColumns("consensus", "ticker", "fpedats", "permno", "actual",
        valueColumn, priceColumn);
    List<Map<String, Object>> rows = context.getExecutor().apply(forecasts.getRows(),
        PERIOD_KEY, (key, group) -> Collections.singletonList(aggregate(group)));
    Table consensus = Table.of(OUTPUT, COLUMNS, rows);
    LOGGER.info("Consensus: {} periods from {} estimates", consensus.size(), forecasts.size());
    return consensus;
  }

  private Map<String, Object> aggregate(List<Map<String, Object>> group) {
    List<Double> estimates = new ArrayList<Double>();
    List<Double> prices = new ArrayList<Double>();
    Object permno = null;
    Double actual = null;
    for (Map<String, Object> row : group) {
      Double estimate = Values.toDouble(row.get(valueColumn));
      if (estimate != null) {
        estimates.add(estimate);
      }
      Double price = Values.toDouble(row.get(priceColumn));
      if (price != null) {
        prices.add(price);
      }
      if (permno == null && !Values.isMissing(row.get("permno"))) {
        permno = row.get("permno");
      }
      if (actual == null) {
        actual = Values.toDouble(row.get("actual"));
      }
    }

    Double mean = mean(estimates);
    Double meanPrice = mean(prices);
    Double error = Ratios.relativeError(actual, mean, meanPrice);

    Map<String, Object> out = new LinkedHashMap<String, Object>();
    out.put("ticker", group.get(0).get("ticker"));
    out.put("fpedats", group.get(0).get("fpedats"));
    out.put("permno", permno);
    out.put("n_analysts", (long) estimates.size());
    out.put("mean_forecast", mean);
    out.put("median_forecast", median(estimates));
    out.put("forecast_dispersion", standardDeviation(estimates, mean));
    out.put("actual", actual);
    out.put("mean_price", meanPrice);
    out.put("consensus_error", error);
    return out;
  }

  static @Nullable Double mean(List<Double> values) {
    if (values.isEmpty()) {
      return null;
    }
    double sum = 0.0;
    for (double v : values) {
      sum += v;
    }
    return sum / values.size();
  }

  static @Nullable Double median(List<Double> values) {
    if (values.isEmpty()) {
      return null;
    }
    List<Double> sorted = new ArrayList<Double>(values);
    Collections.sort(sorted);
    int mid = sorted.size() / 2;
    return sorted.size() % 2 == 1
        ? sorted.get(mid)
        : (sorted.get(mid - 1) + sorted.get(mid)) / 2.0;
  }

  static @Nullable Double standardDeviation(List<Double> values, @Nullable Double mean) {
    if (values.size() < 2 || mean == null) {
      return null;
    }
    double squares = 0.0;
    for (double v : values) {
      squares += (v - mean) * (v - mean);
    }
    return Math.sqrt(squares / (values.size() - 1));
  }
}

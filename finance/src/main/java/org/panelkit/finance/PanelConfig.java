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

import org.panelkit.etl.LookbackWindow;
import org.panelkit.etl.SourceSchema;
import org.panelkit.etl.StatisticComputer;
import org.panelkit.etl.expr.DerivedField;
import org.panelkit.etl.expr.FallbackChain;
import org.panelkit.etl.expr.FilterExpression;
import org.panelkit.etl.expr.Filters;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Configuration of a panel run.
 *
 * <h3>YAML Configuration Example</h3>
 * <pre>{@code
 * name: crsp-compustat-ibes
 * samplePeriod:
 *   startYear: 1990
 *   endYear: 2020
 * parallelism: 4
 * panels: [firm_years, analyst_forecasts]
 * sources:
 *   prices:
 *     file: crsp_dsf.csv
 * linking:
 *   acceptedScores: [0, 1]
 * matching:
 *   lookback: {length: 5, unit: business_days}
 *   tieBreakColumn: cfacshr
 * fallbacks:
 *   pref: {chain: [pstkrv, pstkl, pstk], default: 0}
 *   book_equity: [seq, "ceq + pstk", "at - lt - mib"]
 *   be: "book_equity + coalesce(txditc, 0) - pref"
 * statistics:
 *   market_equity: "abs(prcc_f) * csho"
 *   book_to_market: "ratio(be, market_equity)"
 * forecastStatistics:
 *   price: "adj(abs(prc), cfacshr)"
 * }</pre>
 *
 * <p>Every key is optional; absent keys take the defaults exposed by the
 * {@code default*} methods.
 */
public class PanelConfig {

  private final String name;
  private final @Nullable Integer startYear;
  private final @Nullable Integer endYear;
  private final int parallelism;
  private final Set<PanelType> panels;
  private final Map<FinanceSources, SourceConfig> sources;
  private final List<Integer> acceptedScores;
  private final LookbackWindow lookback;
  private final @Nullable String tieBreakColumn;
  private final List<DerivedField> fallbacks;
  private final List<DerivedField> statistics;
  private final List<DerivedField> forecastStatistics;

  private PanelConfig(Builder builder) {
    this.name = builder.name;
    this.startYear = builder.startYear;
    this.endYear = builder.endYear;
    this.parallelism = builder.parallelism;
    this.panels = Collections.unmodifiableSet(EnumSet.copyOf(builder.panels));
    this.sources = Collections.unmodifiableMap(
        new EnumMap<FinanceSources, SourceConfig>(builder.sources));
    this.acceptedScores = Collections.unmodifiableList(
        new ArrayList<Integer>(builder.acceptedScores));
    this.lookback = builder.lookback;
    this.tieBreakColumn = builder.tieBreakColumn;
    this.fallbacks = Collections.unmodifiableList(
        new ArrayList<DerivedField>(builder.fallbacks));
    this.statistics = Collections.unmodifiableList(
        new ArrayList<DerivedField>(builder.statistics));
    this.forecastStatistics = Collections.unmodifiableList(
        new ArrayList<DerivedField>(builder.forecastStatistics));
  }

  public String getName() {
    return name;
  }

  public @Nullable Integer getStartYear() {
    return startYear;
  }

  public @Nullable Integer getEndYear() {
    return endYear;
  }

  /**
   * Returns the number of worker threads used for per-group stages.
   */
  public int getParallelism() {
    return parallelism;
  }

  public Set<PanelType> getPanels() {
    return panels;
  }

  /**
   * Returns the settings of a source; an unconfigured source gets empty settings.
   */
  public SourceConfig getSource(FinanceSources source) {
    SourceConfig config = sources.get(source);
    return config != null ? config : SourceConfig.builder().build();
  }

  /**
   * Returns the file name of a source, falling back to {@link FinanceSources#defaultFile()}.
   */
  public String getSourceFile(FinanceSources source) {
    String file = getSource(source).getFile();
    return file != null ? file : source.defaultFile();
  }

  /**
   * Returns the declared schema of a source with its configured overrides.
   */
  public SourceSchema getSchema(FinanceSources source) {
    return source.schema().withOverrides(getSource(source).getSchema());
  }

  /**
   * Returns the configured filter of a source, or its default, restricted
   * to the sample period in both cases.
   */
  public FilterExpression getFilter(FinanceSources source) {
    FilterExpression filter = getSource(source).getFilter();
    if (filter == null) {
      return defaultFilter(source);
    }
    FilterExpression period = samplePeriodFilter(source);
    return period == null ? filter : Filters.and(filter, period);
  }

  public List<Integer> getAcceptedScores() {
    return acceptedScores;
  }

  public LookbackWindow getLookback() {
    return lookback;
  }

  public @Nullable String getTieBreakColumn() {
    return tieBreakColumn;
  }

  /**
   * Returns the firm-year fallback chains, in evaluation order.
   */
  public List<DerivedField> getFallbacks() {
    return fallbacks;
  }

  /**
   * Returns the firm-year statistics, computed after the fallbacks.
   */
  public List<DerivedField> getStatistics() {
    return statistics;
  }

  /**
   * Returns the per-forecast statistics.
   */
  public List<DerivedField> getForecastStatistics() {
    return forecastStatistics;
  }

  /**
   * Default row filter of a source, restricted to the sample period.
   */
  public FilterExpression defaultFilter(FinanceSources source) {
    List<FilterExpression> clauses = new ArrayList<FilterExpression>();
    switch (source) {
      case FUNDAMENTALS:
        clauses.add(Filters.eq("indfmt", "INDL"));
        clauses.add(Filters.eq("datafmt", "STD"));
        clauses.add(Filters.eq("popsrc", "D"));
        clauses.add(Filters.eq("consol", "C"));
        clauses.add(Filters.requireNonMissing("gvkey", "fyear"));
        break;
      case FORECASTS:
        clauses.add(Filters.eq("measure", "EPS"));
        clauses.add(Filters.in("fpi", "1"));
        clauses.add(Filters.requireNonMissing("ticker", "fpedats", "anndats"));
        break;
      case ACTUALS:
        clauses.add(Filters.eq("measure", "EPS"));
        clauses.add(Filters.requireNonMissing("ticker", "pends"));
        break;
      case PRICES:
        clauses.add(Filters.requireNonMissing("permno", "date"));
        break;
      case LINKS:
      default:
        return Filters.alwaysTrue();
    }
    FilterExpression period = samplePeriodFilter(source);
    if (period != null) {
      clauses.add(period);
    }
    return Filters.and(clauses);
  }

  /**
   * Range clause of the sample period on the fiscal year of fundamentals or
   * the period end of forecasts; null when no bound is set or the source
   * has no period column.
   */
  public @Nullable FilterExpression samplePeriodFilter(FinanceSources source) {
    if (startYear == null && endYear == null) {
      return null;
    }
    switch (source) {
      case FUNDAMENTALS:
        return Filters.between("fyear", startYear, endYear);
      case FORECASTS:
        return Filters.between("fpedats",
            startYear == null ? null : LocalDate.of(startYear, 1, 1),
            endYear == null ? null : LocalDate.of(endYear, 12, 31));
      default:
        return null;
    }
  }

  /**
   * Default firm-year fallback chains: preferred stock, book equity, then
   * book equity with deferred taxes net of preferred stock.
   */
  public static List<DerivedField> defaultFallbacks() {
    return Arrays.asList(
        new DerivedField("pref",
            FallbackChain.of(Arrays.asList("pstkrv", "pstkl", "pstk"), 0.0)),
        new DerivedField("book_equity",
            FallbackChain.of(Arrays.asList("seq", "ceq + pstk", "at - lt - mib"), null)),
        DerivedField.of("be", "book_equity + coalesce(txditc, 0) - pref"));
  }

  public static List<DerivedField> defaultStatistics() {
    return Arrays.asList(
        DerivedField.of("market_equity", "abs(prcc_f) * csho"),
        DerivedField.of("book_to_market", "ratio(be, market_equity)"));
  }

  public static List<DerivedField> defaultForecastStatistics() {
    return Arrays.asList(
        DerivedField.of("price", "adj(abs(prc), cfacshr)"),
        DerivedField.of("forecast_error", "ratio(actual - value, price)"),
        DerivedField.of("abs_forecast_error", "ratio(abs(actual - value), price)"));
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates a PanelConfig from a YAML/JSON map.
   */
  @SuppressWarnings("unchecked")
  public static PanelConfig fromMap(Map<String, Object> map) {
    Builder builder = builder();
    if (map == null) {
      return builder.build();
    }

    Object nameObj = map.get("name");
    if (nameObj instanceof String) {
      builder.name((String) nameObj);
    }

    Object periodObj = map.get("samplePeriod");
    if (periodObj instanceof Map) {
      Map<String, Object> period = (Map<String, Object>) periodObj;
      builder.startYear(toInteger(period.get("startYear"), "samplePeriod.startYear"));
      builder.endYear(toInteger(period.get("endYear"), "samplePeriod.endYear"));
    }

    Integer parallelism = toInteger(map.get("parallelism"), "parallelism");
    if (parallelism != null) {
      builder.parallelism(parallelism);
    }

    Object panelsObj = map.get("panels");
    if (panelsObj instanceof List) {
      Set<PanelType> panels = EnumSet.noneOf(PanelType.class);
      for (Object panel : (List<?>) panelsObj) {
        panels.add(PanelType.fromString(String.valueOf(panel)));
      }
      builder.panels(panels);
    }

    Object sourcesObj = map.get("sources");
    if (sourcesObj instanceof Map) {
      for (Map.Entry<String, Object> entry : ((Map<String, Object>) sourcesObj).entrySet()) {
        Map<String, Object> sourceMap = entry.getValue() instanceof Map
            ? (Map<String, Object>) entry.getValue()
            : null;
        builder.source(FinanceSources.fromKey(entry.getKey()), SourceConfig.fromMap(sourceMap));
      }
    }

    Object linkingObj = map.get("linking");
    if (linkingObj instanceof Map) {
      Object scoresObj = ((Map<String, Object>) linkingObj).get("acceptedScores");
      if (scoresObj instanceof List) {
        List<Integer> scores = new ArrayList<Integer>();
        for (Object score : (List<?>) scoresObj) {
          scores.add(toInteger(score, "linking.acceptedScores"));
        }
        builder.acceptedScores(scores);
      }
    }

    Object matchingObj = map.get("matching");
    if (matchingObj instanceof Map) {
      Map<String, Object> matching = (Map<String, Object>) matchingObj;
      Object lookbackObj = matching.get("lookback");
      if (lookbackObj instanceof Map) {
        builder.lookback(LookbackWindow.fromMap((Map<String, Object>) lookbackObj,
            LookbackWindow.days(7)));
      }
      Object tieBreakObj = matching.get("tieBreakColumn");
      if (tieBreakObj instanceof String) {
        builder.tieBreakColumn((String) tieBreakObj);
      }
    }

    Object fallbacksObj = map.get("fallbacks");
    if (fallbacksObj instanceof Map) {
      builder.fallbacks(DerivedField.fromMap((Map<String, Object>) fallbacksObj));
    }
    Object statisticsObj = map.get("statistics");
    if (statisticsObj instanceof Map) {
      builder.statistics(StatisticComputer.fromConfig((Map<String, Object>) statisticsObj));
    }
    Object forecastStatisticsObj = map.get("forecastStatistics");
    if (forecastStatisticsObj instanceof Map) {
      builder.forecastStatistics(
          StatisticComputer.fromConfig((Map<String, Object>) forecastStatisticsObj));
    }

    return builder.build();
  }

  private static @Nullable Integer toInteger(@Nullable Object value, String key) {
    if (value == null) {
      return null;
    }
    if (value instanceof Number) {
      return ((Number) value).intValue();
    }
    try {
      return Integer.valueOf(String.valueOf(value).trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("'" + key + "' must be an integer, got: " + value, e);
    }
  }

  @Override public String toString() {
    return "PanelConfig{name='" + name + "', period=" + startYear + ".." + endYear
        + ", panels=" + panels + ", parallelism=" + parallelism
        + ", acceptedScores=" + acceptedScores + ", lookback=" + lookback + "}";
  }

  /**
   * Builder for PanelConfig.
   */
  public static class Builder {
    private String name = "panel";
    private Integer startYear;
    private Integer endYear;
    private int parallelism = 1;
    private Set<PanelType> panels = EnumSet.allOf(PanelType.class);
    private final Map<FinanceSources, SourceConfig> sources =
        new EnumMap<FinanceSources, SourceConfig>(FinanceSources.class);
    private List<Integer> acceptedScores = Arrays.asList(0, 1, 2);
    private LookbackWindow lookback = LookbackWindow.days(7);
    private String tieBreakColumn;
    private List<DerivedField> fallbacks = defaultFallbacks();
    private List<DerivedField> statistics = defaultStatistics();
    private List<DerivedField> forecastStatistics = defaultForecastStatistics();

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder startYear(Integer startYear) {
      this.startYear = startYear;
      return this;
    }

    public Builder endYear(Integer endYear) {
      this.endYear = endYear;
      return this;
    }

    public Builder parallelism(int parallelism) {
      this.parallelism = parallelism;
      return this;
    }

    public Builder panels(Set<PanelType> panels) {
      this.panels = panels;
      return this;
    }

    public Builder panels(PanelType... panels) {
      return panels(new LinkedHashSet<PanelType>(Arrays.asList(panels)));
    }

    public Builder source(FinanceSources source, SourceConfig config) {
      this.sources.put(source, config);
      return this;
    }

    public Builder acceptedScores(List<Integer> acceptedScores) {
      this.acceptedScores = acceptedScores;
      return this;
    }

    public Builder lookback(LookbackWindow lookback) {
      this.lookback = lookback;
      return this;
    }

    public Builder tieBreakColumn(String tieBreakColumn) {
      this.tieBreakColumn = tieBreakColumn;
      return this;
    }

    public Builder fallbacks(List<DerivedField> fallbacks) {
      this.fallbacks = fallbacks;
      return this;
    }

    public Builder statistics(List<DerivedField> statistics) {
      this.statistics = statistics;
      return this;
    }

    public Builder forecastStatistics(List<DerivedField> forecastStatistics) {
      this.forecastStatistics = forecastStatistics;
      return this;
    }

    public PanelConfig build() {
      if (name == null || name.isEmpty()) {
        throw new IllegalArgumentException("Panel name is required");
      }
      if (startYear != null && endYear != null && startYear > endYear) {
        throw new IllegalArgumentException("Sample period start " + startYear
            + " is after end " + endYear);
      }
      if (parallelism < 1) {
        throw new IllegalArgumentException("Parallelism must be >= 1, got " + parallelism);
      }
      if (panels == null || panels.isEmpty()) {
        throw new IllegalArgumentException("At least one panel is required");
      }
      if (acceptedScores == null || acceptedScores.isEmpty()) {
        throw new IllegalArgumentException("At least one accepted link score is required");
      }
      for (Map.Entry<FinanceSources, SourceConfig> entry : sources.entrySet()) {
        // rejects duplicate override columns
        entry.getKey().schema().withOverrides(entry.getValue().getSchema());
      }
      return new PanelConfig(this);
    }
  }
}

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
import org.panelkit.etl.Table;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of a {@link PanelPipeline} run.
 *
 * <p>Holds the produced tables in production order, the row count after
 * every stage, and the diagnostic counts of the run.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * PanelResult result = new PanelPipeline(config).run(sources);
 * Table firmYears = result.getTable("firm_years");
 * long unmatched = result.getDiagnostic(DiagnosticSummary.Condition.NO_MATCH);
 * }</pre>
 *
 * @see PanelPipeline
 */
public class PanelResult {

  private final String pipelineName;
  private final Map<String, Table> tables;
  private final Map<String, Integer> stageCounts;
  private final Map<DiagnosticSummary.Condition, Long> diagnostics;
  private final @Nullable LinkResult linkResult;
  private final long elapsedMs;

  private PanelResult(Builder builder) {
    this.pipelineName = builder.pipelineName;
    this.tables = Collections.unmodifiableMap(new LinkedHashMap<String, Table>(builder.tables));
    this.stageCounts =
        Collections.unmodifiableMap(new LinkedHashMap<String, Integer>(builder.stageCounts));
    this.diagnostics = Collections.unmodifiableMap(
        new EnumMap<DiagnosticSummary.Condition, Long>(builder.diagnostics));
    this.linkResult = builder.linkResult;
    this.elapsedMs = builder.elapsedMs;
  }

  public static Builder builder() {
    return new Builder();
  }

  public String getPipelineName() {
    return pipelineName;
  }

  /**
   * Returns the output tables keyed by name, in production order.
   */
  public Map<String, Table> getTables() {
    return tables;
  }

  /**
   * Returns an output table.
   *
   * @throws IllegalArgumentException if the run produced no such table
   */
  public Table getTable(String name) {
    Table table = tables.get(name);
    if (table == null) {
      throw new IllegalArgumentException("No output table '" + name + "', have "
          + tables.keySet());
    }
    return table;
  }

  /**
   * Returns the row count after each stage, keyed {@code <panel>.<stage>}.
   */
  public Map<String, Integer> getStageCounts() {
    return stageCounts;
  }

  public Map<DiagnosticSummary.Condition, Long> getDiagnostics() {
    return diagnostics;
  }

  public long getDiagnostic(DiagnosticSummary.Condition condition) {
    Long count = diagnostics.get(condition);
    return count == null ? 0 : count;
  }

  /**
   * Returns the ticker to permno link result, or null if the forecast panel
   * was not built.
   */
  public @Nullable LinkResult getLinkResult() {
    return linkResult;
  }

  public long getElapsedMs() {
    return elapsedMs;
  }

  /**
   * Returns the total number of rows over all output tables.
   */
  public long getTotalRows() {
    long total = 0;
    for (Table table : tables.values()) {
      total += table.size();
    }
    return total;
  }

  @Override public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append("PanelResult{pipeline='").append(pipelineName).append("'");
    for (Map.Entry<String, Table> entry : tables.entrySet()) {
      sb.append(", ").append(entry.getKey()).append("=").append(entry.getValue().size());
    }
    sb.append(", diagnostics=").append(diagnostics);
    sb.append(", elapsed=").append(elapsedMs).append("ms");
    sb.append("}");
    return sb.toString();
  }

  /**
   * Builder for PanelResult.
   */
  public static class Builder {
    private String pipelineName = "panel";
    private final Map<String, Table> tables = new LinkedHashMap<String, Table>();
    private final Map<String, Integer> stageCounts = new LinkedHashMap<String, Integer>();
    private final Map<DiagnosticSummary.Condition, Long> diagnostics =
        new EnumMap<DiagnosticSummary.Condition, Long>(DiagnosticSummary.Condition.class);
    private @Nullable LinkResult linkResult;
    private long elapsedMs;

    public Builder pipelineName(String pipelineName) {
      this.pipelineName = pipelineName;
      return this;
    }

    /**
     * Adds an output table under its own name.
     *
     * @throws IllegalArgumentException if a table of that name was added
     */
    public Builder table(Table table) {
      if (tables.containsKey(table.getName())) {
        throw new IllegalArgumentException("Duplicate output table '" + table.getName() + "'");
      }
      tables.put(table.getName(), table);
      return this;
    }

    public Builder stageCounts(Map<String, Integer> counts) {
      stageCounts.putAll(counts);
      return this;
    }

    public Builder diagnostics(Map<DiagnosticSummary.Condition, Long> counts) {
      diagnostics.putAll(counts);
      return this;
    }

    public Builder linkResult(LinkResult linkResult) {
      this.linkResult = linkResult;
      return this;
    }

    public Builder elapsedMs(long elapsedMs) {
      this.elapsedMs = elapsedMs;
      return this;
    }

    public PanelResult build() {
      return new PanelResult(this);
    }
  }
}

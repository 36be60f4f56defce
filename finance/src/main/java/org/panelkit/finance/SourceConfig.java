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

import org.panelkit.etl.ColumnConfig;
import org.panelkit.etl.expr.FilterExpression;
import org.panelkit.etl.expr.FilterParser;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Per-source settings: file, column overrides, row filter, projected
 * columns and missing-value sentinels.
 *
 * <h3>YAML Configuration Example</h3>
 * <pre>{@code
 * sources:
 *   fundamentals:
 *     file: comp_funda.csv
 *     columns: [gvkey, datadate, fyear, seq, ceq, pstk, at, lt, mib, txditc]
 *     sentinels: ["", "NA", "-99"]
 *     schema:
 *       - {name: prcc_f, source: PRCC_F}
 *       - {name: mib, required: false}
 *       - {name: emp, type: double}
 *     filter:
 *       - {column: indfmt, value: INDL}
 *       - {column: fyear, between: [1970, 2020]}
 * }</pre>
 *
 * <p>Schema entries override the declared column of the same name, keeping
 * its unset attributes, or add a column. An absent filter means the panel's
 * default filter; the sample period applies either way. An absent column
 * list means every declared column, absent sentinels mean
 * {@code "", "NA", "."}.
 */
public class SourceConfig {

  private final @Nullable String file;
  private final @Nullable FilterExpression filter;
  private final List<String> columns;
  private final @Nullable List<String> sentinels;
  private final List<ColumnConfig> schema;

  private SourceConfig(Builder builder) {
    this.file = builder.file;
    this.filter = builder.filter;
    this.columns = builder.columns != null
        ? Collections.unmodifiableList(new ArrayList<String>(builder.columns))
        : Collections.<String>emptyList();
    this.sentinels = builder.sentinels != null
        ? Collections.unmodifiableList(new ArrayList<String>(builder.sentinels))
        : null;
    this.schema = builder.schema != null
        ? Collections.unmodifiableList(new ArrayList<ColumnConfig>(builder.schema))
        : Collections.<ColumnConfig>emptyList();
  }

  /**
   * Returns the configured file name, relative to the input directory, or null.
   */
  public @Nullable String getFile() {
    return file;
  }

  /**
   * Returns the configured filter, or null to use the panel default.
   */
  public @Nullable FilterExpression getFilter() {
    return filter;
  }

  /**
   * Returns the projected columns; empty keeps every declared column.
   */
  public List<String> getColumns() {
    return columns;
  }

  /**
   * Returns the configured sentinels, or null for the reader defaults.
   */
  public @Nullable List<String> getSentinels() {
    return sentinels;
  }

  /**
   * Returns the column overrides applied to the declared schema.
   */
  public List<ColumnConfig> getSchema() {
    return schema;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates a SourceConfig from a YAML/JSON map.
   */
  public static SourceConfig fromMap(Map<String, Object> map) {
    Builder builder = builder();
    if (map == null) {
      return builder.build();
    }
    Object fileObj = map.get("file");
    if (fileObj instanceof String) {
      builder.file((String) fileObj);
    }
    if (map.containsKey("filter")) {
      builder.filter(FilterParser.parse(map.get("filter")));
    }
    Object columnsObj = map.get("columns");
    if (columnsObj instanceof List) {
      builder.columns(toStrings((List<?>) columnsObj));
    }
    Object schemaObj = map.get("schema");
    if (schemaObj instanceof List) {
      builder.schema(ColumnConfig.fromList((List<?>) schemaObj));
    }
    Object sentinelsObj = map.get("sentinels");
    if (sentinelsObj instanceof List) {
      builder.sentinels(toStrings((List<?>) sentinelsObj));
    }
    return builder.build();
  }

  private static List<String> toStrings(List<?> values) {
    List<String> result = new ArrayList<String>(values.size());
    for (Object value : values) {
      result.add(value == null ? "" : String.valueOf(value));
    }
    return result;
  }

  /**
   * Builder for SourceConfig.
   */
  public static class Builder {
    private String file;
    private FilterExpression filter;
    private List<String> columns;
    private List<String> sentinels;
    private List<ColumnConfig> schema;

    public Builder file(String file) {
      this.file = file;
      return this;
    }

    public Builder filter(FilterExpression filter) {
      this.filter = filter;
      return this;
    }

    public Builder columns(List<String> columns) {
      this.columns = columns;
      return this;
    }

    public Builder sentinels(List<String> sentinels) {
      this.sentinels = sentinels;
      return this;
    }

    public Builder schema(List<ColumnConfig> schema) {
      this.schema = schema;
      return this;
    }

    public SourceConfig build() {
      return new SourceConfig(this);
    }
  }
}

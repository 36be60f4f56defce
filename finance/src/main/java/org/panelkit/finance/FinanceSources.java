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
import org.panelkit.etl.ColumnType;
import org.panelkit.etl.SourceSchema;

import java.util.Arrays;
import java.util.Collections;

/**
 * Input sources of the financial panels and their declared schemas.
 *
 * <ul>
 *   <li>{@link #FUNDAMENTALS} - annual company fundamentals, one row per
 *       (gvkey, datadate)</li>
 *   <li>{@link #PRICES} - daily security prices with cumulative adjustment
 *       factors, one row per (permno, date)</li>
 *   <li>{@link #LINKS} - raw ticker to permno links with a quality score,
 *       0 being best</li>
 *   <li>{@link #FORECASTS} - individual analyst estimates</li>
 *   <li>{@link #ACTUALS} - reported actual values per (ticker, pends)</li>
 * </ul>
 */
public enum FinanceSources {
  FUNDAMENTALS(SourceSchema.of("fundamentals", Arrays.asList("gvkey", "datadate"),
      text("gvkey"),
      date("datadate"),
      integer("fyear"),
      text("indfmt"),
      text("datafmt"),
      text("popsrc"),
      text("consol"),
      number("at"),
      number("lt"),
      number("seq"),
      number("ceq"),
      number("pstk"),
      number("pstkl"),
      number("pstkrv"),
      number("mib"),
      number("txditc"),
      number("sale"),
      number("prcc_f"),
      number("csho"))),

  PRICES(SourceSchema.of("prices", Arrays.asList("permno", "date"),
      integer("permno"),
      date("date"),
      number("prc"),
      number("cfacpr"),
      number("cfacshr"),
      number("shrout"))),

  LINKS(SourceSchema.of("links", Collections.<String>emptyList(),
      text("ticker"),
      integer("permno"),
      integer("score"))),

  FORECASTS(SourceSchema.of("forecasts",
      Arrays.asList("ticker", "fpedats", "estimator", "analys", "anndats"),
      text("ticker"),
      date("fpedats"),
      integer("estimator"),
      integer("analys"),
      date("anndats"),
      number("value"),
      text("measure"),
      text("fpi"),
      text("pdf"))),

  ACTUALS(SourceSchema.of("actuals", Arrays.asList("ticker", "pends"),
      text("ticker"),
      date("pends"),
      date("anndats"),
      number("value"),
      text("measure"),
      text("pdf")));

  private final SourceSchema schema;

  FinanceSources(SourceSchema schema) {
    this.schema = schema;
  }

  public SourceSchema schema() {
    return schema;
  }

  /**
   * Returns the configuration key and table name, e.g. {@code fundamentals}.
   */
  public String key() {
    return schema.getName();
  }

  /**
   * Returns the file name read when the configuration names none.
   */
  public String defaultFile() {
    return key() + ".csv";
  }

  /**
   * Looks a source up by its configuration key.
   *
   * @throws IllegalArgumentException if no source has that key
   */
  public static FinanceSources fromKey(String key) {
    for (FinanceSources source : values()) {
      if (source.key().equalsIgnoreCase(key)) {
        return source;
      }
    }
    throw new IllegalArgumentException("Unknown source '" + key + "', expected one of "
        + Arrays.toString(values()).toLowerCase());
  }

  private static ColumnConfig text(String name) {
    return ColumnConfig.of(name, ColumnType.STRING);
  }

  private static ColumnConfig integer(String name) {
    return ColumnConfig.of(name, ColumnType.INTEGER);
  }

  private static ColumnConfig number(String name) {
    return ColumnConfig.of(name, ColumnType.DOUBLE);
  }

  private static ColumnConfig date(String name) {
    return ColumnConfig.of(name, ColumnType.DATE);
  }
}

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

import org.panelkit.etl.CsvTableWriter;
import org.panelkit.etl.Table;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Small source tables shared by the panel tests.
 *
 * <p>Fundamentals: firm A reports 2015, 2016 (twice, restated) and 2018;
 * firm B reports 2016 plus a non-industrial duplicate that the default
 * filter removes.
 *
 * <p>Forecasts: IBM has two analysts (one revising), a late estimate and an
 * estimate for a period without an actual; MSFT has no price inside the
 * lookback window; AMBI links to two permnos; LOW only has a rejected link.
 */
public final class PanelFixtures {

  private PanelFixtures() {
  }

  public static SourceTables sources() {
    return SourceTables.builder()
        .put(FinanceSources.FUNDAMENTALS, fundamentals())
        .put(FinanceSources.PRICES, prices())
        .put(FinanceSources.LINKS, links())
        .put(FinanceSources.FORECASTS, forecasts())
        .put(FinanceSources.ACTUALS, actuals())
        .build();
  }

  /**
   * Writes every fixture table as {@code <source>.csv} into a directory.
   */
  public static void writeCsv(Path dir) throws IOException {
    CsvTableWriter writer = new CsvTableWriter();
    SourceTables sources = sources();
    for (FinanceSources source : FinanceSources.values()) {
      writer.write(sources.get(source), dir.resolve(source.defaultFile()));
    }
  }

  public static PanelConfig config(int parallelism) {
    return PanelConfig.builder()
        .name("fixture")
        .startYear(2015)
        .endYear(2020)
        .parallelism(parallelism)
        .build();
  }

  public static Table fundamentals() {
    Table.Builder b = Table.builder("fundamentals",
        FinanceSources.FUNDAMENTALS.schema().getColumnNames());
    b.add(funda("A", date(2015, 12, 31), 2015L, "INDL",
        "seq", 500.0, "pstkrv", 20.0, "txditc", 5.0, "prcc_f", 10.0, "csho", 100.0));
    b.add(funda("A", date(2016, 6, 30), 2016L, "INDL",
        "seq", 100.0, "prcc_f", 1.0, "csho", 1.0));
    b.add(funda("A", date(2016, 12, 31), 2016L, "INDL",
        "seq", 600.0, "prcc_f", 12.0, "csho", 100.0));
    b.add(funda("A", date(2018, 12, 31), 2018L, "INDL",
        "seq", 700.0, "prcc_f", -20.0, "csho", 50.0));
    b.add(funda("B", date(2016, 12, 31), 2016L, "FS",
        "seq", 999.0));
    b.add(funda("B", date(2016, 12, 31), 2016L, "INDL",
        "ceq", 100.0, "pstk", 10.0, "prcc_f", 0.0, "csho", 10.0));
    b.add(funda("C", date(2012, 12, 31), 2012L, "INDL",
        "seq", 1.0));
    return b.build();
  }

  public static Table prices() {
    return Table.builder("prices", FinanceSources.PRICES.schema().getColumnNames())
        .row(12490L, date(2019, 11, 18), 130.0, 1.0, 1.0, 900.0)
        .row(12490L, date(2019, 11, 20), -134.0, 2.0, 2.0, 900.0)
        .row(12490L, date(2019, 11, 22), 136.0, 2.0, 2.0, 900.0)
        .row(10107L, date(2019, 4, 26), 129.0, 1.0, 1.0, 7600.0)
        .row(11111L, date(2019, 11, 1), 50.0, 1.0, 1.0, 10.0)
        .build();
  }

  public static Table links() {
    return Table.builder("links", FinanceSources.LINKS.schema().getColumnNames())
        .row("IBM", 12490L, 0L)
        .row("IBM", 12490L, 1L)
        .row("MSFT", 10107L, 1L)
        .row("AMBI", 11111L, 0L)
        .row("AMBI", 22222L, 2L)
        .row("LOW", 33333L, 5L)
        .build();
  }

  public static Table forecasts() {
    return Table.builder("forecasts", FinanceSources.FORECASTS.schema().getColumnNames())
        .row("IBM", date(2019, 12, 31), 100L, 1L, date(2019, 10, 15), 10.0, "EPS", "1", "D")
        .row("IBM", date(2019, 12, 31), 100L, 1L, date(2019, 11, 20), 11.0, "EPS", "1", "D")
        .row("IBM", date(2019, 12, 31), 200L, 2L, date(2019, 11, 25), 13.0, "EPS", "1", "D")
        .row("IBM", date(2019, 12, 31), 300L, 3L, date(2020, 1, 25), 12.5, "EPS", "1", "D")
        .row("IBM", date(2019, 12, 31), 100L, 1L, date(2019, 11, 20), 14.0, "EPS", "2", "D")
        .row("IBM", date(2020, 12, 31), 100L, 1L, date(2020, 2, 1), 13.0, "EPS", "1", "D")
        .row("MSFT", date(2019, 6, 30), 100L, 4L, date(2019, 5, 6), 4.5, "EPS", "1", "D")
        .row("AMBI", date(2019, 12, 31), 100L, 5L, date(2019, 11, 1), 0.9, "EPS", "1", "D")
        .row("LOW", date(2019, 12, 31), 100L, 6L, date(2019, 11, 1), 2.0, "EPS", "1", "D")
        .build();
  }

  public static Table actuals() {
    return Table.builder("actuals", FinanceSources.ACTUALS.schema().getColumnNames())
        .row("IBM", date(2019, 12, 31), date(2020, 1, 21), 12.0, "EPS", "D")
        .row("IBM", date(2019, 12, 31), date(2020, 1, 21), 77000.0, "SAL", "D")
        .row("MSFT", date(2019, 6, 30), date(2019, 7, 18), 4.75, "EPS", "D")
        .row("AMBI", date(2019, 12, 31), date(2020, 2, 1), 1.0, "EPS", "D")
        .row("LOW", date(2019, 12, 31), date(2020, 2, 1), 2.5, "EPS", "D")
        .build();
  }

  static LocalDate date(int year, int month, int day) {
    return LocalDate.of(year, month, day);
  }

  private static Map<String, Object> funda(String gvkey, LocalDate datadate, long fyear,
      String indfmt, Object... fields) {
    Map<String, Object> row = new LinkedHashMap<String, Object>();
    row.put("gvkey", gvkey);
    row.put("datadate", datadate);
    row.put("fyear", fyear);
    row.put("indfmt", indfmt);
    row.put("datafmt", "STD");
    row.put("popsrc", "D");
    row.put("consol", "C");
    for (int i = 0; i < fields.length; i += 2) {
      row.put((String) fields[i], fields[i + 1]);
    }
    return row;
  }
}

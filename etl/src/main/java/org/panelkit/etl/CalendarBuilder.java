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
package org.panelkit.etl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Expands each entity's observed year span into a gapless year sequence.
 *
 * <p>Observations are grouped by entity; the span runs from the earliest to
 * the latest observed year, inclusive, and one row is emitted for every
 * integer year in it. The result is the spine onto which yearly data is
 * left-joined, so an entity keeps a row for a year even when nothing was
 * reported that year.
 *
 * <p>The observation column may hold dates or year numbers. Rows with a
 * missing entity or year are ignored.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * CalendarBuilder calendar = CalendarBuilder.builder()
 *     .idColumn("gvkey")
 *     .dateColumn("datadate")
 *     .build();
 * Table spine = calendar.build(fundamentals, context);
 * // columns: gvkey, year_min, year_max, year
 * }</pre>
 */
public class CalendarBuilder {

  private static final Logger LOGGER = LoggerFactory.getLogger(CalendarBuilder.class);

  private final String idColumn;
  private final String dateColumn;
  private final String yearColumn;
  private final String yearMinColumn;
  private final String yearMaxColumn;
  private final String outputName;

  private CalendarBuilder(Builder builder) {
    this.idColumn = builder.idColumn;
    this.dateColumn = builder.dateColumn;
    this.yearColumn = builder.yearColumn;
    this.yearMinColumn = builder.yearMinColumn;
    this.yearMaxColumn = builder.yearMaxColumn;
    this.outputName = builder.outputName;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Builds the calendar.
   *
   * @param observations Table with at least the id and date columns
   * @param context Run context supplying the group executor
   * @return Table with columns id, year_min, year_max, year sorted by id then year
   */
  public Table build(Table observations, StageContext context) {
    String stage = "calendar:" + outputName;
    observations.requireColumns(stage, idColumn, dateColumn);

    List<Map<String, Object>> rows = context.getExecutor().apply(observations.getRows(),
        Collections.singletonList(idColumn),
        (key, group) -> expand(key.get(0), group));

    Table calendar = Table.of(outputName,
        Arrays.asList(idColumn, yearMinColumn, yearMaxColumn, yearColumn), rows);
    LOGGER.info("Calendar '{}' expanded {} observations into {} entity-years",
        outputName, observations.size(), calendar.size());
    return calendar;
  }

  /**
   * Expands one entity's observations.
   */
  private List<Map<String, Object>> expand(Object id, List<Map<String, Object>> group) {
    if (id == null) {
      LOGGER.debug("Skipping {} observations with missing '{}'", group.size(), idColumn);
      return Collections.emptyList();
    }
    Integer yearMin = null;
    Integer yearMax = null;
    for (Map<String, Object> row : group) {
      Integer year = Values.yearOf(row.get(dateColumn));
      if (year == null) {
        continue;
      }
      if (yearMin == null || year < yearMin) {
        yearMin = year;
      }
      if (yearMax == null || year > yearMax) {
        yearMax = year;
      }
    }
    if (yearMin == null) {
      LOGGER.debug("Entity {} has no dated observation, no calendar rows", id);
      return Collections.emptyList();
    }

    Object rawId = group.get(0).get(idColumn);
    List<Map<String, Object>> out = new ArrayList<Map<String, Object>>(yearMax - yearMin + 1);
    for (int year = yearMin; year <= yearMax; year++) {
      Map<String, Object> row = new LinkedHashMap<String, Object>();
      row.put(idColumn, rawId);
      row.put(yearMinColumn, yearMin);
      row.put(yearMaxColumn, yearMax);
      row.put(yearColumn, year);
      out.add(row);
    }
    return out;
  }

  /**
   * Builder for CalendarBuilder.
   */
  public static class Builder {
    private String idColumn;
    private String dateColumn;
    private String yearColumn = "year";
    private String yearMinColumn = "year_min";
    private String yearMaxColumn = "year_max";
    private String outputName = "calendar";

    public Builder idColumn(String idColumn) {
      this.idColumn = idColumn;
      return this;
    }

    /**
     * Column holding the observation date (or year).
     */
    public Builder dateColumn(String dateColumn) {
      this.dateColumn = dateColumn;
      return this;
    }

    public Builder yearColumn(String yearColumn) {
      this.yearColumn = yearColumn;
      return this;
    }

    public Builder yearMinColumn(String yearMinColumn) {
      this.yearMinColumn = yearMinColumn;
      return this;
    }

    public Builder yearMaxColumn(String yearMaxColumn) {
      this.yearMaxColumn = yearMaxColumn;
      return this;
    }

    public Builder outputName(String outputName) {
      this.outputName = outputName;
      return this;
    }

    public CalendarBuilder build() {
      if (idColumn == null || idColumn.isEmpty()) {
        throw new IllegalArgumentException("Calendar id column is required");
      }
      if (dateColumn == null || dateColumn.isEmpty()) {
        throw new IllegalArgumentException("Calendar date column is required");
      }
      return new CalendarBuilder(this);
    }
  }
}

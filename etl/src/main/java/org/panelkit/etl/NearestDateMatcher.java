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

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Attaches to each left row the right-hand observation of the same entity
 * dated closest to, and not after, the left row's target date.
 *
 * <p>The search is bounded by a {@link LookbackWindow}: an observation older
 * than {@code target - window} is never matched. Left rows without a match
 * are kept with missing carried values and counted as
 * {@link DiagnosticSummary.Condition#NO_MATCH}.
 *
 * <p>When several right rows share the closest date, the one with the lowest
 * tie-break column value wins (missing last); remaining ties keep the
 * earliest right row in input order.
 *
 * <p>Output rows are grouped by left key in ascending order; within a key
 * they keep their input order.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * NearestDateMatcher matcher = NearestDateMatcher.builder()
 *     .leftKeys("permno").leftDate("anndats")
 *     .rightKeys("permno").rightDate("date")
 *     .carry("prc").carry("cfacshr")
 *     .window(LookbackWindow.days(7))
 *     .build();
 * Table matched = matcher.match(forecasts, prices, context);
 * }</pre>
 */
public class NearestDateMatcher {

  private static final Logger LOGGER = LoggerFactory.getLogger(NearestDateMatcher.class);

  private final List<String> leftKeys;
  private final String leftDate;
  private final List<String> rightKeys;
  private final String rightDate;
  private final Map<String, String> carry;
  private final String matchedDateColumn;
  private final LookbackWindow window;
  private final String tieBreakColumn;

  private NearestDateMatcher(Builder builder) {
    this.leftKeys = Collections.unmodifiableList(new ArrayList<String>(builder.leftKeys));
    this.leftDate = builder.leftDate;
    this.rightKeys = Collections.unmodifiableList(new ArrayList<String>(builder.rightKeys));
    this.rightDate = builder.rightDate;
    this.carry = Collections.unmodifiableMap(new LinkedHashMap<String, String>(builder.carry));
    this.matchedDateColumn = builder.matchedDateColumn;
    this.window = builder.window;
    this.tieBreakColumn = builder.tieBreakColumn;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Matches every left row against the right table.
   *
   * @param left Rows carrying the entity key and the target date
   * @param right Dated observations per entity
   * @param context Run context for the executor and diagnostics
   * @return Left columns followed by the carried columns and the matched date
   * @throws SchemaException if a referenced column is unknown or an output
   *     column already exists on the left
   */
  public Table match(Table left, Table right, StageContext context) {
    String stage = "match:" + left.getName() + "~" + right.getName();
    List<String> leftReferenced = new ArrayList<String>(leftKeys);
    leftReferenced.add(leftDate);
    left.requireColumns(stage, leftReferenced);
    List<String> rightReferenced = new ArrayList<String>(rightKeys);
    rightReferenced.add(rightDate);
    rightReferenced.addAll(carry.keySet());
    if (tieBreakColumn != null) {
      rightReferenced.add(tieBreakColumn);
    }
    right.requireColumns(stage, rightReferenced);

    List<String> columns = new ArrayList<String>(left.getColumns());
    for (String added : outputColumns()) {
      if (columns.contains(added)) {
        throw new SchemaException(stage, "Matched column '" + added
            + "' already exists in '" + left.getName() + "'");
      }
      columns.add(added);
    }

    final Map<List<Object>, TreeMap<LocalDate, Map<String, Object>>> index = index(right);
    final AtomicInteger matched = new AtomicInteger();
    final DiagnosticSummary diagnostics = context.getDiagnostics();

    List<Map<String, Object>> rows = context.getExecutor().apply(left.getRows(), leftKeys,
        (key, group) -> {
          TreeMap<LocalDate, Map<String, Object>> series =
              Values.hasMissing(key) ? null : index.get(key);
          List<Map<String, Object>> out = new ArrayList<Map<String, Object>>(group.size());
          for (Map<String, Object> row : group) {
            Map<String, Object> hit = find(series, Values.toDate(row.get(leftDate)));
            Map<String, Object> joined = new LinkedHashMap<String, Object>(row);
            if (hit == null) {
              diagnostics.record(DiagnosticSummary.Condition.NO_MATCH);
            } else {
              matched.incrementAndGet();
            }
            for (Map.Entry<String, String> entry : carry.entrySet()) {
              joined.put(entry.getValue(), hit == null ? null : hit.get(entry.getKey()));
            }
            joined.put(matchedDateColumn,
                hit == null ? null : Values.toDate(hit.get(rightDate)));
            out.add(joined);
          }
          return out;
        });

    Table result = Table.of(left.getName(), columns, rows);
    int unmatched = result.size() - matched.get();
    LOGGER.info("Matched {} of {} '{}' rows to '{}' within {} ({} without a match)",
        matched.get(), result.size(), left.getName(), right.getName(), window, unmatched);
    if (unmatched > 0) {
      LOGGER.warn("{} '{}' rows found no '{}' observation within {}",
          unmatched, left.getName(), right.getName(), window);
    }
    return result;
  }

  private List<String> outputColumns() {
    List<String> added = new ArrayList<String>(carry.values());
    added.add(matchedDateColumn);
    return added;
  }

  private Map<String, Object> find(TreeMap<LocalDate, Map<String, Object>> series,
      LocalDate target) {
    if (series == null || target == null) {
      return null;
    }
    Map.Entry<LocalDate, Map<String, Object>> floor = series.floorEntry(target);
    if (floor == null || floor.getKey().isBefore(window.start(target))) {
      return null;
    }
    return floor.getValue();
  }

  /**
   * Indexes the right table by key and date, resolving same-date ties.
   */
  private Map<List<Object>, TreeMap<LocalDate, Map<String, Object>>> index(Table right) {
    Map<List<Object>, TreeMap<LocalDate, Map<String, Object>>> index =
        new HashMap<List<Object>, TreeMap<LocalDate, Map<String, Object>>>();
    int skipped = 0;
    for (Map<String, Object> row : right.getRows()) {
      List<Object> key = Values.keyOf(row, rightKeys);
      LocalDate date = Values.toDate(row.get(rightDate));
      if (Values.hasMissing(key) || date == null) {
        skipped++;
        continue;
      }
      TreeMap<LocalDate, Map<String, Object>> series =
          index.computeIfAbsent(key, k -> new TreeMap<LocalDate, Map<String, Object>>());
      Map<String, Object> current = series.get(date);
      if (current == null || prefer(row, current)) {
        series.put(date, row);
      }
    }
    if (skipped > 0) {
      LOGGER.debug("Ignored {} '{}' rows with a missing key or date", skipped, right.getName());
    }
    return index;
  }

  private boolean prefer(Map<String, Object> candidate, Map<String, Object> current) {
    if (tieBreakColumn == null) {
      return false;
    }
    return Values.compare(candidate.get(tieBreakColumn), current.get(tieBreakColumn)) < 0;
  }

  /**
   * Builder for NearestDateMatcher.
   */
  public static class Builder {
    private List<String> leftKeys = new ArrayList<String>();
    private String leftDate;
    private List<String> rightKeys = new ArrayList<String>();
    private String rightDate;
    private final Map<String, String> carry = new LinkedHashMap<String, String>();
    private String matchedDateColumn = "match_date";
    private LookbackWindow window = LookbackWindow.days(7);
    private String tieBreakColumn;

    public Builder leftKeys(String... columns) {
      this.leftKeys = new ArrayList<String>(Arrays.asList(columns));
      return this;
    }

    public Builder leftDate(String column) {
      this.leftDate = column;
      return this;
    }

    public Builder rightKeys(String... columns) {
      this.rightKeys = new ArrayList<String>(Arrays.asList(columns));
      return this;
    }

    public Builder rightDate(String column) {
      this.rightDate = column;
      return this;
    }

    /**
     * Carries a right column into the output under its own name.
     */
    public Builder carry(String column) {
      return carry(column, column);
    }

    /**
     * Carries a right column into the output under a new name.
     */
    public Builder carry(String column, String outputColumn) {
      this.carry.put(column, outputColumn);
      return this;
    }

    public Builder matchedDateColumn(String column) {
      this.matchedDateColumn = column;
      return this;
    }

    public Builder window(LookbackWindow window) {
      this.window = window;
      return this;
    }

    /**
     * Right column whose lowest value wins among rows on the same date.
     */
    public Builder tieBreakColumn(String column) {
      this.tieBreakColumn = column;
      return this;
    }

    public NearestDateMatcher build() {
      if (leftKeys.isEmpty() || leftKeys.size() != rightKeys.size()) {
        throw new IllegalArgumentException("Matcher needs the same non-zero number of left "
            + "and right key columns, got " + leftKeys + " and " + rightKeys);
      }
      if (leftDate == null || rightDate == null) {
        throw new IllegalArgumentException("Matcher left and right date columns are required");
      }
      if (window == null) {
        throw new IllegalArgumentException("Matcher lookback window is required");
      }
      return new NearestDateMatcher(this);
    }
  }
}

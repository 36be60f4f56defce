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

import org.panelkit.etl.expr.ValueExpression;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reduces a table to one row per group key.
 *
 * <p>Policies:
 * <ul>
 *   <li>{@link #keepLast}: order each group by the order keys and keep the
 *       last row; input position breaks remaining ties, so the later input
 *       row wins.</li>
 *   <li>{@link #keepMin} / {@link #keepMax}: keep the row with the smallest
 *       or largest derived value; missing values never win; remaining ties
 *       keep the earliest input row.</li>
 * </ul>
 *
 * <p>A missing key element never equals another, so rows whose group key
 * has a missing element pass through unchanged, as they never match in
 * {@link TableJoiner}. Every dropped row is counted as
 * {@link DiagnosticSummary.Condition#DUPLICATE_DROPPED}. Output is ordered by
 * ascending group key. {@link #requireUnique} asserts the result.
 */
public class Deduplicator {

  private static final Logger LOGGER = LoggerFactory.getLogger(Deduplicator.class);

  private final StageContext context;

  public Deduplicator(StageContext context) {
    this.context = context;
  }

  /**
   * Keeps the last row of each group under the given ordering.
   *
   * @param table Input table
   * @param groupKeys Columns identifying a group
   * @param orderKeys Ordering within a group; the last row is kept
   * @return One row per group key
   */
  public Table keepLast(Table table, List<String> groupKeys, final List<SortKey> orderKeys) {
    String stage = "dedup:" + table.getName();
    table.requireColumns(stage, groupKeys);
    List<String> orderColumns = new ArrayList<String>();
    for (SortKey key : orderKeys) {
      orderColumns.add(key.getColumn());
    }
    table.requireColumns(stage, orderColumns);

    List<Map<String, Object>> rows = context.getExecutor().apply(table.getRows(), groupKeys,
        (key, group) -> {
          if (Values.hasMissing(key)) {
            return group;
          }
          // stable sort: equal rows stay in input order, so the last one is the latest input
          List<Map<String, Object>> sorted = new ArrayList<Map<String, Object>>(group);
          sorted.sort(SortKey.comparator(orderKeys));
          return Collections.singletonList(sorted.get(sorted.size() - 1));
        });
    return finish(table, rows, "keep last by " + orderKeys);
  }

  /**
   * Keeps the row of each group with the smallest derived value.
   */
  public Table keepMin(Table table, List<String> groupKeys, ValueExpression value) {
    return keepExtreme(table, groupKeys, value, false);
  }

  /**
   * Keeps the row of each group with the largest derived value.
   */
  public Table keepMax(Table table, List<String> groupKeys, ValueExpression value) {
    return keepExtreme(table, groupKeys, value, true);
  }

  private Table keepExtreme(Table table, List<String> groupKeys, final ValueExpression value,
      final boolean max) {
    String stage = "dedup:" + table.getName();
    table.requireColumns(stage, groupKeys);
    table.requireColumns(stage, value.columns());

    List<Map<String, Object>> rows = context.getExecutor().apply(table.getRows(), groupKeys,
        (key, group) -> {
          if (Values.hasMissing(key)) {
            return group;
          }
          Map<String, Object> best = null;
          Object bestValue = null;
          for (Map<String, Object> row : group) {
            Object candidate = value.evaluate(row);
            if (best == null) {
              best = row;
              bestValue = candidate;
              continue;
            }
            if (Values.isMissing(candidate)) {
              continue;
            }
            if (Values.isMissing(bestValue)) {
              best = row;
              bestValue = candidate;
              continue;
            }
            int cmp = Values.compare(candidate, bestValue);
            if (max ? cmp > 0 : cmp < 0) {
              best = row;
              bestValue = candidate;
            }
          }
          return Collections.singletonList(best);
        });
    return finish(table, rows, (max ? "keep max of " : "keep min of ") + value);
  }

  private Table finish(Table table, List<Map<String, Object>> rows, String policy) {
    Table result = Table.of(table.getName(), table.getColumns(), rows);
    int dropped = table.size() - result.size();
    context.getDiagnostics().record(DiagnosticSummary.Condition.DUPLICATE_DROPPED, dropped);
    LOGGER.info("Deduplicated '{}' ({}): {} -> {} rows, {} dropped",
        table.getName(), policy, table.size(), result.size(), dropped);
    return result;
  }

  /**
   * Asserts that no two rows share a key. Keys with a missing element are
   * not compared.
   *
   * @param table Table to check
   * @param keys Key columns
   * @param stage Stage name reported on failure
   * @throws UniquenessViolationException listing every duplicated key
   */
  public static void requireUnique(Table table, List<String> keys, String stage) {
    table.requireColumns(stage, keys);
    Map<List<Object>, Integer> counts = new LinkedHashMap<List<Object>, Integer>();
    for (Map<String, Object> row : table.getRows()) {
      List<Object> key = Values.keyOf(row, keys);
      if (!Values.hasMissing(key)) {
        counts.merge(key, 1, Integer::sum);
      }
    }
    Map<List<Object>, Integer> duplicates = new LinkedHashMap<List<Object>, Integer>();
    for (Map.Entry<List<Object>, Integer> entry : counts.entrySet()) {
      if (entry.getValue() > 1) {
        duplicates.put(entry.getKey(), entry.getValue());
      }
    }
    if (!duplicates.isEmpty()) {
      throw new UniquenessViolationException(stage, table.getName(), keys, duplicates,
          table.size());
    }
    LOGGER.debug("'{}' is unique on {} ({} rows)", table.getName(), keys, table.size());
  }
}

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

import org.panelkit.etl.expr.DerivedField;
import org.panelkit.etl.expr.ValueExpression;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Computes per-row statistics from already merged columns.
 *
 * <p>Each statistic is a single expression. {@code ratio} and {@code adj}
 * treat a zero denominator as 1; strict {@code /} and a missing operand
 * yield a missing value, counted in the run diagnostics, and never an
 * exception.
 *
 * <pre>{@code
 * statistics:
 *   market_equity: "abs(prcc_f) * csho"
 *   book_to_market: "ratio(be, market_equity)"
 * }</pre>
 */
public class StatisticComputer {

  private final MergeEngine engine;

  public StatisticComputer(StageContext context) {
    this.engine = new MergeEngine(context);
  }

  /**
   * Appends the statistics in order; later ones may read earlier ones.
   */
  public Table compute(Table table, List<DerivedField> statistics) {
    return engine.derive(table, statistics);
  }

  /**
   * Appends the statistics given as name to expression, in map order.
   */
  public Table compute(Table table, Map<String, ValueExpression> statistics) {
    List<DerivedField> fields = new ArrayList<DerivedField>();
    for (Map.Entry<String, ValueExpression> entry : statistics.entrySet()) {
      fields.add(DerivedField.of(entry.getKey(), entry.getValue()));
    }
    return compute(table, fields);
  }

  /**
   * Parses {@code name: expression} pairs.
   */
  public static List<DerivedField> fromConfig(Map<String, Object> statistics) {
    List<DerivedField> fields = new ArrayList<DerivedField>();
    if (statistics == null) {
      return fields;
    }
    for (Map.Entry<String, Object> entry : statistics.entrySet()) {
      fields.add(DerivedField.of(entry.getKey(), String.valueOf(entry.getValue())));
    }
    return fields;
  }
}

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
import org.panelkit.etl.expr.FallbackChain;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Left-joins data onto a spine and computes derived fields through
 * fallback chains.
 *
 * <p>Joins never add or drop spine rows. Derived fields are computed in
 * declaration order, so a later field may read an earlier one. Numeric
 * results are stored as {@code Double}. A field that comes out missing for
 * a row is counted as {@link DiagnosticSummary.Condition#MISSING_OPERAND}.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * MergeEngine engine = new MergeEngine(context);
 * Table panel = engine.merge(calendar, Collections.singletonList(
 *     MergeEngine.JoinStep.of(fundamentals, Arrays.asList("gvkey", "year"),
 *         Arrays.asList("gvkey", "fyear"))), "firm_years");
 * panel = engine.derive(panel, DerivedField.fromMap(fallbacks));
 * }</pre>
 */
public class MergeEngine {

  private static final Logger LOGGER = LoggerFactory.getLogger(MergeEngine.class);

  private final StageContext context;
  private final TableJoiner joiner = new TableJoiner();

  public MergeEngine(StageContext context) {
    this.context = context;
  }

  /**
   * One left join onto the spine.
   */
  public static final class JoinStep {
    private final Table right;
    private final List<String> leftKeys;
    private final List<String> rightKeys;

    private JoinStep(Table right, List<String> leftKeys, List<String> rightKeys) {
      this.right = right;
      this.leftKeys = Collections.unmodifiableList(new ArrayList<String>(leftKeys));
      this.rightKeys = Collections.unmodifiableList(new ArrayList<String>(rightKeys));
    }

    public static JoinStep of(Table right, List<String> leftKeys, List<String> rightKeys) {
      return new JoinStep(right, leftKeys, rightKeys);
    }

    /**
     * Join on columns that carry the same name on both sides.
     */
    public static JoinStep on(Table right, String... keys) {
      return new JoinStep(right, Arrays.asList(keys), Arrays.asList(keys));
    }

    public Table getRight() {
      return right;
    }

    public List<String> getLeftKeys() {
      return leftKeys;
    }

    public List<String> getRightKeys() {
      return rightKeys;
    }
  }

  /**
   * Applies the join steps in order.
   *
   * @param spine Table whose rows are all preserved
   * @param steps Joins to apply
   * @param outputName Name of the merged table
   * @return Spine widened with every joined table's columns
   */
  public Table merge(Table spine, List<JoinStep> steps, String outputName) {
    Table current = spine;
    for (JoinStep step : steps) {
      current = joiner.leftJoin(current, step.getRight(), step.getLeftKeys(),
          step.getRightKeys(), outputName);
    }
    if (current.size() != spine.size()) {
      throw new IllegalStateException("Merge '" + outputName + "' changed the spine from "
          + spine.size() + " to " + current.size() + " rows");
    }
    return current.withName(outputName);
  }

  /**
   * Computes derived fields row by row.
   *
   * @param table Input table
   * @param fields Fields in evaluation order; a name that already exists
   *     replaces that column's values
   * @return Table with the derived columns appended
   * @throws SchemaException if a field reads a column that is neither in the
   *     table nor derived earlier
   */
  public Table derive(Table table, List<DerivedField> fields) {
    String stage = "derive:" + table.getName();
    List<String> columns = new ArrayList<String>(table.getColumns());
    Set<String> available = new LinkedHashSet<String>(columns);
    for (DerivedField field : fields) {
      Set<String> unknown = new LinkedHashSet<String>(field.getChain().columns());
      unknown.removeAll(available);
      if (!unknown.isEmpty()) {
        throw new SchemaException(stage, table.getName(), unknown);
      }
      if (available.add(field.getName())) {
        columns.add(field.getName());
      }
      LOGGER.debug("Field {} evaluates {}", field.getName(), field.getChain().describe());
    }

    boolean trackUsage = LOGGER.isDebugEnabled();
    Map<String, Map<Integer, Integer>> usage = new LinkedHashMap<String, Map<Integer, Integer>>();
    Map<String, Integer> missing = new LinkedHashMap<String, Integer>();
    for (DerivedField field : fields) {
      usage.put(field.getName(), new LinkedHashMap<Integer, Integer>());
      missing.put(field.getName(), 0);
    }

    Table.Builder builder = Table.builder(table.getName(), columns);
    for (Map<String, Object> row : table.getRows()) {
      Map<String, Object> out = new LinkedHashMap<String, Object>(row);
      for (DerivedField field : fields) {
        FallbackChain chain = field.getChain();
        if (trackUsage) {
          usage.get(field.getName()).merge(chain.resolvedIndex(out), 1, Integer::sum);
        }
        Object value = normalize(chain.evaluate(out));
        if (value == null) {
          missing.merge(field.getName(), 1, Integer::sum);
        }
        out.put(field.getName(), value);
      }
      builder.add(out);
    }

    long totalMissing = 0;
    for (Map.Entry<String, Integer> entry : missing.entrySet()) {
      totalMissing += entry.getValue();
      if (trackUsage) {
        LOGGER.debug("Field {}: candidate usage {} (-1 default, -2 none)",
            entry.getKey(), usage.get(entry.getKey()));
      }
    }
    context.getDiagnostics().record(DiagnosticSummary.Condition.MISSING_OPERAND, totalMissing);
    LOGGER.info("Derived {} field(s) on '{}' ({} rows), missing values per field: {}",
        fields.size(), table.getName(), table.size(), missing);
    return builder.build();
  }

  static Object normalize(Object value) {
    if (Values.isMissing(value)) {
      return null;
    }
    if (value instanceof Number) {
      return ((Number) value).doubleValue();
    }
    return value;
  }
}

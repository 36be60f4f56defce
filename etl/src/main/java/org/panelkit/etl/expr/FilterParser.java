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
package org.panelkit.etl.expr;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds {@link FilterExpression} trees from YAML/JSON maps.
 *
 * <h3>YAML Configuration Example</h3>
 * <pre>{@code
 * filter:
 *   and:
 *     - {column: indfmt, op: eq, value: INDL}
 *     - {column: datadate, between: ["1990-01-01", "2020-12-31"]}
 *     - {column: fpi, in: ["1"]}
 *     - {column: anndats, op: le, otherColumn: actual_date}
 *     - {notMissing: [gvkey, fyear]}
 *     - or:
 *         - {column: at, op: gt, value: 0}
 *         - not: {column: sale, op: le, value: 0}
 * }</pre>
 *
 * <p>A bare list is read as a conjunction. Ranges also accept
 * {@code min}/{@code max} keys with either bound optional.
 */
public final class FilterParser {

  private FilterParser() {
  }

  /**
   * Parses a filter node.
   *
   * @param node Map, list of maps, or null
   * @return The filter, or {@link Filters#alwaysTrue()} when node is null
   * @throws IllegalArgumentException if the node is malformed
   */
  @SuppressWarnings("unchecked")
  public static FilterExpression parse(Object node) {
    if (node == null) {
      return Filters.alwaysTrue();
    }
    if (node instanceof List) {
      return Filters.and(parseList((List<?>) node));
    }
    if (!(node instanceof Map)) {
      throw new IllegalArgumentException("Filter must be a map or a list, got: " + node);
    }
    Map<String, Object> map = (Map<String, Object>) node;

    if (map.containsKey("and")) {
      return Filters.and(parseList(asList(map.get("and"), "and")));
    }
    if (map.containsKey("or")) {
      return Filters.or(parseList(asList(map.get("or"), "or")));
    }
    if (map.containsKey("not")) {
      return Filters.not(parse(map.get("not")));
    }
    if (map.containsKey("notMissing")) {
      List<String> columns = new ArrayList<String>();
      for (Object column : asList(map.get("notMissing"), "notMissing")) {
        columns.add(String.valueOf(column));
      }
      return Filters.requireNonMissing(columns);
    }

    Object columnObj = map.get("column");
    if (!(columnObj instanceof String)) {
      throw new IllegalArgumentException("Filter needs 'column', 'and', 'or', 'not' or "
          + "'notMissing': " + map);
    }
    String column = (String) columnObj;

    if (map.containsKey("in")) {
      return Filters.in(column, asList(map.get("in"), "in"));
    }
    if (map.containsKey("between")) {
      List<?> bounds = asList(map.get("between"), "between");
      if (bounds.size() != 2) {
        throw new IllegalArgumentException("'between' on '" + column
            + "' needs exactly two bounds: " + bounds);
      }
      return Filters.between(column, bounds.get(0), bounds.get(1));
    }
    if (map.containsKey("min") || map.containsKey("max")) {
      return Filters.between(column, map.get("min"), map.get("max"));
    }

    Filters.Operator op = Filters.Operator.fromString(
        map.containsKey("op") ? String.valueOf(map.get("op")) : "eq");
    if (map.containsKey("otherColumn")) {
      return Filters.compareColumns(column, op, String.valueOf(map.get("otherColumn")));
    }
    if (!map.containsKey("value")) {
      throw new IllegalArgumentException("Comparison on '" + column + "' needs 'value'");
    }
    return Filters.compare(column, op, map.get("value"));
  }

  private static List<FilterExpression> parseList(List<?> nodes) {
    List<FilterExpression> result = new ArrayList<FilterExpression>();
    for (Object child : nodes) {
      result.add(parse(child));
    }
    return result;
  }

  private static List<?> asList(Object value, String key) {
    if (!(value instanceof List)) {
      throw new IllegalArgumentException("'" + key + "' must be a list, got: " + value);
    }
    return (List<?>) value;
  }
}

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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable, named snapshot of rows sharing an ordered column list.
 *
 * <p>Each row is a map of column name to value in column order. A row never
 * carries a column outside the table's column list; columns a row does not
 * set hold {@code null}, which is how missing values are represented.
 *
 * <p>Stages never modify a table they receive. They build a new table and
 * hand it to the next stage.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * Table links = Table.builder("links", Arrays.asList("ticker", "permno", "score"))
 *     .row("IBM", 12490L, 0)
 *     .row("MSFT", 10107L, 1)
 *     .build();
 * }</pre>
 */
public final class Table {

  private final String name;
  private final List<String> columns;
  private final List<Map<String, Object>> rows;

  private Table(String name, List<String> columns, List<Map<String, Object>> rows) {
    this.name = name;
    this.columns = columns;
    this.rows = rows;
  }

  /**
   * Creates a table from rows, copying each row into column order.
   *
   * @throws SchemaException if a row carries a column outside {@code columns}
   */
  public static Table of(String name, List<String> columns,
      Collection<? extends Map<String, Object>> rows) {
    Builder builder = builder(name, columns);
    for (Map<String, Object> row : rows) {
      builder.add(row);
    }
    return builder.build();
  }

  public static Builder builder(String name, List<String> columns) {
    return new Builder(name, columns);
  }

  public String getName() {
    return name;
  }

  public List<String> getColumns() {
    return columns;
  }

  public List<Map<String, Object>> getRows() {
    return rows;
  }

  public int size() {
    return rows.size();
  }

  public boolean isEmpty() {
    return rows.isEmpty();
  }

  public boolean hasColumn(String column) {
    return columns.contains(column);
  }

  /**
   * Returns the values of one column in row order.
   */
  public List<Object> column(String column) {
    requireColumns("column", Collections.singletonList(column));
    List<Object> values = new ArrayList<Object>(rows.size());
    for (Map<String, Object> row : rows) {
      values.add(row.get(column));
    }
    return values;
  }

  /**
   * Checks that every referenced column exists.
   *
   * @param stage Name of the stage doing the check, used in the error
   * @param referenced Columns the stage reads
   * @throws SchemaException listing every unknown column
   */
  public void requireColumns(String stage, Collection<String> referenced) {
    Set<String> unknown = new LinkedHashSet<String>();
    for (String column : referenced) {
      if (!columns.contains(column)) {
        unknown.add(column);
      }
    }
    if (!unknown.isEmpty()) {
      throw new SchemaException(stage, name, unknown);
    }
  }

  public void requireColumns(String stage, String... referenced) {
    requireColumns(stage, Arrays.asList(referenced));
  }

  /**
   * Returns a copy of this table under another name.
   */
  public Table withName(String newName) {
    return new Table(newName, columns, rows);
  }

  /**
   * Returns a copy with columns renamed. Columns not in the map keep their name.
   */
  public Table rename(Map<String, String> renames) {
    requireColumns("rename:" + name, renames.keySet());
    List<String> renamed = new ArrayList<String>(columns.size());
    for (String column : columns) {
      String target = renames.get(column);
      renamed.add(target != null ? target : column);
    }
    if (new LinkedHashSet<String>(renamed).size() != renamed.size()) {
      throw new SchemaException("rename:" + name,
          "Renaming " + renames + " produces duplicate columns " + renamed);
    }
    Builder builder = builder(name, renamed);
    for (Map<String, Object> row : rows) {
      Map<String, Object> out = new LinkedHashMap<String, Object>();
      for (Map.Entry<String, Object> entry : row.entrySet()) {
        String target = renames.get(entry.getKey());
        out.put(target != null ? target : entry.getKey(), entry.getValue());
      }
      builder.add(out);
    }
    return builder.build();
  }

  /**
   * Returns a copy stably sorted by the given keys.
   */
  public Table sortBy(List<SortKey> keys) {
    List<String> referenced = new ArrayList<String>();
    for (SortKey key : keys) {
      referenced.add(key.getColumn());
    }
    requireColumns("sort:" + name, referenced);
    List<Map<String, Object>> sorted = new ArrayList<Map<String, Object>>(rows);
    sorted.sort(SortKey.comparator(keys));
    return new Table(name, columns, Collections.unmodifiableList(sorted));
  }

  @Override public String toString() {
    return "Table{name='" + name + "', columns=" + columns + ", rows=" + rows.size() + "}";
  }

  /**
   * Builder for Table.
   */
  public static class Builder {
    private final String name;
    private final List<String> columns;
    private final List<Map<String, Object>> rows = new ArrayList<Map<String, Object>>();

    private Builder(String name, List<String> columns) {
      if (name == null || name.isEmpty()) {
        throw new IllegalArgumentException("Table name is required");
      }
      if (new LinkedHashSet<String>(columns).size() != columns.size()) {
        throw new SchemaException("table:" + name, "Duplicate column names in " + columns);
      }
      this.name = name;
      this.columns = Collections.unmodifiableList(new ArrayList<String>(columns));
    }

    /**
     * Adds a row given as a column-to-value map.
     */
    public Builder add(Map<String, Object> row) {
      for (String key : row.keySet()) {
        if (!columns.contains(key)) {
          throw new SchemaException("table:" + name, name, Collections.singletonList(key));
        }
      }
      Map<String, Object> copy = new LinkedHashMap<String, Object>();
      for (String column : columns) {
        copy.put(column, row.get(column));
      }
      rows.add(Collections.unmodifiableMap(copy));
      return this;
    }

    /**
     * Adds a row given positionally, in column order.
     */
    public Builder row(Object... values) {
      if (values.length != columns.size()) {
        throw new IllegalArgumentException("Expected " + columns.size()
            + " values for table '" + name + "', got " + values.length);
      }
      Map<String, Object> row = new LinkedHashMap<String, Object>();
      for (int i = 0; i < values.length; i++) {
        row.put(columns.get(i), values[i]);
      }
      return add(row);
    }

    public Table build() {
      return new Table(name, columns,
          Collections.unmodifiableList(new ArrayList<Map<String, Object>>(rows)));
    }
  }
}

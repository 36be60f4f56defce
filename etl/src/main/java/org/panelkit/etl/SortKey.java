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
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * One column of a row ordering, ascending or descending.
 *
 * <p>Missing values sort last in both directions.
 */
public final class SortKey {

  private final String column;
  private final boolean ascending;

  private SortKey(String column, boolean ascending) {
    if (column == null || column.isEmpty()) {
      throw new IllegalArgumentException("Sort column is required");
    }
    this.column = column;
    this.ascending = ascending;
  }

  public static SortKey asc(String column) {
    return new SortKey(column, true);
  }

  public static SortKey desc(String column) {
    return new SortKey(column, false);
  }

  /**
   * Builds ascending keys for each column.
   */
  public static List<SortKey> ascending(List<String> columns) {
    List<SortKey> keys = new ArrayList<SortKey>(columns.size());
    for (String column : columns) {
      keys.add(asc(column));
    }
    return keys;
  }

  /**
   * Parses {@code "column"}, {@code "column asc"} or {@code "column desc"}.
   */
  public static SortKey parse(String text) {
    String[] parts = text.trim().split("\\s+");
    if (parts.length == 2 && "desc".equalsIgnoreCase(parts[1])) {
      return desc(parts[0]);
    }
    if (parts.length == 1 || (parts.length == 2 && "asc".equalsIgnoreCase(parts[1]))) {
      return asc(parts[0]);
    }
    throw new IllegalArgumentException("Invalid sort key: '" + text + "'");
  }

  public String getColumn() {
    return column;
  }

  public boolean isAscending() {
    return ascending;
  }

  /**
   * Returns a row comparator applying the keys in order.
   */
  public static Comparator<Map<String, Object>> comparator(final List<SortKey> keys) {
    return new Comparator<Map<String, Object>>() {
      @Override public int compare(Map<String, Object> a, Map<String, Object> b) {
        for (SortKey key : keys) {
          Object va = a.get(key.column);
          Object vb = b.get(key.column);
          int c;
          if (Values.isMissing(va) || Values.isMissing(vb)) {
            c = Values.compare(va, vb);
          } else {
            c = key.ascending ? Values.compare(va, vb) : Values.compare(vb, va);
          }
          if (c != 0) {
            return c;
          }
        }
        return 0;
      }
    };
  }

  @Override public String toString() {
    return column + (ascending ? " asc" : " desc");
  }
}

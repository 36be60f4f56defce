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
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Declared columns and candidate key of an input source.
 */
public final class SourceSchema {

  private final String name;
  private final List<ColumnConfig> columns;
  private final List<String> key;

  public SourceSchema(String name, List<ColumnConfig> columns, List<String> key) {
    if (name == null || name.isEmpty()) {
      throw new IllegalArgumentException("Source name is required");
    }
    Set<String> names = new LinkedHashSet<String>();
    for (ColumnConfig column : columns) {
      if (!names.add(column.getName())) {
        throw new IllegalArgumentException("Duplicate column '" + column.getName()
            + "' in source '" + name + "'");
      }
    }
    for (String k : key) {
      if (!names.contains(k)) {
        throw new IllegalArgumentException("Key column '" + k + "' is not declared in source '"
            + name + "'");
      }
    }
    this.name = name;
    this.columns = Collections.unmodifiableList(new ArrayList<ColumnConfig>(columns));
    this.key = Collections.unmodifiableList(new ArrayList<String>(key));
  }

  public static SourceSchema of(String name, List<String> key, ColumnConfig... columns) {
    return new SourceSchema(name, Arrays.asList(columns), key);
  }

  public String getName() {
    return name;
  }

  public List<ColumnConfig> getColumns() {
    return columns;
  }

  public List<String> getColumnNames() {
    List<String> names = new ArrayList<String>(columns.size());
    for (ColumnConfig column : columns) {
      names.add(column.getName());
    }
    return names;
  }

  /**
   * Returns the candidate key; empty when the source has none.
   */
  public List<String> getKey() {
    return key;
  }

  /**
   * Returns this schema with configured columns applied. A column named like
   * a declared one replaces it and inherits its unset attributes; any other
   * column is appended. The key is unchanged.
   *
   * @param overrides Configured columns, in order
   * @return This schema when there are no overrides
   */
  public SourceSchema withOverrides(List<ColumnConfig> overrides) {
    if (overrides.isEmpty()) {
      return this;
    }
    List<ColumnConfig> merged = new ArrayList<ColumnConfig>(columns);
    for (ColumnConfig override : overrides) {
      int index = getColumnNames().indexOf(override.getName());
      if (index >= 0) {
        merged.set(index, override.inherit(columns.get(index)));
      } else {
        merged.add(override);
      }
    }
    return new SourceSchema(name, merged, key);
  }

  @Override public String toString() {
    return name + columns + (key.isEmpty() ? "" : " key " + key);
  }
}

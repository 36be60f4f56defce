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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * A column of a delimited source.
 *
 * <pre>{@code
 * - name: datadate
 *   type: date
 * - name: prc
 *   type: double
 *   source: PRC        # header name in the file
 *   required: false    # absent header yields a missing column
 * }</pre>
 *
 * <p>Unset attributes default to a required STRING column read from the
 * header of the same name, unless the column overrides a declared one; see
 * {@link #inherit(ColumnConfig)}.
 */
public class ColumnConfig {

  private final String name;
  private final @Nullable ColumnType type;
  private final @Nullable String source;
  private final @Nullable Boolean required;

  private ColumnConfig(Builder builder) {
    this.name = builder.name;
    this.type = builder.type;
    this.source = builder.source;
    this.required = builder.required;
  }

  public static ColumnConfig of(String name, ColumnType type) {
    return builder().name(name).type(type).build();
  }

  /**
   * Returns the table column name.
   */
  public String getName() {
    return name;
  }

  public ColumnType getType() {
    return type != null ? type : ColumnType.STRING;
  }

  /**
   * Returns the header name in the file; defaults to the column name.
   */
  public String getEffectiveSource() {
    return source != null && !source.isEmpty() ? source : name;
  }

  /**
   * Returns whether the reader fails when the header lacks this column.
   */
  public boolean isRequired() {
    return required == null || required;
  }

  /**
   * Returns this column with every unset attribute taken from
   * {@code declared}.
   */
  public ColumnConfig inherit(ColumnConfig declared) {
    Builder builder = builder().name(name)
        .type(type != null ? type : declared.type)
        .source(source != null ? source : declared.source);
    Boolean req = required != null ? required : declared.required;
    if (req != null) {
      builder.required(req);
    }
    return builder.build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates a ColumnConfig from a YAML/JSON map with keys name, type,
   * source and required.
   */
  public static ColumnConfig fromMap(Map<String, Object> map) {
    if (map == null) {
      return null;
    }
    Builder builder = builder();
    builder.name((String) map.get("name"));
    Object typeObj = map.get("type");
    if (typeObj instanceof String) {
      builder.type(ColumnType.fromString((String) typeObj));
    }
    builder.source((String) map.get("source"));
    Object requiredObj = map.get("required");
    if (requiredObj instanceof Boolean) {
      builder.required((Boolean) requiredObj);
    }
    return builder.build();
  }

  /**
   * Parses a list of column maps. A plain string names a column with every
   * attribute unset.
   */
  @SuppressWarnings("unchecked")
  public static List<ColumnConfig> fromList(List<?> list) {
    if (list == null || list.isEmpty()) {
      return Collections.emptyList();
    }
    List<ColumnConfig> result = new ArrayList<ColumnConfig>();
    for (Object item : list) {
      if (item instanceof Map) {
        result.add(fromMap((Map<String, Object>) item));
      } else if (item instanceof String) {
        result.add(builder().name((String) item).build());
      }
    }
    return result;
  }

  @Override public String toString() {
    return name + ":" + getType().name().toLowerCase();
  }

  /**
   * Builder for ColumnConfig.
   */
  public static class Builder {
    private String name;
    private ColumnType type;
    private String source;
    private Boolean required;

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder type(ColumnType type) {
      this.type = type;
      return this;
    }

    public Builder source(String source) {
      this.source = source;
      return this;
    }

    public Builder required(boolean required) {
      this.required = required;
      return this;
    }

    public ColumnConfig build() {
      if (name == null || name.isEmpty()) {
        throw new IllegalArgumentException("Column name is required");
      }
      return new ColumnConfig(this);
    }
  }
}

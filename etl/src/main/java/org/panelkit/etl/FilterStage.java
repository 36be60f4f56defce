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

import org.panelkit.etl.expr.FilterExpression;
import org.panelkit.etl.expr.Filters;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Applies a row predicate and a column projection to a source table.
 *
 * <p>Both the predicate and the projection are checked against the source
 * columns before any row is read; an unknown column raises
 * {@link SchemaException}. An empty projection keeps every column.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * Table funda = new FilterStage().apply(raw,
 *     Filters.and(Filters.eq("indfmt", "INDL"), Filters.requireNonMissing("gvkey")),
 *     Arrays.asList("gvkey", "datadate", "fyear", "at"),
 *     "fundamentals");
 * }</pre>
 */
public class FilterStage {

  private static final Logger LOGGER = LoggerFactory.getLogger(FilterStage.class);

  /**
   * Filters and projects a table.
   *
   * @param source Input table
   * @param filter Row predicate; null keeps every row
   * @param projection Columns to keep, in output order; null or empty keeps all
   * @param outputName Name of the produced table
   * @return New table with matching rows restricted to the projection
   * @throws SchemaException if the filter or projection names an unknown column
   */
  public Table apply(Table source, FilterExpression filter, List<String> projection,
      String outputName) {
    String stage = "filter:" + outputName;
    FilterExpression predicate = filter != null ? filter : Filters.alwaysTrue();
    List<String> columns = projection == null || projection.isEmpty()
        ? source.getColumns()
        : projection;

    source.requireColumns(stage, predicate.columns());
    source.requireColumns(stage, columns);

    Table.Builder builder = Table.builder(outputName, columns);
    for (Map<String, Object> row : source.getRows()) {
      if (!predicate.test(row)) {
        continue;
      }
      Map<String, Object> projected = new LinkedHashMap<String, Object>();
      for (String column : columns) {
        projected.put(column, row.get(column));
      }
      builder.add(projected);
    }
    Table result = builder.build();
    LOGGER.info("Filter '{}' kept {} of {} rows from '{}' ({})",
        outputName, result.size(), source.size(), source.getName(), predicate);
    return result;
  }

  /**
   * Filters a table without projecting.
   */
  public Table apply(Table source, FilterExpression filter) {
    return apply(source, filter, Collections.<String>emptyList(), source.getName());
  }

  /**
   * Projects a table without filtering.
   */
  public Table project(Table source, List<String> projection) {
    return apply(source, Filters.alwaysTrue(), new ArrayList<String>(projection),
        source.getName());
  }
}

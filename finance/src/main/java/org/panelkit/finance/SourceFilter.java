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
package org.panelkit.finance;

import org.panelkit.etl.Deduplicator;
import org.panelkit.etl.FilterStage;
import org.panelkit.etl.SourceSchema;
import org.panelkit.etl.Table;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;

/**
 * Applies the configured row filter of a source, checks the filtered rows
 * against the source's declared key, then projects the configured columns.
 *
 * <p>The key check is skipped for a source without a declared key or for a
 * table that does not carry every key column.
 */
public class SourceFilter {

  private static final Logger LOGGER = LoggerFactory.getLogger(SourceFilter.class);

  private final PanelConfig config;
  private final FilterStage filterStage = new FilterStage();

  public SourceFilter(PanelConfig config) {
    this.config = config;
  }

  /**
   * Filters one source table.
   *
   * @param table Raw table of the source
   * @param source Source the table was read from
   * @param panel Name of the panel being built, used in stage names
   * @return Filtered and projected table named after the source
   * @throws org.panelkit.etl.UniquenessViolationException if two kept rows
   *     share the declared key
   */
  public Table apply(Table table, FinanceSources source, String panel) {
    Table filtered = filterStage.apply(table, config.getFilter(source),
        Collections.<String>emptyList(), source.key());
    SourceSchema schema = config.getSchema(source);
    List<String> key = schema.getKey();
    if (!key.isEmpty() && filtered.getColumns().containsAll(key)) {
      Deduplicator.requireUnique(filtered, key, panel + ":" + source.key());
    } else if (!key.isEmpty()) {
      LOGGER.debug("Skipping key check of '{}': not every column of {} is present",
          source.key(), key);
    }
    List<String> columns = config.getSource(source).getColumns();
    return columns.isEmpty() ? filtered : filterStage.project(filtered, columns);
  }
}

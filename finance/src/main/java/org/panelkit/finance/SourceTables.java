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

import org.panelkit.etl.CsvTableReader;
import org.panelkit.etl.PanelException;
import org.panelkit.etl.Table;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * The raw input tables of a run, keyed by source.
 */
public class SourceTables {

  private static final Logger LOGGER = LoggerFactory.getLogger(SourceTables.class);

  private final Map<FinanceSources, Table> tables;

  private SourceTables(Map<FinanceSources, Table> tables) {
    this.tables = Collections.unmodifiableMap(new EnumMap<FinanceSources, Table>(tables));
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Reads every source the configured panels need from a directory.
   *
   * @param inputDir Directory holding the source files
   * @param config Run configuration naming files and sentinels
   * @throws IOException if a needed file is absent or unreadable
   */
  public static SourceTables load(Path inputDir, PanelConfig config) throws IOException {
    Builder builder = builder();
    for (FinanceSources source : PanelType.requiredSources(config.getPanels())) {
      Path file = inputDir.resolve(config.getSourceFile(source));
      List<String> sentinels = config.getSource(source).getSentinels();
      CsvTableReader reader = sentinels != null
          ? new CsvTableReader(sentinels)
          : new CsvTableReader();
      builder.put(source, reader.read(file, config.getSchema(source)));
    }
    SourceTables tables = builder.build();
    LOGGER.info("Loaded {} source table(s) from {}", tables.tables.size(), inputDir);
    return tables;
  }

  /**
   * Returns the table of a source.
   *
   * @throws PanelException if the source was not loaded
   */
  public Table get(FinanceSources source) {
    Table table = tables.get(source);
    if (table == null) {
      throw new PanelException("sources", "Source '" + source.key() + "' was not loaded");
    }
    return table;
  }

  public boolean contains(FinanceSources source) {
    return tables.containsKey(source);
  }

  /**
   * Builder for SourceTables.
   */
  public static class Builder {
    private final Map<FinanceSources, Table> tables =
        new EnumMap<FinanceSources, Table>(FinanceSources.class);

    /**
     * Registers a source table under the source's name.
     */
    public Builder put(FinanceSources source, Table table) {
      tables.put(source, table.withName(source.key()));
      return this;
    }

    public SourceTables build() {
      return new SourceTables(tables);
    }
  }
}

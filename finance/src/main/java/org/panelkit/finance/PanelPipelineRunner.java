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

import org.panelkit.etl.CsvTableWriter;
import org.panelkit.etl.PanelException;
import org.panelkit.etl.Table;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Command-line entry point: loads a configuration and the source files,
 * runs the pipeline and writes each output table as
 * {@code <output-dir>/<table>.csv}.
 *
 * <p>Nothing is written unless every panel was built.
 */
public final class PanelPipelineRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(PanelPipelineRunner.class);

  private PanelPipelineRunner() {
  }

  public static void main(String[] args) {
    System.exit(run(args));
  }

  /**
   * Runs the pipeline and returns the process exit code: 0 on success, 1 on
   * a usage error, 2 on a failed run.
   */
  public static int run(String[] args) {
    if (args.length < 3) {
      System.err.println("Usage: PanelPipelineRunner <config.yaml|-> <input-dir> <output-dir>");
      System.err.println();
      System.err.println("  config.yaml  - pipeline configuration; '-' uses the built-in defaults");
      System.err.println("  input-dir    - directory holding the source CSV files");
      System.err.println("  output-dir   - directory receiving one CSV file per output table");
      System.err.println();
      System.err.println("Example:");
      System.err.println("  PanelPipelineRunner panel.yaml data/raw data/panels");
      return 1;
    }

    Path inputDir = Paths.get(args[1]);
    Path outputDir = Paths.get(args[2]);
    if (!Files.isDirectory(inputDir)) {
      System.err.println("Error: input directory not found: " + inputDir.toAbsolutePath());
      return 1;
    }

    try {
      PanelConfig config = "-".equals(args[0])
          ? PanelConfigLoader.loadResource(PanelConfigLoader.DEFAULT_RESOURCE)
          : PanelConfigLoader.load(Paths.get(args[0]));
      PanelResult result = new PanelPipeline(config).run(SourceTables.load(inputDir, config));
      write(result, outputDir);
      return 0;
    } catch (IOException | PanelException | IllegalArgumentException e) {
      LOGGER.error("Panel pipeline failed: {}", e.getMessage(), e);
      System.err.println("Error: " + e.getMessage());
      return 2;
    }
  }

  /**
   * Writes every output table of a result.
   */
  public static void write(PanelResult result, Path outputDir) throws IOException {
    CsvTableWriter writer = new CsvTableWriter();
    for (Table table : result.getTables().values()) {
      Path file = outputDir.resolve(table.getName() + ".csv");
      writer.write(table, file);
      LOGGER.info("Wrote {} rows to {}", table.size(), file);
    }
  }
}

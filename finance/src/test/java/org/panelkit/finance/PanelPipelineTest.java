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

import org.panelkit.etl.DiagnosticSummary;
import org.panelkit.etl.PanelException;
import org.panelkit.etl.SchemaException;
import org.panelkit.etl.Table;
import org.panelkit.etl.expr.DerivedField;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for PanelPipeline and PanelPipelineRunner.
 */
@Tag("unit")
public class PanelPipelineTest {

  private static final List<String> OUTPUTS =
      Arrays.asList("firm_years", "forecasts", "ticker_permno", "consensus");

  @Test void testAllPanels() {
    PanelResult result = new PanelPipeline(PanelFixtures.config(1)).run(PanelFixtures.sources());

    assertEquals("fixture", result.getPipelineName());
    assertEquals(OUTPUTS, new ArrayList<String>(result.getTables().keySet()));
    assertEquals(5, result.getTable("firm_years").size());
    assertEquals(5, result.getTable("forecasts").size());
    assertEquals(2, result.getTable("ticker_permno").size());
    assertEquals(4, result.getTable("consensus").size());
    assertEquals(16, result.getTotalRows());

    assertEquals(1, result.getDiagnostic(DiagnosticSummary.Condition.AMBIGUOUS_LINK));
    assertEquals(3, result.getDiagnostic(DiagnosticSummary.Condition.NO_MATCH));
    assertEquals(2, result.getDiagnostic(DiagnosticSummary.Condition.DUPLICATE_DROPPED));
    assertNotNull(result.getLinkResult());
    assertEquals(4, result.getStageCounts().get("firm_years.dedup"));
    assertEquals(5, result.getStageCounts().get("forecasts.dedup"));
  }

  @Test void testSelectedPanelOnly() {
    PanelConfig config = PanelConfig.builder().panels(PanelType.FIRM_YEARS).build();
    SourceTables sources = SourceTables.builder()
        .put(FinanceSources.FUNDAMENTALS, PanelFixtures.fundamentals())
        .build();
    PanelResult result = new PanelPipeline(config).run(sources);
    assertEquals(Collections.singleton("firm_years"), result.getTables().keySet());
    assertNull(result.getLinkResult());
    assertThrows(IllegalArgumentException.class, () -> result.getTable("forecasts"));
  }

  @Test void testMissingSourceFails() {
    SourceTables sources = SourceTables.builder()
        .put(FinanceSources.FUNDAMENTALS, PanelFixtures.fundamentals())
        .build();
    PanelException e = assertThrows(PanelException.class,
        () -> new PanelPipeline(PanelFixtures.config(1)).run(sources));
    assertEquals("sources", e.getStage());
  }

  @Test void testUnknownColumnFailsWholeRun() {
    PanelConfig config = PanelConfig.builder()
        .forecastStatistics(Collections.singletonList(
            DerivedField.of("surprise", "actual - consensus")))
        .build();
    assertThrows(SchemaException.class,
        () -> new PanelPipeline(config).run(PanelFixtures.sources()));
  }

  @Test void testParallelRunMatchesSequential() {
    PanelResult sequential =
        new PanelPipeline(PanelFixtures.config(1)).run(PanelFixtures.sources());
    PanelResult parallel =
        new PanelPipeline(PanelFixtures.config(4)).run(PanelFixtures.sources());
    for (String name : OUTPUTS) {
      Table expected = sequential.getTable(name);
      Table actual = parallel.getTable(name);
      assertEquals(expected.getColumns(), actual.getColumns(), name);
      assertEquals(expected.getRows(), actual.getRows(), name);
    }
    assertEquals(sequential.getDiagnostics(), parallel.getDiagnostics());
  }

  @Test void testRunnerWritesIdenticalFilesAcrossRuns(@TempDir Path dir) throws IOException {
    Path input = Files.createDirectories(dir.resolve("input"));
    PanelFixtures.writeCsv(input);
    Path config = dir.resolve("panel.yaml");
    Files.write(config, ("name: csv\n"
        + "samplePeriod: {startYear: 2015, endYear: 2020}\n"
        + "parallelism: 3\n").getBytes(StandardCharsets.UTF_8));

    Path first = dir.resolve("out1");
    Path second = dir.resolve("out2");
    assertEquals(0, PanelPipelineRunner.run(
        new String[] {config.toString(), input.toString(), first.toString()}));
    assertEquals(0, PanelPipelineRunner.run(
        new String[] {config.toString(), input.toString(), second.toString()}));

    for (String name : OUTPUTS) {
      Path a = first.resolve(name + ".csv");
      Path b = second.resolve(name + ".csv");
      assertTrue(Files.exists(a), name);
      assertArrayEquals(Files.readAllBytes(a), Files.readAllBytes(b), name);
    }
    List<String> firmYears = Files.readAllLines(first.resolve("firm_years.csv"),
        StandardCharsets.UTF_8);
    assertEquals(6, firmYears.size());
    assertTrue(firmYears.get(0).startsWith("gvkey,year_min,year_max,year,datadate"));
  }

  @Test void testRunnerUsageAndFailures(@TempDir Path dir) throws IOException {
    assertEquals(1, PanelPipelineRunner.run(new String[] {"-"}));
    assertEquals(1, PanelPipelineRunner.run(
        new String[] {"-", dir.resolve("absent").toString(), dir.resolve("out").toString()}));

    // input directory without source files: nothing is written
    Path empty = Files.createDirectories(dir.resolve("empty"));
    Path out = dir.resolve("out");
    assertEquals(2, PanelPipelineRunner.run(
        new String[] {"-", empty.toString(), out.toString()}));
    assertFalse(Files.exists(out));
  }
}

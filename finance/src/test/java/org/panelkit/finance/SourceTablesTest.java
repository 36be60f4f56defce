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

import org.panelkit.etl.SchemaException;
import org.panelkit.etl.Table;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for SourceTables.
 */
@Tag("unit")
public class SourceTablesTest {

  private static final String RENAMED_PRICES = ""
      + "sources:\n"
      + "  prices:\n"
      + "    schema:\n"
      + "      - {name: prc, source: PRC}\n"
      + "      - {name: cfacpr, required: false}\n"
      + "      - {name: shrout, required: false}\n"
      + "panels: [forecasts]\n";

  @TempDir
  Path input;

  @Test void testLoadsOnlyNeededSources() throws IOException {
    PanelFixtures.writeCsv(input);
    SourceTables tables = SourceTables.load(input,
        PanelConfigLoader.parse("panels: [firm_years]\n"));
    assertTrue(tables.contains(FinanceSources.FUNDAMENTALS));
    assertFalse(tables.contains(FinanceSources.PRICES));
    assertEquals(PanelFixtures.fundamentals().size(),
        tables.get(FinanceSources.FUNDAMENTALS).size());
  }

  @Test void testSchemaOverridesRenameAndRelaxColumns() throws IOException {
    PanelFixtures.writeCsv(input);
    writePrices();
    Table prices = SourceTables.load(input, PanelConfigLoader.parse(RENAMED_PRICES))
        .get(FinanceSources.PRICES);

    assertEquals(FinanceSources.PRICES.schema().getColumnNames(), prices.getColumns());
    assertEquals(Arrays.<Object>asList(-134.0, 136.0), prices.column("prc"));
    Map<String, Object> first = prices.getRows().get(0);
    assertEquals(12490L, first.get("permno"));
    assertEquals(2.0, first.get("cfacshr"));
    assertNull(first.get("cfacpr"));
    assertNull(first.get("shrout"));
  }

  @Test void testRenamedHeaderFailsWithoutOverride() throws IOException {
    PanelFixtures.writeCsv(input);
    writePrices();
    SchemaException e = assertThrows(SchemaException.class,
        () -> SourceTables.load(input, PanelConfigLoader.parse("panels: [forecasts]\n")));
    assertEquals("read:prices", e.getStage());
    assertTrue(e.getUnknownColumns().contains("prc"));
  }

  private void writePrices() throws IOException {
    Files.write(input.resolve("prices.csv"), ("permno,date,PRC,cfacshr\n"
        + "12490,2019-11-20,-134,2\n"
        + "12490,2019-11-22,136,2\n").getBytes(StandardCharsets.UTF_8));
  }
}

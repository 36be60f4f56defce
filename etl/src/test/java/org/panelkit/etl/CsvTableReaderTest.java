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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.Collections;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for CsvTableReader and CsvTableWriter.
 */
@Tag("unit")
public class CsvTableReaderTest {

  private static final SourceSchema PRICES = SourceSchema.of("prices",
      Arrays.asList("permno", "date"),
      ColumnConfig.of("permno", ColumnType.INTEGER),
      ColumnConfig.of("date", ColumnType.DATE),
      ColumnConfig.of("prc", ColumnType.DOUBLE),
      ColumnConfig.builder().name("cfacshr").type(ColumnType.DOUBLE).required(false).build());

  @TempDir
  Path tempDir;

  private Path write(String name, String content) throws IOException {
    Path file = tempDir.resolve(name);
    Files.write(file, content.getBytes(StandardCharsets.UTF_8));
    return file;
  }

  @Test void testTypedRead() throws IOException {
    Path file = write("prices.csv", "date,permno,prc,shrout\n"
        + "20191028,10107,144.19,7600\n"
        + "2019-10-29,10107,NA,7600\n"
        + "2019-10-30,10107.0,.,7600\n");
    Table table = new CsvTableReader().read(file, PRICES);

    assertEquals("prices", table.getName());
    assertEquals(Arrays.asList("permno", "date", "prc", "cfacshr"), table.getColumns());
    assertEquals(3, table.size());
    Map<String, Object> first = table.getRows().get(0);
    assertEquals(10107L, first.get("permno"));
    assertEquals(LocalDate.of(2019, 10, 28), first.get("date"));
    assertEquals(144.19, first.get("prc"));
    assertNull(first.get("cfacshr"));
    assertNull(table.getRows().get(1).get("prc"));
    assertNull(table.getRows().get(2).get("prc"));
    assertEquals(10107L, table.getRows().get(2).get("permno"));
  }

  @Test void testTabSeparated() throws IOException {
    Path file = write("prices.tsv", "permno\tdate\tprc\tcfacshr\n"
        + "10107\t2019-10-28\t-144.5\t1\n");
    Table table = new CsvTableReader().read(file, PRICES);
    assertEquals(-144.5, table.getRows().get(0).get("prc"));
    assertEquals(1.0, table.getRows().get(0).get("cfacshr"));
  }

  @Test void testCustomSentinels() throws IOException {
    Path file = write("prices.csv", "permno,date,prc\n10107,2019-10-28,-99\n");
    Table table = new CsvTableReader(Collections.singletonList("-99")).read(file, PRICES);
    assertNull(table.getRows().get(0).get("prc"));
  }

  @Test void testMissingRequiredColumn() throws IOException {
    Path file = write("prices.csv", "permno,prc\n10107,1.0\n");
    SchemaException e = assertThrows(SchemaException.class,
        () -> new CsvTableReader().read(file, PRICES));
    assertEquals(Collections.singletonList("date"), e.getUnknownColumns());
  }

  @Test void testBadCellIsAnIoError() throws IOException {
    Path file = write("prices.csv", "permno,date,prc\n10107,2019-10-28,abc\n");
    IOException e = assertThrows(IOException.class, () -> new CsvTableReader().read(file, PRICES));
    assertTrue(e.getMessage().contains(":2:"));
  }

  @Test void testUntypedRead() throws IOException {
    Path file = write("links.csv", "ticker,permno,score\nIBM,12490,0\n");
    Table table = new CsvTableReader().read(file, "links");
    assertEquals(Arrays.asList("ticker", "permno", "score"), table.getColumns());
    assertEquals("12490", table.getRows().get(0).get("permno"));
  }

  @Test void testWriteThenReadBack() throws IOException {
    Table table = Table.builder("prices", Arrays.asList("permno", "date", "prc", "cfacshr"))
        .row(10107L, LocalDate.of(2019, 10, 28), 144.19, null)
        .row(10107L, LocalDate.of(2019, 10, 29), -2.5, 1.0)
        .build();
    Path out = tempDir.resolve("out/prices.csv");
    new CsvTableWriter().write(table, out);

    assertEquals("permno,date,prc,cfacshr\n"
        + "10107,2019-10-28,144.19,\n"
        + "10107,2019-10-29,-2.5,1.0\n",
        new String(Files.readAllBytes(out), StandardCharsets.UTF_8));
    Table back = new CsvTableReader().read(out, PRICES);
    assertEquals(table.getRows(), back.getRows());
  }

  @Test void testWriterQuotesOnlyWhenNeeded() throws IOException {
    Table table = Table.builder("names", Arrays.asList("ticker", "name"))
        .row("BRK", "Berkshire, Hathaway")
        .build();
    Path out = tempDir.resolve("names.csv");
    new CsvTableWriter().write(table, out);
    assertEquals("ticker,name\nBRK,\"Berkshire, Hathaway\"\n",
        new String(Files.readAllBytes(out), StandardCharsets.UTF_8));
  }
}

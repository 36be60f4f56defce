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

import com.opencsv.CSVParserBuilder;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvValidationException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads a header-first delimited file into a typed {@link Table}.
 *
 * <p>Files ending in {@code .tsv} are tab separated, all others comma
 * separated. Cells equal to a sentinel string after trimming become missing.
 * Header columns not declared in the schema are ignored.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * Table prices = new CsvTableReader(CsvTableReader.DEFAULT_SENTINELS)
 *     .read(inputDir.resolve("crsp_daily.csv"), FinanceSources.PRICES.schema());
 * }</pre>
 */
public class CsvTableReader {

  private static final Logger LOGGER = LoggerFactory.getLogger(CsvTableReader.class);

  /** Strings read as missing when no sentinels are configured. */
  public static final Set<String> DEFAULT_SENTINELS =
      Collections.unmodifiableSet(new LinkedHashSet<String>(Arrays.asList("", "NA", ".")));

  private final Set<String> sentinels;

  public CsvTableReader() {
    this(DEFAULT_SENTINELS);
  }

  public CsvTableReader(Collection<String> sentinels) {
    Set<String> set = new LinkedHashSet<String>();
    set.add("");
    for (String sentinel : sentinels) {
      set.add(sentinel.trim());
    }
    this.sentinels = Collections.unmodifiableSet(set);
  }

  public Set<String> getSentinels() {
    return sentinels;
  }

  /**
   * Reads a file against a declared schema.
   *
   * @param path File to read
   * @param schema Declared columns; the table takes the schema's name
   * @return Typed table with the schema's columns in declaration order
   * @throws IOException if the file cannot be read or a cell does not parse
   * @throws SchemaException if a required column is absent from the header
   */
  public Table read(Path path, SourceSchema schema) throws IOException {
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
         CSVReader csv = open(reader, path)) {
      String[] header = readNext(csv, path);
      if (header == null) {
        throw new IOException("Empty file, no header: " + path);
      }
      Map<String, Integer> positions = new HashMap<String, Integer>();
      for (int i = 0; i < header.length; i++) {
        positions.putIfAbsent(stripBom(header[i]).trim(), i);
      }

      List<String> absent = new ArrayList<String>();
      int[] index = new int[schema.getColumns().size()];
      for (int c = 0; c < index.length; c++) {
        ColumnConfig column = schema.getColumns().get(c);
        Integer position = positions.get(column.getEffectiveSource());
        if (position == null) {
          if (column.isRequired()) {
            absent.add(column.getEffectiveSource());
          }
          index[c] = -1;
        } else {
          index[c] = position;
        }
      }
      if (!absent.isEmpty()) {
        throw new SchemaException("read:" + schema.getName(), path.getFileName().toString(),
            absent);
      }

      Table.Builder builder = Table.builder(schema.getName(), schema.getColumnNames());
      long line = 1;
      int missingCells = 0;
      String[] record;
      while ((record = readNext(csv, path)) != null) {
        line++;
        if (record.length == 1 && record[0].trim().isEmpty()) {
          continue;
        }
        if (record.length > header.length) {
          throw new IOException(path + ":" + line + ": expected " + header.length
              + " fields, got " + record.length);
        }
        Object[] values = new Object[index.length];
        for (int c = 0; c < index.length; c++) {
          String cell = index[c] >= 0 && index[c] < record.length ? record[index[c]] : null;
          if (cell == null || sentinels.contains(cell.trim())) {
            missingCells++;
            continue;
          }
          ColumnConfig column = schema.getColumns().get(c);
          try {
            values[c] = column.getType().parse(cell);
          } catch (IllegalArgumentException e) {
            throw new IOException(path + ":" + line + ": invalid " + column.getType()
                + " value '" + cell + "' for column '" + column.getName() + "'", e);
          }
        }
        builder.row(values);
      }
      Table table = builder.build();
      LOGGER.info("Read {} rows of '{}' from {}", table.size(), schema.getName(), path);
      LOGGER.debug("{} missing cells in {}", missingCells, path);
      return table;
    }
  }

  /**
   * Reads a file with every header column as a STRING column.
   */
  public Table read(Path path, String name) throws IOException {
    String[] header;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
         CSVReader csv = open(reader, path)) {
      header = readNext(csv, path);
    }
    if (header == null) {
      throw new IOException("Empty file, no header: " + path);
    }
    List<ColumnConfig> columns = new ArrayList<ColumnConfig>();
    for (String column : header) {
      columns.add(ColumnConfig.of(stripBom(column).trim(), ColumnType.STRING));
    }
    return read(path, new SourceSchema(name, columns, Collections.<String>emptyList()));
  }

  private static CSVReader open(Reader reader, Path path) {
    if (path.getFileName().toString().endsWith(".tsv")) {
      return new CSVReaderBuilder(reader)
          .withCSVParser(new CSVParserBuilder().withSeparator('\t').build())
          .build();
    }
    return new CSVReader(reader);
  }

  private static String[] readNext(CSVReader csv, Path path) throws IOException {
    try {
      return csv.readNext();
    } catch (CsvValidationException e) {
      throw new IOException("Malformed record in " + path + " at line " + e.getLineNumber(), e);
    }
  }

  private static String stripBom(String s) {
    return !s.isEmpty() && s.charAt(0) == '\uFEFF' ? s.substring(1) : s;
  }
}

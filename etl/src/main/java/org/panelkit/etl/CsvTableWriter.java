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

import com.opencsv.CSVWriter;
import com.opencsv.ICSVWriter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Writes a {@link Table} as a comma separated file with a header row.
 *
 * <p>Dates are ISO formatted, numbers use {@code Long.toString} or
 * {@code Double.toString}, missing values are empty and lines end with
 * {@code \n}. Equal tables produce byte-identical files.
 */
public class CsvTableWriter {

  private static final Logger LOGGER = LoggerFactory.getLogger(CsvTableWriter.class);

  /**
   * Writes the table, replacing any existing file.
   *
   * @throws IOException if the file cannot be written
   */
  public void write(Table table, Path path) throws IOException {
    Path parent = path.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    List<String> columns = table.getColumns();
    try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8);
         CSVWriter csv = new CSVWriter(writer, ICSVWriter.DEFAULT_SEPARATOR,
             ICSVWriter.DEFAULT_QUOTE_CHARACTER, ICSVWriter.DEFAULT_ESCAPE_CHARACTER, "\n")) {
      csv.writeNext(columns.toArray(new String[0]), false);
      String[] record = new String[columns.size()];
      for (Map<String, Object> row : table.getRows()) {
        for (int i = 0; i < record.length; i++) {
          record[i] = format(row.get(columns.get(i)));
        }
        csv.writeNext(record, false);
      }
      csv.flush();
      if (csv.checkError()) {
        throw new IOException("Failed writing " + path);
      }
    }
    LOGGER.info("Wrote {} rows of '{}' to {}", table.size(), table.getName(), path);
  }

  /**
   * Formats one cell.
   */
  static String format(Object value) {
    if (Values.isMissing(value)) {
      return "";
    }
    if (value instanceof Long || value instanceof Integer
        || value instanceof Short || value instanceof Byte) {
      return Long.toString(((Number) value).longValue());
    }
    if (value instanceof Number) {
      return Double.toString(((Number) value).doubleValue());
    }
    // LocalDate.toString is ISO-8601
    return value.toString();
  }
}

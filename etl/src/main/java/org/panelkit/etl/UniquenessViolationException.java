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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Thrown when a table holds more than one row for a key that must be unique.
 *
 * <p>The exception reports every offending key with the number of rows found
 * for it, together with the key columns and the size of the checked table.
 *
 * @see Deduplicator#requireUnique(Table, List, String)
 */
public class UniquenessViolationException extends PanelException {

  private static final int MAX_KEYS_IN_MESSAGE = 10;

  private final String tableName;
  private final List<String> keyColumns;
  private final Map<List<Object>, Integer> duplicates;
  private final int rowCount;

  public UniquenessViolationException(String stage, String tableName, List<String> keyColumns,
      Map<List<Object>, Integer> duplicates, int rowCount) {
    super(stage, buildMessage(tableName, keyColumns, duplicates, rowCount));
    this.tableName = tableName;
    this.keyColumns = Collections.unmodifiableList(new ArrayList<String>(keyColumns));
    this.duplicates = Collections.unmodifiableMap(
        new LinkedHashMap<List<Object>, Integer>(duplicates));
    this.rowCount = rowCount;
  }

  public String getTableName() {
    return tableName;
  }

  public List<String> getKeyColumns() {
    return keyColumns;
  }

  /**
   * Returns each duplicated key with the number of rows that share it.
   */
  public Map<List<Object>, Integer> getDuplicates() {
    return duplicates;
  }

  public int getRowCount() {
    return rowCount;
  }

  private static String buildMessage(String tableName, List<String> keyColumns,
      Map<List<Object>, Integer> duplicates, int rowCount) {
    StringBuilder sb = new StringBuilder();
    sb.append(duplicates.size()).append(" duplicate key(s) on ").append(keyColumns)
        .append(" in table '").append(tableName).append("' (").append(rowCount)
        .append(" rows): ");
    int shown = 0;
    for (Map.Entry<List<Object>, Integer> entry : duplicates.entrySet()) {
      if (shown == MAX_KEYS_IN_MESSAGE) {
        sb.append(", ...");
        break;
      }
      if (shown > 0) {
        sb.append(", ");
      }
      sb.append(entry.getKey()).append(" x").append(entry.getValue());
      shown++;
    }
    return sb.toString();
  }
}

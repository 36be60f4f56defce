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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Key-equality left join.
 *
 * <p>Every left row appears exactly once in the output, in input order. The
 * right table must be unique on its join key; a right row is looked up by
 * the normalized key, so {@code 10} and {@code 10.0} join. Right key columns
 * are not repeated in the output. A right column whose name is already
 * taken is suffixed with {@code _<right table name>}.
 */
public class TableJoiner {

  private static final Logger LOGGER = LoggerFactory.getLogger(TableJoiner.class);

  /**
   * Left-joins {@code right} onto {@code left}.
   *
   * @param left Preserved side
   * @param right Lookup side, unique on {@code rightKeys}
   * @param leftKeys Left key columns
   * @param rightKeys Right key columns, paired positionally with {@code leftKeys}
   * @param outputName Name of the joined table
   * @return Joined table
   * @throws SchemaException if a key column is unknown
   * @throws UniquenessViolationException if the right side repeats a key
   */
  public Table leftJoin(Table left, Table right, List<String> leftKeys, List<String> rightKeys,
      String outputName) {
    String stage = "join:" + outputName;
    if (leftKeys.isEmpty() || leftKeys.size() != rightKeys.size()) {
      throw new IllegalArgumentException("Join needs the same non-zero number of key columns, got "
          + leftKeys + " and " + rightKeys);
    }
    left.requireColumns(stage, leftKeys);
    right.requireColumns(stage, rightKeys);
    Deduplicator.requireUnique(right, rightKeys, stage);

    Set<String> rightKeySet = new LinkedHashSet<String>(rightKeys);
    List<String> columns = new ArrayList<String>(left.getColumns());
    Map<String, String> rightOutput = new LinkedHashMap<String, String>();
    for (String column : right.getColumns()) {
      if (rightKeySet.contains(column)) {
        continue;
      }
      String target = columns.contains(column) ? column + "_" + right.getName() : column;
      if (columns.contains(target)) {
        throw new SchemaException(stage, "Cannot add '" + column + "' from '"
            + right.getName() + "': '" + target + "' already exists");
      }
      columns.add(target);
      rightOutput.put(column, target);
    }

    Map<List<Object>, Map<String, Object>> lookup = new HashMap<List<Object>, Map<String, Object>>();
    for (Map<String, Object> row : right.getRows()) {
      List<Object> key = Values.keyOf(row, rightKeys);
      if (!Values.hasMissing(key)) {
        lookup.put(key, row);
      }
    }

    Table.Builder builder = Table.builder(outputName, columns);
    int matched = 0;
    for (Map<String, Object> row : left.getRows()) {
      List<Object> key = Values.keyOf(row, leftKeys);
      Map<String, Object> hit = Values.hasMissing(key) ? null : lookup.get(key);
      Map<String, Object> joined = new LinkedHashMap<String, Object>(row);
      for (Map.Entry<String, String> entry : rightOutput.entrySet()) {
        joined.put(entry.getValue(), hit == null ? null : hit.get(entry.getKey()));
      }
      if (hit != null) {
        matched++;
      }
      builder.add(joined);
    }
    Table result = builder.build();
    LOGGER.info("Joined '{}' onto '{}' on {}={}: {} of {} rows matched",
        right.getName(), left.getName(), leftKeys, rightKeys, matched, left.size());
    return result;
  }
}

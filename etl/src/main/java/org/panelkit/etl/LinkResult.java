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
 * Result of {@link EntityLinker#link}: the one-to-one mapping table and the
 * identifiers excluded as ambiguous.
 */
public class LinkResult {

  private final Table mapping;
  private final List<Object> ambiguous;
  private final int rejectedLinks;
  private final String sourceColumn;
  private final String targetColumn;

  LinkResult(Table mapping, List<Object> ambiguous, int rejectedLinks,
      String sourceColumn, String targetColumn) {
    this.mapping = mapping;
    this.ambiguous = Collections.unmodifiableList(new ArrayList<Object>(ambiguous));
    this.rejectedLinks = rejectedLinks;
    this.sourceColumn = sourceColumn;
    this.targetColumn = targetColumn;
  }

  /**
   * Returns the mapping table: one row per resolved source identifier with
   * its target and best score.
   */
  public Table getMapping() {
    return mapping;
  }

  /**
   * Returns the source identifiers dropped because they mapped to more than
   * one target, in ascending order.
   */
  public List<Object> getAmbiguous() {
    return ambiguous;
  }

  /**
   * Returns the number of raw links dropped by the score allow-list or for a
   * missing identifier.
   */
  public int getRejectedLinks() {
    return rejectedLinks;
  }

  /**
   * Returns the mapping as a map of normalized source identifier to target.
   */
  public Map<Object, Object> asMap() {
    Map<Object, Object> map = new LinkedHashMap<Object, Object>();
    for (Map<String, Object> row : mapping.getRows()) {
      map.put(Values.normalizeKey(row.get(sourceColumn)), row.get(targetColumn));
    }
    return map;
  }

  @Override public String toString() {
    return "LinkResult{mapped=" + mapping.size() + ", ambiguous=" + ambiguous.size()
        + ", rejected=" + rejectedLinks + "}";
  }
}

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
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Thrown when a stage references a column that its input table does not have.
 */
public class SchemaException extends PanelException {

  private final String tableName;
  private final List<String> unknownColumns;

  public SchemaException(String stage, String tableName, Collection<String> unknownColumns) {
    super(stage, "Table '" + tableName + "' has no column(s) " + unknownColumns);
    this.tableName = tableName;
    this.unknownColumns = Collections.unmodifiableList(new ArrayList<String>(unknownColumns));
  }

  public SchemaException(String stage, String message) {
    super(stage, message);
    this.tableName = null;
    this.unknownColumns = Collections.emptyList();
  }

  public String getTableName() {
    return tableName;
  }

  public List<String> getUnknownColumns() {
    return unknownColumns;
  }
}

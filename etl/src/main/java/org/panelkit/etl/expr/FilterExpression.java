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
package org.panelkit.etl.expr;

import java.util.Map;
import java.util.Set;

/**
 * Boolean predicate over a single row.
 *
 * <p>Filter expressions are data: a tree of {@link Filters} variants built in
 * code or parsed from configuration by {@link FilterParser}. The columns a
 * filter reads are known up front so a stage can reject a filter that
 * references an unknown column before touching any rows.
 *
 * @see Filters
 * @see FilterParser
 */
public interface FilterExpression {

  /**
   * Evaluates the predicate.
   *
   * @param row Map of column name to value (must not be modified)
   * @return true if the row passes
   */
  boolean test(Map<String, Object> row);

  /**
   * Returns every column this predicate reads.
   */
  Set<String> columns();
}

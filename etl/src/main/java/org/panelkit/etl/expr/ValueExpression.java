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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Map;
import java.util.Set;

/**
 * Expression producing one value from a row.
 *
 * <p>Evaluation never throws for missing or non-numeric operands; the result
 * is null (missing) instead.
 *
 * @see Expressions
 * @see ExpressionParser
 */
public interface ValueExpression {

  /**
   * Evaluates the expression against a row.
   *
   * @param row Map of column name to value (must not be modified)
   * @return The value, or null when missing
   */
  @Nullable Object evaluate(Map<String, Object> row);

  /**
   * Returns every column this expression reads.
   */
  Set<String> columns();
}

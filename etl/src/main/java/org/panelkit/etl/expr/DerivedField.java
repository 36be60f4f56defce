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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * An output column computed from a fallback chain.
 *
 * <p>A plain statistic is a field whose chain has a single candidate.
 */
public final class DerivedField {

  private final String name;
  private final FallbackChain chain;

  public DerivedField(String name, FallbackChain chain) {
    if (name == null || name.isEmpty()) {
      throw new IllegalArgumentException("Derived field name is required");
    }
    if (chain == null) {
      throw new IllegalArgumentException("Derived field '" + name + "' needs a chain");
    }
    this.name = name;
    this.chain = chain;
  }

  /**
   * Creates a field computed by a single expression.
   */
  public static DerivedField of(String name, ValueExpression expression) {
    return new DerivedField(name, FallbackChain.builder().candidate(expression).build());
  }

  /**
   * Creates a field computed by a single parsed expression.
   */
  public static DerivedField of(String name, String expression) {
    return of(name, ExpressionParser.parse(expression));
  }

  /**
   * Parses an ordered map of field name to chain node.
   *
   * @see FallbackChain#fromConfig(Object)
   */
  public static List<DerivedField> fromMap(Map<String, Object> map) {
    List<DerivedField> fields = new ArrayList<DerivedField>();
    if (map == null) {
      return fields;
    }
    for (Map.Entry<String, Object> entry : map.entrySet()) {
      fields.add(new DerivedField(entry.getKey(), FallbackChain.fromConfig(entry.getValue())));
    }
    return fields;
  }

  public String getName() {
    return name;
  }

  public FallbackChain getChain() {
    return chain;
  }

  @Override public String toString() {
    return name + " := " + chain.describe();
  }
}

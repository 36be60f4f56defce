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

import org.panelkit.etl.Values;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Ordered list of candidate expressions for one derived field.
 *
 * <p>The value is the first candidate that evaluates to a non-missing value,
 * after its optional transformation. When every candidate is missing the
 * chain yields its default, or missing if it has none. The order never
 * changes at runtime and is reported by {@link #describe()}.
 *
 * <h3>YAML Configuration Example</h3>
 * <pre>{@code
 * fallbacks:
 *   book_equity:
 *     chain: [seq, "ceq + pstk", "at - lt - mib"]
 *   pref:
 *     chain: [pstkrv, pstkl, pstk]
 *     default: 0
 * }</pre>
 */
public final class FallbackChain {

  /** Marker returned by {@link #resolvedIndex} when the default was used. */
  public static final int DEFAULT_USED = -1;
  /** Marker returned by {@link #resolvedIndex} when the chain yields missing. */
  public static final int NONE = -2;

  private final List<Candidate> candidates;
  private final @Nullable Object defaultValue;

  private FallbackChain(Builder builder) {
    this.candidates = Collections.unmodifiableList(new ArrayList<Candidate>(builder.candidates));
    this.defaultValue = builder.defaultValue;
  }

  /**
   * One element of a chain: an expression and an optional transformation
   * applied to its non-missing result.
   */
  public static final class Candidate {
    private final ValueExpression expression;
    private final @Nullable UnaryOperator<Object> transform;

    Candidate(ValueExpression expression, @Nullable UnaryOperator<Object> transform) {
      if (expression == null) {
        throw new IllegalArgumentException("Candidate expression is required");
      }
      this.expression = expression;
      this.transform = transform;
    }

    public ValueExpression getExpression() {
      return expression;
    }

    public boolean hasTransform() {
      return transform != null;
    }

    @Nullable Object evaluate(Map<String, Object> row) {
      Object value = expression.evaluate(row);
      if (Values.isMissing(value)) {
        return null;
      }
      if (transform == null) {
        return value;
      }
      Object transformed = transform.apply(value);
      return Values.isMissing(transformed) ? null : transformed;
    }

    @Override public String toString() {
      return hasTransform() ? expression + " [transformed]" : expression.toString();
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates a chain from expression strings, as read from configuration.
   *
   * @param expressions Candidate expressions in evaluation order
   * @param defaultValue Final default, or null for none
   */
  public static FallbackChain of(List<String> expressions, @Nullable Object defaultValue) {
    Builder builder = builder().defaultValue(defaultValue);
    for (String expression : expressions) {
      builder.candidate(expression);
    }
    return builder.build();
  }

  /**
   * Creates a chain from a YAML/JSON node: either a list of expressions or a
   * map with keys {@code chain} and optional {@code default}. A single string
   * is a one-element chain.
   */
  @SuppressWarnings("unchecked")
  public static FallbackChain fromConfig(Object node) {
    if (node instanceof String) {
      return of(Collections.singletonList((String) node), null);
    }
    if (node instanceof List) {
      return of(toStrings((List<?>) node), null);
    }
    if (node instanceof Map) {
      Map<String, Object> map = (Map<String, Object>) node;
      Object chain = map.get("chain");
      List<String> expressions;
      if (chain instanceof List) {
        expressions = toStrings((List<?>) chain);
      } else if (chain instanceof String) {
        expressions = Collections.singletonList((String) chain);
      } else {
        throw new IllegalArgumentException("Fallback needs a 'chain' list: " + map);
      }
      return of(expressions, map.get("default"));
    }
    throw new IllegalArgumentException("Invalid fallback chain: " + node);
  }

  public List<Candidate> getCandidates() {
    return candidates;
  }

  public @Nullable Object getDefaultValue() {
    return defaultValue;
  }

  /**
   * Evaluates the chain against a row.
   */
  public @Nullable Object evaluate(Map<String, Object> row) {
    for (Candidate candidate : candidates) {
      Object value = candidate.evaluate(row);
      if (value != null) {
        return value;
      }
    }
    return defaultValue;
  }

  /**
   * Returns the position of the candidate that supplies the value for a row,
   * {@link #DEFAULT_USED}, or {@link #NONE}.
   */
  public int resolvedIndex(Map<String, Object> row) {
    for (int i = 0; i < candidates.size(); i++) {
      if (candidates.get(i).evaluate(row) != null) {
        return i;
      }
    }
    return defaultValue != null ? DEFAULT_USED : NONE;
  }

  /**
   * Returns every column any candidate reads.
   */
  public Set<String> columns() {
    Set<String> columns = new LinkedHashSet<String>();
    for (Candidate candidate : candidates) {
      columns.addAll(candidate.getExpression().columns());
    }
    return columns;
  }

  /**
   * Describes the evaluation order, one entry per candidate, then the default.
   */
  public List<String> describe() {
    List<String> steps = new ArrayList<String>();
    for (Candidate candidate : candidates) {
      steps.add(candidate.toString());
    }
    if (defaultValue != null) {
      steps.add("default " + defaultValue);
    }
    return steps;
  }

  @Override public String toString() {
    return "FallbackChain" + describe();
  }

  private static List<String> toStrings(List<?> values) {
    List<String> result = new ArrayList<String>(values.size());
    for (Object value : values) {
      result.add(String.valueOf(value));
    }
    return result;
  }

  /**
   * Builder for FallbackChain.
   */
  public static class Builder {
    private final List<Candidate> candidates = new ArrayList<Candidate>();
    private Object defaultValue;

    public Builder candidate(ValueExpression expression) {
      candidates.add(new Candidate(expression, null));
      return this;
    }

    public Builder candidate(ValueExpression expression, UnaryOperator<Object> transform) {
      candidates.add(new Candidate(expression, transform));
      return this;
    }

    public Builder candidate(String expression) {
      return candidate(ExpressionParser.parse(expression));
    }

    public Builder defaultValue(@Nullable Object defaultValue) {
      this.defaultValue = defaultValue;
      return this;
    }

    public FallbackChain build() {
      if (candidates.isEmpty()) {
        throw new IllegalArgumentException("A fallback chain needs at least one candidate");
      }
      return new FallbackChain(this);
    }
  }
}

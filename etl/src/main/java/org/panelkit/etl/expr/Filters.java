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
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Filter expression variants and factory methods.
 *
 * <p>A comparison whose row value is missing is false: a missing cell never
 * satisfies {@code eq}, {@code ne}, {@code lt} or a range. Sentinel literals
 * such as {@code -99} are compared as ordinary values. Use
 * {@link #requireNonMissing(String...)} to drop rows with missing cells
 * explicitly.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * FilterExpression filter = Filters.and(
 *     Filters.eq("indfmt", "INDL"),
 *     Filters.between("fyear", 1990, 2020),
 *     Filters.in("fpi", "1", "2"),
 *     Filters.requireNonMissing("gvkey", "at"));
 * }</pre>
 */
public final class Filters {

  private static final FilterExpression ALWAYS_TRUE = new FilterExpression() {
    @Override public boolean test(Map<String, Object> row) {
      return true;
    }

    @Override public Set<String> columns() {
      return Collections.emptySet();
    }

    @Override public String toString() {
      return "TRUE";
    }
  };

  private Filters() {
  }

  /**
   * Comparison operators.
   */
  public enum Operator {
    EQ("="), NE("!="), LT("<"), LE("<="), GT(">"), GE(">=");

    private final String symbol;

    Operator(String symbol) {
      this.symbol = symbol;
    }

    public String getSymbol() {
      return symbol;
    }

    boolean accepts(int comparison) {
      switch (this) {
      case EQ:
        return comparison == 0;
      case NE:
        return comparison != 0;
      case LT:
        return comparison < 0;
      case LE:
        return comparison <= 0;
      case GT:
        return comparison > 0;
      case GE:
        return comparison >= 0;
      default:
        throw new AssertionError(this);
      }
    }

    /**
     * Parses an operator from its name ({@code "le"}) or symbol ({@code "<="}).
     */
    public static Operator fromString(String value) {
      if (value == null) {
        throw new IllegalArgumentException("Operator is required");
      }
      String v = value.trim();
      for (Operator op : values()) {
        if (op.name().equalsIgnoreCase(v) || op.symbol.equals(v)) {
          return op;
        }
      }
      if ("==".equals(v)) {
        return EQ;
      }
      if ("<>".equals(v)) {
        return NE;
      }
      throw new IllegalArgumentException("Unknown comparison operator: '" + value + "'");
    }
  }

  public static FilterExpression alwaysTrue() {
    return ALWAYS_TRUE;
  }

  public static FilterExpression compare(String column, Operator op, Object literal) {
    return new Comparison(column, op, literal);
  }

  public static FilterExpression eq(String column, Object literal) {
    return new Comparison(column, Operator.EQ, literal);
  }

  public static FilterExpression compareColumns(String left, Operator op, String right) {
    return new ColumnComparison(left, op, right);
  }

  public static FilterExpression between(String column, @Nullable Object lower,
      @Nullable Object upper) {
    return new Range(column, lower, upper);
  }

  public static FilterExpression in(String column, Object... values) {
    return new In(column, Arrays.asList(values));
  }

  public static FilterExpression in(String column, List<?> values) {
    return new In(column, values);
  }

  public static FilterExpression requireNonMissing(String... columns) {
    return new NotMissing(Arrays.asList(columns));
  }

  public static FilterExpression requireNonMissing(List<String> columns) {
    return new NotMissing(columns);
  }

  public static FilterExpression and(FilterExpression... operands) {
    return new And(Arrays.asList(operands));
  }

  public static FilterExpression and(List<FilterExpression> operands) {
    return new And(operands);
  }

  public static FilterExpression or(FilterExpression... operands) {
    return new Or(Arrays.asList(operands));
  }

  public static FilterExpression or(List<FilterExpression> operands) {
    return new Or(operands);
  }

  public static FilterExpression not(FilterExpression operand) {
    return new Not(operand);
  }

  /** Column compared with a literal. */
  public static final class Comparison implements FilterExpression {
    private final String column;
    private final Operator op;
    private final Object literal;

    Comparison(String column, Operator op, Object literal) {
      this.column = requireColumn(column);
      this.op = op;
      if (literal == null) {
        throw new IllegalArgumentException("Comparison on '" + column
            + "' needs a literal; use requireNonMissing for missing checks");
      }
      this.literal = literal;
    }

    @Override public boolean test(Map<String, Object> row) {
      Object value = row.get(column);
      if (Values.isMissing(value)) {
        return false;
      }
      return op.accepts(Values.compare(value, literal));
    }

    @Override public Set<String> columns() {
      return Collections.singleton(column);
    }

    @Override public String toString() {
      return column + " " + op.getSymbol() + " " + literal;
    }
  }

  /** Two columns of the same row compared with each other. */
  public static final class ColumnComparison implements FilterExpression {
    private final String left;
    private final Operator op;
    private final String right;

    ColumnComparison(String left, Operator op, String right) {
      this.left = requireColumn(left);
      this.op = op;
      this.right = requireColumn(right);
    }

    @Override public boolean test(Map<String, Object> row) {
      Object a = row.get(left);
      Object b = row.get(right);
      if (Values.isMissing(a) || Values.isMissing(b)) {
        return false;
      }
      return op.accepts(Values.compare(a, b));
    }

    @Override public Set<String> columns() {
      return new LinkedHashSet<String>(Arrays.asList(left, right));
    }

    @Override public String toString() {
      return left + " " + op.getSymbol() + " " + right;
    }
  }

  /** Inclusive range; either bound may be absent. */
  public static final class Range implements FilterExpression {
    private final String column;
    private final @Nullable Object lower;
    private final @Nullable Object upper;

    Range(String column, @Nullable Object lower, @Nullable Object upper) {
      this.column = requireColumn(column);
      if (lower == null && upper == null) {
        throw new IllegalArgumentException("Range on '" + column + "' needs a bound");
      }
      this.lower = lower;
      this.upper = upper;
    }

    @Override public boolean test(Map<String, Object> row) {
      Object value = row.get(column);
      if (Values.isMissing(value)) {
        return false;
      }
      if (lower != null && Values.compare(value, lower) < 0) {
        return false;
      }
      return upper == null || Values.compare(value, upper) <= 0;
    }

    @Override public Set<String> columns() {
      return Collections.singleton(column);
    }

    @Override public String toString() {
      return column + " BETWEEN " + (lower == null ? "-inf" : lower)
          + " AND " + (upper == null ? "+inf" : upper);
    }
  }

  /** Categorical set membership. */
  public static final class In implements FilterExpression {
    private final String column;
    private final List<Object> values;

    In(String column, List<?> values) {
      this.column = requireColumn(column);
      if (values == null || values.isEmpty()) {
        throw new IllegalArgumentException("IN on '" + column + "' needs at least one value");
      }
      this.values = Collections.unmodifiableList(new ArrayList<Object>(values));
    }

    @Override public boolean test(Map<String, Object> row) {
      Object value = row.get(column);
      if (Values.isMissing(value)) {
        return false;
      }
      for (Object candidate : values) {
        if (candidate != null && Values.compare(value, candidate) == 0) {
          return true;
        }
      }
      return false;
    }

    @Override public Set<String> columns() {
      return Collections.singleton(column);
    }

    @Override public String toString() {
      return column + " IN " + values;
    }
  }

  /** Passes rows whose listed cells are all present. */
  public static final class NotMissing implements FilterExpression {
    private final List<String> columns;

    NotMissing(List<String> columns) {
      if (columns == null || columns.isEmpty()) {
        throw new IllegalArgumentException("requireNonMissing needs at least one column");
      }
      for (String column : columns) {
        requireColumn(column);
      }
      this.columns = Collections.unmodifiableList(new ArrayList<String>(columns));
    }

    @Override public boolean test(Map<String, Object> row) {
      for (String column : columns) {
        if (Values.isMissing(row.get(column))) {
          return false;
        }
      }
      return true;
    }

    @Override public Set<String> columns() {
      return new LinkedHashSet<String>(columns);
    }

    @Override public String toString() {
      return "NOT_MISSING" + columns;
    }
  }

  /** Conjunction; an empty conjunction is true. */
  public static final class And implements FilterExpression {
    private final List<FilterExpression> operands;

    And(List<FilterExpression> operands) {
      this.operands = Collections.unmodifiableList(new ArrayList<FilterExpression>(operands));
    }

    @Override public boolean test(Map<String, Object> row) {
      for (FilterExpression operand : operands) {
        if (!operand.test(row)) {
          return false;
        }
      }
      return true;
    }

    @Override public Set<String> columns() {
      Set<String> columns = new LinkedHashSet<String>();
      for (FilterExpression operand : operands) {
        columns.addAll(operand.columns());
      }
      return columns;
    }

    @Override public String toString() {
      return join(" AND ", operands);
    }
  }

  /** Disjunction; an empty disjunction is false. */
  public static final class Or implements FilterExpression {
    private final List<FilterExpression> operands;

    Or(List<FilterExpression> operands) {
      this.operands = Collections.unmodifiableList(new ArrayList<FilterExpression>(operands));
    }

    @Override public boolean test(Map<String, Object> row) {
      for (FilterExpression operand : operands) {
        if (operand.test(row)) {
          return true;
        }
      }
      return false;
    }

    @Override public Set<String> columns() {
      Set<String> columns = new LinkedHashSet<String>();
      for (FilterExpression operand : operands) {
        columns.addAll(operand.columns());
      }
      return columns;
    }

    @Override public String toString() {
      return join(" OR ", operands);
    }
  }

  /** Negation. */
  public static final class Not implements FilterExpression {
    private final FilterExpression operand;

    Not(FilterExpression operand) {
      if (operand == null) {
        throw new IllegalArgumentException("NOT needs an operand");
      }
      this.operand = operand;
    }

    @Override public boolean test(Map<String, Object> row) {
      return !operand.test(row);
    }

    @Override public Set<String> columns() {
      return operand.columns();
    }

    @Override public String toString() {
      return "NOT (" + operand + ")";
    }
  }

  private static String requireColumn(String column) {
    if (column == null || column.isEmpty()) {
      throw new IllegalArgumentException("Filter column is required");
    }
    return column;
  }

  private static String join(String separator, List<FilterExpression> operands) {
    StringBuilder sb = new StringBuilder("(");
    for (int i = 0; i < operands.size(); i++) {
      if (i > 0) {
        sb.append(separator);
      }
      sb.append(operands.get(i));
    }
    return sb.append(")").toString();
  }
}

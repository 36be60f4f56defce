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

import org.panelkit.etl.Ratios;
import org.panelkit.etl.Values;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Value expression variants and factory methods.
 *
 * <p>Arithmetic results are {@code Double}. A missing (or non-numeric)
 * operand makes an arithmetic result missing.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * // at - lt - mib
 * ValueExpression reconstructed = Expressions.subtract(
 *     Expressions.subtract(Expressions.column("at"), Expressions.column("lt")),
 *     Expressions.column("mib"));
 * }</pre>
 */
public final class Expressions {

  private Expressions() {
  }

  /**
   * Binary arithmetic operators.
   */
  public enum BinaryOp {
    ADD("+"), SUBTRACT("-"), MULTIPLY("*"), DIVIDE("/");

    private final String symbol;

    BinaryOp(String symbol) {
      this.symbol = symbol;
    }

    @Nullable Double apply(double a, double b) {
      switch (this) {
      case ADD:
        return a + b;
      case SUBTRACT:
        return a - b;
      case MULTIPLY:
        return a * b;
      case DIVIDE:
        return Ratios.divide(a, b);
      default:
        throw new AssertionError(this);
      }
    }
  }

  /**
   * Named functions callable from parsed expressions.
   */
  public enum Function {
    /** Absolute value. */
    ABS(1, 1),
    /** {@code adj(value, factor)}: value divided by factor, zero factor treated as 1. */
    ADJ(2, 2),
    /** {@code ratio(num, den)}: zero denominator treated as 1. */
    RATIO(2, 2),
    /** First non-missing argument. */
    COALESCE(1, Integer.MAX_VALUE);

    private final int minArgs;
    private final int maxArgs;

    Function(int minArgs, int maxArgs) {
      this.minArgs = minArgs;
      this.maxArgs = maxArgs;
    }

    public static Function fromName(String name) {
      try {
        return valueOf(name.toUpperCase(Locale.ROOT));
      } catch (IllegalArgumentException e) {
        throw new IllegalArgumentException("Unknown function: '" + name + "'", e);
      }
    }
  }

  public static ValueExpression column(String name) {
    return new Column(name);
  }

  public static ValueExpression constant(@Nullable Object value) {
    return new Constant(value);
  }

  public static ValueExpression add(ValueExpression left, ValueExpression right) {
    return new Binary(BinaryOp.ADD, left, right);
  }

  public static ValueExpression subtract(ValueExpression left, ValueExpression right) {
    return new Binary(BinaryOp.SUBTRACT, left, right);
  }

  public static ValueExpression multiply(ValueExpression left, ValueExpression right) {
    return new Binary(BinaryOp.MULTIPLY, left, right);
  }

  public static ValueExpression divide(ValueExpression left, ValueExpression right) {
    return new Binary(BinaryOp.DIVIDE, left, right);
  }

  public static ValueExpression negate(ValueExpression operand) {
    return new Negate(operand);
  }

  /**
   * Sum of all operands; missing if any operand is missing.
   */
  public static ValueExpression sum(String... columns) {
    if (columns.length == 0) {
      throw new IllegalArgumentException("sum needs at least one column");
    }
    ValueExpression result = column(columns[0]);
    for (int i = 1; i < columns.length; i++) {
      result = add(result, column(columns[i]));
    }
    return result;
  }

  public static ValueExpression call(Function function, ValueExpression... args) {
    return new Call(function, Arrays.asList(args));
  }

  public static ValueExpression call(Function function, List<ValueExpression> args) {
    return new Call(function, args);
  }

  /** Reads a column. */
  public static final class Column implements ValueExpression {
    private final String name;

    Column(String name) {
      if (name == null || name.isEmpty()) {
        throw new IllegalArgumentException("Column name is required");
      }
      this.name = name;
    }

    public String getName() {
      return name;
    }

    @Override public @Nullable Object evaluate(Map<String, Object> row) {
      Object value = row.get(name);
      return Values.isMissing(value) ? null : value;
    }

    @Override public Set<String> columns() {
      return Collections.singleton(name);
    }

    @Override public String toString() {
      return name;
    }
  }

  /** Literal value. */
  public static final class Constant implements ValueExpression {
    private final @Nullable Object value;

    Constant(@Nullable Object value) {
      this.value = value;
    }

    @Override public @Nullable Object evaluate(Map<String, Object> row) {
      return value;
    }

    @Override public Set<String> columns() {
      return Collections.emptySet();
    }

    @Override public String toString() {
      return String.valueOf(value);
    }
  }

  /** Arithmetic on two operands. */
  public static final class Binary implements ValueExpression {
    private final BinaryOp op;
    private final ValueExpression left;
    private final ValueExpression right;

    Binary(BinaryOp op, ValueExpression left, ValueExpression right) {
      this.op = op;
      this.left = left;
      this.right = right;
    }

    @Override public @Nullable Object evaluate(Map<String, Object> row) {
      Double a = Values.toDouble(left.evaluate(row));
      if (a == null) {
        return null;
      }
      Double b = Values.toDouble(right.evaluate(row));
      if (b == null) {
        return null;
      }
      return op.apply(a, b);
    }

    @Override public Set<String> columns() {
      Set<String> columns = new LinkedHashSet<String>(left.columns());
      columns.addAll(right.columns());
      return columns;
    }

    @Override public String toString() {
      return "(" + left + " " + op.symbol + " " + right + ")";
    }
  }

  /** Unary minus. */
  public static final class Negate implements ValueExpression {
    private final ValueExpression operand;

    Negate(ValueExpression operand) {
      this.operand = operand;
    }

    @Override public @Nullable Object evaluate(Map<String, Object> row) {
      Double value = Values.toDouble(operand.evaluate(row));
      return value == null ? null : -value;
    }

    @Override public Set<String> columns() {
      return operand.columns();
    }

    @Override public String toString() {
      return "-" + operand;
    }
  }

  /** Function call. */
  public static final class Call implements ValueExpression {
    private final Function function;
    private final List<ValueExpression> args;

    Call(Function function, List<ValueExpression> args) {
      if (args.size() < function.minArgs || args.size() > function.maxArgs) {
        throw new IllegalArgumentException(function.name().toLowerCase(Locale.ROOT)
            + " takes " + describeArity(function) + " argument(s), got " + args.size());
      }
      this.function = function;
      this.args = Collections.unmodifiableList(new ArrayList<ValueExpression>(args));
    }

    @Override public @Nullable Object evaluate(Map<String, Object> row) {
      switch (function) {
      case ABS:
        Double value = Values.toDouble(args.get(0).evaluate(row));
        return value == null ? null : Math.abs(value);
      case ADJ:
        return Ratios.adjust(Values.toDouble(args.get(0).evaluate(row)),
            Values.toDouble(args.get(1).evaluate(row)));
      case RATIO:
        return Ratios.ratio(Values.toDouble(args.get(0).evaluate(row)),
            Values.toDouble(args.get(1).evaluate(row)));
      case COALESCE:
        for (ValueExpression arg : args) {
          Object candidate = arg.evaluate(row);
          if (!Values.isMissing(candidate)) {
            return candidate;
          }
        }
        return null;
      default:
        throw new AssertionError(function);
      }
    }

    @Override public Set<String> columns() {
      Set<String> columns = new LinkedHashSet<String>();
      for (ValueExpression arg : args) {
        columns.addAll(arg.columns());
      }
      return columns;
    }

    @Override public String toString() {
      StringBuilder sb = new StringBuilder(function.name().toLowerCase(Locale.ROOT)).append("(");
      for (int i = 0; i < args.size(); i++) {
        if (i > 0) {
          sb.append(", ");
        }
        sb.append(args.get(i));
      }
      return sb.append(")").toString();
    }

    private static String describeArity(Function function) {
      if (function.minArgs == function.maxArgs) {
        return String.valueOf(function.minArgs);
      }
      return "at least " + function.minArgs;
    }
  }
}

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

/**
 * Recursive-descent parser for column arithmetic.
 *
 * <p>Grammar:
 * <pre>
 * expr    := term (('+' | '-') term)*
 * term    := unary (('*' | '/') unary)*
 * unary   := '-' unary | primary
 * primary := NUMBER | IDENT | IDENT '(' expr (',' expr)* ')' | '(' expr ')'
 * </pre>
 *
 * <p>Identifiers name columns, or functions when followed by a parenthesis
 * (see {@link Expressions.Function}).
 *
 * <h3>Examples</h3>
 * <pre>{@code
 * ExpressionParser.parse("at - lt - mib");
 * ExpressionParser.parse("book_equity + coalesce(txditc, 0) - pref");
 * ExpressionParser.parse("abs(actual - value) / adj(abs(prc), cfacshr)");
 * }</pre>
 */
public final class ExpressionParser {

  private final String text;
  private int pos;

  private ExpressionParser(String text) {
    this.text = text;
  }

  /**
   * Parses an expression.
   *
   * @throws IllegalArgumentException on a syntax error, naming the position
   */
  public static ValueExpression parse(String text) {
    if (text == null || text.trim().isEmpty()) {
      throw new IllegalArgumentException("Expression is empty");
    }
    ExpressionParser parser = new ExpressionParser(text);
    ValueExpression expression = parser.expr();
    parser.skipWhitespace();
    if (parser.pos < text.length()) {
      throw parser.error("Unexpected '" + text.charAt(parser.pos) + "'");
    }
    return expression;
  }

  private ValueExpression expr() {
    ValueExpression left = term();
    while (true) {
      if (accept('+')) {
        left = Expressions.add(left, term());
      } else if (accept('-')) {
        left = Expressions.subtract(left, term());
      } else {
        return left;
      }
    }
  }

  private ValueExpression term() {
    ValueExpression left = unary();
    while (true) {
      if (accept('*')) {
        left = Expressions.multiply(left, unary());
      } else if (accept('/')) {
        left = Expressions.divide(left, unary());
      } else {
        return left;
      }
    }
  }

  private ValueExpression unary() {
    if (accept('-')) {
      return Expressions.negate(unary());
    }
    return primary();
  }

  private ValueExpression primary() {
    skipWhitespace();
    if (pos >= text.length()) {
      throw error("Unexpected end of expression");
    }
    char c = text.charAt(pos);
    if (accept('(')) {
      ValueExpression inner = expr();
      expect(')');
      return inner;
    }
    if (Character.isDigit(c) || c == '.') {
      return Expressions.constant(number());
    }
    if (Character.isLetter(c) || c == '_') {
      String name = identifier();
      if (accept('(')) {
        List<ValueExpression> args = new ArrayList<ValueExpression>();
        if (!accept(')')) {
          do {
            args.add(expr());
          } while (accept(','));
          expect(')');
        }
        try {
          return Expressions.call(Expressions.Function.fromName(name), args);
        } catch (IllegalArgumentException e) {
          throw error(e.getMessage());
        }
      }
      return Expressions.column(name);
    }
    throw error("Unexpected '" + c + "'");
  }

  private Double number() {
    int start = pos;
    while (pos < text.length()
        && (Character.isDigit(text.charAt(pos)) || text.charAt(pos) == '.')) {
      pos++;
    }
    if (pos < text.length() && (text.charAt(pos) == 'e' || text.charAt(pos) == 'E')) {
      pos++;
      if (pos < text.length() && (text.charAt(pos) == '+' || text.charAt(pos) == '-')) {
        pos++;
      }
      while (pos < text.length() && Character.isDigit(text.charAt(pos))) {
        pos++;
      }
    }
    String literal = text.substring(start, pos);
    try {
      return Double.valueOf(literal);
    } catch (NumberFormatException e) {
      pos = start;
      throw error("Invalid number '" + literal + "'");
    }
  }

  private String identifier() {
    int start = pos;
    while (pos < text.length()
        && (Character.isLetterOrDigit(text.charAt(pos)) || text.charAt(pos) == '_')) {
      pos++;
    }
    return text.substring(start, pos);
  }

  private boolean accept(char expected) {
    skipWhitespace();
    if (pos < text.length() && text.charAt(pos) == expected) {
      pos++;
      return true;
    }
    return false;
  }

  private void expect(char expected) {
    if (!accept(expected)) {
      throw error("Expected '" + expected + "'");
    }
  }

  private void skipWhitespace() {
    while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
      pos++;
    }
  }

  private IllegalArgumentException error(String message) {
    return new IllegalArgumentException(message + " at position " + pos
        + " in expression '" + text + "'");
  }
}

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

import java.time.LocalDate;

/**
 * Cell types of a delimited source column.
 */
public enum ColumnType {
  STRING,
  /** Whole numbers, read as {@code Long}. */
  INTEGER,
  DOUBLE,
  /** ISO ({@code 2019-10-28}) or compact ({@code 20191028}) dates. */
  DATE;

  /**
   * Converts a non-sentinel text cell.
   *
   * @throws IllegalArgumentException if the text is not a value of this type
   */
  public Object parse(String text) {
    String s = text.trim();
    switch (this) {
      case INTEGER:
        try {
          return Long.parseLong(s);
        } catch (NumberFormatException e) {
          double d = Double.parseDouble(s);
          if (d != Math.rint(d)) {
            throw new IllegalArgumentException("Not a whole number: " + text);
          }
          return (long) d;
        }
      case DOUBLE:
        return Double.parseDouble(s);
      case DATE:
        LocalDate date = Values.toDate(s);
        if (date == null) {
          throw new IllegalArgumentException("Not a date: " + text);
        }
        return date;
      case STRING:
      default:
        return text;
    }
  }

  /**
   * Parses a type name such as {@code string}, {@code int}, {@code double}
   * or {@code date}.
   *
   * @param value Type name (case-insensitive); null or empty means STRING
   */
  public static ColumnType fromString(String value) {
    if (value == null || value.isEmpty()) {
      return STRING;
    }
    switch (value.toLowerCase()) {
      case "string":
      case "varchar":
      case "text":
        return STRING;
      case "int":
      case "integer":
      case "long":
      case "bigint":
        return INTEGER;
      case "double":
      case "float":
      case "decimal":
      case "number":
        return DOUBLE;
      case "date":
        return DATE;
      default:
        throw new IllegalArgumentException("Unknown column type: " + value);
    }
  }
}

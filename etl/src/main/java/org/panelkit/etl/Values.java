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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Conversion and comparison rules for cell values.
 *
 * <p>Cells hold {@code String}, {@code Long}/{@code Integer}, {@code Double}
 * or {@link LocalDate}; {@code null} (and {@code NaN}) means missing.
 * Numbers compare numerically regardless of their boxed type, dates compare
 * chronologically, and an ISO date string is promoted to a date when compared
 * against a date. Missing values sort after every present value.
 */
public final class Values {

  private static final DateTimeFormatter BASIC_DATE = DateTimeFormatter.BASIC_ISO_DATE;

  /** Orders composite keys element by element using {@link #compare}. */
  public static final Comparator<List<Object>> KEY_ORDER = new Comparator<List<Object>>() {
    @Override public int compare(List<Object> a, List<Object> b) {
      int n = Math.min(a.size(), b.size());
      for (int i = 0; i < n; i++) {
        int c = Values.compare(a.get(i), b.get(i));
        if (c != 0) {
          return c;
        }
      }
      return Integer.compare(a.size(), b.size());
    }
  };

  private Values() {
  }

  public static boolean isMissing(@Nullable Object value) {
    if (value == null) {
      return true;
    }
    return value instanceof Double && ((Double) value).isNaN();
  }

  /**
   * Converts a cell to a double, or null when it is missing or not numeric.
   */
  public static @Nullable Double toDouble(@Nullable Object value) {
    if (isMissing(value)) {
      return null;
    }
    if (value instanceof Number) {
      return ((Number) value).doubleValue();
    }
    if (value instanceof String) {
      try {
        return Double.valueOf(((String) value).trim());
      } catch (NumberFormatException e) {
        return null;
      }
    }
    return null;
  }

  /**
   * Converts a cell to a date. Accepts {@link LocalDate}, ISO
   * ({@code 2019-10-30}) and basic ({@code 20191030}) strings.
   */
  public static @Nullable LocalDate toDate(@Nullable Object value) {
    if (value == null) {
      return null;
    }
    if (value instanceof LocalDate) {
      return (LocalDate) value;
    }
    if (value instanceof String) {
      return parseDate((String) value);
    }
    return null;
  }

  /**
   * Returns the calendar year of a cell. Dates yield their year, integral
   * numbers and four-digit strings are taken as the year itself.
   */
  public static @Nullable Integer yearOf(@Nullable Object value) {
    if (isMissing(value)) {
      return null;
    }
    if (value instanceof LocalDate) {
      return ((LocalDate) value).getYear();
    }
    if (value instanceof Number) {
      return ((Number) value).intValue();
    }
    if (value instanceof String) {
      String s = ((String) value).trim();
      if (s.matches("\\d{4}")) {
        return Integer.valueOf(s);
      }
      LocalDate date = parseDate(s);
      return date == null ? null : date.getYear();
    }
    return null;
  }

  /**
   * Normalizes a key cell so that equal keys have equal hash codes:
   * integral numbers become {@code Long}, NaN becomes null.
   */
  public static @Nullable Object normalizeKey(@Nullable Object value) {
    if (isMissing(value)) {
      return null;
    }
    if (value instanceof Number) {
      double d = ((Number) value).doubleValue();
      if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < 9.0E15) {
        return (long) d;
      }
      return d;
    }
    return value;
  }

  /**
   * Extracts the normalized composite key of a row.
   */
  public static List<Object> keyOf(Map<String, Object> row, List<String> columns) {
    List<Object> key = new ArrayList<Object>(columns.size());
    for (String column : columns) {
      key.add(normalizeKey(row.get(column)));
    }
    return key;
  }

  /**
   * Returns true when any element of a key is missing.
   */
  public static boolean hasMissing(List<Object> key) {
    for (Object element : key) {
      if (element == null) {
        return true;
      }
    }
    return false;
  }

  /**
   * Compares two cells; missing values sort last.
   */
  public static int compare(@Nullable Object a, @Nullable Object b) {
    boolean aMissing = isMissing(a);
    boolean bMissing = isMissing(b);
    if (aMissing || bMissing) {
      return aMissing == bMissing ? 0 : (aMissing ? 1 : -1);
    }
    if (a instanceof Number && b instanceof Number) {
      return Double.compare(((Number) a).doubleValue(), ((Number) b).doubleValue());
    }
    if (a instanceof LocalDate || b instanceof LocalDate) {
      LocalDate da = toDate(a);
      LocalDate db = toDate(b);
      if (da != null && db != null) {
        return da.compareTo(db);
      }
    }
    if (a instanceof Number || b instanceof Number) {
      Double na = toDouble(a);
      Double nb = toDouble(b);
      if (na != null && nb != null) {
        return Double.compare(na, nb);
      }
    }
    return a.toString().compareTo(b.toString());
  }

  private static @Nullable LocalDate parseDate(String text) {
    String s = text.trim();
    if (s.isEmpty()) {
      return null;
    }
    try {
      if (s.length() == 8 && s.chars().allMatch(Character::isDigit)) {
        return LocalDate.parse(s, BASIC_DATE);
      }
      return LocalDate.parse(s);
    } catch (DateTimeParseException e) {
      return null;
    }
  }
}

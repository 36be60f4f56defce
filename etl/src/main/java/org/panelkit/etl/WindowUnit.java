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

import java.time.DayOfWeek;
import java.time.LocalDate;

/**
 * Units in which a {@link LookbackWindow} is measured.
 *
 * @see LookbackWindow
 */
public enum WindowUnit {
  /** Calendar days. */
  DAYS,

  /**
   * Weekdays; Saturdays and Sundays are not counted.
   *
   * <pre>{@code
   * lookback:
   *   length: 5
   *   unit: business_days
   * }</pre>
   */
  BUSINESS_DAYS,

  /** Calendar weeks of seven days. */
  WEEKS,

  /** Calendar months; the day of month is clamped to the month length. */
  MONTHS;

  /**
   * Returns the date {@code length} units before {@code target}.
   */
  public LocalDate minus(LocalDate target, int length) {
    switch (this) {
      case DAYS:
        return target.minusDays(length);
      case WEEKS:
        return target.minusWeeks(length);
      case MONTHS:
        return target.minusMonths(length);
      case BUSINESS_DAYS:
      default:
        LocalDate date = target;
        int counted = 0;
        while (counted < length) {
          date = date.minusDays(1);
          if (isWeekday(date)) {
            counted++;
          }
        }
        return date;
    }
  }

  private static boolean isWeekday(LocalDate date) {
    DayOfWeek day = date.getDayOfWeek();
    return day != DayOfWeek.SATURDAY && day != DayOfWeek.SUNDAY;
  }

  /**
   * Parses a unit name (case-insensitive, singular or plural).
   *
   * @param value Unit name; null or empty means DAYS
   * @throws IllegalArgumentException if the name is not a known unit
   */
  public static WindowUnit fromString(String value) {
    if (value == null || value.isEmpty()) {
      return DAYS;
    }
    switch (value.toLowerCase()) {
      case "day":
      case "days":
        return DAYS;
      case "business_day":
      case "business_days":
      case "businessdays":
      case "bday":
      case "bdays":
        return BUSINESS_DAYS;
      case "week":
      case "weeks":
        return WEEKS;
      case "month":
      case "months":
        return MONTHS;
      default:
        throw new IllegalArgumentException("Unknown lookback unit: " + value);
    }
  }
}

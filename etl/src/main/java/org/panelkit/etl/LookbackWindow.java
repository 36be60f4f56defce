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
import java.util.Map;

/**
 * Inclusive window {@code [target - length units, target]} searched by the
 * {@link NearestDateMatcher}.
 *
 * <pre>{@code
 * lookback:
 *   length: 7
 *   unit: days
 * }</pre>
 */
public final class LookbackWindow {

  private final int length;
  private final WindowUnit unit;

  public LookbackWindow(int length, WindowUnit unit) {
    if (length < 0) {
      throw new IllegalArgumentException("Lookback length must be >= 0, got " + length);
    }
    if (unit == null) {
      throw new IllegalArgumentException("Lookback unit is required");
    }
    this.length = length;
    this.unit = unit;
  }

  public static LookbackWindow days(int length) {
    return new LookbackWindow(length, WindowUnit.DAYS);
  }

  /**
   * Parses a window from a configuration map with {@code length} and
   * optional {@code unit} keys.
   *
   * @param map Configuration map; null yields the given default
   * @param defaultWindow Window used when the map is null
   */
  public static LookbackWindow fromMap(Map<String, Object> map, LookbackWindow defaultWindow) {
    if (map == null) {
      return defaultWindow;
    }
    int length = defaultWindow.length;
    Object lengthObj = map.get("length");
    if (lengthObj instanceof Number) {
      length = ((Number) lengthObj).intValue();
    } else if (lengthObj instanceof String) {
      length = Integer.parseInt(((String) lengthObj).trim());
    }
    WindowUnit unit = defaultWindow.unit;
    Object unitObj = map.get("unit");
    if (unitObj instanceof String) {
      unit = WindowUnit.fromString((String) unitObj);
    }
    return new LookbackWindow(length, unit);
  }

  public int getLength() {
    return length;
  }

  public WindowUnit getUnit() {
    return unit;
  }

  /**
   * Returns the earliest date inside the window ending at {@code target}.
   */
  public LocalDate start(LocalDate target) {
    return unit.minus(target, length);
  }

  /**
   * Returns true if {@code candidate} lies inside the window ending at {@code target}.
   */
  public boolean contains(LocalDate target, LocalDate candidate) {
    return !candidate.isAfter(target) && !candidate.isBefore(start(target));
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof LookbackWindow)) {
      return false;
    }
    LookbackWindow that = (LookbackWindow) o;
    return length == that.length && unit == that.unit;
  }

  @Override public int hashCode() {
    return 31 * length + unit.hashCode();
  }

  @Override public String toString() {
    return length + " " + unit.name().toLowerCase();
  }
}

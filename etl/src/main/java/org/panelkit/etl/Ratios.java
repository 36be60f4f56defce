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

/**
 * Null-propagating arithmetic used by derived fields.
 *
 * <p>Every method returns null when an operand is missing; none of them
 * throws on a zero denominator. {@link #adjust} and {@link #ratio} treat a
 * zero factor or denominator as 1, {@link #divide} returns missing instead.
 */
public final class Ratios {

  private Ratios() {
  }

  /**
   * Divides a value by an adjustment factor; a zero factor is neutral.
   */
  public static @Nullable Double adjust(@Nullable Double value, @Nullable Double factor) {
    if (value == null || factor == null) {
      return null;
    }
    return value / neutral(factor);
  }

  /**
   * Ratio with a zero denominator treated as 1.
   */
  public static @Nullable Double ratio(@Nullable Double numerator, @Nullable Double denominator) {
    if (numerator == null || denominator == null) {
      return null;
    }
    return numerator / neutral(denominator);
  }

  /**
   * Strict division: a zero denominator yields missing.
   */
  public static @Nullable Double divide(@Nullable Double numerator, @Nullable Double denominator) {
    if (numerator == null || denominator == null || denominator == 0.0) {
      return null;
    }
    return numerator / denominator;
  }

  /**
   * Signed error of an estimate scaled by the magnitude of {@code scale}:
   * {@code (actual - estimate) / |scale|}, zero scale treated as 1.
   */
  public static @Nullable Double relativeError(@Nullable Double actual, @Nullable Double estimate,
      @Nullable Double scale) {
    if (actual == null || estimate == null || scale == null) {
      return null;
    }
    return ratio(actual - estimate, Math.abs(scale));
  }

  private static double neutral(double factor) {
    return factor == 0.0 ? 1.0 : factor;
  }
}

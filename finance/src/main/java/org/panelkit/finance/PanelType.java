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
package org.panelkit.finance;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Panels a run can produce.
 */
public enum PanelType {
  /** Firm-year fundamentals panel with book equity and book-to-market. */
  FIRM_YEARS(FinanceSources.FUNDAMENTALS),

  /** Analyst forecast panel, with its consensus panel. */
  ANALYST_FORECASTS(FinanceSources.FORECASTS, FinanceSources.ACTUALS,
      FinanceSources.LINKS, FinanceSources.PRICES);

  private final List<FinanceSources> requiredSources;

  PanelType(FinanceSources... requiredSources) {
    this.requiredSources = Collections.unmodifiableList(Arrays.asList(requiredSources));
  }

  /**
   * Returns the sources this panel reads.
   */
  public List<FinanceSources> getRequiredSources() {
    return requiredSources;
  }

  /**
   * Returns the union of the sources read by the given panels.
   */
  public static Set<FinanceSources> requiredSources(Set<PanelType> panels) {
    Set<FinanceSources> sources = EnumSet.noneOf(FinanceSources.class);
    for (PanelType panel : panels) {
      sources.addAll(panel.requiredSources);
    }
    return sources;
  }

  /**
   * Parses a panel name such as {@code firm_years} or {@code forecasts}.
   *
   * @throws IllegalArgumentException if the name is unknown
   */
  public static PanelType fromString(String value) {
    if (value == null) {
      throw new IllegalArgumentException("Panel name is required");
    }
    switch (value.toLowerCase()) {
      case "firm_years":
      case "firmyears":
      case "fundamentals":
        return FIRM_YEARS;
      case "analyst_forecasts":
      case "forecasts":
      case "ibes":
        return ANALYST_FORECASTS;
      default:
        throw new IllegalArgumentException("Unknown panel: " + value);
    }
  }
}

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
package org.panelkit.finance.crsp;

import org.panelkit.etl.LookbackWindow;
import org.panelkit.etl.NearestDateMatcher;
import org.panelkit.etl.StageContext;
import org.panelkit.etl.Table;

/**
 * Attaches the security price in effect on a given date.
 *
 * <p>The price is the one dated on or before the target date, no older than
 * the lookback window. The cumulative share adjustment factor of the same
 * observation is carried with it, together with the observation date as
 * {@code price_date}.
 */
public class CrspPriceLookup {

  /** Column receiving the date of the matched price. */
  public static final String PRICE_DATE = "price_date";

  private final NearestDateMatcher matcher;

  /**
   * Creates a lookup.
   *
   * @param dateColumn Column of the left table holding the target date
   * @param window Lookback window
   * @param tieBreakColumn Price column whose lowest value wins among
   *     observations on the same date, or null
   */
  public CrspPriceLookup(String dateColumn, LookbackWindow window, String tieBreakColumn) {
    this.matcher = NearestDateMatcher.builder()
        .leftKeys("permno")
        .leftDate(dateColumn)
        .rightKeys("permno")
        .rightDate("date")
        .carry("prc")
        .carry("cfacshr")
        .matchedDateColumn(PRICE_DATE)
        .window(window)
        .tieBreakColumn(tieBreakColumn)
        .build();
  }

  /**
   * Adds {@code prc}, {@code cfacshr} and {@code price_date} to every row.
   *
   * @param rows Table with {@code permno} and the date column
   * @param prices Daily prices
   * @param context Run context
   */
  public Table attach(Table rows, Table prices, StageContext context) {
    return matcher.match(rows, prices, context);
  }
}

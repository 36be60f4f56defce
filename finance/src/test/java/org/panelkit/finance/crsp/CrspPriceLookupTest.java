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
import org.panelkit.etl.StageContext;
import org.panelkit.etl.Table;
import org.panelkit.etl.WindowUnit;
import org.panelkit.finance.PanelFixtures;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

/**
 * Tests for CrspPriceLookup.
 */
@Tag("unit")
public class CrspPriceLookupTest {

  private static Table targets() {
    return Table.builder("events", Arrays.asList("permno", "event_date"))
        .row(12490L, LocalDate.of(2019, 11, 21))
        .row(12490L, LocalDate.of(2019, 11, 17))
        .row(10107L, LocalDate.of(2019, 5, 6))
        .build();
  }

  @Test void testPriceOnOrBeforeDate() {
    Table priced = new CrspPriceLookup("event_date", LookbackWindow.days(7), null)
        .attach(targets(), PanelFixtures.prices(), StageContext.sequential());

    Map<String, Object> first = priced.getRows().get(1);
    assertEquals(LocalDate.of(2019, 11, 21), first.get("event_date"));
    assertEquals(-134.0, first.get("prc"));
    assertEquals(2.0, first.get("cfacshr"));
    assertEquals(LocalDate.of(2019, 11, 20), first.get(CrspPriceLookup.PRICE_DATE));

    // nothing on or before 2019-11-17
    assertNull(priced.getRows().get(2).get("prc"));
  }

  @Test void testWiderWindowReachesOlderPrice() {
    Table priced = new CrspPriceLookup("event_date", new LookbackWindow(10, WindowUnit.DAYS), null)
        .attach(targets(), PanelFixtures.prices(), StageContext.sequential());
    Map<String, Object> msft = priced.getRows().get(0);
    assertEquals(10107L, msft.get("permno"));
    assertEquals(129.0, msft.get("prc"));
    assertEquals(LocalDate.of(2019, 4, 26), msft.get(CrspPriceLookup.PRICE_DATE));
  }
}

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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

/**
 * Tests for Ratios.
 */
@Tag("unit")
public class RatiosTest {

  @Test void testZeroFactorTreatedAsOne() {
    assertEquals(Double.valueOf(25.0), Ratios.adjust(25.0, 0.0));
    assertEquals(Double.valueOf(12.5), Ratios.adjust(25.0, 2.0));
    assertEquals(Double.valueOf(3.0), Ratios.ratio(3.0, 0.0));
  }

  @Test void testStrictDivision() {
    assertNull(Ratios.divide(3.0, 0.0));
    assertEquals(Double.valueOf(1.5), Ratios.divide(3.0, 2.0));
  }

  @Test void testMissingPropagates() {
    assertNull(Ratios.adjust(null, 2.0));
    assertNull(Ratios.adjust(2.0, null));
    assertNull(Ratios.ratio(null, 0.0));
    assertNull(Ratios.relativeError(1.0, null, 2.0));
  }

  @Test void testRelativeErrorUsesMagnitudeOfScale() {
    assertEquals(Double.valueOf(-0.25), Ratios.relativeError(1.0, 1.5, -2.0));
    assertEquals(Double.valueOf(-0.5), Ratios.relativeError(1.0, 1.5, 0.0));
  }
}

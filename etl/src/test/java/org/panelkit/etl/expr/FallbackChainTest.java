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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for FallbackChain and DerivedField.
 */
@Tag("unit")
public class FallbackChainTest {

  private static final FallbackChain BOOK_EQUITY =
      FallbackChain.of(Arrays.asList("seq", "ceq + pstk", "at - lt - mib"), null);

  private static Map<String, Object> row(Object seq, Object ceq, Object pstk, Object at,
      Object lt, Object mib) {
    Map<String, Object> row = new HashMap<String, Object>();
    row.put("seq", seq);
    row.put("ceq", ceq);
    row.put("pstk", pstk);
    row.put("at", at);
    row.put("lt", lt);
    row.put("mib", mib);
    return row;
  }

  @Test void testFirstNonMissingCandidateWins() {
    assertEquals(500.0, BOOK_EQUITY.evaluate(row(500.0, 100.0, 10.0, 900.0, 300.0, 0.0)));
    assertEquals(0, BOOK_EQUITY.resolvedIndex(row(500.0, 100.0, 10.0, 900.0, 300.0, 0.0)));
  }

  @Test void testSecondCandidateIgnoresLaterOnes() {
    assertEquals(110.0, BOOK_EQUITY.evaluate(row(null, 100.0, 10.0, 900.0, 300.0, 0.0)));
    assertEquals(110.0, BOOK_EQUITY.evaluate(row(null, 100.0, 10.0, null, null, null)));
    assertEquals(1, BOOK_EQUITY.resolvedIndex(row(null, 100.0, 10.0, null, null, null)));
  }

  @Test void testThirdCandidate() {
    assertEquals(550.0, BOOK_EQUITY.evaluate(row(null, 100.0, null, 900.0, 300.0, 50.0)));
  }

  @Test void testDefaultAndNone() {
    assertNull(BOOK_EQUITY.evaluate(row(null, null, null, null, null, null)));
    assertEquals(FallbackChain.NONE,
        BOOK_EQUITY.resolvedIndex(row(null, null, null, null, null, null)));

    FallbackChain pref = FallbackChain.of(Arrays.asList("pstkrv", "pstkl", "pstk"), 0);
    Map<String, Object> empty = new HashMap<String, Object>();
    assertEquals(0, pref.evaluate(empty));
    assertEquals(FallbackChain.DEFAULT_USED, pref.resolvedIndex(empty));
  }

  @Test void testTransformAppliesToNonMissingResult() {
    FallbackChain chain = FallbackChain.builder()
        .candidate(Expressions.column("prc"), v -> Math.abs((Double) v))
        .candidate("0")
        .build();
    Map<String, Object> row = new HashMap<String, Object>();
    row.put("prc", -12.0);
    assertEquals(12.0, chain.evaluate(row));
    row.put("prc", null);
    assertEquals(0.0, chain.evaluate(row));
  }

  @Test void testDescribeListsEvaluationOrder() {
    FallbackChain pref = FallbackChain.of(Arrays.asList("pstkrv", "pstkl", "pstk"), 0);
    assertEquals(Arrays.asList("pstkrv", "pstkl", "pstk", "default 0"), pref.describe());
  }

  @Test void testFromConfig() {
    Map<String, Object> prefNode = new LinkedHashMap<String, Object>();
    prefNode.put("chain", Arrays.asList("pstkrv", "pstkl", "pstk"));
    prefNode.put("default", 0);
    Map<String, Object> fallbacks = new LinkedHashMap<String, Object>();
    fallbacks.put("pref", prefNode);
    fallbacks.put("book_equity", Arrays.asList("seq", "ceq + pstk", "at - lt - mib"));
    fallbacks.put("market_equity", "abs(prcc_f) * csho");

    List<DerivedField> fields = DerivedField.fromMap(fallbacks);
    assertEquals(3, fields.size());
    assertEquals("pref", fields.get(0).getName());
    assertEquals(0, fields.get(0).getChain().getDefaultValue());
    assertEquals(3, fields.get(1).getChain().getCandidates().size());
    assertEquals(1, fields.get(2).getChain().getCandidates().size());
    assertThrows(IllegalArgumentException.class, () -> FallbackChain.fromConfig(42));
  }
}

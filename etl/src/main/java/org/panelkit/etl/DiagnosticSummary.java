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

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-run counts of row-level conditions that were absorbed into missing values.
 *
 * <p>Safe to update from worker threads.
 */
public class DiagnosticSummary {

  /**
   * Row-level conditions that do not stop a run.
   */
  public enum Condition {
    /** An identifier mapped to several targets and was excluded from the link table. */
    AMBIGUOUS_LINK,
    /** A nearest-date lookup found no observation inside the lookback window. */
    NO_MATCH,
    /** A derived field evaluated to missing because its operands were missing. */
    MISSING_OPERAND,
    /** A row was discarded by a deduplication policy. */
    DUPLICATE_DROPPED
  }

  private final Map<Condition, AtomicLong> counts =
      new ConcurrentHashMap<Condition, AtomicLong>();

  public void record(Condition condition) {
    record(condition, 1);
  }

  public void record(Condition condition, long n) {
    if (n <= 0) {
      return;
    }
    counts.computeIfAbsent(condition, c -> new AtomicLong()).addAndGet(n);
  }

  public long count(Condition condition) {
    AtomicLong counter = counts.get(condition);
    return counter == null ? 0 : counter.get();
  }

  /**
   * Returns a point-in-time copy of every count, in condition order.
   */
  public Map<Condition, Long> snapshot() {
    Map<Condition, Long> copy = new EnumMap<Condition, Long>(Condition.class);
    for (Condition condition : Condition.values()) {
      copy.put(condition, count(condition));
    }
    return Collections.unmodifiableMap(copy);
  }

  /**
   * Returns whether no condition was recorded.
   */
  public boolean isClean() {
    for (Condition condition : Condition.values()) {
      if (count(condition) > 0) {
        return false;
      }
    }
    return true;
  }

  @Override public String toString() {
    return "DiagnosticSummary" + snapshot();
  }
}

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

/**
 * Table stages for building entity-period panels from tabular sources.
 *
 * <h2>Core Components</h2>
 * <ul>
 *   <li>{@link org.panelkit.etl.Table} - Immutable named table of row maps</li>
 *   <li>{@link org.panelkit.etl.FilterStage} - Row predicate and column projection</li>
 *   <li>{@link org.panelkit.etl.CalendarBuilder} - Expands entity year spans into
 *       gapless entity-year rows</li>
 *   <li>{@link org.panelkit.etl.EntityLinker} - Resolves scored identifier links into a
 *       one-to-one mapping</li>
 *   <li>{@link org.panelkit.etl.NearestDateMatcher} - As-of match within a lookback
 *       window</li>
 *   <li>{@link org.panelkit.etl.Deduplicator} - One row per key by ordering or by
 *       extreme value</li>
 *   <li>{@link org.panelkit.etl.MergeEngine} - Left joins onto a spine and fallback
 *       chain evaluation</li>
 *   <li>{@link org.panelkit.etl.StatisticComputer} - Per-row ratios and statistics</li>
 * </ul>
 *
 * <h2>Run Support</h2>
 * <ul>
 *   <li>{@link org.panelkit.etl.StageContext} - Executor and diagnostics shared by the
 *       stages of one run</li>
 *   <li>{@link org.panelkit.etl.GroupExecutor} - Per-group worker pool with
 *       deterministic output order</li>
 *   <li>{@link org.panelkit.etl.DiagnosticSummary} - Counts of row-level conditions</li>
 *   <li>{@link org.panelkit.etl.CsvTableReader} and
 *       {@link org.panelkit.etl.CsvTableWriter} - Delimited file I/O</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * try (StageContext context = StageContext.create(4)) {
 *   Table calendar = CalendarBuilder.builder()
 *       .idColumn("gvkey").dateColumn("fyear").build()
 *       .build(fundamentals, context);
 *   Table panel = new MergeEngine(context).merge(calendar,
 *       Collections.singletonList(MergeEngine.JoinStep.of(fundamentals,
 *           Arrays.asList("gvkey", "year"), Arrays.asList("gvkey", "fyear"))),
 *       "firm_years");
 * }
 * }</pre>
 */
package org.panelkit.etl;

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

/**
 * Run-scoped services shared by the stages of one pipeline run: the
 * diagnostic counters and the group executor.
 */
public class StageContext implements AutoCloseable {

  private final DiagnosticSummary diagnostics;
  private final GroupExecutor executor;

  public StageContext(DiagnosticSummary diagnostics, GroupExecutor executor) {
    this.diagnostics = diagnostics;
    this.executor = executor;
  }

  /**
   * Creates a context with fresh diagnostics and the given parallelism.
   */
  public static StageContext create(int parallelism) {
    return new StageContext(new DiagnosticSummary(), new GroupExecutor(parallelism));
  }

  /**
   * Creates a single-threaded context.
   */
  public static StageContext sequential() {
    return create(1);
  }

  public DiagnosticSummary getDiagnostics() {
    return diagnostics;
  }

  public GroupExecutor getExecutor() {
    return executor;
  }

  @Override public void close() {
    executor.close();
  }
}

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
 * Stage-fatal failure raised while building a panel.
 *
 * <p>Carries the name of the stage that failed so callers can report
 * where the run stopped. Row-level conditions (no match, missing operand,
 * ambiguous link) never raise this; they are counted in
 * {@link DiagnosticSummary} instead.
 */
public class PanelException extends RuntimeException {

  private final String stage;

  public PanelException(String stage, String message) {
    super("[" + stage + "] " + message);
    this.stage = stage;
  }

  public PanelException(String stage, String message, Throwable cause) {
    super("[" + stage + "] " + message, cause);
    this.stage = stage;
  }

  /**
   * Returns the name of the stage that failed.
   */
  public String getStage() {
    return stage;
  }
}

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
package org.panelkit.finance.ibes;

import org.panelkit.etl.EntityLinker;
import org.panelkit.etl.LinkResult;
import org.panelkit.etl.StageContext;
import org.panelkit.etl.Table;

import java.util.List;

/**
 * Maps forecast tickers to security permnos through the scored link table.
 *
 * <p>A ticker linked to more than one permno at an accepted score is left
 * unmapped.
 */
public class TickerPermnoLinker {

  /** Name of the mapping table. */
  public static final String OUTPUT = "ticker_permno";

  private final EntityLinker linker;

  public TickerPermnoLinker(List<Integer> acceptedScores) {
    this.linker = EntityLinker.builder()
        .sourceColumn("ticker")
        .targetColumn("permno")
        .scoreColumn("score")
        .acceptedScores(acceptedScores)
        .outputName(OUTPUT)
        .build();
  }

  public LinkResult link(Table links, StageContext context) {
    return linker.link(links, context);
  }
}

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
 * Financial panels built from fundamentals, prices, identifier links,
 * analyst forecasts and reported actuals.
 *
 * <p>{@link org.panelkit.finance.PanelConfigLoader} reads a YAML
 * configuration, {@link org.panelkit.finance.SourceTables} loads the source
 * files it names, and {@link org.panelkit.finance.PanelPipeline} runs the
 * selected panels. {@link org.panelkit.finance.PanelPipelineRunner} wires
 * the three together from the command line.
 */
package org.panelkit.finance;

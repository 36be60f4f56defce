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
package org.panelkit.finance;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Reads a {@link PanelConfig} from a YAML (or JSON) document.
 *
 * <p>A malformed document is an {@link IOException}; a well-formed document
 * with invalid settings raises {@link IllegalArgumentException} from
 * {@link PanelConfig#fromMap}.
 */
public final class PanelConfigLoader {

  private static final Logger LOGGER = LoggerFactory.getLogger(PanelConfigLoader.class);
  private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

  /** Classpath resource holding the default configuration. */
  public static final String DEFAULT_RESOURCE = "/panel-default.yaml";

  private PanelConfigLoader() {
  }

  /**
   * Loads a configuration file.
   */
  public static PanelConfig load(Path path) throws IOException {
    LOGGER.info("Loading panel configuration from {}", path);
    try (InputStream in = Files.newInputStream(path)) {
      return parse(in, path.toString());
    }
  }

  /**
   * Loads a configuration from the classpath.
   */
  public static PanelConfig loadResource(String resource) throws IOException {
    LOGGER.info("Loading panel configuration from resource {}", resource);
    InputStream in = PanelConfigLoader.class.getResourceAsStream(resource);
    if (in == null) {
      throw new IOException("Resource not found: " + resource);
    }
    try {
      return parse(in, resource);
    } finally {
      in.close();
    }
  }

  /**
   * Parses configuration text.
   */
  public static PanelConfig parse(String yaml) throws IOException {
    try {
      return fromTree(YAML_MAPPER.readValue(yaml, Map.class), "<string>");
    } catch (JsonProcessingException e) {
      throw new IOException("Invalid panel configuration: " + e.getOriginalMessage(), e);
    }
  }

  private static PanelConfig parse(InputStream in, String origin) throws IOException {
    try {
      return fromTree(YAML_MAPPER.readValue(in, Map.class), origin);
    } catch (JsonProcessingException e) {
      throw new IOException("Invalid panel configuration in " + origin + ": "
          + e.getOriginalMessage(), e);
    }
  }

  @SuppressWarnings("unchecked")
  private static PanelConfig fromTree(Map<?, ?> tree, String origin) {
    PanelConfig config = PanelConfig.fromMap((Map<String, Object>) tree);
    LOGGER.debug("Loaded {} from {}", config, origin);
    return config;
  }
}

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
package org.apache.calcite.adapter.phenotype.config;

import org.apache.calcite.adapter.phenotype.ConfigurationException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.Locale;
import java.util.Map;

/**
 * Reads a {@link PhenotypeConfig} from a YAML or JSON file.
 *
 * <p>Files ending in {@code .json} are parsed as JSON, everything else as
 * YAML. Placeholders in string values are resolved by
 * {@link VariableResolver} before the configuration is validated.
 */
public final class ConfigLoader {

  private static final Logger LOGGER = LoggerFactory.getLogger(ConfigLoader.class);

  private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
  private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
  private static final TypeReference<Map<String, Object>> MAP_TYPE =
      new TypeReference<Map<String, Object>>() { };

  private ConfigLoader() {
    // Utility class
  }

  /**
   * Loads and validates a configuration file.
   *
   * @throws IOException if the file cannot be read
   * @throws ConfigurationException if its content is malformed
   */
  public static PhenotypeConfig load(File file) throws IOException {
    if (!file.isFile()) {
      throw new ConfigurationException("Configuration file not found: " + file);
    }
    ObjectMapper mapper = file.getName().toLowerCase(Locale.ROOT).endsWith(".json")
        ? JSON_MAPPER
        : YAML_MAPPER;
    Map<String, Object> raw;
    try {
      raw = mapper.readValue(file, MAP_TYPE);
    } catch (JsonProcessingException e) {
      throw new ConfigurationException("Malformed configuration " + file + ": "
          + e.getOriginalMessage(), e);
    }
    LOGGER.info("Loaded configuration from {}", file);
    return fromRaw(raw);
  }

  /**
   * Parses YAML text; used for inline configuration.
   */
  public static PhenotypeConfig parseYaml(String yaml) {
    try {
      return fromRaw(YAML_MAPPER.readValue(yaml, MAP_TYPE));
    } catch (JsonProcessingException e) {
      throw new ConfigurationException("Malformed configuration: " + e.getOriginalMessage(), e);
    }
  }

  @SuppressWarnings("unchecked")
  private static PhenotypeConfig fromRaw(Map<String, Object> raw) {
    return PhenotypeConfig.fromMap((Map<String, Object>) VariableResolver.resolveTree(raw));
  }
}

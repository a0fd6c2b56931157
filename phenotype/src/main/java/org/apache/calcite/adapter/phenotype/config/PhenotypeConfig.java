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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Root of a phenotype extraction configuration.
 *
 * <h3>YAML Configuration Example</h3>
 * <pre>{@code
 * data_sources:
 *   - type: csv
 *     source: patients.csv
 *     context: {...}
 * pipeline:
 *   transform_strategies: [alias_map, sex_mapping]
 *   loader:
 *     file_system: {output_dir: ./out, create_dir: true}
 *   validate: true
 * credentials:
 *   bioportal_api_key: ${BIOPORTAL_API_KEY}
 * }</pre>
 *
 * <p>The section {@code pipeline_config} is accepted in place of
 * {@code pipeline}. Without an explicit key, the BioPortal API key is read
 * from the {@code BIOPORTAL_API_KEY} environment variable or system property.
 *
 * @see ConfigLoader
 */
public final class PhenotypeConfig {

  public static final String BIOPORTAL_API_KEY_VARIABLE = "BIOPORTAL_API_KEY";

  private final List<DataSourceConfig> dataSources;
  private final PipelineConfig pipeline;
  private final @Nullable String bioPortalApiKey;

  private PhenotypeConfig(List<DataSourceConfig> dataSources, PipelineConfig pipeline,
      @Nullable String bioPortalApiKey) {
    this.dataSources = Collections.unmodifiableList(new ArrayList<DataSourceConfig>(dataSources));
    this.pipeline = pipeline;
    this.bioPortalApiKey = bioPortalApiKey;
  }

  @SuppressWarnings("unchecked")
  public static PhenotypeConfig fromMap(Map<String, Object> map) {
    if (map == null) {
      throw new ConfigurationException("Configuration is empty");
    }
    Object sources = map.get("data_sources");
    if (!(sources instanceof List) || ((List<?>) sources).isEmpty()) {
      throw new ConfigurationException("Configuration declares no 'data_sources'");
    }
    Object pipeline = map.containsKey("pipeline")
        ? map.get("pipeline") : map.get("pipeline_config");
    if (!(pipeline instanceof Map)) {
      throw new ConfigurationException("Configuration requires a 'pipeline' section");
    }
    String apiKey = null;
    Object credentials = map.get("credentials");
    if (credentials instanceof Map) {
      Object key = ((Map<String, Object>) credentials).get("bioportal_api_key");
      if (key != null && !String.valueOf(key).trim().isEmpty()
          && !String.valueOf(key).startsWith("${")) {
        apiKey = String.valueOf(key).trim();
      }
    } else if (credentials != null) {
      throw new ConfigurationException("'credentials' must be a map");
    }
    if (apiKey == null) {
      apiKey = VariableResolver.lookup(BIOPORTAL_API_KEY_VARIABLE);
    }
    return new PhenotypeConfig(DataSourceConfig.fromList((List<?>) sources),
        PipelineConfig.fromMap((Map<String, Object>) pipeline), apiKey);
  }

  public List<DataSourceConfig> getDataSources() {
    return dataSources;
  }

  public PipelineConfig getPipeline() {
    return pipeline;
  }

  public @Nullable String getBioPortalApiKey() {
    return bioPortalApiKey;
  }

  @Override public String toString() {
    return "PhenotypeConfig{dataSources=" + dataSources + ", pipeline=" + pipeline
        + ", bioPortalApiKey=" + (bioPortalApiKey == null ? "unset" : "****") + "}";
  }
}

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
 * Settings of the run itself: the ordered transform strategies, the loader,
 * ontology access, the number of tables transformed in parallel and whether
 * finished records are linted.
 */
public final class PipelineConfig {

  public static final int DEFAULT_PARALLELISM = 4;

  private final List<StrategyConfig> strategies;
  private final @Nullable LoaderConfig loader;
  private final OntologyConfig ontologies;
  private final int parallelism;
  private final boolean validate;

  private PipelineConfig(List<StrategyConfig> strategies, @Nullable LoaderConfig loader,
      OntologyConfig ontologies, int parallelism, boolean validate) {
    this.strategies = Collections.unmodifiableList(new ArrayList<StrategyConfig>(strategies));
    this.loader = loader;
    this.ontologies = ontologies;
    this.parallelism = parallelism;
    this.validate = validate;
  }

  @SuppressWarnings("unchecked")
  public static PipelineConfig fromMap(Map<String, Object> map) {
    if (map == null) {
      throw new ConfigurationException("Missing 'pipeline' section");
    }
    Object strategies = map.get("transform_strategies");
    if (strategies != null && !(strategies instanceof List)) {
      throw new ConfigurationException("'transform_strategies' must be a list");
    }
    Object loader = map.get("loader");
    if (loader != null && !(loader instanceof Map)) {
      throw new ConfigurationException("'loader' must be a map");
    }
    Object ontologies = map.get("ontologies");
    if (ontologies != null && !(ontologies instanceof Map)) {
      throw new ConfigurationException("'ontologies' must be a map");
    }
    int parallelism = DEFAULT_PARALLELISM;
    Object parallelismObj = map.get("parallelism");
    if (parallelismObj instanceof Number) {
      parallelism = ((Number) parallelismObj).intValue();
    } else if (parallelismObj != null) {
      try {
        parallelism = Integer.parseInt(String.valueOf(parallelismObj).trim());
      } catch (NumberFormatException e) {
        throw new ConfigurationException("'parallelism' must be a number: " + parallelismObj);
      }
    }
    if (parallelism < 1) {
      throw new ConfigurationException("'parallelism' must be at least 1: " + parallelism);
    }
    return new PipelineConfig(
        StrategyConfig.fromList((List<?>) strategies),
        loader == null ? null : LoaderConfig.fromMap((Map<String, Object>) loader),
        OntologyConfig.fromMap((Map<String, Object>) ontologies),
        parallelism,
        ExtractionConfig.flag(map, "validate", false));
  }

  public List<StrategyConfig> getStrategies() {
    return strategies;
  }

  /**
   * Returns the loader declaration, or null when records are only returned.
   */
  public @Nullable LoaderConfig getLoader() {
    return loader;
  }

  public OntologyConfig getOntologies() {
    return ontologies;
  }

  public int getParallelism() {
    return parallelism;
  }

  public boolean isValidate() {
    return validate;
  }

  @Override public String toString() {
    return "PipelineConfig{strategies=" + strategies.size() + ", loader=" + loader
        + ", parallelism=" + parallelism + ", validate=" + validate + "}";
  }
}

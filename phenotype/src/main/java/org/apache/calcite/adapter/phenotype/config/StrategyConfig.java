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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Declaration of one transform strategy: its type plus type-specific options.
 *
 * <p>The ordered list of declarations is the transform pipeline; there is no
 * implicit registration.
 *
 * <h3>YAML Configuration Example</h3>
 * <pre>{@code
 * transform_strategies:
 *   - string_correction
 *   - alias_map
 *   - sex_mapping
 *   - type: ontology_normaliser
 *     ontology: hp
 *     data_context: hpo_label_or_id
 *   - type: vocabulary_mapping
 *     name: treatment_intent
 *     data_context: treatment_intent
 *     synonyms: {cure: CURATIVE, palliative: PALLIATIVE}
 * }</pre>
 */
public final class StrategyConfig {

  /**
   * Known strategy types.
   */
  public enum Type {
    STRING_CORRECTION,
    ALIAS_MAP,
    SEX_MAPPING,
    VITAL_STATUS_MAPPING,
    VOCABULARY_MAPPING,
    ONTOLOGY_NORMALISER,
    MULTI_HPO_COL_EXPANSION,
    AGE_TO_ISO8601;

    public String configName() {
      return name().toLowerCase(Locale.ROOT);
    }

    public static Type fromConfigName(String name) {
      String wanted = name.trim().toUpperCase(Locale.ROOT).replace('-', '_');
      if ("ONTOLOGY_NORMALIZER".equals(wanted)) {
        return ONTOLOGY_NORMALISER;
      }
      if ("DEFAULT_SEX_MAPPING".equals(wanted)) {
        return SEX_MAPPING;
      }
      for (Type type : values()) {
        if (type.name().equals(wanted)) {
          return type;
        }
      }
      throw new ConfigurationException("Unknown transform strategy: " + name);
    }
  }

  private final Type type;
  private final Map<String, Object> options;

  private StrategyConfig(Type type, Map<String, Object> options) {
    this.type = type;
    this.options = Collections.unmodifiableMap(new LinkedHashMap<String, Object>(options));
  }

  public static StrategyConfig of(Type type) {
    return new StrategyConfig(type, Collections.<String, Object>emptyMap());
  }

  public static StrategyConfig of(Type type, Map<String, Object> options) {
    return new StrategyConfig(type, options);
  }

  /**
   * Parses a bare strategy name or a map with a {@code type} entry.
   */
  public static StrategyConfig fromConfig(Object value) {
    if (value instanceof String) {
      return of(Type.fromConfigName((String) value));
    }
    if (value instanceof Map) {
      Map<String, Object> options = new LinkedHashMap<String, Object>();
      for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
        options.put(String.valueOf(entry.getKey()), entry.getValue());
      }
      Object typeObj = options.remove("type");
      if (typeObj == null) {
        throw new ConfigurationException("Transform strategy requires a 'type': " + value);
      }
      return of(Type.fromConfigName(String.valueOf(typeObj)), options);
    }
    throw new ConfigurationException("Cannot parse transform strategy from " + value);
  }

  public static List<StrategyConfig> fromList(List<?> list) {
    List<StrategyConfig> result = new ArrayList<StrategyConfig>();
    if (list != null) {
      for (Object item : list) {
        result.add(fromConfig(item));
      }
    }
    return result;
  }

  public Type getType() {
    return type;
  }

  public Map<String, Object> getOptions() {
    return options;
  }

  public @Nullable Object getOption(String key) {
    return options.get(key);
  }

  public @Nullable String getString(String key) {
    Object value = options.get(key);
    return value == null ? null : String.valueOf(value);
  }

  public boolean getBoolean(String key, boolean defaultValue) {
    Object value = options.get(key);
    if (value instanceof Boolean) {
      return (Boolean) value;
    }
    if (value instanceof String) {
      return Boolean.parseBoolean((String) value);
    }
    return defaultValue;
  }

  /**
   * Returns a map option with keys and values rendered as strings.
   */
  public Map<String, String> getStringMap(String key) {
    Map<String, String> result = new LinkedHashMap<String, String>();
    Object value = options.get(key);
    if (value == null) {
      return result;
    }
    if (!(value instanceof Map)) {
      throw new ConfigurationException("Option '" + key + "' of " + type.configName()
          + " must be a map");
    }
    for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
      result.put(String.valueOf(entry.getKey()),
          entry.getValue() == null ? null : String.valueOf(entry.getValue()));
    }
    return result;
  }

  /**
   * Returns a list option; a single scalar is treated as a one-element list.
   */
  public List<Object> getList(String key) {
    Object value = options.get(key);
    List<Object> result = new ArrayList<Object>();
    if (value instanceof List) {
      result.addAll((List<?>) value);
    } else if (value != null) {
      result.add(value);
    }
    return result;
  }

  @Override public String toString() {
    return options.isEmpty() ? type.configName() : type.configName() + options;
  }
}

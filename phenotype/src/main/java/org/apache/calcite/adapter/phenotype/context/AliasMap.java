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
package org.apache.calcite.adapter.phenotype.context;

import org.apache.calcite.adapter.phenotype.ConfigurationException;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Literal value rewrite for one column, followed by conversion to a declared
 * output type.
 *
 * <p>Keys are matched case-sensitively against the cell's text. A key mapped
 * to null, or to the string {@code "null"}, turns the cell into null. Values
 * without a key are kept as they are and only converted.
 *
 * <h3>YAML Configuration Example</h3>
 * <pre>{@code
 * alias_map:
 *   output_data_type: string
 *   mappings:
 *     M: Male
 *     F: Female
 *     "?": null
 * }</pre>
 */
public final class AliasMap {

  private static final String NULL_LITERAL = "null";

  private final Map<String, String> mappings;
  private final OutputDataType outputDataType;

  private AliasMap(Builder builder) {
    this.mappings =
        Collections.unmodifiableMap(new LinkedHashMap<String, String>(builder.mappings));
    this.outputDataType = builder.outputDataType;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Parses an alias map. Both {@code mappings} and {@code hash_map} are
   * accepted as the name of the key/value section, and both
   * {@code output_data_type} and {@code output_dtype} for the type.
   *
   * @throws ConfigurationException if a key or value is not a scalar
   */
  public static AliasMap fromMap(Map<String, Object> map) {
    if (map == null) {
      return null;
    }
    Object entries = map.containsKey("mappings") ? map.get("mappings") : map.get("hash_map");
    if (!(entries instanceof Map)) {
      throw new ConfigurationException("Alias map requires a 'mappings' section");
    }
    Object type = map.containsKey("output_data_type")
        ? map.get("output_data_type") : map.get("output_dtype");

    Builder builder = builder().outputDataType(OutputDataType.fromConfig(type));
    for (Map.Entry<?, ?> entry : ((Map<?, ?>) entries).entrySet()) {
      if (entry.getKey() == null || isComposite(entry.getKey())) {
        throw new ConfigurationException("Alias map keys must be scalars: " + entry.getKey());
      }
      if (isComposite(entry.getValue())) {
        throw new ConfigurationException("Alias map values must be scalars: " + entry.getValue());
      }
      builder.alias(OutputDataType.formatScalar(entry.getKey()),
          entry.getValue() == null ? null : OutputDataType.formatScalar(entry.getValue()));
    }
    return builder.build();
  }

  private static boolean isComposite(@Nullable Object value) {
    return value instanceof Map || value instanceof List;
  }

  public Map<String, String> getMappings() {
    return mappings;
  }

  public OutputDataType getOutputDataType() {
    return outputDataType;
  }

  /**
   * Returns whether the key is mapped (possibly to null).
   */
  public boolean contains(String key) {
    return mappings.containsKey(key);
  }

  /**
   * Substitutes and converts one cell value.
   *
   * @param value The cell value, possibly null
   * @return The converted replacement, or null
   * @throws IllegalArgumentException if the value cannot be converted
   */
  public @Nullable Object apply(@Nullable Object value) {
    if (value == null) {
      return null;
    }
    String key = OutputDataType.formatScalar(value);
    Object substituted = value;
    if (mappings.containsKey(key)) {
      String target = mappings.get(key);
      if (target == null || NULL_LITERAL.equals(target)) {
        return null;
      }
      substituted = target;
    }
    return outputDataType.convert(substituted);
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof AliasMap)) {
      return false;
    }
    AliasMap that = (AliasMap) o;
    return outputDataType == that.outputDataType && mappings.equals(that.mappings);
  }

  @Override public int hashCode() {
    return Objects.hash(outputDataType, mappings);
  }

  @Override public String toString() {
    return "AliasMap{type=" + outputDataType + ", mappings=" + mappings + "}";
  }

  /**
   * Builder for {@link AliasMap}.
   */
  public static class Builder {
    private final Map<String, String> mappings = new LinkedHashMap<String, String>();
    private OutputDataType outputDataType = OutputDataType.STRING;

    public Builder alias(String from, @Nullable String to) {
      this.mappings.put(from, to);
      return this;
    }

    public Builder aliases(Map<String, String> aliases) {
      this.mappings.putAll(aliases);
      return this;
    }

    public Builder outputDataType(OutputDataType outputDataType) {
      this.outputDataType = outputDataType;
      return this;
    }

    public AliasMap build() {
      if (outputDataType == null) {
        throw new ConfigurationException("Alias map output data type is required");
      }
      return new AliasMap(this);
    }
  }
}

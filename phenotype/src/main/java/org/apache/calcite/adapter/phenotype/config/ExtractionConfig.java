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

import java.util.Map;

/**
 * How a raw grid of cells is read into a table: whether it carries a header
 * line and whether subjects run down the rows or across the columns.
 *
 * <p>The {@code name} selects the sheet of a workbook and must match the
 * name of the table context applied to it.
 *
 * <h3>YAML Configuration Example</h3>
 * <pre>{@code
 * extraction_config:
 *   name: patients
 *   has_headers: true
 *   patients_are_rows: false
 * }</pre>
 */
public final class ExtractionConfig {

  private final String name;
  private final boolean hasHeaders;
  private final boolean patientsAreRows;

  public ExtractionConfig(String name, boolean hasHeaders, boolean patientsAreRows) {
    if (name == null || name.trim().isEmpty()) {
      throw new ConfigurationException("Extraction config requires a 'name'");
    }
    this.name = name;
    this.hasHeaders = hasHeaders;
    this.patientsAreRows = patientsAreRows;
  }

  /**
   * Headers present, one subject per row.
   */
  public static ExtractionConfig of(String name) {
    return new ExtractionConfig(name, true, true);
  }

  public static ExtractionConfig fromMap(Map<String, Object> map) {
    if (map == null) {
      throw new ConfigurationException("Missing extraction config");
    }
    Object name = map.get("name");
    return new ExtractionConfig(name == null ? null : String.valueOf(name),
        flag(map, "has_headers", true),
        flag(map, "patients_are_rows", true));
  }

  static boolean flag(Map<String, Object> map, String key, boolean defaultValue) {
    Object value = map.get(key);
    if (value == null) {
      return defaultValue;
    }
    if (value instanceof Boolean) {
      return (Boolean) value;
    }
    String text = String.valueOf(value).trim();
    if ("true".equalsIgnoreCase(text)) {
      return true;
    }
    if ("false".equalsIgnoreCase(text)) {
      return false;
    }
    throw new ConfigurationException("'" + key + "' must be true or false, got: " + value);
  }

  public String getName() {
    return name;
  }

  public boolean hasHeaders() {
    return hasHeaders;
  }

  public boolean isPatientsAreRows() {
    return patientsAreRows;
  }

  @Override public String toString() {
    return "ExtractionConfig{name='" + name + "', hasHeaders=" + hasHeaders
        + ", patientsAreRows=" + patientsAreRows + "}";
  }
}

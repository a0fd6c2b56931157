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
import org.apache.calcite.adapter.phenotype.context.TableContext;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Declaration of one data source: a CSV file or an Excel workbook, and the
 * context of each table it yields.
 *
 * <p>Extraction flags may be given in an {@code extraction_config} map or
 * directly on the source (CSV) or sheet (Excel). An extraction name defaults
 * to the name of the table context.
 *
 * <h3>YAML Configuration Example</h3>
 * <pre>{@code
 * data_sources:
 *   - type: csv
 *     source: data/patients.csv
 *     separator: ";"
 *     has_headers: true
 *     patients_are_rows: true
 *     context:
 *       name: patients
 *       contexts:
 *         - identifier: patient_id
 *           data_context: subject_id
 *   - type: excel
 *     source: data/cohort.xlsx
 *     sheets:
 *       - extraction_config: {name: labs, has_headers: true, patients_are_rows: false}
 *         context:
 *           name: labs
 *           contexts: [...]
 * }</pre>
 */
public final class DataSourceConfig {

  /**
   * Supported data source types.
   */
  public enum Type {
    CSV,
    EXCEL
  }

  private final Type type;
  private final String source;
  private final char separator;
  private final List<ExtractionConfig> extractions;
  private final List<TableContext> tableContexts;

  private DataSourceConfig(Type type, String source, char separator,
      List<ExtractionConfig> extractions, List<TableContext> tableContexts) {
    this.type = type;
    this.source = source;
    this.separator = separator;
    this.extractions = Collections.unmodifiableList(new ArrayList<ExtractionConfig>(extractions));
    this.tableContexts = Collections.unmodifiableList(new ArrayList<TableContext>(tableContexts));
  }

  public static DataSourceConfig fromMap(Map<String, Object> map) {
    if (map == null) {
      throw new ConfigurationException("Missing data source config");
    }
    Object typeObj = map.get("type");
    if (typeObj == null) {
      throw new ConfigurationException("Data source requires a 'type' (csv or excel)");
    }
    Type type;
    try {
      type = Type.valueOf(String.valueOf(typeObj).trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException("Unknown data source type: " + typeObj);
    }
    Object source = map.get("source");
    if (source == null) {
      throw new ConfigurationException("Data source requires a 'source' path");
    }

    List<ExtractionConfig> extractions = new ArrayList<ExtractionConfig>();
    List<TableContext> contexts = new ArrayList<TableContext>();
    char separator = ',';
    switch (type) {
      case CSV:
        separator = separator(map.get("separator"));
        addTable(map, extractions, contexts);
        break;
      case EXCEL:
        Object sheets = map.get("sheets");
        if (!(sheets instanceof List) || ((List<?>) sheets).isEmpty()) {
          throw new ConfigurationException("Excel data source " + source + " declares no sheets");
        }
        for (Object sheet : (List<?>) sheets) {
          if (!(sheet instanceof Map)) {
            throw new ConfigurationException("Cannot parse sheet config from " + sheet);
          }
          addTable(asMap(sheet), extractions, contexts);
        }
        break;
      default:
        throw new IllegalStateException("Unhandled data source type: " + type);
    }
    return new DataSourceConfig(type, String.valueOf(source), separator, extractions, contexts);
  }

  public static List<DataSourceConfig> fromList(List<?> list) {
    List<DataSourceConfig> result = new ArrayList<DataSourceConfig>();
    if (list != null) {
      for (Object item : list) {
        if (!(item instanceof Map)) {
          throw new ConfigurationException("Cannot parse data source from " + item);
        }
        result.add(fromMap(asMap(item)));
      }
    }
    return result;
  }

  private static void addTable(Map<String, Object> map, List<ExtractionConfig> extractions,
      List<TableContext> contexts) {
    Object contextObj = map.get("context");
    if (!(contextObj instanceof Map)) {
      throw new ConfigurationException("Table requires a 'context' map");
    }
    TableContext context = TableContext.fromMap(asMap(contextObj));
    Object extractionObj = map.get("extraction_config");
    ExtractionConfig extraction;
    if (extractionObj instanceof Map) {
      Map<String, Object> extractionMap = asMap(extractionObj);
      if (!extractionMap.containsKey("name")) {
        extractionMap.put("name", context.getName());
      }
      extraction = ExtractionConfig.fromMap(extractionMap);
    } else {
      Object sheetName = map.get("sheet_name");
      extraction = new ExtractionConfig(
          sheetName == null ? context.getName() : String.valueOf(sheetName),
          ExtractionConfig.flag(map, "has_headers", true),
          ExtractionConfig.flag(map, "patients_are_rows", true));
    }
    extractions.add(extraction);
    contexts.add(context);
  }

  private static char separator(Object value) {
    if (value == null) {
      return ',';
    }
    String text = String.valueOf(value);
    if ("\\t".equals(text) || "tab".equalsIgnoreCase(text)) {
      return '\t';
    }
    if (text.length() != 1) {
      throw new ConfigurationException("'separator' must be a single character, got: " + value);
    }
    return text.charAt(0);
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> asMap(Object value) {
    return new LinkedHashMap<String, Object>((Map<String, Object>) value);
  }

  public Type getType() {
    return type;
  }

  public String getSource() {
    return source;
  }

  public char getSeparator() {
    return separator;
  }

  public List<ExtractionConfig> getExtractions() {
    return extractions;
  }

  public List<TableContext> getTableContexts() {
    return tableContexts;
  }

  @Override public String toString() {
    return "DataSourceConfig{type=" + type + ", source='" + source + "', tables="
        + extractions.size() + "}";
  }
}

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
package org.apache.calcite.adapter.phenotype.transform;

import org.apache.calcite.adapter.phenotype.ConfigurationException;
import org.apache.calcite.adapter.phenotype.Diagnostic;
import org.apache.calcite.adapter.phenotype.Diagnostics;
import org.apache.calcite.adapter.phenotype.context.Context;
import org.apache.calcite.adapter.phenotype.context.OutputDataType;
import org.apache.calcite.adapter.phenotype.table.ContextualizedTable;

import com.google.common.collect.ImmutableMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Maps free-text values onto a small controlled vocabulary.
 *
 * <p>Keys are compared after trimming and lower-casing. Values that already
 * equal a vocabulary term, ignoring case, are rewritten to the term's
 * canonical spelling. Anything else is left unchanged and reported as a
 * {@link Diagnostic.Kind#MAPPING_VIOLATION}.
 *
 * <p>Only columns whose header carries no context and whose data context is
 * the strategy's target are mapped.
 *
 * @see #sexMapping()
 * @see #vitalStatusMapping()
 */
public class MappingStrategy implements Strategy {

  private static final Logger LOGGER = LoggerFactory.getLogger(MappingStrategy.class);

  public static final String SEX_MAPPING = "sex_mapping";
  public static final String VITAL_STATUS_MAPPING = "vital_status_mapping";

  private static final Map<String, String> SEX_VOCABULARY = ImmutableMap.<String, String>builder()
      .put("m", "MALE")
      .put("male", "MALE")
      .put("man", "MALE")
      .put("f", "FEMALE")
      .put("female", "FEMALE")
      .put("woman", "FEMALE")
      .put("diverse", "OTHER_SEX")
      .put("intersex", "OTHER_SEX")
      .put("other", "OTHER_SEX")
      .build();

  private static final Map<String, String> VITAL_STATUS_VOCABULARY =
      ImmutableMap.<String, String>builder()
      .put("yes", "ALIVE")
      .put("living", "ALIVE")
      .put("alive", "ALIVE")
      .put("no", "DECEASED")
      .put("dead", "DECEASED")
      .put("deceased", "DECEASED")
      .put("unknown", "UNKNOWN_STATUS")
      .put("no data", "UNKNOWN_STATUS")
      .build();

  private final String name;
  private final Context dataContext;
  private final Map<String, String> synonyms;
  private final Map<String, String> terms;

  public MappingStrategy(String name, Context dataContext, Map<String, String> synonyms) {
    if (name == null || name.isEmpty()) {
      throw new ConfigurationException("Mapping strategy name is required");
    }
    if (synonyms == null || synonyms.isEmpty()) {
      throw new ConfigurationException("Mapping strategy '" + name + "' has no synonyms");
    }
    this.name = name;
    this.dataContext = dataContext;
    Map<String, String> normalized = new LinkedHashMap<String, String>();
    Map<String, String> canonical = new LinkedHashMap<String, String>();
    for (Map.Entry<String, String> entry : synonyms.entrySet()) {
      normalized.put(key(entry.getKey()), entry.getValue());
      canonical.put(key(entry.getValue()), entry.getValue());
    }
    this.synonyms = ImmutableMap.copyOf(normalized);
    this.terms = ImmutableMap.copyOf(canonical);
  }

  /**
   * Maps sex descriptions to {@code MALE}, {@code FEMALE} and
   * {@code OTHER_SEX}.
   */
  public static MappingStrategy sexMapping() {
    return new MappingStrategy(SEX_MAPPING, Context.SUBJECT_SEX, SEX_VOCABULARY);
  }

  /**
   * Maps vital status descriptions to {@code ALIVE}, {@code DECEASED} and
   * {@code UNKNOWN_STATUS}.
   */
  public static MappingStrategy vitalStatusMapping() {
    return new MappingStrategy(VITAL_STATUS_MAPPING, Context.VITAL_STATUS,
        VITAL_STATUS_VOCABULARY);
  }

  @Override public String getName() {
    return name;
  }

  public Context getDataContext() {
    return dataContext;
  }

  public Map<String, String> getSynonyms() {
    return synonyms;
  }

  @Override public boolean isApplicable(ContextualizedTable table) {
    return !table.getColumns(Context.NONE, dataContext).isEmpty();
  }

  @Override public void transform(ContextualizedTable table, Diagnostics diagnostics) {
    List<String> columns = table.getColumns(Context.NONE, dataContext);
    for (String column : columns) {
      Set<String> unmapped = new HashSet<String>();
      for (int row = 0; row < table.getRowCount(); row++) {
        Object value = table.getValue(row, column);
        if (value == null) {
          continue;
        }
        String key = key(OutputDataType.formatScalar(value));
        String mapped = synonyms.get(key);
        if (mapped == null) {
          mapped = terms.get(key);
        }
        if (mapped != null) {
          table.setValue(row, column, mapped);
        } else {
          unmapped.add(String.valueOf(value));
          diagnostics.add(Diagnostic.builder(Diagnostic.Kind.MAPPING_VIOLATION)
              .table(table.getName())
              .column(column)
              .row(row)
              .value(value)
              .message("Value '" + value + "' is not in the " + dataContext
                  + " vocabulary " + terms.values())
              .build());
        }
      }
      if (!unmapped.isEmpty()) {
        LOGGER.warn("Strategy '{}' left {} distinct values unmapped in column '{}' of table '{}'",
            name, unmapped.size(), column, table.getName());
      }
    }
  }

  private static String key(String value) {
    return value.trim().toLowerCase(Locale.ROOT);
  }

  @Override public String toString() {
    return "MappingStrategy{name='" + name + "', context=" + dataContext + "}";
  }
}

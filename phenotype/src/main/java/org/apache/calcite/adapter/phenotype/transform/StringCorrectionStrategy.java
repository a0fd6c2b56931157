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
import org.apache.calcite.adapter.phenotype.Diagnostics;
import org.apache.calcite.adapter.phenotype.context.Context;
import org.apache.calcite.adapter.phenotype.context.SeriesContext;
import org.apache.calcite.adapter.phenotype.table.ContextualizedTable;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Normalizes string cells before exact-key lookups run.
 *
 * <p>For every string cell of the targeted columns, in this order:
 * <ol>
 *   <li>configured substrings are replaced</li>
 *   <li>leading and trailing whitespace is removed</li>
 *   <li>runs of internal whitespace collapse to one space</li>
 *   <li>the configured case conversion is applied</li>
 * </ol>
 * A cell that ends up empty becomes null. Without a target list every bound
 * column is corrected.
 *
 * <h3>YAML Configuration Example</h3>
 * <pre>{@code
 * transform_strategies:
 *   - type: string_correction
 *     case: lower
 *     replace: {"_": " "}
 *     data_contexts: [hpo_label_or_id, disease_label_or_id]
 * }</pre>
 */
public class StringCorrectionStrategy implements Strategy {

  public static final String NAME = "string_correction";

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  /**
   * Case conversion applied after whitespace normalization.
   */
  public enum CaseMode {
    NONE,
    LOWER,
    UPPER;

    public static CaseMode fromConfig(@Nullable Object value) {
      if (value == null) {
        return NONE;
      }
      try {
        return valueOf(String.valueOf(value).trim().toUpperCase(Locale.ROOT));
      } catch (IllegalArgumentException e) {
        throw new ConfigurationException("Unknown case mode: " + value, e);
      }
    }
  }

  private final Map<String, String> replacements;
  private final boolean collapseWhitespace;
  private final CaseMode caseMode;
  private final Set<Context> dataContexts;

  private StringCorrectionStrategy(Builder builder) {
    this.replacements = Collections.unmodifiableMap(
        new LinkedHashMap<String, String>(builder.replacements));
    this.collapseWhitespace = builder.collapseWhitespace;
    this.caseMode = builder.caseMode;
    this.dataContexts =
        Collections.unmodifiableSet(new LinkedHashSet<Context>(builder.dataContexts));
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override public String getName() {
    return NAME;
  }

  @Override public boolean isApplicable(ContextualizedTable table) {
    return !targetColumns(table).isEmpty();
  }

  @Override public void transform(ContextualizedTable table, Diagnostics diagnostics) {
    for (String column : targetColumns(table)) {
      for (int row = 0; row < table.getRowCount(); row++) {
        Object value = table.getValue(row, column);
        if (value instanceof String) {
          table.setValue(row, column, correct((String) value));
        }
      }
    }
  }

  /**
   * Corrects one string; returns null when nothing but whitespace remains.
   */
  public @Nullable String correct(String value) {
    String result = value;
    for (Map.Entry<String, String> entry : replacements.entrySet()) {
      result = result.replace(entry.getKey(), entry.getValue());
    }
    result = result.trim();
    if (collapseWhitespace) {
      result = WHITESPACE.matcher(result).replaceAll(" ");
    }
    switch (caseMode) {
      case LOWER:
        result = result.toLowerCase(Locale.ROOT);
        break;
      case UPPER:
        result = result.toUpperCase(Locale.ROOT);
        break;
      case NONE:
        break;
      default:
        throw new IllegalStateException("Unhandled case mode: " + caseMode);
    }
    return result.isEmpty() ? null : result;
  }

  private List<String> targetColumns(ContextualizedTable table) {
    List<String> columns = new ArrayList<String>();
    for (SeriesContext sc : table.getSeriesContexts()) {
      if (dataContexts.isEmpty() || dataContexts.contains(sc.getDataContext())) {
        for (String column : table.getColumns(sc)) {
          if (!columns.contains(column)) {
            columns.add(column);
          }
        }
      }
    }
    return columns;
  }

  @Override public String toString() {
    return "StringCorrectionStrategy{replace=" + replacements + ", collapse=" + collapseWhitespace
        + ", case=" + caseMode + ", dataContexts=" + dataContexts + "}";
  }

  /**
   * Builder for {@link StringCorrectionStrategy}.
   */
  public static class Builder {
    private final Map<String, String> replacements = new LinkedHashMap<String, String>();
    private boolean collapseWhitespace = true;
    private CaseMode caseMode = CaseMode.NONE;
    private final Set<Context> dataContexts = new LinkedHashSet<Context>();

    public Builder replace(String from, String to) {
      if (from == null || from.isEmpty()) {
        throw new ConfigurationException("Replaced text must not be empty");
      }
      this.replacements.put(from, to == null ? "" : to);
      return this;
    }

    public Builder collapseWhitespace(boolean collapseWhitespace) {
      this.collapseWhitespace = collapseWhitespace;
      return this;
    }

    public Builder caseMode(CaseMode caseMode) {
      this.caseMode = caseMode;
      return this;
    }

    public Builder dataContext(Context dataContext) {
      this.dataContexts.add(dataContext);
      return this;
    }

    public StringCorrectionStrategy build() {
      return new StringCorrectionStrategy(this);
    }
  }
}

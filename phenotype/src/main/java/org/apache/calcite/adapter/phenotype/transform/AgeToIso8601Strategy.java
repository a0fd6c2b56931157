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

import org.apache.calcite.adapter.phenotype.Diagnostic;
import org.apache.calcite.adapter.phenotype.Diagnostics;
import org.apache.calcite.adapter.phenotype.context.SeriesContext;
import org.apache.calcite.adapter.phenotype.table.ContextualizedTable;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Rewrites ages given in whole years as ISO 8601 durations.
 *
 * <p>Applies to columns whose header carries no context and whose data
 * context is an age, such as {@code onset: age}. Whole numbers between
 * {@value #MIN_AGE} and {@value #MAX_AGE} become {@code P<n>Y}; values that
 * are already ISO 8601 durations are kept. Anything else is left unchanged
 * and reported as a {@link Diagnostic.Kind#MAPPING_VIOLATION}.
 */
public class AgeToIso8601Strategy implements Strategy {

  public static final String NAME = "age_to_iso8601";

  static final int MIN_AGE = 0;
  static final int MAX_AGE = 150;

  private static final Pattern ISO8601_DURATION =
      Pattern.compile("P(?=\\d|T\\d)(\\d+Y)?(\\d+M)?(\\d+W)?(\\d+D)?(T(\\d+H)?(\\d+M)?(\\d+S)?)?");
  private static final Pattern WHOLE_NUMBER = Pattern.compile("\\d+(\\.0+)?");

  @Override public String getName() {
    return NAME;
  }

  @Override public boolean isApplicable(ContextualizedTable table) {
    return !ageColumns(table).isEmpty();
  }

  @Override public void transform(ContextualizedTable table, Diagnostics diagnostics) {
    for (String column : ageColumns(table)) {
      for (int row = 0; row < table.getRowCount(); row++) {
        Object value = table.getValue(row, column);
        if (value == null) {
          continue;
        }
        String converted = toIso8601(value);
        if (converted != null) {
          table.setValue(row, column, converted);
        } else {
          diagnostics.add(Diagnostic.builder(Diagnostic.Kind.MAPPING_VIOLATION)
              .table(table.getName())
              .column(column)
              .row(row)
              .value(value)
              .message("Value '" + value + "' is neither an age in years between "
                  + MIN_AGE + " and " + MAX_AGE + " nor an ISO 8601 duration")
              .build());
        }
      }
    }
  }

  /**
   * Converts one value; returns null when it is not a usable age.
   */
  static @Nullable String toIso8601(Object value) {
    String text = String.valueOf(value).trim();
    if (ISO8601_DURATION.matcher(text).matches()) {
      return text;
    }
    if (!WHOLE_NUMBER.matcher(text).matches()) {
      return null;
    }
    double years = Double.parseDouble(text);
    if (years < MIN_AGE || years > MAX_AGE) {
      return null;
    }
    return "P" + (long) years + "Y";
  }

  private static List<String> ageColumns(ContextualizedTable table) {
    List<String> columns = new ArrayList<String>();
    for (SeriesContext sc : table.findSeriesContexts(
        s -> s.getHeaderContext().isNone() && s.getDataContext().isAge())) {
      for (String column : table.getColumns(sc)) {
        if (!columns.contains(column)) {
          columns.add(column);
        }
      }
    }
    return columns;
  }
}

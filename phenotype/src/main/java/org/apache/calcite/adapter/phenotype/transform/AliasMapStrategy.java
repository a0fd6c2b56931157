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
import org.apache.calcite.adapter.phenotype.context.AliasMap;
import org.apache.calcite.adapter.phenotype.context.SeriesContext;
import org.apache.calcite.adapter.phenotype.table.ContextualizedTable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Applies the {@link AliasMap} of each series context to its columns.
 *
 * <p>Values are looked up literally and case-sensitively; values without an
 * alias pass through unchanged. Every non-null result is then converted to the
 * alias map's output type. A cell that cannot be converted becomes null and is
 * reported as a {@link Diagnostic.Kind#TYPE_COERCION} diagnostic.
 *
 * <p>A column bound to two series contexts with different alias maps cannot
 * be rewritten consistently and fails the table.
 */
public class AliasMapStrategy implements Strategy {

  private static final Logger LOGGER = LoggerFactory.getLogger(AliasMapStrategy.class);

  public static final String NAME = "alias_map";

  @Override public String getName() {
    return NAME;
  }

  @Override public boolean isApplicable(ContextualizedTable table) {
    return !table.findSeriesContexts(sc -> sc.getAliasMap() != null).isEmpty();
  }

  @Override public void transform(ContextualizedTable table, Diagnostics diagnostics)
      throws StrategyException {
    Map<String, AliasMap> applied = new HashMap<String, AliasMap>();
    for (SeriesContext sc : table.findSeriesContexts(s -> s.getAliasMap() != null)) {
      AliasMap aliasMap = sc.getAliasMap();
      List<String> columns = table.getColumns(sc);
      for (String column : columns) {
        AliasMap previous = applied.get(column);
        if (previous != null) {
          if (!previous.equals(aliasMap)) {
            throw new StrategyException(NAME, table.getName(),
                "column '" + column + "' is bound to conflicting alias maps");
          }
          continue;
        }
        applied.put(column, aliasMap);
        int failures = rewrite(table, column, aliasMap, diagnostics);
        LOGGER.debug("Aliased column '{}' of table '{}' ({} conversion failures)",
            column, table.getName(), failures);
      }
    }
  }

  private static int rewrite(ContextualizedTable table, String column, AliasMap aliasMap,
      Diagnostics diagnostics) {
    int failures = 0;
    for (int row = 0; row < table.getRowCount(); row++) {
      Object value = table.getValue(row, column);
      try {
        table.setValue(row, column, aliasMap.apply(value));
      } catch (IllegalArgumentException e) {
        failures++;
        table.setValue(row, column, null);
        diagnostics.add(Diagnostic.builder(Diagnostic.Kind.TYPE_COERCION)
            .table(table.getName())
            .column(column)
            .row(row)
            .value(value)
            .message(e.getMessage() + " in column '" + column + "' of table '"
                + table.getName() + "'")
            .build());
      }
    }
    return failures;
  }
}

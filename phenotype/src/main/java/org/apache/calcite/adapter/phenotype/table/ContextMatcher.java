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
package org.apache.calcite.adapter.phenotype.table;

import org.apache.calcite.adapter.phenotype.context.ContextKind;
import org.apache.calcite.adapter.phenotype.context.Identifier;
import org.apache.calcite.adapter.phenotype.context.SeriesContext;
import org.apache.calcite.adapter.phenotype.context.TableContext;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Binds the series contexts of a {@link TableContext} to the columns of a raw
 * {@link DataTable}.
 *
 * <p>Matching rules:
 * <ul>
 *   <li>exact and list identifiers must find every named column unless the
 *       series context is optional</li>
 *   <li>a regex identifier binds every matching header and must match at
 *       least once unless the series context is optional</li>
 *   <li>a column selected by several series contexts is bound to all of
 *       them</li>
 *   <li>the subject id must bind exactly one column</li>
 * </ul>
 *
 * <p>After binding, null and blank cells of series contexts that declare
 * {@code fill_missing} are replaced by that value. The raw table is not
 * modified; the result works on a copy.
 */
public class ContextMatcher {

  private static final Logger LOGGER = LoggerFactory.getLogger(ContextMatcher.class);

  /**
   * Matches a raw table against its declared context.
   *
   * @param raw Raw table from a data source
   * @param tableContext Declared shape of the table
   * @param sourceId Identity of the data source, kept for aggregation
   * @return The tagged table
   * @throws IdentifierMatchException if a required column is absent or the
   *     subject id is ambiguous
   */
  public ContextualizedTable match(DataTable raw, TableContext tableContext, String sourceId)
      throws IdentifierMatchException {
    List<String> headers = raw.getColumnNames();
    Map<SeriesContext, List<String>> bindings = new LinkedHashMap<SeriesContext, List<String>>();

    for (SeriesContext sc : tableContext.getSeriesContexts()) {
      Identifier identifier = sc.getIdentifier();
      List<String> selected = identifier.select(headers);
      List<String> missing = identifier.missing(headers);

      if (!sc.isOptional()) {
        if (!missing.isEmpty()) {
          throw new IdentifierMatchException(tableContext.getName(), identifier.toString(),
              "required column(s) " + missing + " not found in " + headers);
        }
        if (selected.isEmpty()) {
          throw new IdentifierMatchException(tableContext.getName(), identifier.toString(),
              "no column matches; available columns " + headers);
        }
      }
      if (sc.getDataContext().getKind() == ContextKind.SUBJECT_ID && selected.size() > 1) {
        throw new IdentifierMatchException(tableContext.getName(), identifier.toString(),
            "subject id is ambiguous, matches " + selected);
      }
      if (selected.isEmpty()) {
        LOGGER.debug("Optional identifier '{}' matched no column in table '{}'",
            identifier, tableContext.getName());
        continue;
      }
      LOGGER.debug("Identifier '{}' bound to {} in table '{}'",
          identifier, selected, tableContext.getName());
      bindings.put(sc, selected);
    }

    DataTable data = raw.copy();
    for (Map.Entry<SeriesContext, List<String>> entry : bindings.entrySet()) {
      Object fill = entry.getKey().getFillMissing();
      if (fill != null) {
        for (String column : entry.getValue()) {
          fillMissing(data, column, fill);
        }
      }
    }

    LOGGER.info("Matched table '{}' from source '{}': {} of {} series contexts bound, {} rows",
        tableContext.getName(), sourceId, bindings.size(),
        tableContext.getSeriesContexts().size(), data.getRowCount());
    return new ContextualizedTable(data, tableContext, sourceId, bindings);
  }

  private static void fillMissing(DataTable data, String column, Object fill) {
    for (int row = 0; row < data.getRowCount(); row++) {
      Object value = data.getValue(row, column);
      if (value == null || (value instanceof String && ((String) value).trim().isEmpty())) {
        data.setValue(row, column, fill);
      }
    }
  }
}

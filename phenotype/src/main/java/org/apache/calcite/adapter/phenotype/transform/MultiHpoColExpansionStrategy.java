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
import org.apache.calcite.adapter.phenotype.context.Context;
import org.apache.calcite.adapter.phenotype.context.ContextKind;
import org.apache.calcite.adapter.phenotype.context.Identifier;
import org.apache.calcite.adapter.phenotype.context.SeriesContext;
import org.apache.calcite.adapter.phenotype.ontology.BiDict;
import org.apache.calcite.adapter.phenotype.ontology.IdGrammar;
import org.apache.calcite.adapter.phenotype.ontology.OntologyLookupException;
import org.apache.calcite.adapter.phenotype.ontology.OntologyRef;
import org.apache.calcite.adapter.phenotype.table.ContextualizedTable;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Expands cells that list several HPO terms into one column per term.
 *
 * <p>Cells of {@code multi_hpo_id} columns are split on commas, semicolons
 * and line breaks. An element may carry a label next to its identifier, as
 * in {@code HP:0001410<TAB>Leukoencephalopathy}; every {@code HP:nnnnnnn}
 * embedded in an element is taken and the rest of the element is ignored.
 * Only an element without any identifier is treated as a label, resolved
 * through the HPO {@link BiDict} when one is configured. Elements that
 * cannot be resolved are reported as {@link Diagnostic.Kind#ONTOLOGY_LOOKUP}
 * diagnostics.
 *
 * <p>For every distinct identifier a column named after it is added, tagged
 * with header context {@code hpo_label_or_id} and data context
 * {@code observation_status}; a row holds {@value #OBSERVED} if it listed
 * the term and null otherwise. The original multi-term columns are dropped.
 *
 * <h3>Example</h3>
 * <pre>{@code
 * patient | symptoms                      patient | HP:0001250 | HP:0004322
 * P001    | HP:0001250, HP:0004322   ->   P001    | OBSERVED   | OBSERVED
 * P002    | HP:0004322                    P002    | null       | OBSERVED
 * }</pre>
 */
public class MultiHpoColExpansionStrategy implements Strategy {

  private static final Logger LOGGER = LoggerFactory.getLogger(MultiHpoColExpansionStrategy.class);

  public static final String NAME = "multi_hpo_col_expansion";
  public static final String OBSERVED = "OBSERVED";

  private static final Pattern SEPARATORS = Pattern.compile("[,;\\r\\n]+");
  private static final Pattern EMBEDDED_HPO_ID = Pattern.compile("HP:\\d{7}");

  private final @Nullable BiDict hpoBiDict;

  /**
   * Creates a strategy that only accepts identifiers.
   */
  public MultiHpoColExpansionStrategy() {
    this(null);
  }

  /**
   * Creates a strategy that also resolves labels through the HPO BiDict.
   */
  public MultiHpoColExpansionStrategy(@Nullable BiDict hpoBiDict) {
    this.hpoBiDict = hpoBiDict;
  }

  @Override public String getName() {
    return NAME;
  }

  @Override public boolean isApplicable(ContextualizedTable table) {
    return !multiHpoContexts(table).isEmpty();
  }

  @Override public void transform(ContextualizedTable table, Diagnostics diagnostics)
      throws StrategyException {
    List<SeriesContext> multiContexts = multiHpoContexts(table);
    if (multiContexts.isEmpty()) {
      return;
    }
    List<String> sourceColumns = new ArrayList<String>();
    Set<String> blockIds = new LinkedHashSet<String>();
    for (SeriesContext sc : multiContexts) {
      for (String column : table.getColumns(sc)) {
        if (!sourceColumns.contains(column)) {
          sourceColumns.add(column);
        }
      }
      blockIds.add(sc.getBuildingBlockId());
    }

    int rows = table.getRowCount();
    Map<String, List<Object>> expanded = new LinkedHashMap<String, List<Object>>();
    for (int row = 0; row < rows; row++) {
      for (String column : sourceColumns) {
        Object cell = table.getValue(row, column);
        if (cell == null) {
          continue;
        }
        for (String element : SEPARATORS.split(String.valueOf(cell))) {
          String trimmed = element.trim();
          if (trimmed.isEmpty()) {
            continue;
          }
          for (String id : resolve(trimmed, table, column, row, diagnostics)) {
            List<Object> values = expanded.get(id);
            if (values == null) {
              values = new ArrayList<Object>(rows);
              for (int i = 0; i < rows; i++) {
                values.add(null);
              }
              expanded.put(id, values);
            }
            values.set(row, OBSERVED);
          }
        }
      }
    }

    for (String column : sourceColumns) {
      table.dropColumn(column);
    }
    if (expanded.isEmpty()) {
      LOGGER.info("No HPO terms found in {} of table '{}'", sourceColumns, table.getName());
      return;
    }

    List<String> newColumns = new ArrayList<String>();
    for (String id : expanded.keySet()) {
      if (table.getData().hasColumn(id)) {
        throw new StrategyException(NAME, table.getName(),
            "expanded column '" + id + "' clashes with an existing column");
      }
      newColumns.add(id);
    }
    SeriesContext observations = SeriesContext.builder()
        .identifier(Identifier.list(newColumns))
        .headerContext(Context.HPO_LABEL_OR_ID)
        .dataContext(Context.OBSERVATION_STATUS)
        .buildingBlockId(blockIds.size() == 1 ? blockIds.iterator().next() : null)
        .optional(true)
        .build();
    for (Map.Entry<String, List<Object>> entry : expanded.entrySet()) {
      table.addColumn(observations, entry.getKey(), entry.getValue());
    }
    LOGGER.info("Expanded {} of table '{}' into {} HPO columns",
        sourceColumns, table.getName(), newColumns.size());
  }

  /**
   * Returns the HPO identifiers of one list element; empty if it has none
   * and cannot be resolved as a label.
   */
  private List<String> resolve(String element, ContextualizedTable table, String column,
      int row, Diagnostics diagnostics) {
    String canonical = IdGrammar.canonicalize(OntologyRef.HP, element);
    if (canonical != null) {
      return Collections.singletonList(canonical);
    }
    List<String> ids = new ArrayList<String>();
    Matcher matcher = EMBEDDED_HPO_ID.matcher(element);
    while (matcher.find()) {
      if (!ids.contains(matcher.group())) {
        ids.add(matcher.group());
      }
    }
    if (!ids.isEmpty()) {
      return ids;
    }
    String error;
    if (hpoBiDict != null) {
      try {
        return Collections.singletonList(hpoBiDict.getId(element));
      } catch (OntologyLookupException e) {
        error = e.getMessage();
      }
    } else {
      error = "'" + element + "' is not an HPO identifier";
    }
    diagnostics.add(Diagnostic.builder(Diagnostic.Kind.ONTOLOGY_LOOKUP)
        .table(table.getName())
        .column(column)
        .row(row)
        .value(element)
        .message(Objects.requireNonNull(error))
        .build());
    return Collections.<String>emptyList();
  }

  private static List<SeriesContext> multiHpoContexts(ContextualizedTable table) {
    return table.findSeriesContexts(
        sc -> sc.getDataContext().getKind() == ContextKind.MULTI_HPO_ID);
  }
}

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
import org.apache.calcite.adapter.phenotype.ontology.BiDict;
import org.apache.calcite.adapter.phenotype.ontology.IdGrammar;
import org.apache.calcite.adapter.phenotype.ontology.OntologyLookupException;
import org.apache.calcite.adapter.phenotype.table.ContextualizedTable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Replaces ontology labels and synonyms with canonical identifiers.
 *
 * <p>Targets columns whose header carries no context and whose data context
 * equals the configured one. For each distinct value:
 * <ul>
 *   <li>a well-formed identifier of the ontology is written in canonical form
 *       without a lookup</li>
 *   <li>anything else is resolved through {@link BiDict#getId}</li>
 * </ul>
 * Values that are malformed identifiers or cannot be resolved keep their
 * original text and are reported as
 * {@link Diagnostic.Kind#ONTOLOGY_LOOKUP} diagnostics, one per cell.
 */
public class OntologyNormaliserStrategy implements Strategy {

  private static final Logger LOGGER = LoggerFactory.getLogger(OntologyNormaliserStrategy.class);

  public static final String NAME = "ontology_normaliser";

  private final BiDict biDict;
  private final Context dataContext;

  public OntologyNormaliserStrategy(BiDict biDict, Context dataContext) {
    if (biDict == null) {
      throw new IllegalArgumentException("BiDict is required");
    }
    if (dataContext == null || dataContext.isNone()) {
      throw new IllegalArgumentException("Ontology normaliser requires a data context");
    }
    this.biDict = biDict;
    this.dataContext = dataContext;
  }

  @Override public String getName() {
    return NAME;
  }

  public Context getDataContext() {
    return dataContext;
  }

  @Override public boolean isApplicable(ContextualizedTable table) {
    return !table.getColumns(Context.NONE, dataContext).isEmpty();
  }

  @Override public void transform(ContextualizedTable table, Diagnostics diagnostics) {
    Map<String, Resolution> resolved = new HashMap<String, Resolution>();
    List<String> columns = table.getColumns(Context.NONE, dataContext);
    for (String column : columns) {
      for (int row = 0; row < table.getRowCount(); row++) {
        Object value = table.getValue(row, column);
        if (value == null) {
          continue;
        }
        String text = String.valueOf(value).trim();
        if (text.isEmpty()) {
          continue;
        }
        Resolution resolution = resolved.get(text);
        if (resolution == null) {
          resolution = resolve(text);
          resolved.put(text, resolution);
        }
        if (resolution.id != null) {
          table.setValue(row, column, resolution.id);
        } else {
          diagnostics.add(Diagnostic.builder(Diagnostic.Kind.ONTOLOGY_LOOKUP)
              .table(table.getName())
              .column(column)
              .row(row)
              .value(text)
              .message(resolution.error)
              .build());
        }
      }
    }
    LOGGER.debug("Normalised {} distinct {} values in table '{}'",
        resolved.size(), biDict.getOntologyRef(), table.getName());
  }

  private Resolution resolve(String text) {
    if (biDict.isId(text)) {
      String canonical = IdGrammar.canonicalize(biDict.getOntologyRef(), text);
      return canonical != null
          ? Resolution.of(canonical)
          : Resolution.failed("'" + text + "' is not a valid "
              + biDict.getOntologyRef().getPrefix() + " identifier");
    }
    try {
      return Resolution.of(biDict.getId(text));
    } catch (OntologyLookupException e) {
      return Resolution.failed(e.getMessage());
    }
  }

  @Override public String toString() {
    return "OntologyNormaliserStrategy{ontology=" + biDict.getOntologyRef()
        + ", context=" + dataContext + "}";
  }

  /**
   * Outcome of resolving one distinct value.
   */
  private static final class Resolution {
    final String id;
    final String error;

    private Resolution(String id, String error) {
      this.id = id;
      this.error = error;
    }

    static Resolution of(String id) {
      return new Resolution(id, null);
    }

    static Resolution failed(String error) {
      return new Resolution(null, error);
    }
  }
}

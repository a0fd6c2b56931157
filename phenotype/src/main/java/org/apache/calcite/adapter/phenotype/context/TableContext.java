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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Declared semantic shape of one physical table: a CSV file or a single
 * spreadsheet sheet.
 *
 * <p>A TableContext is validated when it is built:
 * <ul>
 *   <li>it has a name and at least one series context</li>
 *   <li>exactly one series context has the {@code subject_id} data
 *       context</li>
 *   <li>no two series contexts share an identifier</li>
 * </ul>
 *
 * <h3>YAML Configuration Example</h3>
 * <pre>{@code
 * name: patients
 * contexts:
 *   - identifier: patient_id
 *     data_context: subject_id
 *   - identifier: sex
 *     data_context: subject_sex
 *     alias_map:
 *       mappings: {M: Male, F: Female}
 * }</pre>
 *
 * @see SeriesContext
 */
public final class TableContext {

  private final String name;
  private final List<SeriesContext> seriesContexts;

  private TableContext(Builder builder) {
    this.name = builder.name;
    this.seriesContexts =
        Collections.unmodifiableList(new ArrayList<SeriesContext>(builder.seriesContexts));
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates a TableContext from a YAML/JSON map with {@code name} and
   * {@code contexts} entries.
   */
  public static TableContext fromMap(Map<String, Object> map) {
    if (map == null) {
      return null;
    }
    Object contexts = map.get("contexts");
    if (!(contexts instanceof List)) {
      throw new ConfigurationException("Table context requires a 'contexts' list");
    }
    return builder()
        .name(map.get("name") == null ? null : String.valueOf(map.get("name")))
        .seriesContexts(SeriesContext.fromList((List<?>) contexts))
        .build();
  }

  public String getName() {
    return name;
  }

  public List<SeriesContext> getSeriesContexts() {
    return seriesContexts;
  }

  /**
   * Returns the series context tagged {@code subject_id}.
   */
  public SeriesContext getSubjectIdContext() {
    for (SeriesContext sc : seriesContexts) {
      if (sc.getDataContext().getKind() == ContextKind.SUBJECT_ID) {
        return sc;
      }
    }
    throw new IllegalStateException("Table context " + name + " has no subject id");
  }

  /**
   * Returns the series contexts of one building block, in declared order.
   */
  public List<SeriesContext> getBuildingBlock(String buildingBlockId) {
    List<SeriesContext> block = new ArrayList<SeriesContext>();
    for (SeriesContext sc : seriesContexts) {
      if (buildingBlockId.equals(sc.getBuildingBlockId())) {
        block.add(sc);
      }
    }
    return block;
  }

  @Override public String toString() {
    return "TableContext{name='" + name + "', series=" + seriesContexts.size() + "}";
  }

  /**
   * Builder for {@link TableContext}.
   */
  public static class Builder {
    private String name;
    private final List<SeriesContext> seriesContexts = new ArrayList<SeriesContext>();

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder seriesContext(SeriesContext seriesContext) {
      this.seriesContexts.add(seriesContext);
      return this;
    }

    public Builder seriesContexts(List<SeriesContext> seriesContexts) {
      this.seriesContexts.addAll(seriesContexts);
      return this;
    }

    public TableContext build() {
      if (name == null || name.isEmpty()) {
        throw new ConfigurationException("Table context name is required");
      }
      if (seriesContexts.isEmpty()) {
        throw new ConfigurationException("Table context '" + name
            + "' requires at least one series context");
      }
      int subjectIds = 0;
      Set<Identifier> identifiers = new HashSet<Identifier>();
      for (SeriesContext sc : seriesContexts) {
        if (sc.getDataContext().getKind() == ContextKind.SUBJECT_ID) {
          subjectIds++;
        }
        if (!identifiers.add(sc.getIdentifier())) {
          throw new ConfigurationException("Table context '" + name
              + "' declares identifier '" + sc.getIdentifier() + "' more than once");
        }
      }
      if (subjectIds != 1) {
        throw new ConfigurationException("Table context '" + name
            + "' must declare exactly one subject_id series context, found " + subjectIds);
      }
      return new TableContext(this);
    }
  }
}

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

import org.apache.calcite.adapter.phenotype.context.Context;
import org.apache.calcite.adapter.phenotype.context.SeriesContext;
import org.apache.calcite.adapter.phenotype.context.TableContext;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * A {@link DataTable} whose columns have been bound to the series contexts of
 * a {@link TableContext}.
 *
 * <p>Produced by {@link ContextMatcher} and rewritten in place by the
 * strategies of a transform pipeline. Strategies that create columns register
 * them with a new series context through {@link #addColumn}, so the tags stay
 * in step with the data.
 */
public final class ContextualizedTable {

  private final DataTable data;
  private final TableContext tableContext;
  private final String sourceId;
  private final Map<SeriesContext, List<String>> bindings;

  ContextualizedTable(DataTable data, TableContext tableContext, String sourceId,
      Map<SeriesContext, List<String>> bindings) {
    this.data = data;
    this.tableContext = tableContext;
    this.sourceId = sourceId;
    this.bindings = new LinkedHashMap<SeriesContext, List<String>>();
    for (Map.Entry<SeriesContext, List<String>> entry : bindings.entrySet()) {
      this.bindings.put(entry.getKey(), new ArrayList<String>(entry.getValue()));
    }
  }

  /**
   * Returns the table name used in diagnostics: the table context's name.
   */
  public String getName() {
    return tableContext.getName();
  }

  public DataTable getData() {
    return data;
  }

  public TableContext getTableContext() {
    return tableContext;
  }

  /**
   * Returns the identity of the data source the table was read from.
   */
  public String getSourceId() {
    return sourceId;
  }

  public int getRowCount() {
    return data.getRowCount();
  }

  /**
   * Returns the bound series contexts, declared ones first, followed by
   * those added by strategies.
   */
  public List<SeriesContext> getSeriesContexts() {
    return Collections.unmodifiableList(new ArrayList<SeriesContext>(bindings.keySet()));
  }

  /**
   * Returns the columns bound to a series context.
   */
  public List<String> getColumns(SeriesContext seriesContext) {
    List<String> columns = bindings.get(seriesContext);
    return columns == null
        ? Collections.<String>emptyList()
        : Collections.unmodifiableList(new ArrayList<String>(columns));
  }

  /**
   * Returns the series contexts accepted by a filter.
   */
  public List<SeriesContext> findSeriesContexts(Predicate<SeriesContext> filter) {
    List<SeriesContext> found = new ArrayList<SeriesContext>();
    for (SeriesContext sc : bindings.keySet()) {
      if (filter.test(sc)) {
        found.add(sc);
      }
    }
    return found;
  }

  /**
   * Returns the columns whose series context has exactly the given header and
   * data contexts, without duplicates, in binding order.
   */
  public List<String> getColumns(Context headerContext, Context dataContext) {
    List<String> columns = new ArrayList<String>();
    for (Map.Entry<SeriesContext, List<String>> entry : bindings.entrySet()) {
      SeriesContext sc = entry.getKey();
      if (sc.getHeaderContext().equals(headerContext) && sc.getDataContext().equals(dataContext)) {
        for (String column : entry.getValue()) {
          if (!columns.contains(column)) {
            columns.add(column);
          }
        }
      }
    }
    return columns;
  }

  /**
   * Adds a column and binds it to a series context. The series context is
   * registered if it is not bound yet.
   */
  public void addColumn(SeriesContext seriesContext, String column, List<Object> values) {
    data.addColumn(column, values);
    List<String> columns = bindings.get(seriesContext);
    if (columns == null) {
      columns = new ArrayList<String>();
      bindings.put(seriesContext, columns);
    }
    columns.add(column);
  }

  /**
   * Drops a column from the data and from every binding. A series context
   * left without columns is unbound.
   */
  public void dropColumn(String column) {
    data.dropColumn(column);
    Iterator<Map.Entry<SeriesContext, List<String>>> it = bindings.entrySet().iterator();
    while (it.hasNext()) {
      List<String> columns = it.next().getValue();
      columns.remove(column);
      if (columns.isEmpty()) {
        it.remove();
      }
    }
  }

  public @Nullable Object getValue(int row, String column) {
    return data.getValue(row, column);
  }

  public void setValue(int row, String column, @Nullable Object value) {
    data.setValue(row, column, value);
  }

  /**
   * Returns one tagged row.
   */
  public TaggedRow getRow(int row) {
    List<TaggedCell> cells = new ArrayList<TaggedCell>();
    for (Map.Entry<SeriesContext, List<String>> entry : bindings.entrySet()) {
      for (String column : entry.getValue()) {
        cells.add(new TaggedCell(column, entry.getKey(), data.getValue(row, column)));
      }
    }
    return new TaggedRow(getName(), row, cells);
  }

  /**
   * Returns all tagged rows in table order.
   */
  public List<TaggedRow> getRows() {
    List<TaggedRow> rows = new ArrayList<TaggedRow>(data.getRowCount());
    for (int i = 0; i < data.getRowCount(); i++) {
      rows.add(getRow(i));
    }
    return rows;
  }

  @Override public String toString() {
    return "ContextualizedTable{name='" + getName() + "', source='" + sourceId
        + "', columns=" + data.getColumnNames() + ", rows=" + data.getRowCount() + "}";
  }
}

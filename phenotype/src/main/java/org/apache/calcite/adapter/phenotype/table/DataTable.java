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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Named, column-ordered, in-memory table of nullable scalars.
 *
 * <p>Cells hold {@code String}, {@code Long}, {@code Double} or
 * {@code Boolean} values, or null. Columns are stored column-major so that
 * strategies can rewrite, add and drop whole columns cheaply.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * DataTable table = DataTable.fromRows("patients",
 *     Arrays.asList("patient_id", "sex"),
 *     Arrays.asList(
 *         Arrays.<Object>asList("P001", "M"),
 *         Arrays.<Object>asList("P002", "F")));
 * table.setValue(0, "sex", "Male");
 * }</pre>
 */
public final class DataTable {

  private final String name;
  private final Map<String, List<Object>> columns = new LinkedHashMap<String, List<Object>>();
  private int rowCount;

  public DataTable(String name, int rowCount) {
    if (name == null || name.isEmpty()) {
      throw new IllegalArgumentException("Table name is required");
    }
    this.name = name;
    this.rowCount = rowCount;
  }

  /**
   * Builds a table from a header and row-major data. Short rows are padded
   * with nulls; cells beyond the header are ignored.
   *
   * @throws IllegalArgumentException if a header is null or repeated
   */
  public static DataTable fromRows(String name, List<String> headers, List<List<Object>> rows) {
    DataTable table = new DataTable(name, rows.size());
    for (int c = 0; c < headers.size(); c++) {
      List<Object> values = new ArrayList<Object>(rows.size());
      for (List<Object> row : rows) {
        values.add(c < row.size() ? row.get(c) : null);
      }
      table.addColumn(headers.get(c), values);
    }
    return table;
  }

  public String getName() {
    return name;
  }

  public int getRowCount() {
    return rowCount;
  }

  public List<String> getColumnNames() {
    return Collections.unmodifiableList(new ArrayList<String>(columns.keySet()));
  }

  public boolean hasColumn(String column) {
    return columns.containsKey(column);
  }

  /**
   * Returns a read-only view of a column's values.
   */
  public List<Object> getColumn(String column) {
    return Collections.unmodifiableList(requireColumn(column));
  }

  public @Nullable Object getValue(int row, String column) {
    return requireColumn(column).get(row);
  }

  public void setValue(int row, String column, @Nullable Object value) {
    requireColumn(column).set(row, value);
  }

  /**
   * Appends a column.
   *
   * @throws IllegalArgumentException if the name is taken or the length
   *     differs from the row count
   */
  public void addColumn(String column, List<Object> values) {
    if (column == null) {
      throw new IllegalArgumentException("Column name must not be null in table " + name);
    }
    if (columns.containsKey(column)) {
      throw new IllegalArgumentException("Duplicate column '" + column + "' in table " + name);
    }
    if (values.size() != rowCount) {
      throw new IllegalArgumentException("Column '" + column + "' has " + values.size()
          + " values, table " + name + " has " + rowCount + " rows");
    }
    columns.put(column, new ArrayList<Object>(values));
  }

  public void dropColumn(String column) {
    if (columns.remove(column) == null) {
      throw new IllegalArgumentException("No column '" + column + "' in table " + name);
    }
  }

  /**
   * Returns one row as a column-ordered map.
   */
  public Map<String, Object> getRow(int row) {
    Map<String, Object> values = new LinkedHashMap<String, Object>();
    for (Map.Entry<String, List<Object>> entry : columns.entrySet()) {
      values.put(entry.getKey(), entry.getValue().get(row));
    }
    return values;
  }

  /**
   * Returns a deep copy of this table.
   */
  public DataTable copy() {
    DataTable copy = new DataTable(name, rowCount);
    for (Map.Entry<String, List<Object>> entry : columns.entrySet()) {
      copy.addColumn(entry.getKey(), entry.getValue());
    }
    return copy;
  }

  private List<Object> requireColumn(String column) {
    List<Object> values = columns.get(column);
    if (values == null) {
      throw new IllegalArgumentException("No column '" + column + "' in table " + name);
    }
    return values;
  }

  @Override public String toString() {
    return "DataTable{name='" + name + "', columns=" + columns.keySet()
        + ", rows=" + rowCount + "}";
  }
}

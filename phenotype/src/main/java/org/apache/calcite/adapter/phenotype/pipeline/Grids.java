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
package org.apache.calcite.adapter.phenotype.pipeline;

import org.apache.calcite.adapter.phenotype.config.ExtractionConfig;
import org.apache.calcite.adapter.phenotype.table.DataTable;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a raw grid of cells into a {@link DataTable} according to an
 * {@link ExtractionConfig}.
 */
final class Grids {

  private Grids() {
  }

  /**
   * Builds a table from row-major cells.
   *
   * <p>When subjects run across the columns the grid is transposed first, so
   * the first column of the source supplies the headers. Without headers,
   * columns are named {@code column_1}, {@code column_2} and so on. Empty
   * strings become nulls. Source lines without any value, such as a trailing
   * blank line or an empty spreadsheet row, are skipped.
   */
  static DataTable toDataTable(String name, List<List<Object>> grid, ExtractionConfig extraction) {
    List<List<Object>> lines = new ArrayList<List<Object>>(grid.size());
    for (List<Object> line : grid) {
      if (!isBlank(line)) {
        lines.add(line);
      }
    }
    List<List<Object>> rows = extraction.isPatientsAreRows() ? lines : transpose(lines);
    int width = 0;
    for (List<Object> row : rows) {
      width = Math.max(width, row.size());
    }
    List<String> headers = new ArrayList<String>(width);
    List<List<Object>> body = rows;
    if (extraction.hasHeaders() && !rows.isEmpty()) {
      List<Object> headerRow = rows.get(0);
      for (int c = 0; c < width; c++) {
        Object header = c < headerRow.size() ? headerRow.get(c) : null;
        headers.add(header == null ? "column_" + (c + 1) : String.valueOf(header).trim());
      }
      body = rows.subList(1, rows.size());
    } else {
      for (int c = 0; c < width; c++) {
        headers.add("column_" + (c + 1));
      }
    }
    List<List<Object>> cleaned = new ArrayList<List<Object>>(body.size());
    for (List<Object> row : body) {
      if (isBlank(row)) {
        continue;
      }
      List<Object> values = new ArrayList<Object>(row.size());
      for (Object value : row) {
        values.add(value instanceof String && ((String) value).isEmpty() ? null : value);
      }
      cleaned.add(values);
    }
    return DataTable.fromRows(name, headers, cleaned);
  }

  static boolean isBlank(List<Object> row) {
    for (Object value : row) {
      if (value != null && !(value instanceof String && ((String) value).trim().isEmpty())) {
        return false;
      }
    }
    return true;
  }

  static List<List<Object>> transpose(List<List<Object>> grid) {
    int width = 0;
    for (List<Object> row : grid) {
      width = Math.max(width, row.size());
    }
    List<List<Object>> result = new ArrayList<List<Object>>(width);
    for (int c = 0; c < width; c++) {
      List<Object> column = new ArrayList<Object>(grid.size());
      for (List<Object> row : grid) {
        column.add(c < row.size() ? row.get(c) : null);
      }
      result.add(column);
    }
    return result;
  }
}

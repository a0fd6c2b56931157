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
import org.apache.calcite.adapter.phenotype.context.OutputDataType;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One row of a {@link ContextualizedTable}: every bound cell with its tag.
 *
 * <p>A column bound by two series contexts appears once per series.
 */
public final class TaggedRow {

  private final String tableName;
  private final int rowIndex;
  private final List<TaggedCell> cells;

  public TaggedRow(String tableName, int rowIndex, List<TaggedCell> cells) {
    this.tableName = tableName;
    this.rowIndex = rowIndex;
    this.cells = Collections.unmodifiableList(new ArrayList<TaggedCell>(cells));
  }

  public String getTableName() {
    return tableName;
  }

  public int getRowIndex() {
    return rowIndex;
  }

  public List<TaggedCell> getCells() {
    return cells;
  }

  /**
   * Returns the subject identifier as text, or null when the subject id cell
   * is missing or blank.
   */
  public @Nullable String getSubjectId() {
    for (TaggedCell cell : cells) {
      if (cell.getDataContext().getKind() == ContextKind.SUBJECT_ID) {
        Object value = cell.getValue();
        if (value == null) {
          return null;
        }
        String text = OutputDataType.formatScalar(value).trim();
        return text.isEmpty() ? null : text;
      }
    }
    return null;
  }

  @Override public String toString() {
    return "TaggedRow{table='" + tableName + "', row=" + rowIndex + ", cells=" + cells + "}";
  }
}

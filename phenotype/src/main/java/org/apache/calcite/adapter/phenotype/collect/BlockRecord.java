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
package org.apache.calcite.adapter.phenotype.collect;

import org.apache.calcite.adapter.phenotype.context.Context;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Values of one building block taken from a single row, for example a
 * disease together with the variant that supports it.
 */
public final class BlockRecord {

  private final String blockId;
  private final String tableName;
  private final String sourceId;
  private final int rowIndex;
  private final List<TaggedValue> values;

  public BlockRecord(String blockId, String tableName, String sourceId, int rowIndex,
      List<TaggedValue> values) {
    this.blockId = blockId;
    this.tableName = tableName;
    this.sourceId = sourceId;
    this.rowIndex = rowIndex;
    this.values = Collections.unmodifiableList(new ArrayList<TaggedValue>(values));
  }

  public String getBlockId() {
    return blockId;
  }

  public String getTableName() {
    return tableName;
  }

  public String getSourceId() {
    return sourceId;
  }

  public int getRowIndex() {
    return rowIndex;
  }

  public List<TaggedValue> getValues() {
    return values;
  }

  /**
   * Returns the first value with the given data context, or null.
   */
  public @Nullable Object getValue(Context dataContext) {
    for (TaggedValue value : values) {
      if (value.getDataContext().equals(dataContext)) {
        return value.getValue();
      }
    }
    return null;
  }

  /**
   * Returns whether the block holds a value with the given data context.
   */
  public boolean has(Context dataContext) {
    return getValue(dataContext) != null;
  }

  Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<String, Object>();
    map.put("table", tableName);
    map.put("source", sourceId);
    map.put("row", rowIndex);
    List<Map<String, Object>> list = new ArrayList<Map<String, Object>>();
    for (TaggedValue value : values) {
      list.add(value.toMap());
    }
    map.put("values", list);
    return map;
  }

  @Override public String toString() {
    return "BlockRecord{block='" + blockId + "', table='" + tableName + "', row=" + rowIndex
        + ", values=" + values + "}";
  }
}

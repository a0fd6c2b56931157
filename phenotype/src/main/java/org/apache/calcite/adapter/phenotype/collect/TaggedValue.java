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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A collected, non-null value together with its tags and originating column.
 */
public final class TaggedValue {

  private final String column;
  private final Context headerContext;
  private final Context dataContext;
  private final Object value;

  public TaggedValue(String column, Context headerContext, Context dataContext, Object value) {
    this.column = Objects.requireNonNull(column, "column");
    this.headerContext = Objects.requireNonNull(headerContext, "headerContext");
    this.dataContext = Objects.requireNonNull(dataContext, "dataContext");
    this.value = Objects.requireNonNull(value, "value");
  }

  public String getColumn() {
    return column;
  }

  public Context getHeaderContext() {
    return headerContext;
  }

  public Context getDataContext() {
    return dataContext;
  }

  public Object getValue() {
    return value;
  }

  Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<String, Object>();
    map.put("column", column);
    if (!headerContext.isNone()) {
      map.put("header_context", headerContext.toString());
    }
    map.put("data_context", dataContext.toString());
    map.put("value", value);
    return map;
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TaggedValue)) {
      return false;
    }
    TaggedValue that = (TaggedValue) o;
    return column.equals(that.column) && headerContext.equals(that.headerContext)
        && dataContext.equals(that.dataContext) && value.equals(that.value);
  }

  @Override public int hashCode() {
    return Objects.hash(column, headerContext, dataContext, value);
  }

  @Override public String toString() {
    return column + "[" + (headerContext.isNone() ? "" : headerContext + "/") + dataContext
        + "]=" + value;
  }
}

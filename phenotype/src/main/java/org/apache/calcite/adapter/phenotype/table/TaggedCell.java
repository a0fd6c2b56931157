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

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * One cell together with the column it came from and the series context
 * that tagged it.
 */
public final class TaggedCell {

  private final String column;
  private final SeriesContext seriesContext;
  private final @Nullable Object value;

  public TaggedCell(String column, SeriesContext seriesContext, @Nullable Object value) {
    this.column = column;
    this.seriesContext = seriesContext;
    this.value = value;
  }

  public String getColumn() {
    return column;
  }

  public SeriesContext getSeriesContext() {
    return seriesContext;
  }

  public Context getHeaderContext() {
    return seriesContext.getHeaderContext();
  }

  public Context getDataContext() {
    return seriesContext.getDataContext();
  }

  public @Nullable Object getValue() {
    return value;
  }

  public boolean isNull() {
    return value == null;
  }

  @Override public String toString() {
    return column + "=" + value;
  }
}

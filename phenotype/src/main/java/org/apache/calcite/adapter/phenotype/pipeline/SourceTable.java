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

import org.apache.calcite.adapter.phenotype.context.TableContext;
import org.apache.calcite.adapter.phenotype.table.DataTable;

/**
 * A raw table as extracted by a {@link DataSource}, paired with the context
 * declared for it.
 */
public final class SourceTable {

  private final DataTable data;
  private final TableContext tableContext;

  public SourceTable(DataTable data, TableContext tableContext) {
    if (data == null || tableContext == null) {
      throw new IllegalArgumentException("Both data and table context are required");
    }
    this.data = data;
    this.tableContext = tableContext;
  }

  public DataTable getData() {
    return data;
  }

  public TableContext getTableContext() {
    return tableContext;
  }

  @Override public String toString() {
    return "SourceTable{name='" + tableContext.getName() + "', rows=" + data.getRowCount() + "}";
  }
}

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

import org.apache.calcite.adapter.phenotype.table.DataTable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Data source over tables built in code. Each extraction hands out copies,
 * so the source can be run more than once.
 */
public class InMemoryDataSource implements DataSource {

  private final String id;
  private final List<SourceTable> tables;

  public InMemoryDataSource(String id, List<SourceTable> tables) {
    this.id = id;
    this.tables = Collections.unmodifiableList(new ArrayList<SourceTable>(tables));
  }

  public static InMemoryDataSource of(String id, SourceTable... tables) {
    List<SourceTable> list = new ArrayList<SourceTable>();
    Collections.addAll(list, tables);
    return new InMemoryDataSource(id, list);
  }

  @Override public String getId() {
    return id;
  }

  @Override public String getType() {
    return "memory";
  }

  @Override public List<SourceTable> extract() {
    List<SourceTable> copies = new ArrayList<SourceTable>(tables.size());
    for (SourceTable table : tables) {
      DataTable data = table.getData().copy();
      copies.add(new SourceTable(data, table.getTableContext()));
    }
    return copies;
  }

  @Override public String toString() {
    return "InMemoryDataSource{id='" + id + "', tables=" + tables.size() + "}";
  }
}

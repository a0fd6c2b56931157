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
package org.apache.calcite.adapter.phenotype.transform;

import org.apache.calcite.adapter.phenotype.context.Context;
import org.apache.calcite.adapter.phenotype.context.Identifier;
import org.apache.calcite.adapter.phenotype.context.SeriesContext;
import org.apache.calcite.adapter.phenotype.context.TableContext;
import org.apache.calcite.adapter.phenotype.table.ContextMatcher;
import org.apache.calcite.adapter.phenotype.table.ContextualizedTable;
import org.apache.calcite.adapter.phenotype.table.DataTable;
import org.apache.calcite.adapter.phenotype.table.IdentifierMatchException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Builds small tagged tables for strategy tests: a {@code patient_id}
 * column followed by one column per series context.
 */
final class TestTables {

  private TestTables() {
  }

  static SeriesContext column(String name, Context dataContext) {
    return SeriesContext.builder()
        .identifier(Identifier.exact(name))
        .dataContext(dataContext)
        .build();
  }

  /**
   * Tags a table whose rows are {@code [patientId, value]}.
   */
  static ContextualizedTable single(SeriesContext series, Object... values)
      throws IdentifierMatchException {
    List<List<Object>> rows = new ArrayList<List<Object>>();
    for (int i = 0; i < values.length; i++) {
      rows.add(Arrays.<Object>asList("P" + (i + 1), values[i]));
    }
    String column = series.getIdentifier().getNames().get(0);
    DataTable raw = DataTable.fromRows("patients", Arrays.asList("patient_id", column), rows);
    TableContext tc = TableContext.builder()
        .name("patients")
        .seriesContext(column("patient_id", Context.SUBJECT_ID))
        .seriesContext(series)
        .build();
    return new ContextMatcher().match(raw, tc, "memory");
  }
}

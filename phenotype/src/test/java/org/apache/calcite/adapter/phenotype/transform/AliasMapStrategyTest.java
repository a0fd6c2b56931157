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

import org.apache.calcite.adapter.phenotype.Diagnostic;
import org.apache.calcite.adapter.phenotype.Diagnostics;
import org.apache.calcite.adapter.phenotype.context.AliasMap;
import org.apache.calcite.adapter.phenotype.context.Context;
import org.apache.calcite.adapter.phenotype.context.Identifier;
import org.apache.calcite.adapter.phenotype.context.OutputDataType;
import org.apache.calcite.adapter.phenotype.context.SeriesContext;
import org.apache.calcite.adapter.phenotype.context.TableContext;
import org.apache.calcite.adapter.phenotype.table.ContextMatcher;
import org.apache.calcite.adapter.phenotype.table.ContextualizedTable;
import org.apache.calcite.adapter.phenotype.table.DataTable;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for AliasMapStrategy.
 */
@Tag("unit")
public class AliasMapStrategyTest {

  @Test void testSubstitutesAndKeepsUnmapped() throws Exception {
    SeriesContext sex = TestTables.column("sex", Context.SUBJECT_SEX).toBuilder()
        .aliasMap(AliasMap.builder().alias("M", "Male").alias("F", "Female").build())
        .build();
    ContextualizedTable table = TestTables.single(sex, "M", "F", "X", null);
    Diagnostics diagnostics = new Diagnostics();

    new AliasMapStrategy().transform(table, diagnostics);

    assertEquals("Male", table.getValue(0, "sex"));
    assertEquals("Female", table.getValue(1, "sex"));
    assertEquals("X", table.getValue(2, "sex"));
    assertNull(table.getValue(3, "sex"));
    assertTrue(diagnostics.isEmpty());
  }

  @Test void testConversionFailureNullsCell() throws Exception {
    SeriesContext survival = TestTables.column("days", Context.SURVIVAL_TIME_DAYS).toBuilder()
        .aliasMap(AliasMap.builder()
            .alias("unknown", null)
            .outputDataType(OutputDataType.INT)
            .build())
        .build();
    ContextualizedTable table = TestTables.single(survival, "120", "unknown", "soon");
    Diagnostics diagnostics = new Diagnostics();

    new AliasMapStrategy().transform(table, diagnostics);

    assertEquals(120L, table.getValue(0, "days"));
    assertNull(table.getValue(1, "days"));
    assertNull(table.getValue(2, "days"));
    assertEquals(1, diagnostics.size());
    Diagnostic diagnostic = diagnostics.getEntries().get(0);
    assertEquals(Diagnostic.Kind.TYPE_COERCION, diagnostic.getKind());
    assertEquals("days", diagnostic.getColumn());
    assertEquals(2, diagnostic.getRow());
    assertEquals("soon", diagnostic.getValue());
  }

  @Test void testNotApplicableWithoutAliasMaps() throws Exception {
    ContextualizedTable table =
        TestTables.single(TestTables.column("sex", Context.SUBJECT_SEX), "M");

    assertFalse(new AliasMapStrategy().isApplicable(table));
  }

  @Test void testEqualAliasMapsOnSharedColumnApplyOnce() throws Exception {
    ContextualizedTable table = sharedColumn(
        AliasMap.builder().alias("M", "Male").alias("Male", "Man").build(),
        AliasMap.builder().alias("M", "Male").alias("Male", "Man").build());
    Diagnostics diagnostics = new Diagnostics();

    new AliasMapStrategy().transform(table, diagnostics);

    assertEquals("Male", table.getValue(0, "sex"));
    assertEquals("Man", table.getValue(1, "sex"));
    assertTrue(diagnostics.isEmpty());
  }

  @Test void testConflictingAliasMapsOnSharedColumnFail() throws Exception {
    ContextualizedTable table = sharedColumn(
        AliasMap.builder().alias("M", "Male").build(),
        AliasMap.builder().alias("M", "Man").build());

    assertThrows(StrategyException.class,
        () -> new AliasMapStrategy().transform(table, new Diagnostics()));
  }

  /**
   * Tags a {@code sex} column through two series contexts, an exact one and
   * a regex one, each carrying its own alias map.
   */
  private static ContextualizedTable sharedColumn(AliasMap first, AliasMap second)
      throws Exception {
    DataTable raw = DataTable.fromRows("patients", Arrays.asList("patient_id", "sex"),
        Arrays.asList(Arrays.<Object>asList("P1", "M"), Arrays.<Object>asList("P2", "Male")));
    TableContext tc = TableContext.builder()
        .name("patients")
        .seriesContext(TestTables.column("patient_id", Context.SUBJECT_ID))
        .seriesContext(TestTables.column("sex", Context.SUBJECT_SEX).toBuilder()
            .aliasMap(first)
            .build())
        .seriesContext(SeriesContext.builder()
            .identifier(Identifier.regex("se."))
            .dataContext(Context.SUBJECT_SEX)
            .aliasMap(second)
            .build())
        .build();
    return new ContextMatcher().match(raw, tc, "memory");
  }
}

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

import org.apache.calcite.adapter.phenotype.ConfigurationException;
import org.apache.calcite.adapter.phenotype.Diagnostics;
import org.apache.calcite.adapter.phenotype.context.Context;
import org.apache.calcite.adapter.phenotype.table.ContextualizedTable;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for StringCorrectionStrategy.
 */
@Tag("unit")
public class StringCorrectionStrategyTest {

  @Test void testCorrect() {
    StringCorrectionStrategy strategy = StringCorrectionStrategy.builder()
        .replace("_", " ")
        .build();

    assertEquals("Abdominal pain", strategy.correct("  Abdominal__pain "));
    assertEquals("Seizure", strategy.correct("Seizure"));
    assertNull(strategy.correct("  "));
  }

  @Test void testCaseModeAndNoCollapse() {
    StringCorrectionStrategy strategy = StringCorrectionStrategy.builder()
        .collapseWhitespace(false)
        .caseMode(StringCorrectionStrategy.CaseMode.LOWER)
        .build();

    assertEquals("abdominal  pain", strategy.correct(" Abdominal  Pain"));
    assertEquals(StringCorrectionStrategy.CaseMode.UPPER,
        StringCorrectionStrategy.CaseMode.fromConfig("upper"));
    assertThrows(ConfigurationException.class,
        () -> StringCorrectionStrategy.CaseMode.fromConfig("title"));
  }

  @Test void testOnlyTargetsSelectedContexts() throws Exception {
    StringCorrectionStrategy strategy = StringCorrectionStrategy.builder()
        .dataContext(Context.HPO_LABEL_OR_ID)
        .build();
    ContextualizedTable table = TestTables.single(
        TestTables.column("hpo", Context.HPO_LABEL_OR_ID), " Seizure ", 42L);

    strategy.transform(table, new Diagnostics());

    assertEquals("Seizure", table.getValue(0, "hpo"));
    assertEquals(42L, table.getValue(1, "hpo"));
    assertEquals("P1", table.getValue(0, "patient_id"));

    StringCorrectionStrategy sexOnly = StringCorrectionStrategy.builder()
        .dataContext(Context.SUBJECT_SEX)
        .build();
    assertFalse(sexOnly.isApplicable(table));
  }

  @Test void testEmptyReplacementRejected() {
    assertThrows(ConfigurationException.class,
        () -> StringCorrectionStrategy.builder().replace("", "x"));
  }
}

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
import org.apache.calcite.adapter.phenotype.context.Context;
import org.apache.calcite.adapter.phenotype.context.SeriesContext;
import org.apache.calcite.adapter.phenotype.ontology.CachingBiDict;
import org.apache.calcite.adapter.phenotype.ontology.FakeOntologyProvider;
import org.apache.calcite.adapter.phenotype.ontology.OntologyRef;
import org.apache.calcite.adapter.phenotype.table.ContextualizedTable;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for MultiHpoColExpansionStrategy.
 */
@Tag("unit")
public class MultiHpoColExpansionStrategyTest {

  private static final String OBSERVED = MultiHpoColExpansionStrategy.OBSERVED;

  @Test void testExpandsIntoOneColumnPerTerm() throws Exception {
    CachingBiDict hpo = new CachingBiDict(OntologyRef.HP, new FakeOntologyProvider()
        .term("HP:0002027", "Abdominal pain"));
    ContextualizedTable table = TestTables.single(
        TestTables.column("hpo_terms", Context.MULTI_HPO_ID),
        "HP:0001250; Abdominal pain", "HP:0002027 (Abdominal pain)", null, "Headache");
    Diagnostics diagnostics = new Diagnostics();

    new MultiHpoColExpansionStrategy(hpo).transform(table, diagnostics);

    assertFalse(table.getData().hasColumn("hpo_terms"));
    assertEquals(Arrays.asList("patient_id", "HP:0001250", "HP:0002027"),
        table.getData().getColumnNames());
    assertEquals(OBSERVED, table.getValue(0, "HP:0001250"));
    assertEquals(OBSERVED, table.getValue(0, "HP:0002027"));
    assertNull(table.getValue(1, "HP:0001250"));
    assertEquals(OBSERVED, table.getValue(1, "HP:0002027"));
    assertNull(table.getValue(2, "HP:0002027"));

    List<SeriesContext> added = table.findSeriesContexts(
        sc -> sc.getHeaderContext().equals(Context.HPO_LABEL_OR_ID));
    assertEquals(1, added.size());
    assertEquals(Context.OBSERVATION_STATUS, added.get(0).getDataContext());

    assertEquals(1, diagnostics.size());
    Diagnostic diagnostic = diagnostics.getEntries().get(0);
    assertEquals(Diagnostic.Kind.ONTOLOGY_LOOKUP, diagnostic.getKind());
    assertEquals("Headache", diagnostic.getValue());
    assertEquals(3, diagnostic.getRow());
  }

  @Test void testWithoutBiDictLabelsAreReported() throws Exception {
    ContextualizedTable table = TestTables.single(
        TestTables.column("hpo_terms", Context.MULTI_HPO_ID), "hp:0001250, Seizure");
    Diagnostics diagnostics = new Diagnostics();

    new MultiHpoColExpansionStrategy().transform(table, diagnostics);

    assertEquals(OBSERVED, table.getValue(0, "HP:0001250"));
    assertEquals(1, diagnostics.size());
  }

  @Test void testIdentifiersFollowedByLabels() throws Exception {
    FakeOntologyProvider provider = new FakeOntologyProvider();
    ContextualizedTable table = TestTables.single(
        TestTables.column("HPO", Context.MULTI_HPO_ID),
        "HP:0001410",
        "HP:0012622 Chronic kidney disease\n    HP:0001410\tLeukoencephalopathy",
        "HP:0000212\tGingival overgrowth\n    HP:0011800 Hypoplasia of midface",
        null,
        "HP:0001410,HP:0012622");
    Diagnostics diagnostics = new Diagnostics();

    new MultiHpoColExpansionStrategy(new CachingBiDict(OntologyRef.HP, provider))
        .transform(table, diagnostics);

    assertEquals(
        Arrays.asList("patient_id", "HP:0001410", "HP:0012622", "HP:0000212", "HP:0011800"),
        table.getData().getColumnNames());
    assertEquals(OBSERVED, table.getValue(1, "HP:0001410"));
    assertEquals(OBSERVED, table.getValue(1, "HP:0012622"));
    assertEquals(OBSERVED, table.getValue(2, "HP:0011800"));
    assertNull(table.getValue(3, "HP:0001410"));
    assertEquals(OBSERVED, table.getValue(4, "HP:0012622"));
    assertTrue(diagnostics.isEmpty());
    assertEquals(0, provider.getCalls());
  }

  @Test void testNothingFoundDropsSourceColumn() throws Exception {
    ContextualizedTable table = TestTables.single(
        TestTables.column("hpo_terms", Context.MULTI_HPO_ID), " ; ", null);

    new MultiHpoColExpansionStrategy().transform(table, new Diagnostics());

    assertEquals(Arrays.asList("patient_id"), table.getData().getColumnNames());
  }
}

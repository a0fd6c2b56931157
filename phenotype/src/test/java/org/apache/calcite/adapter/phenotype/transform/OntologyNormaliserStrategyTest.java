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
import org.apache.calcite.adapter.phenotype.ontology.CachingBiDict;
import org.apache.calcite.adapter.phenotype.ontology.FakeOntologyProvider;
import org.apache.calcite.adapter.phenotype.ontology.OntologyRef;
import org.apache.calcite.adapter.phenotype.table.ContextualizedTable;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for OntologyNormaliserStrategy.
 */
@Tag("unit")
public class OntologyNormaliserStrategyTest {

  private FakeOntologyProvider provider;
  private CachingBiDict hpo;

  @BeforeEach
  void setUp() {
    provider = new FakeOntologyProvider()
        .term("HP:0001250", "Seizure", "Epileptic seizure")
        .term("HP:0002027", "Abdominal pain");
    hpo = new CachingBiDict(OntologyRef.HP, provider);
  }

  @Test void testLabelsBecomeIds() throws Exception {
    ContextualizedTable table = TestTables.single(
        TestTables.column("hpo", Context.HPO_LABEL_OR_ID),
        "Seizure", "epileptic seizure", "hp:0002027", null, "Seizure");
    Diagnostics diagnostics = new Diagnostics();

    new OntologyNormaliserStrategy(hpo, Context.HPO_LABEL_OR_ID).transform(table, diagnostics);

    assertEquals("HP:0001250", table.getValue(0, "hpo"));
    assertEquals("HP:0001250", table.getValue(1, "hpo"));
    assertEquals("HP:0002027", table.getValue(2, "hpo"));
    assertEquals("HP:0001250", table.getValue(4, "hpo"));
    assertEquals(0, provider.getIdCalls(), "well-formed ids are not looked up");
    assertEquals(1, provider.getLabelCalls());
    assertEquals(0, diagnostics.size());
  }

  @Test void testUnresolvedValuesAreKeptAndReported() throws Exception {
    ContextualizedTable table = TestTables.single(
        TestTables.column("hpo", Context.HPO_LABEL_OR_ID), "Headache", "HP:12", "Headache");
    Diagnostics diagnostics = new Diagnostics();

    new OntologyNormaliserStrategy(hpo, Context.HPO_LABEL_OR_ID).transform(table, diagnostics);

    assertEquals("Headache", table.getValue(0, "hpo"));
    assertEquals("HP:12", table.getValue(1, "hpo"));
    assertEquals(3, diagnostics.getEntries(Diagnostic.Kind.ONTOLOGY_LOOKUP).size());
    assertEquals(1, provider.getLabelCalls());
  }

  @Test void testProviderFailureIsReported() throws Exception {
    provider.failWith(new IOException("HTTP 500: boom"));
    ContextualizedTable table = TestTables.single(
        TestTables.column("hpo", Context.HPO_LABEL_OR_ID), "Seizure");
    Diagnostics diagnostics = new Diagnostics();

    new OntologyNormaliserStrategy(hpo, Context.HPO_LABEL_OR_ID).transform(table, diagnostics);

    assertEquals("Seizure", table.getValue(0, "hpo"));
    assertEquals(1, diagnostics.size());
  }

  @Test void testOnlyMatchingContext() throws Exception {
    ContextualizedTable table = TestTables.single(
        TestTables.column("disease", Context.DISEASE_LABEL_OR_ID), "Seizure");

    assertFalse(new OntologyNormaliserStrategy(hpo, Context.HPO_LABEL_OR_ID).isApplicable(table));
  }

  @Test void testRequiresDataContext() {
    assertThrows(IllegalArgumentException.class,
        () -> new OntologyNormaliserStrategy(hpo, Context.NONE));
  }
}

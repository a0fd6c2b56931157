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
package org.apache.calcite.adapter.phenotype.ontology;

import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.net.URISyntaxException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for ObographsOntologyProvider.
 */
@Tag("unit")
public class ObographsOntologyProviderTest {

  @TempDir
  File tempDir;

  public static File hpFile() throws URISyntaxException {
    return new File(ObographsOntologyProviderTest.class.getResource("/ontology/hp.json").toURI());
  }

  @Test void testLoadsCurrentTermsOnly() throws Exception {
    ObographsOntologyProvider provider = new ObographsOntologyProvider(OntologyRef.HP, hpFile());

    assertEquals(4, provider.getTermCount());
    assertNull(provider.findById("HP:0000005"));
    assertNull(provider.findById("MONDO:0009998"));
  }

  @Test void testFindByIdAndLabel() throws Exception {
    ObographsOntologyProvider provider = new ObographsOntologyProvider(OntologyRef.HP, hpFile());

    OntologyTerm seizure = provider.findById("HP:0001250");
    assertNotNull(seizure);
    assertEquals("Seizure", seizure.getLabel());
    assertTrue(seizure.getSynonyms().contains("Epileptic seizure"));

    assertEquals("HP:0001250", provider.findByLabel("  epileptic SEIZURE ").getId());
    assertEquals("HP:0002027", provider.findByLabel("Stomach ache").getId());
    assertNull(provider.findByLabel("Headache"));
  }

  @Test void testPrefixFilter() throws Exception {
    ObographsOntologyProvider provider =
        new ObographsOntologyProvider(OntologyRef.MONDO, hpFile());

    assertEquals(1, provider.getTermCount());
    assertEquals("Zollinger-Ellison syndrome", provider.findById("MONDO:0009998").getLabel());
  }

  @Test void testToCurie() {
    assertEquals("HP:0001250",
        ObographsOntologyProvider.toCurie("http://purl.obolibrary.org/obo/HP_0001250"));
    assertEquals("HP:0001250", ObographsOntologyProvider.toCurie("HP:0001250"));
    assertNull(ObographsOntologyProvider.toCurie("http://purl.obolibrary.org/obo/hp#has_onset"));
  }

  @Test void testToCurieRejectsNonTermIris() {
    assertNull(ObographsOntologyProvider.toCurie("http://purl.obolibrary.org/obo/hp#HP_0001250"));
    assertNull(ObographsOntologyProvider.toCurie("http://example.org/obo/1ABC_0001"));
    assertNull(ObographsOntologyProvider.toCurie("http://purl.obolibrary.org/obo/HP_"));
    assertNull(ObographsOntologyProvider.toCurie("http://purl.obolibrary.org/obo/hp.json"));
    assertEquals("MONDO:0009998",
        ObographsOntologyProvider.toCurie("http://purl.obolibrary.org/obo/MONDO_0009998"));
  }

  @Test void testMissingFile() {
    ObographsOntologyProvider provider =
        new ObographsOntologyProvider(OntologyRef.HP, new File(tempDir, "absent.json"));

    assertThrows(IOException.class, provider::preload);
  }

  @Test void testRejectsNonGraphDocument() throws Exception {
    ObjectMapper mapper = new ObjectMapper();

    assertThrows(IOException.class,
        () -> ObographsOntologyProvider.parse(mapper.readTree("{\"nodes\": []}"), "HP"));
  }

  @Test void testCachingBiDictOverFile() throws Exception {
    CachingBiDict dict = new CachingBiDict(OntologyRef.HP,
        new ObographsOntologyProvider(OntologyRef.HP, hpFile()));

    assertEquals("HP:0001250", dict.getId("Seizure"));
    assertEquals("Nausea and vomiting", dict.getLabel("HP:0002017"));
    assertThrows(TermNotFoundException.class, () -> dict.getLabel("HP:0000005"));
  }
}

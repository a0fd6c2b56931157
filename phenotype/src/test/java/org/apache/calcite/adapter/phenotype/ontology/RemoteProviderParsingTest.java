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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for the response parsing of BioPortalClient and HgncClient.
 */
@Tag("unit")
public class RemoteProviderParsingTest {

  private final ObjectMapper mapper = new ObjectMapper();

  @Test void testBioPortalClass() throws Exception {
    JsonNode node = mapper.readTree("{"
        + "\"@id\": \"http://purl.bioontology.org/ontology/OMIM/168600\","
        + "\"prefLabel\": \"PARKINSON DISEASE, LATE-ONSET\","
        + "\"synonym\": [\"PARKINSON DISEASE\", \"PD\"]}");

    OntologyTerm term = BioPortalClient.parseClass(node, "OMIM");

    assertEquals("OMIM:168600", term.getId());
    assertEquals("PARKINSON DISEASE, LATE-ONSET", term.getLabel());
    assertEquals(Arrays.asList("PARKINSON DISEASE", "PD"), term.getSynonyms());
  }

  @Test void testBioPortalSingleSynonymAndMissingLabel() throws Exception {
    OntologyTerm term = BioPortalClient.parseClass(mapper.readTree("{"
        + "\"@id\": \"http://purl.bioontology.org/ontology/OMIM/600000\","
        + "\"prefLabel\": \"EXAMPLE\", \"synonym\": \"EX\"}"), "OMIM");
    assertEquals(Arrays.asList("EX"), term.getSynonyms());

    assertNull(BioPortalClient.parseClass(mapper.readTree("{"
        + "\"@id\": \"http://purl.bioontology.org/ontology/OMIM/600000\"}"), "OMIM"));
  }

  @Test void testHgncResponse() throws Exception {
    JsonNode root = mapper.readTree("{\"response\": {\"numFound\": 1, \"docs\": [{"
        + "\"hgnc_id\": \"HGNC:1100\", \"symbol\": \"BRCA1\","
        + "\"alias_symbol\": [\"RNF53\"], \"prev_symbol\": [\"BRCC1\"]}]}}");

    OntologyTerm term = HgncClient.parseResponse(root);

    assertEquals("HGNC:1100", term.getId());
    assertEquals("BRCA1", term.getLabel());
    assertTrue(term.getSynonyms().contains("RNF53"));
    assertTrue(term.getSynonyms().contains("BRCC1"));
  }

  @Test void testHgncEmptyResponse() throws Exception {
    assertNull(HgncClient.parseResponse(
        mapper.readTree("{\"response\": {\"numFound\": 0, \"docs\": []}}")));
  }

  @Test void testRetryableStatus() {
    assertTrue(JsonHttpClient.isRetryable(new IOException("HTTP 429: slow down")));
    assertTrue(JsonHttpClient.isRetryable(new IOException("HTTP 503: unavailable")));
    assertFalse(JsonHttpClient.isRetryable(new IOException("HTTP 401: unauthorized")));
    assertFalse(JsonHttpClient.isRetryable(new IOException("Connection reset")));
  }
}

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

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UnsupportedEncodingException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * {@link OntologyProvider} backed by the BioPortal REST API, used for
 * ontologies such as OMIM that are not distributed as OBO Graphs files.
 *
 * <p>Identifier lookups fetch the class resource; label lookups use the
 * exact-match search endpoint. Requests authenticate with
 * {@code Authorization: apikey token=<key>}.
 *
 * <h3>Endpoints</h3>
 * <pre>{@code
 * GET {base}/ontologies/OMIM/classes/http%3A%2F%2Fpurl.bioontology.org%2Fontology%2FOMIM%2F{id}
 * GET {base}/search?q={label}&ontologies=OMIM&require_exact_match=true
 * }</pre>
 */
public class BioPortalClient implements OntologyProvider {

  private static final Logger LOGGER = LoggerFactory.getLogger(BioPortalClient.class);

  public static final String DEFAULT_BASE_URL = "https://data.bioontology.org";
  private static final String IRI_BASE = "http://purl.bioontology.org/ontology/";

  private final OntologyRef ref;
  private final String apiKey;
  private final String baseUrl;
  private final JsonHttpClient http;

  public BioPortalClient(OntologyRef ref, String apiKey) {
    this(ref, apiKey, DEFAULT_BASE_URL);
  }

  public BioPortalClient(OntologyRef ref, String apiKey, String baseUrl) {
    if (apiKey == null || apiKey.isEmpty()) {
      throw new IllegalArgumentException("BioPortal API key is required for " + ref);
    }
    this.ref = ref;
    this.apiKey = apiKey;
    this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    this.http = new JsonHttpClient(2, 1000);
  }

  @Override public @Nullable OntologyTerm findById(String id) throws IOException {
    String local = id.substring(id.indexOf(':') + 1);
    String acronym = ref.getPrefix();
    String url = baseUrl + "/ontologies/" + acronym + "/classes/"
        + encode(IRI_BASE + acronym + "/" + local);
    JsonNode node = http.get(url, authHeaders());
    return node == null ? null : parseClass(node, ref.getPrefix());
  }

  @Override public @Nullable OntologyTerm findByLabel(String labelOrSynonym) throws IOException {
    String url = baseUrl + "/search?q=" + encode(labelOrSynonym)
        + "&ontologies=" + ref.getPrefix() + "&require_exact_match=true";
    JsonNode node = http.get(url, authHeaders());
    if (node == null) {
      return null;
    }
    JsonNode collection = node.path("collection");
    if (!collection.isArray() || collection.size() == 0) {
      LOGGER.debug("BioPortal search for '{}' in {} returned no match", labelOrSynonym, ref);
      return null;
    }
    return parseClass(collection.get(0), ref.getPrefix());
  }

  @Override public String getName() {
    return "BioPortal(" + ref.getPrefix() + ")";
  }

  private Map<String, String> authHeaders() {
    return Collections.singletonMap("Authorization", "apikey token=" + apiKey);
  }

  /**
   * Converts a BioPortal class resource to a term; null when it lacks an
   * {@code @id} or {@code prefLabel}.
   */
  static @Nullable OntologyTerm parseClass(JsonNode node, String prefix) {
    String iri = node.path("@id").asText(null);
    String label = node.path("prefLabel").asText(null);
    if (iri == null || label == null) {
      return null;
    }
    String local = iri.substring(iri.lastIndexOf('/') + 1);
    List<String> synonyms = new ArrayList<String>();
    JsonNode synonymNode = node.path("synonym");
    if (synonymNode.isArray()) {
      for (JsonNode synonym : synonymNode) {
        synonyms.add(synonym.asText());
      }
    } else if (synonymNode.isTextual()) {
      synonyms.add(synonymNode.asText());
    }
    return new OntologyTerm(prefix + ":" + local, label, synonyms);
  }

  private static String encode(String value) {
    try {
      return URLEncoder.encode(value, StandardCharsets.UTF_8.name());
    } catch (UnsupportedEncodingException e) {
      throw new IllegalStateException("UTF-8 not supported", e);
    }
  }
}

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

import java.io.IOException;
import java.io.UnsupportedEncodingException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * {@link OntologyProvider} for HGNC gene symbols, backed by the
 * genenames.org REST service.
 *
 * <p>The approved symbol is the label; alias and previous symbols are
 * synonyms. A label lookup tries the approved symbol first and then the
 * alias symbols.
 */
public class HgncClient implements OntologyProvider {

  public static final String DEFAULT_BASE_URL = "https://rest.genenames.org";

  private final String baseUrl;
  private final JsonHttpClient http;

  public HgncClient() {
    this(DEFAULT_BASE_URL);
  }

  public HgncClient(String baseUrl) {
    this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    this.http = new JsonHttpClient(2, 1000);
  }

  @Override public @Nullable OntologyTerm findById(String id) throws IOException {
    return fetch("hgnc_id", id);
  }

  @Override public @Nullable OntologyTerm findByLabel(String labelOrSynonym) throws IOException {
    OntologyTerm term = fetch("symbol", labelOrSynonym.trim());
    if (term == null) {
      term = fetch("alias_symbol", labelOrSynonym.trim());
    }
    return term;
  }

  @Override public String getName() {
    return "HGNC";
  }

  private @Nullable OntologyTerm fetch(String field, String value) throws IOException {
    JsonNode node = http.get(baseUrl + "/fetch/" + field + "/" + encode(value),
        Collections.<String, String>emptyMap());
    return node == null ? null : parseResponse(node);
  }

  /**
   * Reads the first document of a fetch response; null when there is none.
   */
  static @Nullable OntologyTerm parseResponse(JsonNode root) {
    JsonNode docs = root.path("response").path("docs");
    if (!docs.isArray() || docs.size() == 0) {
      return null;
    }
    JsonNode doc = docs.get(0);
    String id = doc.path("hgnc_id").asText(null);
    String symbol = doc.path("symbol").asText(null);
    if (id == null || symbol == null) {
      return null;
    }
    List<String> synonyms = new ArrayList<String>();
    addAll(synonyms, doc.path("alias_symbol"));
    addAll(synonyms, doc.path("prev_symbol"));
    return new OntologyTerm(id, symbol, synonyms);
  }

  private static void addAll(List<String> target, JsonNode array) {
    if (array.isArray()) {
      for (JsonNode item : array) {
        target.add(item.asText());
      }
    }
  }

  private static String encode(String value) {
    try {
      return URLEncoder.encode(value, StandardCharsets.UTF_8.name()).replace("+", "%20");
    } catch (UnsupportedEncodingException e) {
      throw new IllegalStateException("UTF-8 not supported", e);
    }
  }
}

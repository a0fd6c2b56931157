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

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * {@link OntologyProvider} over an OBO Graphs JSON file such as
 * {@code hp.json} or {@code mondo.json}.
 *
 * <p>The file is parsed once, on first use. Only current terms are kept:
 * nodes of type {@code CLASS} whose identifier carries the ontology's prefix
 * and that are not marked deprecated. Node IRIs like
 * {@code http://purl.obolibrary.org/obo/HP_0001250} become
 * {@code HP:0001250}.
 */
public class ObographsOntologyProvider implements OntologyProvider {

  private static final Logger LOGGER = LoggerFactory.getLogger(ObographsOntologyProvider.class);
  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final Pattern PREFIX = Pattern.compile("[A-Za-z][A-Za-z0-9]*");

  private final OntologyRef ref;
  private final File file;
  private volatile Index index;

  public ObographsOntologyProvider(OntologyRef ref, File file) {
    this.ref = ref;
    this.file = file;
  }

  @Override public @Nullable OntologyTerm findById(String id) throws IOException {
    return index().byId.get(id);
  }

  @Override public @Nullable OntologyTerm findByLabel(String labelOrSynonym) throws IOException {
    return index().byLabel.get(labelOrSynonym.trim().toLowerCase(Locale.ROOT));
  }

  @Override public void preload() throws IOException {
    index();
  }

  @Override public String getName() {
    return "OboGraphs(" + file.getName() + ")";
  }

  /**
   * Returns the number of current terms, loading the file if needed.
   */
  public int getTermCount() throws IOException {
    return index().byId.size();
  }

  private Index index() throws IOException {
    Index current = index;
    if (current == null) {
      synchronized (this) {
        current = index;
        if (current == null) {
          current = load();
          index = current;
        }
      }
    }
    return current;
  }

  private Index load() throws IOException {
    long start = System.currentTimeMillis();
    if (!file.isFile()) {
      throw new IOException("Ontology file not found: " + file.getAbsolutePath());
    }
    Index loaded;
    try (InputStream in = Files.newInputStream(file.toPath())) {
      loaded = parse(MAPPER.readTree(in), ref.getPrefix());
    }
    LOGGER.info("Loaded {} current {} terms from {} in {}ms", loaded.byId.size(),
        ref.getPrefix(), file.getName(), System.currentTimeMillis() - start);
    return loaded;
  }

  static Index parse(JsonNode root, String prefix) throws IOException {
    JsonNode graphs = root.path("graphs");
    if (!graphs.isArray()) {
      throw new IOException("Not an OBO Graphs document: missing 'graphs' array");
    }
    Index index = new Index();
    for (JsonNode graph : graphs) {
      for (JsonNode node : graph.path("nodes")) {
        OntologyTerm term = toTerm(node, prefix);
        if (term != null) {
          index.add(term);
        }
      }
    }
    return index;
  }

  private static @Nullable OntologyTerm toTerm(JsonNode node, String prefix) {
    String type = node.path("type").asText("CLASS");
    String label = node.path("lbl").asText(null);
    String id = toCurie(node.path("id").asText(""));
    if (!"CLASS".equals(type) || label == null || id == null || !id.startsWith(prefix + ":")) {
      return null;
    }
    JsonNode meta = node.path("meta");
    if (meta.path("deprecated").asBoolean(false)) {
      return null;
    }
    List<String> synonyms = new ArrayList<String>();
    for (JsonNode synonym : meta.path("synonyms")) {
      String value = synonym.path("val").asText(null);
      if (value != null) {
        synonyms.add(value);
      }
    }
    return new OntologyTerm(id, label, synonyms);
  }

  /**
   * Turns an OBO PURL or a CURIE into a CURIE. Fragment IRIs such as
   * {@code hp#has_onset} name properties, not terms, and give null.
   */
  static @Nullable String toCurie(String iri) {
    String local = iri.substring(iri.lastIndexOf('/') + 1);
    if (local.indexOf('#') >= 0) {
      return null;
    }
    int separator = local.indexOf(':');
    if (separator < 0) {
      separator = local.indexOf('_');
    }
    if (separator <= 0 || separator == local.length() - 1) {
      return null;
    }
    String prefix = local.substring(0, separator);
    if (!PREFIX.matcher(prefix).matches()) {
      return null;
    }
    return prefix + ":" + local.substring(separator + 1);
  }

  /**
   * In-memory lookup tables built from the file.
   */
  static final class Index {
    final Map<String, OntologyTerm> byId = new HashMap<String, OntologyTerm>();
    final Map<String, OntologyTerm> byLabel = new HashMap<String, OntologyTerm>();

    void add(OntologyTerm term) {
      byId.put(term.getId(), term);
      byLabel.put(term.getLabel().toLowerCase(Locale.ROOT), term);
      for (String synonym : term.getSynonyms()) {
        byLabel.putIfAbsent(synonym.toLowerCase(Locale.ROOT), term);
      }
    }
  }
}

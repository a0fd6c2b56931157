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
package org.apache.calcite.adapter.phenotype.config;

import org.apache.calcite.adapter.phenotype.ConfigurationException;
import org.apache.calcite.adapter.phenotype.ontology.CachingBiDict;
import org.apache.calcite.adapter.phenotype.ontology.OntologyRef;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Where ontologies come from and which ones to warm up before a run.
 *
 * <h3>YAML Configuration Example</h3>
 * <pre>{@code
 * ontologies:
 *   ontology_dir: ./ontologies
 *   files:
 *     mondo: ./mondo-2025-01-01.json
 *   prepopulate: [hp, "mondo:2025-01-01"]
 *   lookup_timeout_ms: 60000
 * }</pre>
 */
public final class OntologyConfig {

  private final String ontologyDir;
  private final Map<String, String> files;
  private final List<OntologyRef> prepopulate;
  private final String bioPortalBaseUrl;
  private final String hgncBaseUrl;
  private final long lookupTimeoutMs;

  private OntologyConfig(String ontologyDir, Map<String, String> files,
      List<OntologyRef> prepopulate, String bioPortalBaseUrl, String hgncBaseUrl,
      long lookupTimeoutMs) {
    this.ontologyDir = ontologyDir;
    this.files = Collections.unmodifiableMap(new LinkedHashMap<String, String>(files));
    this.prepopulate = Collections.unmodifiableList(new ArrayList<OntologyRef>(prepopulate));
    this.bioPortalBaseUrl = bioPortalBaseUrl;
    this.hgncBaseUrl = hgncBaseUrl;
    this.lookupTimeoutMs = lookupTimeoutMs;
  }

  public static OntologyConfig defaults() {
    return new OntologyConfig(null, Collections.<String, String>emptyMap(),
        Collections.<OntologyRef>emptyList(), null, null,
        CachingBiDict.DEFAULT_LOOKUP_TIMEOUT_MS);
  }

  public static OntologyConfig fromMap(Map<String, Object> map) {
    if (map == null) {
      return defaults();
    }
    Map<String, String> files = new LinkedHashMap<String, String>();
    Object filesObj = map.get("files");
    if (filesObj instanceof Map) {
      for (Map.Entry<?, ?> entry : ((Map<?, ?>) filesObj).entrySet()) {
        files.put(String.valueOf(entry.getKey()), String.valueOf(entry.getValue()));
      }
    } else if (filesObj != null) {
      throw new ConfigurationException("'files' must map ontology prefixes to paths");
    }
    List<OntologyRef> prepopulate = new ArrayList<OntologyRef>();
    Object refsObj = map.get("prepopulate");
    if (refsObj instanceof List) {
      for (Object ref : (List<?>) refsObj) {
        prepopulate.add(OntologyRef.parse(String.valueOf(ref)));
      }
    } else if (refsObj != null) {
      throw new ConfigurationException("'prepopulate' must be a list of ontology references");
    }
    long timeout = CachingBiDict.DEFAULT_LOOKUP_TIMEOUT_MS;
    Object timeoutObj = map.get("lookup_timeout_ms");
    if (timeoutObj instanceof Number) {
      timeout = ((Number) timeoutObj).longValue();
    } else if (timeoutObj != null) {
      try {
        timeout = Long.parseLong(String.valueOf(timeoutObj).trim());
      } catch (NumberFormatException e) {
        throw new ConfigurationException("'lookup_timeout_ms' must be a number: " + timeoutObj);
      }
    }
    if (timeout <= 0) {
      throw new ConfigurationException("'lookup_timeout_ms' must be positive: " + timeout);
    }
    return new OntologyConfig(string(map, "ontology_dir"), files, prepopulate,
        string(map, "bioportal_base_url"), string(map, "hgnc_base_url"), timeout);
  }

  private static String string(Map<String, Object> map, String key) {
    Object value = map.get(key);
    return value == null ? null : String.valueOf(value);
  }

  public String getOntologyDir() {
    return ontologyDir;
  }

  public Map<String, String> getFiles() {
    return files;
  }

  public List<OntologyRef> getPrepopulate() {
    return prepopulate;
  }

  public String getBioPortalBaseUrl() {
    return bioPortalBaseUrl;
  }

  public String getHgncBaseUrl() {
    return hgncBaseUrl;
  }

  public long getLookupTimeoutMs() {
    return lookupTimeoutMs;
  }

  @Override public String toString() {
    return "OntologyConfig{ontologyDir='" + ontologyDir + "', files=" + files
        + ", prepopulate=" + prepopulate + "}";
  }
}

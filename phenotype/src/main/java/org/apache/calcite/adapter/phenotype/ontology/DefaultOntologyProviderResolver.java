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

import org.apache.calcite.adapter.phenotype.ConfigurationException;

import java.io.File;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Resolves providers from local ontology files and web services.
 *
 * <p>Resolution order for a reference:
 * <ol>
 *   <li>an explicitly registered provider</li>
 *   <li>{@code HGNC} - {@link HgncClient}</li>
 *   <li>an explicitly configured OBO Graphs file for the prefix</li>
 *   <li>{@code <ontology_dir>/<prefix>.json}, or
 *       {@code <prefix>-<version>.json} for a pinned version</li>
 *   <li>{@link BioPortalClient} when a BioPortal API key is configured</li>
 * </ol>
 */
public class DefaultOntologyProviderResolver implements OntologyProviderResolver {

  private final File ontologyDir;
  private final Map<String, File> files;
  private final Map<String, OntologyProvider> providers;
  private final String bioPortalApiKey;
  private final String bioPortalBaseUrl;
  private final String hgncBaseUrl;

  private DefaultOntologyProviderResolver(Builder builder) {
    this.ontologyDir = builder.ontologyDir;
    this.files = new HashMap<String, File>(builder.files);
    this.providers = new HashMap<String, OntologyProvider>(builder.providers);
    this.bioPortalApiKey = builder.bioPortalApiKey;
    this.bioPortalBaseUrl = builder.bioPortalBaseUrl;
    this.hgncBaseUrl = builder.hgncBaseUrl;
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override public OntologyProvider resolve(OntologyRef ref) {
    OntologyProvider registered = providers.get(ref.getPrefix());
    if (registered != null) {
      return registered;
    }
    if ("HGNC".equals(ref.getPrefix())) {
      return new HgncClient(hgncBaseUrl);
    }
    File file = files.get(ref.getPrefix());
    if (file == null && ontologyDir != null) {
      String base = ref.getPrefix().toLowerCase(Locale.ROOT);
      File candidate = new File(ontologyDir,
          ref.isLatest() ? base + ".json" : base + "-" + ref.getVersion() + ".json");
      if (candidate.isFile()) {
        file = candidate;
      }
    }
    if (file != null) {
      return new ObographsOntologyProvider(ref, file);
    }
    if (bioPortalApiKey != null && !bioPortalApiKey.isEmpty()) {
      return new BioPortalClient(ref, bioPortalApiKey, bioPortalBaseUrl);
    }
    throw new ConfigurationException("No ontology provider configured for " + ref
        + "; add an ontology file or a BioPortal API key");
  }

  /**
   * Builder for {@link DefaultOntologyProviderResolver}.
   */
  public static class Builder {
    private File ontologyDir;
    private final Map<String, File> files = new HashMap<String, File>();
    private final Map<String, OntologyProvider> providers = new HashMap<String, OntologyProvider>();
    private String bioPortalApiKey;
    private String bioPortalBaseUrl = BioPortalClient.DEFAULT_BASE_URL;
    private String hgncBaseUrl = HgncClient.DEFAULT_BASE_URL;

    public Builder ontologyDir(File ontologyDir) {
      this.ontologyDir = ontologyDir;
      return this;
    }

    public Builder file(String prefix, File file) {
      this.files.put(OntologyRef.of(prefix).getPrefix(), file);
      return this;
    }

    public Builder provider(String prefix, OntologyProvider provider) {
      this.providers.put(OntologyRef.of(prefix).getPrefix(), provider);
      return this;
    }

    public Builder bioPortalApiKey(String bioPortalApiKey) {
      this.bioPortalApiKey = bioPortalApiKey;
      return this;
    }

    public Builder bioPortalBaseUrl(String bioPortalBaseUrl) {
      this.bioPortalBaseUrl = bioPortalBaseUrl;
      return this;
    }

    public Builder hgncBaseUrl(String hgncBaseUrl) {
      this.hgncBaseUrl = hgncBaseUrl;
      return this;
    }

    public DefaultOntologyProviderResolver build() {
      if (ontologyDir != null && !ontologyDir.isDirectory()) {
        throw new ConfigurationException("Ontology directory does not exist: " + ontologyDir);
      }
      return new DefaultOntologyProviderResolver(this);
    }
  }
}

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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Collection;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Shared owner of the {@link BiDict}s of a run, keyed by {@link OntologyRef}.
 *
 * <p>The first request for a reference builds a {@link CachingBiDict} over
 * the provider chosen by the {@link OntologyProviderResolver}; later requests,
 * from any strategy or thread, get the same instance and therefore share its
 * cache. The factory is passed explicitly to whoever needs it. A caller that
 * keeps the factory across runs keeps the cached lookups too.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * CachedOntologyFactory factory = new CachedOntologyFactory(resolver);
 * BiDict hpo = factory.getBiDict(OntologyRef.HP);
 * String id = hpo.getId("Seizure");   // HP:0001250
 * }</pre>
 */
public class CachedOntologyFactory {

  private static final Logger LOGGER = LoggerFactory.getLogger(CachedOntologyFactory.class);

  private final OntologyProviderResolver resolver;
  private final long lookupTimeoutMs;
  private final ConcurrentHashMap<OntologyRef, CachingBiDict> dicts =
      new ConcurrentHashMap<OntologyRef, CachingBiDict>();

  public CachedOntologyFactory(OntologyProviderResolver resolver) {
    this(resolver, CachingBiDict.DEFAULT_LOOKUP_TIMEOUT_MS);
  }

  public CachedOntologyFactory(OntologyProviderResolver resolver, long lookupTimeoutMs) {
    if (resolver == null) {
      throw new IllegalArgumentException("Ontology provider resolver is required");
    }
    this.resolver = resolver;
    this.lookupTimeoutMs = lookupTimeoutMs;
  }

  /**
   * Returns the shared BiDict of an ontology, building it on first use.
   */
  public BiDict getBiDict(OntologyRef ref) {
    return dicts.computeIfAbsent(ref, r -> {
      OntologyProvider provider = resolver.resolve(r);
      LOGGER.info("Created BiDict for {} backed by {}", r, provider.getName());
      return new CachingBiDict(r, provider, lookupTimeoutMs);
    });
  }

  /**
   * Builds the BiDicts of the given ontologies and lets their providers load
   * up front.
   *
   * @throws IOException if a provider cannot load its data
   */
  public void prepopulate(Collection<OntologyRef> refs) throws IOException {
    for (OntologyRef ref : refs) {
      getBiDict(ref);
      dicts.get(ref).getProvider().preload();
    }
  }

  /**
   * Returns whether a BiDict has been built for the reference.
   */
  public boolean contains(OntologyRef ref) {
    return dicts.containsKey(ref);
  }

  public int size() {
    return dicts.size();
  }

  @Override public String toString() {
    return "CachedOntologyFactory{ontologies=" + dicts.keySet() + "}";
  }
}

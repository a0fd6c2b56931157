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

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link BiDict} that memoizes provider answers with single-flight
 * deduplication.
 *
 * <p>Each key maps to a {@link CompletableFuture}. The first caller for an
 * uncached key installs an incomplete future with
 * {@link ConcurrentHashMap#putIfAbsent} and performs the provider call;
 * concurrent callers for the same key find that future and wait on it, so the
 * provider is invoked once. Already-cached keys are read without locking.
 *
 * <p>A resolved term is indexed under its identifier, its label and every
 * synonym, so {@code getId(getLabel(id))} is answered from the cache. Failed
 * and not-found lookups are removed from the map and do not affect other
 * keys. Waiting for an in-flight lookup is bounded by the lookup timeout.
 *
 * <p>There is no eviction: entries live as long as the instance.
 */
public class CachingBiDict implements BiDict {

  private static final Logger LOGGER = LoggerFactory.getLogger(CachingBiDict.class);

  /** Default bound on waiting for another thread's lookup, in milliseconds. */
  public static final long DEFAULT_LOOKUP_TIMEOUT_MS = 120000;

  private final OntologyRef ontologyRef;
  private final OntologyProvider provider;
  private final long lookupTimeoutMs;
  private final ConcurrentHashMap<String, CompletableFuture<OntologyTerm>> byId =
      new ConcurrentHashMap<String, CompletableFuture<OntologyTerm>>();
  private final ConcurrentHashMap<String, CompletableFuture<OntologyTerm>> byLabel =
      new ConcurrentHashMap<String, CompletableFuture<OntologyTerm>>();
  private final AtomicLong providerCalls = new AtomicLong();

  public CachingBiDict(OntologyRef ontologyRef, OntologyProvider provider) {
    this(ontologyRef, provider, DEFAULT_LOOKUP_TIMEOUT_MS);
  }

  public CachingBiDict(OntologyRef ontologyRef, OntologyProvider provider, long lookupTimeoutMs) {
    if (ontologyRef == null) {
      throw new IllegalArgumentException("Ontology reference is required");
    }
    if (provider == null) {
      throw new IllegalArgumentException("Ontology provider is required");
    }
    if (lookupTimeoutMs <= 0) {
      throw new IllegalArgumentException("Lookup timeout must be positive");
    }
    this.ontologyRef = ontologyRef;
    this.provider = provider;
    this.lookupTimeoutMs = lookupTimeoutMs;
  }

  /**
   * Loads one term from the provider.
   */
  private interface TermLoader {
    @Nullable OntologyTerm load() throws IOException;
  }

  @Override public OntologyRef getOntologyRef() {
    return ontologyRef;
  }

  @Override public boolean isId(String value) {
    return value != null && IdGrammar.looksLikeId(ontologyRef, value);
  }

  @Override public String getLabel(String id) throws OntologyLookupException {
    String canonical = requireValidId(id);
    return lookup(byId, canonical, () -> provider.findById(canonical)).getLabel();
  }

  @Override public String getId(String labelOrSynonym) throws OntologyLookupException {
    if (labelOrSynonym == null || labelOrSynonym.trim().isEmpty()) {
      throw new TermNotFoundException(ontologyRef, String.valueOf(labelOrSynonym));
    }
    if (isId(labelOrSynonym)) {
      String canonical = requireValidId(labelOrSynonym);
      return lookup(byId, canonical, () -> provider.findById(canonical)).getId();
    }
    String label = labelOrSynonym.trim();
    return lookup(byLabel, labelKey(label), () -> provider.findByLabel(label)).getId();
  }

  @Override public String get(String idOrLabel) throws OntologyLookupException {
    if (idOrLabel != null && isId(idOrLabel)) {
      return getLabel(idOrLabel);
    }
    return getId(idOrLabel);
  }

  OntologyProvider getProvider() {
    return provider;
  }

  /**
   * Returns how many times the provider has been called.
   */
  public long getProviderCalls() {
    return providerCalls.get();
  }

  /**
   * Returns the number of resolved identifiers held in the cache.
   */
  public int size() {
    int resolved = 0;
    for (CompletableFuture<OntologyTerm> future : byId.values()) {
      if (future.isDone() && !future.isCompletedExceptionally()) {
        resolved++;
      }
    }
    return resolved;
  }

  private String requireValidId(String id) throws InvalidIdException {
    String canonical = id == null ? null : IdGrammar.canonicalize(ontologyRef, id);
    if (canonical == null) {
      throw new InvalidIdException(ontologyRef, String.valueOf(id));
    }
    return canonical;
  }

  private OntologyTerm lookup(ConcurrentHashMap<String, CompletableFuture<OntologyTerm>> index,
      String key, TermLoader loader) throws OntologyLookupException {
    CompletableFuture<OntologyTerm> future = index.get(key);
    if (future == null) {
      CompletableFuture<OntologyTerm> created = new CompletableFuture<OntologyTerm>();
      future = index.putIfAbsent(key, created);
      if (future == null) {
        future = created;
        load(index, key, created, loader);
      } else {
        LOGGER.debug("Joining in-flight {} lookup of '{}'", ontologyRef, key);
      }
    }
    return await(future, key);
  }

  private void load(ConcurrentHashMap<String, CompletableFuture<OntologyTerm>> index,
      String key, CompletableFuture<OntologyTerm> pending, TermLoader loader) {
    providerCalls.incrementAndGet();
    try {
      OntologyTerm term = loader.load();
      if (term == null) {
        index.remove(key, pending);
        pending.completeExceptionally(new TermNotFoundException(ontologyRef, key));
        return;
      }
      LOGGER.debug("{} resolved '{}' to {} via {}", ontologyRef, key, term, provider.getName());
      pending.complete(term);
      remember(term, pending);
    } catch (IOException | RuntimeException e) {
      LOGGER.warn("{} provider {} failed for '{}': {}", ontologyRef, provider.getName(), key,
          e.getMessage());
      index.remove(key, pending);
      pending.completeExceptionally(e);
    }
  }

  private void remember(OntologyTerm term, CompletableFuture<OntologyTerm> resolved) {
    String canonical = IdGrammar.canonicalize(ontologyRef, term.getId());
    byId.putIfAbsent(canonical != null ? canonical : term.getId(), resolved);
    byLabel.putIfAbsent(labelKey(term.getLabel()), resolved);
    for (String synonym : term.getSynonyms()) {
      byLabel.putIfAbsent(labelKey(synonym), resolved);
    }
  }

  private OntologyTerm await(CompletableFuture<OntologyTerm> future, String key)
      throws OntologyLookupException {
    try {
      return future.get(lookupTimeoutMs, TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new CacheException(ontologyRef, key, "interrupted while waiting for lookup", e);
    } catch (TimeoutException e) {
      throw new CacheException(ontologyRef, key,
          "timed out after " + lookupTimeoutMs + "ms waiting for lookup", e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof TermNotFoundException) {
        throw new TermNotFoundException(ontologyRef, key);
      }
      throw new OntologyLookupException(ontologyRef, key,
          "provider error: " + (cause != null ? cause.getMessage() : e.getMessage()),
          cause != null ? cause : e);
    }
  }

  private static String labelKey(String label) {
    return label.trim().toLowerCase(Locale.ROOT);
  }

  @Override public String toString() {
    return "CachingBiDict{ontology=" + ontologyRef + ", provider=" + provider.getName()
        + ", cached=" + size() + "}";
  }
}

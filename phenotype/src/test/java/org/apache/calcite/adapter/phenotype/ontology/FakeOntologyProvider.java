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

import java.io.IOException;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory {@link OntologyProvider} for tests. Counts calls and can hold
 * every lookup on a latch or fail it.
 */
public class FakeOntologyProvider implements OntologyProvider {

  private final Map<String, OntologyTerm> byId = new LinkedHashMap<String, OntologyTerm>();
  private final Map<String, OntologyTerm> byLabel = new LinkedHashMap<String, OntologyTerm>();
  private final AtomicInteger idCalls = new AtomicInteger();
  private final AtomicInteger labelCalls = new AtomicInteger();
  private volatile @Nullable CountDownLatch gate;
  private volatile @Nullable IOException failure;

  public FakeOntologyProvider term(String id, String label, String... synonyms) {
    OntologyTerm term = new OntologyTerm(id, label, Arrays.asList(synonyms));
    byId.put(id, term);
    byLabel.put(label.toLowerCase(Locale.ROOT), term);
    for (String synonym : synonyms) {
      byLabel.put(synonym.toLowerCase(Locale.ROOT), term);
    }
    return this;
  }

  /** Blocks every lookup until the latch opens. */
  public FakeOntologyProvider gate(CountDownLatch gate) {
    this.gate = gate;
    return this;
  }

  /** Makes lookups fail with the given exception; null restores them. */
  public FakeOntologyProvider failWith(@Nullable IOException failure) {
    this.failure = failure;
    return this;
  }

  public int getIdCalls() {
    return idCalls.get();
  }

  public int getLabelCalls() {
    return labelCalls.get();
  }

  public int getCalls() {
    return idCalls.get() + labelCalls.get();
  }

  @Override public @Nullable OntologyTerm findById(String id) throws IOException {
    idCalls.incrementAndGet();
    await();
    return byId.get(id);
  }

  @Override public @Nullable OntologyTerm findByLabel(String labelOrSynonym) throws IOException {
    labelCalls.incrementAndGet();
    await();
    return byLabel.get(labelOrSynonym.trim().toLowerCase(Locale.ROOT));
  }

  @Override public String getName() {
    return "Fake";
  }

  private void await() throws IOException {
    CountDownLatch latch = gate;
    if (latch != null) {
      try {
        if (!latch.await(10, TimeUnit.SECONDS)) {
          throw new IOException("gate never opened");
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new IOException("interrupted", e);
      }
    }
    IOException error = failure;
    if (error != null) {
      throw error;
    }
  }
}

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

/**
 * Backing store of a {@link BiDict}: an ontology file, a web service or an
 * in-memory table.
 *
 * <p>Providers are called from several threads and must be thread-safe. They
 * are only ever called with identifiers that passed {@link IdGrammar}, and
 * {@link CachingBiDict} calls them at most once per successfully resolved
 * key. Implementations that block on the network must bound the wait.
 */
public interface OntologyProvider {

  /**
   * Fetches a term by canonical identifier.
   *
   * @param id Canonical identifier, for example {@code HP:0001250}
   * @return The term, or null if the ontology has no such identifier
   * @throws IOException if the backing store fails or times out
   */
  @Nullable OntologyTerm findById(String id) throws IOException;

  /**
   * Fetches a term by label or synonym, compared case-insensitively.
   *
   * @return The term, or null if no term carries the label
   * @throws IOException if the backing store fails or times out
   */
  @Nullable OntologyTerm findByLabel(String labelOrSynonym) throws IOException;

  /**
   * Loads whatever the provider needs up front, such as an ontology file.
   * Called when a cache is pre-populated; lookups load lazily otherwise.
   */
  default void preload() throws IOException {
  }

  /**
   * Returns a short name for log messages.
   */
  default String getName() {
    return getClass().getSimpleName();
  }
}

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

/**
 * Bidirectional resolver between the canonical identifiers of one ontology
 * version and their labels and synonyms.
 *
 * <p>Every method validates identifier arguments against {@link IdGrammar}
 * first and throws {@link InvalidIdException} without side effects when they
 * are malformed. Label and synonym arguments are compared case-insensitively
 * after trimming.
 *
 * @see CachingBiDict
 * @see CachedOntologyFactory
 */
public interface BiDict {

  OntologyRef getOntologyRef();

  /**
   * Returns the primary label of an identifier.
   *
   * @throws InvalidIdException if the identifier is malformed
   * @throws TermNotFoundException if the ontology has no such identifier
   * @throws OntologyLookupException if the backing provider fails
   */
  String getLabel(String id) throws OntologyLookupException;

  /**
   * Returns the canonical identifier of a label or synonym. An identifier
   * argument is validated and returned in canonical form.
   *
   * @throws TermNotFoundException if no term carries the label
   * @throws OntologyLookupException if the backing provider fails
   */
  String getId(String labelOrSynonym) throws OntologyLookupException;

  /**
   * Resolves in either direction: an identifier yields its label, a label or
   * synonym yields its identifier.
   */
  String get(String idOrLabel) throws OntologyLookupException;

  /**
   * Returns whether the value claims to be an identifier of this ontology.
   * Pure string check; the claim may still be lexically invalid.
   */
  boolean isId(String value);
}

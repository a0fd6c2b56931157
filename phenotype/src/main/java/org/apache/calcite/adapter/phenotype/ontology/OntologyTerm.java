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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A term returned by an {@link OntologyProvider}: canonical id, primary label
 * and synonyms.
 */
public final class OntologyTerm {

  private final String id;
  private final String label;
  private final List<String> synonyms;

  public OntologyTerm(String id, String label, List<String> synonyms) {
    this.id = Objects.requireNonNull(id, "id");
    this.label = Objects.requireNonNull(label, "label");
    this.synonyms = synonyms == null
        ? Collections.<String>emptyList()
        : Collections.unmodifiableList(new ArrayList<String>(synonyms));
  }

  public OntologyTerm(String id, String label) {
    this(id, label, null);
  }

  public String getId() {
    return id;
  }

  public String getLabel() {
    return label;
  }

  public List<String> getSynonyms() {
    return synonyms;
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof OntologyTerm)) {
      return false;
    }
    OntologyTerm that = (OntologyTerm) o;
    return id.equals(that.id) && label.equals(that.label) && synonyms.equals(that.synonyms);
  }

  @Override public int hashCode() {
    return Objects.hash(id, label, synonyms);
  }

  @Override public String toString() {
    return id + " (" + label + ")";
  }
}

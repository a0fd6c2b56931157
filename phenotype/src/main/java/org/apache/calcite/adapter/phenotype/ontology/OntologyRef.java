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

import java.util.Locale;
import java.util.Objects;

/**
 * Identifies an ontology or controlled vocabulary by prefix and version.
 *
 * <p>Prefixes are upper-cased so that {@code "hp"} and {@code "HP"} denote the
 * same ontology; {@code "HPO"} is accepted as an alias of {@code HP}. The
 * version defaults to {@value #LATEST}.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * OntologyRef hpo = OntologyRef.parse("hp");           // HP:latest
 * OntologyRef pinned = OntologyRef.parse("mondo:2024-06-04");
 * }</pre>
 */
public final class OntologyRef {

  public static final String LATEST = "latest";

  public static final OntologyRef HP = of("HP");
  public static final OntologyRef MONDO = of("MONDO");
  public static final OntologyRef HGNC = of("HGNC");
  public static final OntologyRef OMIM = of("OMIM");
  public static final OntologyRef UO = of("UO");
  public static final OntologyRef GENO = of("GENO");

  private final String prefix;
  private final String version;

  private OntologyRef(String prefix, String version) {
    this.prefix = prefix;
    this.version = version;
  }

  public static OntologyRef of(String prefix) {
    return of(prefix, LATEST);
  }

  /**
   * Creates a reference; a null or blank version means {@value #LATEST}.
   */
  public static OntologyRef of(String prefix, String version) {
    if (prefix == null || prefix.trim().isEmpty()) {
      throw new ConfigurationException("Ontology prefix is required");
    }
    String canonical = prefix.trim().toUpperCase(Locale.ROOT);
    if ("HPO".equals(canonical)) {
      canonical = "HP";
    }
    String v = version == null || version.trim().isEmpty() ? LATEST : version.trim();
    return new OntologyRef(canonical, v);
  }

  /**
   * Parses {@code prefix} or {@code prefix:version}, case-insensitively.
   */
  public static OntologyRef parse(String text) {
    if (text == null) {
      throw new ConfigurationException("Ontology reference is required");
    }
    int colon = text.indexOf(':');
    if (colon < 0) {
      return of(text);
    }
    return of(text.substring(0, colon), text.substring(colon + 1));
  }

  public String getPrefix() {
    return prefix;
  }

  public String getVersion() {
    return version;
  }

  public boolean isLatest() {
    return LATEST.equals(version);
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof OntologyRef)) {
      return false;
    }
    OntologyRef that = (OntologyRef) o;
    return prefix.equals(that.prefix) && version.equals(that.version);
  }

  @Override public int hashCode() {
    return Objects.hash(prefix, version);
  }

  @Override public String toString() {
    return prefix + ":" + version;
  }
}

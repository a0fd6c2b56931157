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

import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Lexical rules for the canonical identifiers of each ontology.
 *
 * <p>Checks are pure string operations; they never touch a provider.
 */
public final class IdGrammar {

  private static final Pattern GENERIC_LOCAL_ID = Pattern.compile("\\d+");

  private static final Map<String, Pattern> LOCAL_ID_PATTERNS =
      ImmutableMap.<String, Pattern>builder()
          .put("HP", Pattern.compile("\\d{7}"))
          .put("MONDO", Pattern.compile("\\d{7}"))
          .put("UO", Pattern.compile("\\d{7}"))
          .put("GENO", Pattern.compile("\\d{7}"))
          .put("OMIM", GENERIC_LOCAL_ID)
          .put("HGNC", GENERIC_LOCAL_ID)
          .build();

  private static final Pattern CURIE = Pattern.compile("[A-Za-z][A-Za-z0-9_.]*:[A-Za-z0-9_.\\-]+");

  private IdGrammar() {
    // Utility class
  }

  /**
   * Returns whether the value claims to be an identifier of the ontology:
   * it carries the ontology's prefix, or, for OMIM, is a bare number. The
   * claim may still be lexically invalid, for example {@code OMIM:ABC}.
   */
  public static boolean looksLikeId(OntologyRef ref, String value) {
    String trimmed = value.trim();
    int colon = trimmed.indexOf(':');
    if (colon > 0) {
      return trimmed.substring(0, colon).trim().equalsIgnoreCase(ref.getPrefix());
    }
    return "OMIM".equals(ref.getPrefix()) && !trimmed.isEmpty()
        && Character.isDigit(trimmed.charAt(0));
  }

  /**
   * Returns the canonical form of an identifier, {@code PREFIX:localId}, or
   * null when the value does not follow the ontology's grammar.
   */
  public static @Nullable String canonicalize(OntologyRef ref, String value) {
    String trimmed = value.trim();
    String local;
    int colon = trimmed.indexOf(':');
    if (colon > 0) {
      if (!trimmed.substring(0, colon).trim().equalsIgnoreCase(ref.getPrefix())) {
        return null;
      }
      local = trimmed.substring(colon + 1).trim();
    } else if ("OMIM".equals(ref.getPrefix())) {
      local = trimmed;
    } else {
      return null;
    }
    Pattern pattern = LOCAL_ID_PATTERNS.get(ref.getPrefix());
    if (pattern == null) {
      pattern = GENERIC_LOCAL_ID;
    }
    if (!pattern.matcher(local).matches()) {
      return null;
    }
    return ref.getPrefix() + ":" + local;
  }

  public static boolean isValidId(OntologyRef ref, String value) {
    return canonicalize(ref, value) != null;
  }

  /**
   * Returns whether the value is a compact URI such as {@code HP:0001250},
   * regardless of ontology.
   */
  public static boolean isCurie(String value) {
    return value != null && CURIE.matcher(value.trim()).matches();
  }

  /**
   * Returns the upper-cased prefix of a CURIE, or null.
   */
  public static @Nullable String prefixOf(String curie) {
    int colon = curie.indexOf(':');
    return colon > 0 ? curie.substring(0, colon).trim().toUpperCase(Locale.ROOT) : null;
  }
}

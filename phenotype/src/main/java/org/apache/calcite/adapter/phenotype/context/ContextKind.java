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
package org.apache.calcite.adapter.phenotype.context;

import org.apache.calcite.adapter.phenotype.ConfigurationException;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Locale;

/**
 * The closed set of semantic roles a column header or a cell value can carry.
 *
 * <p>A kind only names the role. The payload some roles need (a time element
 * type, an assay id, a range boundary) lives in {@link Context}. Code that
 * branches on a role switches over this enum and throws from the
 * {@code default} branch, so adding a kind breaks every consumer that has not
 * been taught about it.
 */
public enum ContextKind {
  SUBJECT_ID(PayloadType.NONE, null),
  SUBJECT_SEX(PayloadType.NONE, null),
  DATE_OF_BIRTH(PayloadType.NONE, null),
  VITAL_STATUS(PayloadType.NONE, null),
  LAST_ENCOUNTER(PayloadType.TIME_ELEMENT, null),
  TIME_OF_DEATH(PayloadType.TIME_ELEMENT, null),
  CAUSE_OF_DEATH(PayloadType.NONE, "MONDO"),
  SURVIVAL_TIME_DAYS(PayloadType.NONE, null),
  HPO_LABEL_OR_ID(PayloadType.NONE, "HP"),
  DISEASE_LABEL_OR_ID(PayloadType.NONE, "MONDO"),
  HGNC_SYMBOL_OR_ID(PayloadType.NONE, "HGNC"),
  HGVS(PayloadType.NONE, null),
  QUANTITATIVE_MEASUREMENT(PayloadType.QUANTITATIVE_ASSAY, null),
  QUALITATIVE_MEASUREMENT(PayloadType.QUALITATIVE_ASSAY, null),
  REFERENCE_RANGE(PayloadType.BOUNDARY, null),
  TREATMENT_TARGET(PayloadType.NONE, null),
  TREATMENT_INTENT(PayloadType.NONE, null),
  RESPONSE_TO_TREATMENT(PayloadType.NONE, null),
  TREATMENT_TERMINATION_REASON(PayloadType.NONE, null),
  PROCEDURE_LABEL_OR_ID(PayloadType.NONE, null),
  PROCEDURE_BODY_SITE(PayloadType.NONE, null),
  TIME_OF_PROCEDURE(PayloadType.TIME_ELEMENT, null),
  OBSERVATION_STATUS(PayloadType.NONE, null),
  MULTI_HPO_ID(PayloadType.NONE, "HP"),
  ONSET(PayloadType.TIME_ELEMENT, null),
  NONE(PayloadType.NONE, null);

  /**
   * Shape of the payload a kind carries.
   */
  public enum PayloadType {
    NONE,
    TIME_ELEMENT,
    QUANTITATIVE_ASSAY,
    QUALITATIVE_ASSAY,
    BOUNDARY
  }

  private final PayloadType payloadType;
  private final @Nullable String defaultOntologyPrefix;

  ContextKind(PayloadType payloadType, @Nullable String defaultOntologyPrefix) {
    this.payloadType = payloadType;
    this.defaultOntologyPrefix = defaultOntologyPrefix;
  }

  public PayloadType getPayloadType() {
    return payloadType;
  }

  /**
   * Returns the prefix of the ontology whose terms values of this kind
   * normally come from, or null when the kind is not ontology-backed.
   */
  public @Nullable String getDefaultOntologyPrefix() {
    return defaultOntologyPrefix;
  }

  public boolean isOntologyBacked() {
    return defaultOntologyPrefix != null;
  }

  /**
   * Returns whether a subject may hold several values of this kind.
   *
   * <p>Single-valued kinds describe the subject (sex, date of birth); a
   * second, different value for them is a conflict. Repeatable kinds describe
   * findings of which a subject can have any number.
   */
  public boolean isRepeatable() {
    switch (this) {
      case SUBJECT_ID:
      case SUBJECT_SEX:
      case DATE_OF_BIRTH:
      case VITAL_STATUS:
      case LAST_ENCOUNTER:
      case TIME_OF_DEATH:
      case CAUSE_OF_DEATH:
      case SURVIVAL_TIME_DAYS:
        return false;
      case HPO_LABEL_OR_ID:
      case DISEASE_LABEL_OR_ID:
      case HGNC_SYMBOL_OR_ID:
      case HGVS:
      case QUANTITATIVE_MEASUREMENT:
      case QUALITATIVE_MEASUREMENT:
      case REFERENCE_RANGE:
      case TREATMENT_TARGET:
      case TREATMENT_INTENT:
      case RESPONSE_TO_TREATMENT:
      case TREATMENT_TERMINATION_REASON:
      case PROCEDURE_LABEL_OR_ID:
      case PROCEDURE_BODY_SITE:
      case TIME_OF_PROCEDURE:
      case OBSERVATION_STATUS:
      case MULTI_HPO_ID:
      case ONSET:
      case NONE:
        return true;
      default:
        throw new IllegalStateException("Unhandled context kind: " + this);
    }
  }

  /**
   * Returns the lowercase name used in configuration files, for example
   * {@code hpo_label_or_id}.
   */
  public String configName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Resolves a configuration name. Both {@code hpo_label_or_id} and
   * {@code HpoLabelOrId} spellings are accepted.
   *
   * @throws ConfigurationException if the name matches no kind
   */
  public static ContextKind fromConfigName(String name) {
    String wanted = normalize(name);
    for (ContextKind kind : values()) {
      if (normalize(kind.name()).equals(wanted)) {
        return kind;
      }
    }
    throw new ConfigurationException("Unknown context: " + name);
  }

  private static String normalize(String name) {
    return name.trim().replace("_", "").replace("-", "").toLowerCase(Locale.ROOT);
  }
}

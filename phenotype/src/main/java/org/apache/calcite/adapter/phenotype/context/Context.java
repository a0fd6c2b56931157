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

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Semantic role of a column header or of a column's cell values.
 *
 * <p>A Context is a {@link ContextKind} plus the payload the kind requires.
 * Equality is structural: two contexts of the same kind with equal payload
 * are the same key, so a Context can index maps of collected values.
 *
 * <h3>Configuration Forms</h3>
 * <pre>{@code
 * data_context: subject_sex
 * data_context:
 *   onset: age
 * data_context:
 *   quantitative_measurement:
 *     assay_id: "LOINC:2345-7"
 *     unit_ontology_id: "UO:0000273"
 * data_context:
 *   reference_range: start
 * }</pre>
 *
 * @see ContextKind
 */
public final class Context {

  private static final Map<ContextKind, Context> SIMPLE =
      new EnumMap<ContextKind, Context>(ContextKind.class);

  static {
    for (ContextKind kind : ContextKind.values()) {
      if (kind.getPayloadType() == ContextKind.PayloadType.NONE) {
        SIMPLE.put(kind, new Context(kind, null, null, null, null));
      }
    }
  }

  public static final Context NONE = SIMPLE.get(ContextKind.NONE);
  public static final Context SUBJECT_ID = SIMPLE.get(ContextKind.SUBJECT_ID);
  public static final Context SUBJECT_SEX = SIMPLE.get(ContextKind.SUBJECT_SEX);
  public static final Context DATE_OF_BIRTH = SIMPLE.get(ContextKind.DATE_OF_BIRTH);
  public static final Context VITAL_STATUS = SIMPLE.get(ContextKind.VITAL_STATUS);
  public static final Context CAUSE_OF_DEATH = SIMPLE.get(ContextKind.CAUSE_OF_DEATH);
  public static final Context SURVIVAL_TIME_DAYS = SIMPLE.get(ContextKind.SURVIVAL_TIME_DAYS);
  public static final Context HPO_LABEL_OR_ID = SIMPLE.get(ContextKind.HPO_LABEL_OR_ID);
  public static final Context DISEASE_LABEL_OR_ID = SIMPLE.get(ContextKind.DISEASE_LABEL_OR_ID);
  public static final Context HGNC_SYMBOL_OR_ID = SIMPLE.get(ContextKind.HGNC_SYMBOL_OR_ID);
  public static final Context HGVS = SIMPLE.get(ContextKind.HGVS);
  public static final Context OBSERVATION_STATUS = SIMPLE.get(ContextKind.OBSERVATION_STATUS);
  public static final Context MULTI_HPO_ID = SIMPLE.get(ContextKind.MULTI_HPO_ID);

  private final ContextKind kind;
  private final @Nullable TimeElementType timeElementType;
  private final @Nullable Boundary boundary;
  private final @Nullable String assayId;
  private final @Nullable String unitOntologyId;

  private Context(ContextKind kind, @Nullable TimeElementType timeElementType,
      @Nullable Boundary boundary, @Nullable String assayId,
      @Nullable String unitOntologyId) {
    this.kind = kind;
    this.timeElementType = timeElementType;
    this.boundary = boundary;
    this.assayId = assayId;
    this.unitOntologyId = unitOntologyId;
  }

  /**
   * Returns the context of a kind that carries no payload.
   *
   * @throws IllegalArgumentException if the kind requires a payload
   */
  public static Context of(ContextKind kind) {
    Context context = SIMPLE.get(kind);
    if (context == null) {
      throw new IllegalArgumentException("Context " + kind.configName()
          + " requires a " + kind.getPayloadType().name().toLowerCase() + " payload");
    }
    return context;
  }

  /**
   * Returns a timed context such as onset or time of death.
   */
  public static Context timed(ContextKind kind, TimeElementType timeElementType) {
    if (kind.getPayloadType() != ContextKind.PayloadType.TIME_ELEMENT) {
      throw new IllegalArgumentException("Context " + kind.configName() + " is not time based");
    }
    return new Context(kind, Objects.requireNonNull(timeElementType, "timeElementType"),
        null, null, null);
  }

  public static Context onset(TimeElementType timeElementType) {
    return timed(ContextKind.ONSET, timeElementType);
  }

  public static Context lastEncounter(TimeElementType timeElementType) {
    return timed(ContextKind.LAST_ENCOUNTER, timeElementType);
  }

  public static Context timeOfDeath(TimeElementType timeElementType) {
    return timed(ContextKind.TIME_OF_DEATH, timeElementType);
  }

  public static Context timeOfProcedure(TimeElementType timeElementType) {
    return timed(ContextKind.TIME_OF_PROCEDURE, timeElementType);
  }

  public static Context quantitativeMeasurement(String assayId, String unitOntologyId) {
    return new Context(ContextKind.QUANTITATIVE_MEASUREMENT, null, null,
        Objects.requireNonNull(assayId, "assayId"),
        Objects.requireNonNull(unitOntologyId, "unitOntologyId"));
  }

  public static Context qualitativeMeasurement(String assayId) {
    return new Context(ContextKind.QUALITATIVE_MEASUREMENT, null, null,
        Objects.requireNonNull(assayId, "assayId"), null);
  }

  public static Context referenceRange(Boundary boundary) {
    return new Context(ContextKind.REFERENCE_RANGE, null,
        Objects.requireNonNull(boundary, "boundary"), null, null);
  }

  /**
   * Parses a context from its YAML/JSON form: a bare name for payload-free
   * kinds, or a single-entry map from the kind name to its payload.
   *
   * @param value String or Map read from configuration; null means
   *     {@link #NONE}
   * @throws ConfigurationException if the value is malformed
   */
  public static Context fromConfig(@Nullable Object value) {
    if (value == null) {
      return NONE;
    }
    if (value instanceof String) {
      ContextKind kind = ContextKind.fromConfigName((String) value);
      if (kind.getPayloadType() != ContextKind.PayloadType.NONE) {
        throw new ConfigurationException("Context '" + value + "' requires a payload");
      }
      return of(kind);
    }
    if (value instanceof Map) {
      Map<?, ?> map = (Map<?, ?>) value;
      if (map.size() != 1) {
        throw new ConfigurationException("Context map must have exactly one entry: " + map);
      }
      Map.Entry<?, ?> entry = map.entrySet().iterator().next();
      ContextKind kind = ContextKind.fromConfigName(String.valueOf(entry.getKey()));
      return withPayload(kind, entry.getValue());
    }
    throw new ConfigurationException("Cannot parse context from " + value);
  }

  private static Context withPayload(ContextKind kind, @Nullable Object payload) {
    switch (kind.getPayloadType()) {
      case NONE:
        return of(kind);
      case TIME_ELEMENT:
        return timed(kind, TimeElementType.fromConfig(payload));
      case BOUNDARY:
        return referenceRange(Boundary.fromConfig(payload));
      case QUANTITATIVE_ASSAY:
        return quantitativeMeasurement(requiredString(kind, payload, "assay_id"),
            requiredString(kind, payload, "unit_ontology_id"));
      case QUALITATIVE_ASSAY:
        if (payload instanceof String) {
          return qualitativeMeasurement((String) payload);
        }
        return qualitativeMeasurement(requiredString(kind, payload, "assay_id"));
      default:
        throw new IllegalStateException("Unhandled payload type: " + kind.getPayloadType());
    }
  }

  private static String requiredString(ContextKind kind, @Nullable Object payload, String key) {
    if (payload instanceof Map) {
      Object value = ((Map<?, ?>) payload).get(key);
      if (value != null) {
        return String.valueOf(value);
      }
    }
    throw new ConfigurationException("Context " + kind.configName() + " requires '" + key + "'");
  }

  public ContextKind getKind() {
    return kind;
  }

  public @Nullable TimeElementType getTimeElementType() {
    return timeElementType;
  }

  public @Nullable Boundary getBoundary() {
    return boundary;
  }

  public @Nullable String getAssayId() {
    return assayId;
  }

  public @Nullable String getUnitOntologyId() {
    return unitOntologyId;
  }

  public boolean isNone() {
    return kind == ContextKind.NONE;
  }

  public boolean isOntologyBacked() {
    return kind.isOntologyBacked();
  }

  /**
   * Returns whether this context holds an age, for example
   * {@code onset: age} or {@code time_of_death: age}.
   */
  public boolean isAge() {
    return timeElementType == TimeElementType.AGE;
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Context)) {
      return false;
    }
    Context that = (Context) o;
    return kind == that.kind
        && timeElementType == that.timeElementType
        && boundary == that.boundary
        && Objects.equals(assayId, that.assayId)
        && Objects.equals(unitOntologyId, that.unitOntologyId);
  }

  @Override public int hashCode() {
    return Objects.hash(kind, timeElementType, boundary, assayId, unitOntologyId);
  }

  @Override public String toString() {
    switch (kind.getPayloadType()) {
      case NONE:
        return kind.configName();
      case TIME_ELEMENT:
        return kind.configName() + "(" + timeElementType.configName() + ")";
      case BOUNDARY:
        return kind.configName() + "(" + boundary.configName() + ")";
      case QUANTITATIVE_ASSAY:
        return kind.configName() + "(" + assayId + ", " + unitOntologyId + ")";
      case QUALITATIVE_ASSAY:
        return kind.configName() + "(" + assayId + ")";
      default:
        throw new IllegalStateException("Unhandled payload type: " + kind.getPayloadType());
    }
  }
}

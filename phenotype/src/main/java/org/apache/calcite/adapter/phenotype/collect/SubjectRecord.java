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
package org.apache.calcite.adapter.phenotype.collect;

import org.apache.calcite.adapter.phenotype.context.Context;
import org.apache.calcite.adapter.phenotype.context.ContextKind;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Immutable per-subject output of a {@link Collector}.
 *
 * <p>A record holds:
 * <ul>
 *   <li>subject-level fields, keyed by data context; single-valued contexts
 *       have at most one value</li>
 *   <li>header observations, from columns whose header carries a context,
 *       such as an HPO term whose presence the cell records</li>
 *   <li>building block sub-records, by block id, in ingestion order</li>
 *   <li>the data sources that contributed</li>
 * </ul>
 */
public final class SubjectRecord {

  private static final Set<String> NEGATIVE_OBSERVATIONS = ImmutableSet.of(
      "excluded", "absent", "not observed", "no", "false", "0");

  private final String subjectId;
  private final Map<Context, List<Object>> fields;
  private final List<TaggedValue> headerValues;
  private final Map<String, List<BlockRecord>> blocks;
  private final Set<String> sources;

  SubjectRecord(String subjectId, Map<Context, List<Object>> fields,
      List<TaggedValue> headerValues, Map<String, List<BlockRecord>> blocks,
      Set<String> sources) {
    this.subjectId = subjectId;
    ImmutableMap.Builder<Context, List<Object>> fieldBuilder = ImmutableMap.builder();
    for (Map.Entry<Context, List<Object>> entry : fields.entrySet()) {
      fieldBuilder.put(entry.getKey(), ImmutableList.copyOf(entry.getValue()));
    }
    this.fields = fieldBuilder.build();
    this.headerValues = ImmutableList.copyOf(headerValues);
    ImmutableMap.Builder<String, List<BlockRecord>> blockBuilder = ImmutableMap.builder();
    for (Map.Entry<String, List<BlockRecord>> entry : blocks.entrySet()) {
      blockBuilder.put(entry.getKey(), ImmutableList.copyOf(entry.getValue()));
    }
    this.blocks = blockBuilder.build();
    this.sources = ImmutableSet.copyOf(sources);
  }

  public String getSubjectId() {
    return subjectId;
  }

  public Map<Context, List<Object>> getFields() {
    return fields;
  }

  /**
   * Returns the first subject-level value of a context, or null.
   */
  public @Nullable Object getValue(Context context) {
    List<Object> values = fields.get(context);
    return values == null || values.isEmpty() ? null : values.get(0);
  }

  /**
   * Returns all subject-level values of a context.
   */
  public List<Object> getValues(Context context) {
    List<Object> values = fields.get(context);
    return values == null ? ImmutableList.<Object>of() : values;
  }

  public List<TaggedValue> getHeaderValues() {
    return headerValues;
  }

  public Map<String, List<BlockRecord>> getBlocks() {
    return blocks;
  }

  public List<BlockRecord> getBlocks(String blockId) {
    List<BlockRecord> list = blocks.get(blockId);
    return list == null ? ImmutableList.<BlockRecord>of() : list;
  }

  public Set<String> getSources() {
    return sources;
  }

  /**
   * Returns every observed HPO term of the subject, in collection order:
   * subject-level values, then header columns whose cell records the term as
   * present, then building block values. Repeats are kept.
   */
  public List<String> getPhenotypeTerms() {
    List<String> terms = new ArrayList<String>();
    for (Object value : getValues(Context.HPO_LABEL_OR_ID)) {
      terms.add(String.valueOf(value));
    }
    for (TaggedValue value : headerValues) {
      if (value.getHeaderContext().getKind() == ContextKind.HPO_LABEL_OR_ID
          && !isNegative(value)) {
        terms.add(value.getColumn());
      }
    }
    for (List<BlockRecord> list : blocks.values()) {
      for (BlockRecord block : list) {
        for (TaggedValue value : block.getValues()) {
          if (value.getDataContext().getKind() == ContextKind.HPO_LABEL_OR_ID) {
            terms.add(String.valueOf(value.getValue()));
          } else if (value.getHeaderContext().getKind() == ContextKind.HPO_LABEL_OR_ID
              && !isNegative(value)) {
            terms.add(value.getColumn());
          }
        }
      }
    }
    return terms;
  }

  private static boolean isNegative(TaggedValue value) {
    return value.getDataContext().getKind() == ContextKind.OBSERVATION_STATUS
        && NEGATIVE_OBSERVATIONS.contains(
            String.valueOf(value.getValue()).trim().toLowerCase(Locale.ROOT));
  }

  /**
   * Returns a JSON-friendly view of the record.
   */
  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<String, Object>();
    map.put("subject_id", subjectId);
    Map<String, Object> fieldMap = new LinkedHashMap<String, Object>();
    for (Map.Entry<Context, List<Object>> entry : fields.entrySet()) {
      boolean repeatable = entry.getKey().getKind().isRepeatable();
      fieldMap.put(entry.getKey().toString(),
          repeatable ? entry.getValue() : entry.getValue().get(0));
    }
    map.put("fields", fieldMap);
    List<Map<String, Object>> observations = new ArrayList<Map<String, Object>>();
    for (TaggedValue value : headerValues) {
      observations.add(value.toMap());
    }
    map.put("observations", observations);
    Map<String, Object> blockMap = new LinkedHashMap<String, Object>();
    for (Map.Entry<String, List<BlockRecord>> entry : blocks.entrySet()) {
      List<Map<String, Object>> list = new ArrayList<Map<String, Object>>();
      for (BlockRecord block : entry.getValue()) {
        list.add(block.toMap());
      }
      blockMap.put(entry.getKey(), list);
    }
    map.put("building_blocks", blockMap);
    map.put("sources", new ArrayList<String>(sources));
    return map;
  }

  @Override public String toString() {
    return "SubjectRecord{subject='" + subjectId + "', fields=" + fields
        + ", observations=" + headerValues.size() + ", blocks=" + blocks.keySet()
        + ", sources=" + sources + "}";
  }
}

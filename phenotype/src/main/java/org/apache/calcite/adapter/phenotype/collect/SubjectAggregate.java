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

import org.apache.calcite.adapter.phenotype.Diagnostic;
import org.apache.calcite.adapter.phenotype.Diagnostics;
import org.apache.calcite.adapter.phenotype.context.Context;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * In-progress accumulator for one subject.
 *
 * <p>Created on the first row naming the subject and folded into by every
 * later row, from any table or source. Not thread-safe; the {@link Collector}
 * guarantees that one subject's aggregate is only touched by one thread at a
 * time.
 */
final class SubjectAggregate {

  private final String subjectId;
  private final Map<Context, List<Object>> fields = new LinkedHashMap<Context, List<Object>>();
  private final List<TaggedValue> headerValues = new ArrayList<TaggedValue>();
  private final Map<String, List<BlockRecord>> blocks =
      new LinkedHashMap<String, List<BlockRecord>>();
  private final Set<String> sources = new LinkedHashSet<String>();

  SubjectAggregate(String subjectId) {
    this.subjectId = subjectId;
  }

  String getSubjectId() {
    return subjectId;
  }

  void addSource(String sourceId) {
    sources.add(sourceId);
  }

  /**
   * Adds a subject-level value. A second, different value for a
   * single-valued context is reported and discarded; the first one wins.
   */
  void addField(Context context, Object value, String tableName, String column, int row,
      Diagnostics diagnostics) {
    List<Object> values = fields.get(context);
    if (values == null) {
      values = new ArrayList<Object>();
      fields.put(context, values);
    }
    if (context.getKind().isRepeatable() || values.isEmpty()) {
      values.add(value);
      return;
    }
    if (!values.get(0).equals(value)) {
      diagnostics.add(Diagnostic.builder(Diagnostic.Kind.CONFLICTING_VALUE)
          .table(tableName)
          .column(column)
          .row(row)
          .value(value)
          .message("Subject '" + subjectId + "' already has " + context + " = '"
              + values.get(0) + "'; ignoring '" + value + "'")
          .build());
    }
  }

  void addHeaderValue(TaggedValue value) {
    headerValues.add(value);
  }

  void addBlock(BlockRecord block) {
    List<BlockRecord> list = blocks.get(block.getBlockId());
    if (list == null) {
      list = new ArrayList<BlockRecord>();
      blocks.put(block.getBlockId(), list);
    }
    list.add(block);
  }

  SubjectRecord toRecord() {
    return new SubjectRecord(subjectId, fields, headerValues, blocks, sources);
  }
}

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
package org.apache.calcite.adapter.phenotype.validation;

import org.apache.calcite.adapter.phenotype.collect.BlockRecord;
import org.apache.calcite.adapter.phenotype.collect.SubjectRecord;
import org.apache.calcite.adapter.phenotype.collect.TaggedValue;
import org.apache.calcite.adapter.phenotype.context.Context;
import org.apache.calcite.adapter.phenotype.ontology.IdGrammar;

import java.util.List;
import java.util.Map;

/**
 * Ontology-backed values must be CURIEs. Values that an ontology normaliser
 * could not resolve keep their label and are caught here.
 */
public class CurieFormatRule implements LintRule {

  public static final String RULE_ID = "CURIE001";

  @Override public String getRuleId() {
    return RULE_ID;
  }

  @Override public void check(SubjectRecord record, LintReport report) {
    for (Map.Entry<Context, List<Object>> entry : record.getFields().entrySet()) {
      if (!entry.getKey().isOntologyBacked()) {
        continue;
      }
      for (Object value : entry.getValue()) {
        checkValue(record, entry.getKey(), value, report);
      }
    }
    for (List<BlockRecord> blocks : record.getBlocks().values()) {
      for (BlockRecord block : blocks) {
        for (TaggedValue value : block.getValues()) {
          if (value.getDataContext().isOntologyBacked()) {
            checkValue(record, value.getDataContext(), value.getValue(), report);
          }
        }
      }
    }
  }

  private void checkValue(SubjectRecord record, Context context, Object value,
      LintReport report) {
    String text = String.valueOf(value);
    if (!IdGrammar.isCurie(text)) {
      report.add(
          new LintViolation(RULE_ID, record.getSubjectId(), ViolationType.NOT_A_CURIE,
              "'" + text + "' of " + context + " is not a CURIE", null));
    }
  }
}

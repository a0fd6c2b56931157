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
import org.apache.calcite.adapter.phenotype.context.ContextKind;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A disease that is named in a building block together with a variant (an
 * HGVS expression or an HGNC gene) is an interpretation of that variant. The
 * same disease must also be recorded as a disease of the subject: either a
 * subject-level value or a block without a variant. Each missing disease is
 * reported once with {@link FixAction#DUPLICATE}.
 */
public class DiseaseConsistencyRule implements LintRule {

  public static final String RULE_ID = "INTER001";

  @Override public String getRuleId() {
    return RULE_ID;
  }

  @Override public void check(SubjectRecord record, LintReport report) {
    Set<String> diseases = new LinkedHashSet<String>();
    for (Object value : record.getValues(Context.DISEASE_LABEL_OR_ID)) {
      diseases.add(String.valueOf(value));
    }
    Set<String> interpreted = new LinkedHashSet<String>();
    for (List<BlockRecord> blocks : record.getBlocks().values()) {
      for (BlockRecord block : blocks) {
        Object disease = block.getValue(Context.DISEASE_LABEL_OR_ID);
        if (disease == null) {
          continue;
        }
        if (hasVariant(block)) {
          interpreted.add(String.valueOf(disease));
        } else {
          diseases.add(String.valueOf(disease));
        }
      }
    }
    for (String disease : interpreted) {
      if (!diseases.contains(disease)) {
        report.add(
            new LintViolation(RULE_ID, record.getSubjectId(),
                ViolationType.DISEASE_CONSISTENCY,
                "Disease " + disease + " of an interpretation is not recorded as a disease",
                FixAction.DUPLICATE));
      }
    }
  }

  private static boolean hasVariant(BlockRecord block) {
    for (TaggedValue value : block.getValues()) {
      ContextKind kind = value.getDataContext().getKind();
      if (kind == ContextKind.HGVS || kind == ContextKind.HGNC_SYMBOL_OR_ID) {
        return true;
      }
    }
    return false;
  }
}

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

import org.apache.calcite.adapter.phenotype.collect.SubjectRecord;

import java.util.HashSet;
import java.util.Set;

/**
 * The same phenotype term should be recorded once per subject. Every repeat
 * after the first is reported with {@link FixAction#REMOVE}.
 */
public class DuplicatePhenotypeRule implements LintRule {

  public static final String RULE_ID = "PF006";

  @Override public String getRuleId() {
    return RULE_ID;
  }

  @Override public void check(SubjectRecord record, LintReport report) {
    Set<String> seen = new HashSet<String>();
    for (String term : record.getPhenotypeTerms()) {
      if (!seen.add(term)) {
        report.add(
            new LintViolation(RULE_ID, record.getSubjectId(),
                ViolationType.DUPLICATE_PHENOTYPE,
                "Phenotype " + term + " is recorded more than once", FixAction.REMOVE));
      }
    }
  }
}

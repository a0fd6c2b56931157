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
import org.apache.calcite.adapter.phenotype.context.Context;

/**
 * Every subject should state a sex.
 */
public class MissingSubjectSexRule implements LintRule {

  public static final String RULE_ID = "IND001";

  @Override public String getRuleId() {
    return RULE_ID;
  }

  @Override public void check(SubjectRecord record, LintReport report) {
    if (record.getValue(Context.SUBJECT_SEX) == null) {
      report.add(
          new LintViolation(RULE_ID, record.getSubjectId(), ViolationType.MISSING_FIELD,
              "No subject sex recorded", FixAction.ADD));
    }
  }
}

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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Runs a fixed list of lint rules over finished subject records.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * RecordLinter linter = RecordLinter.withDefaultRules();
 * LintReport report = linter.lint(records);
 * for (LintViolation violation : report.getViolations()) {
 *   System.out.println(violation);
 * }
 * }</pre>
 */
public class RecordLinter {

  private static final Logger LOGGER = LoggerFactory.getLogger(RecordLinter.class);

  private final List<LintRule> rules;

  public RecordLinter(List<LintRule> rules) {
    this.rules = Collections.unmodifiableList(new ArrayList<LintRule>(rules));
  }

  public static RecordLinter withDefaultRules() {
    return new RecordLinter(defaultRules());
  }

  public static List<LintRule> defaultRules() {
    return Arrays.<LintRule>asList(
        new CurieFormatRule(),
        new DuplicatePhenotypeRule(),
        new DiseaseConsistencyRule(),
        new MissingSubjectSexRule());
  }

  public List<LintRule> getRules() {
    return rules;
  }

  public LintReport lint(List<SubjectRecord> records) {
    LintReport report = new LintReport();
    for (SubjectRecord record : records) {
      for (LintRule rule : rules) {
        rule.check(record, report);
      }
    }
    if (!report.isClean()) {
      LOGGER.warn("Linting found {} violations in {} records", report.size(), records.size());
    }
    return report;
  }
}

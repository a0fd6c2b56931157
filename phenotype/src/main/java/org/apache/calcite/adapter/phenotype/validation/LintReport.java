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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Violations collected by a {@link RecordLinter} run.
 *
 * <p>The report is handed back to the caller; it is neither written anywhere
 * nor acted upon by the linter.
 */
public class LintReport {

  private final List<LintViolation> violations = new ArrayList<LintViolation>();

  public static LintReport empty() {
    return new LintReport();
  }

  public synchronized void add(LintViolation violation) {
    violations.add(violation);
  }

  public synchronized List<LintViolation> getViolations() {
    return Collections.unmodifiableList(new ArrayList<LintViolation>(violations));
  }

  public synchronized List<LintViolation> getViolations(String ruleId) {
    List<LintViolation> result = new ArrayList<LintViolation>();
    for (LintViolation violation : violations) {
      if (violation.getRuleId().equals(ruleId)) {
        result.add(violation);
      }
    }
    return result;
  }

  public synchronized List<LintViolation> getViolationsForSubject(String subjectId) {
    List<LintViolation> result = new ArrayList<LintViolation>();
    for (LintViolation violation : violations) {
      if (violation.getSubjectId().equals(subjectId)) {
        result.add(violation);
      }
    }
    return result;
  }

  public synchronized boolean isClean() {
    return violations.isEmpty();
  }

  public synchronized int size() {
    return violations.size();
  }

  @Override public synchronized String toString() {
    return "LintReport{violations=" + violations.size() + "}";
  }
}

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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Objects;

/**
 * One problem found by a {@link LintRule} in one subject record.
 */
public final class LintViolation {

  private final String ruleId;
  private final String subjectId;
  private final ViolationType type;
  private final String message;
  private final @Nullable FixAction fixAction;

  public LintViolation(String ruleId, String subjectId, ViolationType type, String message,
      @Nullable FixAction fixAction) {
    this.ruleId = Objects.requireNonNull(ruleId, "ruleId");
    this.subjectId = Objects.requireNonNull(subjectId, "subjectId");
    this.type = Objects.requireNonNull(type, "type");
    this.message = Objects.requireNonNull(message, "message");
    this.fixAction = fixAction;
  }

  public String getRuleId() {
    return ruleId;
  }

  public String getSubjectId() {
    return subjectId;
  }

  public ViolationType getType() {
    return type;
  }

  public String getMessage() {
    return message;
  }

  /**
   * Returns the suggested remediation, or null if none applies.
   */
  public @Nullable FixAction getFixAction() {
    return fixAction;
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof LintViolation)) {
      return false;
    }
    LintViolation that = (LintViolation) o;
    return ruleId.equals(that.ruleId)
        && subjectId.equals(that.subjectId)
        && type == that.type
        && message.equals(that.message)
        && fixAction == that.fixAction;
  }

  @Override public int hashCode() {
    return Objects.hash(ruleId, subjectId, type, message, fixAction);
  }

  @Override public String toString() {
    return "[" + ruleId + "] " + subjectId + ": " + message
        + (fixAction == null ? "" : " (fix: " + fixAction + ")");
  }
}

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
package org.apache.calcite.adapter.phenotype.pipeline;

import org.apache.calcite.adapter.phenotype.Diagnostics;
import org.apache.calcite.adapter.phenotype.collect.SubjectRecord;
import org.apache.calcite.adapter.phenotype.validation.LintReport;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of a successful {@link PhenotypePipeline} run.
 *
 * <p>Row-scoped problems never fail a run; they are returned here as
 * diagnostics next to the records.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * PipelineResult result = pipeline.run(sources);
 * System.out.println("Collected " + result.getRecords().size() + " subjects");
 * for (Diagnostic diagnostic : result.getDiagnostics().getEntries()) {
 *   System.err.println("  - " + diagnostic);
 * }
 * }</pre>
 *
 * @see PhenotypePipeline
 */
public class PipelineResult {

  private final List<SubjectRecord> records;
  private final Diagnostics diagnostics;
  private final LintReport lintReport;
  private final int tableCount;
  private final long rowCount;
  private final long rejectedRowCount;
  private final long elapsedMs;

  private PipelineResult(Builder builder) {
    this.records = builder.records != null
        ? Collections.unmodifiableList(new ArrayList<SubjectRecord>(builder.records))
        : Collections.<SubjectRecord>emptyList();
    this.diagnostics = builder.diagnostics != null ? builder.diagnostics : new Diagnostics();
    this.lintReport = builder.lintReport != null ? builder.lintReport : LintReport.empty();
    this.tableCount = builder.tableCount;
    this.rowCount = builder.rowCount;
    this.rejectedRowCount = builder.rejectedRowCount;
    this.elapsedMs = builder.elapsedMs;
  }

  /**
   * Returns the finished records, ordered by subject id.
   */
  public List<SubjectRecord> getRecords() {
    return records;
  }

  public Diagnostics getDiagnostics() {
    return diagnostics;
  }

  /**
   * Returns the lint report; empty when validation was disabled.
   */
  public LintReport getLintReport() {
    return lintReport;
  }

  public int getTableCount() {
    return tableCount;
  }

  /**
   * Returns the number of rows offered to the collector.
   */
  public long getRowCount() {
    return rowCount;
  }

  /**
   * Returns the number of rows rejected for lack of a subject id.
   */
  public long getRejectedRowCount() {
    return rejectedRowCount;
  }

  public long getElapsedMs() {
    return elapsedMs;
  }

  /**
   * Returns whether the run produced neither diagnostics nor lint violations.
   */
  public boolean isClean() {
    return diagnostics.isEmpty() && lintReport.isClean();
  }

  @Override public String toString() {
    return "PipelineResult{subjects=" + records.size() + ", tables=" + tableCount
        + ", rows=" + rowCount + ", rejected=" + rejectedRowCount
        + ", diagnostics=" + diagnostics.size() + ", violations=" + lintReport.size()
        + ", elapsed=" + elapsedMs + "ms}";
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Builder for PipelineResult.
   */
  public static class Builder {
    private List<SubjectRecord> records;
    private Diagnostics diagnostics;
    private LintReport lintReport;
    private int tableCount;
    private long rowCount;
    private long rejectedRowCount;
    private long elapsedMs;

    public Builder records(List<SubjectRecord> records) {
      this.records = records;
      return this;
    }

    public Builder diagnostics(Diagnostics diagnostics) {
      this.diagnostics = diagnostics;
      return this;
    }

    public Builder lintReport(LintReport lintReport) {
      this.lintReport = lintReport;
      return this;
    }

    public Builder tableCount(int tableCount) {
      this.tableCount = tableCount;
      return this;
    }

    public Builder rowCount(long rowCount) {
      this.rowCount = rowCount;
      return this;
    }

    public Builder rejectedRowCount(long rejectedRowCount) {
      this.rejectedRowCount = rejectedRowCount;
      return this;
    }

    public Builder elapsedMs(long elapsedMs) {
      this.elapsedMs = elapsedMs;
      return this;
    }

    public PipelineResult build() {
      return new PipelineResult(this);
    }
  }
}

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

import org.apache.calcite.adapter.phenotype.Diagnostics;
import org.apache.calcite.adapter.phenotype.collect.Collector;
import org.apache.calcite.adapter.phenotype.collect.SubjectRecord;
import org.apache.calcite.adapter.phenotype.context.Context;
import org.apache.calcite.adapter.phenotype.context.Identifier;
import org.apache.calcite.adapter.phenotype.context.SeriesContext;
import org.apache.calcite.adapter.phenotype.context.TableContext;
import org.apache.calcite.adapter.phenotype.table.ContextMatcher;
import org.apache.calcite.adapter.phenotype.table.ContextualizedTable;
import org.apache.calcite.adapter.phenotype.table.DataTable;
import org.apache.calcite.adapter.phenotype.table.TaggedRow;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for RecordLinter and the default lint rules.
 */
@Tag("unit")
public class RecordLinterTest {

  private List<SubjectRecord> records;

  private static SeriesContext series(String column, Context dataContext, String block) {
    return SeriesContext.builder()
        .identifier(Identifier.exact(column))
        .dataContext(dataContext)
        .buildingBlockId(block)
        .build();
  }

  @BeforeEach
  void setUp() throws Exception {
    TableContext tc = TableContext.builder()
        .name("cohort")
        .seriesContext(series("id", Context.SUBJECT_ID, null))
        .seriesContext(series("sex", Context.SUBJECT_SEX, null))
        .seriesContext(series("hpo", Context.HPO_LABEL_OR_ID, null))
        .seriesContext(series("disease", Context.DISEASE_LABEL_OR_ID, null))
        .seriesContext(series("interpreted_disease", Context.DISEASE_LABEL_OR_ID, "interp"))
        .seriesContext(series("gene", Context.HGNC_SYMBOL_OR_ID, "interp"))
        .build();
    DataTable data = DataTable.fromRows("cohort",
        Arrays.asList("id", "sex", "hpo", "disease", "interpreted_disease", "gene"),
        Arrays.asList(
            Arrays.<Object>asList("P001", "MALE", "HP:0001250", "Seizure disorder",
                "MONDO:0000001", "HGNC:1100"),
            Arrays.<Object>asList("P001", "MALE", "HP:0001250", null, null, null),
            Arrays.<Object>asList("P002", "FEMALE", "HP:0002027", "MONDO:0000001",
                "MONDO:0000001", "HGNC:1100"),
            Arrays.<Object>asList("P003", null, "HP:0002027", null, null, null)));
    ContextualizedTable table = new ContextMatcher().match(data, tc, "memory");
    Collector collector = new Collector();
    Diagnostics diagnostics = new Diagnostics();
    for (TaggedRow row : table.getRows()) {
      collector.ingest(row, tc, "memory", diagnostics);
    }
    records = collector.finalizeRecords();
  }

  @Test void testDefaultRules() {
    LintReport report = RecordLinter.withDefaultRules().lint(records);

    assertEquals(4, report.size());
    assertTrue(report.getViolationsForSubject("P002").isEmpty());
    assertEquals(3, report.getViolationsForSubject("P001").size());
    assertEquals(1, report.getViolationsForSubject("P003").size());
  }

  @Test void testCurieFormat() {
    LintReport report = new RecordLinter(
        Collections.<LintRule>singletonList(new CurieFormatRule())).lint(records);

    assertEquals(1, report.size());
    LintViolation violation = report.getViolations().get(0);
    assertEquals(ViolationType.NOT_A_CURIE, violation.getType());
    assertTrue(violation.getMessage().contains("Seizure disorder"));
    assertNull(violation.getFixAction());
  }

  @Test void testDuplicatePhenotype() {
    LintReport report = new RecordLinter(
        Collections.<LintRule>singletonList(new DuplicatePhenotypeRule())).lint(records);

    assertEquals(1, report.size());
    assertEquals("P001", report.getViolations().get(0).getSubjectId());
    assertEquals(FixAction.REMOVE, report.getViolations().get(0).getFixAction());
  }

  @Test void testDiseaseConsistency() {
    LintReport report = new RecordLinter(
        Collections.<LintRule>singletonList(new DiseaseConsistencyRule())).lint(records);

    assertEquals(1, report.getViolations(DiseaseConsistencyRule.RULE_ID).size());
    LintViolation violation = report.getViolations().get(0);
    assertEquals("P001", violation.getSubjectId());
    assertEquals(FixAction.DUPLICATE, violation.getFixAction());
  }

  @Test void testMissingSubjectSex() {
    LintReport report = new RecordLinter(
        Collections.<LintRule>singletonList(new MissingSubjectSexRule())).lint(records);

    assertEquals(1, report.size());
    assertEquals("P003", report.getViolations().get(0).getSubjectId());
    assertEquals(FixAction.ADD, report.getViolations().get(0).getFixAction());
  }

  @Test void testEmptyReport() {
    LintReport report = RecordLinter.withDefaultRules()
        .lint(Collections.<SubjectRecord>emptyList());

    assertTrue(report.isClean());
    assertTrue(LintReport.empty().isClean());
  }
}

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

import org.apache.calcite.adapter.phenotype.Diagnostic;
import org.apache.calcite.adapter.phenotype.PipelineException;
import org.apache.calcite.adapter.phenotype.collect.SubjectRecord;
import org.apache.calcite.adapter.phenotype.config.ExtractionConfig;
import org.apache.calcite.adapter.phenotype.context.AliasMap;
import org.apache.calcite.adapter.phenotype.context.Context;
import org.apache.calcite.adapter.phenotype.context.Identifier;
import org.apache.calcite.adapter.phenotype.context.SeriesContext;
import org.apache.calcite.adapter.phenotype.context.TableContext;
import org.apache.calcite.adapter.phenotype.ontology.CachingBiDict;
import org.apache.calcite.adapter.phenotype.ontology.FakeOntologyProvider;
import org.apache.calcite.adapter.phenotype.ontology.OntologyRef;
import org.apache.calcite.adapter.phenotype.table.DataTable;
import org.apache.calcite.adapter.phenotype.table.IdentifierMatchException;
import org.apache.calcite.adapter.phenotype.transform.AliasMapStrategy;
import org.apache.calcite.adapter.phenotype.transform.MappingStrategy;
import org.apache.calcite.adapter.phenotype.transform.OntologyNormaliserStrategy;
import org.apache.calcite.adapter.phenotype.transform.Strategy;
import org.apache.calcite.adapter.phenotype.transform.StrategyPipeline;
import org.apache.calcite.adapter.phenotype.validation.MissingSubjectSexRule;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LoggerContext;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for PhenotypePipeline.
 */
@Tag("unit")
public class PhenotypePipelineTest {

  @TempDir
  File tempDir;

  /**
   * Context of a {@code patient_id, sex, hpo_label} table, optionally with an
   * alias map on {@code sex}. Empty {@code hpo_label} cells are filled.
   */
  static TableContext patientsContext(boolean aliasSex) {
    SeriesContext.Builder sex = SeriesContext.builder()
        .identifier(Identifier.exact("sex"))
        .dataContext(Context.SUBJECT_SEX);
    if (aliasSex) {
      sex.aliasMap(AliasMap.builder().alias("M", "Male").alias("F", "Female").build());
    }
    return TableContext.builder()
        .name("patients")
        .seriesContext(SeriesContext.builder()
            .identifier(Identifier.exact("patient_id"))
            .dataContext(Context.SUBJECT_ID)
            .build())
        .seriesContext(sex.build())
        .seriesContext(SeriesContext.builder()
            .identifier(Identifier.exact("hpo_label"))
            .dataContext(Context.HPO_LABEL_OR_ID)
            .fillMissing("Zollinger-Ellison syndrome")
            .build())
        .build();
  }

  private static TableContext phenotypesContext() {
    return TableContext.builder()
        .name("phenotypes")
        .seriesContext(SeriesContext.builder()
            .identifier(Identifier.exact("patient_id"))
            .dataContext(Context.SUBJECT_ID)
            .build())
        .seriesContext(SeriesContext.builder()
            .identifier(Identifier.regex("hpo_\\d+"))
            .dataContext(Context.HPO_LABEL_OR_ID)
            .build())
        .build();
  }

  private File writeCsv(String name, String content) throws IOException {
    File file = new File(tempDir, name);
    Files.write(file.toPath(), content.getBytes(StandardCharsets.UTF_8));
    return file;
  }

  private static StrategyPipeline strategies(Strategy... strategies) {
    return new StrategyPipeline(Arrays.asList(strategies));
  }

  @Test void testCsvRowBecomesRecord() throws Exception {
    File csv = writeCsv("patients.csv", "patient_id,sex,hpo_label\nP001,M,\n");
    CollectingLoader loader = new CollectingLoader();
    PhenotypePipeline pipeline = PhenotypePipeline.builder()
        .strategyPipeline(strategies(new AliasMapStrategy()))
        .loader(loader)
        .build();

    PipelineResult result = pipeline.run(Collections.<DataSource>singletonList(
        CsvDataSource.builder().file(csv).tableContext(patientsContext(true)).build()));

    assertEquals(1, result.getRecords().size());
    SubjectRecord record = result.getRecords().get(0);
    assertEquals("P001", record.getSubjectId());
    assertEquals("Male", record.getValue(Context.SUBJECT_SEX));
    assertEquals("Zollinger-Ellison syndrome", record.getValue(Context.HPO_LABEL_OR_ID));
    assertTrue(result.isClean());
    assertEquals(result.getRecords(), loader.getRecords());
    assertEquals(1, result.getTableCount());
    assertEquals(1, result.getRowCount());
  }

  @Test void testSubjectMergedAcrossCsvAndExcel() throws Exception {
    File csv = writeCsv("patients.csv", "patient_id,sex,hpo_label\nP002,F,Abdominal pain\n");
    File xlsx = new File(tempDir, "phenotypes.xlsx");
    ExcelDataSourceTest.writeWorkbook(xlsx, "phenotypes", Arrays.asList(
        Arrays.<Object>asList("patient_id", "hpo_1", "hpo_2"),
        Arrays.<Object>asList("P002", "Seizure", null),
        Arrays.<Object>asList("P003", "HP:0002017", "Epileptic seizure")));
    CachingBiDict hpo = new CachingBiDict(OntologyRef.HP, new FakeOntologyProvider()
        .term("HP:0001250", "Seizure", "Epileptic seizure")
        .term("HP:0002027", "Abdominal pain")
        .term("HP:0002017", "Nausea and vomiting"));
    PhenotypePipeline pipeline = PhenotypePipeline.builder()
        .strategyPipeline(strategies(MappingStrategy.sexMapping(),
            new OntologyNormaliserStrategy(hpo, Context.HPO_LABEL_OR_ID)))
        .build();

    PipelineResult result = pipeline.run(Arrays.<DataSource>asList(
        CsvDataSource.builder().file(csv).tableContext(patientsContext(false)).build(),
        ExcelDataSource.builder()
            .file(xlsx)
            .sheet(ExtractionConfig.of("phenotypes"), phenotypesContext())
            .build()));

    assertEquals(2, result.getRecords().size());
    SubjectRecord p002 = result.getRecords().get(0);
    assertEquals("P002", p002.getSubjectId());
    assertEquals("FEMALE", p002.getValue(Context.SUBJECT_SEX));
    assertEquals(Arrays.<Object>asList("HP:0002027", "HP:0001250"),
        p002.getValues(Context.HPO_LABEL_OR_ID));
    assertEquals(Arrays.asList(csv.getPath(), xlsx.getPath()),
        new ArrayList<String>(p002.getSources()));

    SubjectRecord p003 = result.getRecords().get(1);
    assertEquals(Arrays.<Object>asList("HP:0002017", "HP:0001250"),
        p003.getValues(Context.HPO_LABEL_OR_ID));
    assertTrue(result.getDiagnostics().isEmpty());
  }

  @Test void testFirstTableFailureAbortsRun() {
    DataTable good = DataTable.fromRows("patients",
        Arrays.asList("patient_id", "sex", "hpo_label"),
        Arrays.asList(Arrays.<Object>asList("P001", "M", "Seizure")));
    DataTable bad = DataTable.fromRows("phenotypes",
        Arrays.asList("patient", "hpo_1"),
        Arrays.asList(Arrays.<Object>asList("P001", "Seizure")));
    CollectingLoader loader = new CollectingLoader();
    PhenotypePipeline pipeline = PhenotypePipeline.builder().loader(loader).build();

    PipelineException e = assertThrows(PipelineException.class, () -> pipeline.run(
        Collections.<DataSource>singletonList(InMemoryDataSource.of("memory",
            new SourceTable(good, patientsContext(false)),
            new SourceTable(bad, phenotypesContext())))));

    assertInstanceOf(IdentifierMatchException.class, e);
    assertTrue(loader.getRecords().isEmpty());
  }

  @Test void testExtractionFailureIsWrapped() {
    DataSource broken = new DataSource() {
      @Override public String getId() {
        return "broken";
      }

      @Override public String getType() {
        return "memory";
      }

      @Override public List<SourceTable> extract() throws IOException {
        throw new IOException("disk on fire");
      }
    };

    PipelineException e = assertThrows(PipelineException.class,
        () -> PhenotypePipeline.builder().build()
            .run(Collections.singletonList(broken)));
    assertInstanceOf(IOException.class, e.getCause());
  }

  @Test void testSourcesAreClosedAfterExtraction() throws Exception {
    final AtomicInteger closed = new AtomicInteger();
    DataTable table = DataTable.fromRows("patients",
        Arrays.asList("patient_id", "sex", "hpo_label"),
        Arrays.asList(Arrays.<Object>asList("P001", "M", "Seizure")));
    DataSource good = new InMemoryDataSource("memory",
        Collections.singletonList(new SourceTable(table, patientsContext(false)))) {
      @Override public void close() {
        closed.incrementAndGet();
      }
    };
    DataSource broken = new DataSource() {
      @Override public String getId() {
        return "broken";
      }

      @Override public String getType() {
        return "memory";
      }

      @Override public List<SourceTable> extract() throws IOException {
        throw new IOException("disk on fire");
      }

      @Override public void close() throws IOException {
        closed.incrementAndGet();
        throw new IOException("already gone");
      }
    };

    PhenotypePipeline.builder().build().run(Collections.singletonList(good));
    assertEquals(1, closed.get());

    PipelineException e = assertThrows(PipelineException.class,
        () -> PhenotypePipeline.builder().build().run(Arrays.asList(good, broken)));
    assertEquals(3, closed.get());
    assertEquals("disk on fire", e.getCause().getMessage());
    assertEquals("already gone", e.getSuppressed()[0].getMessage());
  }

  @Test void testOutputIsIndependentOfParallelism() throws Exception {
    List<SourceTable> tables = new ArrayList<SourceTable>();
    for (int t = 0; t < 8; t++) {
      List<List<Object>> rows = new ArrayList<List<Object>>();
      for (int r = 0; r < 20; r++) {
        rows.add(Arrays.<Object>asList("P" + (r % 5), r % 2 == 0 ? "M" : "X",
            r % 3 == 0 ? null : "HP:000" + (1000 + t * 20 + r)));
      }
      tables.add(new SourceTable(DataTable.fromRows("patients",
          Arrays.asList("patient_id", "sex", "hpo_label"), rows), patientsContext(false)));
    }
    List<DataSource> sources =
        Collections.<DataSource>singletonList(new InMemoryDataSource("memory", tables));

    PipelineResult serial = PhenotypePipeline.builder()
        .strategyPipeline(strategies(MappingStrategy.sexMapping()))
        .parallelism(1)
        .build()
        .run(sources);
    PipelineResult parallel = PhenotypePipeline.builder()
        .strategyPipeline(strategies(MappingStrategy.sexMapping()))
        .parallelism(8)
        .build()
        .run(sources);

    assertEquals(5, serial.getRecords().size());
    assertEquals(serial.getRecords().size(), parallel.getRecords().size());
    for (int i = 0; i < serial.getRecords().size(); i++) {
      assertEquals(serial.getRecords().get(i).toMap(), parallel.getRecords().get(i).toMap());
    }
    assertEquals(serial.getDiagnostics().getEntries(), parallel.getDiagnostics().getEntries());
    assertFalse(serial.getDiagnostics().getEntries(Diagnostic.Kind.MAPPING_VIOLATION).isEmpty());
  }

  @Test void testRejectedRowsAreCounted() throws Exception {
    DataTable data = DataTable.fromRows("patients",
        Arrays.asList("patient_id", "sex", "hpo_label"),
        Arrays.asList(
            Arrays.<Object>asList("P001", "M", "Seizure"),
            Arrays.<Object>asList(null, "F", "Seizure")));

    PipelineResult result = PhenotypePipeline.builder().build().run(
        Collections.<DataSource>singletonList(
            InMemoryDataSource.of("memory", new SourceTable(data, patientsContext(false)))));

    assertEquals(2, result.getRowCount());
    assertEquals(1, result.getRejectedRowCount());
    assertEquals(1, result.getDiagnostics().getEntries(Diagnostic.Kind.MISSING_SUBJECT_ID).size());
    assertFalse(result.isClean());
  }

  @Test void testValidationProducesLintReport() throws Exception {
    DataTable data = DataTable.fromRows("patients",
        Arrays.asList("patient_id", "sex", "hpo_label"),
        Arrays.asList(
            Arrays.<Object>asList("P001", null, "HP:0001250"),
            Arrays.<Object>asList("P002", "M", "HP:0001250")));

    PipelineResult result = PhenotypePipeline.builder().validate(true).build().run(
        Collections.<DataSource>singletonList(
            InMemoryDataSource.of("memory", new SourceTable(data, patientsContext(false)))));

    assertEquals(1, result.getLintReport().size());
    assertEquals(MissingSubjectSexRule.RULE_ID,
        result.getLintReport().getViolations().get(0).getRuleId());
    assertEquals("P001", result.getLintReport().getViolations().get(0).getSubjectId());
  }

  @Test void testProgressListenerSeesPhases() throws Exception {
    final List<String> events = new ArrayList<String>();
    PhenotypePipeline.ProgressListener listener = new PhenotypePipeline.ProgressListener() {
      @Override public void onPhaseStart(String phase, int totalItems) {
        events.add("start:" + phase);
      }

      @Override public void onPhaseComplete(String phase, int processedItems) {
        events.add("done:" + phase);
      }

      @Override public void onTableComplete(String tableName, int rowCount, Exception error) {
        events.add("table:" + tableName);
      }
    };
    DataTable data = DataTable.fromRows("patients",
        Arrays.asList("patient_id", "sex", "hpo_label"),
        Arrays.asList(Arrays.<Object>asList("P001", "M", "HP:0001250")));

    PhenotypePipeline.builder()
        .progressListener(listener)
        .loader(new CollectingLoader())
        .build()
        .run(Collections.<DataSource>singletonList(
            InMemoryDataSource.of("memory", new SourceTable(data, patientsContext(false)))));

    assertEquals(Arrays.asList("start:extract", "done:extract", "start:transform",
        "table:patients", "done:transform", "start:collect", "done:collect",
        "start:load", "done:load"), events);
  }

  @Test void testBuilderValidation() {
    assertThrows(IllegalStateException.class,
        () -> PhenotypePipeline.builder().parallelism(0).build());
  }

  @Test void testLoggingRoutesThroughLog4j() throws Exception {
    assertEquals("org.apache.logging.slf4j.Log4jLoggerFactory",
        LoggerFactory.getILoggerFactory().getClass().getName());
    assertEquals(LoggerContext.class, LogManager.getContext(false).getClass());
  }
}

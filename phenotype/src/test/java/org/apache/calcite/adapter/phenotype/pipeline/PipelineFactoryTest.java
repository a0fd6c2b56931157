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

import org.apache.calcite.adapter.phenotype.PipelineException;
import org.apache.calcite.adapter.phenotype.collect.SubjectRecord;
import org.apache.calcite.adapter.phenotype.config.ConfigLoader;
import org.apache.calcite.adapter.phenotype.config.PhenotypeConfig;
import org.apache.calcite.adapter.phenotype.context.Context;
import org.apache.calcite.adapter.phenotype.ontology.FakeOntologyProvider;
import org.apache.calcite.adapter.phenotype.ontology.ObographsOntologyProviderTest;
import org.apache.calcite.adapter.phenotype.ontology.OntologyRef;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for PipelineFactory.
 */
@Tag("unit")
public class PipelineFactoryTest {

  private static final String SOURCES = "data_sources:\n"
      + "  - type: csv\n"
      + "    source: patients.csv\n"
      + "    context:\n"
      + "      name: patients\n"
      + "      contexts:\n"
      + "        - {identifier: patient_id, data_context: subject_id}\n"
      + "        - {identifier: sex, data_context: subject_sex}\n"
      + "        - {identifier: hpo, data_context: hpo_label_or_id}\n";

  @TempDir
  File tempDir;

  private void write(String name, String content) throws IOException {
    Files.write(new File(tempDir, name).toPath(), content.getBytes(StandardCharsets.UTF_8));
  }

  @Test void testRunsConfiguredPipeline() throws Exception {
    write("patients.csv", "patient_id,sex,hpo\nP001,m,Seizures\nP002,,HP:0002027\n");
    write("phenotype.yaml", SOURCES
        + "pipeline:\n"
        + "  transform_strategies:\n"
        + "    - sex_mapping\n"
        + "    - {type: ontology_normaliser, ontology: HP}\n"
        + "  loader:\n"
        + "    file_system: {output_dir: out, create_dir: true}\n"
        + "  parallelism: 1\n"
        + "  validate: true\n");
    PhenotypeConfig config = ConfigLoader.load(new File(tempDir, "phenotype.yaml"));
    FakeOntologyProvider hpo = new FakeOntologyProvider()
        .term("HP:0001250", "Seizure", "Seizures")
        .term("HP:0002027", "Abdominal pain");
    PipelineFactory factory = new PipelineFactory(config, tempDir, ref -> hpo);

    PipelineResult result = factory.createPipeline().run(factory.createDataSources());

    List<SubjectRecord> records = result.getRecords();
    assertEquals(2, records.size());
    assertEquals("MALE", records.get(0).getValue(Context.SUBJECT_SEX));
    assertEquals("HP:0001250", records.get(0).getValue(Context.HPO_LABEL_OR_ID));
    assertEquals("HP:0002027", records.get(1).getValue(Context.HPO_LABEL_OR_ID));
    assertTrue(new File(tempDir, "out/P001.json").isFile());
    assertTrue(new File(tempDir, "out/P002.json").isFile());
    assertEquals(1, result.getLintReport().getViolationsForSubject("P002").size());
    assertTrue(factory.getOntologyFactory().contains(OntologyRef.HP));
  }

  @Test void testCreatesDataSourcesRelativeToBaseDirectory() throws Exception {
    PhenotypeConfig config = ConfigLoader.parseYaml(SOURCES
        + "  - type: excel\n"
        + "    source: cohort.xlsx\n"
        + "    sheets:\n"
        + "      - context:\n"
        + "          name: labs\n"
        + "          contexts: [{identifier: patient_id, data_context: subject_id}]\n"
        + "pipeline: {}\n");

    List<DataSource> sources = new PipelineFactory(config, tempDir).createDataSources();

    assertEquals(2, sources.size());
    assertInstanceOf(CsvDataSource.class, sources.get(0));
    assertEquals(new File(tempDir, "patients.csv").getPath(), sources.get(0).getId());
    assertInstanceOf(ExcelDataSource.class, sources.get(1));
    assertEquals(new File(tempDir, "cohort.xlsx").getPath(), sources.get(1).getId());
  }

  @Test void testPrepopulatesFromOntologyFile() throws Exception {
    String hpPath = ObographsOntologyProviderTest.hpFile().getAbsolutePath();
    PhenotypeConfig config = ConfigLoader.parseYaml(SOURCES
        + "pipeline:\n"
        + "  ontologies:\n"
        + "    files: {HP: '" + hpPath + "'}\n"
        + "    prepopulate: [HPO]\n");
    PipelineFactory factory = new PipelineFactory(config, tempDir);

    factory.createPipeline();

    assertTrue(factory.getOntologyFactory().contains(OntologyRef.HP));
    assertEquals("Seizure",
        factory.getOntologyFactory().getBiDict(OntologyRef.HP).getLabel("HP:0001250"));
  }

  @Test void testPrepopulateFailure() throws Exception {
    PhenotypeConfig config = ConfigLoader.parseYaml(SOURCES
        + "pipeline:\n"
        + "  ontologies:\n"
        + "    files: {HP: missing/hp.json}\n"
        + "    prepopulate: [HP]\n");
    PipelineFactory factory = new PipelineFactory(config, tempDir);

    PipelineException e = assertThrows(PipelineException.class, factory::createPipeline);
    assertInstanceOf(IOException.class, e.getCause());
    assertFalse(new File(tempDir, "missing").exists());
  }
}

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
import org.apache.calcite.adapter.phenotype.config.DataSourceConfig;
import org.apache.calcite.adapter.phenotype.config.LoaderConfig;
import org.apache.calcite.adapter.phenotype.config.OntologyConfig;
import org.apache.calcite.adapter.phenotype.config.PhenotypeConfig;
import org.apache.calcite.adapter.phenotype.config.PipelineConfig;
import org.apache.calcite.adapter.phenotype.ontology.CachedOntologyFactory;
import org.apache.calcite.adapter.phenotype.ontology.DefaultOntologyProviderResolver;
import org.apache.calcite.adapter.phenotype.ontology.OntologyProviderResolver;
import org.apache.calcite.adapter.phenotype.transform.StrategyFactory;
import org.apache.calcite.adapter.phenotype.transform.StrategyPipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds a runnable pipeline and its data sources from a
 * {@link PhenotypeConfig}.
 *
 * <p>Relative paths in the configuration are resolved against a base
 * directory, normally the directory of the configuration file. Ontologies
 * listed under {@code prepopulate} are loaded before the pipeline is
 * returned, so configuration mistakes surface before any data is read.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * File configFile = new File("phenotype.yaml");
 * PhenotypeConfig config = ConfigLoader.load(configFile);
 * PipelineFactory factory = new PipelineFactory(config, configFile.getParentFile());
 * PipelineResult result = factory.createPipeline().run(factory.createDataSources());
 * }</pre>
 */
public class PipelineFactory {

  private static final Logger LOGGER = LoggerFactory.getLogger(PipelineFactory.class);

  private final PhenotypeConfig config;
  private final File baseDirectory;
  private final CachedOntologyFactory ontologyFactory;

  public PipelineFactory(PhenotypeConfig config, File baseDirectory) {
    this(config, baseDirectory, null);
  }

  /**
   * Creates a factory whose ontologies come from the given resolver instead
   * of the configured files and services.
   */
  public PipelineFactory(PhenotypeConfig config, File baseDirectory,
      OntologyProviderResolver resolver) {
    this.config = config;
    this.baseDirectory = baseDirectory != null ? baseDirectory : new File(".");
    OntologyConfig ontologies = config.getPipeline().getOntologies();
    this.ontologyFactory = new CachedOntologyFactory(
        resolver != null ? resolver : createResolver(ontologies),
        ontologies.getLookupTimeoutMs());
  }

  private OntologyProviderResolver createResolver(OntologyConfig ontologies) {
    DefaultOntologyProviderResolver.Builder builder = DefaultOntologyProviderResolver.builder()
        .bioPortalApiKey(config.getBioPortalApiKey());
    if (ontologies.getOntologyDir() != null) {
      builder.ontologyDir(resolve(ontologies.getOntologyDir()));
    }
    for (Map.Entry<String, String> entry : ontologies.getFiles().entrySet()) {
      builder.file(entry.getKey(), resolve(entry.getValue()));
    }
    if (ontologies.getBioPortalBaseUrl() != null) {
      builder.bioPortalBaseUrl(ontologies.getBioPortalBaseUrl());
    }
    if (ontologies.getHgncBaseUrl() != null) {
      builder.hgncBaseUrl(ontologies.getHgncBaseUrl());
    }
    return builder.build();
  }

  public CachedOntologyFactory getOntologyFactory() {
    return ontologyFactory;
  }

  /**
   * Builds the pipeline, loading the ontologies listed for prepopulation.
   *
   * @throws PipelineException if a prepopulated ontology cannot be loaded
   */
  public PhenotypePipeline createPipeline() throws PipelineException {
    PipelineConfig pipelineConfig = config.getPipeline();
    if (!pipelineConfig.getOntologies().getPrepopulate().isEmpty()) {
      try {
        ontologyFactory.prepopulate(pipelineConfig.getOntologies().getPrepopulate());
      } catch (IOException e) {
        throw new PipelineException("Failed to prepopulate ontologies "
            + pipelineConfig.getOntologies().getPrepopulate(), e);
      }
    }
    StrategyPipeline strategies =
        new StrategyFactory(ontologyFactory).createPipeline(pipelineConfig.getStrategies());
    LOGGER.info("Created pipeline with strategies {}", strategies.getStrategyNames());
    return PhenotypePipeline.builder()
        .strategyPipeline(strategies)
        .loader(createLoader(pipelineConfig.getLoader()))
        .validate(pipelineConfig.isValidate())
        .parallelism(pipelineConfig.getParallelism())
        .build();
  }

  /**
   * Returns a data source for every configured source, in declared order.
   */
  public List<DataSource> createDataSources() {
    List<DataSource> sources = new ArrayList<DataSource>();
    for (DataSourceConfig sourceConfig : config.getDataSources()) {
      File file = resolve(sourceConfig.getSource());
      switch (sourceConfig.getType()) {
        case CSV:
          sources.add(CsvDataSource.builder()
              .file(file)
              .separator(sourceConfig.getSeparator())
              .extraction(sourceConfig.getExtractions().get(0))
              .tableContext(sourceConfig.getTableContexts().get(0))
              .build());
          break;
        case EXCEL:
          ExcelDataSource.Builder excel = ExcelDataSource.builder().file(file);
          for (int i = 0; i < sourceConfig.getExtractions().size(); i++) {
            excel.sheet(sourceConfig.getExtractions().get(i),
                sourceConfig.getTableContexts().get(i));
          }
          sources.add(excel.build());
          break;
        default:
          throw new IllegalStateException("Unhandled data source type: "
              + sourceConfig.getType());
      }
    }
    return sources;
  }

  private Loader createLoader(LoaderConfig loaderConfig) {
    if (loaderConfig == null) {
      return null;
    }
    switch (loaderConfig.getType()) {
      case FILE_SYSTEM:
        return new FileSystemLoader(resolve(loaderConfig.getOutputDir()),
            loaderConfig.isCreateDir());
      default:
        throw new IllegalStateException("Unhandled loader type: " + loaderConfig.getType());
    }
  }

  private File resolve(String path) {
    File file = new File(path);
    return file.isAbsolute() ? file : new File(baseDirectory, path);
  }
}

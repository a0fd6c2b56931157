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
package org.apache.calcite.adapter.phenotype.transform;

import org.apache.calcite.adapter.phenotype.ConfigurationException;
import org.apache.calcite.adapter.phenotype.config.StrategyConfig;
import org.apache.calcite.adapter.phenotype.context.Context;
import org.apache.calcite.adapter.phenotype.context.ContextKind;
import org.apache.calcite.adapter.phenotype.ontology.CachedOntologyFactory;
import org.apache.calcite.adapter.phenotype.ontology.OntologyRef;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds {@link Strategy} instances from {@link StrategyConfig} declarations.
 *
 * <p>Strategies that need an ontology obtain their {@link
 * org.apache.calcite.adapter.phenotype.ontology.BiDict} from the shared
 * {@link CachedOntologyFactory}, so every strategy of a run that uses the
 * same ontology shares one cache.
 */
public class StrategyFactory {

  private static final Logger LOGGER = LoggerFactory.getLogger(StrategyFactory.class);

  private final CachedOntologyFactory ontologyFactory;

  public StrategyFactory(CachedOntologyFactory ontologyFactory) {
    this.ontologyFactory = ontologyFactory;
  }

  /**
   * Builds the pipeline for an ordered list of declarations.
   *
   * @throws ConfigurationException if a declaration is invalid or the order
   *     is not allowed
   */
  public StrategyPipeline createPipeline(List<StrategyConfig> configs) {
    List<Strategy> strategies = new ArrayList<Strategy>();
    for (StrategyConfig config : configs) {
      strategies.add(create(config));
    }
    StrategyPipeline pipeline = new StrategyPipeline(strategies);
    LOGGER.info("Transform pipeline: {}", pipeline.getStrategyNames());
    return pipeline;
  }

  /**
   * Builds one strategy.
   */
  public Strategy create(StrategyConfig config) {
    switch (config.getType()) {
      case STRING_CORRECTION:
        return createStringCorrection(config);
      case ALIAS_MAP:
        return new AliasMapStrategy();
      case SEX_MAPPING:
        return MappingStrategy.sexMapping();
      case VITAL_STATUS_MAPPING:
        return MappingStrategy.vitalStatusMapping();
      case VOCABULARY_MAPPING:
        return createVocabularyMapping(config);
      case ONTOLOGY_NORMALISER:
        return createOntologyNormaliser(config);
      case MULTI_HPO_COL_EXPANSION:
        String hpo = config.getString("ontology");
        return hpo == null
            ? new MultiHpoColExpansionStrategy()
            : new MultiHpoColExpansionStrategy(ontologyFactory.getBiDict(OntologyRef.parse(hpo)));
      case AGE_TO_ISO8601:
        return new AgeToIso8601Strategy();
      default:
        throw new IllegalStateException("Unhandled strategy type: " + config.getType());
    }
  }

  private Strategy createStringCorrection(StrategyConfig config) {
    StringCorrectionStrategy.Builder builder = StringCorrectionStrategy.builder()
        .caseMode(StringCorrectionStrategy.CaseMode.fromConfig(config.getOption("case")))
        .collapseWhitespace(config.getBoolean("collapse_whitespace", true));
    for (Map.Entry<String, String> entry : config.getStringMap("replace").entrySet()) {
      builder.replace(entry.getKey(), entry.getValue());
    }
    String charsToReplace = config.getString("chars_to_replace");
    if (charsToReplace != null) {
      String newChars = config.getString("new_chars");
      builder.replace(charsToReplace, newChars == null ? "" : newChars);
    }
    for (Object context : config.getList("data_contexts")) {
      builder.dataContext(Context.fromConfig(context));
    }
    return builder.build();
  }

  private Strategy createVocabularyMapping(StrategyConfig config) {
    Object dataContext = config.getOption("data_context");
    if (dataContext == null) {
      throw new ConfigurationException("vocabulary_mapping requires a 'data_context'");
    }
    Context context = Context.fromConfig(dataContext);
    String name = config.getString("name");
    return new MappingStrategy(name != null ? name : context + "_mapping", context,
        config.getStringMap("synonyms"));
  }

  private Strategy createOntologyNormaliser(StrategyConfig config) {
    String ontology = config.getString("ontology");
    Object contextObj = config.getOption("data_context");
    Context context = contextObj != null ? Context.fromConfig(contextObj) : null;
    if (ontology == null && context != null) {
      ontology = context.getKind().getDefaultOntologyPrefix();
    }
    if (ontology == null) {
      throw new ConfigurationException("ontology_normaliser requires an 'ontology'");
    }
    OntologyRef ref = OntologyRef.parse(ontology);
    if (context == null) {
      context = defaultContext(ref);
    }
    return new OntologyNormaliserStrategy(ontologyFactory.getBiDict(ref), context);
  }

  private static Context defaultContext(OntologyRef ref) {
    for (ContextKind kind : ContextKind.values()) {
      if (ref.getPrefix().equals(kind.getDefaultOntologyPrefix())
          && kind != ContextKind.MULTI_HPO_ID && kind != ContextKind.CAUSE_OF_DEATH) {
        return Context.of(kind);
      }
    }
    throw new ConfigurationException("ontology_normaliser for " + ref
        + " requires a 'data_context'");
  }
}

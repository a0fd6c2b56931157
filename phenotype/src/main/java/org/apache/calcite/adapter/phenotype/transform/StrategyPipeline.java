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
import org.apache.calcite.adapter.phenotype.Diagnostics;
import org.apache.calcite.adapter.phenotype.table.ContextualizedTable;

import com.google.common.collect.ImmutableList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered list of {@link Strategy} steps applied to each tagged table.
 *
 * <p>Steps run in declared order and each sees the previous step's output.
 * String correction must precede alias mapping and ontology normalisation,
 * whose lookups rely on exact keys; a pipeline that declares it later is
 * rejected when built.
 */
public class StrategyPipeline {

  private static final Logger LOGGER = LoggerFactory.getLogger(StrategyPipeline.class);

  private final List<Strategy> strategies;

  public StrategyPipeline(List<Strategy> strategies) {
    validateOrder(strategies);
    this.strategies = ImmutableList.copyOf(strategies);
  }

  /**
   * Returns a pipeline that leaves tables unchanged.
   */
  public static StrategyPipeline empty() {
    return new StrategyPipeline(ImmutableList.<Strategy>of());
  }

  private static void validateOrder(List<Strategy> strategies) {
    String firstExactKeyStrategy = null;
    for (Strategy strategy : strategies) {
      if (strategy instanceof AliasMapStrategy || strategy instanceof OntologyNormaliserStrategy) {
        if (firstExactKeyStrategy == null) {
          firstExactKeyStrategy = strategy.getName();
        }
      } else if (strategy instanceof StringCorrectionStrategy && firstExactKeyStrategy != null) {
        throw new ConfigurationException("Strategy '" + strategy.getName()
            + "' must run before '" + firstExactKeyStrategy + "'");
      }
    }
  }

  /**
   * Applies every applicable strategy to the table.
   *
   * @throws StrategyException if a strategy fails structurally
   */
  public void apply(ContextualizedTable table, Diagnostics diagnostics) throws StrategyException {
    for (Strategy strategy : strategies) {
      if (!strategy.isApplicable(table)) {
        LOGGER.debug("Skipping strategy '{}' for table '{}': no applicable columns",
            strategy.getName(), table.getName());
        continue;
      }
      long start = System.currentTimeMillis();
      int before = diagnostics.size();
      try {
        strategy.transform(table, diagnostics);
      } catch (RuntimeException e) {
        throw new StrategyException(strategy.getName(), table.getName(), e.getMessage(), e);
      }
      LOGGER.info("Strategy '{}' applied to table '{}' in {}ms ({} new diagnostics)",
          strategy.getName(), table.getName(), System.currentTimeMillis() - start,
          diagnostics.size() - before);
    }
  }

  public List<Strategy> getStrategies() {
    return strategies;
  }

  public List<String> getStrategyNames() {
    List<String> names = new ArrayList<String>();
    for (Strategy strategy : strategies) {
      names.add(strategy.getName());
    }
    return names;
  }

  @Override public String toString() {
    return "StrategyPipeline" + getStrategyNames();
  }
}

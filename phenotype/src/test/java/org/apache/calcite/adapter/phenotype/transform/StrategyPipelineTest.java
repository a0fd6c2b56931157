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
import org.apache.calcite.adapter.phenotype.context.AliasMap;
import org.apache.calcite.adapter.phenotype.context.Context;
import org.apache.calcite.adapter.phenotype.context.SeriesContext;
import org.apache.calcite.adapter.phenotype.table.ContextualizedTable;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for StrategyPipeline.
 */
@Tag("unit")
public class StrategyPipelineTest {

  /**
   * Records the order in which it runs.
   */
  private static class RecordingStrategy implements Strategy {
    private final String name;
    private final List<String> log;
    private final boolean applicable;

    RecordingStrategy(String name, List<String> log, boolean applicable) {
      this.name = name;
      this.log = log;
      this.applicable = applicable;
    }

    @Override public String getName() {
      return name;
    }

    @Override public boolean isApplicable(ContextualizedTable table) {
      return applicable;
    }

    @Override public void transform(ContextualizedTable table, Diagnostics diagnostics) {
      log.add(name);
    }
  }

  @Test void testRunsInDeclaredOrderAndSkipsInapplicable() throws Exception {
    List<String> log = new ArrayList<String>();
    StrategyPipeline pipeline = new StrategyPipeline(Arrays.<Strategy>asList(
        new RecordingStrategy("first", log, true),
        new RecordingStrategy("skipped", log, false),
        new RecordingStrategy("second", log, true)));

    pipeline.apply(TestTables.single(TestTables.column("sex", Context.SUBJECT_SEX), "M"),
        new Diagnostics());

    assertEquals(Arrays.asList("first", "second"), log);
    assertEquals(Arrays.asList("first", "skipped", "second"), pipeline.getStrategyNames());
  }

  @Test void testStringCorrectionMustPrecedeExactKeyStrategies() {
    assertThrows(ConfigurationException.class, () -> new StrategyPipeline(Arrays.<Strategy>asList(
        new AliasMapStrategy(), StringCorrectionStrategy.builder().build())));

    StrategyPipeline ok = new StrategyPipeline(Arrays.<Strategy>asList(
        StringCorrectionStrategy.builder().build(), new AliasMapStrategy()));
    assertEquals(2, ok.getStrategies().size());
  }

  @Test void testCleanedValuesReachAliasMap() throws Exception {
    SeriesContext sex = TestTables.column("sex", Context.SUBJECT_SEX).toBuilder()
        .aliasMap(AliasMap.builder().alias("M", "Male").build())
        .build();
    ContextualizedTable table = TestTables.single(sex, "  M ");
    StrategyPipeline pipeline = new StrategyPipeline(Arrays.<Strategy>asList(
        StringCorrectionStrategy.builder().build(), new AliasMapStrategy()));

    pipeline.apply(table, new Diagnostics());

    assertEquals("Male", table.getValue(0, "sex"));
  }

  @Test void testRuntimeFailureIsWrapped() throws Exception {
    Strategy broken = new Strategy() {
      @Override public String getName() {
        return "broken";
      }

      @Override public void transform(ContextualizedTable table, Diagnostics diagnostics) {
        throw new IllegalStateException("boom");
      }
    };
    StrategyPipeline pipeline = new StrategyPipeline(Arrays.asList(broken));
    ContextualizedTable table =
        TestTables.single(TestTables.column("sex", Context.SUBJECT_SEX), "M");

    StrategyException e =
        assertThrows(StrategyException.class, () -> pipeline.apply(table, new Diagnostics()));
    assertEquals("broken", e.getStrategyName());
    assertEquals("patients", e.getTableName());
    assertInstanceOf(IllegalStateException.class, e.getCause());
  }

  @Test void testEmptyPipeline() throws Exception {
    assertTrue(StrategyPipeline.empty().getStrategies().isEmpty());
  }
}

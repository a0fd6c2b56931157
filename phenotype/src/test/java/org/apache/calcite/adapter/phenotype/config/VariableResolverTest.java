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
package org.apache.calcite.adapter.phenotype.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

/**
 * Tests for VariableResolver.
 */
@Tag("unit")
public class VariableResolverTest {

  private static final String PROPERTY = "PHENO_RESOLVER_TEST_VALUE";

  @AfterEach
  void tearDown() {
    System.clearProperty(PROPERTY);
  }

  @Test void testSystemProperty() {
    System.setProperty(PROPERTY, "resolved");

    assertEquals("dir/resolved/x", VariableResolver.resolve("dir/${" + PROPERTY + "}/x"));
    assertEquals("resolved", VariableResolver.resolve("${" + PROPERTY + ":-fallback}"));
  }

  @Test void testDefaults() {
    assertEquals("fallback", VariableResolver.resolve("${" + PROPERTY + ":-fallback}"));
    assertEquals("fallback", VariableResolver.resolve("${" + PROPERTY + ":fallback}"));
    assertEquals("", VariableResolver.resolve("${" + PROPERTY + ":-}"));
  }

  @Test void testNestedDefault() {
    System.setProperty(PROPERTY, "inner");

    assertEquals("inner", VariableResolver.resolve("${PHENO_UNSET_OUTER:-${" + PROPERTY + "}}"));
  }

  @Test void testUnresolvedKept() {
    assertEquals("${PHENO_UNSET_VARIABLE}", VariableResolver.resolve("${PHENO_UNSET_VARIABLE}"));
    assertEquals("plain", VariableResolver.resolve("plain"));
    assertNull(VariableResolver.resolve(null));
    assertNull(VariableResolver.lookup("PHENO_UNSET_VARIABLE"));
  }

  @Test void testResolveTree() {
    System.setProperty(PROPERTY, "v");
    Map<String, Object> tree = Collections.<String, Object>singletonMap("${" + PROPERTY + "}",
        Arrays.<Object>asList("${" + PROPERTY + "}", 3, true));

    @SuppressWarnings("unchecked")
    Map<String, Object> resolved = (Map<String, Object>) VariableResolver.resolveTree(tree);

    List<?> values = (List<?>) resolved.get("${" + PROPERTY + "}");
    assertEquals(Arrays.<Object>asList("v", 3, true), values);
  }
}

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
package org.apache.calcite.adapter.phenotype.context;

import org.apache.calcite.adapter.phenotype.ConfigurationException;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for TableContext, SeriesContext and AliasMap parsing.
 */
@Tag("unit")
public class TableContextTest {

  private static Map<String, Object> series(Object identifier, Object dataContext) {
    Map<String, Object> map = new LinkedHashMap<String, Object>();
    map.put("identifier", identifier);
    map.put("data_context", dataContext);
    return map;
  }

  @Test void testFromMap() {
    Map<String, Object> sex = series("sex", "subject_sex");
    Map<String, Object> aliases = new LinkedHashMap<String, Object>();
    aliases.put("M", "Male");
    aliases.put("F", "Female");
    Map<String, Object> aliasMap = new HashMap<String, Object>();
    aliasMap.put("mappings", aliases);
    aliasMap.put("output_data_type", "string");
    sex.put("alias_map", aliasMap);

    Map<String, Object> onsetContext = new HashMap<String, Object>();
    onsetContext.put("onset", "age");
    Map<String, Object> onset = series("onset_age", onsetContext);
    onset.put("building_block_id", "hpo_block");
    onset.put("optional", true);

    List<Object> contexts = new ArrayList<Object>();
    contexts.add(series("patient_id", "subject_id"));
    contexts.add(sex);
    contexts.add(onset);
    Map<String, Object> map = new HashMap<String, Object>();
    map.put("name", "patients");
    map.put("contexts", contexts);

    TableContext table = TableContext.fromMap(map);

    assertEquals("patients", table.getName());
    assertEquals(3, table.getSeriesContexts().size());
    assertEquals(Context.SUBJECT_ID, table.getSubjectIdContext().getDataContext());
    SeriesContext sexContext = table.getSeriesContexts().get(1);
    assertEquals("Male", sexContext.getAliasMap().apply("M"));
    assertFalse(sexContext.hasBuildingBlock());
    List<SeriesContext> block = table.getBuildingBlock("hpo_block");
    assertEquals(1, block.size());
    assertTrue(block.get(0).isOptional());
    assertTrue(block.get(0).getDataContext().isAge());
  }

  @Test void testExactlyOneSubjectId() {
    SeriesContext sex = SeriesContext.builder()
        .identifier(Identifier.exact("sex"))
        .dataContext(Context.SUBJECT_SEX)
        .build();
    assertThrows(ConfigurationException.class,
        () -> TableContext.builder().name("t").seriesContext(sex).build());

    SeriesContext id = SeriesContext.builder()
        .identifier(Identifier.exact("id"))
        .dataContext(Context.SUBJECT_ID)
        .build();
    SeriesContext otherId = SeriesContext.builder()
        .identifier(Identifier.exact("other"))
        .dataContext(Context.SUBJECT_ID)
        .build();
    assertThrows(ConfigurationException.class,
        () -> TableContext.builder().name("t").seriesContext(id).seriesContext(otherId).build());
  }

  @Test void testDuplicateIdentifierRejected() {
    SeriesContext id = SeriesContext.builder()
        .identifier(Identifier.exact("id"))
        .dataContext(Context.SUBJECT_ID)
        .build();
    SeriesContext again = id.toBuilder().dataContext(Context.SUBJECT_SEX).build();

    assertThrows(ConfigurationException.class,
        () -> TableContext.builder().name("t").seriesContext(id).seriesContext(again).build());
  }

  @Test void testSeriesRequiresIdentifier() {
    assertThrows(ConfigurationException.class,
        () -> SeriesContext.fromMap(new HashMap<String, Object>()));
    assertThrows(ConfigurationException.class, () -> SeriesContext.builder().build());
  }

  @Test void testAliasMapApply() {
    AliasMap aliasMap = AliasMap.builder()
        .alias("1", "true")
        .alias("0", "false")
        .alias("?", null)
        .outputDataType(OutputDataType.BOOLEAN)
        .build();

    assertEquals(Boolean.TRUE, aliasMap.apply(1L));
    assertEquals(Boolean.FALSE, aliasMap.apply("0"));
    assertNull(aliasMap.apply("?"));
    assertNull(aliasMap.apply(null));
    assertThrows(IllegalArgumentException.class, () -> aliasMap.apply("maybe"));
  }

  @Test void testAliasMapFromMap() {
    Map<String, Object> mappings = new LinkedHashMap<String, Object>();
    mappings.put("1.0", 3);
    mappings.put("unknown", "null");
    Map<String, Object> map = new HashMap<String, Object>();
    map.put("hash_map", mappings);
    map.put("output_dtype", "int");

    AliasMap aliasMap = AliasMap.fromMap(map);

    assertEquals(OutputDataType.INT, aliasMap.getOutputDataType());
    assertEquals(3L, aliasMap.apply("1.0"));
    assertNull(aliasMap.apply("unknown"));
    assertEquals(7L, aliasMap.apply("7"));

    Map<String, Object> nested = new HashMap<String, Object>();
    nested.put("mappings", Arrays.asList("a", "b"));
    assertThrows(ConfigurationException.class, () -> AliasMap.fromMap(nested));
  }

  @Test void testAliasMapEquality() {
    Map<String, Object> mappings = new LinkedHashMap<String, Object>();
    mappings.put("M", "Male");
    Map<String, Object> map = new HashMap<String, Object>();
    map.put("hash_map", mappings);
    map.put("output_dtype", "string");
    AliasMap built = AliasMap.builder().alias("M", "Male").build();

    assertEquals(built, AliasMap.fromMap(map));
    assertEquals(built.hashCode(), AliasMap.fromMap(map).hashCode());
    assertNotEquals(built, AliasMap.builder().alias("M", "Man").build());
    assertNotEquals(built,
        AliasMap.builder().alias("M", "Male").outputDataType(OutputDataType.BOOLEAN).build());
  }
}

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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Binds an {@link Identifier} to the meaning of the selected columns.
 *
 * <p>The header context describes what the column header itself denotes (for
 * example an HPO term whose presence the cells record); the data context
 * describes the cell values. Optional settings:
 * <ul>
 *   <li>{@code fill_missing} - value substituted for null or blank cells</li>
 *   <li>{@code alias_map} - literal rewrite plus output type, see
 *       {@link AliasMap}</li>
 *   <li>{@code building_block_id} - groups series of one row into a single
 *       sub-record; series without it attach to the subject directly</li>
 *   <li>{@code optional} - the identifier may select no column; inside a
 *       building block the series may also be null</li>
 * </ul>
 *
 * <p>Instances use identity equality: two declarations with equal settings
 * are still two separate series.
 *
 * <h3>YAML Configuration Example</h3>
 * <pre>{@code
 * - identifier: disease_id
 *   data_context: disease_label_or_id
 *   building_block_id: finding
 * - identifier: "hp_.*"
 *   header_context: hpo_label_or_id
 *   data_context: observation_status
 * }</pre>
 */
public final class SeriesContext {

  private final Identifier identifier;
  private final Context headerContext;
  private final Context dataContext;
  private final @Nullable Object fillMissing;
  private final @Nullable AliasMap aliasMap;
  private final @Nullable String buildingBlockId;
  private final boolean optional;

  private SeriesContext(Builder builder) {
    this.identifier = builder.identifier;
    this.headerContext = builder.headerContext;
    this.dataContext = builder.dataContext;
    this.fillMissing = builder.fillMissing;
    this.aliasMap = builder.aliasMap;
    this.buildingBlockId = builder.buildingBlockId;
    this.optional = builder.optional;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates a SeriesContext from a YAML/JSON map.
   */
  @SuppressWarnings("unchecked")
  public static SeriesContext fromMap(Map<String, Object> map) {
    if (map == null) {
      return null;
    }
    Builder builder = builder();
    Object identifierObj = map.get("identifier");
    if (identifierObj == null) {
      throw new ConfigurationException("Series context requires an identifier: " + map);
    }
    builder.identifier(Identifier.fromConfig(identifierObj));
    builder.headerContext(Context.fromConfig(map.get("header_context")));
    builder.dataContext(Context.fromConfig(map.get("data_context")));
    builder.fillMissing(map.get("fill_missing"));

    Object aliasObj = map.get("alias_map");
    if (aliasObj instanceof Map) {
      builder.aliasMap(AliasMap.fromMap((Map<String, Object>) aliasObj));
    } else if (aliasObj != null) {
      throw new ConfigurationException("alias_map must be a map: " + aliasObj);
    }

    Object blockObj = map.get("building_block_id");
    if (blockObj != null) {
      builder.buildingBlockId(String.valueOf(blockObj));
    }
    Object optionalObj = map.get("optional");
    if (optionalObj instanceof Boolean) {
      builder.optional((Boolean) optionalObj);
    }
    return builder.build();
  }

  /**
   * Parses a list of series context maps.
   */
  @SuppressWarnings("unchecked")
  public static List<SeriesContext> fromList(List<?> list) {
    List<SeriesContext> result = new ArrayList<SeriesContext>();
    if (list == null) {
      return result;
    }
    for (Object item : list) {
      if (!(item instanceof Map)) {
        throw new ConfigurationException("Series context must be a map: " + item);
      }
      result.add(fromMap((Map<String, Object>) item));
    }
    return result;
  }

  public Identifier getIdentifier() {
    return identifier;
  }

  public Context getHeaderContext() {
    return headerContext;
  }

  public Context getDataContext() {
    return dataContext;
  }

  public @Nullable Object getFillMissing() {
    return fillMissing;
  }

  public @Nullable AliasMap getAliasMap() {
    return aliasMap;
  }

  public @Nullable String getBuildingBlockId() {
    return buildingBlockId;
  }

  public boolean isOptional() {
    return optional;
  }

  /**
   * Returns whether this series belongs to a building block.
   */
  public boolean hasBuildingBlock() {
    return buildingBlockId != null && !buildingBlockId.isEmpty();
  }

  /**
   * Returns a builder preset with this series' settings.
   */
  public Builder toBuilder() {
    return builder()
        .identifier(identifier)
        .headerContext(headerContext)
        .dataContext(dataContext)
        .fillMissing(fillMissing)
        .aliasMap(aliasMap)
        .buildingBlockId(buildingBlockId)
        .optional(optional);
  }

  @Override public String toString() {
    return "SeriesContext{identifier=" + identifier + ", header=" + headerContext
        + ", data=" + dataContext
        + (buildingBlockId != null ? ", block=" + buildingBlockId : "") + "}";
  }

  /**
   * Builder for {@link SeriesContext}.
   */
  public static class Builder {
    private Identifier identifier;
    private Context headerContext = Context.NONE;
    private Context dataContext = Context.NONE;
    private Object fillMissing;
    private AliasMap aliasMap;
    private String buildingBlockId;
    private boolean optional;

    public Builder identifier(Identifier identifier) {
      this.identifier = identifier;
      return this;
    }

    public Builder headerContext(Context headerContext) {
      this.headerContext = headerContext;
      return this;
    }

    public Builder dataContext(Context dataContext) {
      this.dataContext = dataContext;
      return this;
    }

    public Builder fillMissing(@Nullable Object fillMissing) {
      this.fillMissing = fillMissing;
      return this;
    }

    public Builder aliasMap(@Nullable AliasMap aliasMap) {
      this.aliasMap = aliasMap;
      return this;
    }

    public Builder buildingBlockId(@Nullable String buildingBlockId) {
      this.buildingBlockId = buildingBlockId;
      return this;
    }

    public Builder optional(boolean optional) {
      this.optional = optional;
      return this;
    }

    public SeriesContext build() {
      if (identifier == null) {
        throw new ConfigurationException("Series context identifier is required");
      }
      if (headerContext == null || dataContext == null) {
        throw new ConfigurationException("Series context " + identifier
            + " has a null context; use Context.NONE");
      }
      return new SeriesContext(this);
    }
  }
}

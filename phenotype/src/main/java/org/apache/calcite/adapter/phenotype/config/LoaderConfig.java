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

import org.apache.calcite.adapter.phenotype.ConfigurationException;

import java.util.Map;

/**
 * Declaration of where finished records go.
 *
 * <h3>YAML Configuration Example</h3>
 * <pre>{@code
 * loader:
 *   file_system:
 *     output_dir: ./out
 *     create_dir: true
 * }</pre>
 */
public final class LoaderConfig {

  /**
   * Supported loader types.
   */
  public enum Type {
    FILE_SYSTEM
  }

  private final Type type;
  private final String outputDir;
  private final boolean createDir;

  private LoaderConfig(Type type, String outputDir, boolean createDir) {
    this.type = type;
    this.outputDir = outputDir;
    this.createDir = createDir;
  }

  public static LoaderConfig fileSystem(String outputDir, boolean createDir) {
    if (outputDir == null || outputDir.trim().isEmpty()) {
      throw new ConfigurationException("File system loader requires an 'output_dir'");
    }
    return new LoaderConfig(Type.FILE_SYSTEM, outputDir, createDir);
  }

  @SuppressWarnings("unchecked")
  public static LoaderConfig fromMap(Map<String, Object> map) {
    if (map == null || map.size() != 1) {
      throw new ConfigurationException("Loader config must name exactly one loader: " + map);
    }
    Map.Entry<String, Object> entry = map.entrySet().iterator().next();
    if (!"file_system".equals(entry.getKey())) {
      throw new ConfigurationException("Unknown loader: " + entry.getKey());
    }
    if (!(entry.getValue() instanceof Map)) {
      throw new ConfigurationException("Loader 'file_system' requires output_dir and create_dir");
    }
    Map<String, Object> options = (Map<String, Object>) entry.getValue();
    Object outputDir = options.get("output_dir");
    return fileSystem(outputDir == null ? null : String.valueOf(outputDir),
        ExtractionConfig.flag(options, "create_dir", false));
  }

  public Type getType() {
    return type;
  }

  public String getOutputDir() {
    return outputDir;
  }

  public boolean isCreateDir() {
    return createDir;
  }

  @Override public String toString() {
    return "LoaderConfig{type=" + type + ", outputDir='" + outputDir + "', createDir="
        + createDir + "}";
  }
}

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

import org.apache.calcite.adapter.phenotype.collect.SubjectRecord;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.List;

/**
 * Writes each subject record as a pretty-printed JSON file named after its
 * subject id, for example {@code P001.json}.
 *
 * <p>Characters outside {@code [A-Za-z0-9._-]} in the subject id are replaced
 * by {@code _} in the file name. Existing files are overwritten.
 *
 * <h3>YAML Configuration Example</h3>
 * <pre>{@code
 * loader:
 *   file_system:
 *     output_dir: ./out
 *     create_dir: true
 * }</pre>
 */
public class FileSystemLoader implements Loader {

  private static final Logger LOGGER = LoggerFactory.getLogger(FileSystemLoader.class);

  private final File outputDir;
  private final boolean createDir;
  private final ObjectWriter writer;

  public FileSystemLoader(File outputDir, boolean createDir) {
    this.outputDir = outputDir;
    this.createDir = createDir;
    this.writer = new ObjectMapper().writerWithDefaultPrettyPrinter();
  }

  @Override public void load(List<SubjectRecord> records) throws LoadException {
    if (records.isEmpty()) {
      return;
    }
    if (!outputDir.isDirectory()) {
      if (!createDir) {
        throw new LoadException("Output directory does not exist: " + outputDir);
      }
      if (!outputDir.mkdirs() && !outputDir.isDirectory()) {
        throw new LoadException("Cannot create output directory: " + outputDir);
      }
    }
    for (SubjectRecord record : records) {
      File target = new File(outputDir, fileName(record.getSubjectId()));
      try {
        writer.writeValue(target, record.toMap());
      } catch (IOException e) {
        throw new LoadException("Cannot store record of subject '" + record.getSubjectId()
            + "' in " + target, e);
      }
      LOGGER.debug("Wrote {}", target);
    }
    LOGGER.info("Stored {} records in {}", records.size(), outputDir);
  }

  static String fileName(String subjectId) {
    return subjectId.replaceAll("[^A-Za-z0-9._-]", "_") + ".json";
  }

  public File getOutputDir() {
    return outputDir;
  }

  @Override public String getType() {
    return "file_system";
  }

  @Override public String toString() {
    return "FileSystemLoader{outputDir=" + outputDir + ", createDir=" + createDir + "}";
  }
}

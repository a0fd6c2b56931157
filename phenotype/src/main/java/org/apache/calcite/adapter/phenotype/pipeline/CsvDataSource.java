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

import org.apache.calcite.adapter.phenotype.ConfigurationException;
import org.apache.calcite.adapter.phenotype.config.ExtractionConfig;
import org.apache.calcite.adapter.phenotype.context.TableContext;
import org.apache.calcite.adapter.phenotype.table.DataTable;

import com.opencsv.CSVParserBuilder;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Reads one delimited text file as one table.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * DataSource source = CsvDataSource.builder()
 *     .file(new File("patients.csv"))
 *     .separator(';')
 *     .extraction(new ExtractionConfig("patients", true, false))
 *     .tableContext(patientsContext)
 *     .build();
 * }</pre>
 */
public class CsvDataSource implements DataSource {

  private static final Logger LOGGER = LoggerFactory.getLogger(CsvDataSource.class);

  private final File file;
  private final char separator;
  private final ExtractionConfig extraction;
  private final TableContext tableContext;

  private CsvDataSource(Builder builder) {
    this.file = builder.file;
    this.separator = builder.separator;
    this.extraction = builder.extraction;
    this.tableContext = builder.tableContext;
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override public String getId() {
    return file.getPath();
  }

  @Override public String getType() {
    return "csv";
  }

  public char getSeparator() {
    return separator;
  }

  @Override public List<SourceTable> extract() throws IOException {
    List<List<Object>> grid = new ArrayList<List<Object>>();
    try (Reader reader = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8);
         CSVReader csv = new CSVReaderBuilder(reader)
             .withCSVParser(new CSVParserBuilder().withSeparator(separator).build())
             .build()) {
      for (String[] line : csv.readAll()) {
        grid.add(new ArrayList<Object>(Arrays.asList((Object[]) line)));
      }
    } catch (CsvException e) {
      throw new IOException("Error reading CSV file " + file + " at line " + e.getLineNumber(), e);
    }
    DataTable data;
    try {
      data = Grids.toDataTable(tableContext.getName(), grid, extraction);
    } catch (IllegalArgumentException e) {
      throw new IOException("Malformed CSV file " + file + ": " + e.getMessage(), e);
    }
    LOGGER.info("Read {} rows and {} columns from {}", data.getRowCount(),
        data.getColumnNames().size(), file);
    return Collections.singletonList(new SourceTable(data, tableContext));
  }

  @Override public String toString() {
    return "CsvDataSource{file=" + file + ", separator='" + separator + "'}";
  }

  /**
   * Builder for CsvDataSource.
   */
  public static class Builder {
    private File file;
    private char separator = ',';
    private ExtractionConfig extraction;
    private TableContext tableContext;

    public Builder file(File file) {
      this.file = file;
      return this;
    }

    public Builder separator(char separator) {
      this.separator = separator;
      return this;
    }

    public Builder extraction(ExtractionConfig extraction) {
      this.extraction = extraction;
      return this;
    }

    public Builder tableContext(TableContext tableContext) {
      this.tableContext = tableContext;
      return this;
    }

    public CsvDataSource build() {
      if (file == null) {
        throw new ConfigurationException("CSV data source requires a file");
      }
      if (tableContext == null) {
        throw new ConfigurationException("CSV data source " + file + " requires a table context");
      }
      if (extraction == null) {
        extraction = ExtractionConfig.of(tableContext.getName());
      }
      return new CsvDataSource(this);
    }
  }
}

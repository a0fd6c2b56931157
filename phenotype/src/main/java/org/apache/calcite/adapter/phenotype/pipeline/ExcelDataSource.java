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

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Reads selected sheets of an Excel workbook, one table per sheet.
 *
 * <p>Each sheet is looked up by the name of its {@link ExtractionConfig} and
 * paired with a table context of the same name.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * DataSource source = ExcelDataSource.builder()
 *     .file(new File("cohort.xlsx"))
 *     .sheet(ExtractionConfig.of("patients"), patientsContext)
 *     .sheet(new ExtractionConfig("labs", true, false), labsContext)
 *     .build();
 * }</pre>
 */
public class ExcelDataSource implements DataSource {

  private static final Logger LOGGER = LoggerFactory.getLogger(ExcelDataSource.class);

  private final File file;
  private final List<ExtractionConfig> extractions;
  private final List<TableContext> tableContexts;

  private ExcelDataSource(Builder builder) {
    this.file = builder.file;
    this.extractions = Collections.unmodifiableList(
        new ArrayList<ExtractionConfig>(builder.extractions));
    this.tableContexts = Collections.unmodifiableList(
        new ArrayList<TableContext>(builder.tableContexts));
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override public String getId() {
    return file.getPath();
  }

  @Override public String getType() {
    return "excel";
  }

  @Override public List<SourceTable> extract() throws IOException {
    List<SourceTable> tables = new ArrayList<SourceTable>();
    try (InputStream is = Files.newInputStream(file.toPath());
         Workbook workbook = WorkbookFactory.create(is)) {
      for (int i = 0; i < extractions.size(); i++) {
        ExtractionConfig extraction = extractions.get(i);
        Sheet sheet = workbook.getSheet(extraction.getName());
        if (sheet == null) {
          throw new IOException("Sheet not found in " + file + ": " + extraction.getName());
        }
        DataTable data;
        try {
          data = Grids.toDataTable(extraction.getName(), readGrid(sheet), extraction);
        } catch (IllegalArgumentException e) {
          throw new IOException("Malformed sheet '" + extraction.getName() + "' in " + file
              + ": " + e.getMessage(), e);
        }
        LOGGER.info("Read {} rows from Excel sheet '{}'", data.getRowCount(),
            sheet.getSheetName());
        tables.add(new SourceTable(data, tableContexts.get(i)));
      }
    }
    return tables;
  }

  private static List<List<Object>> readGrid(Sheet sheet) {
    List<List<Object>> grid = new ArrayList<List<Object>>();
    for (int r = sheet.getFirstRowNum(); r >= 0 && r <= sheet.getLastRowNum(); r++) {
      Row row = sheet.getRow(r);
      List<Object> values = new ArrayList<Object>();
      if (row != null) {
        for (int c = 0; c < row.getLastCellNum(); c++) {
          values.add(getCellValue(row.getCell(c)));
        }
      }
      grid.add(values);
    }
    return grid;
  }

  /**
   * Converts a cell to a Java value. Whole numbers become {@code Long}, dates
   * become ISO-8601 text. Formula cells yield their cached result, converted
   * the same way.
   */
  static @Nullable Object getCellValue(@Nullable Cell cell) {
    if (cell == null) {
      return null;
    }
    switch (cell.getCellType()) {
      case STRING:
        return cell.getStringCellValue();
      case NUMERIC:
        return getNumericValue(cell);
      case BOOLEAN:
        return cell.getBooleanCellValue();
      case FORMULA:
        switch (cell.getCachedFormulaResultType()) {
          case NUMERIC:
            return getNumericValue(cell);
          case BOOLEAN:
            return cell.getBooleanCellValue();
          case STRING:
            return cell.getStringCellValue();
          default:
            return null;
        }
      default:
        return null;
    }
  }

  private static Object getNumericValue(Cell cell) {
    if (DateUtil.isCellDateFormatted(cell)) {
      LocalDateTime dateTime = cell.getLocalDateTimeCellValue();
      return LocalTime.MIDNIGHT.equals(dateTime.toLocalTime())
          ? dateTime.toLocalDate().toString()
          : dateTime.toString();
    }
    double num = cell.getNumericCellValue();
    if (num == Math.floor(num) && !Double.isInfinite(num)) {
      return (long) num;
    }
    return num;
  }

  @Override public String toString() {
    return "ExcelDataSource{file=" + file + ", sheets=" + extractions.size() + "}";
  }

  /**
   * Builder for ExcelDataSource.
   */
  public static class Builder {
    private File file;
    private final List<ExtractionConfig> extractions = new ArrayList<ExtractionConfig>();
    private final List<TableContext> tableContexts = new ArrayList<TableContext>();

    public Builder file(File file) {
      this.file = file;
      return this;
    }

    public Builder sheet(ExtractionConfig extraction, TableContext tableContext) {
      this.extractions.add(extraction);
      this.tableContexts.add(tableContext);
      return this;
    }

    public ExcelDataSource build() {
      if (file == null) {
        throw new ConfigurationException("Excel data source requires a file");
      }
      if (extractions.isEmpty()) {
        throw new ConfigurationException("Excel data source " + file + " declares no sheets");
      }
      for (int i = 0; i < extractions.size(); i++) {
        String sheet = extractions.get(i).getName();
        if (!sheet.equals(tableContexts.get(i).getName())) {
          throw new ConfigurationException("Sheet '" + sheet + "' has no table context named '"
              + sheet + "'; found '" + tableContexts.get(i).getName() + "'");
        }
      }
      return new ExcelDataSource(this);
    }
  }
}

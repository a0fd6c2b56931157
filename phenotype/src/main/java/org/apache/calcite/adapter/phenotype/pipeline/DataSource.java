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

import java.io.IOException;
import java.util.List;

/**
 * A source of raw tables together with their declared contexts.
 *
 * <p>Implementations return freshly read tables on every call to
 * {@link #extract()}; the pipeline mutates them.
 *
 * <h3>Implementations</h3>
 * <ul>
 *   <li>{@link CsvDataSource}: one delimited file, one table</li>
 *   <li>{@link ExcelDataSource}: one workbook, one table per sheet</li>
 *   <li>{@link InMemoryDataSource}: tables built in code</li>
 * </ul>
 */
public interface DataSource {

  /**
   * Returns the identity of this source, recorded as the provenance of every
   * value it contributes.
   */
  String getId();

  /**
   * Returns the source type identifier, such as "csv" or "excel".
   */
  String getType();

  /**
   * Reads all tables of this source.
   *
   * @throws IOException If the underlying data cannot be read
   */
  List<SourceTable> extract() throws IOException;

  /**
   * Closes resources associated with this data source.
   */
  default void close() throws IOException {
    // Default: no-op
  }
}

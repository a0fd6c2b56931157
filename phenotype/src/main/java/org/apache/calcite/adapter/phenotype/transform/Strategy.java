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

import org.apache.calcite.adapter.phenotype.Diagnostics;
import org.apache.calcite.adapter.phenotype.table.ContextualizedTable;

/**
 * One named step of a {@link StrategyPipeline}.
 *
 * <p>A strategy rewrites a tagged table in place. Problems with individual
 * cells are added to the diagnostics and the cell is nulled or left flagged;
 * only structural problems that make the whole table unusable throw.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * public class UpperCaseIds implements Strategy {
 *   public String getName() {
 *     return "upper_case_ids";
 *   }
 *
 *   public void transform(ContextualizedTable table, Diagnostics diagnostics) {
 *     for (String column : table.getColumns(Context.NONE, Context.SUBJECT_ID)) {
 *       for (int row = 0; row < table.getRowCount(); row++) {
 *         Object id = table.getValue(row, column);
 *         if (id != null) {
 *           table.setValue(row, column, id.toString().toUpperCase());
 *         }
 *       }
 *     }
 *   }
 * }
 * }</pre>
 */
public interface Strategy {

  /**
   * Returns the name used in configuration and log messages.
   */
  String getName();

  /**
   * Returns whether the table has any column this strategy would touch.
   * Inapplicable strategies are skipped.
   */
  default boolean isApplicable(ContextualizedTable table) {
    return true;
  }

  /**
   * Rewrites the table.
   *
   * @param table Tagged table, modified in place
   * @param diagnostics Receives row-scoped problems
   * @throws StrategyException if the table cannot be processed at all
   */
  void transform(ContextualizedTable table, Diagnostics diagnostics) throws StrategyException;
}

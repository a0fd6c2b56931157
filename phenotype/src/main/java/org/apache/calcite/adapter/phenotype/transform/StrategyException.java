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

import org.apache.calcite.adapter.phenotype.PipelineException;

/**
 * A strategy could not process a table. Aborts the table and the run.
 */
public class StrategyException extends PipelineException {

  private static final long serialVersionUID = 1L;

  private final String strategyName;
  private final String tableName;

  public StrategyException(String strategyName, String tableName, String message) {
    super("Strategy '" + strategyName + "' failed on table '" + tableName + "': " + message);
    this.strategyName = strategyName;
    this.tableName = tableName;
  }

  public StrategyException(String strategyName, String tableName, String message,
      Throwable cause) {
    super("Strategy '" + strategyName + "' failed on table '" + tableName + "': " + message,
        cause);
    this.strategyName = strategyName;
    this.tableName = tableName;
  }

  public String getStrategyName() {
    return strategyName;
  }

  public String getTableName() {
    return tableName;
  }
}

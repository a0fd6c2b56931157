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
package org.apache.calcite.adapter.phenotype.table;

import org.apache.calcite.adapter.phenotype.PipelineException;

/**
 * Thrown when a required series context selects no column, or when the
 * subject id selects more than one.
 */
public class IdentifierMatchException extends PipelineException {

  private static final long serialVersionUID = 1L;

  private final String tableName;
  private final String identifier;

  public IdentifierMatchException(String tableName, String identifier, String message) {
    super("Table '" + tableName + "', identifier '" + identifier + "': " + message);
    this.tableName = tableName;
    this.identifier = identifier;
  }

  public String getTableName() {
    return tableName;
  }

  public String getIdentifier() {
    return identifier;
  }
}

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

import java.util.List;

/**
 * Final stage of the pipeline: stores finished subject records.
 */
public interface Loader {

  /**
   * Stores the given records.
   *
   * @throws LoadException If a record cannot be stored
   */
  void load(List<SubjectRecord> records) throws LoadException;

  /**
   * Returns the loader type identifier, such as "file_system".
   */
  String getType();
}

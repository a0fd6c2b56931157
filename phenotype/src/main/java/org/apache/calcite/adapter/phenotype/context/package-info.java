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

/**
 * Semantic tagging model: the closed set of column roles ({@link
 * org.apache.calcite.adapter.phenotype.context.Context}), the rules that
 * bind roles to physical columns ({@link
 * org.apache.calcite.adapter.phenotype.context.Identifier}, {@link
 * org.apache.calcite.adapter.phenotype.context.SeriesContext}) and the
 * declared shape of a table ({@link
 * org.apache.calcite.adapter.phenotype.context.TableContext}).
 */
package org.apache.calcite.adapter.phenotype.context;

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
package org.apache.calcite.adapter.phenotype.validation;

/**
 * Categories of problems found by lint rules.
 */
public enum ViolationType {
  /** An ontology-backed value is not a {@code PREFIX:LOCAL} identifier. */
  NOT_A_CURIE,
  /** The same phenotype term is recorded more than once. */
  DUPLICATE_PHENOTYPE,
  /** A disease named alongside a variant is not recorded as a disease. */
  DISEASE_CONSISTENCY,
  /** A field expected on every record is absent. */
  MISSING_FIELD
}

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
package org.apache.calcite.adapter.phenotype.context;

import org.apache.calcite.adapter.phenotype.ConfigurationException;

import java.util.Locale;

/**
 * Which end of a reference range a column holds.
 */
public enum Boundary {
  START,
  END;

  public static Boundary fromConfig(Object value) {
    if (value instanceof String) {
      String name = ((String) value).trim().toUpperCase(Locale.ROOT);
      if ("LOW".equals(name)) {
        return START;
      }
      if ("HIGH".equals(name)) {
        return END;
      }
      for (Boundary boundary : values()) {
        if (boundary.name().equals(name)) {
          return boundary;
        }
      }
    }
    throw new ConfigurationException("Unknown reference range boundary: " + value);
  }

  public String configName() {
    return name().toLowerCase(Locale.ROOT);
  }
}

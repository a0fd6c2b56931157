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
 * How a timed event is expressed in a column: as an age or as a date.
 */
public enum TimeElementType {
  AGE,
  DATE;

  /**
   * Parses a configuration value such as {@code "age"} or {@code "Date"}.
   *
   * @throws ConfigurationException if the value names no time element type
   */
  public static TimeElementType fromConfig(Object value) {
    if (value instanceof String) {
      String name = ((String) value).trim().toUpperCase(Locale.ROOT);
      for (TimeElementType type : values()) {
        if (type.name().equals(name)) {
          return type;
        }
      }
    }
    throw new ConfigurationException("Unknown time element type: " + value);
  }

  public String configName() {
    return name().toLowerCase(Locale.ROOT);
  }
}

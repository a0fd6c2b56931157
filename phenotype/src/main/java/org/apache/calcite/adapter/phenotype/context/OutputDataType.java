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
 * Scalar type the values of an aliased column are converted to.
 */
public enum OutputDataType {
  STRING,
  INT,
  FLOAT,
  BOOLEAN;

  /**
   * Converts a substituted value to this type.
   *
   * @param value Non-null value after alias substitution
   * @return The converted value
   * @throws IllegalArgumentException if the value cannot be represented
   */
  public Object convert(Object value) {
    switch (this) {
      case STRING:
        return value instanceof String ? value : formatScalar(value);
      case INT:
        if (value instanceof Long || value instanceof Integer) {
          return ((Number) value).longValue();
        }
        if (value instanceof Double && ((Double) value) == Math.rint((Double) value)) {
          return ((Double) value).longValue();
        }
        try {
          return Long.parseLong(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
          throw new IllegalArgumentException("Cannot convert '" + value + "' to INT", e);
        }
      case FLOAT:
        if (value instanceof Number) {
          return ((Number) value).doubleValue();
        }
        try {
          return Double.parseDouble(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
          throw new IllegalArgumentException("Cannot convert '" + value + "' to FLOAT", e);
        }
      case BOOLEAN:
        if (value instanceof Boolean) {
          return value;
        }
        String text = String.valueOf(value).trim().toLowerCase(Locale.ROOT);
        if ("true".equals(text)) {
          return Boolean.TRUE;
        }
        if ("false".equals(text)) {
          return Boolean.FALSE;
        }
        throw new IllegalArgumentException("Cannot convert '" + value + "' to BOOLEAN");
      default:
        throw new IllegalStateException("Unhandled output type: " + this);
    }
  }

  /**
   * Renders a cell scalar the way it reads in a spreadsheet, so that the
   * integral double {@code 3.0} becomes {@code "3"}.
   */
  public static String formatScalar(Object value) {
    if (value instanceof Double) {
      double d = (Double) value;
      if (d == Math.rint(d) && !Double.isInfinite(d)) {
        return String.valueOf((long) d);
      }
    }
    return String.valueOf(value);
  }

  /**
   * Parses a configuration name. {@code float64}, {@code int64} and
   * {@code bool} are accepted as aliases.
   */
  public static OutputDataType fromConfig(Object value) {
    if (value == null) {
      return STRING;
    }
    String name = String.valueOf(value).trim().toUpperCase(Locale.ROOT);
    switch (name) {
      case "STRING":
      case "STR":
        return STRING;
      case "INT":
      case "INT64":
      case "INTEGER":
        return INT;
      case "FLOAT":
      case "FLOAT64":
      case "DOUBLE":
        return FLOAT;
      case "BOOLEAN":
      case "BOOL":
        return BOOLEAN;
      default:
        throw new ConfigurationException("Unknown output data type: " + value);
    }
  }
}

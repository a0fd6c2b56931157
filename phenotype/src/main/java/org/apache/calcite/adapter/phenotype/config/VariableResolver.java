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
package org.apache.calcite.adapter.phenotype.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves {@code ${VAR}} placeholders in configuration values.
 *
 * <p>Supports the following patterns:
 * <ul>
 *   <li>{@code ${VAR_NAME}} - environment variable, then system property</li>
 *   <li>{@code ${VAR_NAME:-default}} and {@code ${VAR_NAME:default}} - with a
 *       default when neither is set</li>
 * </ul>
 * Unresolvable placeholders without a default are kept as written.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * String key = VariableResolver.resolve("${BIOPORTAL_API_KEY}");
 * String dir = VariableResolver.resolve("${PHENO_OUT:-./out}");
 * }</pre>
 */
public final class VariableResolver {

  /**
   * Matches only innermost {@code ${...}} references, so nested defaults are
   * resolved from the inside out.
   */
  private static final Pattern DOLLAR_VAR_PATTERN = Pattern.compile("\\$\\{([^{}]+)\\}");

  private static final int MAX_ITERATIONS = 10;

  private VariableResolver() {
    // Utility class
  }

  /**
   * Resolves all placeholders in a string.
   */
  public static String resolve(String template) {
    if (template == null || template.isEmpty()) {
      return template;
    }
    String current = template;
    for (int i = 0; i < MAX_ITERATIONS; i++) {
      String resolved = resolveOnce(current);
      if (resolved.equals(current)) {
        break;
      }
      current = resolved;
    }
    return current;
  }

  /**
   * Returns a copy of a parsed configuration tree with every string value
   * resolved. Map keys are left untouched.
   */
  public static Object resolveTree(Object node) {
    if (node instanceof String) {
      return resolve((String) node);
    }
    if (node instanceof Map) {
      Map<String, Object> result = new LinkedHashMap<String, Object>();
      for (Map.Entry<?, ?> entry : ((Map<?, ?>) node).entrySet()) {
        result.put(String.valueOf(entry.getKey()), resolveTree(entry.getValue()));
      }
      return result;
    }
    if (node instanceof List) {
      List<Object> result = new ArrayList<Object>();
      for (Object item : (List<?>) node) {
        result.add(resolveTree(item));
      }
      return result;
    }
    return node;
  }

  private static String resolveOnce(String template) {
    StringBuffer result = new StringBuffer();
    Matcher matcher = DOLLAR_VAR_PATTERN.matcher(template);
    while (matcher.find()) {
      String varExpr = matcher.group(1);
      String envName = varExpr;
      String defaultValue = null;
      int colonIdx = varExpr.indexOf(":-");
      if (colonIdx > 0) {
        envName = varExpr.substring(0, colonIdx);
        defaultValue = varExpr.substring(colonIdx + 2);
      } else {
        colonIdx = varExpr.indexOf(':');
        if (colonIdx > 0) {
          envName = varExpr.substring(0, colonIdx);
          defaultValue = varExpr.substring(colonIdx + 1);
        }
      }

      String resolved = lookup(envName);
      if (resolved == null) {
        resolved = defaultValue;
      }
      if (resolved == null) {
        resolved = "${" + varExpr + "}";
      }
      matcher.appendReplacement(result, Matcher.quoteReplacement(resolved));
    }
    matcher.appendTail(result);
    return result.toString();
  }

  /**
   * Returns the environment variable or, failing that, the system property of
   * the given name; null if neither is set to a non-empty value.
   */
  static String lookup(String name) {
    String value = System.getenv(name);
    if (value == null || value.isEmpty()) {
      value = System.getProperty(name);
    }
    return value == null || value.isEmpty() ? null : value;
  }
}

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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Rule that selects the physical columns a {@link SeriesContext} applies to.
 *
 * <p>Three forms are supported:
 * <ul>
 *   <li>{@link Type#EXACT} - a single column name</li>
 *   <li>{@link Type#REGEX} - every header the pattern fully matches; a pattern
 *       that is itself the name of an existing column selects only that
 *       column</li>
 *   <li>{@link Type#LIST} - the named columns, in the declared order</li>
 * </ul>
 *
 * <h3>Configuration Forms</h3>
 * <pre>{@code
 * identifier: "hpo_.*"            # regex
 * identifier: [sex, gender]       # list
 * identifier: {exact: patient_id} # exact name
 * }</pre>
 */
public final class Identifier {

  /**
   * How the identifier selects columns.
   */
  public enum Type {
    EXACT,
    REGEX,
    LIST
  }

  private final Type type;
  private final List<String> names;
  private final Pattern pattern;

  private Identifier(Type type, List<String> names, Pattern pattern) {
    this.type = type;
    this.names = names;
    this.pattern = pattern;
  }

  public static Identifier exact(String name) {
    if (name == null || name.isEmpty()) {
      throw new ConfigurationException("Exact identifier requires a column name");
    }
    return new Identifier(Type.EXACT, Collections.singletonList(name), null);
  }

  /**
   * Creates a regex identifier.
   *
   * @throws ConfigurationException if the pattern does not compile
   */
  public static Identifier regex(String regex) {
    if (regex == null || regex.isEmpty()) {
      throw new ConfigurationException("Regex identifier requires a pattern");
    }
    try {
      return new Identifier(Type.REGEX, Collections.singletonList(regex), Pattern.compile(regex));
    } catch (PatternSyntaxException e) {
      throw new ConfigurationException("Invalid identifier pattern '" + regex + "': "
          + e.getDescription(), e);
    }
  }

  public static Identifier list(List<String> names) {
    if (names == null || names.isEmpty()) {
      throw new ConfigurationException("List identifier requires at least one column name");
    }
    for (String name : names) {
      if (name == null || name.isEmpty()) {
        throw new ConfigurationException("List identifier contains an empty column name");
      }
    }
    return new Identifier(Type.LIST,
        Collections.unmodifiableList(new ArrayList<String>(names)), null);
  }

  /**
   * Parses an identifier from configuration.
   */
  public static Identifier fromConfig(Object value) {
    if (value instanceof String) {
      return regex((String) value);
    }
    if (value instanceof List) {
      List<String> names = new ArrayList<String>();
      for (Object item : (List<?>) value) {
        names.add(item == null ? null : String.valueOf(item));
      }
      return list(names);
    }
    if (value instanceof Map) {
      Map<?, ?> map = (Map<?, ?>) value;
      if (map.get("exact") != null) {
        return exact(String.valueOf(map.get("exact")));
      }
      if (map.get("regex") != null) {
        return regex(String.valueOf(map.get("regex")));
      }
      if (map.get("list") instanceof List) {
        return fromConfig(map.get("list"));
      }
    }
    throw new ConfigurationException("Cannot parse identifier from " + value);
  }

  public Type getType() {
    return type;
  }

  /**
   * Returns the configured names: the single name or pattern for exact and
   * regex identifiers, the ordered names for list identifiers.
   */
  public List<String> getNames() {
    return names;
  }

  /**
   * Selects the matching headers, in header order for regex identifiers and
   * in declared order otherwise. Names absent from the headers are skipped;
   * see {@link #missing(List)}.
   */
  public List<String> select(List<String> headers) {
    List<String> selected = new ArrayList<String>();
    switch (type) {
      case EXACT:
      case LIST:
        for (String name : names) {
          if (headers.contains(name)) {
            selected.add(name);
          }
        }
        break;
      case REGEX:
        if (headers.contains(names.get(0))) {
          selected.add(names.get(0));
          break;
        }
        for (String header : headers) {
          if (pattern.matcher(header).matches()) {
            selected.add(header);
          }
        }
        break;
      default:
        throw new IllegalStateException("Unhandled identifier type: " + type);
    }
    return selected;
  }

  /**
   * Returns the declared names that are absent from the headers. Always
   * empty for regex identifiers.
   */
  public List<String> missing(List<String> headers) {
    List<String> missing = new ArrayList<String>();
    if (type != Type.REGEX) {
      for (String name : names) {
        if (!headers.contains(name)) {
          missing.add(name);
        }
      }
    }
    return missing;
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Identifier)) {
      return false;
    }
    Identifier that = (Identifier) o;
    return type == that.type && names.equals(that.names);
  }

  @Override public int hashCode() {
    return Objects.hash(type, names);
  }

  @Override public String toString() {
    return String.join(".", names);
  }
}

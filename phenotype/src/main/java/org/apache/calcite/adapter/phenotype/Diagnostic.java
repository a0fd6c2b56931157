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
package org.apache.calcite.adapter.phenotype;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Objects;

/**
 * A row-scoped problem found while transforming or collecting data.
 *
 * <p>Diagnostics never abort a table. They are accumulated in a
 * {@link Diagnostics} report and returned alongside the successful output.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * diagnostics.add(Diagnostic.builder(Diagnostic.Kind.TYPE_COERCION)
 *     .table("patients")
 *     .column("age")
 *     .row(3)
 *     .value("forty")
 *     .message("Cannot convert 'forty' to INT")
 *     .build());
 * }</pre>
 */
public final class Diagnostic {

  /**
   * Category of a row-scoped problem.
   */
  public enum Kind {
    /** A cell could not be converted to the declared output type. */
    TYPE_COERCION,
    /** A value could not be resolved through an ontology. */
    ONTOLOGY_LOOKUP,
    /** A value is not part of a controlled vocabulary. */
    MAPPING_VIOLATION,
    /** A row has no resolvable subject identifier. */
    MISSING_SUBJECT_ID,
    /** A building block had a null required member and was dropped. */
    INCOMPLETE_BLOCK,
    /** A single-valued subject field received two different values. */
    CONFLICTING_VALUE
  }

  private final Kind kind;
  private final @Nullable String table;
  private final @Nullable String column;
  private final int row;
  private final @Nullable String value;
  private final String message;

  private Diagnostic(Builder builder) {
    this.kind = builder.kind;
    this.table = builder.table;
    this.column = builder.column;
    this.row = builder.row;
    this.value = builder.value;
    this.message = builder.message;
  }

  public static Builder builder(Kind kind) {
    return new Builder(kind);
  }

  public Kind getKind() {
    return kind;
  }

  public @Nullable String getTable() {
    return table;
  }

  public @Nullable String getColumn() {
    return column;
  }

  /**
   * Returns the zero-based row index, or -1 when the problem is not tied to
   * a single row.
   */
  public int getRow() {
    return row;
  }

  public @Nullable String getValue() {
    return value;
  }

  public String getMessage() {
    return message;
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Diagnostic)) {
      return false;
    }
    Diagnostic that = (Diagnostic) o;
    return row == that.row
        && kind == that.kind
        && Objects.equals(table, that.table)
        && Objects.equals(column, that.column)
        && Objects.equals(value, that.value)
        && message.equals(that.message);
  }

  @Override public int hashCode() {
    return Objects.hash(kind, table, column, row, value, message);
  }

  @Override public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(kind);
    if (table != null) {
      sb.append(" [table=").append(table);
      if (column != null) {
        sb.append(", column=").append(column);
      }
      if (row >= 0) {
        sb.append(", row=").append(row);
      }
      sb.append("]");
    }
    sb.append(": ").append(message);
    return sb.toString();
  }

  /**
   * Builder for {@link Diagnostic}.
   */
  public static class Builder {
    private final Kind kind;
    private String table;
    private String column;
    private int row = -1;
    private String value;
    private String message;

    private Builder(Kind kind) {
      this.kind = kind;
    }

    public Builder table(String table) {
      this.table = table;
      return this;
    }

    public Builder column(String column) {
      this.column = column;
      return this;
    }

    public Builder row(int row) {
      this.row = row;
      return this;
    }

    public Builder value(@Nullable Object value) {
      this.value = value == null ? null : String.valueOf(value);
      return this;
    }

    public Builder message(String message) {
      this.message = message;
      return this;
    }

    public Diagnostic build() {
      if (kind == null) {
        throw new IllegalArgumentException("Diagnostic kind is required");
      }
      if (message == null || message.isEmpty()) {
        throw new IllegalArgumentException("Diagnostic message is required");
      }
      return new Diagnostic(this);
    }
  }
}

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

import com.google.common.collect.ImmutableList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Accumulates row-scoped {@link Diagnostic}s.
 *
 * <p>Instances are thread-safe. The pipeline gives every table its own
 * instance and merges them, in declared table order, into the run report.
 */
public class Diagnostics {

  private static final Logger LOGGER = LoggerFactory.getLogger(Diagnostics.class);

  private final List<Diagnostic> entries = new ArrayList<Diagnostic>();

  /**
   * Records a diagnostic.
   */
  public synchronized void add(Diagnostic diagnostic) {
    LOGGER.debug("{}", diagnostic);
    entries.add(diagnostic);
  }

  /**
   * Appends every diagnostic of another report, keeping its order.
   */
  public void addAll(Diagnostics other) {
    List<Diagnostic> copy = other.getEntries();
    synchronized (this) {
      entries.addAll(copy);
    }
  }

  /**
   * Returns an immutable snapshot of the recorded diagnostics.
   */
  public synchronized List<Diagnostic> getEntries() {
    return ImmutableList.copyOf(entries);
  }

  /**
   * Returns the diagnostics of one kind.
   */
  public synchronized List<Diagnostic> getEntries(Diagnostic.Kind kind) {
    ImmutableList.Builder<Diagnostic> builder = ImmutableList.builder();
    for (Diagnostic diagnostic : entries) {
      if (diagnostic.getKind() == kind) {
        builder.add(diagnostic);
      }
    }
    return builder.build();
  }

  /**
   * Returns the number of diagnostics per kind.
   */
  public synchronized Map<Diagnostic.Kind, Integer> countByKind() {
    Map<Diagnostic.Kind, Integer> counts =
        new EnumMap<Diagnostic.Kind, Integer>(Diagnostic.Kind.class);
    for (Diagnostic diagnostic : entries) {
      Integer current = counts.get(diagnostic.getKind());
      counts.put(diagnostic.getKind(), current == null ? 1 : current + 1);
    }
    return counts;
  }

  public synchronized boolean isEmpty() {
    return entries.isEmpty();
  }

  public synchronized int size() {
    return entries.size();
  }

  @Override public synchronized String toString() {
    return "Diagnostics{count=" + entries.size() + ", byKind=" + countByKind() + "}";
  }
}

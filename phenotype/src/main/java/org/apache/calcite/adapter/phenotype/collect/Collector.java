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
package org.apache.calcite.adapter.phenotype.collect;

import org.apache.calcite.adapter.phenotype.Diagnostic;
import org.apache.calcite.adapter.phenotype.Diagnostics;
import org.apache.calcite.adapter.phenotype.context.ContextKind;
import org.apache.calcite.adapter.phenotype.context.SeriesContext;
import org.apache.calcite.adapter.phenotype.context.TableContext;
import org.apache.calcite.adapter.phenotype.table.TaggedCell;
import org.apache.calcite.adapter.phenotype.table.TaggedRow;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Folds tagged rows from any number of tables and sources into per-subject
 * records.
 *
 * <p>For each row:
 * <ol>
 *   <li>the subject is identified by the {@code subject_id} cell; a row
 *       without one is rejected with a
 *       {@link Diagnostic.Kind#MISSING_SUBJECT_ID} diagnostic</li>
 *   <li>cells of series contexts sharing a building block id become one
 *       {@link BlockRecord}, but only if every non-optional series context of
 *       the block has a non-null value; otherwise the block is dropped with an
 *       {@link Diagnostic.Kind#INCOMPLETE_BLOCK} diagnostic</li>
 *   <li>cells whose header carries a context become header observations</li>
 *   <li>the remaining non-null cells become subject-level fields</li>
 * </ol>
 *
 * <p>Aggregates live in a {@link ConcurrentHashMap} and are updated inside
 * {@link ConcurrentHashMap#compute}, so rows for the same subject are folded
 * one at a time while different subjects proceed in parallel. Repeated
 * ingestion of the same row is not detected.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * Collector collector = new Collector();
 * for (TaggedRow row : table.getRows()) {
 *   collector.ingest(row, table.getTableContext(), table.getSourceId(), diagnostics);
 * }
 * List<SubjectRecord> records = collector.finalizeRecords();
 * }</pre>
 */
public class Collector {

  private static final Logger LOGGER = LoggerFactory.getLogger(Collector.class);

  private final ConcurrentHashMap<String, SubjectAggregate> aggregates =
      new ConcurrentHashMap<String, SubjectAggregate>();

  /**
   * Folds one row into the aggregate of its subject.
   *
   * @param row Transformed, tagged row
   * @param tableContext Declared context of the row's table
   * @param sourceId Identity of the data source
   * @param diagnostics Receives row-scoped problems
   * @return false if the row was rejected for lack of a subject id
   */
  public boolean ingest(TaggedRow row, TableContext tableContext, String sourceId,
      Diagnostics diagnostics) {
    String subjectId = row.getSubjectId();
    if (subjectId == null) {
      diagnostics.add(Diagnostic.builder(Diagnostic.Kind.MISSING_SUBJECT_ID)
          .table(tableContext.getName())
          .row(row.getRowIndex())
          .message("Row has no subject id and was not collected")
          .build());
      return false;
    }

    Map<String, List<TaggedCell>> blockCells = new LinkedHashMap<String, List<TaggedCell>>();
    List<TaggedCell> subjectCells = new ArrayList<TaggedCell>();
    for (TaggedCell cell : row.getCells()) {
      SeriesContext sc = cell.getSeriesContext();
      if (sc.hasBuildingBlock()) {
        List<TaggedCell> cells = blockCells.get(sc.getBuildingBlockId());
        if (cells == null) {
          cells = new ArrayList<TaggedCell>();
          blockCells.put(sc.getBuildingBlockId(), cells);
        }
        cells.add(cell);
      } else {
        subjectCells.add(cell);
      }
    }

    List<BlockRecord> blocks = new ArrayList<BlockRecord>();
    for (Map.Entry<String, List<TaggedCell>> entry : blockCells.entrySet()) {
      BlockRecord block = assembleBlock(entry.getKey(), entry.getValue(), row, sourceId,
          subjectId, diagnostics);
      if (block != null) {
        blocks.add(block);
      }
    }

    aggregates.compute(subjectId, (id, existing) -> {
      SubjectAggregate aggregate = existing != null ? existing : new SubjectAggregate(id);
      aggregate.addSource(sourceId);
      for (TaggedCell cell : subjectCells) {
        fold(aggregate, cell, row, diagnostics);
      }
      for (BlockRecord block : blocks) {
        aggregate.addBlock(block);
      }
      return aggregate;
    });
    return true;
  }

  private static void fold(SubjectAggregate aggregate, TaggedCell cell, TaggedRow row,
      Diagnostics diagnostics) {
    if (cell.isNull()) {
      return;
    }
    if (!cell.getHeaderContext().isNone()) {
      aggregate.addHeaderValue(toValue(cell));
      return;
    }
    ContextKind kind = cell.getDataContext().getKind();
    if (kind == ContextKind.SUBJECT_ID || kind == ContextKind.NONE) {
      return;
    }
    aggregate.addField(cell.getDataContext(), cell.getValue(), row.getTableName(),
        cell.getColumn(), row.getRowIndex(), diagnostics);
  }

  private static BlockRecord assembleBlock(String blockId, List<TaggedCell> cells, TaggedRow row,
      String sourceId, String subjectId, Diagnostics diagnostics) {
    Map<SeriesContext, Boolean> present = new IdentityHashMap<SeriesContext, Boolean>();
    List<TaggedValue> values = new ArrayList<TaggedValue>();
    for (TaggedCell cell : cells) {
      Boolean seen = present.get(cell.getSeriesContext());
      present.put(cell.getSeriesContext(), (seen != null && seen) || !cell.isNull());
      if (!cell.isNull()) {
        values.add(toValue(cell));
      }
    }
    List<String> missing = new ArrayList<String>();
    for (Map.Entry<SeriesContext, Boolean> entry : present.entrySet()) {
      if (!entry.getValue() && !entry.getKey().isOptional()) {
        missing.add(entry.getKey().getIdentifier().toString());
      }
    }
    if (!missing.isEmpty() || values.isEmpty()) {
      diagnostics.add(Diagnostic.builder(Diagnostic.Kind.INCOMPLETE_BLOCK)
          .table(row.getTableName())
          .row(row.getRowIndex())
          .message("Building block '" + blockId + "' of subject '" + subjectId
              + "' dropped; no value for " + (missing.isEmpty() ? "any member" : missing))
          .build());
      return null;
    }
    return new BlockRecord(blockId, row.getTableName(), sourceId, row.getRowIndex(), values);
  }

  private static TaggedValue toValue(TaggedCell cell) {
    return new TaggedValue(cell.getColumn(), cell.getHeaderContext(), cell.getDataContext(),
        cell.getValue());
  }

  /**
   * Returns the number of subjects collected so far.
   */
  public int size() {
    return aggregates.size();
  }

  /**
   * Converts every aggregate into an immutable record, ordered by subject id,
   * and clears the collector.
   */
  public List<SubjectRecord> finalizeRecords() {
    Map<String, SubjectAggregate> sorted = new TreeMap<String, SubjectAggregate>(aggregates);
    aggregates.clear();
    List<SubjectRecord> records = new ArrayList<SubjectRecord>(sorted.size());
    for (SubjectAggregate aggregate : sorted.values()) {
      records.add(aggregate.toRecord());
    }
    LOGGER.info("Finalized {} subject records", records.size());
    return records;
  }
}

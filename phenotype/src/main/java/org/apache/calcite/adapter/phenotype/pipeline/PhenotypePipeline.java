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
package org.apache.calcite.adapter.phenotype.pipeline;

import org.apache.calcite.adapter.phenotype.Diagnostics;
import org.apache.calcite.adapter.phenotype.PipelineException;
import org.apache.calcite.adapter.phenotype.collect.Collector;
import org.apache.calcite.adapter.phenotype.collect.SubjectRecord;
import org.apache.calcite.adapter.phenotype.table.ContextMatcher;
import org.apache.calcite.adapter.phenotype.table.ContextualizedTable;
import org.apache.calcite.adapter.phenotype.table.TaggedRow;
import org.apache.calcite.adapter.phenotype.transform.StrategyPipeline;
import org.apache.calcite.adapter.phenotype.validation.LintReport;
import org.apache.calcite.adapter.phenotype.validation.RecordLinter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs data sources through extraction, context matching, transformation,
 * collection, linting and loading.
 *
 * <p>A run proceeds in phases:
 * <ol>
 *   <li>Extract - read every table of every data source</li>
 *   <li>Transform - match each table against its context and apply the
 *       strategy pipeline; tables are processed in parallel on a bounded
 *       pool</li>
 *   <li>Collect - fold the rows of every table into per-subject aggregates,
 *       in declared table order so the output does not depend on
 *       scheduling</li>
 *   <li>Finalize - turn aggregates into immutable records</li>
 *   <li>Lint - check the records, when validation is enabled</li>
 *   <li>Load - hand the records to the loader</li>
 * </ol>
 *
 * <p>Structural errors are fatal: the first table that fails matching or
 * transformation cancels the remaining work and fails the run. Row-scoped
 * problems are returned as diagnostics in the {@link PipelineResult}.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * PhenotypePipeline pipeline = PhenotypePipeline.builder()
 *     .strategyPipeline(strategies)
 *     .loader(new FileSystemLoader(new File("out"), true))
 *     .validate(true)
 *     .parallelism(4)
 *     .build();
 *
 * PipelineResult result = pipeline.run(sources);
 * System.out.println("Collected " + result.getRecords().size() + " subjects");
 * }</pre>
 *
 * @see PipelineResult
 */
public class PhenotypePipeline {

  private static final Logger LOGGER = LoggerFactory.getLogger(PhenotypePipeline.class);

  public static final int DEFAULT_PARALLELISM = 4;

  private final StrategyPipeline strategyPipeline;
  private final ContextMatcher matcher;
  private final Loader loader;
  private final RecordLinter linter;
  private final boolean validate;
  private final int parallelism;
  private final ProgressListener progressListener;

  private PhenotypePipeline(Builder builder) {
    this.strategyPipeline = builder.strategyPipeline;
    this.matcher = builder.matcher;
    this.loader = builder.loader;
    this.linter = builder.linter;
    this.validate = builder.validate;
    this.parallelism = builder.parallelism;
    this.progressListener = builder.progressListener;
  }

  public static Builder builder() {
    return new Builder();
  }

  public StrategyPipeline getStrategyPipeline() {
    return strategyPipeline;
  }

  public Loader getLoader() {
    return loader;
  }

  public boolean isValidate() {
    return validate;
  }

  public int getParallelism() {
    return parallelism;
  }

  /**
   * Runs all phases over the given data sources.
   *
   * @param sources Data sources, in the order their tables are collected
   * @return Records, diagnostics and lint report of the run
   * @throws PipelineException if extraction, matching, transformation or
   *     loading fails
   */
  public PipelineResult run(List<DataSource> sources) throws PipelineException {
    long startTime = System.currentTimeMillis();
    LOGGER.info("Starting phenotype pipeline over {} data sources", sources.size());

    LOGGER.info("Phase 1: Extracting {} data sources", sources.size());
    progressListener.onPhaseStart("extract", sources.size());
    List<PendingTable> pending = new ArrayList<PendingTable>();
    for (DataSource source : sources) {
      List<SourceTable> tables = extract(source);
      for (SourceTable table : tables) {
        pending.add(new PendingTable(source.getId(), table));
      }
    }
    progressListener.onPhaseComplete("extract", pending.size());

    LOGGER.info("Phase 2: Matching and transforming {} tables", pending.size());
    progressListener.onPhaseStart("transform", pending.size());
    List<TransformedTable> transformed = transformAll(pending);
    progressListener.onPhaseComplete("transform", transformed.size());

    LOGGER.info("Phase 3: Collecting rows of {} tables", transformed.size());
    progressListener.onPhaseStart("collect", transformed.size());
    Diagnostics diagnostics = new Diagnostics();
    Collector collector = new Collector();
    long rowCount = 0;
    long rejected = 0;
    for (TransformedTable entry : transformed) {
      diagnostics.addAll(entry.diagnostics);
      ContextualizedTable table = entry.table;
      for (TaggedRow row : table.getRows()) {
        rowCount++;
        if (!collector.ingest(row, table.getTableContext(), table.getSourceId(), diagnostics)) {
          rejected++;
        }
      }
    }
    progressListener.onPhaseComplete("collect", (int) rowCount);

    LOGGER.info("Phase 4: Finalizing {} subjects", collector.size());
    List<SubjectRecord> records = collector.finalizeRecords();

    LintReport lintReport = LintReport.empty();
    if (validate) {
      LOGGER.info("Phase 5: Linting {} records", records.size());
      progressListener.onPhaseStart("lint", records.size());
      lintReport = linter.lint(records);
      progressListener.onPhaseComplete("lint", records.size());
    }

    if (loader != null) {
      LOGGER.info("Phase 6: Loading {} records with '{}' loader", records.size(),
          loader.getType());
      progressListener.onPhaseStart("load", records.size());
      loader.load(records);
      progressListener.onPhaseComplete("load", records.size());
    }

    long elapsed = System.currentTimeMillis() - startTime;
    PipelineResult result = PipelineResult.builder()
        .records(records)
        .diagnostics(diagnostics)
        .lintReport(lintReport)
        .tableCount(transformed.size())
        .rowCount(rowCount)
        .rejectedRowCount(rejected)
        .elapsedMs(elapsed)
        .build();
    LOGGER.info("Phenotype pipeline complete: {}", result);
    return result;
  }

  /**
   * Matches and transforms every table, returning them in input order. The
   * first failure cancels the tables still running.
   */
  private List<TransformedTable> transformAll(List<PendingTable> pending)
      throws PipelineException {
    List<TransformedTable> results = new ArrayList<TransformedTable>(pending.size());
    if (pending.isEmpty()) {
      return results;
    }
    int threads = Math.max(1, Math.min(parallelism, pending.size()));
    ExecutorService executor = Executors.newFixedThreadPool(threads);
    try {
      CompletionService<TransformedTable> completion =
          new ExecutorCompletionService<TransformedTable>(executor);
      Map<Future<TransformedTable>, Integer> positions =
          new HashMap<Future<TransformedTable>, Integer>();
      for (int i = 0; i < pending.size(); i++) {
        final PendingTable table = pending.get(i);
        positions.put(completion.submit(new Callable<TransformedTable>() {
          @Override public TransformedTable call() throws PipelineException {
            return transform(table);
          }
        }), i);
      }
      TransformedTable[] ordered = new TransformedTable[pending.size()];
      for (int done = 0; done < pending.size(); done++) {
        Future<TransformedTable> future = completion.take();
        TransformedTable result = future.get();
        ordered[positions.get(future)] = result;
        progressListener.onTableComplete(result.table.getName(), result.table.getRowCount(), null);
      }
      for (TransformedTable table : ordered) {
        results.add(table);
      }
      return results;
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof PipelineException) {
        LOGGER.error("Table processing failed: {}", cause.getMessage());
        throw (PipelineException) cause;
      }
      throw new PipelineException("Table processing failed: " + cause, cause);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new PipelineException("Interrupted while transforming tables", e);
    } finally {
      executor.shutdownNow();
    }
  }

  private TransformedTable transform(PendingTable pending) throws PipelineException {
    Diagnostics diagnostics = new Diagnostics();
    SourceTable source = pending.table;
    ContextualizedTable table;
    try {
      table = matcher.match(source.getData(), source.getTableContext(), pending.sourceId);
      strategyPipeline.apply(table, diagnostics);
    } catch (PipelineException e) {
      progressListener.onTableComplete(source.getTableContext().getName(), 0, e);
      throw e;
    }
    return new TransformedTable(table, diagnostics);
  }

  /** Extracted table awaiting transformation. */
  /**
   * Reads a source and closes it, whether or not reading succeeded.
   */
  private static List<SourceTable> extract(DataSource source) throws PipelineException {
    List<SourceTable> tables;
    try {
      tables = source.extract();
    } catch (IOException e) {
      LOGGER.error("Extraction of data source '{}' failed: {}", source.getId(), e.getMessage());
      PipelineException failure =
          new PipelineException("Failed to extract data source '" + source.getId() + "'", e);
      try {
        source.close();
      } catch (IOException closeError) {
        failure.addSuppressed(closeError);
      }
      throw failure;
    }
    try {
      source.close();
    } catch (IOException e) {
      throw new PipelineException("Failed to close data source '" + source.getId() + "'", e);
    }
    return tables;
  }

  private static final class PendingTable {
    final String sourceId;
    final SourceTable table;

    PendingTable(String sourceId, SourceTable table) {
      this.sourceId = sourceId;
      this.table = table;
    }
  }

  /** Transformed table with the diagnostics raised while transforming it. */
  private static final class TransformedTable {
    final ContextualizedTable table;
    final Diagnostics diagnostics;

    TransformedTable(ContextualizedTable table, Diagnostics diagnostics) {
      this.table = table;
      this.diagnostics = diagnostics;
    }
  }

  /**
   * Listener for pipeline progress updates.
   */
  public interface ProgressListener {
    /**
     * Called when a phase starts.
     *
     * @param phase Phase name
     * @param totalItems Total items in this phase
     */
    void onPhaseStart(String phase, int totalItems);

    /**
     * Called when a phase completes.
     *
     * @param phase Phase name
     * @param processedItems Number of items processed
     */
    void onPhaseComplete(String phase, int processedItems);

    /**
     * Called when a table has been matched and transformed, or has failed.
     *
     * @param tableName Table name
     * @param rowCount Rows in the table
     * @param error Error if the table failed, null otherwise
     */
    void onTableComplete(String tableName, int rowCount, Exception error);
  }

  /**
   * Default progress listener that logs to SLF4J.
   */
  public static class LoggingProgressListener implements ProgressListener {
    private static final Logger LOG = LoggerFactory.getLogger(LoggingProgressListener.class);

    @Override public void onPhaseStart(String phase, int totalItems) {
      LOG.debug("Starting phase '{}' with {} items", phase, totalItems);
    }

    @Override public void onPhaseComplete(String phase, int processedItems) {
      LOG.debug("Completed phase '{}': {} items processed", phase, processedItems);
    }

    @Override public void onTableComplete(String tableName, int rowCount, Exception error) {
      if (error != null) {
        LOG.warn("Table '{}' failed: {}", tableName, error.getMessage());
      } else {
        LOG.debug("Table '{}' complete: {} rows", tableName, rowCount);
      }
    }
  }

  /**
   * Builder for PhenotypePipeline.
   */
  public static class Builder {
    private StrategyPipeline strategyPipeline = StrategyPipeline.empty();
    private ContextMatcher matcher = new ContextMatcher();
    private Loader loader;
    private RecordLinter linter;
    private boolean validate;
    private int parallelism = DEFAULT_PARALLELISM;
    private ProgressListener progressListener = new LoggingProgressListener();

    public Builder strategyPipeline(StrategyPipeline strategyPipeline) {
      this.strategyPipeline = strategyPipeline;
      return this;
    }

    public Builder matcher(ContextMatcher matcher) {
      this.matcher = matcher;
      return this;
    }

    public Builder loader(Loader loader) {
      this.loader = loader;
      return this;
    }

    public Builder linter(RecordLinter linter) {
      this.linter = linter;
      return this;
    }

    public Builder validate(boolean validate) {
      this.validate = validate;
      return this;
    }

    public Builder parallelism(int parallelism) {
      this.parallelism = parallelism;
      return this;
    }

    public Builder progressListener(ProgressListener progressListener) {
      this.progressListener = progressListener;
      return this;
    }

    public PhenotypePipeline build() {
      if (strategyPipeline == null) {
        throw new IllegalStateException("Strategy pipeline is required");
      }
      if (parallelism < 1) {
        throw new IllegalStateException("Parallelism must be at least 1, got " + parallelism);
      }
      if (validate && linter == null) {
        linter = RecordLinter.withDefaultRules();
      }
      return new PhenotypePipeline(this);
    }
  }
}

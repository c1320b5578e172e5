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
package org.opendata.harvest;

import org.opendata.harvest.config.DatasetDescriptor;
import org.opendata.harvest.config.FetchMode;
import org.opendata.harvest.config.HarvestConfig;
import org.opendata.harvest.engine.DownloadResult;
import org.opendata.harvest.engine.FetchPlan;
import org.opendata.harvest.engine.JsonLinesPageSink;
import org.opendata.harvest.engine.MultiDatasetProgress;
import org.opendata.harvest.engine.PageSink;
import org.opendata.harvest.engine.ParallelDownloadEngine;
import org.opendata.harvest.engine.ParquetPageSink;
import org.opendata.harvest.engine.ProgressTracker;
import org.opendata.harvest.engine.StagedBatch;
import org.opendata.harvest.http.BulkExportFetcher;
import org.opendata.harvest.http.CountEstimator;
import org.opendata.harvest.http.PageFetcher;
import org.opendata.harvest.http.QueryClauses;
import org.opendata.harvest.http.RetryPolicy;
import org.opendata.harvest.http.SessionManager;
import org.opendata.harvest.http.Sleeper;
import org.opendata.harvest.merge.MergeEngine;
import org.opendata.harvest.merge.MergeResult;
import org.opendata.harvest.merge.SchemaDriftException;
import org.opendata.harvest.rate.RateController;
import org.opendata.harvest.watermark.JsonWatermarkStore;
import org.opendata.harvest.watermark.Watermark;
import org.opendata.harvest.watermark.WatermarkStore;

import com.google.common.io.MoreFiles;
import com.google.common.io.RecursiveDeleteOption;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Harvests datasets: fetch, merge into the dataset's table, then advance its
 * watermark.
 *
 * <p>For each dataset:
 * <ol>
 *   <li>Decide whether to fetch incrementally: requested, the table exists
 *       and a watermark is stored. With a date field the where clause gains
 *       {@code <dateField> >= '<last_date>'}</li>
 *   <li>Estimate the count, plan the pages and download them into a fresh
 *       staging directory, or stream the CSV export in bulk mode</li>
 *   <li>Merge into the existing table (incremental) or replace it (full).
 *       If the columns changed, fetch again without the date filter and
 *       replace the table</li>
 *   <li>Write the watermark, only after the merge succeeded</li>
 *   <li>Delete the staging directory</li>
 * </ol>
 *
 * <p>A failed dataset is logged and reported in the result; the remaining
 * datasets still run.
 */
public class HarvestPipeline {

  private static final Logger LOGGER = LoggerFactory.getLogger(HarvestPipeline.class);

  private static final long SHUTDOWN_WAIT_SECONDS = 30;

  private static final DateTimeFormatter STAGING_FORMAT =
      DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

  private final HarvestConfig config;
  private final Clock clock;
  private final WatermarkStore watermarks;
  private final CountEstimator countEstimator;
  private final BulkExportFetcher bulkFetcher;
  private final ParallelDownloadEngine engine;
  private final MergeEngine mergeEngine;
  private final MultiDatasetProgress progress;

  public HarvestPipeline(HarvestConfig config) {
    this(config, Clock.systemDefaultZone(), Sleeper.SYSTEM,
        new JsonWatermarkStore(config.getWatermarkFile()));
  }

  public HarvestPipeline(HarvestConfig config, Clock clock, Sleeper sleeper,
      WatermarkStore watermarks) {
    this.config = config;
    this.clock = clock;
    this.watermarks = watermarks;
    SessionManager session = new SessionManager(config);
    RetryPolicy retryPolicy = RetryPolicy.fromConfig(config.getRetry(), sleeper);
    RateController rateController = RateController.fromConfig(config.getRateLimit(), clock);
    HarvestConfig.TimeoutConfig timeouts = config.getTimeouts();
    PageFetcher pageFetcher = new PageFetcher(session, retryPolicy, rateController, sleeper,
        timeouts.getPage());
    this.countEstimator = new CountEstimator(session, retryPolicy, rateController, sleeper,
        timeouts.getCount());
    this.bulkFetcher = new BulkExportFetcher(session, retryPolicy, rateController, sleeper,
        timeouts.getBulk());
    this.engine = new ParallelDownloadEngine(pageFetcher, rateController, config.isVerbose());
    this.mergeEngine = new MergeEngine(config.getCompression());
    this.progress = new MultiDatasetProgress(config.getProgressStepPercent());
  }

  public MultiDatasetProgress getProgress() {
    return progress;
  }

  /**
   * Harvests every configured dataset.
   */
  public HarvestResult runAll(boolean incremental) throws InterruptedException {
    return run(config.getDatasets(), incremental);
  }

  /**
   * Harvests the given datasets, sequentially or on a small pool when
   * {@code datasetParallelism} is above one.
   *
   * @param datasets Datasets to fetch
   * @param incremental Whether to fetch from the stored watermarks
   * @return One outcome per dataset, in the order given
   * @throws InterruptedException if the run is interrupted
   */
  public HarvestResult run(List<DatasetDescriptor> datasets, boolean incremental)
      throws InterruptedException {
    long start = System.currentTimeMillis();
    LOGGER.info("Harvesting {} datasets ({})", datasets.size(),
        incremental ? "incremental" : "full");
    List<DatasetOutcome> outcomes = new ArrayList<DatasetOutcome>();
    int parallelism = Math.min(config.getDatasetParallelism(), datasets.size());

    if (parallelism <= 1) {
      for (DatasetDescriptor dataset : datasets) {
        outcomes.add(harvest(dataset, incremental));
      }
    } else {
      ExecutorService pool = Executors.newFixedThreadPool(parallelism,
          new ThreadFactoryBuilder().setNameFormat("harvest-dataset-%d").build());
      try {
        List<Future<DatasetOutcome>> futures = new ArrayList<Future<DatasetOutcome>>();
        for (DatasetDescriptor dataset : datasets) {
          futures.add(pool.submit(() -> harvest(dataset, incremental)));
        }
        for (int i = 0; i < futures.size(); i++) {
          try {
            outcomes.add(futures.get(i).get());
          } catch (ExecutionException e) {
            DatasetDescriptor dataset = datasets.get(i);
            LOGGER.error("{}: harvest failed", dataset.getName(), e.getCause());
            outcomes.add(DatasetOutcome.failure(dataset.getId(), dataset.getName(),
                incremental, e.getCause(), 0));
          }
        }
      } finally {
        pool.shutdownNow();
        if (!pool.awaitTermination(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
          LOGGER.warn("Dataset workers did not stop within {}s", SHUTDOWN_WAIT_SECONDS);
        }
      }
    }

    HarvestResult result = new HarvestResult(outcomes, System.currentTimeMillis() - start);
    for (DatasetOutcome outcome : result.getOutcomes()) {
      if (outcome.isSuccess()) {
        LOGGER.info("  {}", outcome);
      } else {
        LOGGER.error("  {}", outcome);
      }
    }
    LOGGER.info("Harvest finished: {}", result);
    return result;
  }

  /**
   * Harvests one dataset. Failures are returned as a failed outcome.
   */
  public DatasetOutcome harvest(DatasetDescriptor dataset, boolean incrementalRequested)
      throws InterruptedException {
    long start = System.currentTimeMillis();
    String name = dataset.getName();
    Path target = config.tablePath(dataset);
    List<Path> stagingDirs = new ArrayList<Path>();
    boolean incremental = false;

    try {
      LocalDate runDate = LocalDate.now(clock);
      QueryClauses clauses = QueryClauses.of(dataset);
      QueryClauses fetchClauses = clauses;

      if (incrementalRequested && Files.exists(target)) {
        Watermark watermark = watermarks.get(dataset.getId());
        if (watermark != null) {
          incremental = true;
          if (dataset.getDateField() != null) {
            fetchClauses = clauses.withWhere(
                incrementalWhere(clauses.getWhere(), dataset.getDateField(),
                    watermark.getLastDate()));
            LOGGER.info("{}: incremental fetch since {}", name, watermark.getLastDate());
          } else {
            LOGGER.info("{}: no date field, fetching everything and merging", name);
          }
        } else {
          LOGGER.info("{}: no watermark stored, running a full fetch", name);
        }
      } else if (incrementalRequested) {
        LOGGER.info("{}: no existing table at {}, running a full fetch", name, target);
      }

      Fetched fetched = fetch(dataset, fetchClauses, stagingDirs);
      MergeResult mergeResult;
      boolean refetched = false;
      if (incremental) {
        try {
          mergeResult = mergeEngine.merge(fetched.batch, target, dataset.getPrimaryKey());
        } catch (SchemaDriftException e) {
          LOGGER.warn("{}: {}; fetching the full dataset and replacing the table",
              name, e.getMessage());
          fetched = fetch(dataset, clauses, stagingDirs);
          mergeResult = mergeEngine.replace(fetched.batch, target, dataset.getPrimaryKey());
          refetched = true;
        }
      } else {
        mergeResult = mergeEngine.replace(fetched.batch, target, dataset.getPrimaryKey());
      }

      watermarks.put(dataset.getId(), Watermark.of(runDate, clock.instant()));
      long rows = fetched.rows >= 0 ? fetched.rows : mergeResult.getBatchRows();
      return DatasetOutcome.success(dataset.getId(), name, incremental, refetched, rows,
          mergeResult, System.currentTimeMillis() - start);
    } catch (IOException | RuntimeException e) {
      LOGGER.error("{}: harvest failed, table left at its last merged state", name, e);
      return DatasetOutcome.failure(dataset.getId(), name, incremental, e,
          System.currentTimeMillis() - start);
    } finally {
      for (Path dir : stagingDirs) {
        deleteStaging(dir);
      }
    }
  }

  private Fetched fetch(DatasetDescriptor dataset, QueryClauses clauses, List<Path> stagingDirs)
      throws IOException, InterruptedException {
    Path staging = newStagingDirectory(dataset);
    stagingDirs.add(staging);
    String name = dataset.getName();

    if (dataset.getMode() == FetchMode.BULK_CSV) {
      ProgressTracker tracker = progress.start(name, 1, 0);
      Path csv = staging.resolve(name + ".csv");
      bulkFetcher.download(dataset.getId(), clauses.getWhere(), csv, tracker::addBytes);
      tracker.update(1, 0, 0);
      return new Fetched(StagedBatch.csv(csv), -1);
    }

    long estimate = countEstimator.estimate(dataset.getId(), clauses.getWhere(),
        dataset.getCountDistinctField());
    FetchPlan plan = FetchPlan.of(dataset.getId(), estimate, dataset.getPageSize());
    ProgressTracker tracker = progress.start(name, plan.pageCount(), estimate);
    try (PageSink sink = newSink(dataset, staging.resolve("pages"))) {
      DownloadResult result = engine.download(dataset, clauses, plan, sink, tracker);
      return new Fetched(result.getBatch(), result.getRows());
    }
  }

  private PageSink newSink(DatasetDescriptor dataset, Path directory) throws IOException {
    if (config.getStagingFormat() == HarvestConfig.StagingFormat.JSON_LINES) {
      return new JsonLinesPageSink(dataset.getName(), directory);
    }
    return new ParquetPageSink(dataset.getName(), directory, config.getCompression());
  }

  private Path newStagingDirectory(DatasetDescriptor dataset) throws IOException {
    String base = dataset.getName() + "_" + LocalDateTime.now(clock).format(STAGING_FORMAT);
    Path dir = config.getStagingDirectory().resolve(base);
    for (int i = 1; Files.exists(dir); i++) {
      dir = config.getStagingDirectory().resolve(base + "_" + i);
    }
    Files.createDirectories(dir);
    return dir;
  }

  private static void deleteStaging(Path dir) {
    if (!Files.exists(dir)) {
      return;
    }
    try {
      MoreFiles.deleteRecursively(dir, RecursiveDeleteOption.ALLOW_INSECURE);
      LOGGER.debug("Deleted staging directory {}", dir);
    } catch (IOException e) {
      LOGGER.warn("Failed to delete staging directory {}: {}", dir, e.getMessage());
    }
  }

  /**
   * Combines the dataset's own filter with the watermark lower bound.
   */
  static String incrementalWhere(@Nullable String where, String dateField, String since) {
    String bound = dateField + " >= '" + since.replace("'", "''") + "'";
    if (where == null || where.isEmpty()) {
      return bound;
    }
    return "(" + where + ") AND " + bound;
  }

  /** Staged batch of one fetch and its row count, -1 when unknown. */
  private static final class Fetched {
    final StagedBatch batch;
    final long rows;

    Fetched(StagedBatch batch, long rows) {
      this.batch = batch;
      this.rows = rows;
    }
  }
}

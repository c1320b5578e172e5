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
package org.opendata.harvest.engine;

import org.opendata.harvest.HarvestException;
import org.opendata.harvest.config.DatasetDescriptor;
import org.opendata.harvest.http.PageSource;
import org.opendata.harvest.http.QueryClauses;
import org.opendata.harvest.rate.RateController;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Downloads every page of a dataset concurrently and streams each page to a
 * {@link PageSink}.
 *
 * <p>Work is dispatched in rounds. Each round takes
 * {@code min(workerCount, pending)} offsets, where the worker count is read
 * from the {@link RateController} at the start of the round, and waits for
 * all of them. A throttled round therefore shrinks the next one without
 * interrupting requests already in flight.
 *
 * <p>A page shorter than the page size marks the end of the data; pending
 * offsets above it are dropped. When the plan runs out without a short page
 * and the dataset follows past the estimate, further rounds are scheduled
 * beyond the planned range until a short page arrives.
 *
 * <p>The first failed page cancels the rest of the run, discards everything
 * staged so far and surfaces as {@link DatasetFetchException}.
 */
public class ParallelDownloadEngine {

  private static final Logger LOGGER = LoggerFactory.getLogger(ParallelDownloadEngine.class);

  private static final long SHUTDOWN_WAIT_SECONDS = 30;

  private final PageSource source;
  private final RateController rateController;
  private final boolean verbose;

  public ParallelDownloadEngine(PageSource source, RateController rateController,
      boolean verbose) {
    this.source = source;
    this.rateController = rateController;
    this.verbose = verbose;
  }

  /**
   * Downloads the planned pages.
   *
   * @param dataset Dataset being fetched
   * @param clauses Query clauses applied to every page
   * @param plan Offsets derived from the estimated count
   * @param sink Destination of each page
   * @param tracker Progress counters for the dataset
   * @return Summary with the committed staged batch
   * @throws DatasetFetchException if any page fails; nothing staged is kept
   * @throws InterruptedException if the calling thread is interrupted
   */
  public DownloadResult download(DatasetDescriptor dataset, QueryClauses clauses,
      FetchPlan plan, PageSink sink, ProgressTracker tracker)
      throws IOException, InterruptedException {
    String name = dataset.getName();
    int pageSize = plan.getPageSize();
    long start = System.currentTimeMillis();
    LOGGER.info("{}: fetching ~{} rows in {} pages of {} with up to {} workers",
        name, plan.getEstimatedTotal(), plan.pageCount(), pageSize,
        rateController.workerCount());

    ExecutorService pool = Executors.newFixedThreadPool(rateController.initialWorkers(),
        new ThreadFactoryBuilder()
            .setNameFormat("harvest-" + name + "-%d")
            .setDaemon(true)
            .build());
    Deque<Long> pending = new ArrayDeque<Long>(plan.getOffsets());
    long endOffset = Long.MAX_VALUE;
    long nextOffset = plan.nextOffset();
    int pagesPlanned = plan.pageCount();
    int pagesCompleted = 0;
    long rows = 0;
    long bytes = 0;
    boolean finished = false;

    try {
      while (true) {
        final long end = endOffset;
        pending.removeIf(offset -> offset > end);
        if (pending.isEmpty()) {
          if (endOffset != Long.MAX_VALUE) {
            break;
          }
          if (!dataset.isFollowPastEstimate()) {
            LOGGER.warn("{}: last planned page was full; rows beyond offset {} are not "
                + "fetched because followPastEstimate is off", name, nextOffset);
            break;
          }
          int extra = Math.max(1, rateController.workerCount());
          for (int i = 0; i < extra; i++) {
            pending.add(nextOffset);
            nextOffset += pageSize;
          }
          pagesPlanned += extra;
          tracker.extendPages(extra, (long) extra * pageSize);
          LOGGER.info("{}: estimate exceeded, scheduling {} more pages from offset {}",
              name, extra, pending.peekFirst());
        }

        int roundSize = Math.min(rateController.workerCount(), pending.size());
        CompletionService<Completed> completion =
            new ExecutorCompletionService<Completed>(pool);
        List<Future<Completed>> futures = new ArrayList<Future<Completed>>(roundSize);
        for (int i = 0; i < roundSize; i++) {
          long offset = pending.poll();
          futures.add(completion.submit(
              () -> fetchPage(dataset, clauses, offset, pageSize, sink, tracker)));
        }

        for (int i = 0; i < roundSize; i++) {
          Completed page;
          try {
            page = completion.take().get();
          } catch (InterruptedException e) {
            LOGGER.warn("{}: interrupted, cancelling outstanding pages", name);
            abort(name, futures, pool, sink);
            throw e;
          } catch (ExecutionException e) {
            abort(name, futures, pool, sink);
            throw new DatasetFetchException(name, -1, e.getCause());
          }
          if (page.error != null) {
            LOGGER.error("{}: page at offset {} failed, aborting dataset: {}",
                name, page.offset, page.error.toString());
            abort(name, futures, pool, sink);
            throw new DatasetFetchException(name, page.offset, page.error);
          }
          pagesCompleted++;
          rows += page.rows;
          bytes += page.bytes;
          if (page.rows < pageSize && page.offset < endOffset) {
            endOffset = page.offset;
            LOGGER.debug("{}: short page at offset {} marks end of data", name, endOffset);
          }
        }
      }

      shutdown(name, pool);
      StagedBatch batch;
      try {
        batch = sink.commit();
      } catch (IOException e) {
        sink.discard();
        throw new HarvestException(name, "failed to commit staged pages", e);
      }
      finished = true;
      tracker.markDone();
      long elapsed = System.currentTimeMillis() - start;
      DownloadResult result = new DownloadResult(name, pagesPlanned, pagesCompleted, rows,
          bytes, elapsed, batch);
      LOGGER.info("{}: download complete, {}", name, result);
      return result;
    } finally {
      if (!finished) {
        pool.shutdownNow();
      }
    }
  }

  private Completed fetchPage(DatasetDescriptor dataset, QueryClauses clauses, long offset,
      int pageSize, PageSink sink, ProgressTracker tracker) {
    try {
      List<Map<String, String>> records =
          source.fetch(dataset.getId(), offset, pageSize, clauses);
      long written = sink.write(PageResult.success(offset, records));
      tracker.update(1, records.size(), written);
      if (verbose) {
        LOGGER.info("{}: offset {} done, {} rows", dataset.getName(), offset, records.size());
      } else {
        LOGGER.debug("{}: offset {} done, {} rows", dataset.getName(), offset, records.size());
      }
      return new Completed(offset, records.size(), written, null);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return new Completed(offset, 0, 0, e);
    } catch (Exception e) {
      return new Completed(offset, 0, 0, e);
    }
  }

  private static void abort(String name, List<Future<Completed>> futures, ExecutorService pool,
      PageSink sink) {
    for (Future<Completed> future : futures) {
      future.cancel(true);
    }
    pool.shutdownNow();
    try {
      if (!pool.awaitTermination(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
        LOGGER.warn("{}: workers did not stop within {}s", name, SHUTDOWN_WAIT_SECONDS);
      }
    } catch (InterruptedException e) {
      LOGGER.warn("{}: interrupted while waiting for workers to stop", name);
      Thread.currentThread().interrupt();
    }
    sink.discard();
  }

  private static void shutdown(String name, ExecutorService pool) throws InterruptedException {
    pool.shutdown();
    if (!pool.awaitTermination(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
      LOGGER.warn("{}: forcing worker shutdown", name);
      pool.shutdownNow();
    }
  }

  /** Outcome of one page task. Records are already in the sink. */
  private static final class Completed {
    final long offset;
    final int rows;
    final long bytes;
    final @Nullable Throwable error;

    Completed(long offset, int rows, long bytes, @Nullable Throwable error) {
      this.offset = offset;
      this.rows = rows;
      this.bytes = bytes;
      this.error = error;
    }
  }
}

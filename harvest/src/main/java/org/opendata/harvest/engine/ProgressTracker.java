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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Thread-safe page, row and byte counters for one dataset.
 *
 * <p>A milestone is reported each time the page percentage crosses the next
 * step boundary (5% by default) and once when it reaches 100%. Counters are
 * guarded by the tracker's own monitor, so trackers of concurrently fetched
 * datasets never contend with each other.
 */
public class ProgressTracker {

  /**
   * Receives progress milestones.
   */
  public interface ProgressListener {
    /**
     * Called when a step boundary is crossed or the dataset completes.
     *
     * @param snapshot Counters at the time of the milestone
     */
    void onMilestone(Snapshot snapshot);
  }

  /**
   * Default progress listener that logs to SLF4J.
   */
  public static class LoggingProgressListener implements ProgressListener {
    private static final Logger LOG = LoggerFactory.getLogger(LoggingProgressListener.class);

    @Override public void onMilestone(Snapshot snapshot) {
      LOG.info("{}", snapshot.format());
    }
  }

  private final String name;
  private final int stepPercent;
  private final ProgressListener listener;

  private long totalPages;
  private long totalRows;
  private long pagesDone;
  private long rowsDone;
  private long bytesDone;
  private int nextMilestone;
  private boolean completeReported;

  public ProgressTracker(String name, long totalPages, long totalRows, int stepPercent) {
    this(name, totalPages, totalRows, stepPercent, new LoggingProgressListener());
  }

  public ProgressTracker(String name, long totalPages, long totalRows, int stepPercent,
      ProgressListener listener) {
    if (stepPercent <= 0) {
      throw new IllegalArgumentException("stepPercent must be positive: " + stepPercent);
    }
    this.name = name;
    this.totalPages = totalPages;
    this.totalRows = totalRows;
    this.stepPercent = stepPercent;
    this.listener = listener;
    this.nextMilestone = stepPercent;
  }

  public String getName() {
    return name;
  }

  /**
   * Adds completed work and reports a milestone if one was crossed.
   */
  public void update(long pages, long rows, long bytes) {
    Snapshot milestone = null;
    synchronized (this) {
      pagesDone += pages;
      rowsDone += rows;
      bytesDone += bytes;
      int percent = percentLocked();
      if (percent >= 100 && pagesDone >= totalPages) {
        if (!completeReported) {
          completeReported = true;
          milestone = snapshotLocked();
        }
      } else if (percent >= nextMilestone) {
        nextMilestone = (percent / stepPercent + 1) * stepPercent;
        milestone = snapshotLocked();
      }
    }
    if (milestone != null) {
      listener.onMilestone(milestone);
    }
  }

  /** Adds bytes without completing a page, e.g. during a streamed export. */
  public void addBytes(long bytes) {
    synchronized (this) {
      bytesDone += bytes;
    }
  }

  /**
   * Grows the page and row denominators when fetching continues past the
   * estimated size.
   */
  public synchronized void extendPages(long pages, long rows) {
    totalPages += pages;
    totalRows += rows;
  }

  /**
   * Marks the dataset complete. Denominators are set to the observed totals
   * and a final milestone is reported if 100% was not reported yet.
   */
  public void markDone() {
    Snapshot milestone = null;
    synchronized (this) {
      totalPages = pagesDone;
      totalRows = rowsDone;
      if (!completeReported) {
        completeReported = true;
        milestone = snapshotLocked();
      }
    }
    if (milestone != null) {
      listener.onMilestone(milestone);
    }
  }

  public synchronized Snapshot snapshot() {
    return snapshotLocked();
  }

  private int percentLocked() {
    if (totalPages <= 0) {
      return 100;
    }
    return (int) Math.min(100, pagesDone * 100 / totalPages);
  }

  private Snapshot snapshotLocked() {
    return new Snapshot(name, pagesDone, totalPages, rowsDone, totalRows, bytesDone,
        percentLocked());
  }

  /**
   * Immutable view of the counters.
   */
  public static final class Snapshot {
    private final String name;
    private final long pagesDone;
    private final long totalPages;
    private final long rowsDone;
    private final long totalRows;
    private final long bytesDone;
    private final int percent;

    Snapshot(String name, long pagesDone, long totalPages, long rowsDone, long totalRows,
        long bytesDone, int percent) {
      this.name = name;
      this.pagesDone = pagesDone;
      this.totalPages = totalPages;
      this.rowsDone = rowsDone;
      this.totalRows = totalRows;
      this.bytesDone = bytesDone;
      this.percent = percent;
    }

    public String getName() {
      return name;
    }

    public long getPagesDone() {
      return pagesDone;
    }

    public long getTotalPages() {
      return totalPages;
    }

    public long getRowsDone() {
      return rowsDone;
    }

    public long getTotalRows() {
      return totalRows;
    }

    public long getBytesDone() {
      return bytesDone;
    }

    public int getPercent() {
      return percent;
    }

    /** Formats as {@code name: pct% | page x/y | rows a/b | n.n MB}. */
    public String format() {
      return String.format(Locale.ROOT, "%s: %d%% | page %d/%d | rows %,d/%,d | %.1f MB",
          name, percent, pagesDone, totalPages, rowsDone, totalRows,
          bytesDone / (1024.0 * 1024.0));
    }

    @Override public String toString() {
      return format();
    }
  }
}

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

import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Registry of progress trackers for datasets fetched in the same run.
 *
 * <p>Each dataset gets an independent tracker with its own lock; the
 * registry only guards the map itself.
 */
public class MultiDatasetProgress {

  private final int stepPercent;
  private final ProgressTracker.ProgressListener listener;
  private final Map<String, ProgressTracker> trackers =
      new LinkedHashMap<String, ProgressTracker>();

  public MultiDatasetProgress(int stepPercent) {
    this(stepPercent, new ProgressTracker.LoggingProgressListener());
  }

  public MultiDatasetProgress(int stepPercent, ProgressTracker.ProgressListener listener) {
    this.stepPercent = stepPercent;
    this.listener = listener;
  }

  /**
   * Creates and registers a tracker, replacing any earlier tracker of the
   * same dataset.
   */
  public synchronized ProgressTracker start(String dataset, long totalPages, long totalRows) {
    ProgressTracker tracker =
        new ProgressTracker(dataset, totalPages, totalRows, stepPercent, listener);
    trackers.put(dataset, tracker);
    return tracker;
  }

  public synchronized @Nullable ProgressTracker get(String dataset) {
    return trackers.get(dataset);
  }

  /** Returns a snapshot of every registered tracker, in registration order. */
  public ImmutableMap<String, ProgressTracker.Snapshot> snapshots() {
    ImmutableMap.Builder<String, ProgressTracker.Snapshot> result = ImmutableMap.builder();
    Map<String, ProgressTracker> copy;
    synchronized (this) {
      copy = new LinkedHashMap<String, ProgressTracker>(trackers);
    }
    for (Map.Entry<String, ProgressTracker> entry : copy.entrySet()) {
      result.put(entry.getKey(), entry.getValue().snapshot());
    }
    return result.build();
  }
}

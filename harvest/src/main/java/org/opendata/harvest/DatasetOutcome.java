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

import org.opendata.harvest.merge.MergeResult;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Outcome of harvesting one dataset.
 */
public final class DatasetOutcome {

  private final String datasetId;
  private final String name;
  private final boolean success;
  private final boolean incremental;
  private final boolean refetchedAfterDrift;
  private final long rowsFetched;
  private final @Nullable MergeResult mergeResult;
  private final @Nullable Throwable error;
  private final long elapsedMs;

  private DatasetOutcome(String datasetId, String name, boolean success, boolean incremental,
      boolean refetchedAfterDrift, long rowsFetched, @Nullable MergeResult mergeResult,
      @Nullable Throwable error, long elapsedMs) {
    this.datasetId = datasetId;
    this.name = name;
    this.success = success;
    this.incremental = incremental;
    this.refetchedAfterDrift = refetchedAfterDrift;
    this.rowsFetched = rowsFetched;
    this.mergeResult = mergeResult;
    this.error = error;
    this.elapsedMs = elapsedMs;
  }

  public static DatasetOutcome success(String datasetId, String name, boolean incremental,
      boolean refetchedAfterDrift, long rowsFetched, MergeResult mergeResult, long elapsedMs) {
    return new DatasetOutcome(datasetId, name, true, incremental, refetchedAfterDrift,
        rowsFetched, mergeResult, null, elapsedMs);
  }

  public static DatasetOutcome failure(String datasetId, String name, boolean incremental,
      Throwable error, long elapsedMs) {
    return new DatasetOutcome(datasetId, name, false, incremental, false, 0, null, error,
        elapsedMs);
  }

  public String getDatasetId() {
    return datasetId;
  }

  public String getName() {
    return name;
  }

  public boolean isSuccess() {
    return success;
  }

  /** Returns whether the dataset was fetched from its watermark. */
  public boolean isIncremental() {
    return incremental;
  }

  /**
   * Returns whether an incremental merge hit a column change and the
   * dataset was fetched again in full.
   */
  public boolean isRefetchedAfterDrift() {
    return refetchedAfterDrift;
  }

  public long getRowsFetched() {
    return rowsFetched;
  }

  public @Nullable MergeResult getMergeResult() {
    return mergeResult;
  }

  public @Nullable Throwable getError() {
    return error;
  }

  public long getElapsedMs() {
    return elapsedMs;
  }

  @Override public String toString() {
    if (success) {
      return name + " (" + datasetId + "): " + rowsFetched + " rows fetched, " + mergeResult
          + (refetchedAfterDrift ? " after full refetch" : "");
    }
    return name + " (" + datasetId + "): FAILED " + error;
  }
}

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

/**
 * Summary of one completed download.
 */
public final class DownloadResult {

  private final String dataset;
  private final int pagesPlanned;
  private final int pagesCompleted;
  private final long rows;
  private final long bytes;
  private final long elapsedMs;
  private final StagedBatch batch;

  public DownloadResult(String dataset, int pagesPlanned, int pagesCompleted, long rows,
      long bytes, long elapsedMs, StagedBatch batch) {
    this.dataset = dataset;
    this.pagesPlanned = pagesPlanned;
    this.pagesCompleted = pagesCompleted;
    this.rows = rows;
    this.bytes = bytes;
    this.elapsedMs = elapsedMs;
    this.batch = batch;
  }

  public String getDataset() {
    return dataset;
  }

  /** Pages in the plan, including any scheduled past the estimate. */
  public int getPagesPlanned() {
    return pagesPlanned;
  }

  public int getPagesCompleted() {
    return pagesCompleted;
  }

  public long getRows() {
    return rows;
  }

  public long getBytes() {
    return bytes;
  }

  public long getElapsedMs() {
    return elapsedMs;
  }

  public StagedBatch getBatch() {
    return batch;
  }

  @Override public String toString() {
    return dataset + ": " + pagesCompleted + "/" + pagesPlanned + " pages, " + rows
        + " rows in " + elapsedMs + "ms";
  }
}

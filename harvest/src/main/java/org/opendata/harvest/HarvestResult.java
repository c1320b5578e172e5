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

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Result of a harvest run over one or more datasets.
 *
 * <p>Datasets succeed or fail independently; a failed dataset keeps its last
 * successfully merged table.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * HarvestResult result = pipeline.run(datasets, true);
 * if (!result.isCompleteSuccess()) {
 *   for (DatasetOutcome failed : result.getFailed()) {
 *     System.err.println("  - " + failed);
 *   }
 * }
 * }</pre>
 */
public final class HarvestResult {

  private final ImmutableList<DatasetOutcome> outcomes;
  private final long elapsedMs;

  public HarvestResult(List<DatasetOutcome> outcomes, long elapsedMs) {
    this.outcomes = ImmutableList.copyOf(outcomes);
    this.elapsedMs = elapsedMs;
  }

  public ImmutableList<DatasetOutcome> getOutcomes() {
    return outcomes;
  }

  public long getElapsedMs() {
    return elapsedMs;
  }

  /**
   * Returns whether every dataset succeeded.
   */
  public boolean isCompleteSuccess() {
    return getFailed().isEmpty();
  }

  public ImmutableList<DatasetOutcome> getSucceeded() {
    ImmutableList.Builder<DatasetOutcome> result = ImmutableList.builder();
    for (DatasetOutcome outcome : outcomes) {
      if (outcome.isSuccess()) {
        result.add(outcome);
      }
    }
    return result.build();
  }

  public ImmutableList<DatasetOutcome> getFailed() {
    ImmutableList.Builder<DatasetOutcome> result = ImmutableList.builder();
    for (DatasetOutcome outcome : outcomes) {
      if (!outcome.isSuccess()) {
        result.add(outcome);
      }
    }
    return result.build();
  }

  /** Returns the total rows fetched across successful datasets. */
  public long getTotalRowsFetched() {
    long total = 0;
    for (DatasetOutcome outcome : outcomes) {
      total += outcome.getRowsFetched();
    }
    return total;
  }

  @Override public String toString() {
    return "HarvestResult{" + getSucceeded().size() + " succeeded, " + getFailed().size()
        + " failed, " + elapsedMs + "ms}";
  }
}

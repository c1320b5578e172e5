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

import com.google.common.collect.ImmutableList;

/**
 * Offsets to request for one dataset, derived from the estimated count.
 *
 * <p>Offsets run {@code 0, pageSize, 2 * pageSize, ...} strictly below the
 * estimate. A plan always contains offset 0 so that an estimate of zero
 * still confirms the dataset is empty.
 */
public final class FetchPlan {

  private final String datasetId;
  private final long estimatedTotal;
  private final int pageSize;
  private final ImmutableList<Long> offsets;

  private FetchPlan(String datasetId, long estimatedTotal, int pageSize,
      ImmutableList<Long> offsets) {
    this.datasetId = datasetId;
    this.estimatedTotal = estimatedTotal;
    this.pageSize = pageSize;
    this.offsets = offsets;
  }

  public static FetchPlan of(String datasetId, long estimatedTotal, int pageSize) {
    if (pageSize <= 0) {
      throw new IllegalArgumentException("pageSize must be positive: " + pageSize);
    }
    ImmutableList.Builder<Long> offsets = ImmutableList.builder();
    offsets.add(0L);
    for (long offset = pageSize; offset < estimatedTotal; offset += pageSize) {
      offsets.add(offset);
    }
    return new FetchPlan(datasetId, Math.max(0L, estimatedTotal), pageSize, offsets.build());
  }

  public String getDatasetId() {
    return datasetId;
  }

  public long getEstimatedTotal() {
    return estimatedTotal;
  }

  public int getPageSize() {
    return pageSize;
  }

  public ImmutableList<Long> getOffsets() {
    return offsets;
  }

  public int pageCount() {
    return offsets.size();
  }

  /** Returns the first offset after the planned range. */
  public long nextOffset() {
    return offsets.get(offsets.size() - 1) + pageSize;
  }

  @Override public String toString() {
    return "FetchPlan{" + datasetId + ", total=" + estimatedTotal + ", pageSize=" + pageSize
        + ", pages=" + offsets.size() + "}";
  }
}

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
package org.opendata.harvest.watermark;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.util.Collections;
import java.util.Map;

/**
 * Persists the watermark of each dataset across runs.
 *
 * <p>A watermark is read once when an incremental fetch starts and written
 * once after the fetch and merge of that dataset succeed.
 */
public interface WatermarkStore {

  /**
   * Returns the watermark of a dataset, or null if it was never fetched.
   *
   * @param datasetId Dataset id
   */
  @Nullable Watermark get(String datasetId) throws IOException;

  /**
   * Stores the watermark of a dataset, keeping those of other datasets.
   *
   * @param datasetId Dataset id
   * @param watermark New watermark
   */
  void put(String datasetId, Watermark watermark) throws IOException;

  /**
   * Returns every stored watermark keyed by dataset id.
   */
  Map<String, Watermark> all() throws IOException;

  /**
   * A store that remembers nothing, so every fetch is a full fetch.
   */
  WatermarkStore NOOP = new WatermarkStore() {
    @Override public @Nullable Watermark get(String datasetId) {
      return null;
    }

    @Override public void put(String datasetId, Watermark watermark) {
      // No-op
    }

    @Override public Map<String, Watermark> all() {
      return Collections.emptyMap();
    }
  };
}

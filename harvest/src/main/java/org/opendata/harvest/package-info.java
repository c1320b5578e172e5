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
/**
 * Harvests large tabular datasets from a paginated, rate-limited open-data
 * API into deduplicated Parquet tables.
 *
 * <h2>Core Components</h2>
 * <ul>
 *   <li>{@link org.opendata.harvest.HarvestPipeline} - Fetches, merges and advances the
 *       watermark of each dataset</li>
 *   <li>{@link org.opendata.harvest.engine.ParallelDownloadEngine} - Concurrent page
 *       downloads under an adaptive worker count</li>
 *   <li>{@link org.opendata.harvest.merge.MergeEngine} - Primary-key merge with atomic
 *       table replacement</li>
 *   <li>{@link org.opendata.harvest.rate.RateController} - Throttle backoff and pool
 *       shrinking</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * HarvestConfig config = HarvestConfig.load(Paths.get("harvest.yaml"));
 * HarvestResult result = new HarvestPipeline(config).runAll(true);
 * if (!result.isCompleteSuccess()) {
 *   System.exit(1);
 * }
 * }</pre>
 */
package org.opendata.harvest;

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

import java.io.Closeable;
import java.io.IOException;

/**
 * Durable destination for fetched pages.
 *
 * <p>{@link #write} is called concurrently by download workers in page
 * completion order. A sink is finished either by {@link #commit}, which
 * yields the staged batch, or by {@link #discard}, which removes everything
 * written so far. Writes after either call fail.
 */
public interface PageSink extends Closeable {

  /**
   * Persists one page.
   *
   * @return Number of bytes staged for the page
   */
  long write(PageResult page) throws IOException;

  /** Finishes the run and describes what was staged. */
  StagedBatch commit() throws IOException;

  /** Deletes every artifact of the run. Safe to call more than once. */
  void discard();
}

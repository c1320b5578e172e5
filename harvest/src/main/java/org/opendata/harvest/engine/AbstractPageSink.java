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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;
import com.google.common.io.MoreFiles;
import com.google.common.io.RecursiveDeleteOption;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Shared state of the staging sinks: lifecycle, row totals and the column
 * union across pages.
 *
 * <p>Columns are tracked per page and combined in offset order at commit,
 * so the column order of a batch does not depend on which page finished
 * first.
 */
abstract class AbstractPageSink implements PageSink {

  private static final Logger LOGGER = LoggerFactory.getLogger(AbstractPageSink.class);

  protected static final ObjectMapper MAPPER = new ObjectMapper();

  protected final String datasetId;
  protected final Path directory;

  private final Map<Long, List<String>> pageColumns = new TreeMap<Long, List<String>>();
  private final AtomicLong rows = new AtomicLong();
  private volatile boolean finished;

  protected AbstractPageSink(String datasetId, Path directory) throws IOException {
    this.datasetId = datasetId;
    this.directory = directory;
    Files.createDirectories(directory);
  }

  @Override public final long write(PageResult page) throws IOException {
    if (finished) {
      throw new IllegalStateException("Sink for " + datasetId + " is already finished");
    }
    recordColumns(page);
    if (page.size() == 0) {
      return 0L;
    }
    long bytes = writePage(page);
    rows.addAndGet(page.size());
    return bytes;
  }

  /** Persists a non-empty page. */
  protected abstract long writePage(PageResult page) throws IOException;

  @Override public final StagedBatch commit() throws IOException {
    if (finished) {
      throw new IllegalStateException("Sink for " + datasetId + " is already finished");
    }
    finished = true;
    return finish(columns(), rows.get());
  }

  /** Closes open resources and describes the staged files. */
  protected abstract StagedBatch finish(List<String> columns, long rowCount)
      throws IOException;

  @Override public void discard() {
    finished = true;
    try {
      closeResources();
    } catch (IOException e) {
      LOGGER.warn("Failed to close sink for {}: {}", datasetId, e.getMessage());
    }
    if (Files.exists(directory)) {
      try {
        MoreFiles.deleteRecursively(directory, RecursiveDeleteOption.ALLOW_INSECURE);
        LOGGER.info("Discarded staged pages for {}", datasetId);
      } catch (IOException e) {
        LOGGER.warn("Failed to delete staging directory {}: {}", directory, e.getMessage());
      }
    }
  }

  @Override public void close() throws IOException {
    closeResources();
  }

  /** Releases file handles. Called on close and discard. */
  protected void closeResources() throws IOException {
  }

  protected long rowCount() {
    return rows.get();
  }

  private void recordColumns(PageResult page) {
    Set<String> seen = new LinkedHashSet<String>();
    for (Map<String, String> record : page.getRecords()) {
      seen.addAll(record.keySet());
    }
    synchronized (pageColumns) {
      pageColumns.put(page.getOffset(), ImmutableList.copyOf(seen));
    }
  }

  /** Returns the union of columns seen so far, in page offset order. */
  protected List<String> columns() {
    Set<String> union = new LinkedHashSet<String>();
    synchronized (pageColumns) {
      for (List<String> columns : pageColumns.values()) {
        union.addAll(columns);
      }
    }
    return ImmutableList.copyOf(union);
  }

  /**
   * Serializes a page as newline-delimited JSON with bookkeeping columns.
   */
  protected static byte[] toJsonLines(PageResult page) throws IOException {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    int row = 0;
    for (Map<String, String> record : page.getRecords()) {
      Map<String, Object> line = new LinkedHashMap<String, Object>(record);
      line.put(StagedBatch.OFFSET_COLUMN, page.getOffset());
      line.put(StagedBatch.ROW_COLUMN, row++);
      out.write(MAPPER.writeValueAsBytes(line));
      out.write('\n');
    }
    return out.toByteArray();
  }
}

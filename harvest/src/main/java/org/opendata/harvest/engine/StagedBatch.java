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

import java.nio.file.Path;
import java.util.List;

/**
 * Durable output of one completed download, ready to be merged.
 *
 * <p>Paged downloads stage records with two bookkeeping columns,
 * {@link #OFFSET_COLUMN} and {@link #ROW_COLUMN}, that identify the position
 * of each record in the remote result. They are used to resolve duplicate
 * keys inside the batch and are dropped before anything is written to the
 * merged table.
 */
public final class StagedBatch {

  /** Offset of the page a record came from. */
  public static final String OFFSET_COLUMN = "_harvest_offset";

  /** Position of a record within its page. */
  public static final String ROW_COLUMN = "_harvest_row";

  /**
   * Physical layout of the staged files.
   */
  public enum Format {
    /** One Parquet file per page. */
    PARQUET,
    /** One newline-delimited JSON file appended page by page. */
    JSON_LINES,
    /** A single CSV export without bookkeeping columns. */
    CSV
  }

  private final Format format;
  private final Path directory;
  private final ImmutableList<Path> files;
  private final ImmutableList<String> columns;
  private final long rowCount;

  public StagedBatch(Format format, Path directory, List<Path> files, List<String> columns,
      long rowCount) {
    this.format = format;
    this.directory = directory;
    this.files = ImmutableList.copyOf(files);
    this.columns = ImmutableList.copyOf(columns);
    this.rowCount = rowCount;
  }

  /** Creates a batch for a CSV export whose row count is not known yet. */
  public static StagedBatch csv(Path file) {
    return new StagedBatch(Format.CSV, file.toAbsolutePath().getParent(),
        ImmutableList.of(file), ImmutableList.<String>of(), -1);
  }

  public Format getFormat() {
    return format;
  }

  public Path getDirectory() {
    return directory;
  }

  public ImmutableList<Path> getFiles() {
    return files;
  }

  /**
   * Returns the data columns in first-seen order by page offset, excluding
   * bookkeeping columns. Empty for CSV batches, whose header is read at
   * merge time.
   */
  public ImmutableList<String> getColumns() {
    return columns;
  }

  /** Returns the number of staged rows, or -1 when unknown. */
  public long getRowCount() {
    return rowCount;
  }

  public boolean hasBookkeepingColumns() {
    return format != Format.CSV;
  }

  /** Returns whether the batch is known to hold no rows. */
  public boolean isEmpty() {
    return files.isEmpty() || rowCount == 0;
  }

  @Override public String toString() {
    return "StagedBatch{" + format + ", files=" + files.size() + ", rows=" + rowCount + "}";
  }
}

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

import org.opendata.harvest.merge.DuckDbSupport;

import com.google.common.collect.ImmutableList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Stages every page as its own Parquet file, {@code page_<offset>.parquet}.
 *
 * <p>Pages are independent artifacts, so workers never contend on a shared
 * file. Each page is written as newline-delimited JSON to a temporary file
 * and converted by DuckDB with every data column typed as VARCHAR. Empty
 * pages produce no file.
 */
public class ParquetPageSink extends AbstractPageSink {

  private static final Logger LOGGER = LoggerFactory.getLogger(ParquetPageSink.class);

  private final String compression;
  private final Map<Long, Path> files = new ConcurrentSkipListMap<Long, Path>();

  public ParquetPageSink(String datasetId, Path directory, String compression)
      throws IOException {
    super(datasetId, directory);
    this.compression = compression;
  }

  @Override protected long writePage(PageResult page) throws IOException {
    long offset = page.getOffset();
    Path json = directory.resolve("page_" + offset + ".jsonl");
    Path tmp = directory.resolve("page_" + offset + ".parquet.tmp");
    Path target = directory.resolve("page_" + offset + ".parquet");
    byte[] bytes = toJsonLines(page);
    Files.write(json, bytes);
    try (Connection conn = DuckDbSupport.connect();
         Statement stmt = conn.createStatement()) {
      String sql = "COPY (SELECT * FROM read_json(" + DuckDbSupport.quotePath(json)
          + ", format = 'newline_delimited', columns = " + columnSpec(page) + "))"
          + " TO " + DuckDbSupport.quotePath(tmp) + " "
          + DuckDbSupport.parquetOptions(compression);
      LOGGER.debug("Page staging SQL: {}", sql);
      stmt.execute(sql);
    } catch (SQLException e) {
      String errorMsg = String.format("Failed to stage page %d of '%s': %s",
          offset, datasetId, e.getMessage());
      LOGGER.error(errorMsg, e);
      Files.deleteIfExists(tmp);
      throw new IOException(errorMsg, e);
    } finally {
      Files.deleteIfExists(json);
    }
    Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE,
        StandardCopyOption.REPLACE_EXISTING);
    files.put(offset, target);
    return bytes.length;
  }

  @Override protected StagedBatch finish(List<String> columns, long rowCount) {
    List<Path> staged = new ArrayList<Path>(files.values());
    LOGGER.debug("{}: staged {} page files, {} rows", datasetId, staged.size(), rowCount);
    return new StagedBatch(StagedBatch.Format.PARQUET, directory,
        ImmutableList.copyOf(staged), columns, rowCount);
  }

  /** Builds the DuckDB {@code columns} struct for the fields of one page. */
  private static String columnSpec(PageResult page) {
    List<String> columns = new ArrayList<String>();
    for (Map<String, String> record : page.getRecords()) {
      for (String column : record.keySet()) {
        if (!columns.contains(column)) {
          columns.add(column);
        }
      }
    }
    StringBuilder sb = new StringBuilder("{");
    for (String column : columns) {
      sb.append(DuckDbSupport.quoteLiteral(column)).append(": 'VARCHAR', ");
    }
    sb.append(DuckDbSupport.quoteLiteral(StagedBatch.OFFSET_COLUMN)).append(": 'BIGINT', ");
    sb.append(DuckDbSupport.quoteLiteral(StagedBatch.ROW_COLUMN)).append(": 'BIGINT'}");
    return sb.toString();
  }
}

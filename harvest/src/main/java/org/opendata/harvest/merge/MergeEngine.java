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
package org.opendata.harvest.merge;

import org.opendata.harvest.engine.StagedBatch;

import com.google.common.collect.ImmutableList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Writes staged batches into the merged Parquet table of a dataset.
 *
 * <p>Features:
 * <ul>
 *   <li>Primary-key deduplication with {@code ROW_NUMBER() OVER (PARTITION BY pk)}</li>
 *   <li>New rows always replace existing rows with the same key</li>
 *   <li>Within a batch the last occurrence by remote offset and row wins</li>
 *   <li>Atomic replace: results go to {@code <table>.tmp} and are moved over the table</li>
 *   <li>Empty batches leave the table untouched</li>
 *   <li>Table columns missing from a batch are merged as {@code NULL}</li>
 * </ul>
 *
 * <p>Callers must not merge into the same table from two threads at once.
 */
public class MergeEngine {

  private static final Logger LOGGER = LoggerFactory.getLogger(MergeEngine.class);

  private static final String NEW_ROWS = "new_rows";
  private static final String SOURCE = "__src";
  private static final String KEY1 = "__k1";
  private static final String KEY2 = "__k2";
  private static final String RANK = "__rn";

  private final String compression;

  public MergeEngine(String compression) {
    DuckDbSupport.parquetOptions(compression);
    this.compression = compression;
  }

  /**
   * Merges a batch into the table at {@code target}.
   *
   * <p>Without an existing table this is the same as {@link #replace}. An
   * empty primary key appends without deduplication.
   *
   * <p>The API omits null fields, so a batch may lack some of the table's
   * columns; those are written as {@code NULL} for the new rows.
   *
   * @throws SchemaDriftException if the batch has columns the table lacks
   */
  public MergeResult merge(StagedBatch batch, Path target, List<String> primaryKey)
      throws IOException {
    long before = Files.exists(target) ? rowCount(target) : 0L;
    if (batch.getFiles().isEmpty()) {
      LOGGER.info("Empty batch, {} unchanged ({} rows)", target.getFileName(), before);
      return MergeResult.unchanged(before);
    }
    if (!Files.exists(target)) {
      LOGGER.info("No existing table at {}, writing batch as new table", target);
      return replace(batch, target, primaryKey);
    }

    long start = System.currentTimeMillis();
    try (Connection conn = DuckDbSupport.connect()) {
      long batchRows = createNewRowsView(conn, batch);
      if (batchRows == 0) {
        LOGGER.info("Empty batch, {} unchanged ({} rows)", target.getFileName(), before);
        return MergeResult.unchanged(before);
      }
      String existing = "read_parquet(" + DuckDbSupport.quotePath(target)
          + ", file_row_number = true)";
      List<String> existingColumns = columnsOf(conn, "SELECT * EXCLUDE (file_row_number) FROM "
          + existing);
      List<String> newColumns = dataColumns(columnsOf(conn, "SELECT * FROM " + NEW_ROWS));
      checkNoAddedColumns(target, existingColumns, newColumns);
      checkKey(primaryKey, newColumns);

      String columns = columnList(existingColumns);
      String union = "SELECT " + projection(existingColumns, newColumns) + ", 0 AS " + SOURCE
          + ", " + KEY1 + ", " + KEY2
          + " FROM " + NEW_ROWS + "\n"
          + "  UNION ALL\n"
          + "  SELECT " + columns + ", 1 AS " + SOURCE + ", 0 AS " + KEY1
          + ", -file_row_number AS " + KEY2 + " FROM " + existing;
      String query = primaryKey.isEmpty()
          ? "SELECT " + columns + " FROM (" + union + ")"
          : deduplicate(union, columns, primaryKey, true);

      long after = writeAtomically(conn, query, target);
      LOGGER.info("Merged {} new rows into {}: {} -> {} rows in {}ms",
          batchRows, target.getFileName(), before, after, System.currentTimeMillis() - start);
      return MergeResult.merged(before, batchRows, after);
    } catch (SQLException e) {
      String errorMsg = String.format("DuckDB merge failed for '%s': %s",
          target, e.getMessage());
      LOGGER.error(errorMsg, e);
      throw new IOException(errorMsg, e);
    }
  }

  /**
   * Overwrites the table at {@code target} with the batch, deduplicated by
   * the primary key when one is given. An empty batch leaves the table
   * untouched.
   */
  public MergeResult replace(StagedBatch batch, Path target, List<String> primaryKey)
      throws IOException {
    long before = Files.exists(target) ? rowCount(target) : 0L;
    if (batch.getFiles().isEmpty()) {
      LOGGER.info("Empty batch, {} unchanged ({} rows)", target.getFileName(), before);
      return MergeResult.unchanged(before);
    }

    long start = System.currentTimeMillis();
    try (Connection conn = DuckDbSupport.connect()) {
      long batchRows = createNewRowsView(conn, batch);
      if (batchRows == 0) {
        LOGGER.info("Empty batch, {} unchanged ({} rows)", target.getFileName(), before);
        return MergeResult.unchanged(before);
      }
      List<String> newColumns = dataColumns(columnsOf(conn, "SELECT * FROM " + NEW_ROWS));
      checkKey(primaryKey, newColumns);
      String columns = columnList(newColumns);
      String query = primaryKey.isEmpty()
          ? "SELECT " + columns + " FROM " + NEW_ROWS
          : deduplicate("SELECT * FROM " + NEW_ROWS, columns, primaryKey, false);

      long after = writeAtomically(conn, query, target);
      LOGGER.info("Replaced {} with {} rows ({} staged) in {}ms",
          target.getFileName(), after, batchRows, System.currentTimeMillis() - start);
      return MergeResult.replaced(before, batchRows, after);
    } catch (SQLException e) {
      String errorMsg = String.format("DuckDB replace failed for '%s': %s",
          target, e.getMessage());
      LOGGER.error(errorMsg, e);
      throw new IOException(errorMsg, e);
    }
  }

  /**
   * Returns the number of rows in a Parquet table.
   */
  public long rowCount(Path table) throws IOException {
    try (Connection conn = DuckDbSupport.connect();
         Statement stmt = conn.createStatement();
         ResultSet rs = stmt.executeQuery("SELECT count(*) FROM read_parquet("
             + DuckDbSupport.quotePath(table) + ")")) {
      rs.next();
      return rs.getLong(1);
    } catch (SQLException e) {
      String errorMsg = String.format("Failed to count rows of '%s': %s",
          table, e.getMessage());
      LOGGER.error(errorMsg, e);
      throw new IOException(errorMsg, e);
    }
  }

  /**
   * Defines the {@code new_rows} view over the staged files: the data
   * columns plus two ordering keys, and returns its row count.
   */
  private static long createNewRowsView(Connection conn, StagedBatch batch) throws SQLException {
    String source;
    switch (batch.getFormat()) {
    case PARQUET:
      source = "SELECT * EXCLUDE (" + bookkeeping() + "), "
          + DuckDbSupport.quoteIdentifier(StagedBatch.OFFSET_COLUMN) + " AS " + KEY1 + ", "
          + DuckDbSupport.quoteIdentifier(StagedBatch.ROW_COLUMN) + " AS " + KEY2
          + " FROM read_parquet(" + DuckDbSupport.pathList(batch.getFiles())
          + ", union_by_name = true)";
      break;
    case JSON_LINES:
      source = "SELECT * EXCLUDE (" + bookkeeping() + "), "
          + DuckDbSupport.quoteIdentifier(StagedBatch.OFFSET_COLUMN) + " AS " + KEY1 + ", "
          + DuckDbSupport.quoteIdentifier(StagedBatch.ROW_COLUMN) + " AS " + KEY2
          + " FROM read_json(" + DuckDbSupport.pathList(batch.getFiles())
          + ", format = 'newline_delimited', columns = " + jsonColumns(batch.getColumns())
          + ")";
      break;
    case CSV:
      source = "SELECT *, CAST(0 AS BIGINT) AS " + KEY1 + ", row_number() OVER () AS " + KEY2
          + " FROM read_csv(" + DuckDbSupport.pathList(batch.getFiles())
          + ", header = true, delim = ',', quote = '\"', escape = '\"'"
          + ", all_varchar = true)";
      break;
    default:
      throw new IllegalArgumentException("Unknown batch format: " + batch.getFormat());
    }
    try (Statement stmt = conn.createStatement()) {
      stmt.execute("CREATE TEMP VIEW " + NEW_ROWS + " AS " + source);
      try (ResultSet rs = stmt.executeQuery("SELECT count(*) FROM " + NEW_ROWS)) {
        rs.next();
        return rs.getLong(1);
      }
    }
  }

  /**
   * Keeps one row per key. Rows are ranked by source (new before existing),
   * then by descending ordering keys.
   */
  private static String deduplicate(String input, String columns, List<String> primaryKey,
      boolean withSource) {
    StringBuilder order = new StringBuilder();
    if (withSource) {
      order.append(SOURCE).append(", ");
    }
    order.append(KEY1).append(" DESC, ").append(KEY2).append(" DESC");
    return "SELECT " + columns + " FROM (\n"
        + "  SELECT *, ROW_NUMBER() OVER (PARTITION BY " + columnList(primaryKey)
        + " ORDER BY " + order + ") AS " + RANK + "\n"
        + "  FROM (" + input + ")\n"
        + ") WHERE " + RANK + " = 1";
  }

  private long writeAtomically(Connection conn, String query, Path target)
      throws SQLException, IOException {
    Path parent = target.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
    Files.deleteIfExists(tmp);
    String sql = "COPY (" + query + ") TO " + DuckDbSupport.quotePath(tmp) + " "
        + DuckDbSupport.parquetOptions(compression);
    LOGGER.debug("Merge SQL:\n{}", sql);
    long rows;
    try (Statement stmt = conn.createStatement()) {
      stmt.execute(sql);
      try (ResultSet rs = stmt.executeQuery("SELECT count(*) FROM read_parquet("
          + DuckDbSupport.quotePath(tmp) + ")")) {
        rs.next();
        rows = rs.getLong(1);
      }
    } catch (SQLException e) {
      Files.deleteIfExists(tmp);
      throw e;
    }
    try {
      Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE,
          StandardCopyOption.REPLACE_EXISTING);
    } catch (IOException e) {
      Files.deleteIfExists(tmp);
      throw e;
    }
    return rows;
  }

  private static List<String> columnsOf(Connection conn, String query) throws SQLException {
    try (Statement stmt = conn.createStatement();
         ResultSet rs = stmt.executeQuery(query + " LIMIT 0")) {
      ResultSetMetaData meta = rs.getMetaData();
      ImmutableList.Builder<String> columns = ImmutableList.builder();
      for (int i = 1; i <= meta.getColumnCount(); i++) {
        columns.add(meta.getColumnName(i));
      }
      return columns.build();
    }
  }

  private static List<String> dataColumns(List<String> columns) {
    ImmutableList.Builder<String> data = ImmutableList.builder();
    for (String column : columns) {
      if (!KEY1.equals(column) && !KEY2.equals(column)) {
        data.add(column);
      }
    }
    return data.build();
  }

  /**
   * Fails when the batch carries a column the table lacks. A renamed column
   * shows up as one added and one removed column.
   */
  private static void checkNoAddedColumns(Path target, List<String> existing,
      List<String> batch) throws SchemaDriftException {
    Set<String> added = new LinkedHashSet<String>(batch);
    added.removeAll(existing);
    Set<String> removed = new LinkedHashSet<String>(existing);
    removed.removeAll(batch);
    if (!added.isEmpty()) {
      LOGGER.warn("Schema drift for {}: added {}, removed {}", target.getFileName(),
          added, removed);
      throw new SchemaDriftException(target.getFileName().toString(), added, removed);
    }
  }

  private static void checkKey(List<String> primaryKey, List<String> columns) {
    for (String column : primaryKey) {
      if (!columns.contains(column)) {
        throw new IllegalArgumentException("Primary key column '" + column
            + "' not found in " + columns);
      }
    }
  }

  /** Selects the table's columns from the batch, with {@code NULL} for absent ones. */
  private static String projection(List<String> existing, List<String> batch) {
    StringBuilder sb = new StringBuilder();
    for (String column : existing) {
      if (sb.length() > 0) {
        sb.append(", ");
      }
      String quoted = DuckDbSupport.quoteIdentifier(column);
      if (batch.contains(column)) {
        sb.append(quoted);
      } else {
        sb.append("CAST(NULL AS VARCHAR) AS ").append(quoted);
      }
    }
    return sb.toString();
  }

  private static String columnList(List<String> columns) {
    StringBuilder sb = new StringBuilder();
    for (String column : columns) {
      if (sb.length() > 0) {
        sb.append(", ");
      }
      sb.append(DuckDbSupport.quoteIdentifier(column));
    }
    return sb.toString();
  }

  private static String bookkeeping() {
    return DuckDbSupport.quoteIdentifier(StagedBatch.OFFSET_COLUMN) + ", "
        + DuckDbSupport.quoteIdentifier(StagedBatch.ROW_COLUMN);
  }

  private static String jsonColumns(List<String> columns) {
    StringBuilder sb = new StringBuilder("{");
    for (String column : columns) {
      sb.append(DuckDbSupport.quoteLiteral(column)).append(": 'VARCHAR', ");
    }
    sb.append(DuckDbSupport.quoteLiteral(StagedBatch.OFFSET_COLUMN)).append(": 'BIGINT', ");
    sb.append(DuckDbSupport.quoteLiteral(StagedBatch.ROW_COLUMN)).append(": 'BIGINT'}");
    return sb.toString();
  }
}

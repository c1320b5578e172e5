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

import com.google.common.collect.ImmutableSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Locale;

/**
 * DuckDB connection and SQL quoting helpers shared by the staging sinks and
 * the merge engine.
 */
public final class DuckDbSupport {

  private static final Logger LOGGER = LoggerFactory.getLogger(DuckDbSupport.class);

  /** Parquet codecs accepted by DuckDB's COPY. */
  public static final ImmutableSet<String> CODECS =
      ImmutableSet.of("zstd", "snappy", "gzip", "lz4", "brotli", "uncompressed");

  private DuckDbSupport() {
  }

  /**
   * Opens an in-memory DuckDB connection with the Parquet and JSON
   * extensions loaded.
   */
  public static Connection connect() throws SQLException {
    Connection conn = DriverManager.getConnection("jdbc:duckdb:");
    try (Statement stmt = conn.createStatement()) {
      stmt.execute("LOAD parquet");
      stmt.execute("LOAD json");
    } catch (SQLException e) {
      LOGGER.debug("Extensions already loaded or built-in: {}", e.getMessage());
    }
    return conn;
  }

  /**
   * Quotes a string literal for SQL.
   */
  public static String quoteLiteral(String literal) {
    return "'" + literal.replace("'", "''") + "'";
  }

  /** Quotes a path as a SQL literal using forward slashes. */
  public static String quotePath(Path path) {
    return quoteLiteral(path.toAbsolutePath().toString().replace('\\', '/'));
  }

  /**
   * Quotes an identifier for SQL.
   */
  public static String quoteIdentifier(String identifier) {
    return "\"" + identifier.replace("\"", "\"\"") + "\"";
  }

  /** Returns a SQL list literal of quoted paths, e.g. {@code ['a', 'b']}. */
  public static String pathList(List<Path> paths) {
    StringBuilder sb = new StringBuilder("[");
    for (int i = 0; i < paths.size(); i++) {
      if (i > 0) {
        sb.append(", ");
      }
      sb.append(quotePath(paths.get(i)));
    }
    return sb.append(']').toString();
  }

  /**
   * Returns the COPY options for a Parquet file with the given codec.
   */
  public static String parquetOptions(String compression) {
    String codec = compression.toLowerCase(Locale.ROOT);
    if (!CODECS.contains(codec)) {
      throw new IllegalArgumentException("Unsupported Parquet compression: " + compression);
    }
    return "(FORMAT PARQUET, COMPRESSION " + codec.toUpperCase(Locale.ROOT) + ")";
  }
}

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
package org.opendata.harvest.http;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * One request against the {@code /resource/{id}.{format}} endpoint.
 *
 * <p>Values are URL-encoded as UTF-8 with spaces written as {@code %20}.
 */
public final class SoqlQuery {

  private final String datasetId;
  private final @Nullable Long limit;
  private final @Nullable Long offset;
  private final QueryClauses clauses;
  private final String format;

  private SoqlQuery(String datasetId, @Nullable Long limit, @Nullable Long offset,
      QueryClauses clauses, String format) {
    this.datasetId = datasetId;
    this.limit = limit;
    this.offset = offset;
    this.clauses = clauses;
    this.format = format;
  }

  /** Creates a JSON page query. */
  public static SoqlQuery page(String datasetId, long offset, long limit,
      QueryClauses clauses) {
    return new SoqlQuery(datasetId, limit, offset, clauses, "json");
  }

  /**
   * Creates a count query, {@code count(*)} or {@code count(distinct field)}
   * when a distinct field is given.
   */
  public static SoqlQuery count(String datasetId, @Nullable String where,
      @Nullable String distinctField) {
    String select = distinctField == null
        ? "count(*)"
        : "count(distinct " + distinctField + ")";
    return new SoqlQuery(datasetId, null, null,
        new QueryClauses(select, where, null, null), "json");
  }

  /** Creates a CSV export query without a practical row limit. */
  public static SoqlQuery csvExport(String datasetId, @Nullable String where) {
    return new SoqlQuery(datasetId, 999999999L, null,
        new QueryClauses(null, where, null, null), "csv");
  }

  public String getDatasetId() {
    return datasetId;
  }

  public @Nullable Long getOffset() {
    return offset;
  }

  public QueryClauses getClauses() {
    return clauses;
  }

  public String getFormat() {
    return format;
  }

  /**
   * Builds the request URI.
   *
   * @param baseUrl API root without trailing slash, e.g. {@code https://opendata.rdw.nl}
   */
  public URI toUri(String baseUrl) {
    StringBuilder sb = new StringBuilder(baseUrl)
        .append("/resource/").append(datasetId).append('.').append(format);
    char sep = '?';
    if (limit != null) {
      sep = append(sb, sep, "$limit", String.valueOf(limit));
    }
    if (offset != null) {
      sep = append(sb, sep, "$offset", String.valueOf(offset));
    }
    sep = append(sb, sep, "$select", clauses.getSelect());
    sep = append(sb, sep, "$where", clauses.getWhere());
    sep = append(sb, sep, "$group", clauses.getGroup());
    append(sb, sep, "$order", clauses.getOrder());
    return URI.create(sb.toString());
  }

  private static char append(StringBuilder sb, char sep, String name, @Nullable String value) {
    if (value == null || value.isEmpty()) {
      return sep;
    }
    sb.append(sep).append(name).append('=').append(encode(value));
    return '&';
  }

  static String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
  }

  @Override public String toString() {
    return datasetId + "." + format + "[offset=" + offset + ", limit=" + limit + "]";
  }
}

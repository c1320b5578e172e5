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

import org.opendata.harvest.config.HarvestConfig;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.time.Duration;

/**
 * Owns the HTTP client shared by every worker of a harvest run.
 *
 * <p>The JDK client pools connections and is safe for concurrent use, so one
 * instance serves all page, count and export requests. The session itself
 * is read-only after construction.
 */
public class SessionManager {

  private static final Logger LOGGER = LoggerFactory.getLogger(SessionManager.class);

  private final HttpClient httpClient;
  private final String baseUrl;
  private final @Nullable String appToken;
  private final String tokenHeader;
  private final String userAgent;

  public SessionManager(HarvestConfig config) {
    this(HttpClient.newBuilder()
            .connectTimeout(config.getTimeouts().getConnect())
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build(),
        config.getBaseUrl(), config.getAppToken(), config.getTokenHeader(),
        config.getUserAgent());
  }

  public SessionManager(HttpClient httpClient, String baseUrl, @Nullable String appToken,
      String tokenHeader, String userAgent) {
    this.httpClient = httpClient;
    this.baseUrl = baseUrl;
    this.appToken = appToken;
    this.tokenHeader = tokenHeader;
    this.userAgent = userAgent;
    if (appToken != null) {
      LOGGER.info("Using app token {}...",
          appToken.substring(0, Math.min(8, appToken.length())));
    } else {
      LOGGER.warn("No app token configured; requests are subject to stricter throttling");
    }
  }

  public HttpClient getHttpClient() {
    return httpClient;
  }

  public String getBaseUrl() {
    return baseUrl;
  }

  /**
   * Returns a GET request builder with the session headers applied.
   *
   * @param uri Request URI
   * @param timeout Per-request timeout
   */
  public HttpRequest.Builder newRequest(URI uri, Duration timeout) {
    HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
        .timeout(timeout)
        .header("User-Agent", userAgent)
        .GET();
    if (appToken != null) {
      builder.header(tokenHeader, appToken);
    }
    return builder;
  }

  public URI resolve(SoqlQuery query) {
    return query.toUri(baseUrl);
  }

  /**
   * Returns the bulk CSV export URI. Without a filter the full view export is
   * used; with a filter the resource endpoint is queried with an unbounded limit.
   */
  public URI exportUri(String datasetId, @Nullable String where) {
    if (where == null || where.isEmpty()) {
      return URI.create(baseUrl + "/api/views/" + datasetId + "/rows.csv?accessType=DOWNLOAD");
    }
    return SoqlQuery.csvExport(datasetId, where).toUri(baseUrl);
  }
}

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

import org.opendata.harvest.rate.RateController;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Base class for clients of the open-data API.
 *
 * <p>Provides the shared request loop used by page, count and export
 * requests:
 * <ul>
 *   <li>transient network failures are retried by the {@link RetryPolicy};
 *       the response body is consumed inside the retried call so a truncated
 *       transfer is retried as well</li>
 *   <li>HTTP 429 is reported to the {@link RateController}, the caller sleeps
 *       the returned wait and the request is re-issued, with no attempt
 *       ceiling</li>
 *   <li>any other non-2xx status fails immediately with
 *       {@link HttpStatusException}</li>
 * </ul>
 */
public abstract class AbstractApiClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(AbstractApiClient.class);

  private static final int TOO_MANY_REQUESTS = 429;

  /**
   * Consumes a successful response body.
   *
   * @param <T> Result type
   */
  @FunctionalInterface
  protected interface BodyReader<T> {
    T read(InputStream body) throws IOException;
  }

  protected final SessionManager session;
  protected final RetryPolicy retryPolicy;
  protected final RateController rateController;
  protected final Sleeper sleeper;

  protected AbstractApiClient(SessionManager session, RetryPolicy retryPolicy,
      RateController rateController, Sleeper sleeper) {
    this.session = session;
    this.retryPolicy = retryPolicy;
    this.rateController = rateController;
    this.sleeper = sleeper;
  }

  /**
   * Issues a GET request and reads the body.
   *
   * @param description Label for log messages
   * @param uri Request URI
   * @param timeout Per-request timeout
   * @param accept Accept header value
   * @param reader Consumes the body of a 2xx response
   */
  protected <T> T executeGet(String description, URI uri, Duration timeout, String accept,
      BodyReader<T> reader) throws IOException, InterruptedException {
    HttpRequest request = session.newRequest(uri, timeout)
        .header("Accept", accept)
        .build();
    while (true) {
      Attempt<T> attempt = retryPolicy.execute(description, () -> send(request, reader));
      if (!attempt.throttled) {
        rateController.onSuccess();
        return attempt.value;
      }
      Duration wait = rateController.onThrottle();
      LOGGER.warn("{} throttled (429), waiting {}s; workers now {}",
          description, wait.getSeconds(), rateController.workerCount());
      sleeper.sleep(wait);
    }
  }

  private <T> Attempt<T> send(HttpRequest request, BodyReader<T> reader)
      throws IOException, InterruptedException {
    HttpResponse<InputStream> response = session.getHttpClient()
        .send(request, HttpResponse.BodyHandlers.ofInputStream());
    try (InputStream body = response.body()) {
      int status = response.statusCode();
      if (status == TOO_MANY_REQUESTS) {
        return Attempt.throttled();
      }
      if (status < 200 || status >= 300) {
        throw new HttpStatusException(status, request.uri(), readSnippet(body));
      }
      return Attempt.of(reader.read(body));
    }
  }

  private static String readSnippet(InputStream body) {
    try {
      byte[] bytes = body.readNBytes(2048);
      return new String(bytes, StandardCharsets.UTF_8);
    } catch (IOException e) {
      LOGGER.debug("Could not read error body: {}", e.toString());
      return "";
    }
  }

  /** Result of one HTTP exchange: a value or a throttle signal. */
  private static final class Attempt<T> {
    final @Nullable T value;
    final boolean throttled;

    private Attempt(@Nullable T value, boolean throttled) {
      this.value = value;
      this.throttled = throttled;
    }

    static <T> Attempt<T> of(T value) {
      return new Attempt<T>(value, false);
    }

    static <T> Attempt<T> throttled() {
      return new Attempt<T>(null, true);
    }
  }
}

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

import com.fasterxml.jackson.core.io.JsonEOFException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.EOFException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Locale;

/**
 * Bounded exponential backoff for transient network failures.
 *
 * <p>A call is attempted up to {@code maxAttempts} times. After a transient
 * failure the policy sleeps {@code min(baseDelay * 2^(attempt-1), maxDelay)}
 * and tries again; the last failure is rethrown. Anything that is not
 * transient, including {@link HttpStatusException}, propagates at once.
 */
public class RetryPolicy {

  private static final Logger LOGGER = LoggerFactory.getLogger(RetryPolicy.class);

  /**
   * An I/O operation that may be retried.
   *
   * @param <T> Result type
   */
  @FunctionalInterface
  public interface IoCall<T> {
    T call() throws IOException, InterruptedException;
  }

  private final int maxAttempts;
  private final long baseDelayMs;
  private final long maxDelayMs;
  private final Sleeper sleeper;

  public RetryPolicy(int maxAttempts, long baseDelayMs, long maxDelayMs, Sleeper sleeper) {
    if (maxAttempts <= 0) {
      throw new IllegalArgumentException("maxAttempts must be positive: " + maxAttempts);
    }
    this.maxAttempts = maxAttempts;
    this.baseDelayMs = baseDelayMs;
    this.maxDelayMs = maxDelayMs;
    this.sleeper = sleeper;
  }

  public static RetryPolicy fromConfig(HarvestConfig.RetryConfig config, Sleeper sleeper) {
    return new RetryPolicy(config.getMaxAttempts(), config.getBaseDelayMs(),
        config.getMaxDelayMs(), sleeper);
  }

  public int getMaxAttempts() {
    return maxAttempts;
  }

  /**
   * Runs the call, retrying transient failures.
   *
   * @param description Short label used in log messages
   * @param call Operation to run
   * @return Result of the first successful attempt
   * @throws IOException the last transient failure, or the first non-transient one
   * @throws InterruptedException if interrupted while waiting between attempts
   */
  public <T> T execute(String description, IoCall<T> call)
      throws IOException, InterruptedException {
    int attempt = 1;
    while (true) {
      try {
        return call.call();
      } catch (IOException e) {
        if (!isTransient(e)) {
          throw e;
        }
        if (attempt >= maxAttempts) {
          LOGGER.error("{} failed after {} attempts: {}", description, attempt, e.toString());
          throw e;
        }
        long delay = delayMillis(attempt);
        LOGGER.warn("{} failed, retrying in {}ms (attempt {}/{}): {}",
            description, delay, attempt, maxAttempts, e.toString());
        sleeper.sleep(Duration.ofMillis(delay));
        attempt++;
      }
    }
  }

  /**
   * Returns the backoff before the next attempt, after {@code attempt}
   * attempts have failed.
   */
  long delayMillis(int attempt) {
    int shift = Math.min(attempt - 1, 30);
    long delay = baseDelayMs * (1L << shift);
    if (delay < 0 || delay > maxDelayMs) {
      return maxDelayMs;
    }
    return delay;
  }

  /**
   * Returns whether the failure is a connection reset, timeout or truncated
   * transfer.
   */
  public static boolean isTransient(IOException e) {
    if (e instanceof HttpStatusException) {
      return false;
    }
    if (e instanceof HttpTimeoutException
        || e instanceof ConnectException
        || e instanceof SocketException
        || e instanceof EOFException
        || e instanceof JsonEOFException) {
      return true;
    }
    Throwable cause = e.getCause();
    if (cause instanceof IOException && cause != e && isTransient((IOException) cause)) {
      return true;
    }
    String message = e.getMessage();
    if (message == null) {
      return false;
    }
    String lower = message.toLowerCase(Locale.ROOT);
    return lower.contains("connection reset")
        || lower.contains("eof")
        || lower.contains("stream closed")
        || lower.contains("premature")
        || lower.contains("timed out");
  }
}

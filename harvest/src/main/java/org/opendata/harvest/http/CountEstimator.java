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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.time.Duration;
import java.util.Iterator;
import java.util.Map;

/**
 * Queries the approximate number of rows, or distinct groups, a dataset
 * query will return. The result sizes the fetch plan and the progress
 * denominator only; end of data is decided by a short page.
 */
public class CountEstimator extends AbstractApiClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(CountEstimator.class);

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final Duration countTimeout;

  public CountEstimator(SessionManager session, RetryPolicy retryPolicy,
      RateController rateController, Sleeper sleeper, Duration countTimeout) {
    super(session, retryPolicy, rateController, sleeper);
    this.countTimeout = countTimeout;
  }

  /**
   * Returns the estimated count.
   *
   * @param datasetId Dataset id
   * @param where Optional filter
   * @param distinctField When set, counts distinct values of this field
   */
  public long estimate(String datasetId, @Nullable String where,
      @Nullable String distinctField) throws IOException, InterruptedException {
    URI uri = session.resolve(SoqlQuery.count(datasetId, where, distinctField));
    long count = executeGet(datasetId + " count", uri, countTimeout, "application/json",
        CountEstimator::readCount);
    LOGGER.info("{}: estimated {} {}", datasetId, count,
        distinctField == null ? "rows" : "groups of " + distinctField);
    return count;
  }

  /**
   * Reads the first key starting with {@code count} from the first row.
   * An empty array means zero.
   */
  static long readCount(InputStream body) throws IOException {
    JsonNode root = MAPPER.readTree(body);
    if (root == null || !root.isArray()) {
      throw new IOException("Expected JSON array from count query but got "
          + (root == null ? "nothing" : root.getNodeType()));
    }
    if (root.size() == 0) {
      return 0L;
    }
    JsonNode first = root.get(0);
    Iterator<Map.Entry<String, JsonNode>> fields = first.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      if (field.getKey().startsWith("count")) {
        String text = field.getValue().asText();
        try {
          return Long.parseLong(text.trim());
        } catch (NumberFormatException e) {
          throw new IOException("Count value is not a number: " + text, e);
        }
      }
    }
    throw new IOException("No count field in response: " + first);
  }
}

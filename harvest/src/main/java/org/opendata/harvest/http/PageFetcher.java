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

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fetches one page of JSON records from {@code /resource/{id}.json}.
 *
 * <p>The response array is read with a streaming parser. Scalar values
 * become their text form, nested objects and arrays become compact JSON and
 * JSON nulls are omitted, matching how the API leaves empty fields out.
 */
public class PageFetcher extends AbstractApiClient implements PageSource {

  private static final Logger LOGGER = LoggerFactory.getLogger(PageFetcher.class);

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final Duration pageTimeout;

  public PageFetcher(SessionManager session, RetryPolicy retryPolicy,
      RateController rateController, Sleeper sleeper, Duration pageTimeout) {
    super(session, retryPolicy, rateController, sleeper);
    this.pageTimeout = pageTimeout;
  }

  @Override public List<Map<String, String>> fetch(String datasetId, long offset, int limit,
      QueryClauses clauses) throws IOException, InterruptedException {
    SoqlQuery query = SoqlQuery.page(datasetId, offset, limit, clauses);
    URI uri = session.resolve(query);
    LOGGER.debug("GET {}", uri);
    return executeGet(datasetId + " offset " + offset, uri, pageTimeout,
        "application/json", PageFetcher::readRecords);
  }

  /**
   * Parses a JSON array of flat objects.
   */
  static List<Map<String, String>> readRecords(InputStream body) throws IOException {
    List<Map<String, String>> records = new ArrayList<Map<String, String>>();
    try (JsonParser parser = MAPPER.getFactory().createParser(body)) {
      JsonToken token = parser.nextToken();
      if (token == null) {
        return records;
      }
      if (token != JsonToken.START_ARRAY) {
        throw new IOException("Expected JSON array but found " + token);
      }
      while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
        if (token == null) {
          throw new EOFException("Truncated JSON array after "
              + records.size() + " records");
        }
        if (token != JsonToken.START_OBJECT) {
          throw new IOException("Expected JSON object but found " + token);
        }
        records.add(readRecord(parser));
      }
    }
    return records;
  }

  private static Map<String, String> readRecord(JsonParser parser) throws IOException {
    Map<String, String> record = new LinkedHashMap<String, String>();
    while (parser.nextToken() == JsonToken.FIELD_NAME) {
      String field = parser.currentName();
      JsonToken value = parser.nextToken();
      if (value == JsonToken.VALUE_NULL) {
        continue;
      }
      if (value == JsonToken.START_OBJECT || value == JsonToken.START_ARRAY) {
        JsonNode node = MAPPER.readTree(parser);
        record.put(field, MAPPER.writeValueAsString(node));
      } else {
        record.put(field, parser.getText());
      }
    }
    return record;
  }
}

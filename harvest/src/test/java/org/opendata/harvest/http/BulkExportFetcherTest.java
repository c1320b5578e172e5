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

import org.opendata.harvest.http.StubApiServer.StubResponse;
import org.opendata.harvest.rate.MutableClock;
import org.opendata.harvest.rate.RateController;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for BulkExportFetcher.
 */
@Tag("unit")
public class BulkExportFetcherTest {

  private static final String CSV = "Kenteken,Brandstof volgnummer,Brandstof omschrijving\n"
      + "AB123C,1,Benzine\n"
      + "AB123C,2,Elektriciteit\n";

  @TempDir
  Path tempDir;

  private StubApiServer server;
  private BulkExportFetcher fetcher;

  @BeforeEach
  void setUp() throws IOException {
    server = new StubApiServer();
    RecordingSleeper sleeper = new RecordingSleeper();
    RateController rateController = new RateController(8, 2, Duration.ofSeconds(30), 5,
        Duration.ofSeconds(32), new MutableClock(Instant.parse("2024-01-15T10:00:00Z")));
    SessionManager session = new SessionManager(HttpClient.newHttpClient(),
        server.baseUrl(), "token123", "X-App-Token", "harvest-test");
    fetcher = new BulkExportFetcher(session, new RetryPolicy(3, 10, 100, sleeper),
        rateController, sleeper, Duration.ofSeconds(10));
  }

  @AfterEach
  void tearDown() {
    server.close();
  }

  @Test void testUnfilteredExportUsesViewEndpoint() throws Exception {
    server.on("/api/views/8ys7-d773/rows.csv", (uri, headers) -> StubResponse.csv(CSV));
    Path target = tempDir.resolve("export/brandstof.csv");
    AtomicLong reported = new AtomicLong();

    long bytes = fetcher.download("8ys7-d773", null, target, reported::addAndGet);

    byte[] expected = CSV.getBytes(StandardCharsets.UTF_8);
    assertEquals(expected.length, bytes);
    assertEquals(expected.length, reported.get());
    assertEquals(CSV, new String(Files.readAllBytes(target), StandardCharsets.UTF_8));
    assertEquals("DOWNLOAD",
        StubApiServer.queryParams(server.getRequests().get(0)).get("accessType"));
  }

  @Test void testFilteredExportUsesResourceEndpoint() throws Exception {
    server.on("/resource/8ys7-d773.csv", (uri, headers) -> StubResponse.csv(CSV));
    Path target = tempDir.resolve("brandstof.csv");
    Files.write(target, "stale content that is longer than the export body itself........"
        .repeat(4).getBytes(StandardCharsets.UTF_8));

    fetcher.download("8ys7-d773", "Brandstof volgnummer = '1'", target, n -> { });

    URI request = server.getRequests().get(0);
    assertEquals("Brandstof volgnummer = '1'", StubApiServer.queryParams(request).get("$where"));
    assertEquals(CSV, new String(Files.readAllBytes(target), StandardCharsets.UTF_8));
  }

  @Test void testMissingExportFails() {
    assertThrows(HttpStatusException.class,
        () -> fetcher.download("8ys7-d773", null, tempDir.resolve("x.csv"), n -> { }));
  }
}

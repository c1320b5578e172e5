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
package org.opendata.harvest;

import org.opendata.harvest.config.DatasetDescriptor;
import org.opendata.harvest.config.FetchMode;
import org.opendata.harvest.config.HarvestConfig;
import org.opendata.harvest.http.RecordingSleeper;
import org.opendata.harvest.http.StubApiServer;
import org.opendata.harvest.http.StubApiServer.StubResponse;
import org.opendata.harvest.merge.DuckDbSupport;
import org.opendata.harvest.merge.MergeResult;
import org.opendata.harvest.rate.MutableClock;
import org.opendata.harvest.watermark.JsonWatermarkStore;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * End-to-end tests of HarvestPipeline against an in-process API stub.
 */
@Tag("integration")
public class HarvestPipelineTest {

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private static final String CSV = "Kenteken,Brandstof volgnummer,Brandstof omschrijving\n"
      + "V0001,1,Benzine\n"
      + "V0002,1,Diesel\n"
      + "V0002,2,Elektriciteit\n";

  @TempDir
  Path tempDir;

  private StubApiServer server;
  private MutableClock clock;
  private JsonWatermarkStore watermarks;

  private final DatasetDescriptor voertuigen = DatasetDescriptor.builder()
      .id("m9d7-ebf2")
      .name("voertuigen")
      .primaryKey("kenteken")
      .dateField("datum")
      .pageSize(50)
      .order(":id")
      .build();

  private final DatasetDescriptor brandstof = DatasetDescriptor.builder()
      .id("8ys7-d773")
      .name("brandstof")
      .primaryKey("Kenteken", "Brandstof volgnummer")
      .mode(FetchMode.BULK_CSV)
      .build();

  @BeforeEach
  void setUp() throws IOException {
    server = new StubApiServer();
    clock = new MutableClock(Instant.parse("2024-01-15T10:00:00Z"));
    watermarks = new JsonWatermarkStore(tempDir.resolve("out/.download_metadata.json"));
  }

  @AfterEach
  void tearDown() {
    server.close();
  }

  private HarvestConfig config(int parallelism, DatasetDescriptor... datasets) {
    return HarvestConfig.builder()
        .baseUrl(server.baseUrl())
        .appToken("token123")
        .outputDirectory(tempDir.resolve("out"))
        .retry(new HarvestConfig.RetryConfig(3, 1, 10))
        .rateLimit(new HarvestConfig.RateLimitConfig(4, 2, Duration.ofSeconds(30), 5,
            Duration.ofSeconds(32)))
        .datasetParallelism(parallelism)
        .datasets(ImmutableList.copyOf(datasets))
        .build();
  }

  private HarvestPipeline pipeline(HarvestConfig config) {
    return new HarvestPipeline(config, clock, new RecordingSleeper(), watermarks);
  }

  private static Map<String, String> vehicle(int i, String merk, String datum) {
    Map<String, String> row = new LinkedHashMap<String, String>();
    row.put("kenteken", String.format("V%04d", i));
    row.put("merk", merk);
    row.put("datum", datum);
    return row;
  }

  private static List<Map<String, String>> vehicles(int from, int to, String merk,
      String datum) {
    List<Map<String, String>> rows = new ArrayList<Map<String, String>>();
    for (int i = from; i <= to; i++) {
      rows.add(vehicle(i, merk, datum));
    }
    return rows;
  }

  /** Serves count and page queries over the rows chosen for each where clause. */
  private static StubApiServer.Responder resource(
      Function<String, List<Map<String, String>>> rowsForWhere) {
    return (uri, headers) -> {
      Map<String, String> params = StubApiServer.queryParams(uri);
      List<Map<String, String>> rows = rowsForWhere.apply(params.get("$where"));
      String select = params.get("$select");
      if (select != null && select.startsWith("count")) {
        return StubResponse.json("[{\"count\":\"" + rows.size() + "\"}]");
      }
      int offset = (int) StubApiServer.longParam(uri, "$offset", 0);
      int limit = (int) StubApiServer.longParam(uri, "$limit", 1000);
      List<Map<String, String>> page = offset >= rows.size()
          ? Collections.<Map<String, String>>emptyList()
          : rows.subList(offset, Math.min(rows.size(), offset + limit));
      return StubResponse.json(MAPPER.writeValueAsString(page));
    };
  }

  private List<String> whereClauses(String datasetId) {
    List<String> result = new ArrayList<String>();
    for (URI uri : server.getRequests()) {
      if (uri.getPath().contains(datasetId)) {
        result.add(StubApiServer.queryParams(uri).get("$where"));
      }
    }
    return result;
  }

  private Map<String, String> table(String name, String keyColumn, String valueColumn)
      throws SQLException {
    Map<String, String> result = new LinkedHashMap<String, String>();
    Path file = tempDir.resolve("out/" + name + ".parquet");
    try (Connection conn = DuckDbSupport.connect();
         Statement stmt = conn.createStatement();
         ResultSet rs = stmt.executeQuery("SELECT "
             + DuckDbSupport.quoteIdentifier(keyColumn) + ", "
             + DuckDbSupport.quoteIdentifier(valueColumn) + " FROM read_parquet("
             + DuckDbSupport.quotePath(file) + ") ORDER BY 1")) {
      while (rs.next()) {
        result.put(rs.getString(1), rs.getString(2));
      }
    }
    return result;
  }

  private boolean stagingIsEmpty() throws IOException {
    Path staging = tempDir.resolve("out/_staging");
    if (!Files.exists(staging)) {
      return true;
    }
    try (Stream<Path> entries = Files.list(staging)) {
      return !entries.findAny().isPresent();
    }
  }

  @Test void testFullHarvest() throws Exception {
    server.on("/resource/m9d7-ebf2.json",
        resource(where -> vehicles(1, 120, "VOLVO", "20240101")));
    server.on("/api/views/8ys7-d773/rows.csv", (uri, headers) -> StubResponse.csv(CSV));
    HarvestPipeline pipeline = pipeline(config(1, voertuigen, brandstof));

    HarvestResult result = pipeline.runAll(false);

    assertTrue(result.isCompleteSuccess(), String.valueOf(result.getFailed()));
    DatasetOutcome outcome = result.getOutcomes().get(0);
    assertEquals(120, outcome.getRowsFetched());
    assertFalse(outcome.isIncremental());
    assertEquals(MergeResult.Action.REPLACED, outcome.getMergeResult().getAction());
    assertEquals(120, table("voertuigen", "kenteken", "merk").size());
    assertEquals(3, table("brandstof", "Kenteken", "Brandstof omschrijving").size());

    assertEquals("20240115", watermarks.get("m9d7-ebf2").getLastDate());
    assertEquals("20240115", watermarks.get("8ys7-d773").getLastDate());
    assertTrue(stagingIsEmpty());
    assertEquals(100, pipeline.getProgress().snapshots().get("voertuigen").getPercent());
    assertEquals("token123", server.lastHeaders().getFirst("X-App-Token"));
  }

  @Test void testIncrementalHarvestMergesNewRows() throws Exception {
    server.on("/resource/m9d7-ebf2.json",
        resource(where -> vehicles(1, 120, "VOLVO", "20240101")));
    pipeline(config(1, voertuigen)).runAll(false);

    clock.advance(Duration.ofDays(1));
    List<Map<String, String>> changed = vehicles(116, 125, "FIAT", "20240115");
    server.on("/resource/m9d7-ebf2.json", resource(where ->
        where != null && where.contains("datum >= '20240115'")
            ? changed
            : vehicles(1, 120, "VOLVO", "20240101")));

    HarvestResult result = pipeline(config(1, voertuigen)).runAll(true);

    assertTrue(result.isCompleteSuccess(), String.valueOf(result.getFailed()));
    DatasetOutcome outcome = result.getOutcomes().get(0);
    assertTrue(outcome.isIncremental());
    assertEquals(10, outcome.getRowsFetched());
    assertEquals(MergeResult.Action.MERGED, outcome.getMergeResult().getAction());

    Map<String, String> rows = table("voertuigen", "kenteken", "merk");
    assertEquals(125, rows.size());
    assertEquals("VOLVO", rows.get("V0115"));
    assertEquals("FIAT", rows.get("V0116"));
    assertEquals("FIAT", rows.get("V0125"));
    assertEquals("20240116", watermarks.get("m9d7-ebf2").getLastDate());
    List<String> wheres = whereClauses("m9d7-ebf2");
    assertEquals("datum >= '20240115'", wheres.get(wheres.size() - 1));
  }

  @Test void testSparseIncrementalBatchIsMergedWithoutRefetch() throws Exception {
    List<Map<String, String>> initial = vehicles(1, 30, "VOLVO", "20240101");
    for (Map<String, String> row : initial) {
      row.put("vervaldatum_tachograaf", "20300101");
    }
    server.on("/resource/m9d7-ebf2.json", resource(where -> initial));
    pipeline(config(1, voertuigen)).runAll(false);

    clock.advance(Duration.ofDays(1));
    List<Map<String, String>> changed = vehicles(28, 32, "FIAT", "20240115");
    server.on("/resource/m9d7-ebf2.json", resource(where ->
        where != null ? changed : initial));

    HarvestResult result = pipeline(config(1, voertuigen)).runAll(true);

    DatasetOutcome outcome = result.getOutcomes().get(0);
    assertTrue(outcome.isSuccess(), String.valueOf(outcome.getError()));
    assertFalse(outcome.isRefetchedAfterDrift());
    assertEquals(MergeResult.Action.MERGED, outcome.getMergeResult().getAction());
    Map<String, String> expiry = table("voertuigen", "kenteken", "vervaldatum_tachograaf");
    assertEquals(32, expiry.size());
    assertEquals("20300101", expiry.get("V0027"));
    assertNull(expiry.get("V0028"));
    assertNull(expiry.get("V0032"));
    assertEquals("FIAT", table("voertuigen", "kenteken", "merk").get("V0028"));
    List<String> wheres = whereClauses("m9d7-ebf2");
    assertNotNull(wheres.get(wheres.size() - 1));
  }

  @Test void testIncrementalWithoutTableRunsFullFetch() throws Exception {
    server.on("/resource/m9d7-ebf2.json",
        resource(where -> vehicles(1, 10, "VOLVO", "20240101")));

    HarvestResult result = pipeline(config(1, voertuigen)).runAll(true);

    DatasetOutcome outcome = result.getOutcomes().get(0);
    assertTrue(outcome.isSuccess());
    assertFalse(outcome.isIncremental());
    for (String where : whereClauses("m9d7-ebf2")) {
      assertNull(where);
    }
  }

  @Test void testFailedDatasetDoesNotStopOthers() throws Exception {
    DatasetDescriptor broken = DatasetDescriptor.builder()
        .id("dead-beef")
        .name("kapot")
        .build();
    server.on("/resource/m9d7-ebf2.json",
        resource(where -> vehicles(1, 20, "VOLVO", "20240101")));
    server.on("/resource/dead-beef.json",
        (uri, headers) -> StubResponse.status(500, "internal error"));

    HarvestResult result = pipeline(config(1, broken, voertuigen)).runAll(false);

    assertFalse(result.isCompleteSuccess());
    assertEquals(1, result.getFailed().size());
    DatasetOutcome failed = result.getFailed().get(0);
    assertEquals("kapot", failed.getName());
    assertNotNull(failed.getError());
    assertEquals(1, result.getSucceeded().size());
    assertEquals(20, result.getTotalRowsFetched());
    assertNull(watermarks.get("dead-beef"));
    assertFalse(Files.exists(tempDir.resolve("out/kapot.parquet")));
    assertTrue(stagingIsEmpty());
  }

  @Test void testFailedPageKeepsPreviousTable() throws Exception {
    server.on("/resource/m9d7-ebf2.json",
        resource(where -> vehicles(1, 120, "VOLVO", "20240101")));
    pipeline(config(1, voertuigen)).runAll(false);
    long modified = Files.getLastModifiedTime(tempDir.resolve("out/voertuigen.parquet"))
        .toMillis();

    clock.advance(Duration.ofDays(1));
    StubApiServer.Responder healthy = resource(where -> vehicles(1, 120, "AUDI", "20240101"));
    server.on("/resource/m9d7-ebf2.json", (uri, headers) ->
        StubApiServer.longParam(uri, "$offset", 0) == 50
            ? StubResponse.status(404, "gone")
            : healthy.respond(uri, headers));

    HarvestResult result = pipeline(config(1, voertuigen)).runAll(false);

    assertFalse(result.isCompleteSuccess());
    assertEquals(modified, Files.getLastModifiedTime(
        tempDir.resolve("out/voertuigen.parquet")).toMillis());
    assertEquals("VOLVO", table("voertuigen", "kenteken", "merk").get("V0001"));
    assertEquals("20240115", watermarks.get("m9d7-ebf2").getLastDate());
    assertTrue(stagingIsEmpty());
  }

  @Test void testSchemaDriftRefetchesFullDataset() throws Exception {
    server.on("/resource/m9d7-ebf2.json",
        resource(where -> vehicles(1, 30, "VOLVO", "20240101")));
    pipeline(config(1, voertuigen)).runAll(false);

    clock.advance(Duration.ofDays(1));
    List<Map<String, String>> withColour = vehicles(1, 40, "VOLVO", "20240101");
    for (Map<String, String> row : withColour) {
      row.put("kleur", "ROOD");
    }
    server.on("/resource/m9d7-ebf2.json", resource(where ->
        where != null ? withColour.subList(35, 40) : withColour));

    HarvestResult result = pipeline(config(1, voertuigen)).runAll(true);

    DatasetOutcome outcome = result.getOutcomes().get(0);
    assertTrue(outcome.isSuccess(), String.valueOf(outcome.getError()));
    assertTrue(outcome.isRefetchedAfterDrift());
    assertEquals(MergeResult.Action.REPLACED, outcome.getMergeResult().getAction());
    Map<String, String> colours = table("voertuigen", "kenteken", "kleur");
    assertEquals(40, colours.size());
    assertEquals("ROOD", colours.get("V0001"));
    List<String> wheres = whereClauses("m9d7-ebf2");
    assertNull(wheres.get(wheres.size() - 1));
    assertTrue(stagingIsEmpty());
  }

  @Test void testParallelDatasets() throws Exception {
    DatasetDescriptor other = DatasetDescriptor.builder()
        .id("sgfe-77wx")
        .name("meldingen")
        .primaryKey("kenteken")
        .pageSize(7)
        .build();
    server.on("/resource/m9d7-ebf2.json",
        resource(where -> vehicles(1, 120, "VOLVO", "20240101")));
    server.on("/resource/sgfe-77wx.json",
        resource(where -> vehicles(1, 33, "OPEL", "20240101")));

    HarvestResult result = pipeline(config(2, voertuigen, other)).runAll(false);

    assertTrue(result.isCompleteSuccess(), String.valueOf(result.getFailed()));
    assertEquals("voertuigen", result.getOutcomes().get(0).getName());
    assertEquals("meldingen", result.getOutcomes().get(1).getName());
    assertEquals(153, result.getTotalRowsFetched());
    assertEquals(33, table("meldingen", "kenteken", "merk").size());
  }

  @Test void testJsonLinesStaging() throws Exception {
    server.on("/resource/m9d7-ebf2.json",
        resource(where -> vehicles(1, 75, "SAAB", "20240101")));
    HarvestConfig config = HarvestConfig.builder()
        .baseUrl(server.baseUrl())
        .outputDirectory(tempDir.resolve("out"))
        .stagingFormat(HarvestConfig.StagingFormat.JSON_LINES)
        .datasets(ImmutableList.of(voertuigen))
        .build();

    HarvestResult result = pipeline(config).runAll(false);

    assertTrue(result.isCompleteSuccess(), String.valueOf(result.getFailed()));
    Map<String, String> rows = table("voertuigen", "kenteken", "merk");
    assertEquals(75, rows.size());
    assertEquals("SAAB", rows.get("V0075"));
    assertTrue(stagingIsEmpty());
  }

  @Test void testIncrementalWhere() {
    assertEquals("datum >= '20240115'",
        HarvestPipeline.incrementalWhere(null, "datum", "20240115"));
    assertEquals("(merk = 'VOLVO') AND datum >= '20240115'",
        HarvestPipeline.incrementalWhere("merk = 'VOLVO'", "datum", "20240115"));
  }
}

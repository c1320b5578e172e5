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
package org.opendata.harvest.config;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for HarvestConfig and DatasetDescriptor parsing.
 */
@Tag("unit")
public class HarvestConfigTest {

  @TempDir
  Path tempDir;

  @AfterEach
  void clearProperties() {
    System.clearProperty("HARVEST_TEST_TOKEN");
  }

  private static Map<String, Object> minimal() {
    Map<String, Object> map = new HashMap<String, Object>();
    map.put("baseUrl", "https://opendata.rdw.nl/");
    map.put("outputDirectory", "/data/out");
    map.put("datasets", ImmutableList.of(
        ImmutableMap.of("id", "m9d7-ebf2", "name", "voertuigen", "primaryKey", "kenteken")));
    return map;
  }

  @Test void testDefaults() {
    HarvestConfig config = HarvestConfig.fromMap(minimal());

    assertEquals("https://opendata.rdw.nl", config.getBaseUrl());
    assertNull(config.getAppToken());
    assertEquals("X-App-Token", config.getTokenHeader());
    assertEquals(Paths.get("/data/out/_staging"), config.getStagingDirectory());
    assertEquals(Paths.get("/data/out/.download_metadata.json"), config.getWatermarkFile());
    assertEquals("zstd", config.getCompression());
    assertSame(HarvestConfig.StagingFormat.PARQUET, config.getStagingFormat());
    assertEquals(5, config.getProgressStepPercent());
    assertEquals(1, config.getDatasetParallelism());
    assertFalse(config.isVerbose());

    assertEquals(Duration.ofSeconds(180), config.getTimeouts().getPage());
    assertEquals(Duration.ofSeconds(60), config.getTimeouts().getCount());
    assertEquals(5, config.getRetry().getMaxAttempts());
    assertEquals(8, config.getRateLimit().getInitialWorkers());
    assertEquals(2, config.getRateLimit().getMinWorkers());
    assertEquals(Duration.ofSeconds(32), config.getRateLimit().getMaxWait());

    DatasetDescriptor dataset = config.getDatasets().get(0);
    assertEquals(ImmutableList.of("kenteken"), dataset.getPrimaryKey());
    assertEquals(DatasetDescriptor.DEFAULT_PAGE_SIZE, dataset.getPageSize());
    assertSame(FetchMode.PAGED, dataset.getMode());
    assertTrue(dataset.isFollowPastEstimate());
    assertNull(dataset.getDateField());
    assertEquals(Paths.get("/data/out/voertuigen.parquet"), config.tablePath(dataset));
  }

  @Test void testFindDataset() {
    HarvestConfig config = HarvestConfig.fromMap(minimal());
    assertEquals("m9d7-ebf2", config.findDataset("voertuigen").getId());
    assertEquals("voertuigen", config.findDataset("m9d7-ebf2").getName());
    assertNull(config.findDataset("nope"));
  }

  @Test void testEnvironmentSubstitution() {
    System.setProperty("HARVEST_TEST_TOKEN", "abc123");
    Map<String, Object> map = minimal();
    map.put("appToken", "{env:HARVEST_TEST_TOKEN}");

    assertEquals("abc123", HarvestConfig.fromMap(map).getAppToken());
    assertEquals("x-abc123-y", HarvestConfig.resolveEnv("x-{env:HARVEST_TEST_TOKEN}-y"));
    assertEquals("", HarvestConfig.resolveEnv("{env:HARVEST_TEST_UNSET_VARIABLE}"));
  }

  @Test void testUnsetTokenMeansAnonymous() {
    Map<String, Object> map = minimal();
    map.put("appToken", "{env:HARVEST_TEST_UNSET_VARIABLE}");
    assertNull(HarvestConfig.fromMap(map).getAppToken());
  }

  @Test void testDuplicateDatasets() {
    Map<String, Object> map = minimal();
    map.put("datasets", ImmutableList.of(
        ImmutableMap.of("id", "a", "name", "x"),
        ImmutableMap.of("id", "b", "name", "x")));
    assertThrows(IllegalArgumentException.class, () -> HarvestConfig.fromMap(map));

    map.put("datasets", ImmutableList.of(ImmutableMap.of("id", "a"), ImmutableMap.of("id", "a")));
    assertThrows(IllegalArgumentException.class, () -> HarvestConfig.fromMap(map));
  }

  @Test void testInvalidValues() {
    Map<String, Object> map = minimal();
    map.put("compression", "lzma");
    assertThrows(IllegalArgumentException.class, () -> HarvestConfig.fromMap(map));

    Map<String, Object> noBase = minimal();
    noBase.remove("baseUrl");
    assertThrows(IllegalArgumentException.class, () -> HarvestConfig.fromMap(noBase));

    Map<String, Object> badMode = minimal();
    badMode.put("datasets", ImmutableList.of(ImmutableMap.of("id", "a", "mode", "ftp")));
    assertThrows(IllegalArgumentException.class, () -> HarvestConfig.fromMap(badMode));

    Map<String, Object> badCap = minimal();
    badCap.put("rateLimit", ImmutableMap.of("waitExponentCap", 63));
    assertThrows(IllegalArgumentException.class, () -> HarvestConfig.fromMap(badCap));

    assertThrows(IllegalArgumentException.class,
        () -> DatasetDescriptor.builder().id("a").pageSize(0).build());
    assertThrows(IllegalArgumentException.class,
        () -> DatasetDescriptor.builder().id(" ").build());
  }

  @Test void testLoadYaml() throws IOException {
    Path file = tempDir.resolve("harvest.yaml");
    Files.write(file, ("baseUrl: http://localhost:8080\n"
        + "outputDirectory: " + tempDir.resolve("out") + "\n"
        + "stagingFormat: jsonl\n"
        + "compression: SNAPPY\n"
        + "rateLimit:\n"
        + "  initialWorkers: 4\n"
        + "  cooldownSeconds: 10\n"
        + "datasets:\n"
        + "  - id: sgfe-77wx\n"
        + "    primaryKey: [kenteken, meld_datum]\n"
        + "    pageSize: \"1000\"\n"
        + "    where: \"a = 'b'\"\n"
        + "    group: kenteken\n"
        + "    followPastEstimate: false\n"
        + "  - id: 8ys7-d773\n"
        + "    mode: bulk\n").getBytes(StandardCharsets.UTF_8));

    HarvestConfig config = HarvestConfig.load(file);

    assertSame(HarvestConfig.StagingFormat.JSON_LINES, config.getStagingFormat());
    assertEquals("snappy", config.getCompression());
    assertEquals(4, config.getRateLimit().getInitialWorkers());
    assertEquals(2, config.getRateLimit().getMinWorkers());
    assertEquals(Duration.ofSeconds(10), config.getRateLimit().getCooldown());

    List<DatasetDescriptor> datasets = config.getDatasets();
    DatasetDescriptor meldingen = datasets.get(0);
    assertEquals("sgfe-77wx", meldingen.getName());
    assertEquals(ImmutableList.of("kenteken", "meld_datum"), meldingen.getPrimaryKey());
    assertEquals(1000, meldingen.getPageSize());
    assertEquals("a = 'b'", meldingen.getWhere());
    assertEquals("kenteken", meldingen.getCountDistinctField());
    assertFalse(meldingen.isFollowPastEstimate());
    assertSame(FetchMode.BULK_CSV, datasets.get(1).getMode());
  }

  @Test void testLoadJson() throws IOException {
    Path file = tempDir.resolve("harvest.json");
    Files.write(file, ("{\"baseUrl\": \"http://localhost\", \"outputDirectory\": \"out\","
        + " \"datasets\": [{\"id\": \"a\"}]}").getBytes(StandardCharsets.UTF_8));
    assertEquals(1, HarvestConfig.load(file).getDatasets().size());
  }

  @Test void testLoadInvalidFileIsIoError() throws IOException {
    Path file = tempDir.resolve("bad.yaml");
    Files.write(file, "baseUrl: http://localhost\n".getBytes(StandardCharsets.UTF_8));
    IOException e = assertThrows(IOException.class, () -> HarvestConfig.load(file));
    assertTrue(e.getMessage().contains("outputDirectory"), e.getMessage());
  }

  @Test void testBundledConfiguration() throws IOException, URISyntaxException {
    Path bundled = Paths.get(HarvestConfigTest.class.getResource("/harvest.yaml").toURI());
    HarvestConfig config = HarvestConfig.load(bundled);

    assertEquals(5, config.getDatasets().size());
    DatasetDescriptor brandstof = config.findDataset("brandstof");
    assertSame(FetchMode.BULK_CSV, brandstof.getMode());
    assertEquals(ImmutableList.of("Kenteken", "Brandstof volgnummer"),
        brandstof.getPrimaryKey());
    assertEquals("datum_tenaamstelling", config.findDataset("m9d7-ebf2").getDateField());
  }
}

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

import org.opendata.harvest.http.StubApiServer;
import org.opendata.harvest.http.StubApiServer.StubResponse;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for the command-line entry point.
 */
@Tag("unit")
public class MainTest {

  @TempDir
  Path tempDir;

  private Path writeConfig(String baseUrl) throws IOException {
    Path file = tempDir.resolve("harvest.yaml");
    Files.write(file, ("baseUrl: " + baseUrl + "\n"
        + "outputDirectory: " + tempDir.resolve("out") + "\n"
        + "retry:\n"
        + "  maxAttempts: 1\n"
        + "datasets:\n"
        + "  - id: m9d7-ebf2\n"
        + "    name: voertuigen\n"
        + "    primaryKey: [kenteken]\n").getBytes(StandardCharsets.UTF_8));
    return file;
  }

  @Test void testUsageErrors() throws Exception {
    String config = writeConfig("http://127.0.0.1:1").toString();

    assertEquals(1, Main.run(new String[0]));
    assertEquals(1, Main.run(new String[] {tempDir.resolve("missing.yaml").toString()}));
    assertEquals(1, Main.run(new String[] {config, "--bogus"}));
    assertEquals(1, Main.run(new String[] {config, "--all", "m9d7-ebf2"}));
    assertEquals(1, Main.run(new String[] {config, "unknown-dataset"}));
  }

  @Test void testInvalidConfiguration() throws Exception {
    Path file = tempDir.resolve("broken.yaml");
    Files.write(file, "datasets: []\n".getBytes(StandardCharsets.UTF_8));
    assertEquals(1, Main.run(new String[] {file.toString()}));
  }

  @Test void testSuccessfulRun() throws Exception {
    try (StubApiServer server = new StubApiServer()) {
      server.on("/resource/m9d7-ebf2.json", (uri, headers) ->
          StubApiServer.queryParams(uri).containsKey("$offset")
              ? StubResponse.json("[{\"kenteken\":\"AB123C\"}]")
              : StubResponse.json("[{\"count\":\"1\"}]"));
      String config = writeConfig(server.baseUrl()).toString();

      assertEquals(0, Main.run(new String[] {config, "voertuigen"}));
      assertTrue(Files.exists(tempDir.resolve("out/voertuigen.parquet")));
      assertTrue(Files.exists(tempDir.resolve("out/.download_metadata.json")));
    }
  }

  @Test void testFailedDatasetGivesNonZeroStatus() throws Exception {
    try (StubApiServer server = new StubApiServer()) {
      server.on("/resource/", (uri, headers) -> StubResponse.status(500, "boom"));
      String config = writeConfig(server.baseUrl()).toString();

      assertEquals(1, Main.run(new String[] {config, "--all"}));
      assertFalse(Files.exists(tempDir.resolve("out/voertuigen.parquet")));
    }
  }
}

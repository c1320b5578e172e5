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
package org.opendata.harvest.watermark;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Iterator;
import java.util.Map;

/**
 * Watermark store backed by one JSON file:
 *
 * <pre>{@code
 * {
 *   "m9d7-ebf2": {"last_date": "20240115", "updated_at": "2024-01-15T10:30:00Z"}
 * }
 * }</pre>
 *
 * <p>Writes go to a temporary file that is moved over the store, so a crash
 * never leaves a truncated file. Entries of other datasets are preserved.
 */
public class JsonWatermarkStore implements WatermarkStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(JsonWatermarkStore.class);

  private static final String LAST_DATE = "last_date";
  private static final String UPDATED_AT = "updated_at";

  private final ObjectMapper mapper = new ObjectMapper();
  private final Path file;

  public JsonWatermarkStore(Path file) {
    this.file = file;
  }

  @Override public synchronized @Nullable Watermark get(String datasetId) throws IOException {
    JsonNode entry = read().get(datasetId);
    if (entry == null || !entry.hasNonNull(LAST_DATE)) {
      return null;
    }
    return new Watermark(entry.get(LAST_DATE).asText(),
        entry.hasNonNull(UPDATED_AT) ? entry.get(UPDATED_AT).asText() : "");
  }

  @Override public synchronized void put(String datasetId, Watermark watermark)
      throws IOException {
    ObjectNode root = read();
    ObjectNode entry = mapper.createObjectNode();
    entry.put(LAST_DATE, watermark.getLastDate());
    entry.put(UPDATED_AT, watermark.getUpdatedAt());
    root.set(datasetId, entry);

    Path parent = file.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
    mapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), root);
    Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    LOGGER.info("Watermark for {} set to {}", datasetId, watermark.getLastDate());
  }

  @Override public synchronized Map<String, Watermark> all() throws IOException {
    ImmutableMap.Builder<String, Watermark> result = ImmutableMap.builder();
    Iterator<Map.Entry<String, JsonNode>> fields = read().fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      JsonNode entry = field.getValue();
      if (entry.hasNonNull(LAST_DATE)) {
        result.put(field.getKey(), new Watermark(entry.get(LAST_DATE).asText(),
            entry.hasNonNull(UPDATED_AT) ? entry.get(UPDATED_AT).asText() : ""));
      }
    }
    return result.build();
  }

  private ObjectNode read() throws IOException {
    if (!Files.exists(file)) {
      return mapper.createObjectNode();
    }
    JsonNode root = mapper.readTree(file.toFile());
    if (root == null || root.isMissingNode()) {
      return mapper.createObjectNode();
    }
    if (!root.isObject()) {
      throw new IOException("Watermark file " + file + " does not contain a JSON object");
    }
    return (ObjectNode) root;
  }
}

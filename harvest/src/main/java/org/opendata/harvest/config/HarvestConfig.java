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

import org.opendata.harvest.merge.DuckDbSupport;
import org.opendata.harvest.rate.RateController;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Configuration for a harvest run.
 *
 * <p>HarvestConfig defines the remote API endpoint, authentication, request
 * timeouts, retry and throttling behaviour, output locations and the list of
 * datasets to fetch.
 *
 * <h3>YAML Configuration Example</h3>
 * <pre>{@code
 * baseUrl: "https://opendata.rdw.nl"
 * appToken: "{env:RDW_APP_TOKEN}"
 * outputDirectory: "data/rdw"
 * timeouts:
 *   pageSeconds: 180
 *   countSeconds: 60
 * retry:
 *   maxAttempts: 5
 *   baseDelayMs: 1000
 * rateLimit:
 *   initialWorkers: 8
 *   minWorkers: 2
 *   cooldownSeconds: 30
 * datasets:
 *   - id: "m9d7-ebf2"
 *     name: "voertuigen"
 *     primaryKey: ["kenteken"]
 *     dateField: "datum_tenaamstelling"
 * }</pre>
 */
public class HarvestConfig {

  /**
   * How pages are staged before the merge.
   */
  public enum StagingFormat {
    /** One Parquet file per page. */
    PARQUET,
    /** One newline-delimited JSON file shared by all pages. */
    JSON_LINES;

    static StagingFormat fromString(@Nullable String value) {
      if (value == null || value.isEmpty()) {
        return PARQUET;
      }
      String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
      if ("JSONL".equals(normalized) || "JSON".equals(normalized)) {
        return JSON_LINES;
      }
      try {
        return valueOf(normalized);
      } catch (IllegalArgumentException e) {
        throw new IllegalArgumentException("Unknown staging format: " + value, e);
      }
    }
  }

  private static final Pattern ENV_PATTERN = Pattern.compile("\\{env:([^}]+)\\}");

  private final String baseUrl;
  private final @Nullable String appToken;
  private final String tokenHeader;
  private final String userAgent;
  private final Path outputDirectory;
  private final Path stagingDirectory;
  private final Path watermarkFile;
  private final TimeoutConfig timeouts;
  private final RetryConfig retry;
  private final RateLimitConfig rateLimit;
  private final int progressStepPercent;
  private final int datasetParallelism;
  private final boolean verbose;
  private final String compression;
  private final StagingFormat stagingFormat;
  private final ImmutableList<DatasetDescriptor> datasets;

  private HarvestConfig(Builder builder) {
    if (builder.baseUrl == null || builder.baseUrl.trim().isEmpty()) {
      throw new IllegalArgumentException("baseUrl is required");
    }
    if (builder.outputDirectory == null) {
      throw new IllegalArgumentException("outputDirectory is required");
    }
    if (builder.progressStepPercent <= 0 || builder.progressStepPercent > 100) {
      throw new IllegalArgumentException("progressStepPercent must be in 1..100: "
          + builder.progressStepPercent);
    }
    if (builder.datasetParallelism <= 0) {
      throw new IllegalArgumentException("datasetParallelism must be positive: "
          + builder.datasetParallelism);
    }
    String url = builder.baseUrl.trim();
    this.baseUrl = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    this.appToken = builder.appToken == null || builder.appToken.isEmpty()
        ? null : builder.appToken;
    this.tokenHeader = builder.tokenHeader != null ? builder.tokenHeader : "X-App-Token";
    this.userAgent = builder.userAgent != null ? builder.userAgent : "harvest/1.0";
    this.outputDirectory = builder.outputDirectory;
    this.stagingDirectory = builder.stagingDirectory != null
        ? builder.stagingDirectory
        : builder.outputDirectory.resolve("_staging");
    this.watermarkFile = builder.watermarkFile != null
        ? builder.watermarkFile
        : builder.outputDirectory.resolve(".download_metadata.json");
    this.timeouts = builder.timeouts != null ? builder.timeouts : TimeoutConfig.defaults();
    this.retry = builder.retry != null ? builder.retry : RetryConfig.defaults();
    this.rateLimit = builder.rateLimit != null ? builder.rateLimit : RateLimitConfig.defaults();
    this.progressStepPercent = builder.progressStepPercent;
    this.datasetParallelism = builder.datasetParallelism;
    this.verbose = builder.verbose;
    this.compression = builder.compression != null
        ? builder.compression.toLowerCase(Locale.ROOT) : "zstd";
    if (!DuckDbSupport.CODECS.contains(this.compression)) {
      throw new IllegalArgumentException("Unsupported compression: " + builder.compression
          + ", expected one of " + DuckDbSupport.CODECS);
    }
    this.stagingFormat = builder.stagingFormat != null
        ? builder.stagingFormat : StagingFormat.PARQUET;
    this.datasets = builder.datasets != null
        ? ImmutableList.copyOf(builder.datasets) : ImmutableList.<DatasetDescriptor>of();
    validateDatasets(this.datasets);
  }

  private static void validateDatasets(List<DatasetDescriptor> datasets) {
    Set<String> ids = new HashSet<String>();
    Set<String> names = new HashSet<String>();
    for (DatasetDescriptor dataset : datasets) {
      if (!ids.add(dataset.getId())) {
        throw new IllegalArgumentException("Duplicate dataset id: " + dataset.getId());
      }
      if (!names.add(dataset.getName())) {
        throw new IllegalArgumentException("Duplicate dataset output name: "
            + dataset.getName());
      }
    }
  }

  public String getBaseUrl() {
    return baseUrl;
  }

  public @Nullable String getAppToken() {
    return appToken;
  }

  public String getTokenHeader() {
    return tokenHeader;
  }

  public String getUserAgent() {
    return userAgent;
  }

  public Path getOutputDirectory() {
    return outputDirectory;
  }

  public Path getStagingDirectory() {
    return stagingDirectory;
  }

  public Path getWatermarkFile() {
    return watermarkFile;
  }

  public TimeoutConfig getTimeouts() {
    return timeouts;
  }

  public RetryConfig getRetry() {
    return retry;
  }

  public RateLimitConfig getRateLimit() {
    return rateLimit;
  }

  public int getProgressStepPercent() {
    return progressStepPercent;
  }

  public int getDatasetParallelism() {
    return datasetParallelism;
  }

  public boolean isVerbose() {
    return verbose;
  }

  /** Returns the Parquet compression codec, e.g. {@code zstd} or {@code snappy}. */
  public String getCompression() {
    return compression;
  }

  public StagingFormat getStagingFormat() {
    return stagingFormat;
  }

  public ImmutableList<DatasetDescriptor> getDatasets() {
    return datasets;
  }

  /**
   * Returns the dataset with the given id or output name, or null.
   */
  public @Nullable DatasetDescriptor findDataset(String idOrName) {
    for (DatasetDescriptor dataset : datasets) {
      if (dataset.getId().equals(idOrName) || dataset.getName().equals(idOrName)) {
        return dataset;
      }
    }
    return null;
  }

  /**
   * Returns the path of the merged table for a dataset.
   */
  public Path tablePath(DatasetDescriptor dataset) {
    return outputDirectory.resolve(dataset.getName() + ".parquet");
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Loads configuration from a YAML or JSON file.
   *
   * @param path Configuration file
   * @return Parsed configuration
   * @throws IOException if the file cannot be read or parsed
   */
  public static HarvestConfig load(Path path) throws IOException {
    String fileName = path.getFileName().toString().toLowerCase(Locale.ROOT);
    ObjectMapper mapper = fileName.endsWith(".json")
        ? new ObjectMapper()
        : new ObjectMapper(new YAMLFactory());
    Map<String, Object> map;
    try (InputStream in = Files.newInputStream(path)) {
      map = mapper.readValue(in, new TypeReference<Map<String, Object>>() { });
    }
    if (map == null) {
      throw new IOException("Configuration file is empty: " + path);
    }
    try {
      return fromMap(map);
    } catch (IllegalArgumentException e) {
      throw new IOException("Invalid configuration in " + path + ": " + e.getMessage(), e);
    }
  }

  /**
   * Creates a configuration from a map.
   *
   * @param map Map parsed from YAML or JSON
   * @return Configuration
   */
  @SuppressWarnings("unchecked")
  public static HarvestConfig fromMap(Map<String, Object> map) {
    if (map == null) {
      throw new IllegalArgumentException("Configuration is missing");
    }

    Builder builder = builder()
        .baseUrl(resolveEnv(stringValue(map.get("baseUrl"))))
        .appToken(resolveEnv(stringValue(map.get("appToken"))))
        .tokenHeader(stringValue(map.get("tokenHeader")))
        .userAgent(stringValue(map.get("userAgent")))
        .compression(stringValue(map.get("compression")))
        .stagingFormat(StagingFormat.fromString(stringValue(map.get("stagingFormat"))));

    String output = resolveEnv(stringValue(map.get("outputDirectory")));
    if (output != null) {
      builder.outputDirectory(Paths.get(output));
    }
    String staging = resolveEnv(stringValue(map.get("stagingDirectory")));
    if (staging != null) {
      builder.stagingDirectory(Paths.get(staging));
    }
    String watermark = resolveEnv(stringValue(map.get("watermarkFile")));
    if (watermark != null) {
      builder.watermarkFile(Paths.get(watermark));
    }

    Object timeoutsObj = map.get("timeouts");
    if (timeoutsObj instanceof Map) {
      builder.timeouts(TimeoutConfig.fromMap((Map<String, Object>) timeoutsObj));
    }
    Object retryObj = map.get("retry");
    if (retryObj instanceof Map) {
      builder.retry(RetryConfig.fromMap((Map<String, Object>) retryObj));
    }
    Object rateLimitObj = map.get("rateLimit");
    if (rateLimitObj instanceof Map) {
      builder.rateLimit(RateLimitConfig.fromMap((Map<String, Object>) rateLimitObj));
    }

    builder.progressStepPercent(intValue(map.get("progressStepPercent"), 5));
    builder.datasetParallelism(intValue(map.get("datasetParallelism"), 1));
    Object verboseObj = map.get("verbose");
    if (verboseObj instanceof Boolean) {
      builder.verbose((Boolean) verboseObj);
    } else if (verboseObj instanceof String) {
      builder.verbose(Boolean.parseBoolean((String) verboseObj));
    }

    Object datasetsObj = map.get("datasets");
    if (datasetsObj instanceof List) {
      ImmutableList.Builder<DatasetDescriptor> datasets = ImmutableList.builder();
      for (Object item : (List<Object>) datasetsObj) {
        if (!(item instanceof Map)) {
          throw new IllegalArgumentException("Dataset entry must be a map: " + item);
        }
        datasets.add(DatasetDescriptor.fromMap((Map<String, Object>) item));
      }
      builder.datasets(datasets.build());
    }

    return builder.build();
  }

  /**
   * Replaces {@code {env:NAME}} references with the environment variable,
   * falling back to the system property of the same name, else empty.
   */
  static @Nullable String resolveEnv(@Nullable String value) {
    if (value == null) {
      return null;
    }
    Matcher matcher = ENV_PATTERN.matcher(value);
    StringBuffer result = new StringBuffer();
    while (matcher.find()) {
      String name = matcher.group(1);
      String replacement = System.getenv(name);
      if (replacement == null) {
        replacement = System.getProperty(name, "");
      }
      matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
    }
    matcher.appendTail(result);
    return result.toString();
  }

  private static @Nullable String stringValue(@Nullable Object value) {
    return value != null ? String.valueOf(value) : null;
  }

  private static int intValue(@Nullable Object value, int defaultValue) {
    if (value instanceof Number) {
      return ((Number) value).intValue();
    }
    if (value instanceof String) {
      return Integer.parseInt(((String) value).trim());
    }
    return defaultValue;
  }

  private static long longValue(@Nullable Object value, long defaultValue) {
    if (value instanceof Number) {
      return ((Number) value).longValue();
    }
    if (value instanceof String) {
      return Long.parseLong(((String) value).trim());
    }
    return defaultValue;
  }

  /**
   * Per-request timeouts. Page fetches, count queries and bulk exports each
   * get their own limit; there is no deadline spanning a whole dataset.
   */
  public static class TimeoutConfig {
    private final Duration connect;
    private final Duration page;
    private final Duration count;
    private final Duration bulk;

    public TimeoutConfig(Duration connect, Duration page, Duration count, Duration bulk) {
      this.connect = connect;
      this.page = page;
      this.count = count;
      this.bulk = bulk;
    }

    public static TimeoutConfig defaults() {
      return new TimeoutConfig(Duration.ofSeconds(30), Duration.ofSeconds(180),
          Duration.ofSeconds(60), Duration.ofSeconds(3600));
    }

    public Duration getConnect() {
      return connect;
    }

    public Duration getPage() {
      return page;
    }

    public Duration getCount() {
      return count;
    }

    public Duration getBulk() {
      return bulk;
    }

    public static TimeoutConfig fromMap(Map<String, Object> map) {
      if (map == null) {
        return defaults();
      }
      return new TimeoutConfig(
          Duration.ofSeconds(longValue(map.get("connectSeconds"), 30)),
          Duration.ofSeconds(longValue(map.get("pageSeconds"), 180)),
          Duration.ofSeconds(longValue(map.get("countSeconds"), 60)),
          Duration.ofSeconds(longValue(map.get("bulkSeconds"), 3600)));
    }
  }

  /**
   * Retry budget for transient network errors.
   */
  public static class RetryConfig {
    private final int maxAttempts;
    private final long baseDelayMs;
    private final long maxDelayMs;

    public RetryConfig(int maxAttempts, long baseDelayMs, long maxDelayMs) {
      if (maxAttempts <= 0) {
        throw new IllegalArgumentException("retry.maxAttempts must be positive: " + maxAttempts);
      }
      this.maxAttempts = maxAttempts;
      this.baseDelayMs = baseDelayMs;
      this.maxDelayMs = maxDelayMs;
    }

    public static RetryConfig defaults() {
      return new RetryConfig(5, 1000, 60000);
    }

    public int getMaxAttempts() {
      return maxAttempts;
    }

    public long getBaseDelayMs() {
      return baseDelayMs;
    }

    public long getMaxDelayMs() {
      return maxDelayMs;
    }

    public static RetryConfig fromMap(Map<String, Object> map) {
      if (map == null) {
        return defaults();
      }
      return new RetryConfig(
          intValue(map.get("maxAttempts"), 5),
          longValue(map.get("baseDelayMs"), 1000),
          longValue(map.get("maxDelayMs"), 60000));
    }
  }

  /**
   * Adaptive throttling settings. Workers start at {@code initialWorkers},
   * halve on a 429 at most once per cooldown and never drop below
   * {@code minWorkers}.
   */
  public static class RateLimitConfig {
    private final int initialWorkers;
    private final int minWorkers;
    private final Duration cooldown;
    private final int waitExponentCap;
    private final Duration maxWait;

    public RateLimitConfig(int initialWorkers, int minWorkers, Duration cooldown,
        int waitExponentCap, Duration maxWait) {
      if (minWorkers <= 0 || initialWorkers < minWorkers) {
        throw new IllegalArgumentException("rateLimit requires 0 < minWorkers <= initialWorkers: "
            + minWorkers + ", " + initialWorkers);
      }
      if (waitExponentCap < 0 || waitExponentCap > RateController.MAX_WAIT_EXPONENT) {
        throw new IllegalArgumentException("rateLimit.waitExponentCap must be in 0.."
            + RateController.MAX_WAIT_EXPONENT + ": " + waitExponentCap);
      }
      this.initialWorkers = initialWorkers;
      this.minWorkers = minWorkers;
      this.cooldown = cooldown;
      this.waitExponentCap = waitExponentCap;
      this.maxWait = maxWait;
    }

    public static RateLimitConfig defaults() {
      return new RateLimitConfig(8, 2, Duration.ofSeconds(30), 5, Duration.ofSeconds(32));
    }

    public int getInitialWorkers() {
      return initialWorkers;
    }

    public int getMinWorkers() {
      return minWorkers;
    }

    public Duration getCooldown() {
      return cooldown;
    }

    public int getWaitExponentCap() {
      return waitExponentCap;
    }

    public Duration getMaxWait() {
      return maxWait;
    }

    public static RateLimitConfig fromMap(Map<String, Object> map) {
      if (map == null) {
        return defaults();
      }
      return new RateLimitConfig(
          intValue(map.get("initialWorkers"), 8),
          intValue(map.get("minWorkers"), 2),
          Duration.ofSeconds(longValue(map.get("cooldownSeconds"), 30)),
          intValue(map.get("waitExponentCap"), 5),
          Duration.ofSeconds(longValue(map.get("maxWaitSeconds"), 32)));
    }
  }

  /**
   * Builder for HarvestConfig.
   */
  public static class Builder {
    private String baseUrl;
    private String appToken;
    private String tokenHeader;
    private String userAgent;
    private Path outputDirectory;
    private Path stagingDirectory;
    private Path watermarkFile;
    private TimeoutConfig timeouts;
    private RetryConfig retry;
    private RateLimitConfig rateLimit;
    private int progressStepPercent = 5;
    private int datasetParallelism = 1;
    private boolean verbose;
    private String compression;
    private StagingFormat stagingFormat;
    private List<DatasetDescriptor> datasets;

    public Builder baseUrl(String baseUrl) {
      this.baseUrl = baseUrl;
      return this;
    }

    public Builder appToken(String appToken) {
      this.appToken = appToken;
      return this;
    }

    public Builder tokenHeader(String tokenHeader) {
      this.tokenHeader = tokenHeader;
      return this;
    }

    public Builder userAgent(String userAgent) {
      this.userAgent = userAgent;
      return this;
    }

    public Builder outputDirectory(Path outputDirectory) {
      this.outputDirectory = outputDirectory;
      return this;
    }

    public Builder stagingDirectory(Path stagingDirectory) {
      this.stagingDirectory = stagingDirectory;
      return this;
    }

    public Builder watermarkFile(Path watermarkFile) {
      this.watermarkFile = watermarkFile;
      return this;
    }

    public Builder timeouts(TimeoutConfig timeouts) {
      this.timeouts = timeouts;
      return this;
    }

    public Builder retry(RetryConfig retry) {
      this.retry = retry;
      return this;
    }

    public Builder rateLimit(RateLimitConfig rateLimit) {
      this.rateLimit = rateLimit;
      return this;
    }

    public Builder progressStepPercent(int progressStepPercent) {
      this.progressStepPercent = progressStepPercent;
      return this;
    }

    public Builder datasetParallelism(int datasetParallelism) {
      this.datasetParallelism = datasetParallelism;
      return this;
    }

    public Builder verbose(boolean verbose) {
      this.verbose = verbose;
      return this;
    }

    public Builder compression(String compression) {
      this.compression = compression;
      return this;
    }

    public Builder stagingFormat(StagingFormat stagingFormat) {
      this.stagingFormat = stagingFormat;
      return this;
    }

    public Builder datasets(List<DatasetDescriptor> datasets) {
      this.datasets = datasets;
      return this;
    }

    public HarvestConfig build() {
      return new HarvestConfig(this);
    }
  }
}

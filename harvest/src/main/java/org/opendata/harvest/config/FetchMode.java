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

import java.util.Locale;

/**
 * How a dataset is pulled from the remote API.
 */
public enum FetchMode {
  /** Concurrent offset pagination over the JSON resource endpoint. */
  PAGED,

  /** One sequential streaming download of the CSV export. */
  BULK_CSV;

  /**
   * Parses a configuration value such as {@code paged} or {@code bulk_csv}.
   *
   * @param value Configuration value, may be null
   * @return Parsed mode, {@link #PAGED} when value is null or empty
   */
  public static FetchMode fromString(String value) {
    if (value == null || value.isEmpty()) {
      return PAGED;
    }
    String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
    if ("BULK".equals(normalized) || "CSV".equals(normalized)) {
      return BULK_CSV;
    }
    try {
      return valueOf(normalized);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unknown fetch mode: " + value, e);
    }
  }
}

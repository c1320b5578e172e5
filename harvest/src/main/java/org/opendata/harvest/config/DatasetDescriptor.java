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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;
import java.util.Map;

/**
 * Immutable description of one remote dataset and how to persist it.
 *
 * <h3>YAML Configuration Example</h3>
 * <pre>{@code
 * datasets:
 *   - id: "sgfe-77wx"
 *     name: "meldingen"
 *     primaryKey: ["kenteken", "meld_datum_door_keuringsinstantie",
 *                  "meld_tijd_door_keuringsinstantie"]
 *     dateField: "meld_datum_door_keuringsinstantie"
 *     pageSize: 50000
 *     where: "soort_erkenning_omschrijving='APK Lichte voertuigen'"
 *     order: ":id"
 * }</pre>
 *
 * <p>The primary key is supplied by configuration; it is never derived from
 * the data. An empty key disables deduplication for the dataset.
 */
public class DatasetDescriptor {

  /** Default number of rows requested per page. */
  public static final int DEFAULT_PAGE_SIZE = 50000;

  private final String id;
  private final String name;
  private final ImmutableList<String> primaryKey;
  private final @Nullable String dateField;
  private final int pageSize;
  private final @Nullable String select;
  private final @Nullable String where;
  private final @Nullable String group;
  private final @Nullable String order;
  private final FetchMode mode;
  private final boolean followPastEstimate;

  private DatasetDescriptor(Builder builder) {
    if (builder.id == null || builder.id.trim().isEmpty()) {
      throw new IllegalArgumentException("Dataset id is required");
    }
    if (builder.pageSize <= 0) {
      throw new IllegalArgumentException("pageSize must be positive for dataset "
          + builder.id + ": " + builder.pageSize);
    }
    this.id = builder.id.trim();
    this.name = builder.name != null && !builder.name.isEmpty() ? builder.name : this.id;
    this.primaryKey = builder.primaryKey != null
        ? ImmutableList.copyOf(builder.primaryKey)
        : ImmutableList.<String>of();
    this.dateField = emptyToNull(builder.dateField);
    this.pageSize = builder.pageSize;
    this.select = emptyToNull(builder.select);
    this.where = emptyToNull(builder.where);
    this.group = emptyToNull(builder.group);
    this.order = emptyToNull(builder.order);
    this.mode = builder.mode != null ? builder.mode : FetchMode.PAGED;
    this.followPastEstimate = builder.followPastEstimate;
  }

  /** Returns the remote dataset identifier, e.g. {@code m9d7-ebf2}. */
  public String getId() {
    return id;
  }

  /** Returns the output name used for the merged table file. */
  public String getName() {
    return name;
  }

  public ImmutableList<String> getPrimaryKey() {
    return primaryKey;
  }

  /** Returns the field compared against the watermark, or null if none. */
  public @Nullable String getDateField() {
    return dateField;
  }

  public int getPageSize() {
    return pageSize;
  }

  public @Nullable String getSelect() {
    return select;
  }

  public @Nullable String getWhere() {
    return where;
  }

  public @Nullable String getGroup() {
    return group;
  }

  public @Nullable String getOrder() {
    return order;
  }

  public FetchMode getMode() {
    return mode;
  }

  /**
   * Returns whether the engine keeps requesting pages past the estimated
   * count until a short page marks the end of the data.
   */
  public boolean isFollowPastEstimate() {
    return followPastEstimate;
  }

  /**
   * Returns the field whose distinct values are counted to size the plan.
   * Grouped queries return one row per group, so the group field is used.
   */
  public @Nullable String getCountDistinctField() {
    return group;
  }

  @Override public String toString() {
    return "DatasetDescriptor{" + id + " -> " + name + ", pk=" + primaryKey
        + ", mode=" + mode + "}";
  }

  private static @Nullable String emptyToNull(@Nullable String value) {
    return value == null || value.trim().isEmpty() ? null : value;
  }

  /**
   * Creates a new builder.
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates a descriptor from a configuration map.
   *
   * @param map Map parsed from YAML or JSON
   * @return Dataset descriptor
   */
  @SuppressWarnings("unchecked")
  public static DatasetDescriptor fromMap(Map<String, Object> map) {
    if (map == null) {
      throw new IllegalArgumentException("Dataset configuration is missing");
    }

    Builder builder = builder()
        .id(stringValue(map.get("id")))
        .name(stringValue(map.get("name")))
        .dateField(stringValue(map.get("dateField")))
        .select(stringValue(map.get("select")))
        .where(stringValue(map.get("where")))
        .group(stringValue(map.get("group")))
        .order(stringValue(map.get("order")))
        .mode(FetchMode.fromString(stringValue(map.get("mode"))));

    Object pkObj = map.get("primaryKey");
    if (pkObj instanceof List) {
      ImmutableList.Builder<String> pk = ImmutableList.builder();
      for (Object column : (List<Object>) pkObj) {
        pk.add(String.valueOf(column));
      }
      builder.primaryKey(pk.build());
    } else if (pkObj instanceof String) {
      builder.primaryKey(ImmutableList.of((String) pkObj));
    }

    Object pageSizeObj = map.get("pageSize");
    if (pageSizeObj instanceof Number) {
      builder.pageSize(((Number) pageSizeObj).intValue());
    } else if (pageSizeObj instanceof String) {
      builder.pageSize(Integer.parseInt((String) pageSizeObj));
    }

    Object followObj = map.get("followPastEstimate");
    if (followObj instanceof Boolean) {
      builder.followPastEstimate((Boolean) followObj);
    } else if (followObj instanceof String) {
      builder.followPastEstimate(Boolean.parseBoolean((String) followObj));
    }

    return builder.build();
  }

  private static @Nullable String stringValue(@Nullable Object value) {
    return value != null ? String.valueOf(value) : null;
  }

  /**
   * Builder for DatasetDescriptor.
   */
  public static class Builder {
    private String id;
    private String name;
    private List<String> primaryKey;
    private String dateField;
    private int pageSize = DEFAULT_PAGE_SIZE;
    private String select;
    private String where;
    private String group;
    private String order;
    private FetchMode mode;
    private boolean followPastEstimate = true;

    public Builder id(String id) {
      this.id = id;
      return this;
    }

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder primaryKey(List<String> primaryKey) {
      this.primaryKey = primaryKey;
      return this;
    }

    public Builder primaryKey(String... primaryKey) {
      this.primaryKey = ImmutableList.copyOf(primaryKey);
      return this;
    }

    public Builder dateField(String dateField) {
      this.dateField = dateField;
      return this;
    }

    public Builder pageSize(int pageSize) {
      this.pageSize = pageSize;
      return this;
    }

    public Builder select(String select) {
      this.select = select;
      return this;
    }

    public Builder where(String where) {
      this.where = where;
      return this;
    }

    public Builder group(String group) {
      this.group = group;
      return this;
    }

    public Builder order(String order) {
      this.order = order;
      return this;
    }

    public Builder mode(FetchMode mode) {
      this.mode = mode;
      return this;
    }

    public Builder followPastEstimate(boolean followPastEstimate) {
      this.followPastEstimate = followPastEstimate;
      return this;
    }

    public DatasetDescriptor build() {
      return new DatasetDescriptor(this);
    }
  }
}

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

import org.opendata.harvest.config.DatasetDescriptor;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Objects;

/**
 * Optional select, where, group and order clauses attached to every page
 * request of a dataset.
 */
public final class QueryClauses {

  public static final QueryClauses NONE = new QueryClauses(null, null, null, null);

  private final @Nullable String select;
  private final @Nullable String where;
  private final @Nullable String group;
  private final @Nullable String order;

  public QueryClauses(@Nullable String select, @Nullable String where,
      @Nullable String group, @Nullable String order) {
    this.select = select;
    this.where = where;
    this.group = group;
    this.order = order;
  }

  public static QueryClauses of(DatasetDescriptor dataset) {
    return new QueryClauses(dataset.getSelect(), dataset.getWhere(),
        dataset.getGroup(), dataset.getOrder());
  }

  /** Returns a copy with a different where clause. */
  public QueryClauses withWhere(@Nullable String newWhere) {
    return new QueryClauses(select, newWhere, group, order);
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

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof QueryClauses)) {
      return false;
    }
    QueryClauses that = (QueryClauses) o;
    return Objects.equals(select, that.select)
        && Objects.equals(where, that.where)
        && Objects.equals(group, that.group)
        && Objects.equals(order, that.order);
  }

  @Override public int hashCode() {
    return Objects.hash(select, where, group, order);
  }

  @Override public String toString() {
    return "QueryClauses{select=" + select + ", where=" + where
        + ", group=" + group + ", order=" + order + "}";
  }
}

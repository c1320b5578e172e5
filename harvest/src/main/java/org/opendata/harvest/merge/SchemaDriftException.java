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
package org.opendata.harvest.merge;

import org.opendata.harvest.HarvestException;

import com.google.common.collect.ImmutableSet;

import java.util.Set;

/**
 * The column set of a new batch differs from the existing table, so the
 * batch cannot be merged incrementally. The existing table is left untouched.
 */
public class SchemaDriftException extends HarvestException {
  private static final long serialVersionUID = 1L;

  private final ImmutableSet<String> added;
  private final ImmutableSet<String> removed;

  public SchemaDriftException(String dataset, Set<String> added, Set<String> removed) {
    super(dataset, "column set changed, added " + added + ", removed " + removed);
    this.added = ImmutableSet.copyOf(added);
    this.removed = ImmutableSet.copyOf(removed);
  }

  /** Columns present in the new batch but not in the existing table. */
  public ImmutableSet<String> getAdded() {
    return added;
  }

  /** Columns present in the existing table but not in the new batch. */
  public ImmutableSet<String> getRemoved() {
    return removed;
  }
}

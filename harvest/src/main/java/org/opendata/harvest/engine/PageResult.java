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
package org.opendata.harvest.engine;

import java.util.List;
import java.util.Map;

/**
 * Records of one fetched page, keyed by the offset they were requested at.
 */
public final class PageResult {

  private final long offset;
  private final List<Map<String, String>> records;

  private PageResult(long offset, List<Map<String, String>> records) {
    this.offset = offset;
    this.records = records;
  }

  public static PageResult success(long offset, List<Map<String, String>> records) {
    return new PageResult(offset, records);
  }

  public long getOffset() {
    return offset;
  }

  public List<Map<String, String>> getRecords() {
    return records;
  }

  public int size() {
    return records.size();
  }
}

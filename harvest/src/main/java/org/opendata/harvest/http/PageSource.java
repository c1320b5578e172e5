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

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Source of one page of records. Implementations must be safe to call
 * concurrently from several worker threads.
 */
public interface PageSource {

  /**
   * Fetches the records at {@code [offset, offset + limit)}.
   *
   * @return Records in server order, each an ordered field to text-value map
   * @throws IOException if the page cannot be fetched; this is fatal for the page
   */
  List<Map<String, String>> fetch(String datasetId, long offset, int limit,
      QueryClauses clauses) throws IOException, InterruptedException;
}

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

import org.opendata.harvest.HarvestException;

/**
 * A page could not be fetched or staged; the whole dataset fetch is aborted
 * and nothing from it is merged.
 */
public class DatasetFetchException extends HarvestException {
  private static final long serialVersionUID = 1L;

  private final long offset;

  public DatasetFetchException(String dataset, long offset, Throwable cause) {
    super(dataset, "page at offset " + offset + " failed: " + cause, cause);
    this.offset = offset;
  }

  /** Returns the offset of the page that failed, or -1 if none. */
  public long getOffset() {
    return offset;
  }
}

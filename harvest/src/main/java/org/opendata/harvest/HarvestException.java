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

import java.io.IOException;

/**
 * Base exception for failures while harvesting a dataset.
 *
 * <p>Carries the dataset name so that a multi-dataset run can report which
 * dataset failed and why.
 */
public class HarvestException extends IOException {
  private static final long serialVersionUID = 1L;

  private final String dataset;

  /**
   * Creates a new HarvestException with the specified message.
   */
  public HarvestException(String dataset, String message) {
    super(dataset + ": " + message);
    this.dataset = dataset;
  }

  /**
   * Creates a new HarvestException with the specified message and cause.
   */
  public HarvestException(String dataset, String message, Throwable cause) {
    super(dataset + ": " + message, cause);
    this.dataset = dataset;
  }

  /** Returns the id or name of the dataset that failed. */
  public String getDataset() {
    return dataset;
  }
}

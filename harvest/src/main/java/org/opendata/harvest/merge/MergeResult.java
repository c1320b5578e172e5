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

/**
 * Result of writing a batch into a merged table.
 */
public final class MergeResult {

  /**
   * What happened to the target table.
   */
  public enum Action {
    /** New rows were combined with the existing table. */
    MERGED,
    /** The table was overwritten with the new batch. */
    REPLACED,
    /** The batch was empty; the table was not touched. */
    UNCHANGED
  }

  private final Action action;
  private final long rowsBefore;
  private final long batchRows;
  private final long rowsAfter;

  private MergeResult(Action action, long rowsBefore, long batchRows, long rowsAfter) {
    this.action = action;
    this.rowsBefore = rowsBefore;
    this.batchRows = batchRows;
    this.rowsAfter = rowsAfter;
  }

  public static MergeResult merged(long rowsBefore, long batchRows, long rowsAfter) {
    return new MergeResult(Action.MERGED, rowsBefore, batchRows, rowsAfter);
  }

  public static MergeResult replaced(long rowsBefore, long batchRows, long rowsAfter) {
    return new MergeResult(Action.REPLACED, rowsBefore, batchRows, rowsAfter);
  }

  public static MergeResult unchanged(long rows) {
    return new MergeResult(Action.UNCHANGED, rows, 0, rows);
  }

  public Action getAction() {
    return action;
  }

  public long getRowsBefore() {
    return rowsBefore;
  }

  public long getBatchRows() {
    return batchRows;
  }

  /** Returns the row count of the table after the operation. */
  public long getRowsAfter() {
    return rowsAfter;
  }

  @Override public String toString() {
    return action + ": " + rowsBefore + " + " + batchRows + " -> " + rowsAfter + " rows";
  }
}

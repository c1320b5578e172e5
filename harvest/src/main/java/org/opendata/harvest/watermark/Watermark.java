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
package org.opendata.harvest.watermark;

import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Date up to which a dataset was last fetched successfully.
 *
 * <p>{@code lastDate} uses the compact {@code yyyyMMdd} form the remote API
 * accepts in date comparisons; {@code updatedAt} is an ISO-8601 timestamp.
 */
public final class Watermark {

  public static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.BASIC_ISO_DATE;

  private final String lastDate;
  private final String updatedAt;

  public Watermark(String lastDate, String updatedAt) {
    this.lastDate = Objects.requireNonNull(lastDate, "lastDate");
    this.updatedAt = Objects.requireNonNull(updatedAt, "updatedAt");
  }

  /** Creates a watermark for a fetch that completed at {@code now}. */
  public static Watermark of(LocalDate date, Instant now) {
    return new Watermark(date.format(DATE_FORMAT), now.toString());
  }

  public String getLastDate() {
    return lastDate;
  }

  public String getUpdatedAt() {
    return updatedAt;
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Watermark)) {
      return false;
    }
    Watermark that = (Watermark) o;
    return lastDate.equals(that.lastDate) && updatedAt.equals(that.updatedAt);
  }

  @Override public int hashCode() {
    return Objects.hash(lastDate, updatedAt);
  }

  @Override public String toString() {
    return "Watermark{" + lastDate + ", updated " + updatedAt + "}";
  }
}

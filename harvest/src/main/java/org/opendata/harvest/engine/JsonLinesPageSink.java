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

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Appends every page to one newline-delimited JSON file under a write lock.
 *
 * <p>Pages are serialized outside the lock; only the append itself is
 * serialized. The file is forced to disk after each page.
 */
public class JsonLinesPageSink extends AbstractPageSink {

  static final String FILE_NAME = "pages.jsonl";

  private final ReentrantLock writeLock = new ReentrantLock();
  private final Path file;
  private @Nullable FileChannel channel;

  public JsonLinesPageSink(String datasetId, Path directory) throws IOException {
    super(datasetId, directory);
    this.file = directory.resolve(FILE_NAME);
    this.channel = FileChannel.open(file, StandardOpenOption.CREATE,
        StandardOpenOption.WRITE, StandardOpenOption.APPEND);
  }

  @Override protected long writePage(PageResult page) throws IOException {
    byte[] bytes = toJsonLines(page);
    writeLock.lock();
    try {
      FileChannel out = channel;
      if (out == null) {
        throw new IllegalStateException("Sink for " + datasetId + " is closed");
      }
      ByteBuffer buffer = ByteBuffer.wrap(bytes);
      while (buffer.hasRemaining()) {
        out.write(buffer);
      }
      out.force(false);
    } finally {
      writeLock.unlock();
    }
    return bytes.length;
  }

  @Override protected StagedBatch finish(List<String> columns, long rowCount)
      throws IOException {
    closeResources();
    List<Path> files = rowCount > 0 ? ImmutableList.of(file) : ImmutableList.<Path>of();
    return new StagedBatch(StagedBatch.Format.JSON_LINES, directory, files, columns, rowCount);
  }

  @Override protected void closeResources() throws IOException {
    writeLock.lock();
    try {
      if (channel != null) {
        channel.close();
        channel = null;
      }
    } finally {
      writeLock.unlock();
    }
  }
}

/*
 * Copyright 2014 WANdisco
 *
 *  WANdisco licenses this file to you under the Apache License,
 *  version 2.0 (the "License"); you may not use this file except in compliance
 *  with the License. You may obtain a copy of the License at:
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 *  WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 *  License for the specific language governing permissions and limitations
 *  under the License.
 */

package eventlog.store;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;

import static java.nio.file.StandardOpenOption.APPEND;
import static java.nio.file.StandardOpenOption.CREATE;

/**
 * A BytePersistence over a single file, written through a FileChannel in append mode.
 */
public class FilePersistence implements BytePersistence {
  private final FileChannel appendChannel;
  private final Path path;

  public FilePersistence(Path path) throws IOException {
    this.path = path;
    this.appendChannel = FileChannel.open(path, CREATE, APPEND);
  }

  public Path getPath() {
    return path;
  }

  @Override
  public boolean isEmpty() throws IOException {
    return size() == 0;
  }

  @Override
  public long size() throws IOException {
    return appendChannel.size();
  }

  @Override
  public void append(ByteBuffer[] buffers) throws IOException {
    long remaining = 0;
    for (ByteBuffer buffer : buffers) {
      remaining += buffer.remaining();
    }

    // A gathering write may stop early; keep going until every buffer is drained.
    while (remaining > 0) {
      remaining -= appendChannel.write(buffers);
    }
  }

  @Override
  public InputStream getInputStream() throws IOException {
    return Files.newInputStream(path);
  }

  @Override
  public void truncate(long size) throws IOException {
    if (size > size()) {
      throw new IllegalArgumentException("Truncation may not grow the file");
    }
    appendChannel.truncate(size);
  }

  @Override
  public void sync() throws IOException {
    appendChannel.force(true);
  }

  @Override
  public void close() throws IOException {
    appendChannel.close();
  }
}

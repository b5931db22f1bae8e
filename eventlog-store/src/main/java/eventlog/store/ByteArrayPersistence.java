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

import com.google.common.primitives.Ints;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.nio.ByteBuffer;

/**
 * BytePersistence held entirely in memory, for tests and throwaway stores. Not efficient: it
 * copies the whole array freely.
 */
public class ByteArrayPersistence implements BytePersistence {
  private ByteArrayOutputStream stream = new ByteArrayOutputStream();

  /**
   * Replace a single byte, to simulate corruption.
   */
  public synchronized void overwrite(int position, int b) {
    byte[] bytes = stream.toByteArray();
    bytes[position] = (byte) b;
    replaceContents(bytes, bytes.length);
  }

  @Override
  public synchronized boolean isEmpty() {
    return stream.size() == 0;
  }

  @Override
  public synchronized long size() {
    return stream.size();
  }

  @Override
  public synchronized void append(ByteBuffer[] buffers) {
    for (ByteBuffer buffer : buffers) {
      byte[] bytes = new byte[buffer.remaining()];
      buffer.get(bytes);
      stream.write(bytes, 0, bytes.length);
    }
  }

  @Override
  public synchronized InputStream getInputStream() {
    return new ByteArrayInputStream(stream.toByteArray());
  }

  @Override
  public synchronized void truncate(long size) {
    if (size > stream.size()) {
      throw new IllegalArgumentException("Truncation may not grow the persistence");
    }
    replaceContents(stream.toByteArray(), Ints.checkedCast(size));
  }

  @Override
  public void sync() {
    // Nothing to flush.
  }

  @Override
  public void close() {
  }

  private void replaceContents(byte[] bytes, int length) {
    stream = new ByteArrayOutputStream(length);
    stream.write(bytes, 0, length);
  }
}

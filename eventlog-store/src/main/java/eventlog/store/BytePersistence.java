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

/**
 * Append-only byte storage underneath a journal.
 */
public interface BytePersistence extends AutoCloseable {
  boolean isEmpty() throws IOException;

  long size() throws IOException;

  /**
   * Append the remaining bytes of each buffer, in order.
   */
  void append(ByteBuffer[] buffers) throws IOException;

  /**
   * @return a stream over the bytes persisted so far, from the beginning. The caller closes it.
   */
  InputStream getInputStream() throws IOException;

  /**
   * Discard everything from {@code size} onwards.
   */
  void truncate(long size) throws IOException;

  /**
   * Make everything appended so far durable.
   */
  void sync() throws IOException;

  @Override
  void close() throws IOException;
}

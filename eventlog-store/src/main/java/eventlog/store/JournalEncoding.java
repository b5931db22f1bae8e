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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import com.google.common.primitives.Ints;
import eventlog.EventLogConstants;
import eventlog.util.CrcInputStream;
import io.protostuff.LinkBuffer;
import io.protostuff.LinkedBuffer;
import io.protostuff.ProtobufException;
import io.protostuff.ProtostuffIOUtil;
import io.protostuff.Schema;
import io.protostuff.runtime.RuntimeSchema;

import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.util.List;
import java.util.zip.Adler32;

/**
 * Encoding of journal records: a varint length, the protostuff-serialized batch, then a 4-byte
 * Adler32 of everything before it.
 */
final class JournalEncoding {
  private static final Schema<JournalBatch> SCHEMA = RuntimeSchema.getSchema(JournalBatch.class);
  private static final int MAX_VARINT32_BYTES = 5;

  private JournalEncoding() {
  }

  /**
   * A record whose stored checksum does not match its contents.
   */
  static class CrcError extends RuntimeException {
    CrcError(String s) {
      super(s);
    }
  }

  static ByteBuffer[] encode(JournalBatch batch) {
    final byte[] message = ProtostuffIOUtil.toByteArray(batch, SCHEMA, LinkedBuffer.allocate());
    if (message.length > EventLogConstants.JOURNAL_MAX_RECORD_LENGTH) {
      throw new IllegalArgumentException("Journal record of " + message.length + " bytes exceeds the maximum of "
          + EventLogConstants.JOURNAL_MAX_RECORD_LENGTH);
    }

    try {
      final List<ByteBuffer> lengthPrefix = new LinkBuffer(MAX_VARINT32_BYTES).writeVarInt32(message.length).finish();
      final Adler32 crc = new Adler32();
      lengthPrefix.forEach((ByteBuffer buffer) -> crc.update(buffer.duplicate()));
      crc.update(message, 0, message.length);

      final LinkBuffer crcBuf = new LinkBuffer(8);
      putCrc(crcBuf, crc.getValue());

      return Iterables.toArray(
          Iterables.concat(lengthPrefix, ImmutableList.of(ByteBuffer.wrap(message)), crcBuf.finish()),
          ByteBuffer.class);
    } catch (IOException e) {
      // Only in-memory buffers are written here.
      throw new RuntimeException(e);
    }
  }

  /**
   * Read one record written by {@link #encode} and verify its checksum.
   *
   * @throws EOFException                    if the stream ends at, or partway through, the record.
   * @throws io.protostuff.ProtobufException if the record's length or body is malformed.
   * @throws CrcError                        if the checksum does not match.
   */
  static JournalBatch decode(InputStream inputStream) throws IOException, CrcError {
    final CrcInputStream crcStream = new CrcInputStream(inputStream, new Adler32());
    final int length = readVarInt32(crcStream);
    if (length < 0 || length > EventLogConstants.JOURNAL_MAX_RECORD_LENGTH) {
      throw new ProtobufException("Journal record length " + length + " is out of range");
    }

    final byte[] message = new byte[length];
    new DataInputStream(crcStream).readFully(message);

    final long computedCrc = crcStream.getValue();
    final long storedCrc = readCrc(inputStream);
    if (storedCrc != computedCrc) {
      throw new CrcError("CRC mismatch on journal record");
    }

    final JournalBatch batch = SCHEMA.newMessage();
    try {
      ProtostuffIOUtil.mergeFrom(message, batch, SCHEMA);
    } catch (RuntimeException e) {
      throw new ProtobufException("Unreadable journal record body", e);
    }
    return batch;
  }

  private static int readVarInt32(InputStream inputStream) throws IOException {
    int result = 0;
    for (int shift = 0; shift < 7 * MAX_VARINT32_BYTES; shift += 7) {
      final int b = inputStream.read();
      if (b < 0) {
        throw new EOFException();
      }
      result |= (b & 0x7f) << shift;
      if ((b & 0x80) == 0) {
        return result;
      }
    }
    throw new ProtobufException("Malformed journal record length");
  }

  // The CRC is an unsigned 32-bit value; shift it into signed int range to store it.
  private static void putCrc(LinkBuffer writeTo, long crc) throws IOException {
    writeTo.writeInt32(Ints.checkedCast(crc + Integer.MIN_VALUE));
  }

  private static long readCrc(InputStream inputStream) throws IOException {
    int shiftedCrc = new DataInputStream(inputStream).readInt();
    return ((long) shiftedCrc) - Integer.MIN_VALUE;
  }
}

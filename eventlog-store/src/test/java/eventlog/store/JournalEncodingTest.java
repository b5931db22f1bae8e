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
import com.google.common.primitives.Bytes;
import eventlog.interfaces.store.SequencedItem;
import io.protostuff.ProtobufException;
import org.junit.Test;

import java.io.ByteArrayInputStream;
import java.io.EOFException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;

import static eventlog.EventLogTestUtil.anItem;
import static eventlog.EventLogTestUtil.bytes;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;

public class JournalEncodingTest {
  private final UUID sequenceId = UUID.randomUUID();
  private final UUID otherSequenceId = UUID.randomUUID();

  private final List<SequencedItem> batch = ImmutableList.of(
      anItem(sequenceId, 0, "first"),
      anItem(otherSequenceId, 7, "second"),
      new SequencedItem(sequenceId, 1, "test.Empty", new byte[0]));

  @Test
  public void decodesABatchOfSeveralItemsFromItsEncodedRecord() throws Exception {
    InputStream input = new ByteArrayInputStream(encoded(batch));

    assertThat(JournalEncoding.decode(input).toItems(), is(equalTo(batch)));
  }

  @Test(expected = EOFException.class)
  public void readsConsecutiveRecordsInOrderThenReportsTheEndOfTheStream() throws Exception {
    List<SequencedItem> later = ImmutableList.of(anItem(sequenceId, 2, "later"));
    InputStream input = new ByteArrayInputStream(Bytes.concat(encoded(batch), encoded(later)));

    assertThat(JournalEncoding.decode(input).toItems(), is(equalTo(batch)));
    assertThat(JournalEncoding.decode(input).toItems(), contains(later.get(0)));
    JournalEncoding.decode(input);
  }

  @Test(expected = EOFException.class)
  public void reportsARecordCutOffPartwayAsTheEndOfTheStream() throws Exception {
    byte[] record = encoded(batch);

    JournalEncoding.decode(new ByteArrayInputStream(Arrays.copyOf(record, record.length - 3)));
  }

  @Test(expected = JournalEncoding.CrcError.class)
  public void detectsABodyChangedAfterItWasWritten() throws Exception {
    byte[] record = encoded(ImmutableList.of(anItem(sequenceId, 0, "payload")));
    record[3] ^= 0x20;

    JournalEncoding.decode(new ByteArrayInputStream(record));
  }

  @Test(expected = ProtobufException.class)
  public void refusesARecordLengthBeyondTheMaximum() throws Exception {
    byte[] hugeLength = {(byte) 0xFF, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF, 0x07};

    JournalEncoding.decode(new ByteArrayInputStream(Bytes.concat(hugeLength, bytes("not a record"))));
  }

  private static byte[] encoded(List<SequencedItem> items) {
    byte[] result = new byte[0];
    for (ByteBuffer buffer : JournalEncoding.encode(new JournalBatch(items))) {
      byte[] chunk = new byte[buffer.remaining()];
      buffer.get(chunk);
      result = Bytes.concat(result, chunk);
    }
    return result;
  }
}

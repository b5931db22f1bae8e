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
import eventlog.interfaces.store.SequencedItem;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * One atomic mutation of a journaled store, in the shape the journal serializes.
 */
class JournalBatch {
  private List<JournalRecord> records;

  @SuppressWarnings("UnusedDeclaration")
  JournalBatch() {
  }

  JournalBatch(List<SequencedItem> items) {
    records = new ArrayList<>(items.size());
    for (SequencedItem item : items) {
      records.add(new JournalRecord(item));
    }
  }

  List<SequencedItem> toItems() {
    if (records == null) {
      return ImmutableList.of();
    }
    ImmutableList.Builder<SequencedItem> items = ImmutableList.builder();
    for (JournalRecord record : records) {
      items.add(record.toItem());
    }
    return items.build();
  }

  static class JournalRecord {
    private long sequenceIdHigh;
    private long sequenceIdLow;
    private long position;
    private String topic;
    private byte[] data;

    @SuppressWarnings("UnusedDeclaration")
    JournalRecord() {
    }

    JournalRecord(SequencedItem item) {
      this.sequenceIdHigh = item.getSequenceId().getMostSignificantBits();
      this.sequenceIdLow = item.getSequenceId().getLeastSignificantBits();
      this.position = item.getPosition();
      this.topic = item.getTopic();
      this.data = item.getData();
    }

    SequencedItem toItem() {
      return new SequencedItem(
          new UUID(sequenceIdHigh, sequenceIdLow),
          position,
          topic == null ? "" : topic,
          data == null ? new byte[0] : data);
    }
  }
}

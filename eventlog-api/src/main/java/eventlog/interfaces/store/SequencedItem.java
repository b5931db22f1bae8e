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

package eventlog.interfaces.store;

import org.jetbrains.annotations.NotNull;

import java.util.Arrays;
import java.util.Objects;
import java.util.UUID;

/**
 * An immutable item stored at a position within a sequence. The pair (sequenceId, position) is
 * unique within a store; the topic names the type the data decodes to, and the data itself is
 * opaque to everything in the event log.
 */
public final class SequencedItem {
  private final UUID sequenceId;
  private final long position;
  private final String topic;
  private final byte[] data;

  public SequencedItem(@NotNull UUID sequenceId, long position, @NotNull String topic, @NotNull byte[] data) {
    if (position < 0) {
      throw new InvalidPosition(position);
    }
    this.sequenceId = Objects.requireNonNull(sequenceId, "sequenceId");
    this.position = position;
    this.topic = Objects.requireNonNull(topic, "topic");
    this.data = Objects.requireNonNull(data, "data").clone();
  }

  @NotNull
  public UUID getSequenceId() {
    return sequenceId;
  }

  public long getPosition() {
    return position;
  }

  @NotNull
  public String getTopic() {
    return topic;
  }

  @NotNull
  public byte[] getData() {
    return data.clone();
  }

  /**
   * Copy this item's topic and data to a different slot.
   */
  public SequencedItem withSlot(UUID newSequenceId, long newPosition) {
    return new SequencedItem(newSequenceId, newPosition, topic, data);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }

    SequencedItem that = (SequencedItem) o;
    return position == that.position
        && sequenceId.equals(that.sequenceId)
        && topic.equals(that.topic)
        && Arrays.equals(data, that.data);
  }

  @Override
  public int hashCode() {
    int result = sequenceId.hashCode();
    result = 31 * result + (int) (position ^ (position >>> 32));
    result = 31 * result + topic.hashCode();
    result = 31 * result + Arrays.hashCode(data);
    return result;
  }

  @Override
  public String toString() {
    return "SequencedItem{" +
        "sequenceId=" + sequenceId +
        ", position=" + position +
        ", topic='" + topic + '\'' +
        ", data.length=" + data.length +
        '}';
  }
}

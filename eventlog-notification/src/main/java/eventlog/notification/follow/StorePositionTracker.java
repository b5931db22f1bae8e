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

package eventlog.notification.follow;

import com.google.common.primitives.Longs;
import eventlog.EventLogConstants;
import eventlog.interfaces.store.ConcurrencyError;
import eventlog.interfaces.store.InvalidPosition;
import eventlog.interfaces.store.SequencedItem;
import eventlog.interfaces.store.SequencedItemStore;

import java.io.IOException;
import java.util.UUID;

/**
 * Tracks a follower's position as items of a tracking sequence. Recording position n is a
 * conditional insert at slot n - 1, so each position is recorded at most once, however many
 * followers race to record it.
 */
public class StorePositionTracker implements PositionTracker {
  private final SequencedItemStore store;
  private final UUID trackingSequenceId;

  public StorePositionTracker(SequencedItemStore store, UUID trackingSequenceId) {
    this.store = store;
    this.trackingSequenceId = trackingSequenceId;
  }

  @Override
  public long getPosition() throws IOException {
    final SequencedItem last = store.getLast(trackingSequenceId);
    return last == null ? 0 : last.getPosition() + 1;
  }

  @Override
  public void recordPosition(long position) throws ConcurrencyError, IOException {
    if (position < 1) {
      throw new InvalidPosition(position);
    }
    if (position <= getPosition()) {
      throw new ConcurrencyError(trackingSequenceId, position - 1);
    }

    store.insert(new SequencedItem(trackingSequenceId, position - 1,
        EventLogConstants.TRACKING_RECORD_TOPIC, Longs.toByteArray(position)));
  }
}

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
package eventlog.notification;

import com.google.common.collect.ImmutableList;
import eventlog.EventLogConstants;
import eventlog.NotificationConstants;
import eventlog.codec.SectionCodec;
import eventlog.interfaces.notification.CausalDependency;
import eventlog.interfaces.store.ConcurrencyError;
import eventlog.interfaces.store.SequenceAppender;
import eventlog.interfaces.store.SequencedItem;
import eventlog.interfaces.store.SequencedItemStore;
import eventlog.util.ConcurrencyRetrier;

import java.io.IOException;
import java.util.List;
import java.util.UUID;

/**
 * Appends to a notification sequence, recording alongside each notification the causal
 * dependencies it was written with. The dependencies of the item at position p are stored at
 * position p of a companion sequence; both are written in one atomic batch, so a notification
 * is never visible without its dependencies. Read them back with a {@link StoreNotificationLog}
 * built over the same pair of sequences.
 */
public class CausalNotificationAppender implements SequenceAppender {
  private final SequencedItemStore store;
  private final UUID sequenceId;
  private final UUID dependencySequenceId;
  private final ConcurrencyRetrier retrier;

  public CausalNotificationAppender(SequencedItemStore store, UUID sequenceId, UUID dependencySequenceId) {
    this(store, sequenceId, dependencySequenceId, new ConcurrencyRetrier(
        EventLogConstants.APPEND_RETRY_MAX_ATTEMPTS,
        EventLogConstants.APPEND_RETRY_WAIT_MILLIS));
  }

  public CausalNotificationAppender(SequencedItemStore store,
                                    UUID sequenceId,
                                    UUID dependencySequenceId,
                                    ConcurrencyRetrier retrier) {
    if (sequenceId.equals(dependencySequenceId)) {
      throw new IllegalArgumentException("Dependencies need a sequence of their own");
    }
    this.store = store;
    this.sequenceId = sequenceId;
    this.dependencySequenceId = dependencySequenceId;
    this.retrier = retrier;
  }

  @Override
  public long append(String topic, byte[] data) throws ConcurrencyError, IOException {
    return append(topic, data, ImmutableList.of());
  }

  /**
   * @return the position the notification was written at; its id is one more.
   * @throws ConcurrencyError if every attempt lost its position to another writer.
   */
  public long append(String topic, byte[] data, List<CausalDependency> dependencies)
      throws ConcurrencyError, IOException {
    return retrier.call(() -> {
      final SequencedItem last = store.getLast(sequenceId);
      final long position = last == null ? 0 : last.getPosition() + 1;

      if (dependencies.isEmpty()) {
        store.insert(new SequencedItem(sequenceId, position, topic, data));
      } else {
        store.insertAll(ImmutableList.of(
            new SequencedItem(sequenceId, position, topic, data),
            new SequencedItem(dependencySequenceId, position,
                NotificationConstants.CAUSAL_DEPENDENCIES_TOPIC, SectionCodec.encodeDependencies(dependencies))));
      }
      return position;
    });
  }
}

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

import com.google.common.primitives.Ints;
import eventlog.EventLogConstants;
import eventlog.codec.SectionCodec;
import eventlog.interfaces.notification.Notification;
import eventlog.interfaces.store.SequencedItem;
import eventlog.interfaces.store.SequencedItemStore;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * Notification log of one store sequence, typically the application sequence written through
 * the contiguous write path. Each section is a single range read.
 * <p>
 * Given a dependency sequence, as written by a {@link CausalNotificationAppender}, each
 * notification also carries the causal dependencies stored at its position there.
 */
public class StoreNotificationLog extends AbstractLocalNotificationLog {
  private final SequencedItemStore store;
  private final UUID sequenceId;
  @Nullable
  private final UUID dependencySequenceId;

  public StoreNotificationLog(SequencedItemStore store, UUID sequenceId) {
    this(store, sequenceId, EventLogConstants.DEFAULT_SECTION_SIZE);
  }

  public StoreNotificationLog(SequencedItemStore store, UUID sequenceId, int sectionSize) {
    this(store, sequenceId, null, sectionSize);
  }

  public StoreNotificationLog(SequencedItemStore store,
                              UUID sequenceId,
                              @Nullable UUID dependencySequenceId,
                              int sectionSize) {
    super(sectionSize);
    this.store = store;
    this.sequenceId = sequenceId;
    this.dependencySequenceId = dependencySequenceId;
  }

  @Override
  protected long nextPosition() throws IOException {
    final SequencedItem last = store.getLast(sequenceId);
    return last == null ? 0 : last.getPosition() + 1;
  }

  @Override
  protected List<Notification> readNotifications(long start, long stop) throws IOException {
    final List<Notification> notifications =
        new ArrayList<>(Collections.nCopies(Ints.checkedCast(stop - start), null));

    for (SequencedItem item : store.readRange(sequenceId, start, stop)) {
      notifications.set((int) (item.getPosition() - start), toNotification(item));
    }

    if (dependencySequenceId != null) {
      for (SequencedItem dependencies : store.readRange(dependencySequenceId, start, stop)) {
        final int index = (int) (dependencies.getPosition() - start);
        final Notification notification = notifications.get(index);
        if (notification != null) {
          notifications.set(index,
              notification.withCausalDependencies(SectionCodec.decodeDependencies(dependencies.getData())));
        }
      }
    }
    return notifications;
  }
}

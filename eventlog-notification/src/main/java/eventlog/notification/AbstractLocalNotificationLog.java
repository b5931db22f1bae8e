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
import eventlog.interfaces.notification.Notification;
import eventlog.interfaces.notification.NotificationLog;
import eventlog.interfaces.notification.NotificationSection;
import eventlog.interfaces.notification.SectionId;
import eventlog.interfaces.store.SequencedItem;

import java.io.IOException;
import java.util.List;
import java.util.OptionalInt;

/**
 * Sections of a positionally addressed item source. Section n covers positions
 * [n * size, (n + 1) * size), named by the 1-based ids of its first and last notifications.
 * <p>
 * The current section is the one containing the next unassigned position; every section
 * before it is fully assigned, has a next id, and never changes again. Sections past the
 * current one are returned empty, without a next id.
 * <p>
 * A requested id is resolved by its first notification id alone, to the section holding that
 * notification; the section returned always carries its own full id.
 */
public abstract class AbstractLocalNotificationLog implements NotificationLog {
  private final int sectionSize;

  protected AbstractLocalNotificationLog(int sectionSize) {
    if (sectionSize < 1) {
      throw new IllegalArgumentException("Section size must be positive, got " + sectionSize);
    }
    this.sectionSize = sectionSize;
  }

  @Override
  public NotificationSection getSection(String sectionId) throws IOException {
    final long next = nextPosition();
    final SectionId id = SectionId.isCurrent(sectionId)
        ? SectionId.containing(next, sectionSize)
        : SectionId.containing(SectionId.parseFirst(sectionId) - 1, sectionSize);

    final long start = id.startPosition();
    final long stop = id.stopPosition();

    final List<Notification> items = start < next
        ? readNotifications(start, Math.min(stop, next))
        : ImmutableList.of();
    final String previousId = start > 0 ? id.previous().toString() : null;
    final String nextId = next >= stop ? id.next().toString() : null;

    return new NotificationSection(id.toString(), previousId, nextId, items);
  }

  @Override
  public OptionalInt getSectionSize() {
    return OptionalInt.of(sectionSize);
  }

  /**
   * @return one past the highest assigned position.
   */
  protected abstract long nextPosition() throws IOException;

  /**
   * @return exactly stop - start elements, the notification at each position in turn, or null
   * where a position has no item.
   */
  protected abstract List<Notification> readNotifications(long start, long stop) throws IOException;

  protected static Notification toNotification(SequencedItem item) {
    return Notification.atPosition(item.getPosition(), item.getTopic(), item.getData());
  }
}

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

import eventlog.interfaces.notification.Notification;
import eventlog.interfaces.notification.NotificationLog;
import eventlog.interfaces.notification.NotificationSection;
import eventlog.interfaces.notification.SectionId;
import eventlog.interfaces.store.InvalidPosition;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.OptionalInt;

/**
 * A resumable cursor over a notification log. Its position is the number of notifications
 * already consumed; every read starts by locating the section holding that position, then
 * follows next ids forward until the current section is exhausted.
 * <p>
 * The position is the reader's only state. Persisting it and seeking back to it is all it
 * takes to resume after a restart. Readers are not thread safe.
 */
public class NotificationLogReader {
  private final NotificationLog log;
  private final GapPolicy gapPolicy;

  private long position = 0;
  private long sectionCount = 0;

  public NotificationLogReader(NotificationLog log) {
    this(log, GapPolicy.SURFACE);
  }

  public NotificationLogReader(NotificationLog log, GapPolicy gapPolicy) {
    this.log = log;
    this.gapPolicy = gapPolicy;
  }

  public long getPosition() {
    return position;
  }

  /**
   * Number of sections requested from the log by this reader so far.
   */
  public long getSectionCount() {
    return sectionCount;
  }

  public void seek(long newPosition) {
    if (newPosition < 0) {
      throw new InvalidPosition(newPosition);
    }
    position = newPosition;
  }

  /**
   * Read every notification available from the current position on.
   */
  public List<Notification> read() throws IOException {
    return read(Long.MAX_VALUE);
  }

  /**
   * Read up to {@code limit} notifications from the current position, advancing past each one.
   * Under {@link GapPolicy#SURFACE} the result contains nulls for positions without items.
   */
  public List<Notification> read(long limit) throws IOException {
    final List<Notification> notifications = new ArrayList<>();
    if (limit <= 0) {
      return notifications;
    }

    NotificationSection section = locateSectionHoldingPosition();
    while (true) {
      final long sectionStart = SectionId.parse(section.getSectionId()).startPosition();
      final List<Notification> items = section.getItems();

      for (long index = position - sectionStart; index < items.size(); index++) {
        if (notifications.size() >= limit) {
          return notifications;
        }

        final Notification notification = items.get((int) index);
        if (notification == null && gapPolicy == GapPolicy.HALT) {
          return notifications;
        }
        if (notification != null || gapPolicy == GapPolicy.SURFACE) {
          notifications.add(notification);
        }
        position++;
      }

      if (section.getNextId() == null || notifications.size() >= limit) {
        return notifications;
      }
      section = fetch(section.getNextId());
    }
  }

  /**
   * Seek to start, then read the notifications at positions before stop.
   */
  public List<Notification> readSlice(long start, long stop) throws IOException {
    seek(start);
    return read(stop - start);
  }

  public List<Notification> readFrom(long start) throws IOException {
    seek(start);
    return read();
  }

  /**
   * Seek to the index and read the notification there.
   *
   * @return the notification, or null if the position has no item and gaps are surfaced.
   * @throws NoSuchElementException if nothing can be read at the index yet.
   */
  @Nullable
  public Notification get(long index) throws IOException {
    final List<Notification> notifications = readSlice(index, index + 1);
    if (notifications.isEmpty()) {
      throw new NoSuchElementException("No notification at index " + index);
    }
    return notifications.get(0);
  }

  private NotificationSection locateSectionHoldingPosition() throws IOException {
    final OptionalInt sectionSize = log.getSectionSize();
    if (sectionSize.isPresent()) {
      return fetch(SectionId.containing(position, sectionSize.getAsInt()).toString());
    }

    NotificationSection section = fetch(SectionId.CURRENT);
    while (section.getPreviousId() != null
        && SectionId.parse(section.getSectionId()).startPosition() > position) {
      section = fetch(section.getPreviousId());
    }
    return section;
  }

  private NotificationSection fetch(String sectionId) throws IOException {
    sectionCount++;
    return log.getSection(sectionId);
  }
}

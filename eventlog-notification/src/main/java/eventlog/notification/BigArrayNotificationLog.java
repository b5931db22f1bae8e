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

import eventlog.EventLogConstants;
import eventlog.array.BigArray;
import eventlog.interfaces.notification.Notification;
import eventlog.interfaces.store.SequencedItem;
import eventlog.interfaces.store.SequencedItemIterator;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Notification log of a BigArray. The array size must be a multiple of the section size, so
 * that every section lies within a single partition.
 */
public class BigArrayNotificationLog extends AbstractLocalNotificationLog {
  private final BigArray array;

  public BigArrayNotificationLog(BigArray array) {
    this(array, EventLogConstants.DEFAULT_SECTION_SIZE);
  }

  public BigArrayNotificationLog(BigArray array, int sectionSize) {
    super(sectionSize);
    if (array.getArraySize() % sectionSize != 0) {
      throw new IllegalArgumentException("Array size " + array.getArraySize()
          + " is not a multiple of section size " + sectionSize);
    }
    this.array = array;
  }

  @Override
  protected long nextPosition() throws IOException {
    return array.getNextPosition();
  }

  @Override
  protected List<Notification> readNotifications(long start, long stop) throws IOException {
    final List<Notification> notifications = new ArrayList<>();
    final SequencedItemIterator slice = array.getSlice(start, stop);

    while (slice.hasNext()) {
      final SequencedItem item = slice.next();
      notifications.add(item == null ? null : toNotification(item));
    }
    return notifications;
  }
}

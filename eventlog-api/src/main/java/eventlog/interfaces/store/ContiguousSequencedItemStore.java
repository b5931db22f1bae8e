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

import java.io.IOException;
import java.util.List;
import java.util.UUID;

/**
 * A store able to compute positions itself. The position of an item written through this
 * interface is one more than the highest position of its sequence, determined within the same
 * atomic operation as the write, so sequences written only this way never contain a gap.
 * All writers to a sequence are serialized by the store.
 */
public interface ContiguousSequencedItemStore extends SequencedItemStore {

  /**
   * Append to a sequence at max(position) + 1, or 0 if the sequence is empty.
   *
   * @return the position written.
   */
  long insertAtNextPosition(@NotNull UUID sequenceId, @NotNull String topic, @NotNull byte[] data)
      throws ConcurrencyError, IOException;

  /**
   * Conditionally insert the given items and, in the same atomic operation, append one record
   * per item to the notification sequence at contiguous positions. Each notification record
   * copies its item's topic and data.
   *
   * @return the notification positions assigned, in the order of the items.
   */
  List<Long> recordWithNotifications(@NotNull List<SequencedItem> items, @NotNull UUID notificationSequenceId)
      throws ConcurrencyError, IOException;
}

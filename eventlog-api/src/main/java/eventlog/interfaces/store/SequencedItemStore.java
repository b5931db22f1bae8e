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

import com.google.common.collect.ImmutableList;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.util.Collection;
import java.util.Set;
import java.util.UUID;

/**
 * Storage of sequenced items, namespaced by sequence id. Every write is a conditional insert:
 * a slot, once filled, is fixed permanently. Implementations must be safe to call from many
 * threads at once without external locking.
 */
public interface SequencedItemStore {

  /**
   * Write an item if, and only if, its slot is unoccupied.
   *
   * @throws ConcurrencyError if (sequenceId, position) already holds an item, even an identical one.
   */
  void insert(@NotNull SequencedItem item) throws ConcurrencyError, IOException;

  /**
   * Write a batch of items atomically: either every item is written, or none is.
   *
   * @throws ConcurrencyError if any slot is occupied, or if two items of the batch share a slot.
   */
  void insertAll(@NotNull Collection<SequencedItem> items) throws ConcurrencyError, IOException;

  @Nullable
  SequencedItem get(@NotNull UUID sequenceId, long position) throws IOException;

  /**
   * Read the items of a sequence with start &lt;= position &lt; stop, in ascending order.
   * Unassigned positions are missing from the result.
   */
  ImmutableList<SequencedItem> readRange(@NotNull UUID sequenceId, long start, long stop) throws IOException;

  /**
   * @return the item with the highest position in the sequence, or null if the sequence is empty.
   */
  @Nullable
  SequencedItem getLast(@NotNull UUID sequenceId) throws IOException;

  Set<UUID> getSequenceIds() throws IOException;

  static void checkRange(long start, long stop) {
    if (start < 0) {
      throw new InvalidPosition(start);
    }
    if (stop < start) {
      throw new InvalidPosition("Range stop " + stop + " is before its start " + start);
    }
  }

  static void checkBatch(Collection<SequencedItem> items) {
    if (items.isEmpty()) {
      throw new IllegalArgumentException("Empty batch");
    }
  }
}

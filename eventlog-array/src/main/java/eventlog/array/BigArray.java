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

package eventlog.array;

import com.google.common.collect.Iterators;
import com.google.common.collect.PeekingIterator;
import com.google.common.math.LongMath;
import com.google.common.primitives.Ints;
import eventlog.EventLogConstants;
import eventlog.interfaces.store.ConcurrencyError;
import eventlog.interfaces.store.InvalidPosition;
import eventlog.interfaces.store.SequenceAppender;
import eventlog.interfaces.store.SequencedItem;
import eventlog.interfaces.store.SequencedItemIterator;
import eventlog.interfaces.store.SequencedItemStore;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.NoSuchElementException;
import java.util.UUID;

import static eventlog.array.ArrayAddressing.fromBytes;
import static eventlog.array.ArrayAddressing.toBytes;

/**
 * An unbounded array of items stored as fixed-size partitions in a SequencedItemStore.
 * <p>
 * Reading or writing a known position touches exactly one partition, found by arithmetic alone.
 * The partitions are indexed by a tree whose branching factor is the array size: every node
 * of height h &gt; 1 is a store sequence whose slot i holds the id of its i-th child, and the
 * array's own sequence holds, at position h - 1, the id of the node of height h covering
 * [0, array_size^h). The highest of these is the apex. The index is only read to discover the
 * next unused position, by descending from the apex through the last occupied slot of each
 * node, which takes a number of reads logarithmic in the size of the array.
 * <p>
 * All writes, to items and to the index alike, are conditional inserts, so concurrent writers
 * racing for the same slot or creating the same node are resolved by the store. Item writes
 * precede the index writes that refer to them; index links left unwritten by a writer that
 * died are found by probing past the last indexed partition, and restored by the next append.
 * <p>
 * The array size cannot be changed once items have been written.
 */
public class BigArray implements SequenceAppender {
  private static final Logger LOG = LoggerFactory.getLogger(BigArray.class);

  private final UUID arrayId;
  private final SequencedItemStore store;
  private final int arraySize;
  private final ArrayAddressing addressing;

  public BigArray(UUID arrayId, SequencedItemStore store) {
    this(arrayId, store, EventLogConstants.DEFAULT_ARRAY_SIZE);
  }

  public BigArray(UUID arrayId, SequencedItemStore store, int arraySize) {
    if (arraySize < 2) {
      throw new IllegalArgumentException("Array size must be at least 2, got " + arraySize);
    }
    this.arrayId = arrayId;
    this.store = store;
    this.arraySize = arraySize;
    this.addressing = new ArrayAddressing(arrayId, arraySize);
  }

  public UUID getArrayId() {
    return arrayId;
  }

  public int getArraySize() {
    return arraySize;
  }

  /**
   * @return the item at the position, with this array's id as its sequence id, or null if the
   * position has not been assigned.
   */
  @Nullable
  public SequencedItem get(long position) throws IOException {
    checkPosition(position);
    final SequencedItem stored = store.get(addressing.partitionId(position), addressing.offset(position));
    return stored == null ? null : stored.withSlot(arrayId, position);
  }

  /**
   * Lazily iterate over the slots start &lt;= position &lt; stop, reading one partition at a time.
   * Unassigned slots are returned as null.
   */
  public SequencedItemIterator getSlice(long start, long stop) {
    SequencedItemStore.checkRange(start, stop);
    return new Slice(start, stop);
  }

  /**
   * Write the item at the position, then link its partition into the index.
   *
   * @throws ConcurrencyError if the position is already assigned. Nothing is written.
   */
  public void set(long position, String topic, byte[] data) throws ConcurrencyError, IOException {
    checkPosition(position);
    store.insert(new SequencedItem(addressing.partitionId(position), addressing.offset(position), topic, data));
    link(position, true);
  }

  /**
   * Write at the next unused position. Another writer may take that position between its
   * discovery and the write, in which case this throws ConcurrencyError and can be retried.
   */
  @Override
  public long append(String topic, byte[] data) throws ConcurrencyError, IOException {
    final long position = discoverNextPosition(true);
    set(position, topic, data);
    return position;
  }

  /**
   * @return the position after the highest assigned position, found through the index.
   */
  public long getNextPosition() throws IOException {
    return discoverNextPosition(false);
  }

  private long discoverNextPosition(boolean repairIndex) throws IOException {
    final SequencedItem apex = store.getLast(arrayId);
    if (apex == null) {
      return scanUnindexedPartitions(0, repairIndex);
    }

    int height = Ints.checkedCast(apex.getPosition() + 1);
    UUID nodeId = fromBytes(apex.getData());
    long nodeStart = 0;

    while (height > 1) {
      final SequencedItem lastChild = store.getLast(nodeId);
      if (lastChild == null) {
        break;
      }
      nodeStart += LongMath.checkedMultiply(lastChild.getPosition(), addressing.span(height - 1));
      nodeId = fromBytes(lastChild.getData());
      height--;
    }

    long candidate = nodeStart;
    if (height == 1) {
      final SequencedItem lastItem = store.getLast(nodeId);
      if (lastItem != null) {
        candidate = nodeStart + lastItem.getPosition() + 1;
      }
    }
    return scanUnindexedPartitions(candidate, repairIndex);
  }

  /**
   * A candidate at a partition boundary may still be in use, if a writer died before indexing
   * the partition starting there. Skip over any such partitions.
   */
  private long scanUnindexedPartitions(long candidate, boolean repairIndex) throws IOException {
    long position = candidate;

    while (position % arraySize == 0 && position < Long.MAX_VALUE) {
      final SequencedItem lastItem = store.getLast(addressing.partitionId(position));
      if (lastItem == null) {
        break;
      }

      final long lastPosition = position + lastItem.getPosition();
      LOG.debug("Partition at {} of array {} is missing from the index", position, arrayId);
      if (repairIndex) {
        link(lastPosition, false);
      }
      position = lastPosition + 1;
    }
    return position;
  }

  /**
   * Link the partition holding the position into each ancestor, then record the apex. When
   * stopAtExistingLink is set, an ancestor slot already holding this child means another writer
   * has linked it, and the rest is left to that writer.
   */
  private void link(long position, boolean stopAtExistingLink) throws IOException {
    final int apexHeight = addressing.requiredHeight(position);
    long childStart = addressing.startOf(position, 1);
    UUID childId = addressing.nodeId(childStart, 1);

    for (int height = 1; height < apexHeight; height++) {
      final long parentStart = addressing.startOf(childStart, height + 1);
      final UUID parentId = addressing.nodeId(parentStart, height + 1);

      final boolean linked = insertLink(parentId, addressing.slotInParent(childStart, height),
          EventLogConstants.ARRAY_LINK_TOPIC, childId);
      if (!linked && stopAtExistingLink) {
        return;
      }
      childStart = parentStart;
      childId = parentId;
    }

    insertLink(arrayId, apexHeight - 1, EventLogConstants.ARRAY_APEX_TOPIC, childId);
  }

  private boolean insertLink(UUID nodeId, long slot, String topic, UUID childId) throws IOException {
    try {
      store.insert(new SequencedItem(nodeId, slot, topic, toBytes(childId)));
      return true;
    } catch (ConcurrencyError e) {
      // Node ids are deterministic, so whoever filled the slot wrote this same link.
      LOG.trace("Slot {} of index node {} is already linked", slot, nodeId);
      return false;
    }
  }

  private static void checkPosition(long position) {
    if (position < 0 || position == Long.MAX_VALUE) {
      throw new InvalidPosition(position);
    }
  }

  private class Slice implements SequencedItemIterator {
    private final long stop;
    private long nextPosition;
    private long partitionStop = -1;
    private PeekingIterator<SequencedItem> partitionItems;

    Slice(long start, long stop) {
      this.nextPosition = start;
      this.stop = stop;
    }

    @Override
    public boolean hasNext() {
      return nextPosition < stop;
    }

    @Nullable
    @Override
    public SequencedItem next() throws IOException {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      if (nextPosition >= partitionStop) {
        readNextPartition();
      }

      final long position = nextPosition++;
      final long offset = addressing.offset(position);
      if (partitionItems.hasNext() && partitionItems.peek().getPosition() == offset) {
        return partitionItems.next().withSlot(arrayId, position);
      }
      return null;
    }

    private void readNextPartition() throws IOException {
      final long partitionStart = addressing.startOf(nextPosition, 1);
      partitionStop = Math.min(stop, LongMath.saturatedAdd(partitionStart, arraySize));
      partitionItems = Iterators.peekingIterator(
          store.readRange(
              addressing.partitionId(nextPosition),
              nextPosition - partitionStart,
              partitionStop - partitionStart)
              .iterator());
    }
  }
}

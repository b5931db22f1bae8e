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

package eventlog.store;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import eventlog.interfaces.sequence.SequenceExhausted;
import eventlog.interfaces.store.ConcurrencyError;
import eventlog.interfaces.store.ContiguousSequencedItemStore;
import eventlog.interfaces.store.SequencedItem;
import eventlog.interfaces.store.SequencedItemStore;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Item store held in memory. Every mutation, including the check that its slots are free, runs
 * under a single lock, which makes conditional inserts, batches and server-computed positions
 * atomic. Reads do not take the lock.
 * <p>
 * Subclasses may make mutations durable by overriding {@link #beforeApply}, which is called with
 * the lock held, after the mutation has been validated and before it becomes visible.
 */
public class InMemorySequencedItemStore implements ContiguousSequencedItemStore {
  private static final Logger LOG = LoggerFactory.getLogger(InMemorySequencedItemStore.class);

  private final ConcurrentMap<UUID, ConcurrentNavigableMap<Long, SequencedItem>> sequences =
      new ConcurrentHashMap<>();
  private final Object writeLock = new Object();

  @Override
  public void insert(@NotNull SequencedItem item) throws ConcurrencyError, IOException {
    insertAll(ImmutableList.of(item));
  }

  @Override
  public void insertAll(@NotNull Collection<SequencedItem> items) throws ConcurrencyError, IOException {
    SequencedItemStore.checkBatch(items);
    final List<SequencedItem> batch = ImmutableList.copyOf(items);

    synchronized (writeLock) {
      ensureSlotsAreFree(batch);
      beforeApply(batch);
      apply(batch);
    }
  }

  @Override
  public long insertAtNextPosition(@NotNull UUID sequenceId, @NotNull String topic, @NotNull byte[] data)
      throws ConcurrencyError, IOException {
    synchronized (writeLock) {
      final SequencedItem item = new SequencedItem(sequenceId, nextPosition(sequenceId), topic, data);
      final List<SequencedItem> batch = ImmutableList.of(item);
      beforeApply(batch);
      apply(batch);
      return item.getPosition();
    }
  }

  @Override
  public List<Long> recordWithNotifications(@NotNull List<SequencedItem> items, @NotNull UUID notificationSequenceId)
      throws ConcurrencyError, IOException {
    SequencedItemStore.checkBatch(items);

    synchronized (writeLock) {
      final List<SequencedItem> batch = new ArrayList<>(items);
      final ImmutableList.Builder<Long> notificationPositions = ImmutableList.builder();

      long position = nextPosition(notificationSequenceId);
      for (SequencedItem item : items) {
        batch.add(item.withSlot(notificationSequenceId, position));
        notificationPositions.add(position);
        position++;
      }

      ensureSlotsAreFree(batch);
      beforeApply(batch);
      apply(batch);
      return notificationPositions.build();
    }
  }

  @Nullable
  @Override
  public SequencedItem get(@NotNull UUID sequenceId, long position) {
    final ConcurrentNavigableMap<Long, SequencedItem> sequence = sequences.get(sequenceId);
    return sequence == null ? null : sequence.get(position);
  }

  @Override
  public ImmutableList<SequencedItem> readRange(@NotNull UUID sequenceId, long start, long stop) {
    SequencedItemStore.checkRange(start, stop);

    final ConcurrentNavigableMap<Long, SequencedItem> sequence = sequences.get(sequenceId);
    if (sequence == null || start == stop) {
      return ImmutableList.of();
    }
    return ImmutableList.copyOf(sequence.subMap(start, true, stop, false).values());
  }

  @Nullable
  @Override
  public SequencedItem getLast(@NotNull UUID sequenceId) {
    final ConcurrentNavigableMap<Long, SequencedItem> sequence = sequences.get(sequenceId);
    if (sequence == null) {
      return null;
    }
    final Map.Entry<Long, SequencedItem> last = sequence.lastEntry();
    return last == null ? null : last.getValue();
  }

  @Override
  public Set<UUID> getSequenceIds() {
    return ImmutableSet.copyOf(sequences.keySet());
  }

  /**
   * Called with the write lock held, for a batch that is known to fit. If this throws, nothing
   * of the batch is applied.
   */
  protected void beforeApply(List<SequencedItem> batch) throws IOException {
  }

  /**
   * Make a batch visible without validating or journaling it; for restoring previously
   * accepted batches.
   */
  protected void applyRecovered(List<SequencedItem> batch) {
    synchronized (writeLock) {
      apply(batch);
    }
  }

  private void apply(List<SequencedItem> batch) {
    for (SequencedItem item : batch) {
      sequences
          .computeIfAbsent(item.getSequenceId(), (ignore) -> new ConcurrentSkipListMap<>())
          .put(item.getPosition(), item);
    }
  }

  private long nextPosition(UUID sequenceId) {
    final SequencedItem last = getLast(sequenceId);
    if (last == null) {
      return 0;
    }
    if (last.getPosition() == Long.MAX_VALUE) {
      throw new SequenceExhausted(last.getPosition());
    }
    return last.getPosition() + 1;
  }

  private void ensureSlotsAreFree(List<SequencedItem> batch) throws ConcurrencyError {
    final Map<UUID, Set<Long>> batchSlots = new HashMap<>();

    for (SequencedItem item : batch) {
      final UUID sequenceId = item.getSequenceId();
      final long position = item.getPosition();
      final boolean firstInBatch = batchSlots.computeIfAbsent(sequenceId, (ignore) -> new HashSet<>()).add(position);

      if (!firstInBatch || get(sequenceId, position) != null) {
        LOG.debug("Rejecting write to occupied position {} of {}", position, sequenceId);
        throw new ConcurrencyError(sequenceId, position);
      }
    }
  }
}

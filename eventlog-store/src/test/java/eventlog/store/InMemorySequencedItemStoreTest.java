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
import eventlog.interfaces.store.ConcurrencyError;
import eventlog.interfaces.store.InvalidPosition;
import eventlog.interfaces.store.SequencedItem;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

import static eventlog.CollectionMatchers.isAContiguousRunFrom;
import static eventlog.ConcurrencyTestUtil.runAConcurrencyTestSeveralTimes;
import static eventlog.ConcurrencyTestUtil.runNTimesAndWaitForAllToComplete;
import static eventlog.EventLogTestUtil.anItem;
import static eventlog.EventLogTestUtil.bytes;
import static eventlog.EventLogTestUtil.text;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.Assert.fail;

public class InMemorySequencedItemStoreTest {
  private final UUID sequenceId = UUID.randomUUID();
  private final UUID notificationSequenceId = UUID.randomUUID();
  private final InMemorySequencedItemStore store = new InMemorySequencedItemStore();

  @Test
  public void returnsAnInsertedItemFromItsSlot() throws Exception {
    store.insert(anItem(sequenceId, 3, "three"));

    assertThat(store.get(sequenceId, 3), is(equalTo(anItem(sequenceId, 3, "three"))));
    assertThat(store.get(sequenceId, 2), is(nullValue()));
    assertThat(store.get(UUID.randomUUID(), 3), is(nullValue()));
  }

  @Test
  public void rejectsASecondWriteToAnOccupiedSlotEvenWithIdenticalContent() throws Exception {
    store.insert(anItem(sequenceId, 0, "first"));

    try {
      store.insert(anItem(sequenceId, 0, "first"));
      fail("expected ConcurrencyError");
    } catch (ConcurrencyError e) {
      assertThat(e.getSequenceId(), is(equalTo(sequenceId)));
      assertThat(e.getPosition(), is(equalTo(0L)));
    }
  }

  @Test(timeout = 30000)
  public void exactlyOneOfTwoConcurrentWritersToTheSamePositionWinsAndItsPayloadIsKept() throws Exception {
    runAConcurrencyTestSeveralTimes(2, 50, (numThreads, executor) -> {
      final UUID contested = UUID.randomUUID();

      List<String> outcomes = runNTimesAndWaitForAllToComplete(numThreads, executor, (index) -> {
        try {
          store.insert(anItem(contested, 5, "writer-" + index));
          return "writer-" + index;
        } catch (ConcurrencyError e) {
          return "lost";
        }
      });

      List<String> winners = outcomes.stream().filter((outcome) -> !outcome.equals("lost")).collect(Collectors.toList());
      assertThat(winners, hasSize(1));
      assertThat(text(store.get(contested, 5).getData()), is(equalTo(winners.get(0))));
    });
  }

  @Test
  public void writesNothingFromABatchThatConflictsWithAnExistingItem() throws Exception {
    store.insert(anItem(sequenceId, 2, "existing"));

    try {
      store.insertAll(ImmutableList.of(
          anItem(sequenceId, 1, "a"),
          anItem(sequenceId, 2, "b"),
          anItem(sequenceId, 3, "c")));
      fail("expected ConcurrencyError");
    } catch (ConcurrencyError expected) {
    }

    assertThat(store.get(sequenceId, 1), is(nullValue()));
    assertThat(store.get(sequenceId, 3), is(nullValue()));
    assertThat(text(store.get(sequenceId, 2).getData()), is(equalTo("existing")));
  }

  @Test(expected = ConcurrencyError.class)
  public void rejectsABatchContainingTheSameSlotTwice() throws Exception {
    store.insertAll(ImmutableList.of(
        anItem(sequenceId, 1, "a"),
        anItem(sequenceId, 1, "b")));
  }

  @Test
  public void readsARangeInAscendingOrderLeavingOutUnassignedPositions() throws Exception {
    for (long position : new long[]{7, 1, 4, 2, 9}) {
      store.insert(anItem(sequenceId, position, "item" + position));
    }

    List<Long> positions = store.readRange(sequenceId, 2, 9).stream()
        .map(SequencedItem::getPosition)
        .collect(Collectors.toList());

    assertThat(positions, contains(2L, 4L, 7L));
    assertThat(store.readRange(sequenceId, 3, 3), is(empty()));
    assertThat(store.readRange(UUID.randomUUID(), 0, 100), is(empty()));
  }

  @Test(expected = InvalidPosition.class)
  public void refusesARangeStartingAtANegativePosition() throws Exception {
    store.readRange(sequenceId, -1, 5);
  }

  @Test(expected = InvalidPosition.class)
  public void refusesARangeThatEndsBeforeItStarts() throws Exception {
    store.readRange(sequenceId, 5, 4);
  }

  @Test
  public void reportsTheItemAtTheHighestPositionAsLast() throws Exception {
    assertThat(store.getLast(sequenceId), is(nullValue()));

    store.insert(anItem(sequenceId, 10, "ten"));
    store.insert(anItem(sequenceId, 3, "three"));

    assertThat(store.getLast(sequenceId).getPosition(), is(equalTo(10L)));
  }

  @Test
  public void computesPositionsFromTheHighestExistingPosition() throws Exception {
    assertThat(store.insertAtNextPosition(sequenceId, "topic", bytes("a")), is(equalTo(0L)));
    assertThat(store.insertAtNextPosition(sequenceId, "topic", bytes("b")), is(equalTo(1L)));

    store.insert(anItem(sequenceId, 5, "explicit"));

    assertThat(store.insertAtNextPosition(sequenceId, "topic", bytes("c")), is(equalTo(6L)));
  }

  @Test(timeout = 60000)
  public void concurrentContiguousWritersProduceExactlyOneItemPerPositionWithNoGaps() throws Exception {
    final int writers = 8;
    final int appendsPerWriter = 200;

    runAConcurrencyTestSeveralTimes(writers, 1, (numThreads, executor) -> {
      List<List<Long>> positionsByWriter = runNTimesAndWaitForAllToComplete(numThreads, executor, (index) -> {
        List<Long> positions = new ArrayList<>();
        for (int i = 0; i < appendsPerWriter; i++) {
          positions.add(store.insertAtNextPosition(sequenceId, "topic", bytes(index + ":" + i)));
        }
        return positions;
      });

      List<Long> allPositions = positionsByWriter.stream().flatMap(List::stream).collect(Collectors.toList());
      assertThat(allPositions, isAContiguousRunFrom(0));
      assertThat(store.readRange(sequenceId, 0, Long.MAX_VALUE), hasSize(writers * appendsPerWriter));
    });
  }

  @Test
  public void recordsItemsTogetherWithContiguousNotificationRecords() throws Exception {
    store.insertAtNextPosition(notificationSequenceId, "earlier", bytes("earlier"));
    UUID otherSequenceId = UUID.randomUUID();

    List<Long> notificationPositions = store.recordWithNotifications(
        ImmutableList.of(anItem(sequenceId, 0, "created"), anItem(otherSequenceId, 0, "opened")),
        notificationSequenceId);

    assertThat(notificationPositions, contains(1L, 2L));
    assertThat(text(store.get(notificationSequenceId, 1).getData()), is(equalTo("created")));
    assertThat(text(store.get(notificationSequenceId, 2).getData()), is(equalTo("opened")));
    assertThat(store.get(sequenceId, 0), is(equalTo(anItem(sequenceId, 0, "created"))));
  }

  @Test
  public void recordsNoNotificationsWhenAnyItemConflicts() throws Exception {
    store.insert(anItem(sequenceId, 1, "existing"));

    try {
      store.recordWithNotifications(
          ImmutableList.of(anItem(sequenceId, 0, "new"), anItem(sequenceId, 1, "conflicting")),
          notificationSequenceId);
      fail("expected ConcurrencyError");
    } catch (ConcurrencyError expected) {
    }

    assertThat(store.getLast(notificationSequenceId), is(nullValue()));
    assertThat(store.get(sequenceId, 0), is(nullValue()));
  }

  @Test
  public void listsEverySequenceThatHasBeenWrittenTo() throws Exception {
    store.insert(anItem(sequenceId, 0, "a"));
    store.insertAtNextPosition(notificationSequenceId, "topic", bytes("b"));

    assertThat(store.getSequenceIds(), containsInAnyOrder(sequenceId, notificationSequenceId));
  }
}

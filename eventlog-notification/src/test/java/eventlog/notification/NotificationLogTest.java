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

import eventlog.array.BigArray;
import eventlog.interfaces.notification.Notification;
import eventlog.interfaces.notification.NotificationLog;
import eventlog.interfaces.notification.NotificationSection;
import eventlog.interfaces.store.InvalidPosition;
import eventlog.store.ContiguousAppender;
import eventlog.store.InMemorySequencedItemStore;
import org.junit.Test;

import java.util.List;
import java.util.OptionalInt;
import java.util.UUID;
import java.util.stream.Collectors;

import static eventlog.EventLogTestUtil.anItem;
import static eventlog.EventLogTestUtil.bytes;
import static eventlog.EventLogTestUtil.text;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.nullValue;

public class NotificationLogTest {
  private static final int SECTION_SIZE = 5;

  private final UUID sequenceId = UUID.randomUUID();
  private final InMemorySequencedItemStore store = new InMemorySequencedItemStore();
  private final NotificationLog log = new StoreNotificationLog(store, sequenceId, SECTION_SIZE);

  @Test
  public void theCurrentSectionOfAnEmptyLogIsTheFirstWindowWithNoItemsAndNoNeighbours() throws Exception {
    NotificationSection current = log.getSection("current");

    assertThat(current.getSectionId(), is(equalTo("1,5")));
    assertThat(current.getItems(), is(empty()));
    assertThat(current.getPreviousId(), is(nullValue()));
    assertThat(current.getNextId(), is(nullValue()));
    assertThat(current.isArchived(), is(false));
  }

  @Test
  public void theCurrentSectionHoldsTheNotificationsAfterTheLastFullSection() throws Exception {
    appendItems(9);

    NotificationSection current = log.getSection("current");

    assertThat(current.getSectionId(), is(equalTo("6,10")));
    assertThat(idsOf(current), contains(6L, 7L, 8L, 9L));
    assertThat(current.getPreviousId(), is(equalTo("1,5")));
    assertThat(current.getNextId(), is(nullValue()));
  }

  @Test
  public void aFullSectionIsArchivedAndLinksToTheNextSection() throws Exception {
    appendItems(9);

    NotificationSection first = log.getSection("1,5");

    assertThat(idsOf(first), contains(1L, 2L, 3L, 4L, 5L));
    assertThat(first.getPreviousId(), is(nullValue()));
    assertThat(first.getNextId(), is(equalTo("6,10")));
    assertThat(first.isArchived(), is(true));
  }

  @Test
  public void notificationsCarryTheTopicAndDataOfTheirItems() throws Exception {
    appendItems(3);

    Notification second = log.getSection("1,5").getItems().get(1);

    assertThat(second.getId(), is(equalTo(2L)));
    assertThat(second.getPosition(), is(equalTo(1L)));
    assertThat(second.getTopic(), is(equalTo("test.Event")));
    assertThat(text(second.getData()), is(equalTo("item 1")));
  }

  @Test
  public void whenTheLastSectionIsExactlyFullTheCurrentSectionIsTheEmptyOneAfterIt() throws Exception {
    appendItems(10);

    NotificationSection current = log.getSection("current");

    assertThat(current.getSectionId(), is(equalTo("11,15")));
    assertThat(current.getItems(), is(empty()));
    assertThat(current.getPreviousId(), is(equalTo("6,10")));
    assertThat(log.getSection("6,10").getNextId(), is(equalTo("11,15")));
  }

  @Test
  public void sectionsBeyondTheCurrentOneAreEmptyAndHaveNoNextSection() throws Exception {
    appendItems(3);

    NotificationSection beyond = log.getSection("21,25");

    assertThat(beyond.getItems(), is(empty()));
    assertThat(beyond.getPreviousId(), is(equalTo("16,20")));
    assertThat(beyond.getNextId(), is(nullValue()));
  }

  @Test
  public void positionsWithoutItemsAppearAsNullsBelowTheHighWaterMark() throws Exception {
    store.insert(anItem(sequenceId, 0, "a"));
    store.insert(anItem(sequenceId, 2, "c"));

    List<Notification> items = log.getSection("current").getItems();

    assertThat(items.size(), is(equalTo(3)));
    assertThat(items.get(0).getId(), is(equalTo(1L)));
    assertThat(items.get(1), is(nullValue()));
    assertThat(items.get(2).getId(), is(equalTo(3L)));
  }

  @Test
  public void resolvesTheIdOfAPartlyFilledSectionToThatSection() throws Exception {
    appendItems(9);

    NotificationSection section = log.getSection("6,9");

    assertThat(section.getSectionId(), is(equalTo("6,10")));
    assertThat(idsOf(section), contains(6L, 7L, 8L, 9L));
  }

  @Test
  public void resolvesAnIdByItsFirstNotificationAlone() throws Exception {
    appendItems(9);

    assertThat(log.getSection("7,11").getSectionId(), is(equalTo("6,10")));
    assertThat(log.getSection("6,").getSectionId(), is(equalTo("6,10")));
    assertThat(log.getSection("3").getSectionId(), is(equalTo("1,5")));
    assertThat(idsOf(log.getSection("5,100")), contains(1L, 2L, 3L, 4L, 5L));
  }

  @Test(expected = InvalidPosition.class)
  public void rejectsASectionIdStartingBeforeTheFirstNotification() throws Exception {
    log.getSection("0,4");
  }

  @Test(expected = InvalidPosition.class)
  public void rejectsASectionIdThatIsNotARange() throws Exception {
    log.getSection("first-page");
  }

  @Test(expected = InvalidPosition.class)
  public void rejectsASectionIdWhoseLastPartIsNotANumber() throws Exception {
    log.getSection("6,ten");
  }

  @Test
  public void reportsItsSectionSize() throws Exception {
    assertThat(log.getSectionSize(), is(equalTo(OptionalInt.of(SECTION_SIZE))));
  }

  @Test
  public void aBigArrayLogPagesThroughTheArrayAcrossPartitions() throws Exception {
    BigArray array = new BigArray(UUID.randomUUID(), store, 10);
    NotificationLog arrayLog = new BigArrayNotificationLog(array, SECTION_SIZE);
    for (int i = 0; i < 13; i++) {
      array.append("test.Event", bytes("item " + i));
    }

    NotificationSection current = arrayLog.getSection("current");
    assertThat(current.getSectionId(), is(equalTo("11,15")));
    assertThat(idsOf(current), contains(11L, 12L, 13L));
    assertThat(current.getPreviousId(), is(equalTo("6,10")));

    NotificationSection second = arrayLog.getSection("6,10");
    assertThat(idsOf(second), contains(6L, 7L, 8L, 9L, 10L));
    assertThat(second.getNextId(), is(equalTo("11,15")));
  }

  @Test
  public void aBigArrayLogShowsUnsetPositionsAsNulls() throws Exception {
    BigArray array = new BigArray(UUID.randomUUID(), store, 10);
    NotificationLog arrayLog = new BigArrayNotificationLog(array, SECTION_SIZE);
    array.set(0, "test.Event", bytes("a"));
    array.set(1, "test.Event", bytes("b"));
    array.set(3, "test.Event", bytes("d"));

    List<Notification> items = arrayLog.getSection("current").getItems();

    assertThat(items.size(), is(equalTo(4)));
    assertThat(items.get(1), is(notNullValue()));
    assertThat(items.get(2), is(nullValue()));
    assertThat(items.get(3).getId(), is(equalTo(4L)));
  }

  @Test(expected = IllegalArgumentException.class)
  public void aBigArrayLogRequiresSectionsToDivideTheArraySize() throws Exception {
    new BigArrayNotificationLog(new BigArray(UUID.randomUUID(), store, 7), SECTION_SIZE);
  }

  private void appendItems(int count) throws Exception {
    ContiguousAppender appender = new ContiguousAppender(store, sequenceId);
    for (int i = 0; i < count; i++) {
      appender.append("test.Event", bytes("item " + i));
    }
  }

  private static List<Long> idsOf(NotificationSection section) {
    return section.getItems().stream()
        .map(Notification::getId)
        .collect(Collectors.toList());
  }
}

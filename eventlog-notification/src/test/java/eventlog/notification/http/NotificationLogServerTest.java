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

package eventlog.notification.http;

import com.google.common.collect.ConcurrentHashMultiset;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Multiset;
import eventlog.interfaces.notification.Notification;
import eventlog.interfaces.notification.NotificationLog;
import eventlog.interfaces.notification.NotificationSection;
import eventlog.interfaces.store.InvalidPosition;
import eventlog.notification.NotificationLogReader;
import eventlog.notification.StoreNotificationLog;
import eventlog.store.ContiguousAppender;
import eventlog.store.InMemorySequencedItemStore;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.io.IOException;
import java.net.HttpURLConnection;
import java.net.URL;
import java.util.List;
import java.util.OptionalInt;
import java.util.UUID;
import java.util.stream.Collectors;

import static eventlog.EventLogTestUtil.bytes;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.notNullValue;

public class NotificationLogServerTest {
  private static final int SECTION_SIZE = 5;

  private final UUID sequenceId = UUID.randomUUID();
  private final InMemorySequencedItemStore store = new InMemorySequencedItemStore();
  private final ContiguousAppender appender = new ContiguousAppender(store, sequenceId);
  private final CountingLog servedLog = new CountingLog(new StoreNotificationLog(store, sequenceId, SECTION_SIZE));

  private EventLoopGroup bossGroup;
  private EventLoopGroup workerGroup;
  private NotificationLogServer server;
  private RemoteNotificationLog remote;

  @Before
  public void startServer() {
    bossGroup = new NioEventLoopGroup(1);
    workerGroup = new NioEventLoopGroup(2);
    server = new NotificationLogServer(bossGroup, workerGroup, 0, ImmutableMap.<String, NotificationLog>of(
        "orders", servedLog,
        "broken", sectionId -> {
          throw new IOException("disk on fire");
        }));
    server.startAsync().awaitRunning();
    remote = new RemoteNotificationLog(workerGroup, "localhost", server.getPort(), "orders");
  }

  @After
  public void stopServer() {
    server.stopAsync().awaitTerminated();
    workerGroup.shutdownGracefully();
    bossGroup.shutdownGracefully();
  }

  @Test(timeout = 10000)
  public void aRemoteLogReturnsTheSameSectionsAsTheLogItIsServing() throws Exception {
    appendItems(9);

    assertThat(remote.getSection("current"), is(equalTo(servedLog.getSection("current"))));
    assertThat(remote.getSection("1,5"), is(equalTo(servedLog.getSection("1,5"))));
  }

  @Test(timeout = 10000)
  public void aReaderReadsEverythingThroughARemoteLog() throws Exception {
    appendItems(12);
    NotificationLogReader reader = new NotificationLogReader(remote);

    List<Long> ids = reader.read().stream()
        .map(Notification::getId)
        .collect(Collectors.toList());

    assertThat(ids, contains(1L, 2L, 3L, 4L, 5L, 6L, 7L, 8L, 9L, 10L, 11L, 12L));
    assertThat(remote.getSectionSize(), is(equalTo(OptionalInt.of(SECTION_SIZE))));
  }

  @Test(timeout = 10000)
  public void archivedSectionsAreOnlyFetchedOnce() throws Exception {
    appendItems(7);

    remote.getSection("1,5");
    NotificationSection again = remote.getSection("1,5");

    assertThat(again.getItems().size(), is(equalTo(5)));
    assertThat(servedLog.requests.count("1,5"), is(equalTo(1)));
  }

  @Test(timeout = 10000)
  public void theCurrentSectionIsRevalidatedAndPicksUpNewNotifications() throws Exception {
    appendItems(2);
    assertThat(remote.getSection("current").getItems().size(), is(equalTo(2)));
    assertThat(remote.getSection("current").getItems().size(), is(equalTo(2)));

    appendItems(1);

    assertThat(remote.getSection("current").getItems().size(), is(equalTo(3)));
    assertThat(servedLog.requests.count("current"), is(equalTo(3)));
  }

  @Test(timeout = 10000)
  public void servesTheSectionHoldingTheFirstIdOfAnyRequestedRange() throws Exception {
    appendItems(9);

    assertThat(remote.getSection("6,9").getSectionId(), is(equalTo("6,10")));
    assertThat(remote.getSection("7,").getItems().size(), is(equalTo(4)));
  }

  @Test(timeout = 10000)
  public void marksArchivedSectionsCacheableForeverAndTheCurrentSectionNotAtAll() throws Exception {
    appendItems(7);

    HttpURLConnection archived = open("/notifications/orders/1,5");
    assertThat(archived.getResponseCode(), is(equalTo(200)));
    assertThat(archived.getHeaderField("Cache-Control"), is(equalTo("public, max-age=31536000, immutable")));
    assertThat(archived.getContentType(), is(equalTo("application/json")));

    HttpURLConnection current = open("/notifications/orders/current");
    assertThat(current.getResponseCode(), is(equalTo(200)));
    assertThat(current.getHeaderField("Cache-Control"), is(equalTo("no-cache")));
  }

  @Test(timeout = 10000)
  public void answersAMatchingIfNoneMatchWithNotModified() throws Exception {
    appendItems(3);
    HttpURLConnection first = open("/notifications/orders/current");
    assertThat(first.getResponseCode(), is(equalTo(200)));
    String etag = first.getHeaderField("ETag");
    assertThat(etag, is(notNullValue()));

    HttpURLConnection revalidation = open("/notifications/orders/current");
    revalidation.setRequestProperty("If-None-Match", etag);
    assertThat(revalidation.getResponseCode(), is(equalTo(304)));

    appendItems(1);
    HttpURLConnection afterAppend = open("/notifications/orders/current");
    afterAppend.setRequestProperty("If-None-Match", etag);
    assertThat(afterAppend.getResponseCode(), is(equalTo(200)));
  }

  @Test(timeout = 10000)
  public void rejectsMalformedAndUnknownRequests() throws Exception {
    assertThat(open("/notifications/orders/0,4").getResponseCode(), is(equalTo(400)));
    assertThat(open("/notifications/nowhere/current").getResponseCode(), is(equalTo(404)));
    assertThat(open("/elsewhere/orders/current").getResponseCode(), is(equalTo(404)));

    HttpURLConnection post = open("/notifications/orders/current");
    post.setRequestMethod("POST");
    assertThat(post.getResponseCode(), is(equalTo(405)));
  }

  @Test(timeout = 10000)
  public void reportsAStorageFailureAsAServerError() throws Exception {
    assertThat(open("/notifications/broken/current").getResponseCode(), is(equalTo(500)));
  }

  @Test(timeout = 10000, expected = InvalidPosition.class)
  public void aRemoteLogRejectsSectionIdsTheServerRejects() throws Exception {
    remote.getSection("0,4");
  }

  @Test(timeout = 10000, expected = IOException.class)
  public void aRemoteLogFailsWithAnIOExceptionForAnUnknownLog() throws Exception {
    new RemoteNotificationLog(workerGroup, "localhost", server.getPort(), "nowhere").getSection("current");
  }

  @Test(timeout = 10000, expected = IOException.class)
  public void aRemoteLogFailsWithAnIOExceptionWhenTheServerFails() throws Exception {
    new RemoteNotificationLog(workerGroup, "localhost", server.getPort(), "broken").getSection("current");
  }

  private HttpURLConnection open(String path) throws IOException {
    HttpURLConnection connection =
        (HttpURLConnection) new URL("http://localhost:" + server.getPort() + path).openConnection();
    connection.setUseCaches(false);
    return connection;
  }

  private void appendItems(int count) throws Exception {
    for (int i = 0; i < count; i++) {
      appender.append("test.Event", bytes("item " + i));
    }
  }

  private static class CountingLog implements NotificationLog {
    final Multiset<String> requests = ConcurrentHashMultiset.create();
    private final NotificationLog delegate;

    CountingLog(NotificationLog delegate) {
      this.delegate = delegate;
    }

    @Override
    public NotificationSection getSection(String sectionId) throws IOException {
      requests.add(sectionId);
      return delegate.getSection(sectionId);
    }

    @Override
    public OptionalInt getSectionSize() {
      return delegate.getSectionSize();
    }
  }
}

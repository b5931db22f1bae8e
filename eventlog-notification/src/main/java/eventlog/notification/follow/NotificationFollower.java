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

package eventlog.notification.follow;

import com.google.common.util.concurrent.AbstractService;
import eventlog.NotificationConstants;
import eventlog.interfaces.notification.CausalDependency;
import eventlog.interfaces.notification.Notification;
import eventlog.interfaces.notification.NotificationLog;
import eventlog.notification.GapPolicy;
import eventlog.notification.NotificationLogReader;
import eventlog.util.FiberOnly;
import eventlog.util.FiberSupplier;
import org.jetlang.channels.Channel;
import org.jetlang.channels.MemoryChannel;
import org.jetlang.channels.Subscriber;
import org.jetlang.core.Disposable;
import org.jetlang.fibers.Fiber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Follows an upstream notification log: polls it for new notifications, hands each to a
 * {@link NotificationProcessor} in order, and records the position reached with a
 * {@link PositionTracker}. On start, it resumes from the tracked position.
 * <p>
 * All polling and processing happens on the follower's own fiber. A processor failure, or a
 * failure to read or track, fails the service; the notification that failed is not recorded,
 * and will be the first processed when a new follower resumes from the same tracker.
 * <p>
 * A notification whose causal dependencies are not yet met, according to the follower's
 * {@link CausalDependencyCheck}, is held back: the batch stops there, and the notification is
 * offered again on the next poll.
 */
public class NotificationFollower extends AbstractService {
  private static final Logger LOG = LoggerFactory.getLogger(NotificationFollower.class);

  private final NotificationLogReader reader;
  private final NotificationProcessor processor;
  private final PositionTracker positionTracker;
  private final Fiber fiber;
  private final long pollIntervalMillis;
  private final int batchSize;
  private final CausalDependencyCheck dependencyCheck;

  private final Channel<Notification> processedChannel = new MemoryChannel<>();

  private Disposable pollTask;

  public NotificationFollower(NotificationLog upstream,
                              NotificationProcessor processor,
                              PositionTracker positionTracker,
                              FiberSupplier fiberSupplier) {
    this(upstream, GapPolicy.HALT, processor, positionTracker, fiberSupplier,
        NotificationConstants.FOLLOWER_POLL_INTERVAL_MILLIS);
  }

  /**
   * @param gapPolicy either HALT, to wait for gaps to be filled, or SKIP, to pass over them.
   */
  public NotificationFollower(NotificationLog upstream,
                              GapPolicy gapPolicy,
                              NotificationProcessor processor,
                              PositionTracker positionTracker,
                              FiberSupplier fiberSupplier,
                              long pollIntervalMillis) {
    this(upstream, gapPolicy, processor, positionTracker, fiberSupplier, pollIntervalMillis,
        CausalDependencyCheck.NONE);
  }

  public NotificationFollower(NotificationLog upstream,
                              GapPolicy gapPolicy,
                              NotificationProcessor processor,
                              PositionTracker positionTracker,
                              FiberSupplier fiberSupplier,
                              long pollIntervalMillis,
                              CausalDependencyCheck dependencyCheck) {
    if (gapPolicy == GapPolicy.SURFACE) {
      throw new IllegalArgumentException("A follower cannot process gaps; use HALT or SKIP");
    }
    this.reader = new NotificationLogReader(upstream, gapPolicy);
    this.processor = processor;
    this.positionTracker = positionTracker;
    this.fiber = fiberSupplier.getNewFiber(this::failWith);
    this.pollIntervalMillis = pollIntervalMillis;
    this.batchSize = NotificationConstants.FOLLOWER_BATCH_SIZE;
    this.dependencyCheck = dependencyCheck;
  }

  /**
   * Each notification is published here once it has been processed and its position recorded.
   */
  public Subscriber<Notification> getProcessedNotifications() {
    return processedChannel;
  }

  /**
   * Poll now, rather than waiting for the next scheduled poll.
   */
  public void prompt() {
    fiber.execute(this::poll);
  }

  @Override
  protected void doStart() {
    fiber.start();
    fiber.execute(() -> {
      try {
        final long position = positionTracker.getPosition();
        reader.seek(position);
        LOG.info("Following notifications from position {}", position);
        pollTask = fiber.scheduleWithFixedDelay(this::poll, 0, pollIntervalMillis, TimeUnit.MILLISECONDS);
        notifyStarted();
      } catch (Throwable t) {
        LOG.error("Unable to start following notifications", t);
        notifyFailed(t);
        fiber.dispose();
      }
    });
  }

  @Override
  protected void doStop() {
    fiber.execute(() -> {
      cancelPolling();
      notifyStopped();
      fiber.dispose();
    });
  }

  @FiberOnly
  private void poll() {
    if (state() != State.RUNNING) {
      return;
    }

    try {
      final List<Notification> batch = reader.read(batchSize);
      for (Notification notification : batch) {
        if (!dependenciesMet(notification)) {
          reader.seek(notification.getPosition());
          return;
        }
        processor.process(notification);
        positionTracker.recordPosition(notification.getId());
        processedChannel.publish(notification);
      }

      // Skipped gaps after the last notification.
      if (reader.getPosition() > positionTracker.getPosition()) {
        positionTracker.recordPosition(reader.getPosition());
      }

      if (batch.size() == batchSize) {
        fiber.execute(this::poll);
      }
    } catch (Throwable t) {
      failWith(t);
    }
  }

  @FiberOnly
  private boolean dependenciesMet(Notification notification) throws IOException {
    for (CausalDependency dependency : notification.getCausalDependencies()) {
      if (!dependencyCheck.isSatisfied(dependency)) {
        LOG.debug("Holding back notification {} until {} has been processed", notification.getId(), dependency);
        return false;
      }
    }
    return true;
  }

  private void failWith(Throwable t) {
    LOG.error("Notification follower failed near position {}", reader.getPosition(), t);
    cancelPolling();
    final State state = state();
    if (state == State.STARTING || state == State.RUNNING || state == State.STOPPING) {
      notifyFailed(t);
    }
    fiber.dispose();
  }

  private void cancelPolling() {
    if (pollTask != null) {
      pollTask.dispose();
      pollTask = null;
    }
  }
}

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

package eventlog.sequence;

import eventlog.interfaces.sequence.AtomicCounter;
import eventlog.interfaces.sequence.HighWaterMark;
import eventlog.interfaces.sequence.IntegerSequencer;
import eventlog.interfaces.sequence.SequenceExhausted;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Sequencer shared between processes through an external atomic counter. Counter value v
 * issues position v - 1.
 * <p>
 * The counter's host may lose state and restart below positions already in use. This sequencer
 * resynchronizes the counter to max(storage high-water mark, highest position it issued + 1):
 * <ul>
 *   <li>before issuing its first position;</li>
 *   <li>when the counter returns a value below the last synchronized floor;</li>
 *   <li>when a writer reports through {@link #resync()} that an issued position was occupied.</li>
 * </ul>
 * A restart that goes undetected by the first two checks still cannot overwrite anything,
 * because storage rejects the duplicate and the writer's retry obtains a resynchronized number.
 */
public class CounterBackedIntegerSequencer implements IntegerSequencer {
  private static final Logger LOG = LoggerFactory.getLogger(CounterBackedIntegerSequencer.class);

  private final AtomicCounter counter;
  private final HighWaterMark highWaterMark;

  private final AtomicLong highestIssued = new AtomicLong(-1);
  private final AtomicLong synchronizedFloor = new AtomicLong(-1);
  private volatile boolean synced = false;

  public CounterBackedIntegerSequencer(AtomicCounter counter, HighWaterMark highWaterMark) {
    this.counter = counter;
    this.highWaterMark = highWaterMark;
  }

  @Override
  public long next() throws IOException {
    if (!synced) {
      resync();
    }

    long position = issue();
    if (position < synchronizedFloor.get()) {
      LOG.warn("Counter issued position {}, below the synchronized floor {}; it has lost state",
          position, synchronizedFloor.get());
      resync();

      position = issue();
      if (position < synchronizedFloor.get()) {
        throw new IOException("Counter did not advance to the synchronized floor " + synchronizedFloor.get());
      }
    }

    highestIssued.accumulateAndGet(position, Math::max);
    return position;
  }

  @Override
  public synchronized void resync() throws IOException {
    final long floor = Math.max(highWaterMark.nextUnassignedPosition(), highestIssued.get() + 1);
    counter.advanceTo(floor);
    synchronizedFloor.accumulateAndGet(floor, Math::max);
    synced = true;
    LOG.debug("Counter synchronized to issue from position {}", floor);
  }

  private long issue() throws IOException {
    final long value = counter.increment();
    if (value == Long.MAX_VALUE) {
      throw new SequenceExhausted(value - 1);
    }
    return value - 1;
  }
}

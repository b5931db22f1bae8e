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

import eventlog.interfaces.store.ConcurrencyError;
import eventlog.interfaces.store.InvalidPosition;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

public class InMemoryPositionTracker implements PositionTracker {
  private final UUID trackerId = UUID.randomUUID();

  private final AtomicLong position;

  public InMemoryPositionTracker() {
    this(0);
  }

  public InMemoryPositionTracker(long initialPosition) {
    if (initialPosition < 0) {
      throw new InvalidPosition(initialPosition);
    }
    this.position = new AtomicLong(initialPosition);
  }

  @Override
  public long getPosition() {
    return position.get();
  }

  @Override
  public void recordPosition(long newPosition) throws ConcurrencyError {
    final long previous = position.getAndAccumulate(newPosition, Math::max);
    if (previous >= newPosition) {
      throw new ConcurrencyError(trackerId, newPosition - 1);
    }
  }
}

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

import java.util.concurrent.atomic.AtomicLong;

/**
 * AtomicCounter within the current process, for sequencers shared by threads rather than
 * processes, and for tests.
 */
public class InMemoryAtomicCounter implements AtomicCounter {
  private final AtomicLong value = new AtomicLong();

  @Override
  public long increment() {
    return value.incrementAndGet();
  }

  @Override
  public void advanceTo(long newValue) {
    value.accumulateAndGet(newValue, Math::max);
  }

  public long get() {
    return value.get();
  }
}

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

import eventlog.interfaces.sequence.IntegerSequencer;
import eventlog.interfaces.sequence.SequenceExhausted;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Sequencer for a single process. Safe for concurrent callers; its state lives only in memory,
 * so a new instance starts again from its initial value.
 */
public class LocalIntegerSequencer implements IntegerSequencer {
  private final AtomicLong nextPosition;

  public LocalIntegerSequencer() {
    this(0);
  }

  public LocalIntegerSequencer(long firstPosition) {
    if (firstPosition < 0) {
      throw new IllegalArgumentException("Negative first position: " + firstPosition);
    }
    this.nextPosition = new AtomicLong(firstPosition);
  }

  @Override
  public long next() {
    return nextPosition.getAndUpdate((position) -> {
      if (position == Long.MAX_VALUE) {
        throw new SequenceExhausted(position - 1);
      }
      return position + 1;
    });
  }
}

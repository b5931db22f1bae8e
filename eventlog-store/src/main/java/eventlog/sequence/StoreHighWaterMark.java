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

import eventlog.interfaces.sequence.HighWaterMark;
import eventlog.interfaces.store.SequencedItem;
import eventlog.interfaces.store.SequencedItemStore;

import java.io.IOException;
import java.util.UUID;

/**
 * The high-water mark of one sequence in a store: one past its highest position.
 */
public class StoreHighWaterMark implements HighWaterMark {
  private final SequencedItemStore store;
  private final UUID sequenceId;

  public StoreHighWaterMark(SequencedItemStore store, UUID sequenceId) {
    this.store = store;
    this.sequenceId = sequenceId;
  }

  @Override
  public long nextUnassignedPosition() throws IOException {
    final SequencedItem last = store.getLast(sequenceId);
    return last == null ? 0 : last.getPosition() + 1;
  }
}

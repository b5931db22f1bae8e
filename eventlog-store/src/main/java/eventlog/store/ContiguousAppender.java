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

import eventlog.interfaces.store.ConcurrencyError;
import eventlog.interfaces.store.ContiguousSequencedItemStore;
import eventlog.interfaces.store.SequenceAppender;

import java.io.IOException;
import java.util.UUID;

/**
 * Write path letting the store compute each position, for sequences that must never contain a
 * gap. Throughput to one sequence is bounded by the store's write latency.
 */
public class ContiguousAppender implements SequenceAppender {
  private final ContiguousSequencedItemStore store;
  private final UUID sequenceId;

  public ContiguousAppender(ContiguousSequencedItemStore store, UUID sequenceId) {
    this.store = store;
    this.sequenceId = sequenceId;
  }

  @Override
  public long append(String topic, byte[] data) throws ConcurrencyError, IOException {
    return store.insertAtNextPosition(sequenceId, topic, data);
  }
}

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

import eventlog.interfaces.sequence.IntegerSequencer;
import eventlog.interfaces.store.ConcurrencyError;
import eventlog.interfaces.store.SequenceAppender;
import eventlog.interfaces.store.SequencedItem;
import eventlog.interfaces.store.SequencedItemStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.UUID;

/**
 * Write path taking positions from a sequencer and writing them with a conditional insert.
 * Writers never wait on each other, but a writer that dies between obtaining a position and
 * writing it leaves a permanent gap.
 */
public class SequencerAppender implements SequenceAppender {
  private static final Logger LOG = LoggerFactory.getLogger(SequencerAppender.class);

  private final IntegerSequencer sequencer;
  private final SequencedItemStore store;
  private final UUID sequenceId;

  public SequencerAppender(IntegerSequencer sequencer, SequencedItemStore store, UUID sequenceId) {
    this.sequencer = sequencer;
    this.store = store;
    this.sequenceId = sequenceId;
  }

  @Override
  public long append(String topic, byte[] data) throws ConcurrencyError, IOException {
    final long position = sequencer.next();
    try {
      store.insert(new SequencedItem(sequenceId, position, topic, data));
      return position;
    } catch (ConcurrencyError e) {
      LOG.debug("Sequencer issued occupied position {} of {}", position, sequenceId);
      sequencer.resync();
      throw e;
    }
  }
}

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

package eventlog.interfaces.sequence;

import java.io.IOException;

/**
 * Issues positions: 0, 1, 2, ... Every number is issued at most once by a correctly operating
 * sequencer; a number that is issued but never written to storage leaves a permanent gap.
 */
public interface IntegerSequencer {

  /**
   * @throws SequenceExhausted if the sequence has no numbers left.
   */
  long next() throws IOException;

  /**
   * Called by writers that found a freshly issued position already occupied, which means the
   * sequencer has fallen behind the positions actually in use. Sequencers able to correct
   * themselves should do so here; the default does nothing.
   */
  default void resync() throws IOException {
  }
}

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

package eventlog.interfaces.store;

import java.util.UUID;

/**
 * Thrown when a conditional write finds its slot already occupied. Some other writer won the
 * slot; the caller may retry with a freshly obtained position, or propagate the error, but must
 * not drop the write silently.
 */
public class ConcurrencyError extends Exception {
  private final UUID sequenceId;
  private final long position;

  public ConcurrencyError(UUID sequenceId, long position) {
    super("Position " + position + " of sequence " + sequenceId + " is already occupied");
    this.sequenceId = sequenceId;
    this.position = position;
  }

  public UUID getSequenceId() {
    return sequenceId;
  }

  public long getPosition() {
    return position;
  }
}

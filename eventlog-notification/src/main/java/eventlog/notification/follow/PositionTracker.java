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

import java.io.IOException;

/**
 * Remembers how far a follower has processed an upstream log, so that processing can resume
 * there after a restart.
 */
public interface PositionTracker {
  /**
   * The position of the next notification to process; 0 if nothing has been processed.
   */
  long getPosition() throws IOException;

  /**
   * Record that every notification before the given position has been processed.
   *
   * @throws ConcurrencyError if the position has already been recorded, for instance by a second
   *                          follower processing the same log.
   */
  void recordPosition(long position) throws ConcurrencyError, IOException;
}

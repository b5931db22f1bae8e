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

import java.io.IOException;

/**
 * Appends data to a single sequence, choosing the position on the caller's behalf.
 */
public interface SequenceAppender {

  /**
   * @return the position the data was written at.
   * @throws ConcurrencyError if the chosen position was taken by another writer first; the
   *                          write did not happen and may be retried.
   */
  long append(String topic, byte[] data) throws ConcurrencyError, IOException;
}

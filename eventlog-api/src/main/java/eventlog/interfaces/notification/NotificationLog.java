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

package eventlog.interfaces.notification;

import java.io.IOException;
import java.util.OptionalInt;

/**
 * A log of notifications presented as linked, fixed-size sections, suitable for pull-based
 * replication. Implementations may be local views of storage, or clients of a remote log.
 */
public interface NotificationLog {

  /**
   * @param sectionId "first,last", or {@link SectionId#CURRENT}. Only the first id counts; the
   *                  section holding that notification is returned, under its own id.
   * @return the section. Sections beyond the end of the log are returned empty.
   * @throws eventlog.interfaces.store.InvalidPosition if the id is malformed, or its first id is
   *                                                   below 1.
   */
  NotificationSection getSection(String sectionId) throws IOException;

  /**
   * The size of this log's sections, if known without a request. Readers use it to go straight
   * to the section holding a position instead of walking back from the current section.
   */
  default OptionalInt getSectionSize() {
    return OptionalInt.empty();
  }
}

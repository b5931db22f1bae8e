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
 * A shared counter with an atomic increment, typically hosted by an external service. The first
 * increment of a fresh counter returns 1. After the hosting service loses state or fails over,
 * values may repeat; in steady state they never decrease.
 */
public interface AtomicCounter {
  long increment() throws IOException;

  /**
   * Raise the counter so that it is at least {@code value}. Never lowers it.
   */
  void advanceTo(long value) throws IOException;
}

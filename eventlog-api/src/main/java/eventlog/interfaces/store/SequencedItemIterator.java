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

import org.jetbrains.annotations.Nullable;

import java.io.IOException;

/**
 * An Iterator-like interface over the slots of a sequence. Iterator's methods cannot throw
 * checked exceptions, so this does not extend Iterator; the semantics are otherwise the same.
 * Iterators are restartable only by requesting a new one, and they are always finite.
 */
public interface SequencedItemIterator {
  boolean hasNext() throws IOException;

  /**
   * @return the item in the next slot, or null if that slot has never been assigned.
   */
  @Nullable
  SequencedItem next() throws IOException;
}

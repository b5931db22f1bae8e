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

package eventlog.notification;

/**
 * What a reader does on reaching a position that has no item.
 */
public enum GapPolicy {
  /**
   * Deliver a null in place of the missing notification and move past it.
   */
  SURFACE,

  /**
   * Move past the position without delivering anything for it.
   */
  SKIP,

  /**
   * Stop reading at the position, leaving the reader there, so the caller can wait for the
   * position to be filled and read again.
   */
  HALT
}

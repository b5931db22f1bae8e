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

import com.google.common.base.Splitter;
import com.google.common.math.LongMath;
import eventlog.interfaces.store.InvalidPosition;

import java.util.List;

/**
 * The inclusive, 1-based range of notification ids a section covers, written "first,last".
 * The literal {@link #CURRENT} names whichever section is being filled.
 */
public final class SectionId {
  public static final String CURRENT = "current";

  private static final Splitter COMMA = Splitter.on(',').trimResults();

  private final long first;
  private final long last;

  private SectionId(long first, long last) {
    this.first = first;
    this.last = last;
  }

  /**
   * The section whose first notification is the item at {@code startPosition}.
   */
  public static SectionId ofWindow(long startPosition, int size) {
    if (startPosition < 0) {
      throw new InvalidPosition(startPosition);
    }
    if (size < 1) {
      throw new IllegalArgumentException("Section size must be positive, got " + size);
    }
    return new SectionId(startPosition + 1, LongMath.saturatedAdd(startPosition, size));
  }

  /**
   * The fixed-size window containing {@code position}.
   */
  public static SectionId containing(long position, int size) {
    if (position < 0) {
      throw new InvalidPosition(position);
    }
    return ofWindow(position / size * size, size);
  }

  public static boolean isCurrent(String sectionId) {
    return CURRENT.equals(sectionId);
  }

  /**
   * @throws InvalidPosition if the string is not two positive integers "first,last" with
   *                         first &lt;= last.
   */
  public static SectionId parse(String sectionId) {
    List<String> parts = COMMA.splitToList(sectionId);
    if (parts.size() != 2) {
      throw new InvalidPosition("Malformed section id: '" + sectionId + "'");
    }

    long first;
    long last;
    try {
      first = Long.parseLong(parts.get(0));
      last = Long.parseLong(parts.get(1));
    } catch (NumberFormatException e) {
      throw new InvalidPosition("Malformed section id: '" + sectionId + "'");
    }

    if (first < 1 || last < first) {
      throw new InvalidPosition("Section id out of range: '" + sectionId + "'");
    }
    return new SectionId(first, last);
  }

  /**
   * The id of the first notification a requested section id names. Only the part before the
   * comma is significant: "6,10", "6,9" and "6," all name notification 6 onwards, and so does a
   * bare "6". A reader that does not know a log's section size asks for "n," to start at n.
   *
   * @throws InvalidPosition if the first part is not an integer of at least 1, or a last part is
   *                         given that is not an integer.
   */
  public static long parseFirst(String sectionId) {
    List<String> parts = COMMA.splitToList(sectionId);
    if (parts.size() > 2) {
      throw new InvalidPosition("Malformed section id: '" + sectionId + "'");
    }

    long first;
    try {
      first = Long.parseLong(parts.get(0));
      if (parts.size() == 2 && !parts.get(1).isEmpty()) {
        Long.parseLong(parts.get(1));
      }
    } catch (NumberFormatException e) {
      throw new InvalidPosition("Malformed section id: '" + sectionId + "'");
    }

    if (first < 1) {
      throw new InvalidPosition("Section id out of range: '" + sectionId + "'");
    }
    return first;
  }

  public long getFirst() {
    return first;
  }

  public long getLast() {
    return last;
  }

  /**
   * Position of the first item in this section.
   */
  public long startPosition() {
    return first - 1;
  }

  /**
   * One past the position of the last item in this section.
   */
  public long stopPosition() {
    return last;
  }

  public long size() {
    return last - first + 1;
  }

  public SectionId next() {
    return ofWindow(stopPosition(), (int) size());
  }

  public SectionId previous() {
    return ofWindow(startPosition() - size(), (int) size());
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }

    SectionId that = (SectionId) o;
    return first == that.first && last == that.last;
  }

  @Override
  public int hashCode() {
    return 31 * Long.hashCode(first) + Long.hashCode(last);
  }

  @Override
  public String toString() {
    return first + "," + last;
  }
}

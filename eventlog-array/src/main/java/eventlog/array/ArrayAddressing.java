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

package eventlog.array;

import com.google.common.math.LongMath;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * Position arithmetic of a BigArray. A node of height h covers array_size^h consecutive positions
 * starting at a multiple of that span; height 1 nodes are the partitions holding items. Every
 * node's identity is a name-based UUID of the array id and the range it covers, so any node can
 * be addressed without reading the tree.
 * <p>
 * Spans saturate at Long.MAX_VALUE, which is therefore the first position that cannot be used.
 */
final class ArrayAddressing {
  private final UUID arrayId;
  private final int arraySize;

  ArrayAddressing(UUID arrayId, int arraySize) {
    this.arrayId = arrayId;
    this.arraySize = arraySize;
  }

  long span(int height) {
    return LongMath.saturatedPow(arraySize, height);
  }

  long startOf(long position, int height) {
    final long span = span(height);
    return position / span * span;
  }

  UUID nodeId(long start, int height) {
    final long stop = LongMath.saturatedAdd(start, span(height));
    final String name = arrayId + "(" + start + ", " + stop + ")";
    return UUID.nameUUIDFromBytes(name.getBytes(StandardCharsets.UTF_8));
  }

  UUID partitionId(long position) {
    return nodeId(startOf(position, 1), 1);
  }

  long offset(long position) {
    return position % arraySize;
  }

  /**
   * The height of the smallest node starting at 0 that covers the position.
   */
  int requiredHeight(long position) {
    int height = 1;
    while (span(height) <= position) {
      height++;
    }
    return height;
  }

  /**
   * Slot of a child node within its parent.
   */
  long slotInParent(long childStart, int childHeight) {
    return (childStart - startOf(childStart, childHeight + 1)) / span(childHeight);
  }

  static byte[] toBytes(UUID id) {
    return ByteBuffer.allocate(16)
        .putLong(id.getMostSignificantBits())
        .putLong(id.getLeastSignificantBits())
        .array();
  }

  static UUID fromBytes(byte[] bytes) {
    if (bytes.length != 16) {
      throw new IllegalStateException("Index record of " + bytes.length + " bytes is not a node id");
    }
    final ByteBuffer buffer = ByteBuffer.wrap(bytes);
    return new UUID(buffer.getLong(), buffer.getLong());
  }
}

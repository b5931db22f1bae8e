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

import org.junit.Test;

import java.util.UUID;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;

public class ArrayAddressingTest {
  private final UUID arrayId = UUID.randomUUID();
  private final ArrayAddressing addressing = new ArrayAddressing(arrayId, 10);

  @Test
  public void positionsInTheSamePartitionShareAPartitionId() {
    assertThat(addressing.partitionId(20), is(equalTo(addressing.partitionId(29))));
    assertThat(addressing.partitionId(29), is(not(equalTo(addressing.partitionId(30)))));
    assertThat(addressing.offset(27), is(equalTo(7L)));
  }

  @Test
  public void identitiesDependOnlyOnTheArrayIdAndTheCoveredRange() {
    ArrayAddressing sameArray = new ArrayAddressing(arrayId, 10);
    ArrayAddressing otherArray = new ArrayAddressing(UUID.randomUUID(), 10);

    assertThat(sameArray.partitionId(12345), is(equalTo(addressing.partitionId(12345))));
    assertThat(otherArray.partitionId(12345), is(not(equalTo(addressing.partitionId(12345)))));
    assertThat(addressing.nodeId(0, 1), is(not(equalTo(addressing.nodeId(0, 2)))));
  }

  @Test
  public void theRequiredHeightIsThatOfTheSmallestNodeFromZeroCoveringThePosition() {
    assertThat(addressing.requiredHeight(0), is(equalTo(1)));
    assertThat(addressing.requiredHeight(9), is(equalTo(1)));
    assertThat(addressing.requiredHeight(10), is(equalTo(2)));
    assertThat(addressing.requiredHeight(99), is(equalTo(2)));
    assertThat(addressing.requiredHeight(100), is(equalTo(3)));
    assertThat(addressing.requiredHeight(Long.MAX_VALUE - 1), is(equalTo(19)));
  }

  @Test
  public void childrenOccupyTheSlotOfTheirOffsetWithinTheParent() {
    assertThat(addressing.slotInParent(40, 1), is(equalTo(4L)));
    assertThat(addressing.slotInParent(140, 1), is(equalTo(4L)));
    assertThat(addressing.slotInParent(300, 2), is(equalTo(3L)));
  }

  @Test
  public void nodeIdsSurviveTheRoundTripThroughTheirByteForm() {
    UUID id = addressing.nodeId(1000, 3);
    assertThat(ArrayAddressing.fromBytes(ArrayAddressing.toBytes(id)), is(equalTo(id)));
  }
}

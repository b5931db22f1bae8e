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

import com.google.common.collect.ImmutableList;
import org.jetbrains.annotations.NotNull;

import java.util.Arrays;
import java.util.Collection;
import java.util.Objects;

/**
 * A stored item as delivered to consumers of a notification log. Ids are 1-based: the item at
 * position p of the underlying sequence is notification p + 1.
 * <p>
 * A notification may name causal dependencies: notifications of other logs that a consumer
 * should have processed before this one. Most notifications have none.
 */
public final class Notification {
  private final long id;
  private final String topic;
  private final byte[] data;
  private final ImmutableList<CausalDependency> causalDependencies;

  public Notification(long id, @NotNull String topic, @NotNull byte[] data) {
    this(id, topic, data, ImmutableList.of());
  }

  public Notification(long id,
                      @NotNull String topic,
                      @NotNull byte[] data,
                      @NotNull Collection<CausalDependency> causalDependencies) {
    if (id < 1) {
      throw new IllegalArgumentException("Notification ids start at 1, got " + id);
    }
    this.id = id;
    this.topic = Objects.requireNonNull(topic, "topic");
    this.data = Objects.requireNonNull(data, "data").clone();
    this.causalDependencies = ImmutableList.copyOf(causalDependencies);
  }

  public static Notification atPosition(long position, String topic, byte[] data) {
    return new Notification(position + 1, topic, data);
  }

  public Notification withCausalDependencies(Collection<CausalDependency> dependencies) {
    return new Notification(id, topic, data, dependencies);
  }

  public long getId() {
    return id;
  }

  public long getPosition() {
    return id - 1;
  }

  @NotNull
  public String getTopic() {
    return topic;
  }

  @NotNull
  public byte[] getData() {
    return data.clone();
  }

  @NotNull
  public ImmutableList<CausalDependency> getCausalDependencies() {
    return causalDependencies;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }

    Notification that = (Notification) o;
    return id == that.id
        && topic.equals(that.topic)
        && Arrays.equals(data, that.data)
        && causalDependencies.equals(that.causalDependencies);
  }

  @Override
  public int hashCode() {
    int result = (int) (id ^ (id >>> 32));
    result = 31 * result + topic.hashCode();
    result = 31 * result + Arrays.hashCode(data);
    result = 31 * result + causalDependencies.hashCode();
    return result;
  }

  @Override
  public String toString() {
    return "Notification{" +
        "id=" + id +
        ", topic='" + topic + '\'' +
        (causalDependencies.isEmpty() ? "" : ", causalDependencies=" + causalDependencies) +
        '}';
  }
}

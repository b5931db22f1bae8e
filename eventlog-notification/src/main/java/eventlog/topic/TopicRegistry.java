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

package eventlog.topic;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import eventlog.interfaces.notification.Notification;

import java.io.IOException;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Maps topic strings to the decoders that understand them. Built once and immutable after.
 */
public final class TopicRegistry {
  private final ImmutableMap<String, TopicDecoder<?>> decoders;

  private TopicRegistry(Map<String, TopicDecoder<?>> decoders) {
    this.decoders = ImmutableMap.copyOf(decoders);
  }

  public static Builder builder() {
    return new Builder();
  }

  public Set<String> getTopics() {
    return decoders.keySet();
  }

  public boolean isRegistered(String topic) {
    return decoders.containsKey(topic);
  }

  /**
   * @throws UnregisteredTopic if the notification's topic has no decoder.
   */
  public Object decode(Notification notification) throws IOException {
    return decoderFor(notification.getTopic()).decode(notification.getData());
  }

  TopicDecoder<?> decoderFor(String topic) {
    final TopicDecoder<?> decoder = decoders.get(topic);
    if (decoder == null) {
      throw new UnregisteredTopic(topic);
    }
    return decoder;
  }

  public static class Builder {
    private final Map<String, TopicDecoder<?>> decoders = new LinkedHashMap<>();
    private final Set<String> required = Sets.newLinkedHashSet();

    public <T> Builder register(String topic, TopicDecoder<T> decoder) {
      if (decoders.putIfAbsent(topic, decoder) != null) {
        throw new IllegalArgumentException("Topic " + topic + " is already registered");
      }
      return this;
    }

    /**
     * Fail {@link #build()} unless every one of these topics has been registered.
     */
    public Builder requireTopics(String... topics) {
      return requireTopics(Arrays.asList(topics));
    }

    public Builder requireTopics(Collection<String> topics) {
      required.addAll(topics);
      return this;
    }

    /**
     * @throws UnregisteredTopic naming every required topic left without a decoder.
     */
    public TopicRegistry build() {
      final Set<String> missing = ImmutableSet.copyOf(Sets.difference(required, decoders.keySet()));
      if (!missing.isEmpty()) {
        throw new UnregisteredTopic(missing);
      }
      return new TopicRegistry(decoders);
    }
  }
}

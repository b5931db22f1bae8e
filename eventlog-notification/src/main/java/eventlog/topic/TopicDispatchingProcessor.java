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
import eventlog.interfaces.notification.Notification;
import eventlog.notification.follow.NotificationProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * Decodes each notification by its topic, and passes the result to the handler registered for
 * that topic. A topic with no handler fails processing with {@link UnregisteredTopic}, unless
 * unhandled topics were explicitly allowed to be ignored.
 */
public class TopicDispatchingProcessor implements NotificationProcessor {
  private static final Logger LOG = LoggerFactory.getLogger(TopicDispatchingProcessor.class);

  private final TopicRegistry registry;
  private final ImmutableMap<String, Dispatch<?>> dispatches;
  private final boolean ignoreUnhandledTopics;

  private TopicDispatchingProcessor(TopicRegistry registry,
                                    Map<String, Dispatch<?>> dispatches,
                                    boolean ignoreUnhandledTopics) {
    this.registry = registry;
    this.dispatches = ImmutableMap.copyOf(dispatches);
    this.ignoreUnhandledTopics = ignoreUnhandledTopics;
  }

  public static Builder builder() {
    return new Builder();
  }

  public TopicRegistry getRegistry() {
    return registry;
  }

  @Override
  public void process(Notification notification) throws Exception {
    final Dispatch<?> dispatch = dispatches.get(notification.getTopic());
    if (dispatch == null) {
      if (ignoreUnhandledTopics) {
        LOG.debug("Ignoring notification {} with unhandled topic {}", notification.getId(), notification.getTopic());
        return;
      }
      throw new UnregisteredTopic(notification.getTopic());
    }
    dispatch.run(notification);
  }

  private static class Dispatch<T> {
    private final TopicDecoder<T> decoder;
    private final TopicHandler<? super T> handler;

    Dispatch(TopicDecoder<T> decoder, TopicHandler<? super T> handler) {
      this.decoder = decoder;
      this.handler = handler;
    }

    void run(Notification notification) throws Exception {
      handler.handle(notification, decoder.decode(notification.getData()));
    }
  }

  public static class Builder {
    private final TopicRegistry.Builder registry = TopicRegistry.builder();
    private final Map<String, Dispatch<?>> dispatches = new HashMap<>();
    private boolean ignoreUnhandledTopics = false;

    public <T> Builder on(String topic, TopicDecoder<T> decoder, TopicHandler<? super T> handler) {
      registry.register(topic, decoder);
      dispatches.put(topic, new Dispatch<>(decoder, handler));
      return this;
    }

    public Builder requireTopics(String... topics) {
      registry.requireTopics(topics);
      return this;
    }

    public Builder ignoreUnhandledTopics() {
      this.ignoreUnhandledTopics = true;
      return this;
    }

    public TopicDispatchingProcessor build() {
      return new TopicDispatchingProcessor(registry.build(), dispatches, ignoreUnhandledTopics);
    }
  }
}

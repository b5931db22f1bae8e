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

package eventlog.codec;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import eventlog.interfaces.notification.CausalDependency;

import java.io.IOException;
import java.util.List;

/**
 * JSON shape of a notification section.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
class SectionDocument {
  private final String sectionId;
  private final String previousId;
  private final String nextId;
  private final List<NotificationDocument> items;

  @JsonCreator
  SectionDocument(@JsonProperty("section_id") String sectionId,
                  @JsonProperty("previous_id") String previousId,
                  @JsonProperty("next_id") String nextId,
                  @JsonProperty("items") List<NotificationDocument> items) {
    this.sectionId = sectionId;
    this.previousId = previousId;
    this.nextId = nextId;
    this.items = items == null ? ImmutableList.of() : items;
  }

  @JsonProperty("section_id")
  String getSectionId() {
    return sectionId;
  }

  @JsonProperty("previous_id")
  String getPreviousId() {
    return previousId;
  }

  @JsonProperty("next_id")
  String getNextId() {
    return nextId;
  }

  @JsonProperty("items")
  List<NotificationDocument> getItems() {
    return items;
  }

  /**
   * One notification; a document with an id but no topic marks a position without an item.
   */
  @JsonInclude(JsonInclude.Include.NON_EMPTY)
  static class NotificationDocument {
    private final long id;
    private final String topic;
    private final byte[] data;
    private final List<DependencyDocument> causalDependencies;

    NotificationDocument(long id, String topic, byte[] data) {
      this(id, topic, data, null);
    }

    @JsonCreator
    NotificationDocument(@JsonProperty("id") long id,
                         @JsonProperty("topic") String topic,
                         @JsonProperty("data") byte[] data,
                         @JsonProperty("causal_dependencies") List<DependencyDocument> causalDependencies) {
      this.id = id;
      this.topic = topic;
      this.data = data;
      this.causalDependencies = causalDependencies == null ? ImmutableList.of() : causalDependencies;
    }

    @JsonProperty("id")
    @JsonInclude(JsonInclude.Include.ALWAYS)
    long getId() {
      return id;
    }

    @JsonProperty("topic")
    String getTopic() {
      return topic;
    }

    @JsonProperty("data")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    byte[] getData() {
      return data;
    }

    @JsonProperty("causal_dependencies")
    List<DependencyDocument> getCausalDependencies() {
      return causalDependencies;
    }
  }

  static class DependencyDocument {
    private final String logName;
    private final long notificationId;

    @JsonCreator
    DependencyDocument(@JsonProperty("log_name") String logName,
                       @JsonProperty("notification_id") long notificationId) {
      this.logName = logName;
      this.notificationId = notificationId;
    }

    static DependencyDocument of(CausalDependency dependency) {
      return new DependencyDocument(dependency.getLogName(), dependency.getNotificationId());
    }

    @JsonProperty("log_name")
    String getLogName() {
      return logName;
    }

    @JsonProperty("notification_id")
    long getNotificationId() {
      return notificationId;
    }

    CausalDependency toDependency() throws IOException {
      if (logName == null || notificationId < 1) {
        throw new IOException("Malformed causal dependency: " + logName + "#" + notificationId);
      }
      return new CausalDependency(logName, notificationId);
    }
  }
}

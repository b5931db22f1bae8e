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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.Lists;
import eventlog.interfaces.notification.CausalDependency;
import eventlog.interfaces.notification.Notification;
import eventlog.interfaces.notification.NotificationSection;
import eventlog.interfaces.notification.SectionId;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static eventlog.codec.SectionDocument.DependencyDocument;
import static eventlog.codec.SectionDocument.NotificationDocument;

/**
 * Encodes notification sections as self-describing JSON documents:
 * <pre>
 * {"section_id": "1,5", "next_id": "6,10",
 *  "items": [{"id": 1, "topic": "...", "data": "base64"}, {"id": 2}, ...]}
 * </pre>
 * Absent previous or next ids are left out. Data passes through as opaque bytes. A notification
 * with causal dependencies lists them as
 * {@code "causal_dependencies": [{"log_name": "orders", "notification_id": 12}]}.
 */
public class SectionCodec {
  private static final ObjectMapper MAPPER = new ObjectMapper()
      .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
  private static final TypeReference<List<DependencyDocument>> DEPENDENCY_LIST =
      new TypeReference<List<DependencyDocument>>() {
      };

  public static byte[] encode(NotificationSection section) {
    final List<NotificationDocument> items = new ArrayList<>(section.getItems().size());
    final long firstId = SectionId.parse(section.getSectionId()).getFirst();

    for (int i = 0; i < section.getItems().size(); i++) {
      final Notification notification = section.getItems().get(i);
      items.add(notification == null
          ? new NotificationDocument(firstId + i, null, null)
          : new NotificationDocument(notification.getId(), notification.getTopic(), notification.getData(),
              Lists.transform(notification.getCausalDependencies(), DependencyDocument::of)));
    }

    try {
      return MAPPER.writeValueAsBytes(
          new SectionDocument(section.getSectionId(), section.getPreviousId(), section.getNextId(), items));
    } catch (JsonProcessingException e) {
      // Only in-memory values are written here.
      throw new IllegalStateException(e);
    }
  }

  /**
   * @throws IOException if the bytes are not a section document.
   */
  public static NotificationSection decode(byte[] json) throws IOException {
    final SectionDocument document = MAPPER.readValue(json, SectionDocument.class);
    if (document.getSectionId() == null) {
      throw new IOException("Section document has no section_id");
    }

    final List<Notification> items = new ArrayList<>(document.getItems().size());
    for (NotificationDocument item : document.getItems()) {
      items.add(item.getTopic() == null ? null : toNotification(item));
    }
    return new NotificationSection(document.getSectionId(), document.getPreviousId(), document.getNextId(), items);
  }

  /**
   * Stored form of the dependencies of one notification: a JSON array of dependency objects.
   */
  public static byte[] encodeDependencies(List<CausalDependency> dependencies) {
    try {
      return MAPPER.writeValueAsBytes(Lists.transform(dependencies, DependencyDocument::of));
    } catch (JsonProcessingException e) {
      throw new IllegalStateException(e);
    }
  }

  public static List<CausalDependency> decodeDependencies(byte[] json) throws IOException {
    final List<DependencyDocument> documents = MAPPER.readValue(json, DEPENDENCY_LIST);
    return toDependencies(documents);
  }

  private static Notification toNotification(NotificationDocument item) throws IOException {
    return new Notification(item.getId(), item.getTopic(), item.getData() == null ? new byte[0] : item.getData(),
        toDependencies(item.getCausalDependencies()));
  }

  private static List<CausalDependency> toDependencies(List<DependencyDocument> documents) throws IOException {
    final List<CausalDependency> dependencies = new ArrayList<>(documents.size());
    for (DependencyDocument document : documents) {
      dependencies.add(document.toDependency());
    }
    return dependencies;
  }
}

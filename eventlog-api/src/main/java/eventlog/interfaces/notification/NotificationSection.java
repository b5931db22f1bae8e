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

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A page of a notification log. Sections are views computed from storage on every request;
 * a section with a next id is archived and will never change again, the one without is still
 * being filled.
 * <p>
 * Items may contain nulls: each null stands for a position below the log's high-water mark
 * that has no item, and is left for the reader to deal with.
 */
public final class NotificationSection {
  private final String sectionId;
  private final String previousId;
  private final String nextId;
  private final List<Notification> items;

  public NotificationSection(@NotNull String sectionId,
                             @Nullable String previousId,
                             @Nullable String nextId,
                             @NotNull List<Notification> items) {
    this.sectionId = Objects.requireNonNull(sectionId, "sectionId");
    this.previousId = previousId;
    this.nextId = nextId;
    // ImmutableList would reject the gap placeholders.
    this.items = Collections.unmodifiableList(new ArrayList<>(items));
  }

  @NotNull
  public String getSectionId() {
    return sectionId;
  }

  @Nullable
  public String getPreviousId() {
    return previousId;
  }

  @Nullable
  public String getNextId() {
    return nextId;
  }

  @NotNull
  public List<Notification> getItems() {
    return items;
  }

  public boolean isArchived() {
    return nextId != null;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }

    NotificationSection that = (NotificationSection) o;
    return sectionId.equals(that.sectionId)
        && Objects.equals(previousId, that.previousId)
        && Objects.equals(nextId, that.nextId)
        && items.equals(that.items);
  }

  @Override
  public int hashCode() {
    return Objects.hash(sectionId, previousId, nextId, items);
  }

  @Override
  public String toString() {
    return "NotificationSection{" +
        "sectionId='" + sectionId + '\'' +
        ", previousId='" + previousId + '\'' +
        ", nextId='" + nextId + '\'' +
        ", items.size=" + items.size() +
        '}';
  }
}

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

import java.util.Objects;

/**
 * Names a notification, in some log, that must be processed before the notification carrying
 * this dependency.
 */
public final class CausalDependency {
  private final String logName;
  private final long notificationId;

  public CausalDependency(@NotNull String logName, long notificationId) {
    if (notificationId < 1) {
      throw new IllegalArgumentException("Notification ids start at 1, got " + notificationId);
    }
    this.logName = Objects.requireNonNull(logName, "logName");
    this.notificationId = notificationId;
  }

  @NotNull
  public String getLogName() {
    return logName;
  }

  public long getNotificationId() {
    return notificationId;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }

    CausalDependency that = (CausalDependency) o;
    return notificationId == that.notificationId && logName.equals(that.logName);
  }

  @Override
  public int hashCode() {
    return 31 * logName.hashCode() + (int) (notificationId ^ (notificationId >>> 32));
  }

  @Override
  public String toString() {
    return logName + "#" + notificationId;
  }
}

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
package eventlog.notification.follow;

import com.google.common.collect.ImmutableMap;
import eventlog.interfaces.notification.CausalDependency;

import java.io.IOException;
import java.util.Map;

/**
 * Decides whether the causal dependencies of a notification have been met, so that a follower
 * can hold the notification back until they are.
 */
@FunctionalInterface
public interface CausalDependencyCheck {
  CausalDependencyCheck NONE = dependency -> true;

  boolean isSatisfied(CausalDependency dependency) throws IOException;

  /**
   * A dependency on a log is met once the tracker of that log has moved past the named
   * notification. Dependencies on logs with no tracker here are taken as met.
   */
  static CausalDependencyCheck trackedBy(Map<String, ? extends PositionTracker> trackersByLogName) {
    final Map<String, PositionTracker> trackers = ImmutableMap.copyOf(trackersByLogName);
    return dependency -> {
      final PositionTracker tracker = trackers.get(dependency.getLogName());
      return tracker == null || tracker.getPosition() >= dependency.getNotificationId();
    };
  }
}

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

import eventlog.interfaces.notification.Notification;

/**
 * Downstream processing of notifications received by a {@link NotificationFollower}, one at a
 * time and in log order. Throwing stops the follower without recording the notification.
 */
@FunctionalInterface
public interface NotificationProcessor {
  void process(Notification notification) throws Exception;
}

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

package eventlog;

/**
 * Defaults for serving, fetching and following notification logs.
 */
public class NotificationConstants {
  public static final String HTTP_PATH_PREFIX = "/notifications";
  public static final int HTTP_MAX_CONTENT_LENGTH = 16 * 1024 * 1024;
  public static final int HTTP_SO_BACKLOG = 100;

  public static final String ARCHIVED_CACHE_CONTROL = "public, max-age=31536000, immutable";
  public static final String CURRENT_CACHE_CONTROL = "no-cache";

  public static final int SECTION_READER_THREADS = 4;

  public static final long REMOTE_REQUEST_TIMEOUT_MILLIS = 10000;
  public static final long REMOTE_CACHE_MAX_SECTIONS = 10000;

  public static final long FOLLOWER_POLL_INTERVAL_MILLIS = 1000;
  public static final int FOLLOWER_BATCH_SIZE = 500;

  public static final String CAUSAL_DEPENDENCIES_TOPIC = "eventlog.causal-dependencies";
}

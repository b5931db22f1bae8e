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
 * Defaults shared by the event log modules. Everything here can be overridden by a constructor
 * parameter of the component that uses it.
 */
public class EventLogConstants {
  public static final int DEFAULT_ARRAY_SIZE = 10000;
  public static final int DEFAULT_SECTION_SIZE = 20;

  // Conditional-write retry policy used by appenders.
  public static final int APPEND_RETRY_MAX_ATTEMPTS = 50;
  public static final long APPEND_RETRY_WAIT_MILLIS = 10;

  public static final String JOURNAL_FILE_NAME = "items.journal";
  public static final int JOURNAL_MAX_RECORD_LENGTH = 64 * 1024 * 1024;

  public static final String ARRAY_LINK_TOPIC = "eventlog.array.link";
  public static final String ARRAY_APEX_TOPIC = "eventlog.array.apex";
  public static final String TRACKING_RECORD_TOPIC = "eventlog.tracking";
}

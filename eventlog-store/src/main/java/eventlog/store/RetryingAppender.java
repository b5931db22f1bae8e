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

package eventlog.store;

import eventlog.EventLogConstants;
import eventlog.interfaces.store.ConcurrencyError;
import eventlog.interfaces.store.SequenceAppender;
import eventlog.util.ConcurrencyRetrier;

import java.io.IOException;

/**
 * Repeats appends that lose their position to another writer. Each repetition goes back to the
 * wrapped appender, which chooses a new position.
 */
public class RetryingAppender implements SequenceAppender {
  private final SequenceAppender delegate;
  private final ConcurrencyRetrier retrier;

  public RetryingAppender(SequenceAppender delegate) {
    this(delegate, new ConcurrencyRetrier(
        EventLogConstants.APPEND_RETRY_MAX_ATTEMPTS,
        EventLogConstants.APPEND_RETRY_WAIT_MILLIS));
  }

  public RetryingAppender(SequenceAppender delegate, ConcurrencyRetrier retrier) {
    this.delegate = delegate;
    this.retrier = retrier;
  }

  @Override
  public long append(String topic, byte[] data) throws ConcurrencyError, IOException {
    return retrier.call(() -> delegate.append(topic, data));
  }
}

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

package eventlog.util;

import eventlog.interfaces.store.ConcurrencyError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.concurrent.TimeUnit;

/**
 * Repeats an operation that lost a conditional write, a bounded number of times. Each attempt
 * must derive its position afresh; repeating a write to the same occupied slot can never succeed.
 * When attempts run out, the last ConcurrencyError is thrown to the caller. Any other exception
 * ends the retries immediately.
 */
public class ConcurrencyRetrier {
  private static final Logger LOG = LoggerFactory.getLogger(ConcurrencyRetrier.class);

  private final int maxAttempts;
  private final long waitMillis;

  public ConcurrencyRetrier(int maxAttempts, long waitMillis) {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("At least one attempt is required");
    }
    if (waitMillis < 0) {
      throw new IllegalArgumentException("Negative wait: " + waitMillis);
    }
    this.maxAttempts = maxAttempts;
    this.waitMillis = waitMillis;
  }

  public <T> T call(Attempt<T> attempt) throws ConcurrencyError, IOException {
    ConcurrencyError lastError = null;

    for (int attemptNumber = 1; attemptNumber <= maxAttempts; attemptNumber++) {
      try {
        return attempt.run();
      } catch (ConcurrencyError e) {
        lastError = e;
        LOG.debug("Attempt {} of {} lost position {} of {}",
            attemptNumber, maxAttempts, e.getPosition(), e.getSequenceId());
        if (attemptNumber < maxAttempts) {
          pause();
        }
      }
    }

    throw lastError;
  }

  public int getMaxAttempts() {
    return maxAttempts;
  }

  private void pause() throws IOException {
    if (waitMillis == 0) {
      return;
    }
    try {
      TimeUnit.MILLISECONDS.sleep(waitMillis);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new InterruptedIOException("Interrupted while waiting to retry a conflicting write");
    }
  }

  /**
   * One attempt at a write that may lose a conditional insert.
   */
  @FunctionalInterface
  public interface Attempt<T> {
    T run() throws ConcurrencyError, IOException;
  }
}

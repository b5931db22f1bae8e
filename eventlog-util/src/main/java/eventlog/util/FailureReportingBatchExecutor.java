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

import org.jetlang.core.BatchExecutor;
import org.jetlang.core.EventReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Consumer;

/**
 * Runs a fiber's batch of tasks, reporting each task failure to the fiber's owner rather than
 * letting it end the fiber's thread. The rest of the batch still runs after a failure, except
 * after a VirtualMachineError, which is reported and then rethrown.
 * <p>
 * The handler runs on the fiber's thread, so a service can fail itself before its next task.
 */
public class FailureReportingBatchExecutor implements BatchExecutor {
  private static final Logger LOG = LoggerFactory.getLogger(FailureReportingBatchExecutor.class);

  private final String fiberName;
  private final Consumer<Throwable> failureHandler;

  private long failureCount = 0;

  public FailureReportingBatchExecutor(String fiberName, Consumer<Throwable> failureHandler) {
    this.fiberName = fiberName;
    this.failureHandler = failureHandler;
  }

  @Override
  public void execute(EventReader tasks) {
    final int batchSize = tasks.size();
    for (int i = 0; i < batchSize; i++) {
      final Runnable task = tasks.get(i);
      try {
        task.run();
      } catch (VirtualMachineError fatal) {
        report(fatal, i, batchSize);
        throw fatal;
      } catch (Throwable failure) {
        report(failure, i, batchSize);
      }
    }
  }

  /**
   * Failures reported so far. Only meaningful when read from the fiber's own thread.
   */
  public long getFailureCount() {
    return failureCount;
  }

  private void report(Throwable failure, int taskIndex, int batchSize) {
    failureCount++;
    LOG.debug("Task {} of {} on fiber {} failed", taskIndex + 1, batchSize, fiberName, failure);
    try {
      failureHandler.accept(failure);
    } catch (RuntimeException handlerFailure) {
      handlerFailure.addSuppressed(failure);
      LOG.error("Failure handler of fiber {} threw while handling a task failure", fiberName, handlerFailure);
    }
  }
}

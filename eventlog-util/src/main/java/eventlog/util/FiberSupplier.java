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

import org.jetlang.core.RunnableExecutorImpl;
import org.jetlang.fibers.Fiber;
import org.jetlang.fibers.ThreadFiber;

import java.util.function.Consumer;

/**
 * Creates fibers for services, each with its own handler for exceptions thrown by its tasks.
 * Tests substitute suppliers that run on a shared or synchronous fiber.
 */
@FunctionalInterface
public interface FiberSupplier {
  Fiber getNewFiber(Consumer<Throwable> throwableHandler);

  /**
   * Each fiber gets a daemon thread of its own, named after the given prefix.
   */
  static FiberSupplier threadFibers(String namePrefix) {
    return (throwableHandler) ->
        new ThreadFiber(
            new RunnableExecutorImpl(new FailureReportingBatchExecutor(namePrefix, throwableHandler)),
            namePrefix,
            true);
  }
}

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

import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Runs test tasks on many threads at once.
 */
public class ConcurrencyTestUtil {
  private static final int TIMEOUT_SECONDS = 30;

  /**
   * Run a concurrency test repeatedly against one thread pool, so that races which only show up
   * occasionally get several chances to.
   */
  public static void runAConcurrencyTestSeveralTimes(int numThreads, int numAttempts, ConcurrencyTest test)
      throws Exception {
    final ExecutorService executor = Executors.newFixedThreadPool(numThreads);

    try {
      for (int attempt = 0; attempt < numAttempts; attempt++) {
        test.run(numThreads, executor);
      }
    } finally {
      executor.shutdown();
      executor.awaitTermination(TIMEOUT_SECONDS, TimeUnit.SECONDS);
    }
  }

  /**
   * Submit nTimes invocations of the task, all released at the same moment, and wait for every
   * one of them to finish. The results are returned in invocation-index order; if any invocation
   * threw, this throws.
   */
  public static <T> List<T> runNTimesAndWaitForAllToComplete(int nTimes, ExecutorService executor,
                                                             IndexedTask<T> task) throws Exception {
    final ListeningExecutorService listeningExecutor = MoreExecutors.listeningDecorator(executor);
    final CountDownLatch startingGun = new CountDownLatch(1);
    final List<ListenableFuture<T>> futures = new ArrayList<>(nTimes);

    for (int i = 0; i < nTimes; i++) {
      final int invocationIndex = i;
      futures.add(listeningExecutor.submit(() -> {
        startingGun.await();
        return task.run(invocationIndex);
      }));
    }

    startingGun.countDown();
    return Futures.allAsList(futures).get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
  }

  public interface ConcurrencyTest {
    void run(int degreeOfConcurrency, ExecutorService executorService) throws Exception;
  }

  public interface IndexedTask<T> {
    T run(int indexIdentifyingThisInvocation) throws Exception;
  }
}

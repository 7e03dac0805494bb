// Copyright (c) 2007-2023 Broadcom. All Rights Reserved.
// The term "Broadcom" refers to Broadcom Inc. and/or its subsidiaries.
//
// This software, the RabbitMQ Java client library, is triple-licensed under the
// Mozilla Public License 2.0 ("MPL"), the GNU General Public License version 2
// ("GPL") and the Apache License version 2 ("ASL"). For the MPL, please see
// LICENSE-MPL-RabbitMQ. For the GPL, please see LICENSE-GPL2.  For the ASL,
// please see LICENSE-APACHE2.
//
// This software is distributed on an "AS IS" basis, WITHOUT WARRANTY OF ANY KIND,
// either express or implied. See the LICENSE file for specific language governing
// rights and limitations of this software.
//
// If you have any questions regarding licensing, please contact us at
// info@rabbitmq.com.
package com.sqsbench.perf;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Map;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for pools of concurrent workers. A pool runs its workers either to completion (each
 * worker stops by itself) or until a deadline (workers are told to stop and abandoned).
 */
abstract class WorkerPool {

  static final String STOP_REASON_REACHED_TIME_LIMIT = "Reached time limit";

  private static final Logger LOGGER = LoggerFactory.getLogger(WorkerPool.class);

  private final String workerType;
  private final ConcurrentMap<String, Integer> reasons;

  WorkerPool(String workerType, ConcurrentMap<String, Integer> reasons) {
    this.workerType = workerType;
    this.reasons = reasons;
  }

  /**
   * Start the workers and wait for all of them to stop.
   *
   * @param workers number of workers
   * @param factory
   * @throws InterruptedException
   * @throws PerfTestException if a worker failed fatally
   */
  void runToCompletion(int workers, AgentFactory factory) throws InterruptedException {
    StopSignal stopSignal = new StopSignal();
    CompletionHandler completionHandler =
        new DefaultCompletionHandler(Duration.ZERO, workers, reasons);
    ThreadingHandler threadingHandler = new DefaultThreadingHandler("sqs-perf-test-");
    try {
      start(workers, factory, stopSignal, completionHandler, threadingHandler);
      completionHandler.waitForCompletion();
    } finally {
      stopSignal.stop();
      threadingHandler.shutdown();
    }
    throwIfFailed(stopSignal);
  }

  /**
   * Start the workers, wait for the time limit, then stop them without waiting for their
   * in-flight operations.
   *
   * @param timeLimit
   * @param workers number of workers
   * @param factory
   * @throws InterruptedException
   * @throws PerfTestException if a worker failed fatally
   */
  void runUntil(Duration timeLimit, int workers, AgentFactory factory)
      throws InterruptedException {
    StopSignal stopSignal = new StopSignal();
    CompletionHandler completionHandler = new DefaultCompletionHandler(timeLimit, workers, reasons);
    ThreadingHandler threadingHandler = new DefaultThreadingHandler("sqs-perf-test-");
    try {
      start(workers, factory, stopSignal, completionHandler, threadingHandler);
      completionHandler.waitForCompletion();
    } finally {
      stopSignal.stop();
      threadingHandler.shutdownNow();
    }
    throwIfFailed(stopSignal);
  }

  private void start(
      int workers,
      AgentFactory factory,
      StopSignal stopSignal,
      CompletionHandler completionHandler,
      ThreadingHandler threadingHandler) {
    ExecutorService executorService =
        threadingHandler.executorService(workerType + "-", workers);
    LOGGER.debug("Starting {} {}(s)", workers, workerType);
    for (int i = 0; i < workers; i++) {
      executorService.submit(factory.create(i, stopSignal, completionHandler));
    }
  }

  private static void throwIfFailed(StopSignal stopSignal) {
    PerfTestException failure = stopSignal.failure();
    if (failure != null) {
      throw failure;
    }
  }

  private static void recordReason(Map<String, Integer> reasons, String reason) {
    reasons.compute(reason, (keyReason, count) -> count == null ? 1 : ++count);
  }

  @FunctionalInterface
  interface AgentFactory {

    AgentBase create(int id, StopSignal stopSignal, CompletionHandler completionHandler);
  }

  interface ThreadingHandler {

    ExecutorService executorService(String name, int nbThreads);

    /** Interrupt the workers and wait for them to terminate. */
    void shutdown();

    /** Interrupt the workers and return immediately. */
    void shutdownNow();
  }

  interface CompletionHandler {

    void waitForCompletion() throws InterruptedException;

    void countDown(String reason);
  }

  static class DefaultThreadingHandler implements ThreadingHandler {

    private final Collection<ExecutorService> executorServices = new ArrayList<>();
    private final AtomicBoolean closing = new AtomicBoolean(false);
    private final String prefix;

    DefaultThreadingHandler(String prefix) {
      this.prefix = prefix;
    }

    @Override
    public ExecutorService executorService(String name, int nbThreads) {
      ExecutorService executorService =
          Executors.newFixedThreadPool(
              Math.max(1, nbThreads), new NamedThreadFactory(prefix + name));
      this.executorServices.add(executorService);
      return executorService;
    }

    @Override
    public void shutdown() {
      if (closing.compareAndSet(false, true)) {
        for (ExecutorService executorService : executorServices) {
          executorService.shutdownNow();
          try {
            boolean terminated = executorService.awaitTermination(10, TimeUnit.SECONDS);
            if (!terminated) {
              LOGGER.warn("Some workers didn't finish");
            }
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PerfTestException("Interrupted while waiting for workers to finish", e);
          }
        }
      }
    }

    @Override
    public void shutdownNow() {
      if (closing.compareAndSet(false, true)) {
        for (ExecutorService executorService : executorServices) {
          executorService.shutdownNow();
        }
      }
    }
  }

  static class DefaultCompletionHandler implements CompletionHandler {

    private final Duration timeLimit;
    private final CountDownLatch latch;
    private final ConcurrentMap<String, Integer> reasons;
    private final AtomicBoolean completed = new AtomicBoolean(false);

    /**
     * @param timeLimit zero or negative to wait without limit
     * @param countLimit the number of workers to wait for
     * @param reasons
     */
    DefaultCompletionHandler(
        Duration timeLimit, int countLimit, ConcurrentMap<String, Integer> reasons) {
      this.timeLimit = timeLimit;
      this.latch = new CountDownLatch(countLimit <= 0 ? 1 : countLimit);
      this.reasons = reasons;
    }

    @Override
    public void waitForCompletion() throws InterruptedException {
      if (timeLimit.isZero() || timeLimit.isNegative()) {
        this.latch.await();
        completed.set(true);
      } else {
        boolean countedDown = this.latch.await(timeLimit.toMillis(), TimeUnit.MILLISECONDS);
        completed.set(true);
        LOGGER.debug("Completed, counted down? {}", countedDown);
        if (!countedDown) {
          recordReason(reasons, STOP_REASON_REACHED_TIME_LIMIT);
        }
      }
    }

    @Override
    public void countDown(String reason) {
      LOGGER.debug("Counting down ({})", reason);
      if (!completed.get()) {
        recordReason(reasons, reason);
        latch.countDown();
      }
    }
  }
}

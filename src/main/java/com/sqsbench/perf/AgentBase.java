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

import com.sqsbench.perf.WorkerPool.CompletionHandler;
import com.sqsbench.perf.gateway.QueueGateway;
import com.sqsbench.perf.metrics.PerformanceMetrics;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for producers and consumers. A worker loops until it reaches its own stop condition
 * or until the stop signal of its pool fires, then reports why it stopped to the completion
 * handler, exactly once.
 */
abstract class AgentBase implements Runnable {

  static final String STOP_REASON_STOPPED = "Stopped by the pool";
  static final String STOP_REASON_THREAD_INTERRUPTED = "Thread interrupted";

  private static final Logger LOGGER = LoggerFactory.getLogger(AgentBase.class);

  final int id;
  final QueueGateway gateway;
  final String queue;
  final StopSignal stopSignal;
  final PerformanceMetrics performanceMetrics;
  private final CompletionHandler completionHandler;
  private final AtomicBoolean completed = new AtomicBoolean(false);

  protected AgentBase(
      int id,
      QueueGateway gateway,
      String queue,
      StopSignal stopSignal,
      CompletionHandler completionHandler,
      PerformanceMetrics performanceMetrics) {
    this.id = id;
    this.gateway = gateway;
    this.queue = queue;
    this.stopSignal = stopSignal;
    this.completionHandler = completionHandler;
    this.performanceMetrics =
        performanceMetrics == null ? PerformanceMetrics.NO_OP : performanceMetrics;
  }

  @Override
  public void run() {
    LOGGER.debug("Starting {} {}", type(), id);
    String reason;
    try {
      reason = doRun();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      reason = STOP_REASON_THREAD_INTERRUPTED;
    } catch (PerfTestException e) {
      LOGGER.error("Fatal error in {} {}", type(), id, e);
      stopSignal.fail(e);
      reason = e.getMessage();
    } catch (RuntimeException e) {
      if (stopSignal.isStopped()) {
        // abandoned at the deadline, the in-flight operation was interrupted
        LOGGER.debug("Error in {} {} after stop", type(), id, e);
        reason = STOP_REASON_THREAD_INTERRUPTED;
      } else {
        LOGGER.error("Unexpected error in {} {}", type(), id, e);
        stopSignal.fail(new PerfTestException("Error in " + type() + " " + id, e));
        reason = "Error in " + type() + " (" + e.getMessage() + ")";
      }
    }
    LOGGER.debug("{} {} stopped: {}", type(), id, reason);
    countDown(reason);
  }

  /**
   * The loop of the worker.
   *
   * @return the reason the worker stopped
   * @throws InterruptedException
   */
  protected abstract String doRun() throws InterruptedException;

  protected abstract String type();

  protected boolean keepGoing() {
    return !stopSignal.isStopped() && !Thread.currentThread().isInterrupted();
  }

  /** Sleep, if the duration is positive. */
  protected void pause(Duration duration) throws InterruptedException {
    if (duration != null && !duration.isZero() && !duration.isNegative()) {
      Thread.sleep(duration.toMillis());
    }
  }

  private void countDown(String reason) {
    if (completed.compareAndSet(false, true)) {
      completionHandler.countDown(reason);
    }
  }
}

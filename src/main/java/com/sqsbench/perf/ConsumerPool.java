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

import com.sqsbench.perf.gateway.QueueGateway;
import com.sqsbench.perf.metrics.LatencyAggregator;
import com.sqsbench.perf.metrics.PerformanceMetrics;
import java.time.Duration;
import java.util.concurrent.ConcurrentMap;

/** Dequeues messages from concurrent consumers and aggregates their latencies. */
public class ConsumerPool extends WorkerPool {

  private final QueueGateway gateway;
  private final String queue;
  private final MessageTagger tagger;
  private final PerformanceMetrics performanceMetrics;
  private int visibilityTimeoutInSeconds = 1;
  private int batchSize = QueueGateway.MAX_BATCH_SIZE;
  private Duration emptyReceiveBackoff = Duration.ZERO;

  public ConsumerPool(
      QueueGateway gateway,
      String queue,
      MessageTagger tagger,
      PerformanceMetrics performanceMetrics,
      ConcurrentMap<String, Integer> reasons) {
    super("consumer", reasons);
    this.gateway = gateway;
    this.queue = queue;
    this.tagger = tagger;
    this.performanceMetrics = performanceMetrics;
  }

  public ConsumerPool visibilityTimeoutInSeconds(int visibilityTimeoutInSeconds) {
    this.visibilityTimeoutInSeconds = visibilityTimeoutInSeconds;
    return this;
  }

  public ConsumerPool batchSize(int batchSize) {
    if (batchSize <= 0 || batchSize > QueueGateway.MAX_BATCH_SIZE) {
      throw new IllegalArgumentException(
          "Batch size must be between 1 and " + QueueGateway.MAX_BATCH_SIZE);
    }
    this.batchSize = batchSize;
    return this;
  }

  public ConsumerPool emptyReceiveBackoff(Duration emptyReceiveBackoff) {
    this.emptyReceiveBackoff = emptyReceiveBackoff;
    return this;
  }

  /**
   * Receive messages one at a time until <code>count</code> samples are recorded.
   *
   * @param count
   * @param workers
   * @return the latencies
   * @throws InterruptedException
   */
  public LatencyAggregator dequeue(long count, int workers) throws InterruptedException {
    LatencyAggregator aggregator = new LatencyAggregator(false);
    ConsumerParameters parameters = parameters(aggregator).setMessageLimit(count);
    runToCompletion(
        workers,
        (id, stopSignal, completionHandler) ->
            new Consumer(id, stopSignal, completionHandler, parameters));
    return aggregator;
  }

  /**
   * Receive messages in batches until <code>count</code> samples are recorded. A failed batch
   * delete stops the pool.
   *
   * @param count
   * @param workers
   * @return the latencies, samples retained
   * @throws InterruptedException
   * @throws PerfTestException if a batch delete call failed
   */
  public LatencyAggregator dequeueBatches(long count, int workers) throws InterruptedException {
    LatencyAggregator aggregator = new LatencyAggregator(true);
    ConsumerParameters parameters =
        parameters(aggregator).setMessageLimit(count).setFailOnAcknowledgeError(true);
    runToCompletion(
        workers,
        (id, stopSignal, completionHandler) ->
            new BatchConsumer(id, stopSignal, completionHandler, parameters));
    return aggregator;
  }

  /**
   * Receive messages in batches until the time limit. A failed batch delete is logged and
   * consumers carry on. Consumers are not waited for at the deadline, the returned aggregator can
   * still receive samples from consumers finishing their in-flight batch.
   *
   * @param timeLimit
   * @param workers
   * @return the latencies, samples retained
   * @throws InterruptedException
   */
  public LatencyAggregator dequeueBatchesUntil(Duration timeLimit, int workers)
      throws InterruptedException {
    LatencyAggregator aggregator = new LatencyAggregator(true);
    ConsumerParameters parameters =
        parameters(aggregator).setMessageLimit(0).setFailOnAcknowledgeError(false);
    runUntil(
        timeLimit,
        workers,
        (id, stopSignal, completionHandler) ->
            new BatchConsumer(id, stopSignal, completionHandler, parameters));
    return aggregator;
  }

  /**
   * Send a message and receive one, <code>count</code> times, from a single worker.
   *
   * @param count
   * @param messageBodySource
   * @return the latencies
   * @throws InterruptedException
   */
  public LatencyAggregator roundTrip(long count, MessageBodySource messageBodySource)
      throws InterruptedException {
    LatencyAggregator aggregator = new LatencyAggregator(false);
    ConsumerParameters parameters = parameters(aggregator).setMessageLimit(count);
    runToCompletion(
        1,
        (id, stopSignal, completionHandler) ->
            new RoundTripAgent(id, stopSignal, completionHandler, parameters, messageBodySource));
    return aggregator;
  }

  private ConsumerParameters parameters(LatencyAggregator aggregator) {
    return new ConsumerParameters()
        .setGateway(gateway)
        .setQueue(queue)
        .setAggregator(aggregator)
        .setVisibilityTimeoutInSeconds(visibilityTimeoutInSeconds)
        .setBatchSize(batchSize)
        .setEmptyReceiveBackoff(emptyReceiveBackoff)
        .setTagger(tagger)
        .setPerformanceMetrics(performanceMetrics);
  }
}

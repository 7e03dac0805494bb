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
import com.sqsbench.perf.metrics.PerformanceMetrics;
import java.time.Duration;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/** Enqueues tagged messages from concurrent producers. */
public class ProducerPool extends WorkerPool {

  private final QueueGateway gateway;
  private final String queue;
  private final MessageTagger tagger;
  private final MessageBodySource messageBodySource;
  private final PerformanceMetrics performanceMetrics;

  public ProducerPool(
      QueueGateway gateway,
      String queue,
      MessageTagger tagger,
      MessageBodySource messageBodySource,
      PerformanceMetrics performanceMetrics,
      ConcurrentMap<String, Integer> reasons) {
    super("producer", reasons);
    this.gateway = gateway;
    this.queue = queue;
    this.tagger = tagger;
    this.messageBodySource = messageBodySource;
    this.performanceMetrics = performanceMetrics;
  }

  /**
   * Send messages with indices 1 to <code>count</code>, each index once, and wait for all the
   * producers to stop.
   *
   * @param count
   * @param workers
   * @return the number of successful sends, lower than count if some sends failed
   * @throws InterruptedException
   */
  public long enqueue(long count, int workers) throws InterruptedException {
    AtomicLong sentCount = new AtomicLong(0);
    ProducerParameters parameters = parameters(sentCount).setMessageLimit(count);
    runToCompletion(
        workers,
        (id, stopSignal, completionHandler) ->
            new Producer(id, stopSignal, completionHandler, parameters));
    return sentCount.get();
  }

  /**
   * Send at a fixed pace per producer until the time limit. Producers are not waited for at the
   * deadline.
   *
   * @param timeLimit
   * @param workers
   * @param publishingInterval pause of each producer after a send
   * @return the number of successful sends at the deadline, sends in flight are not counted
   * @throws InterruptedException
   */
  public long enqueueUntil(Duration timeLimit, int workers, Duration publishingInterval)
      throws InterruptedException {
    AtomicLong sentCount = new AtomicLong(0);
    ProducerParameters parameters =
        parameters(sentCount).setMessageLimit(0).setPublishingInterval(publishingInterval);
    runUntil(
        timeLimit,
        workers,
        (id, stopSignal, completionHandler) ->
            new Producer(id, stopSignal, completionHandler, parameters));
    return sentCount.get();
  }

  private ProducerParameters parameters(AtomicLong sentCount) {
    return new ProducerParameters()
        .setGateway(gateway)
        .setQueue(queue)
        .setSequence(new AtomicLong(0))
        .setSentCount(sentCount)
        .setTagger(tagger)
        .setMessageBodySource(messageBodySource)
        .setPerformanceMetrics(performanceMetrics);
  }
}

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
import com.sqsbench.perf.gateway.MessageMetadata;
import com.sqsbench.perf.gateway.QueueGatewayException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends tagged messages. Producers of a pool claim sequence indices from a shared counter, so an
 * index is never sent twice. A failed send is logged and its index is lost, it is not retried.
 *
 * <p>With a publishing interval, the producer sleeps after each send (open-loop load).
 */
class Producer extends AgentBase {

  static final String STOP_REASON_PRODUCER_MESSAGE_LIMIT = "Producer reached message limit";

  private static final Logger LOGGER = LoggerFactory.getLogger(Producer.class);

  private final AtomicLong sequence;
  private final AtomicLong sentCount;
  private final long messageLimit;
  private final Duration publishingInterval;
  private final MessageTagger tagger;
  private final MessageBodySource messageBodySource;

  Producer(
      int id,
      StopSignal stopSignal,
      CompletionHandler completionHandler,
      ProducerParameters parameters) {
    super(
        id,
        parameters.getGateway(),
        parameters.getQueue(),
        stopSignal,
        completionHandler,
        parameters.getPerformanceMetrics());
    this.sequence = parameters.getSequence();
    this.sentCount = parameters.getSentCount();
    this.messageLimit = parameters.getMessageLimit();
    this.publishingInterval = parameters.getPublishingInterval();
    this.tagger = parameters.getTagger();
    this.messageBodySource = parameters.getMessageBodySource();
  }

  @Override
  protected String doRun() throws InterruptedException {
    while (keepGoing()) {
      long index = sequence.incrementAndGet();
      if (messageLimit > 0 && index > messageLimit) {
        return STOP_REASON_PRODUCER_MESSAGE_LIMIT;
      }
      send(index);
      pause(publishingInterval);
    }
    return STOP_REASON_STOPPED;
  }

  private void send(long index) {
    MessageMetadata metadata = tagger.tag(index);
    try {
      gateway.send(queue, messageBodySource.create(index), metadata);
      sentCount.incrementAndGet();
      performanceMetrics.sent();
    } catch (QueueGatewayException e) {
      performanceMetrics.sendFailed();
      if (keepGoing()) {
        LOGGER.warn("Could not send message {}: {}", index, e.getMessage());
      }
    }
  }

  @Override
  protected String type() {
    return "producer";
  }
}

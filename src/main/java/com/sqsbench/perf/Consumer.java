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
import com.sqsbench.perf.gateway.InboundMessage;
import com.sqsbench.perf.gateway.QueueGatewayException;
import com.sqsbench.perf.metrics.LatencyAggregator;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Receives messages one at a time, deletes each of them and records its latency once the delete
 * succeeded.
 *
 * <p>Consumers of a pool stop when the shared sample count reaches the limit. They check the count
 * concurrently, so the final count can exceed the limit by a few samples.
 */
class Consumer extends AgentBase {

  static final String STOP_REASON_CONSUMER_MESSAGE_LIMIT = "Consumer reached message limit";

  private static final Logger LOGGER = LoggerFactory.getLogger(Consumer.class);

  final LatencyAggregator aggregator;
  final long messageLimit;
  final int visibilityTimeoutInSeconds;
  final Duration emptyReceiveBackoff;
  final MessageTagger tagger;

  Consumer(
      int id,
      StopSignal stopSignal,
      CompletionHandler completionHandler,
      ConsumerParameters parameters) {
    super(
        id,
        parameters.getGateway(),
        parameters.getQueue(),
        stopSignal,
        completionHandler,
        parameters.getPerformanceMetrics());
    this.aggregator = parameters.getAggregator();
    this.messageLimit = parameters.getMessageLimit();
    this.visibilityTimeoutInSeconds = parameters.getVisibilityTimeoutInSeconds();
    this.emptyReceiveBackoff = parameters.getEmptyReceiveBackoff();
    this.tagger = parameters.getTagger();
  }

  @Override
  protected String doRun() throws InterruptedException {
    while (keepGoing()) {
      if (limitReached()) {
        return STOP_REASON_CONSUMER_MESSAGE_LIMIT;
      }
      Optional<InboundMessage> message;
      try {
        message = gateway.receiveOne(queue, visibilityTimeoutInSeconds);
      } catch (QueueGatewayException e) {
        logIfRunning("Could not receive message", e);
        backOff();
        continue;
      }
      if (message.isPresent()) {
        long receiveTime = tagger.now();
        performanceMetrics.received(1);
        handle(message.get(), receiveTime);
      } else {
        backOff();
      }
    }
    return STOP_REASON_STOPPED;
  }

  /**
   * Delete the message and record its latency.
   *
   * @return true if a sample was recorded
   */
  boolean handle(InboundMessage message, long receiveTime) {
    if (!message.isTagged()) {
      LOGGER.debug("Ignoring message {} without enqueue time", message.getMessageId());
      return false;
    }
    try {
      gateway.acknowledge(queue, message.getAcknowledgmentToken());
    } catch (QueueGatewayException e) {
      performanceMetrics.acknowledgeFailed(1);
      logIfRunning("Could not delete message " + message.getMessageId(), e);
      return false;
    }
    long latency = tagger.latency(message.getMetadata(), receiveTime);
    aggregator.record(latency);
    performanceMetrics.acknowledged(latency);
    return true;
  }

  boolean limitReached() {
    return messageLimit > 0 && aggregator.count() >= messageLimit;
  }

  void backOff() throws InterruptedException {
    pause(Utils.jitter(emptyReceiveBackoff));
  }

  void logIfRunning(String message, QueueGatewayException e) {
    if (keepGoing()) {
      LOGGER.warn("{}: {}", message, e.getMessage());
    }
  }

  @Override
  protected String type() {
    return "consumer";
  }
}

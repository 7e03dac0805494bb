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
import com.sqsbench.perf.gateway.BatchAcknowledgement;
import com.sqsbench.perf.gateway.InboundMessage;
import com.sqsbench.perf.gateway.QueueGatewayException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Receives messages in batches and deletes each batch with one call. Latencies are recorded for
 * the messages the queue service confirmed as deleted only.
 *
 * <p>The limit is checked between batches: the in-flight batch is always acknowledged and
 * recorded, so the final count can exceed the limit by up to a batch per consumer.
 */
class BatchConsumer extends Consumer {

  private static final Logger LOGGER = LoggerFactory.getLogger(BatchConsumer.class);

  private final int batchSize;
  private final boolean failOnAcknowledgeError;

  BatchConsumer(
      int id,
      StopSignal stopSignal,
      CompletionHandler completionHandler,
      ConsumerParameters parameters) {
    super(id, stopSignal, completionHandler, parameters);
    this.batchSize = parameters.getBatchSize();
    this.failOnAcknowledgeError = parameters.isFailOnAcknowledgeError();
  }

  @Override
  protected String doRun() throws InterruptedException {
    while (keepGoing()) {
      if (limitReached()) {
        return STOP_REASON_CONSUMER_MESSAGE_LIMIT;
      }
      List<InboundMessage> messages;
      try {
        messages = gateway.receiveBatch(queue, batchSize, visibilityTimeoutInSeconds);
      } catch (QueueGatewayException e) {
        logIfRunning("Could not receive messages", e);
        backOff();
        continue;
      }
      if (messages.isEmpty()) {
        backOff();
      } else {
        long receiveTime = tagger.now();
        performanceMetrics.received(messages.size());
        handle(messages, receiveTime);
      }
    }
    return STOP_REASON_STOPPED;
  }

  private void handle(List<InboundMessage> messages, long receiveTime) {
    // latencies by acknowledgment token
    Map<String, Long> latencies = new LinkedHashMap<>(messages.size());
    for (InboundMessage message : messages) {
      if (message.isTagged()) {
        latencies.put(
            message.getAcknowledgmentToken(), tagger.latency(message.getMetadata(), receiveTime));
      } else {
        LOGGER.debug("Ignoring message {} without enqueue time", message.getMessageId());
      }
    }
    if (latencies.isEmpty()) {
      return;
    }

    BatchAcknowledgement acknowledgement;
    try {
      acknowledgement = gateway.acknowledgeBatch(queue, new ArrayList<>(latencies.keySet()));
    } catch (QueueGatewayException e) {
      performanceMetrics.acknowledgeFailed(latencies.size());
      if (failOnAcknowledgeError) {
        throw new PerfTestException("Batch delete failed: " + e.getMessage(), e);
      }
      logIfRunning("Could not delete batch of " + latencies.size() + " message(s)", e);
      return;
    }

    if (!acknowledgement.isComplete()) {
      performanceMetrics.acknowledgeFailed(acknowledgement.failed().size());
      LOGGER.warn(
          "Could not delete {} message(s) out of {}: {}",
          acknowledgement.failed().size(),
          latencies.size(),
          acknowledgement.failed().values());
    }
    for (String token : acknowledgement.acknowledged()) {
      Long latency = latencies.get(token);
      if (latency != null) {
        aggregator.record(latency);
        performanceMetrics.acknowledged(latency);
      }
    }
  }
}

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
import java.util.Optional;

/**
 * Closed-loop worker: sends one message, then receives until it gets one back, and starts again.
 * The latency of each received message is recorded after it is deleted.
 */
class RoundTripAgent extends Consumer {

  static final String STOP_REASON_ROUND_TRIPS_COMPLETED = "Round trips completed";

  private final MessageBodySource messageBodySource;

  RoundTripAgent(
      int id,
      StopSignal stopSignal,
      CompletionHandler completionHandler,
      ConsumerParameters parameters,
      MessageBodySource messageBodySource) {
    super(id, stopSignal, completionHandler, parameters);
    this.messageBodySource = messageBodySource;
  }

  @Override
  protected String doRun() throws InterruptedException {
    long index = 1;
    while (keepGoing() && index <= messageLimit) {
      try {
        gateway.send(queue, messageBodySource.create(index), tagger.tag(index));
        performanceMetrics.sent();
      } catch (QueueGatewayException e) {
        performanceMetrics.sendFailed();
        logIfRunning("Could not send message " + index, e);
        backOff();
        continue;
      }
      if (receiveOne()) {
        index++;
      }
    }
    return index > messageLimit ? STOP_REASON_ROUND_TRIPS_COMPLETED : STOP_REASON_STOPPED;
  }

  /**
   * Receive until a tagged message is received and deleted.
   *
   * @return true if a sample was recorded
   */
  private boolean receiveOne() throws InterruptedException {
    while (keepGoing()) {
      Optional<InboundMessage> message;
      try {
        message = gateway.receiveOne(queue, visibilityTimeoutInSeconds);
      } catch (QueueGatewayException e) {
        logIfRunning("Could not receive message", e);
        backOff();
        continue;
      }
      if (!message.isPresent()) {
        backOff();
        continue;
      }
      performanceMetrics.received(1);
      if (handle(message.get(), tagger.now())) {
        return true;
      }
    }
    return false;
  }

  @Override
  protected String type() {
    return "round-trip worker";
  }
}

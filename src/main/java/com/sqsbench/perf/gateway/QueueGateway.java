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
package com.sqsbench.perf.gateway;

import java.util.List;
import java.util.Optional;

/**
 * Thin adapter over the operations of the queue service.
 *
 * <p>Implementations hold a client and nothing else, they are safe to use from many threads once
 * created. Queues are designated by an opaque handle (e.g. a queue URL) returned by {@link
 * #ensureQueue(String)}. Every failure of the queue service surfaces as a {@link
 * QueueGatewayException}, callers decide whether it is fatal.
 */
public interface QueueGateway extends AutoCloseable {

  /** Maximum number of messages a batch receive can return. */
  int MAX_BATCH_SIZE = 10;

  /**
   * Look up a queue by name and create it only if it does not exist.
   *
   * @param name the queue name
   * @return the queue handle
   */
  String ensureQueue(String name);

  /**
   * Send a message.
   *
   * @param queue
   * @param body
   * @param metadata
   * @return the ID assigned by the queue service
   */
  String send(String queue, byte[] body, MessageMetadata metadata);

  /**
   * Receive at most one message.
   *
   * @param queue
   * @param visibilityTimeoutInSeconds
   * @return the message, or an empty optional if there is no message available
   */
  Optional<InboundMessage> receiveOne(String queue, int visibilityTimeoutInSeconds);

  /**
   * Receive up to <code>maxCount</code> messages, never more than {@link #MAX_BATCH_SIZE}.
   *
   * @param queue
   * @param maxCount
   * @param visibilityTimeoutInSeconds
   * @return the received messages, possibly none
   */
  List<InboundMessage> receiveBatch(String queue, int maxCount, int visibilityTimeoutInSeconds);

  void acknowledge(String queue, String acknowledgmentToken);

  /**
   * Acknowledge several messages at once.
   *
   * <p>The call itself can fail (exception) or some entries only can be rejected, they are then
   * listed in {@link BatchAcknowledgement#failed()}.
   *
   * @param queue
   * @param acknowledgmentTokens
   * @return the per-token outcome
   */
  BatchAcknowledgement acknowledgeBatch(String queue, List<String> acknowledgmentTokens);

  void deleteQueue(String queue);

  List<String> listQueues();

  @Override
  void close();

  /** Creates gateways, a seam for tests. */
  @FunctionalInterface
  interface Factory {

    QueueGateway create(GatewayConfiguration configuration);
  }
}

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

/** A message as delivered by a receive call, with the token needed to acknowledge it. */
public final class InboundMessage {

  private final String messageId;
  private final byte[] body;
  private final MessageMetadata metadata;
  private final String acknowledgmentToken;

  public InboundMessage(
      String messageId, byte[] body, MessageMetadata metadata, String acknowledgmentToken) {
    this.messageId = messageId;
    this.body = body;
    this.metadata = metadata;
    this.acknowledgmentToken = acknowledgmentToken;
  }

  public String getMessageId() {
    return messageId;
  }

  public byte[] getBody() {
    return body;
  }

  /**
   * The metadata set by the sender.
   *
   * @return the metadata, <code>null</code> if the message was not tagged
   */
  public MessageMetadata getMetadata() {
    return metadata;
  }

  public boolean isTagged() {
    return metadata != null;
  }

  public String getAcknowledgmentToken() {
    return acknowledgmentToken;
  }

  @Override
  public String toString() {
    return "InboundMessage{messageId='" + messageId + "', metadata=" + metadata + '}';
  }
}

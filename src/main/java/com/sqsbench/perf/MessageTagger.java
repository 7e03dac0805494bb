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

import com.sqsbench.perf.gateway.MessageMetadata;

/** Stamps outgoing messages and computes the latency of incoming ones. */
public class MessageTagger {

  private final TimestampProvider timestampProvider;

  public MessageTagger(TimestampProvider timestampProvider) {
    this.timestampProvider = timestampProvider;
  }

  /** Metadata for the message with the given sequence index, stamped now. */
  public MessageMetadata tag(long index) {
    return new MessageMetadata(index, timestampProvider.getCurrentTime());
  }

  public long now() {
    return timestampProvider.getCurrentTime();
  }

  /** Latency in nanoseconds between the enqueue time and the receive time. */
  public long latency(MessageMetadata metadata, long receiveTime) {
    return timestampProvider.getDifference(receiveTime, metadata.getEnqueueTimeInNanos());
  }
}

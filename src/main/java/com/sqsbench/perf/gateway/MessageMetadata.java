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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Metadata attached to each outgoing message: a sequence index and the enqueue timestamp.
 *
 * <p>Both values travel as decimal strings in the message attributes, so that they survive the
 * queue service unchanged.
 */
public final class MessageMetadata {

  public static final String ENQUEUE_TIME_ATTRIBUTE = "EnqueueTime";
  public static final String INDEX_ATTRIBUTE = "Index";

  static final long NO_INDEX = -1;

  private final long index;
  private final long enqueueTimeInNanos;

  public MessageMetadata(long index, long enqueueTimeInNanos) {
    this.index = index;
    this.enqueueTimeInNanos = enqueueTimeInNanos;
  }

  public long getIndex() {
    return index;
  }

  public long getEnqueueTimeInNanos() {
    return enqueueTimeInNanos;
  }

  public Map<String, String> toAttributes() {
    Map<String, String> attributes = new LinkedHashMap<>(2);
    attributes.put(ENQUEUE_TIME_ATTRIBUTE, Long.toUnsignedString(enqueueTimeInNanos));
    attributes.put(INDEX_ATTRIBUTE, Long.toUnsignedString(index));
    return attributes;
  }

  /**
   * Extract metadata from message attributes.
   *
   * @param attributes
   * @return the metadata, or <code>null</code> if there is no valid enqueue time
   */
  public static MessageMetadata fromAttributes(Map<String, String> attributes) {
    if (attributes == null) {
      return null;
    }
    String enqueueTime = attributes.get(ENQUEUE_TIME_ATTRIBUTE);
    if (enqueueTime == null) {
      return null;
    }
    long enqueueTimeInNanos;
    try {
      enqueueTimeInNanos = Long.parseUnsignedLong(enqueueTime.trim());
    } catch (NumberFormatException e) {
      return null;
    }
    long index = NO_INDEX;
    String indexValue = attributes.get(INDEX_ATTRIBUTE);
    if (indexValue != null) {
      try {
        index = Long.parseUnsignedLong(indexValue.trim());
      } catch (NumberFormatException e) {
        // the timestamp is enough to compute the latency
        index = NO_INDEX;
      }
    }
    return new MessageMetadata(index, enqueueTimeInNanos);
  }

  @Override
  public String toString() {
    return "MessageMetadata{index=" + index + ", enqueueTimeInNanos=" + enqueueTimeInNanos + '}';
  }
}

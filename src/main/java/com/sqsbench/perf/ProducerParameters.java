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
import java.util.concurrent.atomic.AtomicLong;

/** Settings shared by the producers of a pool. */
public class ProducerParameters {

  private QueueGateway gateway;
  private String queue;
  private AtomicLong sequence;
  private AtomicLong sentCount;
  private long messageLimit;
  private Duration publishingInterval = Duration.ZERO;
  private MessageTagger tagger;
  private MessageBodySource messageBodySource;
  private PerformanceMetrics performanceMetrics = PerformanceMetrics.NO_OP;

  public QueueGateway getGateway() {
    return gateway;
  }

  public ProducerParameters setGateway(QueueGateway gateway) {
    this.gateway = gateway;
    return this;
  }

  public String getQueue() {
    return queue;
  }

  public ProducerParameters setQueue(String queue) {
    this.queue = queue;
    return this;
  }

  /** Counter the producers claim sequence indices from. */
  public AtomicLong getSequence() {
    return sequence;
  }

  public ProducerParameters setSequence(AtomicLong sequence) {
    this.sequence = sequence;
    return this;
  }

  /** Number of successful sends. */
  public AtomicLong getSentCount() {
    return sentCount;
  }

  public ProducerParameters setSentCount(AtomicLong sentCount) {
    this.sentCount = sentCount;
    return this;
  }

  /** Highest index to send, 0 for no limit. */
  public long getMessageLimit() {
    return messageLimit;
  }

  public ProducerParameters setMessageLimit(long messageLimit) {
    this.messageLimit = messageLimit;
    return this;
  }

  public Duration getPublishingInterval() {
    return publishingInterval;
  }

  public ProducerParameters setPublishingInterval(Duration publishingInterval) {
    this.publishingInterval = publishingInterval;
    return this;
  }

  public MessageTagger getTagger() {
    return tagger;
  }

  public ProducerParameters setTagger(MessageTagger tagger) {
    this.tagger = tagger;
    return this;
  }

  public MessageBodySource getMessageBodySource() {
    return messageBodySource;
  }

  public ProducerParameters setMessageBodySource(MessageBodySource messageBodySource) {
    this.messageBodySource = messageBodySource;
    return this;
  }

  public PerformanceMetrics getPerformanceMetrics() {
    return performanceMetrics;
  }

  public ProducerParameters setPerformanceMetrics(PerformanceMetrics performanceMetrics) {
    this.performanceMetrics = performanceMetrics;
    return this;
  }
}

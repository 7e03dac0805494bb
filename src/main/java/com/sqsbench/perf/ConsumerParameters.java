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
import com.sqsbench.perf.metrics.LatencyAggregator;
import com.sqsbench.perf.metrics.PerformanceMetrics;
import java.time.Duration;

/** Settings shared by the consumers of a pool. */
public class ConsumerParameters {

  private QueueGateway gateway;
  private String queue;
  private LatencyAggregator aggregator;
  private long messageLimit;
  private int visibilityTimeoutInSeconds = 1;
  private int batchSize = 10;
  private Duration emptyReceiveBackoff = Duration.ZERO;
  private boolean failOnAcknowledgeError;
  private MessageTagger tagger;
  private PerformanceMetrics performanceMetrics = PerformanceMetrics.NO_OP;

  public QueueGateway getGateway() {
    return gateway;
  }

  public ConsumerParameters setGateway(QueueGateway gateway) {
    this.gateway = gateway;
    return this;
  }

  public String getQueue() {
    return queue;
  }

  public ConsumerParameters setQueue(String queue) {
    this.queue = queue;
    return this;
  }

  public LatencyAggregator getAggregator() {
    return aggregator;
  }

  public ConsumerParameters setAggregator(LatencyAggregator aggregator) {
    this.aggregator = aggregator;
    return this;
  }

  /** Number of samples after which consumers stop, 0 for no limit. */
  public long getMessageLimit() {
    return messageLimit;
  }

  public ConsumerParameters setMessageLimit(long messageLimit) {
    this.messageLimit = messageLimit;
    return this;
  }

  public int getVisibilityTimeoutInSeconds() {
    return visibilityTimeoutInSeconds;
  }

  public ConsumerParameters setVisibilityTimeoutInSeconds(int visibilityTimeoutInSeconds) {
    this.visibilityTimeoutInSeconds = visibilityTimeoutInSeconds;
    return this;
  }

  public int getBatchSize() {
    return batchSize;
  }

  public ConsumerParameters setBatchSize(int batchSize) {
    this.batchSize = batchSize;
    return this;
  }

  public Duration getEmptyReceiveBackoff() {
    return emptyReceiveBackoff;
  }

  public ConsumerParameters setEmptyReceiveBackoff(Duration emptyReceiveBackoff) {
    this.emptyReceiveBackoff = emptyReceiveBackoff;
    return this;
  }

  public boolean isFailOnAcknowledgeError() {
    return failOnAcknowledgeError;
  }

  public ConsumerParameters setFailOnAcknowledgeError(boolean failOnAcknowledgeError) {
    this.failOnAcknowledgeError = failOnAcknowledgeError;
    return this;
  }

  public MessageTagger getTagger() {
    return tagger;
  }

  public ConsumerParameters setTagger(MessageTagger tagger) {
    this.tagger = tagger;
    return this;
  }

  public PerformanceMetrics getPerformanceMetrics() {
    return performanceMetrics;
  }

  public ConsumerParameters setPerformanceMetrics(PerformanceMetrics performanceMetrics) {
    this.performanceMetrics = performanceMetrics;
    return this;
  }
}

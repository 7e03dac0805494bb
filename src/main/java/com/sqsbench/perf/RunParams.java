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

import java.time.Duration;

/** Settings of a run, as parsed from the command line and the environment. */
public class RunParams {

  static final String DEFAULT_QUEUE = "benchmark-queue";
  static final String DEFAULT_REGION = "eu-west-2";
  static final long DEFAULT_MESSAGE_COUNT = 10_000;
  static final int DEFAULT_PRODUCERS = 10;
  static final int DEFAULT_CONSUMERS = 10;
  static final int DEFAULT_TIME_BOUND_PRODUCERS = 300;
  static final int DEFAULT_PUBLISHING_INTERVAL_IN_MS = 975;
  static final int DEFAULT_TIME_LIMIT_IN_SECONDS = 60;
  static final int DEFAULT_GRACE_PERIOD_IN_SECONDS = 30;
  static final int DEFAULT_VISIBILITY_TIMEOUT_IN_SECONDS = 1;
  static final String DEFAULT_OUTPUT_FILE = "/tmp/sqs_latencies.txt";
  static final String DEFAULT_TIME_BOUND_OUTPUT_FILE = "/tmp/sqs_time_bound_latencies.txt";

  private RunMode mode;
  private String queue = DEFAULT_QUEUE;
  private long messageCount = DEFAULT_MESSAGE_COUNT;
  private int producerCount = DEFAULT_PRODUCERS;
  private int consumerCount = DEFAULT_CONSUMERS;
  private int timeBoundProducerCount = DEFAULT_TIME_BOUND_PRODUCERS;
  private Duration publishingInterval = Duration.ofMillis(DEFAULT_PUBLISHING_INTERVAL_IN_MS);
  private Duration timeLimit = Duration.ofSeconds(DEFAULT_TIME_LIMIT_IN_SECONDS);
  private Duration gracePeriod = Duration.ofSeconds(DEFAULT_GRACE_PERIOD_IN_SECONDS);
  private int visibilityTimeoutInSeconds = DEFAULT_VISIBILITY_TIMEOUT_IN_SECONDS;
  private int batchSize = 10;
  private Duration emptyReceiveBackoff = Duration.ZERO;
  private String outputFile;
  private String bodyFile;
  private Duration reportingInterval = Duration.ofSeconds(5);

  public RunMode getMode() {
    return mode;
  }

  public void setMode(RunMode mode) {
    this.mode = mode;
  }

  public String getQueue() {
    return queue;
  }

  public void setQueue(String queue) {
    this.queue = queue;
  }

  public long getMessageCount() {
    return messageCount;
  }

  public void setMessageCount(long messageCount) {
    this.messageCount = messageCount;
  }

  public int getProducerCount() {
    return producerCount;
  }

  public void setProducerCount(int producerCount) {
    this.producerCount = producerCount;
  }

  public int getConsumerCount() {
    return consumerCount;
  }

  public void setConsumerCount(int consumerCount) {
    this.consumerCount = consumerCount;
  }

  public int getTimeBoundProducerCount() {
    return timeBoundProducerCount;
  }

  public void setTimeBoundProducerCount(int timeBoundProducerCount) {
    this.timeBoundProducerCount = timeBoundProducerCount;
  }

  public Duration getPublishingInterval() {
    return publishingInterval;
  }

  public void setPublishingInterval(Duration publishingInterval) {
    this.publishingInterval = publishingInterval;
  }

  public Duration getTimeLimit() {
    return timeLimit;
  }

  public void setTimeLimit(Duration timeLimit) {
    this.timeLimit = timeLimit;
  }

  public Duration getGracePeriod() {
    return gracePeriod;
  }

  public void setGracePeriod(Duration gracePeriod) {
    this.gracePeriod = gracePeriod;
  }

  public int getVisibilityTimeoutInSeconds() {
    return visibilityTimeoutInSeconds;
  }

  public void setVisibilityTimeoutInSeconds(int visibilityTimeoutInSeconds) {
    this.visibilityTimeoutInSeconds = visibilityTimeoutInSeconds;
  }

  public int getBatchSize() {
    return batchSize;
  }

  public void setBatchSize(int batchSize) {
    this.batchSize = batchSize;
  }

  public Duration getEmptyReceiveBackoff() {
    return emptyReceiveBackoff;
  }

  public void setEmptyReceiveBackoff(Duration emptyReceiveBackoff) {
    this.emptyReceiveBackoff = emptyReceiveBackoff;
  }

  /**
   * The latency file, which depends on the mode when not set explicitly.
   *
   * @return the file set, or the default file of the mode
   */
  public String getOutputFile() {
    if (outputFile != null) {
      return outputFile;
    }
    return mode != null && mode.isTimeBound()
        ? DEFAULT_TIME_BOUND_OUTPUT_FILE
        : DEFAULT_OUTPUT_FILE;
  }

  public void setOutputFile(String outputFile) {
    this.outputFile = outputFile;
  }

  public String getBodyFile() {
    return bodyFile;
  }

  public void setBodyFile(String bodyFile) {
    this.bodyFile = bodyFile;
  }

  public Duration getReportingInterval() {
    return reportingInterval;
  }

  public void setReportingInterval(Duration reportingInterval) {
    this.reportingInterval = reportingInterval;
  }
}

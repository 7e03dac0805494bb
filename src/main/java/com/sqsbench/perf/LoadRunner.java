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
import com.sqsbench.perf.gateway.QueueGatewayException;
import com.sqsbench.perf.metrics.LatencyAggregator;
import com.sqsbench.perf.metrics.PerformanceMetrics;
import com.sqsbench.perf.metrics.ReportSink;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Runs one workload against the queue and reports its results. */
class LoadRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(LoadRunner.class);

  private final QueueGateway gateway;
  private final RunParams params;
  private final MessageTagger tagger;
  private final MessageBodySource messageBodySource;
  private final PerformanceMetrics performanceMetrics;
  private final ReportSink reportSink;

  LoadRunner(
      QueueGateway gateway,
      RunParams params,
      MessageTagger tagger,
      MessageBodySource messageBodySource,
      PerformanceMetrics performanceMetrics,
      ReportSink reportSink) {
    this.gateway = gateway;
    this.params = params;
    this.tagger = tagger;
    this.messageBodySource = messageBodySource;
    this.performanceMetrics = performanceMetrics;
    this.reportSink = reportSink;
  }

  /**
   * Run the workload of the mode.
   *
   * @throws InterruptedException
   * @throws PerfTestException if the queue cannot be set up, a bounded batch delete failed, the
   *     latency file cannot be written, or no sample was collected
   */
  void run() throws InterruptedException {
    RunMode mode = params.getMode();
    String queue = ensureQueue(params.getQueue());
    ConcurrentMap<String, Integer> reasons = new ConcurrentHashMap<>();
    performanceMetrics.start();
    try {
      switch (mode) {
        case BULK_ENQUEUE:
          reportSink.println("Starting enqueuer");
          reportSink.sent(
              producerPool(queue, reasons)
                  .enqueue(params.getMessageCount(), params.getProducerCount()));
          break;
        case TIME_BOUND_ENQUEUE:
          reportSink.println(
              "Starting time bound enqueuer for duration: " + seconds(params.getTimeLimit()));
          // best effort, sends in flight at the deadline are not counted
          reportSink.sent(
              producerPool(queue, reasons)
                  .enqueueUntil(
                      params.getTimeLimit(),
                      params.getTimeBoundProducerCount(),
                      params.getPublishingInterval()));
          break;
        case BULK_DEQUEUE:
          reportSink.println("Starting dequeuer");
          reportSink.report(
              consumerPool(queue, reasons)
                  .dequeue(params.getMessageCount(), params.getConsumerCount()));
          break;
        case BULK_BATCH_DEQUEUE:
          reportSink.println("Starting batch dequeuer");
          writeAndReport(
              consumerPool(queue, reasons)
                  .dequeueBatches(params.getMessageCount(), params.getConsumerCount()));
          break;
        case TIME_BOUND_BATCH_DEQUEUE:
          reportSink.println(
              "Starting time bound batch dequeuer for duration: "
                  + seconds(params.getTimeLimit()));
          Duration timeLimit = params.getTimeLimit().plus(params.getGracePeriod());
          writeAndReport(
              consumerPool(queue, reasons)
                  .dequeueBatchesUntil(timeLimit, params.getConsumerCount()));
          break;
        case ROUND_TRIP:
          reportSink.println("Starting round trip");
          reportSink.report(
              consumerPool(queue, reasons).roundTrip(params.getMessageCount(), messageBodySource));
          break;
        default:
          throw new IllegalArgumentException("Unsupported mode: " + mode);
      }
    } finally {
      reportSink.println(stopLine(reasons));
    }
  }

  private String ensureQueue(String name) {
    try {
      String queue = gateway.ensureQueue(name);
      LOGGER.info("Using queue {}", queue);
      return queue;
    } catch (QueueGatewayException e) {
      throw new PerfTestException("Could not set up queue " + name + ": " + e.getMessage(), e);
    }
  }

  private void writeAndReport(LatencyAggregator aggregator) {
    reportSink.writeSamples(Paths.get(params.getOutputFile()), aggregator.samples());
    reportSink.report(aggregator);
  }

  private ProducerPool producerPool(String queue, ConcurrentMap<String, Integer> reasons) {
    return new ProducerPool(
        gateway, queue, tagger, messageBodySource, performanceMetrics, reasons);
  }

  private ConsumerPool consumerPool(String queue, ConcurrentMap<String, Integer> reasons) {
    return new ConsumerPool(gateway, queue, tagger, performanceMetrics, reasons)
        .visibilityTimeoutInSeconds(params.getVisibilityTimeoutInSeconds())
        .batchSize(params.getBatchSize())
        .emptyReceiveBackoff(params.getEmptyReceiveBackoff());
  }

  private static String seconds(Duration duration) {
    return duration.getSeconds() + "s";
  }

  static String stopLine(Map<String, Integer> reasons) {
    StringBuilder stoppedLine = new StringBuilder("test stopped");
    if (reasons.size() > 0) {
      stoppedLine.append(" (");
      int count = 1;
      for (Map.Entry<String, Integer> reasonToCount : reasons.entrySet()) {
        stoppedLine.append(reasonToCount.getKey());
        if (reasonToCount.getValue() > 1) {
          stoppedLine.append(" [").append(reasonToCount.getValue()).append("]");
        }
        if (count < reasons.size()) {
          stoppedLine.append(", ");
        }
        count++;
      }
      stoppedLine.append(")");
    }
    return stoppedLine.toString();
  }
}

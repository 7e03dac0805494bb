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
package com.sqsbench.perf.metrics;

import static com.sqsbench.perf.metrics.MetricsFormatterUtils.LATENCY_HEADER;
import static com.sqsbench.perf.metrics.MetricsFormatterUtils.MESSAGE_RATE_LABEL;
import static com.sqsbench.perf.metrics.MetricsFormatterUtils.formatLatency;
import static com.sqsbench.perf.metrics.MetricsFormatterUtils.formatRate;
import static com.sqsbench.perf.metrics.MetricsFormatterUtils.formatTime;

import com.codahale.metrics.ExponentiallyDecayingReservoir;
import com.codahale.metrics.Histogram;
import com.codahale.metrics.Snapshot;
import com.sqsbench.perf.NamedThreadFactory;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.io.PrintStream;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects progress metrics in Micrometer meters and prints the rates and latencies of the last
 * interval on the console.
 */
public final class DefaultPerformanceMetrics implements PerformanceMetrics, AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(DefaultPerformanceMetrics.class);
  private static final float MS_TO_SECOND = 1_000;

  private final ScheduledExecutorService scheduledExecutorService;
  private final AtomicLong startTime = new AtomicLong(-1);
  private final AtomicLong lastTick = new AtomicLong(-1);
  // to calculate rates
  private final AtomicLong sent = new AtomicLong(0);
  private final AtomicLong received = new AtomicLong(0);
  private final AtomicLong acknowledged = new AtomicLong(0);
  private final AtomicLong lastSent = new AtomicLong(0);
  private final AtomicLong lastReceived = new AtomicLong(0);
  private final AtomicReference<Histogram> latency = new AtomicReference<>(histogram());
  // Micrometer's meters
  private final Counter sentCounter, sendFailedCounter, receivedCounter, acknowledgeFailedCounter;
  private final Timer latencyTimer;

  private final Duration interval;
  private final PrintStream out;
  private final AtomicBoolean started = new AtomicBoolean(false);

  public DefaultPerformanceMetrics(
      Duration interval, MeterRegistry registry, String metricsPrefix, PrintStream out) {
    this.interval = interval;
    this.out = out;
    this.scheduledExecutorService =
        Executors.newScheduledThreadPool(
            1, new NamedThreadFactory("sqs-perf-test-metrics-scheduling-"));
    String prefix = metricsPrefix == null ? "" : metricsPrefix;
    this.sentCounter = registry.counter(prefix + "sent");
    this.sendFailedCounter = registry.counter(prefix + "send.failed");
    this.receivedCounter = registry.counter(prefix + "received");
    this.acknowledgeFailedCounter = registry.counter(prefix + "acknowledge.failed");
    this.latencyTimer =
        Timer.builder(prefix + "latency")
            .description("message latency")
            .publishPercentiles(0.5, 0.75, 0.95, 0.99)
            .distributionStatisticExpiry(interval)
            .register(registry);
    this.startTime.set(System.nanoTime());
    this.lastTick.set(startTime.get());
  }

  private static Histogram histogram() {
    return new Histogram(new ExponentiallyDecayingReservoir());
  }

  private static double swapAndCalculateRate(
      AtomicLong current, AtomicLong last, long elapsedTimeInMs) {
    long currentValue = current.get();
    long count = currentValue - last.get();
    last.set(currentValue);
    return elapsedTimeInMs <= 0 ? 0 : MS_TO_SECOND * count / elapsedTimeInMs;
  }

  @Override
  public void start() {
    if (this.started.compareAndSet(false, true)) {
      startTime.set(System.nanoTime());
      lastTick.set(startTime.get());
      out.println(
          "time (s), sent "
              + MESSAGE_RATE_LABEL
              + ", received "
              + MESSAGE_RATE_LABEL
              + ", acknowledged, latency "
              + LATENCY_HEADER);
      scheduledExecutorService.scheduleAtFixedRate(
          () -> {
            try {
              metrics(System.nanoTime());
            } catch (Exception e) {
              LOGGER.warn("Error while processing metrics", e);
            }
          },
          interval.toMillis(),
          interval.toMillis(),
          TimeUnit.MILLISECONDS);
    }
  }

  void metrics(long currentTime) {
    long elapsedTimeInMs = Duration.ofNanos(currentTime - lastTick.get()).toMillis();
    lastTick.set(currentTime);
    Duration sinceStart = Duration.ofNanos(currentTime - startTime.get());
    double sentRate = swapAndCalculateRate(sent, lastSent, elapsedTimeInMs);
    double receivedRate = swapAndCalculateRate(received, lastReceived, elapsedTimeInMs);
    Snapshot snapshot = latency.getAndSet(histogram()).getSnapshot();
    long[] stats =
        new long[] {
          snapshot.getMin(),
          (long) snapshot.getMedian(),
          (long) snapshot.get75thPercentile(),
          (long) snapshot.get95thPercentile(),
          (long) snapshot.get99thPercentile()
        };
    out.println(
        String.join(
            ", ",
            formatTime(sinceStart),
            formatRate(sentRate),
            formatRate(receivedRate),
            Long.toString(acknowledged.get()),
            formatLatency(stats)));
  }

  @Override
  public void sent() {
    sent.incrementAndGet();
    sentCounter.increment();
  }

  @Override
  public void sendFailed() {
    sendFailedCounter.increment();
  }

  @Override
  public void received(int count) {
    received.addAndGet(count);
    receivedCounter.increment(count);
  }

  @Override
  public void acknowledged(long latencyInNanos) {
    acknowledged.incrementAndGet();
    latency.get().update(latencyInNanos);
    latencyTimer.record(latencyInNanos, TimeUnit.NANOSECONDS);
  }

  @Override
  public void acknowledgeFailed(int count) {
    acknowledgeFailedCounter.increment(count);
  }

  @Override
  public void close() {
    if (this.started.compareAndSet(true, false)) {
      this.scheduledExecutorService.shutdownNow();
    } else {
      this.scheduledExecutorService.shutdown();
    }
  }
}

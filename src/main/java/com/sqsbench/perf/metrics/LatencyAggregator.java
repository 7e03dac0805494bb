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

import static java.util.concurrent.TimeUnit.NANOSECONDS;

import com.codahale.metrics.Histogram;
import com.codahale.metrics.Snapshot;
import com.codahale.metrics.UniformReservoir;
import com.sqsbench.perf.NoSamplesException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Running count and sum of message latencies, shared by all the consumers of a run.
 *
 * <p>Latencies are recorded in nanoseconds. When samples are retained (batch modes), each of
 * them is also kept in millisecond resolution in an append-only list that can be read at any
 * time, even while consumers keep recording.
 */
public class LatencyAggregator {

  private final AtomicLong count = new AtomicLong(0);
  private final AtomicLong sum = new AtomicLong(0);
  private final Histogram histogram = new Histogram(new UniformReservoir());
  private final Queue<Long> samples;

  public LatencyAggregator(boolean retainSamples) {
    this.samples = retainSamples ? new ConcurrentLinkedQueue<>() : null;
  }

  /**
   * Record the latency of one acknowledged message.
   *
   * @param latencyInNanos the latency, negative values are recorded as 0
   * @return the number of samples recorded so far, this one included
   */
  public long record(long latencyInNanos) {
    long latency = Math.max(0, latencyInNanos);
    sum.addAndGet(latency);
    histogram.update(latency);
    if (samples != null) {
      samples.add(NANOSECONDS.toMillis(latency));
    }
    return count.incrementAndGet();
  }

  public long count() {
    return count.get();
  }

  public long sum() {
    return sum.get();
  }

  /**
   * Mean latency in nanoseconds (integer division).
   *
   * @return sum / count
   * @throws NoSamplesException if no latency has been recorded
   */
  public long mean() {
    long currentCount = count.get();
    if (currentCount == 0) {
      throw new NoSamplesException();
    }
    return sum.get() / currentCount;
  }

  public boolean retainsSamples() {
    return samples != null;
  }

  /** Snapshot of the retained samples in milliseconds, in recording order. */
  public List<Long> samples() {
    if (samples == null) {
      return Collections.emptyList();
    }
    return new ArrayList<>(samples);
  }

  /**
   * Latency statistics in nanoseconds.
   *
   * @return min, median, 75th, 95th and 99th percentiles
   */
  public long[] percentiles() {
    Snapshot snapshot = histogram.getSnapshot();
    return new long[] {
      snapshot.getMin(),
      (long) snapshot.getMedian(),
      (long) snapshot.get75thPercentile(),
      (long) snapshot.get95thPercentile(),
      (long) snapshot.get99thPercentile()
    };
  }
}

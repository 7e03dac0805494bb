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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.sqsbench.perf.NoSamplesException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

public class LatencyAggregatorTest {

  @Test
  void meanIsSumDividedByCount() {
    LatencyAggregator aggregator = new LatencyAggregator(false);
    assertThat(aggregator.record(10)).isEqualTo(1);
    assertThat(aggregator.record(20)).isEqualTo(2);
    assertThat(aggregator.record(31)).isEqualTo(3);
    assertThat(aggregator.count()).isEqualTo(3);
    assertThat(aggregator.sum()).isEqualTo(61);
    assertThat(aggregator.mean()).isEqualTo(61 / 3);
  }

  @Test
  void meanWithoutSampleIsAnError() {
    LatencyAggregator aggregator = new LatencyAggregator(true);
    assertThatThrownBy(aggregator::mean)
        .isInstanceOf(NoSamplesException.class)
        .hasMessageContaining("No samples collected");
  }

  @Test
  void negativeLatencyIsRecordedAsZero() {
    LatencyAggregator aggregator = new LatencyAggregator(true);
    aggregator.record(-5_000_000);
    assertThat(aggregator.mean()).isZero();
    assertThat(aggregator.samples()).containsExactly(0L);
  }

  @Test
  void samplesAreRetainedInMillisecondsInRecordingOrder() {
    LatencyAggregator aggregator = new LatencyAggregator(true);
    aggregator.record(12_000_000);
    aggregator.record(45_999_999);
    aggregator.record(7_000_001);
    assertThat(aggregator.samples()).containsExactly(12L, 45L, 7L);
  }

  @Test
  void samplesAreNotRetainedByDefault() {
    LatencyAggregator aggregator = new LatencyAggregator(false);
    aggregator.record(12_000_000);
    assertThat(aggregator.retainsSamples()).isFalse();
    assertThat(aggregator.samples()).isEmpty();
  }

  @Test
  void percentiles() {
    LatencyAggregator aggregator = new LatencyAggregator(false);
    for (int i = 1; i <= 100; i++) {
      aggregator.record(i);
    }
    long[] percentiles = aggregator.percentiles();
    assertThat(percentiles).hasSize(5);
    assertThat(percentiles[0]).isEqualTo(1);
    assertThat(percentiles[1]).isBetween(49L, 51L);
    assertThat(percentiles[4]).isBetween(98L, 100L);
  }

  @Test
  void concurrentRecordsAreAllCounted() throws Exception {
    LatencyAggregator aggregator = new LatencyAggregator(true);
    int threads = 8;
    int recordsPerThread = 10_000;
    ExecutorService executorService = Executors.newFixedThreadPool(threads);
    CountDownLatch latch = new CountDownLatch(threads);
    try {
      for (int i = 0; i < threads; i++) {
        executorService.submit(
            () -> {
              for (int j = 0; j < recordsPerThread; j++) {
                aggregator.record(2_000_000);
              }
              latch.countDown();
            });
      }
      assertThat(latch.await(10, TimeUnit.SECONDS)).isTrue();
    } finally {
      executorService.shutdownNow();
    }
    assertThat(aggregator.count()).isEqualTo(threads * recordsPerThread);
    assertThat(aggregator.sum()).isEqualTo(threads * recordsPerThread * 2_000_000L);
    assertThat(aggregator.samples()).hasSize(threads * recordsPerThread);
    assertThat(aggregator.mean()).isEqualTo(2_000_000L);
  }
}

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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.sqsbench.perf.metrics.PerformanceMetrics;
import com.sqsbench.perf.metrics.ReportSink;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class LoadRunnerTest {

  static final long NOW = 1_700_000_000_000L;

  InMemoryQueueGateway gateway;
  ByteArrayOutputStream out;

  @BeforeEach
  void init() {
    gateway = new InMemoryQueueGateway();
    out = new ByteArrayOutputStream();
  }

  @Test
  void stopLine() {
    String[][] parameters =
        new String[][] {
          {"", "test stopped"},
          {"reason1=1", "test stopped (reason1)"},
          {"reason1=2", "test stopped (reason1 [2])"},
          {"reason1=1 reason2=1", "test stopped (reason1, reason2)"},
          {"reason1=2 reason2=1", "test stopped (reason1 [2], reason2)"},
          {"reason1=2 reason2=1 reason3=1", "test stopped (reason1 [2], reason2, reason3)"}
        };
    for (String[] parameter : parameters) {
      assertThat(LoadRunner.stopLine(reasons(parameter[0]))).isEqualTo(parameter[1]);
    }
  }

  @Test
  void dequeueWithoutSamplesFails(@TempDir Path tempDir) throws Exception {
    gateway.ensureQueue("untagged");
    gateway.offer("untagged", TestUtils.BODY, null);
    RunParams params = params(RunMode.TIME_BOUND_BATCH_DEQUEUE, "untagged");
    params.setTimeLimit(Duration.ofSeconds(1));
    params.setGracePeriod(Duration.ZERO);
    params.setOutputFile(tempDir.resolve("latencies.txt").toString());

    assertThatThrownBy(() -> runner(params).run())
        .isInstanceOf(NoSamplesException.class)
        .hasMessageContaining("No samples collected");
    assertThat(console()).contains("Starting time bound batch dequeuer for duration: 1s");
    assertThat(tempDir.resolve("latencies.txt")).isEmptyFile();
    assertThat(console()).contains("test stopped (" + WorkerPool.STOP_REASON_REACHED_TIME_LIMIT);
  }

  @Test
  void enqueueCreatesMissingQueue() throws Exception {
    RunParams params = params(RunMode.BULK_ENQUEUE, "new-queue");
    params.setMessageCount(12);
    params.setProducerCount(3);

    runner(params).run();

    assertThat(gateway.ensureQueueCalls()).isEqualTo(1);
    assertThat(gateway.size("new-queue")).isEqualTo(12);
    assertThat(console())
        .contains("Sent 12 message(s)")
        .contains(Producer.STOP_REASON_PRODUCER_MESSAGE_LIMIT + " [3]");
  }

  @Test
  void queueSetupFailureIsReported() {
    gateway.failEnsureQueue = true;
    assertThatThrownBy(() -> runner(params(RunMode.BULK_DEQUEUE, "q")).run())
        .isInstanceOf(PerfTestException.class)
        .hasMessageStartingWith("Could not set up queue q");
  }

  LoadRunner runner(RunParams params) {
    return new LoadRunner(
        gateway,
        params,
        new MessageTagger(TestUtils.fixedTimestampProvider(NOW)),
        index -> TestUtils.BODY,
        PerformanceMetrics.NO_OP,
        new ReportSink(new PrintStream(out, true)));
  }

  static RunParams params(RunMode mode, String queue) {
    RunParams params = new RunParams();
    params.setMode(mode);
    params.setQueue(queue);
    return params;
  }

  String console() {
    return new String(out.toByteArray(), StandardCharsets.UTF_8);
  }

  static Map<String, Integer> reasons(String reasons) {
    Map<String, Integer> result = new LinkedHashMap<>();
    if (reasons.isEmpty()) {
      return result;
    }
    for (String reason : reasons.split(" ")) {
      String[] nameCount = reason.split("=");
      result.put(nameCount[0], Integer.parseInt(nameCount[1]));
    }
    return result;
  }
}

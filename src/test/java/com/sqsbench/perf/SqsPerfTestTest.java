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

import static com.sqsbench.perf.SqsPerfTest.LONG_OPTION_TO_ENVIRONMENT_VARIABLE;
import static org.assertj.core.api.Assertions.assertThat;

import com.sqsbench.perf.SqsPerfTest.PerfTestOptions;
import com.sqsbench.perf.SqsPerfTest.SystemExiter;
import com.sqsbench.perf.gateway.GatewayConfiguration;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class SqsPerfTestTest {

  ByteArrayOutputStream out, err;
  RecordingSystemExiter systemExiter;
  InMemoryQueueGateway gateway;
  AtomicInteger gatewayCreations;
  AtomicReference<GatewayConfiguration> gatewayConfiguration;
  Map<String, String> env;

  @BeforeEach
  void init() {
    out = new ByteArrayOutputStream();
    err = new ByteArrayOutputStream();
    systemExiter = new RecordingSystemExiter();
    gateway = new InMemoryQueueGateway();
    gatewayCreations = new AtomicInteger(0);
    gatewayConfiguration = new AtomicReference<>();
    env = new HashMap<>();
  }

  @Test
  void longOptionToEnvironmentVariable() {
    String[][] parameters = {
      {"mode", "MODE"},
      {"message-count", "MESSAGE_COUNT"},
      {"time-bound-producers", "TIME_BOUND_PRODUCERS"},
      {"empty-receive-backoff", "EMPTY_RECEIVE_BACKOFF"},
    };
    for (String[] parameter : parameters) {
      assertThat(LONG_OPTION_TO_ENVIRONMENT_VARIABLE.apply(parameter[0])).isEqualTo(parameter[1]);
    }
  }

  @Test
  void helpExitsWithoutRunning() {
    run("-?");
    assertThat(systemExiter.status()).isZero();
    assertThat(systemExiter.exitCount()).isEqualTo(1);
    assertThat(consoleOut()).contains("--mode").contains("--batch-size");
    assertThat(gatewayCreations).hasValue(0);
  }

  @Test
  void environmentVariablesUsage() {
    run("-env");
    assertThat(systemExiter.status()).isZero();
    assertThat(consoleOut()).contains("MODE").contains("MESSAGE_COUNT");
  }

  @Test
  void versionInformation() {
    run("-v");
    assertThat(systemExiter.status()).isZero();
    assertThat(consoleOut()).contains("SQS Perf Test").contains("Java version");
  }

  @Test
  void missingModeIsRejected() {
    run("-C", "10");
    assertThat(systemExiter.status()).isEqualTo(1);
    assertThat(systemExiter.exitCount()).isEqualTo(1);
    assertThat(consoleErr()).contains("No mode specified").contains("tbbd");
    assertThat(gatewayCreations).hasValue(0);
  }

  @Test
  void invalidModeIsRejected() {
    run("-m", "zz");
    assertThat(systemExiter.status()).isEqualTo(1);
    assertThat(systemExiter.exitCount()).isEqualTo(1);
    assertThat(consoleErr()).contains("Invalid mode 'zz'");
    assertThat(gatewayCreations).hasValue(0);
  }

  @ParameterizedTest
  @ValueSource(strings = {"0", "11"})
  void batchSizeOutOfRangeIsRejected(String batchSize) {
    run("-m", "bd", "-bs", batchSize);
    assertThat(systemExiter.status()).isEqualTo(1);
    assertThat(consoleErr()).contains("Batch size must be between 1 and 10");
    assertThat(gatewayCreations).hasValue(0);
  }

  @Test
  void invalidNumberIsRejected() {
    run("-m", "e", "-C", "many");
    assertThat(systemExiter.status()).isEqualTo(1);
    assertThat(consoleErr()).contains("Invalid numeric value");
  }

  @Test
  void unknownOptionPrintsUsage() {
    run("--not-an-option");
    assertThat(systemExiter.status()).isEqualTo(1);
    assertThat(consoleErr()).contains("Parsing failed").contains("--mode");
  }

  @Test
  void enqueueThenDequeue() {
    run("-m", "e", "-C", "20", "-x", "4", "-i", "0", "-u", "q1");
    assertThat(systemExiter.status()).isZero();
    assertThat(consoleOut()).contains("Starting enqueuer").contains("Sent 20 message(s)");
    assertThat(gateway.size("q1")).isEqualTo(20);

    out.reset();
    systemExiter = new RecordingSystemExiter();
    run("-m", "d", "-C", "20", "-y", "2", "-i", "0", "-u", "q1");
    assertThat(systemExiter.status()).isZero();
    assertThat(systemExiter.exitCount()).isEqualTo(1);
    assertThat(consoleOut())
        .contains("Starting dequeuer")
        .contains("Average latency for 20 message(s)")
        .contains("test stopped");
    assertThat(gateway.size("q1")).isZero();
    assertThat(gateway.closed).isTrue();
  }

  @Test
  void settingsCanComeFromEnvironment() {
    env.put("MODE", "bulk-enqueue");
    env.put("MESSAGE_COUNT", "5");
    env.put("INTERVAL", "0");
    env.put("QUEUE", "from-env");
    run();
    assertThat(systemExiter.status()).isZero();
    assertThat(gateway.size("from-env")).isEqualTo(5);
  }

  @Test
  void gatewayConfigurationComesFromArguments() {
    run(
        "-m", "e", "-C", "1", "-i", "0",
        "--region", "us-east-1", "--endpoint", "http://localhost:4566", "-w", "3");
    assertThat(systemExiter.status()).isZero();
    assertThat(gatewayConfiguration.get().getRegion()).isEqualTo("us-east-1");
    assertThat(gatewayConfiguration.get().getEndpoint()).isEqualTo("http://localhost:4566");
    assertThat(gatewayConfiguration.get().getReceiveWaitTimeInSeconds()).isEqualTo(3);
  }

  @Test
  void batchDequeueWritesLatencyFile(@TempDir Path tempDir) throws IOException {
    gateway.ensureQueue("q2");
    long now = System.currentTimeMillis();
    for (int i = 1; i <= 15; i++) {
      gateway.offer("q2", TestUtils.BODY, TestUtils.enqueuedBefore(i, now, 5));
    }
    Path latencies = tempDir.resolve("latencies.txt");
    run("-m", "bd", "-C", "15", "-y", "3", "-i", "0", "-u", "q2", "-o", latencies.toString());
    assertThat(systemExiter.status()).isZero();
    List<String> lines = Files.readAllLines(latencies);
    assertThat(lines).hasSize(15);
    assertThat(lines).allSatisfy(line -> assertThat(Long.parseLong(line)).isNotNegative());
    assertThat(consoleOut())
        .contains("Wrote 15 latencies to " + latencies)
        .contains("Latency min/median/75th/95th/99th");
  }

  @Test
  void roundTrip() {
    run("-m", "rt", "-C", "3", "-i", "0", "-u", "q3");
    assertThat(systemExiter.status()).isZero();
    assertThat(consoleOut()).contains("Average latency for 3 message(s)");
    assertThat(gateway.size("q3")).isZero();
  }

  @Test
  void queueSetupFailureIsFatal() {
    gateway.failEnsureQueue = true;
    run("-m", "e", "-C", "5", "-i", "0");
    assertThat(systemExiter.status()).isEqualTo(1);
    assertThat(systemExiter.exitCount()).isEqualTo(1);
    assertThat(consoleErr()).contains("Could not set up queue benchmark-queue");
    assertThat(gateway.sent()).isEmpty();
    assertThat(gateway.closed).isTrue();
  }

  @Test
  void listQueues() {
    gateway.ensureQueue("a");
    run("-lq");
    assertThat(systemExiter.status()).isZero();
    assertThat(consoleOut())
        .contains("List of queues in eu-west-2")
        .contains("0: " + InMemoryQueueGateway.queueUrl("a"));
  }

  @Test
  void deleteQueue() {
    gateway.ensureQueue("to-delete");
    run("-dq", "-u", "to-delete");
    assertThat(systemExiter.status()).isZero();
    assertThat(consoleOut())
        .contains("Queue deleted: " + InMemoryQueueGateway.queueUrl("to-delete"));
    assertThat(gateway.listQueues()).isEmpty();
  }

  void run(String... args) {
    Function<String, String> envLookup = variable -> env.get(variable);
    PerfTestOptions options =
        new PerfTestOptions()
            .setSystemExiter(systemExiter)
            .setShutdownService(new ShutdownService())
            .setConsoleOut(new PrintStream(out, true))
            .setConsoleErr(new PrintStream(err, true))
            .setArgumentLookup(LONG_OPTION_TO_ENVIRONMENT_VARIABLE.andThen(envLookup))
            .setGatewayFactory(
                configuration -> {
                  gatewayCreations.incrementAndGet();
                  gatewayConfiguration.set(configuration);
                  return gateway;
                });
    SqsPerfTest.main(args, options);
  }

  String consoleOut() {
    return new String(out.toByteArray(), StandardCharsets.UTF_8);
  }

  String consoleErr() {
    return new String(err.toByteArray(), StandardCharsets.UTF_8);
  }

  private static class RecordingSystemExiter implements SystemExiter {

    private AtomicInteger exitCount = new AtomicInteger(0);
    private AtomicInteger lastStatus = new AtomicInteger(-1);

    @Override
    public void exit(int status) {
      exitCount.incrementAndGet();
      lastStatus.set(status);
    }

    int exitCount() {
      return exitCount.get();
    }

    int status() {
      return lastStatus.get();
    }
  }
}

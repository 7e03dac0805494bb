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
import static com.sqsbench.perf.metrics.MetricsFormatterUtils.NANO_TO_MILLI;
import static com.sqsbench.perf.metrics.MetricsFormatterUtils.formatLatency;

import com.sqsbench.perf.PerfTestException;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Writes the results of a run: the console report and the latency file. */
public class ReportSink {

  private static final Logger LOGGER = LoggerFactory.getLogger(ReportSink.class);

  private final PrintStream out;

  public ReportSink(PrintStream out) {
    this.out = out;
  }

  /**
   * Write one sample per line, in iteration order. The file is created or truncated.
   *
   * @param file
   * @param samples
   * @throws PerfTestException if the file cannot be written
   */
  public void writeSamples(Path file, Collection<Long> samples) {
    LOGGER.debug("Writing {} sample(s) to {}", samples.size(), file);
    try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
      for (Long sample : samples) {
        writer.write(Long.toString(sample));
        writer.write('\n');
      }
      writer.flush();
    } catch (IOException e) {
      throw new PerfTestException("Could not write latencies to " + file, e);
    }
    out.println("Wrote " + samples.size() + " latencies to " + file);
  }

  /**
   * Print the count and mean latency of a run, and the latency distribution.
   *
   * @param aggregator
   * @throws com.sqsbench.perf.NoSamplesException if no latency was recorded
   */
  public void report(LatencyAggregator aggregator) {
    long count = aggregator.count();
    long mean = aggregator.mean();
    out.printf(
        "Average latency for %d message(s) is %d ns (%d ms)%n", count, mean, mean / NANO_TO_MILLI);
    out.println("Latency " + LATENCY_HEADER + ": " + formatLatency(aggregator.percentiles()));
  }

  public void sent(long count) {
    out.println("Sent " + count + " message(s)");
  }

  public void println(String line) {
    out.println(line);
  }
}

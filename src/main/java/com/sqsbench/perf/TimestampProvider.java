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

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.TimeUnit;

/**
 * Wall-clock time with nanosecond resolution.
 *
 * <p>Producers and consumers usually run in different processes, so the monotonic {@link
 * System#nanoTime()} cannot be used: timestamps are nanoseconds since the epoch.
 */
public class TimestampProvider {

  public static final TimestampProvider SYSTEM = new TimestampProvider(Clock.systemUTC());

  private final Clock clock;

  public TimestampProvider(Clock clock) {
    this.clock = clock;
  }

  public long getCurrentTime() {
    Instant now = clock.instant();
    return TimeUnit.SECONDS.toNanos(now.getEpochSecond()) + now.getNano();
  }

  /**
   * Difference between 2 timestamps, 0 if the later timestamp is before the earlier one (clock
   * skew between hosts).
   */
  public long getDifference(long later, long earlier) {
    return Math.max(0, later - earlier);
  }
}

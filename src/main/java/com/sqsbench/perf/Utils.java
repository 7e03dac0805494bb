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
import java.util.concurrent.ThreadLocalRandom;

final class Utils {

  private Utils() {}

  static String strArg(CommandLineProxy cmd, String opt, String def) {
    return cmd.getOptionValue(opt, def);
  }

  static int intArg(CommandLineProxy cmd, String opt, int def) {
    return Integer.parseInt(cmd.getOptionValue(opt, Integer.toString(def)).trim());
  }

  static long longArg(CommandLineProxy cmd, String opt, long def) {
    return Long.parseLong(cmd.getOptionValue(opt, Long.toString(def)).trim());
  }

  /**
   * Random duration between half and all of the base duration.
   *
   * @param base
   * @return the jittered duration, zero if the base is zero or negative
   */
  static Duration jitter(Duration base) {
    long millis = base.toMillis();
    if (millis <= 0) {
      return Duration.ZERO;
    }
    long half = millis / 2;
    return Duration.ofMillis(half + ThreadLocalRandom.current().nextLong(millis - half + 1));
  }
}

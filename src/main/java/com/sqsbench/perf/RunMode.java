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

import java.util.Locale;

/** The workloads the tool can run, selected by their short code or their long name. */
public enum RunMode {
  BULK_ENQUEUE("e", "bulk-enqueue", false),
  TIME_BOUND_ENQUEUE("tbe", "time-bound-enqueue", true),
  BULK_DEQUEUE("d", "bulk-dequeue", false),
  BULK_BATCH_DEQUEUE("bd", "bulk-batch-dequeue", false),
  TIME_BOUND_BATCH_DEQUEUE("tbbd", "time-bound-batch-dequeue", true),
  ROUND_TRIP("rt", "round-trip", false);

  private final String code;
  private final String longName;
  private final boolean timeBound;

  RunMode(String code, String longName, boolean timeBound) {
    this.code = code;
    this.longName = longName;
    this.timeBound = timeBound;
  }

  /**
   * Find a mode by its code or long name, case-insensitive.
   *
   * @param value
   * @return the mode, <code>null</code> if the value matches no mode
   */
  static RunMode lookup(String value) {
    if (value == null) {
      return null;
    }
    String candidate = value.trim().toLowerCase(Locale.ENGLISH);
    for (RunMode mode : values()) {
      if (mode.code.equals(candidate) || mode.longName.equals(candidate)) {
        return mode;
      }
    }
    return null;
  }

  static String validValues() {
    StringBuilder builder = new StringBuilder();
    for (RunMode mode : values()) {
      if (builder.length() > 0) {
        builder.append(", ");
      }
      builder.append(mode.code).append(" (").append(mode.longName).append(")");
    }
    return builder.toString();
  }

  boolean isTimeBound() {
    return timeBound;
  }
}

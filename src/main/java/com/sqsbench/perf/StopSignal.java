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

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cancellation token shared by the workers of a pool. Workers poll it between two operations on
 * the queue.
 */
final class StopSignal {

  private final AtomicBoolean stopped = new AtomicBoolean(false);
  private final AtomicReference<PerfTestException> failure = new AtomicReference<>();

  /**
   * Ask workers to stop.
   *
   * @return true if this call fired the signal
   */
  boolean stop() {
    return stopped.compareAndSet(false, true);
  }

  boolean isStopped() {
    return stopped.get();
  }

  /** Record a fatal error (only the first one is kept) and stop all workers. */
  void fail(PerfTestException exception) {
    failure.compareAndSet(null, exception);
    stop();
  }

  PerfTestException failure() {
    return failure.get();
  }
}

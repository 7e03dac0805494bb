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

import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A {@link ThreadFactory} that names threads with a prefix and a sequence number.
 *
 * <p>Threads are daemon threads by default: workers of time-bound runs are abandoned at the
 * deadline and must not keep the JVM alive.
 */
public class NamedThreadFactory implements ThreadFactory {

  private final ThreadFactory backingThreadFactory;

  private final String prefix;

  private final boolean daemon;

  private final AtomicLong count = new AtomicLong(0);

  public NamedThreadFactory(String prefix) {
    this(prefix, true);
  }

  public NamedThreadFactory(String prefix, boolean daemon) {
    this.backingThreadFactory = Executors.defaultThreadFactory();
    this.prefix = prefix;
    this.daemon = daemon;
  }

  @Override
  public Thread newThread(Runnable r) {
    Thread thread = this.backingThreadFactory.newThread(r);
    thread.setName(prefix + count.getAndIncrement());
    thread.setDaemon(daemon);
    return thread;
  }
}

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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registers closing callbacks (gateway client, executors, metrics) and calls them in reverse order
 * of registration. Each callback runs at most once, whether it is called individually or through
 * {@link #close()}.
 */
public class ShutdownService implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(ShutdownService.class);

  private final List<NamedCloseable> closeables = Collections.synchronizedList(new ArrayList<>());

  AutoCloseable wrap(CloseCallback closeCallback) {
    return wrap("callback-" + closeables.size(), closeCallback);
  }

  /**
   * Wrap and register the callback into an idempotent {@link AutoCloseable}.
   *
   * @param name used in logs
   * @param closeCallback
   * @return the callback as an idempotent {@link AutoCloseable}
   */
  AutoCloseable wrap(String name, CloseCallback closeCallback) {
    NamedCloseable closeable = new NamedCloseable(name, closeCallback);
    closeables.add(closeable);
    return closeable;
  }

  @Override
  public void close() {
    List<NamedCloseable> snapshot;
    synchronized (closeables) {
      snapshot = new ArrayList<>(closeables);
    }
    for (int i = snapshot.size() - 1; i >= 0; i--) {
      NamedCloseable closeable = snapshot.get(i);
      try {
        closeable.close();
      } catch (Exception e) {
        LOGGER.warn("Could not properly close {}", closeable.name, e);
      }
    }
  }

  @FunctionalInterface
  interface CloseCallback {

    void run() throws Exception;
  }

  private static final class NamedCloseable implements AutoCloseable {

    private final String name;
    private final CloseCallback callback;
    private final AtomicBoolean closingOrAlreadyClosed = new AtomicBoolean(false);

    private NamedCloseable(String name, CloseCallback callback) {
      this.name = name;
      this.callback = callback;
    }

    @Override
    public void close() throws Exception {
      if (closingOrAlreadyClosed.compareAndSet(false, true)) {
        LOGGER.debug("Closing {}", name);
        callback.run();
      }
    }
  }
}

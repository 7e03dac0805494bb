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

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Version of the tool, read from a property file generated at build time, with the package
 * implementation version as a fallback.
 */
public final class Version {

  public static final String VERSION, BUILD_TIMESTAMP;

  static final String PROPERTY_FILE = "sqs-perf-test.properties";

  private static final Logger LOGGER = LoggerFactory.getLogger(Version.class);

  static {
    Properties properties = loadProperties();
    VERSION = version(properties);
    BUILD_TIMESTAMP = properties.getProperty("com.sqsbench.perf.build.timestamp", "unknown");
  }

  private Version() {}

  private static Properties loadProperties() {
    Properties properties = new Properties();
    try (InputStream inputStream =
        Version.class.getClassLoader().getResourceAsStream(PROPERTY_FILE)) {
      if (inputStream == null) {
        LOGGER.warn("Property file {} not found", PROPERTY_FILE);
      } else {
        properties.load(inputStream);
      }
    } catch (IOException e) {
      LOGGER.warn("Could not read property file {}", PROPERTY_FILE, e);
    }
    return properties;
  }

  private static String version(Properties properties) {
    String version = properties.getProperty("com.sqsbench.perf.version");
    if (version == null || version.startsWith("${")) {
      version = Version.class.getPackage().getImplementationVersion();
    }
    return version == null ? "0.0.0" : version;
  }
}

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

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import ch.qos.logback.core.util.StatusPrinter;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.LoggerFactory;

/**
 * Configure logback from the bundled configuration file.
 *
 * <p>Logger levels can be set with the <code>sqs.perftest.loggers</code> system property or the
 * <code>SQS_PERF_TEST_LOGGERS</code> environment variable, e.g. <code>
 * com.sqsbench.perf=debug,software.amazon.awssdk=info</code>. Nothing is done if <code>
 * logback.configurationFile</code> is set.
 */
public class Log {

  static final String LOGGERS_SYSTEM_PROPERTY = "sqs.perftest.loggers";
  static final String LOGGERS_ENVIRONMENT_VARIABLE = "SQS_PERF_TEST_LOGGERS";
  static final String CONFIGURATION_FILE = "/logback-sqs-perf-test.xml";

  public static void configureLog() throws IOException {
    if (System.getProperty("logback.configurationFile") == null) {
      String loggers =
          System.getProperty(LOGGERS_SYSTEM_PROPERTY) == null
              ? System.getenv(LOGGERS_ENVIRONMENT_VARIABLE)
              : System.getProperty(LOGGERS_SYSTEM_PROPERTY);
      LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
      try (InputStream configurationFile = Log.class.getResourceAsStream(CONFIGURATION_FILE)) {
        if (configurationFile == null) {
          return;
        }
        String configuration = processConfigurationFile(configurationFile, loggerLevels(loggers));
        JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        context.reset();
        configurator.doConfigure(
            new ByteArrayInputStream(configuration.getBytes(StandardCharsets.UTF_8)));
      } catch (JoranException je) {
        // StatusPrinter will handle this
      }
      StatusPrinter.printInCaseOfErrorsOrWarnings(context);
    }
  }

  /**
   * Parse a <code>logger=level</code> comma-separated list.
   *
   * @param loggers
   * @return the levels by logger name, in declaration order, never null
   */
  static Map<String, String> loggerLevels(String loggers) {
    Map<String, String> levels = new LinkedHashMap<>();
    if (loggers == null || loggers.trim().isEmpty()) {
      return levels;
    }
    for (String entry : loggers.split(",")) {
      String[] nameLevel = entry.trim().split("=");
      if (nameLevel.length == 2 && !nameLevel[0].isEmpty()) {
        levels.put(nameLevel[0], nameLevel[1]);
      }
    }
    return levels;
  }

  static String processConfigurationFile(
      InputStream configurationFile, Map<String, String> loggers) throws IOException {
    StringBuilder loggersConfiguration = new StringBuilder();
    if (loggers != null) {
      for (Map.Entry<String, String> logger : loggers.entrySet()) {
        loggersConfiguration.append(
            String.format(
                "\t<logger name=\"%s\" level=\"%s\" />%s",
                logger.getKey(), logger.getValue(), System.lineSeparator()));
      }
    }

    Reader in = new InputStreamReader(configurationFile, StandardCharsets.UTF_8);
    char[] buffer = new char[1024];
    StringBuilder builder = new StringBuilder();
    int charsRead;
    while ((charsRead = in.read(buffer, 0, buffer.length)) > 0) {
      builder.append(buffer, 0, charsRead);
    }

    return builder.toString().replace("${loggers}", loggersConfiguration);
  }
}

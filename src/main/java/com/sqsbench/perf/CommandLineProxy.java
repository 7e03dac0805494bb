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

import java.util.function.Function;
import java.util.function.Supplier;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;

/**
 * Wraps a {@link CommandLine} so that an external lookup (environment variables by default) can
 * set or override arguments. The lookup receives the long name of the option.
 *
 * <p>{@link CommandLine} cannot be subclassed, hence the proxy.
 */
public class CommandLineProxy {

  private final CommandLine delegate;

  private final Function<String, String> argumentLookup;

  public CommandLineProxy(
      Options options, CommandLine delegate, Function<String, String> argumentLookup) {
    this.delegate = delegate;
    Function<String, String> optionToLongOption =
        option -> {
          Option opt = options.getOption(option);
          return opt == null ? null : opt.getLongOpt();
        };
    this.argumentLookup =
        optionToLongOption.andThen(
            longOption -> longOption == null ? null : argumentLookup.apply(longOption));
  }

  public boolean hasOption(String opt) {
    String value = argumentLookup.apply(opt);
    return value == null ? delegate.hasOption(opt) : Boolean.parseBoolean(value);
  }

  public String getOptionValue(String opt) {
    return override(opt, () -> delegate.getOptionValue(opt));
  }

  public String getOptionValue(String opt, String def) {
    return override(opt, () -> delegate.getOptionValue(opt, def));
  }

  private String override(String opt, Supplier<String> argumentValue) {
    String value = argumentLookup.apply(opt);
    return value == null ? argumentValue.get() : value;
  }
}

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

import static java.util.stream.IntStream.range;
import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class UtilsTest {

  @ValueSource(longs = {1, 2, 100, 1000})
  @ParameterizedTest
  void jitterStaysBetweenHalfAndFullDuration(long millis) {
    Duration base = Duration.ofMillis(millis);
    range(0, 100)
        .forEach(
            i ->
                assertThat(Utils.jitter(base).toMillis())
                    .isBetween(millis / 2, millis));
  }

  @Test
  void jitterOfZeroIsZero() {
    assertThat(Utils.jitter(Duration.ZERO)).isEqualTo(Duration.ZERO);
    assertThat(Utils.jitter(Duration.ofMillis(-5))).isEqualTo(Duration.ZERO);
  }
}

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
package com.sqsbench.perf.gateway;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a batch acknowledgement: the tokens the queue service accepted and the ones it
 * rejected, with the reason of each rejection.
 */
public final class BatchAcknowledgement {

  static final BatchAcknowledgement EMPTY =
      new BatchAcknowledgement(Collections.emptyList(), Collections.emptyMap());

  private final List<String> acknowledged;
  private final Map<String, String> failed;

  public BatchAcknowledgement(List<String> acknowledged, Map<String, String> failed) {
    this.acknowledged = Collections.unmodifiableList(acknowledged);
    this.failed = Collections.unmodifiableMap(failed);
  }

  public List<String> acknowledged() {
    return acknowledged;
  }

  /** Failed tokens mapped to the error reported for each of them. */
  public Map<String, String> failed() {
    return failed;
  }

  public boolean isComplete() {
    return failed.isEmpty();
  }
}

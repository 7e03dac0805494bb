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

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;

/** Uses the content of a local file as the payload of every message. */
public class LocalFileMessageBodySource implements MessageBodySource {

  private final byte[] body;

  public LocalFileMessageBodySource(String fileName) throws IOException {
    File file = new File(fileName.trim());
    if (!file.exists() || file.isDirectory()) {
      throw new IllegalArgumentException(fileName + " isn't a valid body file.");
    }
    this.body = Files.readAllBytes(file.toPath());
  }

  @Override
  public byte[] create(long sequenceNumber) {
    return body;
  }
}

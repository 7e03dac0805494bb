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

import com.google.gson.Gson;
import com.google.gson.JsonObject;
import java.nio.charset.StandardCharsets;

/**
 * Default payload: an SMS delivery record, serialized once. All messages carry the same body, only
 * the metadata changes.
 */
class SampleJsonMessageBodySource implements MessageBodySource {

  private final byte[] body;

  SampleJsonMessageBodySource() {
    this.body = new Gson().toJson(sample()).getBytes(StandardCharsets.UTF_8);
  }

  static JsonObject sample() {
    JsonObject message = new JsonObject();
    message.addProperty("src", "972525626731");
    message.addProperty("dst", "972502224696");
    message.addProperty("prefix", "972502224696");
    message.addProperty("url", "");
    message.addProperty("method", "POST");
    message.addProperty(
        "text",
        "\u05dc\u05e7\u05d5\u05d7 \u05d9\u05e7\u05e8 \u05e2\u05e7\u05d1 \u05ea\u05e7\u05dc\u05d4 STOP");
    message.addProperty("log_sms", "true");
    message.addProperty("message_uuid", "ffe2bb44-d34f-4359-a7d7-217bf4e9f705");
    message.addProperty("message_time", "2017-07-13 13:12:47.046303");
    message.addProperty("carrier_rate", "0.0065");
    message.addProperty("carrier_amount", "0.013");
    message.addProperty("is_gsm", false);
    message.addProperty("is_unicode", true);
    message.addProperty("units", "2");

    JsonObject authInfo = new JsonObject();
    authInfo.addProperty("auth_id", "MANZE1ODRHYWFIZGMXNJ");
    authInfo.addProperty("auth_token", "NWRjNjU3ZDJhZDM0ZjE5NWE5ZWRmYTNmOGIzNGZm");
    authInfo.addProperty("api_id", "de124d64-6186-11e7-920b-0600a1193e9b");
    authInfo.addProperty("api_method", "POST");
    authInfo.addProperty("api_name", "/api/v1/Message/");
    authInfo.addProperty("account_id", "48844");
    authInfo.addProperty("subaccount_id", "0");
    authInfo.addProperty("parent_auth_id", "MANZE1ODRHYWFIZGMXNJ");
    message.add("auth_info", authInfo);
    return message;
  }

  @Override
  public byte[] create(long sequenceNumber) {
    return body;
  }
}

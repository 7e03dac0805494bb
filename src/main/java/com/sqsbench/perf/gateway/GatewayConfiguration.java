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

/** Connection settings for the queue service. */
public class GatewayConfiguration {

  private String region = "eu-west-2";
  private String endpoint;
  private String profile;
  private int receiveWaitTimeInSeconds = 0;

  public String getRegion() {
    return region;
  }

  public GatewayConfiguration setRegion(String region) {
    this.region = region;
    return this;
  }

  /** Endpoint override, <code>null</code> to use the endpoint of the region. */
  public String getEndpoint() {
    return endpoint;
  }

  public GatewayConfiguration setEndpoint(String endpoint) {
    this.endpoint = endpoint;
    return this;
  }

  /** Profile of the shared credentials file, <code>null</code> for the default chain. */
  public String getProfile() {
    return profile;
  }

  public GatewayConfiguration setProfile(String profile) {
    this.profile = profile;
    return this;
  }

  public int getReceiveWaitTimeInSeconds() {
    return receiveWaitTimeInSeconds;
  }

  public GatewayConfiguration setReceiveWaitTimeInSeconds(int receiveWaitTimeInSeconds) {
    this.receiveWaitTimeInSeconds = receiveWaitTimeInSeconds;
    return this;
  }

  @Override
  public String toString() {
    return "GatewayConfiguration{region='"
        + region
        + "', endpoint='"
        + endpoint
        + "', profile='"
        + profile
        + "', receiveWaitTimeInSeconds="
        + receiveWaitTimeInSeconds
        + '}';
  }
}

/*
 * Copyright 2025 Yelp Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.yelp.ingestion.appsinstalled.memcached.sharding;

import com.google.common.collect.ImmutableMap;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/**
 * Routes records to a memcached shard by device type.
 *
 * <p>The routing table is a static mapping from device type (e.g. {@code idfa}, {@code gaid}) to a
 * {@code host:port} address. Device types without a mapping are reported as absent and must be
 * dropped by the caller.
 */
public class ShardRouter {
  private final Map<String, String> addressByDeviceType;

  public ShardRouter(Map<String, String> addressByDeviceType) {
    this.addressByDeviceType = ImmutableMap.copyOf(addressByDeviceType);
  }

  /**
   * Look up the shard for a device type.
   *
   * @param deviceType device type of the record
   * @return the shard address, or empty if the device type is unknown
   */
  public Optional<String> route(String deviceType) {
    if (deviceType == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(addressByDeviceType.get(deviceType));
  }

  public Collection<String> getAddresses() {
    return addressByDeviceType.values();
  }

  /** Human-readable description of the routing table for logging. */
  public String getDescription() {
    return "ShardRouter" + addressByDeviceType;
  }
}

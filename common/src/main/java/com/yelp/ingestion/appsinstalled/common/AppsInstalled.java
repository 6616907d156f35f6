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
package com.yelp.ingestion.appsinstalled.common;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;

/**
 * One device's installed-apps record, as read from a single line of an appsinstalled log. Device
 * type and id are always non-empty; the app list may be empty and holds uint32 ids only.
 */
public final class AppsInstalled {
  private final String deviceType;
  private final String deviceId;
  private final double lat;
  private final double lon;
  private final List<Long> apps;

  public AppsInstalled(
      String deviceType, String deviceId, double lat, double lon, List<Long> apps) {
    Preconditions.checkArgument(!Strings.isNullOrEmpty(deviceType), "deviceType must be set");
    Preconditions.checkArgument(!Strings.isNullOrEmpty(deviceId), "deviceId must be set");
    this.deviceType = deviceType;
    this.deviceId = deviceId;
    this.lat = lat;
    this.lon = lon;
    Preconditions.checkNotNull(apps, "apps must not be null");
    for (long app : apps) {
      Preconditions.checkArgument(UserApps.isValidAppId(app), "App id %s is not a uint32", app);
    }
    this.apps = ImmutableList.copyOf(apps);
  }

  public String getDeviceType() {
    return deviceType;
  }

  public String getDeviceId() {
    return deviceId;
  }

  public double getLat() {
    return lat;
  }

  public double getLon() {
    return lon;
  }

  public List<Long> getApps() {
    return apps;
  }

  /** Memcached key for this record, {@code "<device type>:<device id>"}. */
  public String getKey() {
    return deviceType + ":" + deviceId;
  }

  /** Value payload for this record. */
  public UserApps toUserApps() {
    return new UserApps(lat, lon, apps);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof AppsInstalled)) {
      return false;
    }
    AppsInstalled that = (AppsInstalled) o;
    return Double.compare(that.lat, lat) == 0
        && Double.compare(that.lon, lon) == 0
        && deviceType.equals(that.deviceType)
        && deviceId.equals(that.deviceId)
        && apps.equals(that.apps);
  }

  @Override
  public int hashCode() {
    return Objects.hash(deviceType, deviceId, lat, lon, apps);
  }

  @Override
  public String toString() {
    return "AppsInstalled{"
        + "deviceType='"
        + deviceType
        + '\''
        + ", deviceId='"
        + deviceId
        + '\''
        + ", lat="
        + lat
        + ", lon="
        + lon
        + ", apps="
        + apps
        + '}';
  }
}

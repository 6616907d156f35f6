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
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;

/**
 * The value stored in memcached for one device: its location and installed app ids. App ids are
 * unsigned 32-bit values, held as longs in {@code [0, MAX_APP_ID]}.
 */
public final class UserApps {
  public static final long MAX_APP_ID = 0xFFFFFFFFL;

  private final double lat;
  private final double lon;
  private final List<Long> apps;

  public UserApps(double lat, double lon, List<Long> apps) {
    for (long app : apps) {
      Preconditions.checkArgument(isValidAppId(app), "App id %s is not a uint32", app);
    }
    this.lat = lat;
    this.lon = lon;
    this.apps = ImmutableList.copyOf(apps);
  }

  public static boolean isValidAppId(long app) {
    return app >= 0 && app <= MAX_APP_ID;
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

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof UserApps)) {
      return false;
    }
    UserApps userApps = (UserApps) o;
    return Double.compare(userApps.lat, lat) == 0
        && Double.compare(userApps.lon, lon) == 0
        && apps.equals(userApps.apps);
  }

  @Override
  public int hashCode() {
    return Objects.hash(lat, lon, apps);
  }

  /** Single-line form used when logging dry-run writes. */
  @Override
  public String toString() {
    return "lat: " + lat + " lon: " + lon + " apps: " + apps;
  }
}

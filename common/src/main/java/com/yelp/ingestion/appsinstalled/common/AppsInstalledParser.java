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

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.primitives.Doubles;
import com.google.common.primitives.Longs;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses appsinstalled log lines of the form
 *
 * <pre>
 * device_type \t device_id \t lat \t lon \t app1,app2,...
 * </pre>
 *
 * <p>Lines with fewer than five fields or an empty device type/id are rejected. Bad app ids and
 * bad coordinates are tolerated: app tokens that are not uint32 numbers are dropped and an
 * unparseable coordinate becomes {@code 0.0}, with a warning logged in both cases.
 */
public final class AppsInstalledParser {
  private static final Logger LOGGER = LoggerFactory.getLogger(AppsInstalledParser.class);

  static final int FIELD_COUNT = 5;
  static final double INVALID_COORDINATE = 0.0;

  private static final Splitter FIELD_SPLITTER = Splitter.on('\t');
  private static final Splitter APPS_SPLITTER = Splitter.on(',').trimResults();
  private static final CharMatcher DIGITS = CharMatcher.inRange('0', '9');

  private AppsInstalledParser() {}

  /**
   * Parse one log line.
   *
   * @param line raw line, surrounding whitespace is ignored
   * @return the record, or empty if the line is malformed
   */
  public static Optional<AppsInstalled> parse(String line) {
    if (line == null) {
      return Optional.empty();
    }
    List<String> parts = FIELD_SPLITTER.splitToList(line.strip());
    if (parts.size() < FIELD_COUNT) {
      return Optional.empty();
    }
    String deviceType = parts.get(0);
    String deviceId = parts.get(1);
    if (deviceType.isEmpty() || deviceId.isEmpty()) {
      return Optional.empty();
    }

    List<Long> apps = parseApps(parts.get(4), line);

    Double lat = Doubles.tryParse(parts.get(2).strip());
    Double lon = Doubles.tryParse(parts.get(3).strip());
    if (lat == null || lon == null) {
      LOGGER.warn("Invalid geo coords: {}", line);
    }

    return Optional.of(
        new AppsInstalled(
            deviceType,
            deviceId,
            lat == null ? INVALID_COORDINATE : lat,
            lon == null ? INVALID_COORDINATE : lon,
            apps));
  }

  private static List<Long> parseApps(String rawApps, String line) {
    List<String> tokens = APPS_SPLITTER.splitToList(rawApps);
    List<Long> apps = new ArrayList<>(tokens.size());
    boolean lenient = false;
    for (String token : tokens) {
      Long app = parseAppId(token);
      if (app == null) {
        lenient = true;
        break;
      }
      apps.add(app);
    }
    if (!lenient) {
      return apps;
    }

    apps.clear();
    for (String token : tokens) {
      if (!token.isEmpty() && DIGITS.matchesAllOf(token)) {
        Long app = parseAppId(token);
        if (app != null) {
          apps.add(app);
        }
      }
    }
    LOGGER.warn("Not all user apps are digits: {}", line);
    return apps;
  }

  /** @return the id, or null unless the token is a number in the uint32 range */
  private static Long parseAppId(String token) {
    Long app = Longs.tryParse(token);
    return app != null && UserApps.isValidAppId(app) ? app : null;
  }
}

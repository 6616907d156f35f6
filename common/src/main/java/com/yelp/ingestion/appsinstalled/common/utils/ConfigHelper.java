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
package com.yelp.ingestion.appsinstalled.common.utils;

import java.util.Map;

/**
 * Helper for reading loader configuration maps.
 *
 * <p>Keys are looked up verbatim first (flat keys such as {@code worker.threads}); when no such key
 * exists the path is navigated as dot-separated nested maps, so the same value may be written
 * either way in YAML.
 */
public class ConfigHelper {

  private ConfigHelper() {}

  public static String getString(Map<String, Object> config, String path) {
    Object value = lookup(config, path);
    if (value == null) {
      throw new IllegalArgumentException("Required configuration '" + path + "' is missing");
    }
    return value.toString();
  }

  public static String getString(Map<String, Object> config, String path, String defaultValue) {
    Object value = lookup(config, path);
    return value == null ? defaultValue : value.toString();
  }

  public static int getInteger(Map<String, Object> config, String path, int defaultValue) {
    Object value = lookup(config, path);
    if (value == null) {
      return defaultValue;
    }
    if (value instanceof Integer) {
      return (Integer) value;
    }
    try {
      return Integer.parseInt(value.toString().trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid integer value for '" + path + "': " + value, e);
    }
  }

  public static long getLong(Map<String, Object> config, String path, long defaultValue) {
    Object value = lookup(config, path);
    if (value == null) {
      return defaultValue;
    }
    if (value instanceof Number) {
      return ((Number) value).longValue();
    }
    try {
      return Long.parseLong(value.toString().trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid long value for '" + path + "': " + value, e);
    }
  }

  public static double getDouble(Map<String, Object> config, String path, double defaultValue) {
    Object value = lookup(config, path);
    if (value == null) {
      return defaultValue;
    }
    if (value instanceof Number) {
      return ((Number) value).doubleValue();
    }
    try {
      return Double.parseDouble(value.toString().trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid double value for '" + path + "': " + value, e);
    }
  }

  public static boolean getBoolean(Map<String, Object> config, String path, boolean defaultValue) {
    Object value = lookup(config, path);
    if (value == null) {
      return defaultValue;
    }
    if (value instanceof Boolean) {
      return (Boolean) value;
    }
    String text = value.toString().trim();
    if ("true".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text)) {
      return Boolean.parseBoolean(text);
    }
    throw new IllegalArgumentException("Invalid boolean value for '" + path + "': " + value);
  }

  @SuppressWarnings("unchecked")
  public static Map<String, Object> getMap(Map<String, Object> config, String path) {
    Object value = lookup(config, path);
    if (value == null) {
      return null;
    }
    if (!(value instanceof Map)) {
      throw new IllegalArgumentException("Value at '" + path + "' is not a map: " + value);
    }
    return (Map<String, Object>) value;
  }

  private static Object lookup(Map<String, Object> config, String path) {
    if (config == null || path == null || path.isEmpty()) {
      return null;
    }
    if (config.containsKey(path)) {
      return config.get(path);
    }
    return navigate(config, path);
  }

  private static Object navigate(Map<String, Object> config, String path) {
    String[] parts = path.split("\\.");
    Object current = config;

    for (int i = 0; i < parts.length; i++) {
      if (!(current instanceof Map)) {
        throw new IllegalArgumentException(
            "Cannot navigate past non-map value in path '" + path + "'");
      }

      @SuppressWarnings("unchecked")
      Map<String, Object> currentMap = (Map<String, Object>) current;
      current = currentMap.get(parts[i]);

      if (current == null) {
        return null;
      }
    }

    return current;
  }
}

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
package com.yelp.ingestion.appsinstalled.memcached.client;

import java.io.IOException;

/** A connection to a single memcached shard. */
public interface MemcacheClient {

  /**
   * Store a value under a key.
   *
   * @param key memcached key
   * @param value raw value bytes
   * @return true if the server accepted the value, false if it rejected it
   * @throws IOException if the operation failed or timed out
   */
  boolean set(String key, byte[] value) throws IOException;

  /** Release the connection. Never throws. */
  void close();
}

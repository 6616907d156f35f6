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

/** Opens new connections to memcached shards. */
@FunctionalInterface
public interface MemcacheClientFactory {

  /**
   * Connect to a shard.
   *
   * @param address shard address, {@code host:port}
   * @param socketTimeoutMs timeout applied to every operation on the connection
   * @return a new client bound to the address
   * @throws IOException if the connection cannot be created
   */
  MemcacheClient connect(String address, long socketTimeoutMs) throws IOException;
}

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
package com.yelp.ingestion.appsinstalled.memcached.pool;

import com.yelp.ingestion.appsinstalled.memcached.LoaderConfig;
import com.yelp.ingestion.appsinstalled.memcached.client.MemcacheClientFactory;
import java.io.Closeable;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * The connection pools used while loading one file, one per shard address, created on first use.
 * Closing it closes every pool.
 */
public class ShardPools implements Closeable {
  private final MemcacheClientFactory clientFactory;
  private final long socketTimeoutMs;
  private final long acquireTimeoutMs;
  private final int maxIdle;
  private final Map<String, ConnectionPool> pools = new ConcurrentHashMap<>();

  public ShardPools(MemcacheClientFactory clientFactory, LoaderConfig config) {
    this.clientFactory = clientFactory;
    this.socketTimeoutMs = config.getSocketTimeoutMs();
    this.acquireTimeoutMs = config.getPollTimeoutMs();
    this.maxIdle = config.getPoolMaxIdle();
  }

  public ConnectionPool forAddress(String address) {
    return pools.computeIfAbsent(
        address,
        a -> new ConnectionPool(a, clientFactory, socketTimeoutMs, acquireTimeoutMs, maxIdle));
  }

  public Map<String, ConnectionPool> getPools() {
    return Map.copyOf(pools);
  }

  @Override
  public void close() {
    for (ConnectionPool pool : pools.values()) {
      pool.close();
    }
  }
}

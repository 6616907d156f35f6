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
package com.yelp.ingestion.appsinstalled.memcached;

import com.yelp.ingestion.appsinstalled.memcached.client.MemcacheClient;
import com.yelp.ingestion.appsinstalled.memcached.client.MemcacheClientFactory;
import java.io.IOException;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/** Memcached stand-in for tests: every shard address is a separate in-memory map. */
public class InMemoryMemcacheClientFactory implements MemcacheClientFactory {
  private final Map<String, Map<String, byte[]>> stores = new ConcurrentHashMap<>();
  private final Set<String> rejectingAddresses = ConcurrentHashMap.newKeySet();
  private final AtomicInteger connections = new AtomicInteger();
  private final AtomicInteger sets = new AtomicInteger();

  /** Make every set to the address fail as rejected by the server. */
  public void reject(String address) {
    rejectingAddresses.add(address);
  }

  public Map<String, byte[]> store(String address) {
    return stores.computeIfAbsent(address, a -> new ConcurrentHashMap<>());
  }

  public int getConnections() {
    return connections.get();
  }

  public int getSets() {
    return sets.get();
  }

  @Override
  public MemcacheClient connect(String address, long socketTimeoutMs) throws IOException {
    connections.incrementAndGet();
    Map<String, byte[]> store = store(address);
    return new MemcacheClient() {
      @Override
      public boolean set(String key, byte[] value) {
        sets.incrementAndGet();
        if (rejectingAddresses.contains(address)) {
          return false;
        }
        store.put(key, value);
        return true;
      }

      @Override
      public void close() {}
    };
  }
}

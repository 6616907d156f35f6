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
import net.spy.memcached.AddrUtil;
import net.spy.memcached.ConnectionFactory;
import net.spy.memcached.ConnectionFactoryBuilder;
import net.spy.memcached.MemcachedClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Creates spymemcached connections, one client per shard address. */
public class SpyMemcacheClientFactory implements MemcacheClientFactory {
  private static final Logger LOGGER = LoggerFactory.getLogger(SpyMemcacheClientFactory.class);

  static {
    // Route spymemcached's own logging through SLF4J
    if (System.getProperty("net.spy.log.LoggerImpl") == null) {
      System.setProperty("net.spy.log.LoggerImpl", "net.spy.memcached.compat.log.SLF4JLogger");
    }
  }

  @Override
  public MemcacheClient connect(String address, long socketTimeoutMs) throws IOException {
    ConnectionFactory connectionFactory =
        new ConnectionFactoryBuilder()
            .setProtocol(ConnectionFactoryBuilder.Protocol.TEXT)
            .setOpTimeout(socketTimeoutMs)
            .setDaemon(true)
            .build();
    try {
      MemcachedClient client =
          new MemcachedClient(connectionFactory, AddrUtil.getAddresses(address));
      LOGGER.debug("Opened memcached connection to {}", address);
      return new SpyMemcacheClient(address, client, socketTimeoutMs);
    } catch (IllegalArgumentException e) {
      throw new IOException("Invalid memcached address: " + address, e);
    }
  }
}

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
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import net.spy.memcached.MemcachedClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** {@link MemcacheClient} backed by a spymemcached client bound to one shard. */
public class SpyMemcacheClient implements MemcacheClient {
  private static final Logger LOGGER = LoggerFactory.getLogger(SpyMemcacheClient.class);

  private static final int NO_EXPIRY = 0;

  private final String address;
  private final MemcachedClient client;
  private final long timeoutMs;

  public SpyMemcacheClient(String address, MemcachedClient client, long timeoutMs) {
    this.address = address;
    this.client = client;
    this.timeoutMs = timeoutMs;
  }

  @Override
  public boolean set(String key, byte[] value) throws IOException {
    Future<Boolean> result = client.set(key, NO_EXPIRY, value, RawBytesTranscoder.INSTANCE);
    try {
      return Boolean.TRUE.equals(result.get(timeoutMs, TimeUnit.MILLISECONDS));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      result.cancel(true);
      throw new IOException("Interrupted while writing " + key + " to " + address, e);
    } catch (TimeoutException e) {
      result.cancel(true);
      throw new IOException("Timed out after " + timeoutMs + "ms writing to " + address, e);
    } catch (ExecutionException e) {
      throw new IOException("Failed to write " + key + " to " + address, e.getCause());
    } catch (RuntimeException e) {
      // spymemcached reports a full input queue or a dead node this way
      throw new IOException("Failed to write " + key + " to " + address, e);
    }
  }

  @Override
  public void close() {
    try {
      client.shutdown(timeoutMs, TimeUnit.MILLISECONDS);
    } catch (RuntimeException e) {
      LOGGER.warn("Exception while closing memcached client for {}", address, e);
    }
  }

  @Override
  public String toString() {
    return "SpyMemcacheClient{" + address + '}';
  }
}

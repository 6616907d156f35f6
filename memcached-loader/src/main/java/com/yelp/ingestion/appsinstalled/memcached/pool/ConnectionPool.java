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

import com.yelp.ingestion.appsinstalled.memcached.client.MemcacheClient;
import com.yelp.ingestion.appsinstalled.memcached.client.MemcacheClientFactory;
import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pool of reusable connections to a single memcached shard.
 *
 * <p>{@link #acquire()} waits briefly for an idle connection and opens a new one when none shows
 * up, so the number of live connections grows with contention. Only idle connections are bounded,
 * by {@code maxIdle}; a connection released into a full pool is closed.
 */
public class ConnectionPool implements Closeable {
  private static final Logger LOGGER = LoggerFactory.getLogger(ConnectionPool.class);

  private final String address;
  private final MemcacheClientFactory clientFactory;
  private final long socketTimeoutMs;
  private final long acquireTimeoutMs;
  private final BlockingQueue<MemcacheClient> idle;

  private final AtomicInteger created = new AtomicInteger();
  private final AtomicInteger discarded = new AtomicInteger();
  private volatile boolean closed;

  public ConnectionPool(
      String address,
      MemcacheClientFactory clientFactory,
      long socketTimeoutMs,
      long acquireTimeoutMs,
      int maxIdle) {
    this.address = address;
    this.clientFactory = clientFactory;
    this.socketTimeoutMs = socketTimeoutMs;
    this.acquireTimeoutMs = acquireTimeoutMs;
    this.idle = new LinkedBlockingQueue<>(maxIdle);
  }

  /**
   * Take an idle connection, or open a new one if none becomes idle within the acquire timeout.
   * The returned handle must be closed to give the connection back.
   *
   * @throws IOException if a new connection cannot be opened
   * @throws InterruptedException if interrupted while waiting for an idle connection
   */
  public PooledConnection acquire() throws IOException, InterruptedException {
    if (closed) {
      throw new IllegalStateException("Connection pool for " + address + " is closed");
    }
    MemcacheClient client = idle.poll(acquireTimeoutMs, TimeUnit.MILLISECONDS);
    if (client == null) {
      client = clientFactory.connect(address, socketTimeoutMs);
      int total = created.incrementAndGet();
      LOGGER.debug("Created connection #{} to {}", total, address);
    }
    return new PooledConnection(this, client);
  }

  void release(MemcacheClient client) {
    if (closed || !idle.offer(client)) {
      client.close();
      return;
    }
    // close() may have drained the queue between the check and the offer
    if (closed && idle.remove(client)) {
      client.close();
    }
  }

  void discard(MemcacheClient client) {
    discarded.incrementAndGet();
    LOGGER.debug("Discarding broken connection to {}", address);
    client.close();
  }

  public String getAddress() {
    return address;
  }

  public int getIdleCount() {
    return idle.size();
  }

  public int getCreatedCount() {
    return created.get();
  }

  public int getDiscardedCount() {
    return discarded.get();
  }

  /** Close all idle connections. Connections still checked out are closed when released. */
  @Override
  public void close() {
    closed = true;
    List<MemcacheClient> drained = new ArrayList<>();
    idle.drainTo(drained);
    for (MemcacheClient client : drained) {
      client.close();
    }
    LOGGER.debug(
        "Closed connection pool for {}: created={}, discarded={}",
        address,
        created.get(),
        discarded.get());
  }
}

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

import com.yelp.ingestion.appsinstalled.common.AppsInstalled;
import com.yelp.ingestion.appsinstalled.common.UserApps;
import com.yelp.ingestion.appsinstalled.common.UserAppsCodec;
import com.yelp.ingestion.appsinstalled.memcached.pool.ConnectionPool;
import com.yelp.ingestion.appsinstalled.memcached.pool.PooledConnection;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes single records to memcached. Each write borrows a connection from the shard's pool and
 * tries up to {@code maxRetries} times, sleeping {@code backoffFactor * 2^attempt} seconds between
 * failed attempts. Failures are logged and reported as {@code false}; nothing is thrown.
 */
public class AppsInstalledWriter {
  private static final Logger LOGGER = LoggerFactory.getLogger(AppsInstalledWriter.class);

  /** Pause between attempts. Replaced in tests. */
  @FunctionalInterface
  interface Sleeper {
    void sleep(long millis) throws InterruptedException;
  }

  private final int maxRetries;
  private final double backoffFactor;
  private final Sleeper sleeper;

  public AppsInstalledWriter(LoaderConfig config) {
    this(config, Thread::sleep);
  }

  AppsInstalledWriter(LoaderConfig config, Sleeper sleeper) {
    this.maxRetries = config.getMaxRetries();
    this.backoffFactor = config.getBackoffFactor();
    this.sleeper = sleeper;
  }

  /**
   * Write one record.
   *
   * @param pool connection pool of the record's shard
   * @param address shard address, used for logging
   * @param record record to store
   * @param dryRun log the write instead of performing it
   * @return true if the record was stored (always true for dry runs)
   */
  public boolean write(ConnectionPool pool, String address, AppsInstalled record, boolean dryRun) {
    String key = record.getKey();
    try {
      UserApps userApps = record.toUserApps();
      byte[] packed = UserAppsCodec.encode(userApps);

      if (dryRun) {
        LOGGER.debug("{} - {} -> {}", address, key, userApps);
        return true;
      }

      try (PooledConnection connection = pool.acquire()) {
        return setWithRetries(connection, address, key, packed);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOGGER.warn("Interrupted while writing {} to memc {}", key, address);
      return false;
    } catch (Exception e) {
      LOGGER.error("Cannot write to memc {}: {}", address, e.getMessage(), e);
      return false;
    }
  }

  private boolean setWithRetries(
      PooledConnection connection, String address, String key, byte[] packed)
      throws InterruptedException {
    boolean broken = false;
    for (int attempt = 0; attempt < maxRetries; attempt++) {
      boolean ok;
      try {
        ok = connection.client().set(key, packed);
        broken = false;
      } catch (IOException | RuntimeException e) {
        LOGGER.warn(
            "Attempt {}/{} to write {} to memc {} failed: {}",
            attempt + 1,
            maxRetries,
            key,
            address,
            e.getMessage());
        ok = false;
        broken = true;
      }
      if (ok) {
        return true;
      }
      if (attempt + 1 < maxRetries) {
        long backoffMs = backoffMillis(backoffFactor, attempt);
        LOGGER.debug("Retrying {} on memc {} in {}ms", key, address, backoffMs);
        sleeper.sleep(backoffMs);
      }
    }
    if (broken) {
      connection.invalidate();
    }
    LOGGER.debug("Giving up on {} after {} attempt(s) to memc {}", key, maxRetries, address);
    return false;
  }

  static long backoffMillis(double backoffFactor, int attempt) {
    return Math.round(backoffFactor * 1000.0 * (1L << attempt));
  }
}

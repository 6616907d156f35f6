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
import com.yelp.ingestion.appsinstalled.memcached.pool.ConnectionPool;

/**
 * One record waiting to be written to its shard. {@link #SHUTDOWN} is the sentinel the producer
 * sends once per worker when there is no more work.
 */
public final class WriteTask {
  public static final WriteTask SHUTDOWN = new WriteTask(null, null, null, false);

  private final ConnectionPool pool;
  private final String address;
  private final AppsInstalled record;
  private final boolean dryRun;

  public WriteTask(ConnectionPool pool, String address, AppsInstalled record, boolean dryRun) {
    this.pool = pool;
    this.address = address;
    this.record = record;
    this.dryRun = dryRun;
  }

  public ConnectionPool getPool() {
    return pool;
  }

  public String getAddress() {
    return address;
  }

  public AppsInstalled getRecord() {
    return record;
  }

  public boolean isDryRun() {
    return dryRun;
  }

  public boolean isShutdown() {
    return this == SHUTDOWN;
  }
}

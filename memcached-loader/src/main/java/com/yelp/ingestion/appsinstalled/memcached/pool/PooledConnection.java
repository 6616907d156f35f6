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

/**
 * A connection checked out of a {@link ConnectionPool}. Closing the handle returns the connection
 * to its pool, or closes it for good if it was {@link #invalidate() invalidated}. Closing twice is
 * a no-op.
 */
public class PooledConnection implements AutoCloseable {
  private final ConnectionPool pool;
  private final MemcacheClient client;
  private boolean invalid;
  private boolean returned;

  PooledConnection(ConnectionPool pool, MemcacheClient client) {
    this.pool = pool;
    this.client = client;
  }

  public MemcacheClient client() {
    return client;
  }

  /** Mark the connection as unusable so it is discarded instead of pooled. */
  public void invalidate() {
    this.invalid = true;
  }

  public boolean isInvalid() {
    return invalid;
  }

  @Override
  public void close() {
    if (returned) {
      return;
    }
    returned = true;
    if (invalid) {
      pool.discard(client);
    } else {
      pool.release(client);
    }
  }
}

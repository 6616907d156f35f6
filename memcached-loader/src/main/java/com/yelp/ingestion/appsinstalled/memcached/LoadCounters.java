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

/** Count of records written and records that failed. Immutable; combine with {@link #plus}. */
public final class LoadCounters {
  public static final LoadCounters ZERO = new LoadCounters(0, 0);

  private final long processed;
  private final long errors;

  public LoadCounters(long processed, long errors) {
    this.processed = processed;
    this.errors = errors;
  }

  public long getProcessed() {
    return processed;
  }

  public long getErrors() {
    return errors;
  }

  public LoadCounters plus(LoadCounters other) {
    return new LoadCounters(processed + other.processed, errors + other.errors);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof LoadCounters)) {
      return false;
    }
    LoadCounters that = (LoadCounters) o;
    return processed == that.processed && errors == that.errors;
  }

  @Override
  public int hashCode() {
    return Long.hashCode(processed) * 31 + Long.hashCode(errors);
  }

  @Override
  public String toString() {
    return "LoadCounters{processed=" + processed + ", errors=" + errors + '}';
  }
}

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

import com.google.common.collect.ImmutableList;
import java.nio.file.Path;
import java.util.List;

/** Outcome of a dispatch run: the files that were loaded and renamed, and those that failed. */
public final class DispatchSummary {
  private final List<FileLoadResult> loaded;
  private final List<Path> failed;

  public DispatchSummary(List<FileLoadResult> loaded, List<Path> failed) {
    this.loaded = ImmutableList.copyOf(loaded);
    this.failed = ImmutableList.copyOf(failed);
  }

  public List<FileLoadResult> getLoaded() {
    return loaded;
  }

  public List<Path> getFailed() {
    return failed;
  }

  public LoadCounters getTotals() {
    LoadCounters total = LoadCounters.ZERO;
    for (FileLoadResult result : loaded) {
      total = total.plus(result.getCounters());
    }
    return total;
  }

  @Override
  public String toString() {
    return "DispatchSummary{loaded="
        + loaded.size()
        + ", failed="
        + failed.size()
        + ", totals="
        + getTotals()
        + '}';
  }
}

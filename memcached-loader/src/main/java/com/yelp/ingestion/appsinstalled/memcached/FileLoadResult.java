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

import java.nio.file.Path;

/** Summary of one loaded file. */
public final class FileLoadResult {
  private final Path path;
  private final LoadCounters counters;
  private final LoadVerdict verdict;
  private final boolean stoppedEarly;

  public FileLoadResult(Path path, LoadCounters counters, boolean stoppedEarly) {
    this.path = path;
    this.counters = counters;
    this.verdict = LoadVerdict.classify(counters);
    this.stoppedEarly = stoppedEarly;
  }

  public Path getPath() {
    return path;
  }

  public LoadCounters getCounters() {
    return counters;
  }

  public LoadVerdict getVerdict() {
    return verdict;
  }

  /** True if streaming stopped before the end of the file because no worker was left. */
  public boolean isStoppedEarly() {
    return stoppedEarly;
  }

  @Override
  public String toString() {
    return "FileLoadResult{"
        + "path="
        + path
        + ", counters="
        + counters
        + ", verdict="
        + verdict
        + ", stoppedEarly="
        + stoppedEarly
        + '}';
  }
}

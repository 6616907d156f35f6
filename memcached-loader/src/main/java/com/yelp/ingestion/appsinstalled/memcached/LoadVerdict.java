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

/** Outcome of a file load, judged by its error rate. Informational only. */
public enum LoadVerdict {
  ACCEPTABLE,
  HIGH_ERROR_RATE,
  NOTHING_PROCESSED;

  /** Highest error rate, exclusive, of an acceptable load. */
  public static final double NORMAL_ERROR_RATE = 0.01;

  public static LoadVerdict classify(LoadCounters counters) {
    if (counters.getProcessed() == 0) {
      return NOTHING_PROCESSED;
    }
    return errorRate(counters) < NORMAL_ERROR_RATE ? ACCEPTABLE : HIGH_ERROR_RATE;
  }

  /** Errors per successfully processed record, or {@code NaN} if nothing was processed. */
  public static double errorRate(LoadCounters counters) {
    if (counters.getProcessed() == 0) {
      return Double.NaN;
    }
    return (double) counters.getErrors() / counters.getProcessed();
  }
}

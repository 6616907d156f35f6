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

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import com.yelp.ingestion.appsinstalled.common.utils.ConfigHelper;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable configuration of the memcached loader. Built once, either from a YAML map or through
 * the builder, and handed to the file loaders, writers and worker pools.
 *
 * <p>Expected YAML configuration structure:
 *
 * <pre>
 * shards:
 *   idfa: "127.0.0.1:33013"
 *   gaid: "127.0.0.1:33014"
 * dry.run: false
 * memcached.max.retries: 1           # attempts per record (default: 1, no retry)
 * memcached.socket.timeout.ms: 3000  # per-operation timeout (default: 3000)
 * memcached.backoff.factor: 0.3      # sleep factor * 2^attempt seconds between attempts
 * worker.threads: 4                  # writer threads per file (default: 4)
 * poll.timeout.ms: 100               # job queue / connection pool wait (default: 100)
 * job.queue.capacity: unbounded      # "unbounded" or a positive integer
 * result.queue.capacity: unbounded   # "unbounded" or an integer >= worker.threads
 * pool.max.idle: unbounded           # idle connections kept per shard
 * parallelism: 8                     # files loaded concurrently (default: CPU count)
 * </pre>
 */
public class LoaderConfig {
  private static final Logger LOGGER = LoggerFactory.getLogger(LoaderConfig.class);

  /** Capacity value meaning "no limit". */
  public static final int UNBOUNDED = Integer.MAX_VALUE;

  private static final String UNBOUNDED_KEYWORD = "unbounded";

  public static final Map<String, String> DEFAULT_SHARDS =
      ImmutableMap.of(
          "idfa", "127.0.0.1:33013",
          "gaid", "127.0.0.1:33014",
          "adid", "127.0.0.1:33015",
          "dvid", "127.0.0.1:33016");

  // Default configuration values
  private static final int DEFAULT_MAX_RETRIES = 1;
  private static final long DEFAULT_SOCKET_TIMEOUT_MS = 3000L;
  private static final double DEFAULT_BACKOFF_FACTOR = 0.3;
  private static final int DEFAULT_WORKER_THREADS = 4;
  private static final long DEFAULT_POLL_TIMEOUT_MS = 100L;

  private final Map<String, String> shards;
  private final boolean dryRun;
  private final int maxRetries;
  private final long socketTimeoutMs;
  private final double backoffFactor;
  private final int workerThreads;
  private final long pollTimeoutMs;
  private final int jobQueueCapacity;
  private final int resultQueueCapacity;
  private final int poolMaxIdle;
  private final int parallelism;

  private LoaderConfig(Builder builder) {
    Preconditions.checkArgument(!builder.shards.isEmpty(), "At least one shard must be configured");
    for (Map.Entry<String, String> shard : builder.shards.entrySet()) {
      Preconditions.checkArgument(
          !Strings.isNullOrEmpty(shard.getKey()), "Shard device type must not be empty");
      Preconditions.checkArgument(
          !Strings.isNullOrEmpty(shard.getValue()),
          "Shard address for device type '%s' must not be empty",
          shard.getKey());
    }
    Preconditions.checkArgument(builder.maxRetries >= 1, "memcached.max.retries must be >= 1");
    Preconditions.checkArgument(
        builder.socketTimeoutMs > 0, "memcached.socket.timeout.ms must be positive");
    Preconditions.checkArgument(
        builder.backoffFactor >= 0, "memcached.backoff.factor must not be negative");
    Preconditions.checkArgument(builder.workerThreads >= 1, "worker.threads must be >= 1");
    Preconditions.checkArgument(builder.pollTimeoutMs > 0, "poll.timeout.ms must be positive");
    Preconditions.checkArgument(builder.jobQueueCapacity >= 1, "job.queue.capacity must be >= 1");
    // Workers publish their counters before the loader drains them
    Preconditions.checkArgument(
        builder.resultQueueCapacity >= builder.workerThreads,
        "result.queue.capacity (%s) must be >= worker.threads (%s)",
        builder.resultQueueCapacity,
        builder.workerThreads);
    Preconditions.checkArgument(builder.poolMaxIdle >= 1, "pool.max.idle must be >= 1");
    Preconditions.checkArgument(builder.parallelism >= 1, "parallelism must be >= 1");

    this.shards = ImmutableMap.copyOf(builder.shards);
    this.dryRun = builder.dryRun;
    this.maxRetries = builder.maxRetries;
    this.socketTimeoutMs = builder.socketTimeoutMs;
    this.backoffFactor = builder.backoffFactor;
    this.workerThreads = builder.workerThreads;
    this.pollTimeoutMs = builder.pollTimeoutMs;
    this.jobQueueCapacity = builder.jobQueueCapacity;
    this.resultQueueCapacity = builder.resultQueueCapacity;
    this.poolMaxIdle = builder.poolMaxIdle;
    this.parallelism = builder.parallelism;
  }

  /**
   * Create a configuration from a YAML-style map. Missing keys take their defaults; the shard table
   * defaults to {@link #DEFAULT_SHARDS}.
   *
   * @throws IllegalArgumentException if a value is malformed or out of range
   */
  public static LoaderConfig fromMap(Map<String, Object> config) {
    Builder builder = newBuilder();

    Map<String, Object> shards = ConfigHelper.getMap(config, "shards");
    if (shards != null) {
      Map<String, String> table = new LinkedHashMap<>();
      shards.forEach(
          (deviceType, address) -> {
            Preconditions.checkArgument(
                address != null, "Shard address for device type '%s' is missing", deviceType);
            table.put(deviceType, String.valueOf(address));
          });
      builder.setShards(table);
    }

    builder
        .setDryRun(ConfigHelper.getBoolean(config, "dry.run", false))
        .setMaxRetries(
            ConfigHelper.getInteger(config, "memcached.max.retries", DEFAULT_MAX_RETRIES))
        .setSocketTimeoutMs(
            ConfigHelper.getLong(config, "memcached.socket.timeout.ms", DEFAULT_SOCKET_TIMEOUT_MS))
        .setBackoffFactor(
            ConfigHelper.getDouble(config, "memcached.backoff.factor", DEFAULT_BACKOFF_FACTOR))
        .setWorkerThreads(ConfigHelper.getInteger(config, "worker.threads", DEFAULT_WORKER_THREADS))
        .setPollTimeoutMs(ConfigHelper.getLong(config, "poll.timeout.ms", DEFAULT_POLL_TIMEOUT_MS))
        .setJobQueueCapacity(getCapacity(config, "job.queue.capacity"))
        .setResultQueueCapacity(getCapacity(config, "result.queue.capacity"))
        .setPoolMaxIdle(getCapacity(config, "pool.max.idle"))
        .setParallelism(ConfigHelper.getInteger(config, "parallelism", defaultParallelism()));

    LoaderConfig loaderConfig = builder.build();
    LOGGER.info("Initialized {}", loaderConfig);
    return loaderConfig;
  }

  static int getCapacity(Map<String, Object> config, String key) {
    String value = ConfigHelper.getString(config, key, UNBOUNDED_KEYWORD).trim();
    if (UNBOUNDED_KEYWORD.equalsIgnoreCase(value)) {
      return UNBOUNDED;
    }
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(
          "Invalid capacity for '" + key + "': " + value + " (expected 'unbounded' or an integer)",
          e);
    }
  }

  private static int defaultParallelism() {
    return Runtime.getRuntime().availableProcessors();
  }

  public Map<String, String> getShards() {
    return shards;
  }

  public boolean isDryRun() {
    return dryRun;
  }

  public int getMaxRetries() {
    return maxRetries;
  }

  public long getSocketTimeoutMs() {
    return socketTimeoutMs;
  }

  public double getBackoffFactor() {
    return backoffFactor;
  }

  public int getWorkerThreads() {
    return workerThreads;
  }

  public long getPollTimeoutMs() {
    return pollTimeoutMs;
  }

  public int getJobQueueCapacity() {
    return jobQueueCapacity;
  }

  public int getResultQueueCapacity() {
    return resultQueueCapacity;
  }

  public int getPoolMaxIdle() {
    return poolMaxIdle;
  }

  public int getParallelism() {
    return parallelism;
  }

  public Builder toBuilder() {
    return newBuilder()
        .setShards(shards)
        .setDryRun(dryRun)
        .setMaxRetries(maxRetries)
        .setSocketTimeoutMs(socketTimeoutMs)
        .setBackoffFactor(backoffFactor)
        .setWorkerThreads(workerThreads)
        .setPollTimeoutMs(pollTimeoutMs)
        .setJobQueueCapacity(jobQueueCapacity)
        .setResultQueueCapacity(resultQueueCapacity)
        .setPoolMaxIdle(poolMaxIdle)
        .setParallelism(parallelism);
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  @Override
  public String toString() {
    return "LoaderConfig{"
        + "shards="
        + shards
        + ", dryRun="
        + dryRun
        + ", maxRetries="
        + maxRetries
        + ", socketTimeoutMs="
        + socketTimeoutMs
        + ", backoffFactor="
        + backoffFactor
        + ", workerThreads="
        + workerThreads
        + ", pollTimeoutMs="
        + pollTimeoutMs
        + ", jobQueueCapacity="
        + capacityString(jobQueueCapacity)
        + ", resultQueueCapacity="
        + capacityString(resultQueueCapacity)
        + ", poolMaxIdle="
        + capacityString(poolMaxIdle)
        + ", parallelism="
        + parallelism
        + '}';
  }

  private static String capacityString(int capacity) {
    return capacity == UNBOUNDED ? UNBOUNDED_KEYWORD : String.valueOf(capacity);
  }

  public static class Builder {
    private Map<String, String> shards = DEFAULT_SHARDS;
    private boolean dryRun = false;
    private int maxRetries = DEFAULT_MAX_RETRIES;
    private long socketTimeoutMs = DEFAULT_SOCKET_TIMEOUT_MS;
    private double backoffFactor = DEFAULT_BACKOFF_FACTOR;
    private int workerThreads = DEFAULT_WORKER_THREADS;
    private long pollTimeoutMs = DEFAULT_POLL_TIMEOUT_MS;
    private int jobQueueCapacity = UNBOUNDED;
    private int resultQueueCapacity = UNBOUNDED;
    private int poolMaxIdle = UNBOUNDED;
    private int parallelism = defaultParallelism();

    public Builder setShards(Map<String, String> shards) {
      this.shards = new LinkedHashMap<>(Preconditions.checkNotNull(shards, "shards"));
      return this;
    }

    public Builder setDryRun(boolean dryRun) {
      this.dryRun = dryRun;
      return this;
    }

    public Builder setMaxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
      return this;
    }

    public Builder setSocketTimeoutMs(long socketTimeoutMs) {
      this.socketTimeoutMs = socketTimeoutMs;
      return this;
    }

    public Builder setBackoffFactor(double backoffFactor) {
      this.backoffFactor = backoffFactor;
      return this;
    }

    public Builder setWorkerThreads(int workerThreads) {
      this.workerThreads = workerThreads;
      return this;
    }

    public Builder setPollTimeoutMs(long pollTimeoutMs) {
      this.pollTimeoutMs = pollTimeoutMs;
      return this;
    }

    public Builder setJobQueueCapacity(int jobQueueCapacity) {
      this.jobQueueCapacity = jobQueueCapacity;
      return this;
    }

    public Builder setResultQueueCapacity(int resultQueueCapacity) {
      this.resultQueueCapacity = resultQueueCapacity;
      return this;
    }

    public Builder setPoolMaxIdle(int poolMaxIdle) {
      this.poolMaxIdle = poolMaxIdle;
      return this;
    }

    public Builder setParallelism(int parallelism) {
      this.parallelism = parallelism;
      return this;
    }

    public LoaderConfig build() {
      return new LoaderConfig(this);
    }
  }
}

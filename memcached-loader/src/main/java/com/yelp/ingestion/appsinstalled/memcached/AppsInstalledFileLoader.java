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
import com.yelp.ingestion.appsinstalled.common.AppsInstalledParser;
import com.yelp.ingestion.appsinstalled.memcached.client.MemcacheClientFactory;
import com.yelp.ingestion.appsinstalled.memcached.pool.ShardPools;
import com.yelp.ingestion.appsinstalled.memcached.sharding.ShardRouter;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.zip.GZIPInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads one gzipped appsinstalled log into memcached.
 *
 * <p>The calling thread streams the file, parsing and routing every line, and feeds a {@link
 * WorkerPool} that performs the writes. Malformed lines and unknown device types are counted as
 * errors here; failed writes are counted by the workers. When the file is exhausted the workers are
 * drained and the error rate of the file is logged.
 *
 * <p>An instance loads a single file once; its connection pools and workers are private to it.
 */
public class AppsInstalledFileLoader {
  private static final Logger LOGGER = LoggerFactory.getLogger(AppsInstalledFileLoader.class);
  private static final int READ_BUFFER_SIZE = 64 * 1024;

  private final Path path;
  private final LoaderConfig config;
  private final MemcacheClientFactory clientFactory;
  private final AppsInstalledWriter writer;
  private final ShardRouter router;

  private volatile LoadState state = LoadState.NEW;

  public AppsInstalledFileLoader(
      Path path, LoaderConfig config, MemcacheClientFactory clientFactory) {
    this(path, config, clientFactory, new AppsInstalledWriter(config));
  }

  AppsInstalledFileLoader(
      Path path,
      LoaderConfig config,
      MemcacheClientFactory clientFactory,
      AppsInstalledWriter writer) {
    this.path = path;
    this.config = config;
    this.clientFactory = clientFactory;
    this.writer = writer;
    this.router = new ShardRouter(config.getShards());
  }

  public LoadState getState() {
    return state;
  }

  public Path getPath() {
    return path;
  }

  /**
   * Load the file.
   *
   * @return the counters and verdict of the load, whatever the error rate
   * @throws IOException if the file cannot be opened or read
   */
  public FileLoadResult load() throws IOException {
    if (state != LoadState.NEW) {
      throw new IllegalStateException("File " + path + " was already loaded");
    }
    LOGGER.info("Processing {}", path);
    transition(LoadState.OPEN);

    long parseErrors = 0;
    boolean stoppedEarly = false;
    LoadCounters written;

    try (BufferedReader reader = open(path);
        ShardPools pools = new ShardPools(clientFactory, config)) {
      WorkerPool workers =
          new WorkerPool(path.getFileName().toString(), config, writer);
      workers.start();
      try {
        transition(LoadState.STREAMING);
        String line;
        while ((line = reader.readLine()) != null) {
          line = line.strip();
          if (line.isEmpty()) {
            continue;
          }

          Optional<AppsInstalled> parsed = AppsInstalledParser.parse(line);
          if (parsed.isEmpty()) {
            parseErrors++;
            continue;
          }
          AppsInstalled record = parsed.get();

          Optional<String> address = router.route(record.getDeviceType());
          if (address.isEmpty()) {
            parseErrors++;
            LOGGER.error("Unknown device type: {}", record.getDeviceType());
            continue;
          }

          if (workers.allWorkersTerminated()
              || !workers.submit(
                  new WriteTask(
                      pools.forAddress(address.get()), address.get(), record, config.isDryRun()))) {
            LOGGER.warn("No live workers left, stopping {} before the end of the file", path);
            stoppedEarly = true;
            break;
          }
        }
      } finally {
        transition(LoadState.DRAINING);
        written = workers.shutdownAndCollect();
      }
    }

    LoadCounters total = written.plus(new LoadCounters(0, parseErrors));
    FileLoadResult result = new FileLoadResult(path, total, stoppedEarly);
    logVerdict(result);
    transition(LoadState.DONE);
    return result;
  }

  private static BufferedReader open(Path path) throws IOException {
    InputStream in = Files.newInputStream(path);
    try {
      return new BufferedReader(
          new InputStreamReader(
              new GZIPInputStream(in, READ_BUFFER_SIZE), StandardCharsets.UTF_8),
          READ_BUFFER_SIZE);
    } catch (IOException e) {
      in.close();
      throw e;
    }
  }

  private void logVerdict(FileLoadResult result) {
    LoadCounters counters = result.getCounters();
    double errorRate = LoadVerdict.errorRate(counters);
    switch (result.getVerdict()) {
      case ACCEPTABLE:
        LOGGER.info(
            "Acceptable error rate ({}). Successful load of {}: {}",
            errorRate,
            path,
            counters);
        break;
      case HIGH_ERROR_RATE:
        LOGGER.error(
            "High error rate ({} > {}). Failed load of {}: {}",
            errorRate,
            LoadVerdict.NORMAL_ERROR_RATE,
            path,
            counters);
        break;
      default:
        LOGGER.warn("Nothing was written from {}: {}", path, counters);
    }
  }

  private void transition(LoadState next) {
    LOGGER.debug("{}: {} -> {}", path, state, next);
    state = next;
  }
}

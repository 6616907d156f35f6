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

import com.yelp.ingestion.appsinstalled.memcached.client.MemcacheClientFactory;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads every file matching a pattern, {@code parallelism} files at a time.
 *
 * <p>Each file gets its own {@link AppsInstalledFileLoader} and therefore its own connection pools
 * and workers; nothing is shared between files. Results are consumed in sorted file order and each
 * loaded file is dot-renamed as soon as its load completes. A file that cannot be read is logged,
 * left in place and does not affect the others.
 */
public class FileDispatcher {
  private static final Logger LOGGER = LoggerFactory.getLogger(FileDispatcher.class);
  private static final AtomicInteger THREAD_ID = new AtomicInteger();

  private final LoaderConfig config;
  private final MemcacheClientFactory clientFactory;

  public FileDispatcher(LoaderConfig config, MemcacheClientFactory clientFactory) {
    this.config = config;
    this.clientFactory = clientFactory;
  }

  /**
   * Find the files matching a pattern such as {@code /data/appsinstalled/*.tsv.gz}. The directory
   * part is taken literally and the file name part is a glob. Dot files, i.e. files already
   * processed, never match.
   *
   * @return matching regular files, sorted
   */
  public static List<Path> findFiles(String pattern) throws IOException {
    Path patternPath = Paths.get(pattern);
    Path directory = patternPath.getParent() == null ? Paths.get(".") : patternPath.getParent();
    String glob = patternPath.getFileName().toString();

    List<Path> files = new ArrayList<>();
    if (!Files.isDirectory(directory)) {
      LOGGER.warn("Directory {} does not exist", directory);
      return files;
    }
    try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, glob)) {
      for (Path path : stream) {
        if (Files.isRegularFile(path) && !DotRenamer.isProcessed(path)) {
          files.add(path);
        }
      }
    }
    files.sort(null);
    return files;
  }

  public DispatchSummary dispatch(String pattern) throws IOException, InterruptedException {
    List<Path> files = findFiles(pattern);
    LOGGER.info("Found {} file(s) matching {}", files.size(), pattern);
    return dispatch(files);
  }

  public DispatchSummary dispatch(List<Path> files) throws InterruptedException {
    List<FileLoadResult> loaded = new ArrayList<>();
    List<Path> failed = new ArrayList<>();
    if (files.isEmpty()) {
      return new DispatchSummary(loaded, failed);
    }

    ExecutorService executorService =
        Executors.newFixedThreadPool(
            Math.min(config.getParallelism(), files.size()),
            r -> {
              Thread t = new Thread(r, "memc-loader-file-" + THREAD_ID.getAndIncrement());
              t.setDaemon(true);
              return t;
            });
    try {
      List<Future<FileLoadResult>> futures = new ArrayList<>(files.size());
      for (Path file : files) {
        futures.add(
            executorService.submit(
                () -> new AppsInstalledFileLoader(file, config, clientFactory).load()));
      }

      for (int i = 0; i < files.size(); i++) {
        Path file = files.get(i);
        FileLoadResult result;
        try {
          result = futures.get(i).get();
        } catch (ExecutionException e) {
          LOGGER.error("Failed to load {}, leaving it in place", file, e.getCause());
          failed.add(file);
          continue;
        }

        try {
          Path renamed = DotRenamer.rename(file);
          LOGGER.debug("Renamed {} to {}", file, renamed);
          loaded.add(result);
        } catch (IOException e) {
          LOGGER.error("Loaded {} but failed to mark it processed", file, e);
          failed.add(file);
        }
      }
    } finally {
      executorService.shutdownNow();
    }

    DispatchSummary summary = new DispatchSummary(loaded, failed);
    LOGGER.info("Dispatch finished: {}", summary);
    return summary;
  }
}

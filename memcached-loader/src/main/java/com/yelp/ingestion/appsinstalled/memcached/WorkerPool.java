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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fixed set of {@link InsertWorker}s sharing one job queue and one result queue.
 *
 * <p>Workers run until they receive a {@link WriteTask#SHUTDOWN} sentinel; an empty queue never
 * stops them. {@link #shutdownAndCollect()} sends one sentinel per worker, waits for all of them
 * and sums their counters.
 */
public class WorkerPool {
  private static final Logger LOGGER = LoggerFactory.getLogger(WorkerPool.class);
  private static final AtomicInteger POOL_ID = new AtomicInteger();
  private static final long JOIN_LOG_INTERVAL_SECONDS = 30;

  private final String name;
  private final int workerThreads;
  private final long pollTimeoutMs;
  private final AppsInstalledWriter writer;
  private final BlockingQueue<WriteTask> jobQueue;
  private final BlockingQueue<LoadCounters> resultQueue;
  private final AtomicInteger liveWorkers = new AtomicInteger();

  private ExecutorService executorService;

  public WorkerPool(String name, LoaderConfig config, AppsInstalledWriter writer) {
    this.name = name;
    this.workerThreads = config.getWorkerThreads();
    this.pollTimeoutMs = config.getPollTimeoutMs();
    this.writer = writer;
    this.jobQueue = new LinkedBlockingQueue<>(config.getJobQueueCapacity());
    this.resultQueue = new LinkedBlockingQueue<>(config.getResultQueueCapacity());
  }

  public synchronized void start() {
    if (executorService != null) {
      throw new IllegalStateException("Worker pool " + name + " already started");
    }
    int poolId = POOL_ID.getAndIncrement();
    AtomicInteger threadId = new AtomicInteger();
    executorService =
        Executors.newFixedThreadPool(
            workerThreads,
            r -> {
              Thread t = new Thread(r, "memc-worker-" + poolId + "-" + threadId.getAndIncrement());
              t.setDaemon(true);
              return t;
            });
    liveWorkers.set(workerThreads);
    for (int i = 0; i < workerThreads; i++) {
      executorService.submit(
          new InsertWorker(
              i, jobQueue, resultQueue, writer, pollTimeoutMs, liveWorkers::decrementAndGet));
    }
    LOGGER.debug("Started {} workers for {}", workerThreads, name);
  }

  /**
   * Queue a task, waiting for space if the job queue is bounded and full.
   *
   * @return false if the task could not be queued because every worker has stopped or the caller
   *     was interrupted
   */
  public boolean submit(WriteTask task) {
    try {
      while (!jobQueue.offer(task, pollTimeoutMs, TimeUnit.MILLISECONDS)) {
        if (allWorkersTerminated()) {
          return false;
        }
      }
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  /** True once every worker has exited. */
  public boolean allWorkersTerminated() {
    return liveWorkers.get() == 0;
  }

  public int getLiveWorkers() {
    return liveWorkers.get();
  }

  /**
   * Signal the end of work, wait for every worker to exit and return the sum of their counters.
   * If interrupted, workers are cancelled and whatever counters were published are returned.
   */
  public LoadCounters shutdownAndCollect() {
    if (executorService == null) {
      return LoadCounters.ZERO;
    }
    try {
      for (int i = 0; i < workerThreads; i++) {
        if (!submit(WriteTask.SHUTDOWN)) {
          break;
        }
      }
      executorService.shutdown();
      while (!executorService.awaitTermination(JOIN_LOG_INTERVAL_SECONDS, TimeUnit.SECONDS)) {
        LOGGER.info(
            "Still waiting for {} worker(s) of {}, {} task(s) queued",
            liveWorkers.get(),
            name,
            jobQueue.size());
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOGGER.warn("Interrupted while waiting for workers of {}, cancelling", name);
      executorService.shutdownNow();
    }

    List<LoadCounters> published = new ArrayList<>();
    resultQueue.drainTo(published);
    LoadCounters total = LoadCounters.ZERO;
    for (LoadCounters counters : published) {
      total = total.plus(counters);
    }
    return total;
  }
}

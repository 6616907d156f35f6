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

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Worker loop: takes write tasks off the shared job queue until it receives the shutdown sentinel,
 * counting successes and failures locally. The totals are published exactly once, when the loop
 * ends for any reason.
 */
class InsertWorker implements Runnable {
  private static final Logger LOGGER = LoggerFactory.getLogger(InsertWorker.class);

  private final int workerId;
  private final BlockingQueue<WriteTask> jobQueue;
  private final BlockingQueue<LoadCounters> resultQueue;
  private final AppsInstalledWriter writer;
  private final long pollTimeoutMs;
  private final Runnable onExit;

  InsertWorker(
      int workerId,
      BlockingQueue<WriteTask> jobQueue,
      BlockingQueue<LoadCounters> resultQueue,
      AppsInstalledWriter writer,
      long pollTimeoutMs,
      Runnable onExit) {
    this.workerId = workerId;
    this.jobQueue = jobQueue;
    this.resultQueue = resultQueue;
    this.writer = writer;
    this.pollTimeoutMs = pollTimeoutMs;
    this.onExit = onExit;
  }

  @Override
  public void run() {
    long processed = 0;
    long errors = 0;
    LOGGER.debug("Worker {} started", workerId);
    try {
      while (true) {
        WriteTask task = jobQueue.poll(pollTimeoutMs, TimeUnit.MILLISECONDS);
        if (task == null) {
          continue;
        }
        if (task.isShutdown()) {
          break;
        }
        boolean ok =
            writer.write(task.getPool(), task.getAddress(), task.getRecord(), task.isDryRun());
        if (ok) {
          processed++;
        } else {
          errors++;
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOGGER.warn("Worker {} interrupted, stopping", workerId);
    } catch (RuntimeException e) {
      LOGGER.error("Worker {} failed unexpectedly", workerId, e);
    } finally {
      LoadCounters counters = new LoadCounters(processed, errors);
      if (!resultQueue.offer(counters)) {
        LOGGER.error("Result queue full, worker {} dropped its counters {}", workerId, counters);
      }
      onExit.run();
      LOGGER.debug("Worker {} stopped: {}", workerId, counters);
    }
  }
}

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

import static org.awaitility.Awaitility.await;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.google.common.collect.ImmutableList;
import com.yelp.ingestion.appsinstalled.common.AppsInstalled;
import com.yelp.ingestion.appsinstalled.memcached.pool.ConnectionPool;
import java.time.Duration;
import org.junit.Before;
import org.junit.Test;

public class WorkerPoolTest {
  private static final String ADDRESS = "127.0.0.1:33013";

  private LoaderConfig config;
  private ConnectionPool pool;

  @Before
  public void setUp() {
    config = LoaderConfig.newBuilder().setWorkerThreads(3).setPollTimeoutMs(10).build();
    pool =
        new ConnectionPool(
            ADDRESS, new InMemoryMemcacheClientFactory(), 3000, 10, LoaderConfig.UNBOUNDED);
  }

  private static AppsInstalled record(int i) {
    return new AppsInstalled("idfa", "device-" + i, 1.0, 2.0, ImmutableList.of((long) i));
  }

  @Test
  public void testCountersAreSummedAcrossWorkers() {
    WorkerPool workers = new WorkerPool("test", config, new AppsInstalledWriter(config));
    workers.start();

    for (int i = 0; i < 100; i++) {
      assertTrue(workers.submit(new WriteTask(pool, ADDRESS, record(i), true)));
    }

    assertEquals(new LoadCounters(100, 0), workers.shutdownAndCollect());
    assertTrue(workers.allWorkersTerminated());
  }

  @Test
  public void testFailedWritesAreCountedAsErrors() {
    AppsInstalledWriter writer = mock(AppsInstalledWriter.class);
    when(writer.write(any(), anyString(), any(), anyBoolean())).thenReturn(true, false, true);
    WorkerPool workers = new WorkerPool("test", config, writer);
    workers.start();

    for (int i = 0; i < 3; i++) {
      workers.submit(new WriteTask(pool, ADDRESS, record(i), false));
    }

    assertEquals(new LoadCounters(2, 1), workers.shutdownAndCollect());
  }

  @Test
  public void testWorkersOutliveAnEmptyQueue() {
    WorkerPool workers = new WorkerPool("test", config, new AppsInstalledWriter(config));
    workers.start();

    // Many poll timeouts pass with nothing queued
    await()
        .during(Duration.ofMillis(200))
        .atMost(Duration.ofSeconds(2))
        .until(() -> workers.getLiveWorkers() == 3);

    assertTrue(workers.submit(new WriteTask(pool, ADDRESS, record(1), true)));
    assertEquals(new LoadCounters(1, 0), workers.shutdownAndCollect());
  }

  @Test
  public void testShutdownWithoutWork() {
    WorkerPool workers = new WorkerPool("test", config, new AppsInstalledWriter(config));
    workers.start();

    assertEquals(LoadCounters.ZERO, workers.shutdownAndCollect());
    assertEquals(0, workers.getLiveWorkers());
  }

  @Test
  public void testShutdownBeforeStart() {
    WorkerPool workers = new WorkerPool("test", config, new AppsInstalledWriter(config));

    assertEquals(LoadCounters.ZERO, workers.shutdownAndCollect());
  }

  @Test(expected = IllegalStateException.class)
  public void testStartTwice() {
    WorkerPool workers = new WorkerPool("test", config, new AppsInstalledWriter(config));
    workers.start();
    try {
      workers.start();
    } finally {
      workers.shutdownAndCollect();
    }
  }

  @Test
  public void testSubmitFailsOnceAllWorkersDied() {
    LoaderConfig single =
        config.toBuilder().setWorkerThreads(1).setJobQueueCapacity(1).build();
    AppsInstalledWriter writer = mock(AppsInstalledWriter.class);
    when(writer.write(any(), anyString(), any(), anyBoolean()))
        .thenThrow(new IllegalStateException("boom"));
    WorkerPool workers = new WorkerPool("test", single, writer);
    workers.start();

    assertTrue(workers.submit(new WriteTask(pool, ADDRESS, record(1), false)));
    await().atMost(Duration.ofSeconds(2)).until(workers::allWorkersTerminated);

    // The queue takes one more task, then nobody is left to drain it
    assertTrue(workers.submit(new WriteTask(pool, ADDRESS, record(2), false)));
    assertFalse(workers.submit(new WriteTask(pool, ADDRESS, record(3), false)));

    assertEquals(LoadCounters.ZERO, workers.shutdownAndCollect());
  }
}

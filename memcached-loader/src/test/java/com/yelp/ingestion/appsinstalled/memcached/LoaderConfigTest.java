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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import com.google.common.collect.ImmutableMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.Test;

public class LoaderConfigTest {

  @Test
  public void testDefaults() {
    LoaderConfig config = LoaderConfig.fromMap(new HashMap<>());

    assertEquals(LoaderConfig.DEFAULT_SHARDS, config.getShards());
    assertFalse(config.isDryRun());
    assertEquals(1, config.getMaxRetries());
    assertEquals(3000L, config.getSocketTimeoutMs());
    assertEquals(0.3, config.getBackoffFactor(), 0.0);
    assertEquals(4, config.getWorkerThreads());
    assertEquals(100L, config.getPollTimeoutMs());
    assertEquals(LoaderConfig.UNBOUNDED, config.getJobQueueCapacity());
    assertEquals(LoaderConfig.UNBOUNDED, config.getResultQueueCapacity());
    assertEquals(LoaderConfig.UNBOUNDED, config.getPoolMaxIdle());
    assertEquals(Runtime.getRuntime().availableProcessors(), config.getParallelism());
  }

  @Test
  public void testDefaultShards() {
    assertEquals("127.0.0.1:33013", LoaderConfig.DEFAULT_SHARDS.get("idfa"));
    assertEquals("127.0.0.1:33014", LoaderConfig.DEFAULT_SHARDS.get("gaid"));
    assertEquals("127.0.0.1:33015", LoaderConfig.DEFAULT_SHARDS.get("adid"));
    assertEquals("127.0.0.1:33016", LoaderConfig.DEFAULT_SHARDS.get("dvid"));
  }

  @Test
  public void testFlatKeys() {
    Map<String, Object> map = new HashMap<>();
    map.put("dry.run", "true");
    map.put("memcached.max.retries", 3);
    map.put("memcached.socket.timeout.ms", "500");
    map.put("memcached.backoff.factor", 0.1);
    map.put("worker.threads", "8");
    map.put("poll.timeout.ms", 50);
    map.put("job.queue.capacity", 1000);
    map.put("result.queue.capacity", "16");
    map.put("pool.max.idle", "unbounded");
    map.put("parallelism", 2);

    LoaderConfig config = LoaderConfig.fromMap(map);

    assertTrue(config.isDryRun());
    assertEquals(3, config.getMaxRetries());
    assertEquals(500L, config.getSocketTimeoutMs());
    assertEquals(0.1, config.getBackoffFactor(), 0.0);
    assertEquals(8, config.getWorkerThreads());
    assertEquals(50L, config.getPollTimeoutMs());
    assertEquals(1000, config.getJobQueueCapacity());
    assertEquals(16, config.getResultQueueCapacity());
    assertEquals(LoaderConfig.UNBOUNDED, config.getPoolMaxIdle());
    assertEquals(2, config.getParallelism());
  }

  @Test
  public void testNestedKeys() {
    Map<String, Object> memcached = new HashMap<>();
    memcached.put("max", ImmutableMap.of("retries", 2));
    Map<String, Object> map = new HashMap<>();
    map.put("memcached", memcached);
    map.put("worker", ImmutableMap.of("threads", 6));

    LoaderConfig config = LoaderConfig.fromMap(map);

    assertEquals(2, config.getMaxRetries());
    assertEquals(6, config.getWorkerThreads());
  }

  @Test
  public void testShardTableReplacesDefaults() {
    Map<String, Object> shards = new LinkedHashMap<>();
    shards.put("idfa", "10.0.0.1:11211");
    shards.put("gaid", "10.0.0.2:11211");
    Map<String, Object> map = new HashMap<>();
    map.put("shards", shards);

    LoaderConfig config = LoaderConfig.fromMap(map);

    assertEquals(
        ImmutableMap.of("idfa", "10.0.0.1:11211", "gaid", "10.0.0.2:11211"), config.getShards());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testShardWithoutAddressIsRejected() {
    // "idfa:" with no value in YAML
    Map<String, Object> shards = new LinkedHashMap<>();
    shards.put("idfa", null);
    shards.put("gaid", "10.0.0.2:11211");
    Map<String, Object> map = new HashMap<>();
    map.put("shards", shards);

    LoaderConfig.fromMap(map);
  }

  @Test
  public void testUnboundedKeywordIsCaseInsensitive() {
    Map<String, Object> map = new HashMap<>();
    map.put("job.queue.capacity", " UNBOUNDED ");

    assertEquals(LoaderConfig.UNBOUNDED, LoaderConfig.getCapacity(map, "job.queue.capacity"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testInvalidCapacity() {
    Map<String, Object> map = new HashMap<>();
    map.put("job.queue.capacity", "lots");

    LoaderConfig.fromMap(map);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testResultQueueSmallerThanWorkers() {
    LoaderConfig.newBuilder().setWorkerThreads(4).setResultQueueCapacity(2).build();
  }

  @Test
  public void testRejectsOutOfRangeValues() {
    assertInvalid(LoaderConfig.newBuilder().setMaxRetries(0));
    assertInvalid(LoaderConfig.newBuilder().setSocketTimeoutMs(0));
    assertInvalid(LoaderConfig.newBuilder().setBackoffFactor(-1));
    assertInvalid(LoaderConfig.newBuilder().setWorkerThreads(0));
    assertInvalid(LoaderConfig.newBuilder().setPollTimeoutMs(0));
    assertInvalid(LoaderConfig.newBuilder().setJobQueueCapacity(0));
    assertInvalid(LoaderConfig.newBuilder().setPoolMaxIdle(0));
    assertInvalid(LoaderConfig.newBuilder().setParallelism(0));
    assertInvalid(LoaderConfig.newBuilder().setShards(new HashMap<>()));
    assertInvalid(LoaderConfig.newBuilder().setShards(ImmutableMap.of("idfa", "")));
  }

  @Test
  public void testToBuilderRoundTrip() {
    LoaderConfig config =
        LoaderConfig.newBuilder().setMaxRetries(5).setWorkerThreads(2).setDryRun(true).build();

    LoaderConfig copy = config.toBuilder().build();

    assertEquals(config.toString(), copy.toString());
    assertTrue(copy.toString().contains("jobQueueCapacity=unbounded"));
  }

  private static void assertInvalid(LoaderConfig.Builder builder) {
    try {
      builder.build();
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) {
      // expected
    }
  }
}

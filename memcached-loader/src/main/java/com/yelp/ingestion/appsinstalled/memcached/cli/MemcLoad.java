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
package com.yelp.ingestion.appsinstalled.memcached.cli;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.yelp.ingestion.appsinstalled.memcached.DispatchSummary;
import com.yelp.ingestion.appsinstalled.memcached.FileDispatcher;
import com.yelp.ingestion.appsinstalled.memcached.LoaderConfig;
import com.yelp.ingestion.appsinstalled.memcached.client.MemcacheClientFactory;
import com.yelp.ingestion.appsinstalled.memcached.client.SpyMemcacheClientFactory;
import java.io.File;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/** Command line entry point: loads every appsinstalled log matching a pattern into memcached. */
@Command(
    name = "memc-load",
    mixinStandardHelpOptions = true,
    version = "0.1.0",
    description = "Load gzipped appsinstalled logs into sharded memcached")
public class MemcLoad implements Callable<Integer> {
  private static final Logger LOGGER = LoggerFactory.getLogger(MemcLoad.class);

  static final String DEFAULT_PATTERN = "/data/appsinstalled/*.tsv.gz";

  @Option(
      names = {"-t", "--test"},
      description = "Round-trip sample lines through the value codec and exit")
  private boolean test;

  @Option(
      names = {"-l", "--log"},
      description = "Log to this file instead of the console")
  private String logFile;

  @Option(
      names = {"--dry"},
      description = "Log the writes instead of performing them")
  private boolean dry;

  @Option(
      names = {"--pattern"},
      description = "Input files: directory plus file name glob (default: ${DEFAULT-VALUE})")
  private String pattern = DEFAULT_PATTERN;

  @Option(
      names = {"--idfa"},
      description = "Memcached address for idfa devices (default: 127.0.0.1:33013)")
  private String idfa;

  @Option(
      names = {"--gaid"},
      description = "Memcached address for gaid devices (default: 127.0.0.1:33014)")
  private String gaid;

  @Option(
      names = {"--adid"},
      description = "Memcached address for adid devices (default: 127.0.0.1:33015)")
  private String adid;

  @Option(
      names = {"--dvid"},
      description = "Memcached address for dvid devices (default: 127.0.0.1:33016)")
  private String dvid;

  @Option(
      names = {"-c", "--config"},
      description = "YAML file with shard and tuning settings")
  private File configFile;

  @Option(
      names = {"--parallelism", "--processes"},
      description =
          "Number of files loaded concurrently, one thread per file in this JVM"
              + " (default: number of CPUs)")
  private Integer parallelism;

  private final MemcacheClientFactory clientFactory;

  public MemcLoad() {
    this(new SpyMemcacheClientFactory());
  }

  MemcLoad(MemcacheClientFactory clientFactory) {
    this.clientFactory = clientFactory;
  }

  public static void main(String[] args) {
    int exitCode = new CommandLine(new MemcLoad()).execute(args);
    System.exit(exitCode);
  }

  @Override
  public Integer call() {
    LoggingConfigurer.configure(logFile, dry);
    if (test) {
      return AppsInstalledSelfTest.run() ? 0 : 1;
    }

    LOGGER.info("Memc loader started with options: {}", describeOptions());
    try {
      LoaderConfig config = buildConfig();
      DispatchSummary summary = new FileDispatcher(config, clientFactory).dispatch(pattern);
      LOGGER.info("Memc loader finished: {}", summary);
      return 0;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOGGER.error("Interrupted, exiting");
      return 1;
    } catch (Exception e) {
      LOGGER.error("Unexpected error: {}", e.getMessage(), e);
      return 1;
    }
  }

  /**
   * Shards come from the defaults, replaced by the YAML table if present, then overridden one by
   * one by the device type options given on the command line.
   */
  LoaderConfig buildConfig() throws IOException {
    LoaderConfig fromFile = LoaderConfig.fromMap(readConfigFile());

    Map<String, String> shards = new LinkedHashMap<>(fromFile.getShards());
    putIfPresent(shards, "idfa", idfa);
    putIfPresent(shards, "gaid", gaid);
    putIfPresent(shards, "adid", adid);
    putIfPresent(shards, "dvid", dvid);

    LoaderConfig.Builder builder = fromFile.toBuilder().setShards(shards);
    if (dry) {
      builder.setDryRun(true);
    }
    if (parallelism != null) {
      builder.setParallelism(parallelism);
    }
    return builder.build();
  }

  private Map<String, Object> readConfigFile() throws IOException {
    if (configFile == null) {
      return new LinkedHashMap<>();
    }
    ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
    Map<String, Object> config =
        mapper.readValue(configFile, new TypeReference<Map<String, Object>>() {});
    return config == null ? new LinkedHashMap<>() : config;
  }

  private static void putIfPresent(Map<String, String> shards, String deviceType, String address) {
    if (address != null) {
      shards.put(deviceType, address);
    }
  }

  private String describeOptions() {
    Map<String, Object> options = new LinkedHashMap<>();
    options.put("pattern", pattern);
    options.put("dry", dry);
    options.put("log", logFile);
    options.put("idfa", idfa);
    options.put("gaid", gaid);
    options.put("adid", adid);
    options.put("dvid", dvid);
    options.put("config", configFile);
    options.put("parallelism", parallelism);
    return options.toString();
  }
}

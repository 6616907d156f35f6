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

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.FileAppender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Adjusts the Logback root logger for a command line run: DEBUG for dry runs, INFO otherwise, and
 * a file appender in place of the console one when a log file is given.
 */
final class LoggingConfigurer {
  static final String PATTERN = "[%d{yyyy.MM.dd HH:mm:ss}] %.-1level %msg%n";
  static final String CONSOLE_APPENDER = "CONSOLE";
  static final String FILE_APPENDER = "FILE";

  private LoggingConfigurer() {}

  static void configure(String logFile, boolean dryRun) {
    LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
    ch.qos.logback.classic.Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
    root.setLevel(dryRun ? Level.DEBUG : Level.INFO);

    if (logFile == null) {
      return;
    }
    PatternLayoutEncoder encoder = new PatternLayoutEncoder();
    encoder.setContext(context);
    encoder.setPattern(PATTERN);
    encoder.start();

    FileAppender<ILoggingEvent> appender = new FileAppender<>();
    appender.setContext(context);
    appender.setName(FILE_APPENDER);
    appender.setFile(logFile);
    appender.setAppend(true);
    appender.setEncoder(encoder);
    appender.start();

    root.detachAppender(CONSOLE_APPENDER);
    root.detachAppender(FILE_APPENDER);
    root.addAppender(appender);
  }
}

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
package com.yelp.ingestion.appsinstalled.common;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.util.Optional;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.slf4j.LoggerFactory;

public class AppsInstalledParserTest {

  private Logger parserLogger;
  private ListAppender<ILoggingEvent> appender;

  @Before
  public void setUp() {
    parserLogger = (Logger) LoggerFactory.getLogger(AppsInstalledParser.class);
    appender = new ListAppender<>();
    appender.start();
    parserLogger.addAppender(appender);
  }

  @After
  public void tearDown() {
    parserLogger.detachAppender(appender);
    appender.stop();
  }

  @Test
  public void testWellFormedLine() {
    Optional<AppsInstalled> parsed =
        AppsInstalledParser.parse("idfa\t1rfw452y52g2gq4g\t55.55\t42.42\t1423,43,567,3,7,23");

    assertThat(parsed).isPresent();
    AppsInstalled record = parsed.get();
    assertThat(record.getDeviceType()).isEqualTo("idfa");
    assertThat(record.getDeviceId()).isEqualTo("1rfw452y52g2gq4g");
    assertThat(record.getLat()).isEqualTo(55.55);
    assertThat(record.getLon()).isEqualTo(42.42);
    assertThat(record.getApps()).containsExactly(1423L, 43L, 567L, 3L, 7L, 23L);
    assertThat(record.getKey()).isEqualTo("idfa:1rfw452y52g2gq4g");
    assertThat(appender.list).isEmpty();
  }

  @Test
  public void testSurroundingWhitespaceAndSpacedApps() {
    Optional<AppsInstalled> parsed =
        AppsInstalledParser.parse("  gaid\t7rfw452y52g2gq4g\t55.55\t42.42\t7423, 424 \n");

    assertThat(parsed).isPresent();
    assertThat(parsed.get().getApps()).containsExactly(7423L, 424L);
  }

  @Test
  public void testTooFewFields() {
    assertThat(AppsInstalledParser.parse("idfa\tabc\t55.55\t42.42")).isEmpty();
    assertThat(AppsInstalledParser.parse("")).isEmpty();
    assertThat(AppsInstalledParser.parse(null)).isEmpty();
  }

  @Test
  public void testEmptyIdentityFields() {
    assertThat(AppsInstalledParser.parse("\tabc\t55.55\t42.42\t1,2")).isEmpty();
    assertThat(AppsInstalledParser.parse("idfa\t\t55.55\t42.42\t1,2")).isEmpty();
  }

  @Test
  public void testNonNumericAppsAreDroppedWithOneWarning() {
    Optional<AppsInstalled> parsed = AppsInstalledParser.parse("idfa\tabc\t1.0\t2.0\t12,xx,7");

    assertThat(parsed).isPresent();
    assertThat(parsed.get().getApps()).containsExactly(12L, 7L);
    assertThat(appender.list).hasSize(1);
    assertThat(appender.list.get(0).getLevel()).isEqualTo(Level.WARN);
    assertThat(appender.list.get(0).getFormattedMessage()).contains("Not all user apps are digits");
  }

  @Test
  public void testNegativeAppIsDroppedWithOneWarning() {
    Optional<AppsInstalled> parsed = AppsInstalledParser.parse("idfa\tabc\t1.0\t2.0\t-3,4");

    assertThat(parsed).isPresent();
    assertThat(parsed.get().getApps()).containsExactly(4L);
    assertThat(appender.list).hasSize(1);
    assertThat(appender.list.get(0).getFormattedMessage()).contains("Not all user apps are digits");
  }

  @Test
  public void testAppIdsAboveSignedIntRangeAreKept() {
    Optional<AppsInstalled> parsed =
        AppsInstalledParser.parse("idfa\tabc\t1.0\t2.0\t3000000000,7,4294967295");

    assertThat(parsed).isPresent();
    assertThat(parsed.get().getApps()).containsExactly(3000000000L, 7L, 4294967295L);
    assertThat(appender.list).isEmpty();
  }

  @Test
  public void testAppIdsAboveUint32AreDroppedWithOneWarning() {
    Optional<AppsInstalled> parsed =
        AppsInstalledParser.parse("idfa\tabc\t1.0\t2.0\t4294967296,7");

    assertThat(parsed.get().getApps()).containsExactly(7L);
    assertThat(appender.list).hasSize(1);
  }

  @Test
  public void testInvalidGeoCoordsDefaultToZero() {
    Optional<AppsInstalled> parsed = AppsInstalledParser.parse("dvid\tabc\tnorth\t42.42\t1,2");

    assertThat(parsed).isPresent();
    assertThat(parsed.get().getLat()).isEqualTo(0.0);
    assertThat(parsed.get().getLon()).isEqualTo(42.42);
    assertThat(parsed.get().getApps()).containsExactly(1L, 2L);
    assertThat(appender.list).hasSize(1);
    assertThat(appender.list.get(0).getFormattedMessage()).contains("Invalid geo coords");
  }

  @Test
  public void testEmptyAppsField() {
    Optional<AppsInstalled> parsed = AppsInstalledParser.parse("adid\tabc\t1.0\t2.0\t ");

    // trailing whitespace is stripped with the line, leaving four fields
    assertThat(parsed).isEmpty();
  }

  @Test
  public void testExtraFieldsAreIgnored() {
    Optional<AppsInstalled> parsed =
        AppsInstalledParser.parse("adid\tabc\t1.0\t2.0\t5,6\tunexpected");

    assertThat(parsed).isPresent();
    assertThat(parsed.get().getApps()).containsExactly(5L, 6L);
  }
}

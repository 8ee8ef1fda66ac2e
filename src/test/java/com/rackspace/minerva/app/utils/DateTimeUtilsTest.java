/*
 * Copyright 2022 Rackspace US, Inc.
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

package com.rackspace.minerva.app.utils;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.rackspace.minerva.app.exceptions.BadQueryException;
import com.rackspace.minerva.app.model.TimeRange;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import org.junit.jupiter.api.Test;

public class DateTimeUtilsTest {

  private static final Instant NOW = Instant.parse("2022-03-15T12:00:00Z");

  @Test
  public void parseInstantTestWithNow() {
    assertThat(DateTimeUtils.parseInstant("now", NOW)).isEqualTo(NOW);
  }

  @Test
  public void parseInstantTestWithNowRelative() {
    assertThat(DateTimeUtils.parseInstant("now-5m", NOW))
        .isEqualTo(NOW.minus(5, ChronoUnit.MINUTES));
    assertThat(DateTimeUtils.parseInstant("now-250ms", NOW))
        .isEqualTo(NOW.minusMillis(250));
    assertThat(DateTimeUtils.parseInstant("now-2w", NOW))
        .isEqualTo(NOW.minus(14, ChronoUnit.DAYS));
  }

  @Test
  public void parseInstantTestWithMonthsAndYears() {
    assertThat(DateTimeUtils.parseInstant("now-1M", NOW))
        .isEqualTo(Instant.parse("2022-02-15T12:00:00Z"));
    assertThat(DateTimeUtils.parseInstant("now-1y", NOW))
        .isEqualTo(Instant.parse("2021-03-15T12:00:00Z"));
  }

  @Test
  public void parseInstantTestWithAgo() {
    assertThat(DateTimeUtils.parseInstant("3h-ago", NOW))
        .isEqualTo(NOW.minus(3, ChronoUnit.HOURS));
  }

  @Test
  public void parseInstantTestWithEpochMillis() {
    assertThat(DateTimeUtils.parseInstant("1605094715000", NOW))
        .isEqualTo(Instant.ofEpochMilli(1605094715000L));
  }

  @Test
  public void parseInstantTestWithEpochSeconds() {
    assertThat(DateTimeUtils.parseInstant("1605094715", NOW))
        .isEqualTo(Instant.ofEpochSecond(1605094715));
  }

  @Test
  public void parseInstantTestWithUTCTime() {
    assertThat(DateTimeUtils.parseInstant("2020-11-10T14:24:35Z", NOW))
        .isEqualTo(Instant.parse("2020-11-10T14:24:35Z"));
  }

  @Test
  public void parseInstantTest_Invalid() {
    assertThatThrownBy(() -> DateTimeUtils.parseInstant("yesterday", NOW))
        .isInstanceOf(BadQueryException.class)
        .hasMessage("invalid time range value: yesterday");
    assertThatThrownBy(() -> DateTimeUtils.parseInstant("now-5x", NOW))
        .isInstanceOf(BadQueryException.class);
  }

  @Test
  public void parseInstantTest_NumberOutOfRange() {
    assertThatThrownBy(() -> DateTimeUtils.parseInstant("99999999999999999999", NOW))
        .isInstanceOf(BadQueryException.class)
        .hasMessage("invalid time range value: 99999999999999999999");
    assertThatThrownBy(() -> DateTimeUtils.parseInstant("now-99999999999999999999m", NOW))
        .isInstanceOf(BadQueryException.class);
    assertThatThrownBy(() -> DateTimeUtils.parseInstant("99999999999999999999s-ago", NOW))
        .isInstanceOf(BadQueryException.class);
  }

  @Test
  public void parseInstantTest_OffsetOutOfRange() {
    assertThatThrownBy(() -> DateTimeUtils.parseInstant("now-9999999999999d", NOW))
        .isInstanceOf(BadQueryException.class)
        .hasMessage("invalid time range value: now-9999999999999d");
    assertThatThrownBy(() -> DateTimeUtils.parseInstant("now-999999999999y", NOW))
        .isInstanceOf(BadQueryException.class);
    assertThatThrownBy(() -> DateTimeUtils.parseInstant("now-999999999999999999w", NOW))
        .isInstanceOf(BadQueryException.class);
  }

  @Test
  public void parseTimeRangeTest_Invalid() {
    assertThatThrownBy(() -> DateTimeUtils.parseTimeRange("99999999999999999999", "now", NOW))
        .isInstanceOf(BadQueryException.class);
  }

  @Test
  public void parseTimeRangeTestWithDefaults() {
    final TimeRange timeRange = DateTimeUtils.parseTimeRange(null, "", NOW);

    assertThat(timeRange.getFrom()).isEqualTo(NOW.minus(6, ChronoUnit.HOURS));
    assertThat(timeRange.getTo()).isEqualTo(NOW);
  }

  @Test
  public void parseTimeRangeTest() {
    final TimeRange timeRange = DateTimeUtils.parseTimeRange("now-1h", "now-5m", NOW);

    assertThat(timeRange.getFrom()).isEqualTo(NOW.minus(1, ChronoUnit.HOURS));
    assertThat(timeRange.getTo()).isEqualTo(NOW.minus(5, ChronoUnit.MINUTES));
  }
}

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

import com.rackspace.minerva.app.exceptions.BadQueryException;
import com.rackspace.minerva.app.model.TimeRange;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.commons.lang3.StringUtils;

public class DateTimeUtils {

  public static final String DEFAULT_FROM = "now-6h";
  public static final String DEFAULT_TO = "now";

  public static final Pattern NOW_RELATIVE_PATTERN = Pattern.compile("now(?:-([0-9]+)(ms|s|m|h|d|w|M|y))?");
  public static final Pattern AGO_RELATIVE_PATTERN = Pattern.compile("([0-9]+)(ms|s|m|h|d|w|M|y)-ago");
  public static final Pattern EPOCH_MILLIS_PATTERN = Pattern.compile("\\d{13,}");
  public static final Pattern EPOCH_SECONDS_PATTERN = Pattern.compile("\\d{1,12}");

  private DateTimeUtils() {
  }

  /**
   * Parses the shared time range of a batch against the given reference instant.
   */
  public static TimeRange parseTimeRange(String from, String to, Instant now) {
    return new TimeRange(
        parseInstant(StringUtils.defaultIfBlank(from, DEFAULT_FROM), now),
        parseInstant(StringUtils.defaultIfBlank(to, DEFAULT_TO), now)
    );
  }

  /**
   * Gets the instant for one of: <code>now</code>, <code>now-5m</code>,
   * <code>5m-ago</code>, epoch millis, epoch seconds or an ISO-8601 instant.
   */
  public static Instant parseInstant(String value, Instant now) {
    String time = value.trim();
    try {
      Matcher nowMatch = NOW_RELATIVE_PATTERN.matcher(time);
      if (nowMatch.matches()) {
        return nowMatch.group(1) == null ? now :
            minus(now, Long.parseLong(nowMatch.group(1)), nowMatch.group(2));
      }
      Matcher agoMatch = AGO_RELATIVE_PATTERN.matcher(time);
      if (agoMatch.matches()) {
        return minus(now, Long.parseLong(agoMatch.group(1)), agoMatch.group(2));
      }
      if (EPOCH_MILLIS_PATTERN.matcher(time).matches()) {
        return Instant.ofEpochMilli(Long.parseLong(time));
      }
      if (EPOCH_SECONDS_PATTERN.matcher(time).matches()) {
        return Instant.ofEpochSecond(Long.parseLong(time));
      }
      return Instant.parse(time);
    } catch (NumberFormatException | DateTimeException | ArithmeticException e) {
      // DateTimeParseException is a DateTimeException
      throw new BadQueryException("invalid time range value: " + value);
    }
  }

  private static Instant minus(Instant now, long amount, String unit) {
    return switch (unit) {
      case "ms" -> now.minus(amount, ChronoUnit.MILLIS);
      case "s" -> now.minus(amount, ChronoUnit.SECONDS);
      case "m" -> now.minus(amount, ChronoUnit.MINUTES);
      case "h" -> now.minus(amount, ChronoUnit.HOURS);
      case "d" -> now.minus(amount, ChronoUnit.DAYS);
      case "w" -> now.minus(Math.multiplyExact(amount, 7), ChronoUnit.DAYS);
      // Instant has no month or year arithmetic
      case "M" -> now.atOffset(ZoneOffset.UTC).minusMonths(amount).toInstant();
      case "y" -> now.atOffset(ZoneOffset.UTC).minusYears(amount).toInstant();
      default -> throw new BadQueryException("invalid time unit: " + unit);
    };
  }
}

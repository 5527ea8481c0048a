package com.spot.facet;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts datetime values to epoch seconds and duration values to seconds. Datetimes without an
 * offset are taken to be UTC.
 */
public final class TimeTransform {
  private static final Pattern ISO_DURATION =
      Pattern.compile(
          "^P(?:([0-9.]+)Y)?(?:([0-9.]+)M)?(?:([0-9.]+)W)?(?:([0-9.]+)D)?"
              + "(?:T(?:([0-9.]+)H)?(?:([0-9.]+)M)?(?:([0-9.]+)S)?)?$",
          Pattern.CASE_INSENSITIVE);

  private static final DurationUnit[] ISO_DURATION_UNITS = {
    DurationUnit.YEARS,
    DurationUnit.MONTHS,
    DurationUnit.WEEKS,
    DurationUnit.DAYS,
    DurationUnit.HOURS,
    DurationUnit.MINUTES,
    DurationUnit.SECONDS
  };

  private static final List<Function<String, Instant>> DATETIME_PARSERS =
      List.of(
          Instant::parse,
          text -> OffsetDateTime.parse(text).toInstant(),
          text -> ZonedDateTime.parse(text).toInstant(),
          text -> LocalDateTime.parse(text).toInstant(ZoneOffset.UTC),
          text -> LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant());

  private TimeTransform() {}

  /** Parses an ISO-8601 datetime string, returning null when it is not one. */
  public static Instant parseDatetime(String value) {
    String text = value.trim();
    if (text.length() < 10 || !Character.isDigit(text.charAt(0))) {
      return null;
    }
    if (text.length() > 10 && text.charAt(10) == ' ') {
      text = text.substring(0, 10) + 'T' + text.substring(11);
    }
    for (Function<String, Instant> parser : DATETIME_PARSERS) {
      try {
        return parser.apply(text);
      } catch (DateTimeParseException e) {
        // not in this format, try the next one
      }
    }
    return null;
  }

  /** Parses an ISO-8601 duration such as {@code P1Y2M} or {@code PT1.5H} to seconds. */
  public static Double parseDuration(String value) {
    Matcher matcher = ISO_DURATION.matcher(value.trim());
    if (!matcher.matches() || value.trim().length() < 3) {
      return null;
    }
    double seconds = 0;
    for (int i = 0; i < ISO_DURATION_UNITS.length; i++) {
      String amount = matcher.group(i + 1);
      if (amount != null) {
        try {
          seconds += ISO_DURATION_UNITS[i].toSeconds(Double.parseDouble(amount));
        } catch (NumberFormatException e) {
          return null;
        }
      }
    }
    return seconds;
  }

  /** Epoch seconds for a datetime value; numbers are taken to be epoch seconds already. */
  public static Double datetimeToSeconds(Object raw) {
    if (raw instanceof Number number) {
      return number.doubleValue();
    }
    if (raw instanceof Instant instant) {
      return instant.getEpochSecond() + instant.getNano() / 1e9;
    }
    Instant instant = parseDatetime(raw.toString());
    if (instant == null) {
      return null;
    }
    return instant.getEpochSecond() + instant.getNano() / 1e9;
  }

  /** Seconds for a duration value; plain numbers are interpreted in the given unit. */
  public static Double durationToSeconds(Object raw, DurationUnit unit) {
    if (raw instanceof Number number) {
      return unit.toSeconds(number.doubleValue());
    }
    String text = raw.toString().trim();
    if (!text.isEmpty() && (text.charAt(0) == 'P' || text.charAt(0) == 'p')) {
      return parseDuration(text);
    }
    Double number = FacetValues.parseNumber(text);
    return number == null ? null : unit.toSeconds(number);
  }
}

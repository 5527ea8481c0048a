package com.spot.facet;

import java.util.Locale;

/** Units a plain numeric duration value can be expressed in, with their length in seconds. */
public enum DurationUnit {
  YEARS(365.25 * 86400),
  MONTHS(30 * 86400),
  WEEKS(7 * 86400),
  DAYS(86400),
  HOURS(3600),
  MINUTES(60),
  SECONDS(1),
  MILLISECONDS(0.001);

  private final double seconds;

  DurationUnit(double seconds) {
    this.seconds = seconds;
  }

  public double toSeconds(double amount) {
    return amount * seconds;
  }

  public static DurationUnit fromString(String unit) {
    return valueOf(unit.trim().toUpperCase(Locale.ROOT));
  }
}

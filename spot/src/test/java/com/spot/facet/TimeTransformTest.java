package com.spot.facet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.time.Instant;
import org.junit.jupiter.api.Test;

public class TimeTransformTest {

  @Test
  public void testParseDatetime() {
    assertThat(TimeTransform.parseDatetime("2020-01-01T00:00:00Z"))
        .isEqualTo(Instant.parse("2020-01-01T00:00:00Z"));
    assertThat(TimeTransform.parseDatetime("2020-01-01T02:00:00+02:00"))
        .isEqualTo(Instant.parse("2020-01-01T00:00:00Z"));
    assertThat(TimeTransform.parseDatetime("2020-01-01 06:30:00"))
        .isEqualTo(Instant.parse("2020-01-01T06:30:00Z"));
    assertThat(TimeTransform.parseDatetime("2020-01-01"))
        .isEqualTo(Instant.parse("2020-01-01T00:00:00Z"));
    assertThat(TimeTransform.parseDatetime("20200101")).isNull();
    assertThat(TimeTransform.parseDatetime("yesterday, 5pm")).isNull();
    assertThat(TimeTransform.parseDatetime("2020-13-45")).isNull();
  }

  @Test
  public void testParseDuration() {
    assertThat(TimeTransform.parseDuration("P1DT2H")).isEqualTo(93600.0);
    assertThat(TimeTransform.parseDuration("P1W")).isEqualTo(604800.0);
    assertThat(TimeTransform.parseDuration("PT1.5H")).isEqualTo(5400.0);
    assertThat(TimeTransform.parseDuration("pt90s")).isEqualTo(90.0);
    assertThat(TimeTransform.parseDuration("P")).isNull();
    assertThat(TimeTransform.parseDuration("PT")).isNull();
    assertThat(TimeTransform.parseDuration("P1..2D")).isNull();
    assertThat(TimeTransform.parseDuration("90 seconds")).isNull();
  }

  @Test
  public void testDurationToSeconds() {
    assertThat(TimeTransform.durationToSeconds(90, DurationUnit.SECONDS)).isEqualTo(90.0);
    assertThat(TimeTransform.durationToSeconds("1.5", DurationUnit.HOURS)).isEqualTo(5400.0);
    assertThat(TimeTransform.durationToSeconds("PT1M", DurationUnit.DAYS)).isEqualTo(60.0);
    assertThat(TimeTransform.durationToSeconds(250, DurationUnit.MILLISECONDS))
        .isCloseTo(0.25, within(1e-12));
    assertThat(TimeTransform.durationToSeconds("long", DurationUnit.SECONDS)).isNull();
  }

  @Test
  public void testDurationUnitFromString() {
    assertThat(DurationUnit.fromString("minutes")).isEqualTo(DurationUnit.MINUTES);
    assertThat(DurationUnit.DAYS.toSeconds(2)).isEqualTo(172800.0);
  }
}

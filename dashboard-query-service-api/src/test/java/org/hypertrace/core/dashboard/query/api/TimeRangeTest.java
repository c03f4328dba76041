package org.hypertrace.core.dashboard.query.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class TimeRangeTest {

  @Test
  void computesDurationBetweenInstants() {
    TimeRange timeRange = TimeRange.ofEpochSeconds(1_700_000_000L, 1_700_000_300L);
    assertEquals(Duration.ofMinutes(5), timeRange.getDuration());
    assertEquals(300, timeRange.getDurationSeconds());
  }

  @Test
  void rejectsRangeThatDoesNotMoveForward() {
    Instant now = Instant.parse("2023-11-14T22:13:20Z");
    assertThrows(IllegalArgumentException.class, () -> TimeRange.of(now, now));
    assertThrows(IllegalArgumentException.class, () -> TimeRange.of(now, now.minusSeconds(1)));
    assertThrows(NullPointerException.class, () -> TimeRange.of(null, now));
  }
}

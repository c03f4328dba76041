package org.hypertrace.core.dashboard.query.api;

import com.google.common.base.Preconditions;
import java.time.Duration;
import java.time.Instant;
import lombok.Value;

/** Absolute query window. {@code from} is always strictly before {@code to}. */
@Value
public class TimeRange {

  Instant from;
  Instant to;

  private TimeRange(Instant from, Instant to) {
    Preconditions.checkNotNull(from, "from must be set");
    Preconditions.checkNotNull(to, "to must be set");
    Preconditions.checkArgument(
        from.isBefore(to), "time range start %s must be before its end %s", from, to);
    this.from = from;
    this.to = to;
  }

  public static TimeRange of(Instant from, Instant to) {
    return new TimeRange(from, to);
  }

  public static TimeRange ofEpochSeconds(long fromSeconds, long toSeconds) {
    return new TimeRange(Instant.ofEpochSecond(fromSeconds), Instant.ofEpochSecond(toSeconds));
  }

  public Duration getDuration() {
    return Duration.between(from, to);
  }

  public long getDurationSeconds() {
    return getDuration().getSeconds();
  }
}

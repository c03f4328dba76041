package org.hypertrace.core.dashboard.query.service.interval;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;
import javax.inject.Inject;
import javax.inject.Singleton;
import lombok.Value;
import org.hypertrace.core.dashboard.query.api.TimeRange;
import org.hypertrace.core.dashboard.query.service.DashboardQueryServiceConfig;

/**
 * Picks the bucket size a time series query is aggregated at. The result grows with the queried
 * duration, never drops below the floor mandated for that duration and is always one of {@link
 * #STANDARD_BUCKET_SECONDS}.
 */
@Singleton
public class IntervalResolver {

  public static final List<Long> STANDARD_BUCKET_SECONDS =
      ImmutableList.of(
          30L, 60L, 120L, 300L, 600L, 900L, 1800L, 3600L, 10800L, 21600L, 43200L, 86400L);

  // Ordered by descending threshold, first match wins.
  private static final List<DurationFloor> DURATION_FLOORS =
      ImmutableList.of(
          new DurationFloor(30 * 86400L + 1, 43200L),
          new DurationFloor(7 * 86400L + 1, 21600L),
          new DurationFloor(86400L + 1, 10800L),
          new DurationFloor(12 * 3600L + 1, 3600L),
          new DurationFloor(6 * 3600L + 1, 1800L),
          new DurationFloor(3600L + 1, 120L),
          new DurationFloor(1800L + 1, 60L));

  private final int targetPointCount;
  private final long minimumBucketSeconds;

  @Inject
  IntervalResolver(DashboardQueryServiceConfig config) {
    this(
        config.getIntervalConfig().getTargetPointCount(),
        config.getIntervalConfig().getMinimumBucket().getSeconds());
  }

  public IntervalResolver(int targetPointCount, long minimumBucketSeconds) {
    Preconditions.checkArgument(targetPointCount > 0, "target point count must be positive");
    Preconditions.checkArgument(minimumBucketSeconds > 0, "minimum bucket must be positive");
    this.targetPointCount = targetPointCount;
    this.minimumBucketSeconds = minimumBucketSeconds;
  }

  public long resolve(TimeRange timeRange) {
    return resolve(timeRange.getDurationSeconds());
  }

  public long resolve(long durationSeconds) {
    long duration = durationSeconds > 0 ? durationSeconds : minimumBucketSeconds;
    long ideal = (duration + targetPointCount - 1) / targetPointCount;
    long candidate = Math.max(minimumBucketSeconds, Math.max(ideal, durationFloor(duration)));
    return roundUpToStandard(candidate);
  }

  public int getTargetPointCount() {
    return targetPointCount;
  }

  private static long durationFloor(long durationSeconds) {
    return DURATION_FLOORS.stream()
        .filter(floor -> durationSeconds >= floor.getThresholdSeconds())
        .findFirst()
        .map(DurationFloor::getMinimumBucketSeconds)
        .orElse(0L);
  }

  private static long roundUpToStandard(long candidateSeconds) {
    return STANDARD_BUCKET_SECONDS.stream()
        .filter(standard -> standard >= candidateSeconds)
        .findFirst()
        .orElse(STANDARD_BUCKET_SECONDS.get(STANDARD_BUCKET_SECONDS.size() - 1));
  }

  @Value
  private static class DurationFloor {
    long thresholdSeconds;
    long minimumBucketSeconds;
  }
}

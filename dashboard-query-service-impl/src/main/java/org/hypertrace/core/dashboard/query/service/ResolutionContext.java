package org.hypertrace.core.dashboard.query.service;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentLinkedQueue;
import org.hypertrace.core.dashboard.query.api.DatasourceRef;
import org.hypertrace.core.dashboard.query.api.Diagnostic;
import org.hypertrace.core.dashboard.query.api.TimeRange;

/**
 * Holds the state that the pipeline components share during one dashboard execution: the time
 * window and bucket, the run's deadline, the datasource directory fetched for this run and the
 * diagnostics collected so far. A context is created per run and discarded afterwards, nothing in
 * it is shared between concurrent executions.
 */
public class ResolutionContext {

  public static final String DEFAULT_DATASOURCE_ALIAS = "default";

  private final String dashboardId;
  private final TimeRange timeRange;
  private final long bucketSeconds;
  private final int maxDataPoints;
  private final Duration deadline;
  private final Instant deadlineInstant;
  private final Clock clock;
  // keyed by lower-cased datasource name and by uid
  private final Map<String, DatasourceRef> datasourceDirectory;
  private final ConcurrentLinkedQueue<Diagnostic> diagnostics = new ConcurrentLinkedQueue<>();

  public ResolutionContext(
      String dashboardId,
      TimeRange timeRange,
      long bucketSeconds,
      int maxDataPoints,
      Duration deadline,
      Map<String, DatasourceRef> datasourceDirectory) {
    this(
        dashboardId,
        timeRange,
        bucketSeconds,
        maxDataPoints,
        deadline,
        datasourceDirectory,
        Clock.systemUTC());
  }

  ResolutionContext(
      String dashboardId,
      TimeRange timeRange,
      long bucketSeconds,
      int maxDataPoints,
      Duration deadline,
      Map<String, DatasourceRef> datasourceDirectory,
      Clock clock) {
    this(
        dashboardId,
        timeRange,
        bucketSeconds,
        maxDataPoints,
        deadline,
        clock.instant().plus(deadline),
        datasourceDirectory,
        clock);
  }

  /** Continues a run whose clock started at {@code deadlineInstant} minus {@code deadline}. */
  public ResolutionContext(
      String dashboardId,
      TimeRange timeRange,
      long bucketSeconds,
      int maxDataPoints,
      Duration deadline,
      Instant deadlineInstant,
      Map<String, DatasourceRef> datasourceDirectory) {
    this(
        dashboardId,
        timeRange,
        bucketSeconds,
        maxDataPoints,
        deadline,
        deadlineInstant,
        datasourceDirectory,
        Clock.systemUTC());
  }

  ResolutionContext(
      String dashboardId,
      TimeRange timeRange,
      long bucketSeconds,
      int maxDataPoints,
      Duration deadline,
      Instant deadlineInstant,
      Map<String, DatasourceRef> datasourceDirectory,
      Clock clock) {
    this.dashboardId = dashboardId;
    this.timeRange = timeRange;
    this.bucketSeconds = bucketSeconds;
    this.maxDataPoints = maxDataPoints;
    this.deadline = deadline;
    this.clock = clock;
    this.deadlineInstant = deadlineInstant;
    ImmutableMap.Builder<String, DatasourceRef> directory = ImmutableMap.builder();
    datasourceDirectory.forEach(
        (name, ref) -> directory.put(name.toLowerCase(Locale.ROOT), ref));
    this.datasourceDirectory = directory.buildKeepingLast();
  }

  public String getDashboardId() {
    return dashboardId;
  }

  public TimeRange getTimeRange() {
    return timeRange;
  }

  public long getBucketSeconds() {
    return bucketSeconds;
  }

  public int getMaxDataPoints() {
    return maxDataPoints;
  }

  public Duration getDeadline() {
    return deadline;
  }

  /** Time left before the run's deadline, never negative. */
  public Duration getRemaining() {
    Duration remaining = Duration.between(clock.instant(), deadlineInstant);
    return remaining.isNegative() ? Duration.ZERO : remaining;
  }

  /**
   * Resolves a datasource reference by name, alias or uid. Unknown values are assumed to already
   * be uids.
   */
  public DatasourceRef resolveDatasource(DatasourceRef reference) {
    return lookupDatasource(reference.getUid())
        .map(
            found ->
                reference.getTypeOptional().isPresent() && found.getTypeOptional().isEmpty()
                    ? DatasourceRef.of(found.getUid(), reference.getType())
                    : found)
        .orElse(reference);
  }

  public Optional<DatasourceRef> lookupDatasource(String nameOrUid) {
    return Optional.ofNullable(datasourceDirectory.get(nameOrUid.toLowerCase(Locale.ROOT)));
  }

  public Optional<DatasourceRef> getDefaultDatasource() {
    return lookupDatasource(DEFAULT_DATASOURCE_ALIAS);
  }

  public void addDiagnostic(Diagnostic diagnostic) {
    this.diagnostics.add(diagnostic);
  }

  public List<Diagnostic> getDiagnostics() {
    return ImmutableList.copyOf(this.diagnostics);
  }
}

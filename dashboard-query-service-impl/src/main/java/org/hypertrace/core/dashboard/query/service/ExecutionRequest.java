package org.hypertrace.core.dashboard.query.service;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import javax.annotation.Nullable;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import org.hypertrace.core.dashboard.query.api.TimeRange;

@Value
@Builder
public class ExecutionRequest {
  @NonNull String dashboardId;
  @NonNull TimeRange timeRange;

  /** Panels to execute; all panels when empty. */
  @Singular Set<String> panelIds;

  /** User selections by variable name, always winning over the dashboard's own selection. */
  @Singular Map<String, List<String>> variableOverrides;

  /** Overrides the configured execution deadline for this run. */
  @Nullable Duration deadline;

  public Optional<Duration> getDeadlineOptional() {
    return Optional.ofNullable(deadline);
  }
}

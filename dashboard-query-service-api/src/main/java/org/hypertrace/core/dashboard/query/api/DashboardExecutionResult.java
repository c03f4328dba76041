package org.hypertrace.core.dashboard.query.api;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Outcome of one dashboard run: whatever results could be produced plus the diagnostics for
 * everything that could not.
 */
@Value
@Builder
public class DashboardExecutionResult {
  @NonNull String dashboardId;
  long bucketSeconds;
  @Singular Map<String, List<String>> variables;
  @Singular List<NormalizedResult> results;
  @Singular List<Diagnostic> diagnostics;

  public List<Diagnostic> getDiagnostics(DiagnosticType type) {
    return diagnostics.stream()
        .filter(diagnostic -> diagnostic.getType() == type)
        .collect(Collectors.toUnmodifiableList());
  }

  public List<NormalizedResult> getResultsForPanel(String panelId) {
    return results.stream()
        .filter(result -> result.getPanelInfo().getPanelId().equals(panelId))
        .collect(Collectors.toUnmodifiableList());
  }
}

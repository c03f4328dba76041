package org.hypertrace.core.dashboard.query.service;

import com.google.common.base.Splitter;
import java.time.Instant;
import java.util.Map;
import java.util.Set;
import org.hypertrace.core.dashboard.query.api.DashboardExecutionResult;
import org.hypertrace.core.dashboard.query.api.DatasourceRef;
import org.hypertrace.core.dashboard.query.api.TimeRange;

/** Entry point for executing dashboards and ad-hoc queries against the configured backends. */
public interface DashboardQueryService {

  /**
   * Executes the requested panels of a dashboard.
   *
   * @throws DashboardNotFoundException if no configured backend knows the dashboard
   * @throws NoExecutableQueriesException if the selected panels yield nothing to run
   * @throws BackendBatchFailureException if the batched backend call fails or times out
   */
  DashboardExecutionResult executeDashboard(ExecutionRequest request);

  /**
   * Convenience variant taking overrides as they arrive from a command line or query string, with
   * multiple values of one variable separated by commas.
   */
  default DashboardExecutionResult executeDashboard(
      String dashboardId,
      Instant from,
      Instant to,
      Set<String> panelIds,
      Map<String, String> variableOverrides) {
    ExecutionRequest.ExecutionRequestBuilder request =
        ExecutionRequest.builder()
            .dashboardId(dashboardId)
            .timeRange(TimeRange.of(from, to))
            .panelIds(panelIds);
    variableOverrides.forEach(
        (name, value) ->
            request.variableOverride(
                name, Splitter.on(',').trimResults().omitEmptyStrings().splitToList(value)));
    return executeDashboard(request.build());
  }

  /** Runs a single expression against the default backend as a time series query. */
  DashboardExecutionResult executeSingleQuery(
      String expression, DatasourceRef datasource, Instant from, Instant to);
}

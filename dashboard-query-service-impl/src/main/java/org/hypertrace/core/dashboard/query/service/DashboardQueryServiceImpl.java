package org.hypertrace.core.dashboard.query.service;

import io.reactivex.rxjava3.core.Single;
import io.reactivex.rxjava3.schedulers.Schedulers;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import javax.inject.Inject;
import javax.inject.Singleton;
import lombok.extern.slf4j.Slf4j;
import org.hypertrace.core.dashboard.query.api.DashboardDefinition;
import org.hypertrace.core.dashboard.query.api.DashboardExecutionResult;
import org.hypertrace.core.dashboard.query.api.DatasourceRef;
import org.hypertrace.core.dashboard.query.api.TimeRange;

@Singleton
@Slf4j
class DashboardQueryServiceImpl implements DashboardQueryService {

  private final BackendRegistry backendRegistry;
  private final DashboardExecutor executor;

  @Inject
  DashboardQueryServiceImpl(BackendRegistry backendRegistry, DashboardExecutor executor) {
    this.backendRegistry = backendRegistry;
    this.executor = executor;
  }

  @Override
  public DashboardExecutionResult executeDashboard(ExecutionRequest request) {
    Duration deadline = executor.deadlineOf(request);
    Instant deadlineInstant = Instant.now().plus(deadline);
    for (Backend backend : backendRegistry.getAll()) {
      DashboardDefinition dashboard;
      try {
        dashboard = fetchDashboard(backend, request.getDashboardId(), deadline, deadlineInstant);
      } catch (DashboardNotFoundException e) {
        log.debug(
            "Dashboard {} not found on backend {}", request.getDashboardId(), backend.getName());
        continue;
      }
      try {
        return executor.execute(backend, dashboard, request, deadlineInstant);
      } catch (DashboardQueryException e) {
        log.error(
            "Dashboard {} failed on backend {}", request.getDashboardId(), backend.getName(), e);
        throw e;
      }
    }
    throw new DashboardNotFoundException(request.getDashboardId());
  }

  private static DashboardDefinition fetchDashboard(
      Backend backend, String dashboardId, Duration deadline, Instant deadlineInstant) {
    try {
      return Single.fromCallable(() -> backend.getDashboardStore().getDashboard(dashboardId))
          .subscribeOn(Schedulers.io())
          .timeout(DashboardExecutor.remainingMillis(deadlineInstant), TimeUnit.MILLISECONDS)
          .blockingGet();
    } catch (RuntimeException e) {
      if (e.getCause() instanceof TimeoutException) {
        log.error("Fetching dashboard {} from {} timed out", dashboardId, backend.getName());
        throw new ExecutionTimeoutException(dashboardId, deadline);
      }
      throw e;
    }
  }

  @Override
  public DashboardExecutionResult executeSingleQuery(
      String expression, DatasourceRef datasource, Instant from, Instant to) {
    return executor.executeSingleQuery(
        backendRegistry.getDefault(), expression, datasource, TimeRange.of(from, to));
  }
}

package org.hypertrace.core.dashboard.query.service;

import java.time.Duration;

public class ExecutionTimeoutException extends BackendBatchFailureException {

  public ExecutionTimeoutException(String dashboardId, Duration deadline) {
    super("Execution of dashboard " + dashboardId + " exceeded its deadline of " + deadline);
  }
}

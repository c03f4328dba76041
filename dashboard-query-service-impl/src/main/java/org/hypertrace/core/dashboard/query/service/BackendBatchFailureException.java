package org.hypertrace.core.dashboard.query.service;

/** The backend failed the whole batched request. Fatal for the dashboard run. */
public class BackendBatchFailureException extends DashboardQueryException {

  public BackendBatchFailureException(String message) {
    super(message);
  }

  public BackendBatchFailureException(String message, Throwable cause) {
    super(message, cause);
  }
}

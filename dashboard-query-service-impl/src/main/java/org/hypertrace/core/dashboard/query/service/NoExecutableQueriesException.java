package org.hypertrace.core.dashboard.query.service;

public class NoExecutableQueriesException extends DashboardQueryException {

  public NoExecutableQueriesException(String dashboardId) {
    super("No executable query could be built for dashboard " + dashboardId);
  }
}

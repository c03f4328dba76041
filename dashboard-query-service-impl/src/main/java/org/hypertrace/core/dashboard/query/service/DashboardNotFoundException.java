package org.hypertrace.core.dashboard.query.service;

public class DashboardNotFoundException extends DashboardQueryException {

  public DashboardNotFoundException(String dashboardId) {
    super("Dashboard not found: " + dashboardId);
  }
}

package org.hypertrace.core.dashboard.query.service;

import org.hypertrace.core.dashboard.query.api.DashboardDefinition;

public interface DashboardStore {

  /**
   * @throws DashboardNotFoundException if the backend holds no dashboard with this id
   */
  DashboardDefinition getDashboard(String dashboardId);
}

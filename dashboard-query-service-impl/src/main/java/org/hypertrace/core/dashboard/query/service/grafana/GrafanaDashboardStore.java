package org.hypertrace.core.dashboard.query.service.grafana;

import org.hypertrace.core.dashboard.query.api.DashboardDefinition;
import org.hypertrace.core.dashboard.query.service.DashboardStore;

class GrafanaDashboardStore implements DashboardStore {

  private final GrafanaRestClient restClient;

  GrafanaDashboardStore(GrafanaRestClient restClient) {
    this.restClient = restClient;
  }

  @Override
  public DashboardDefinition getDashboard(String dashboardId) {
    return restClient
        .getDashboard(dashboardId)
        .map(json -> GrafanaDashboardParser.parse(dashboardId, json))
        .blockingGet();
  }
}

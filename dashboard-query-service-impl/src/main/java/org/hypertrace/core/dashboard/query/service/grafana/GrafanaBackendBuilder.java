package org.hypertrace.core.dashboard.query.service.grafana;

import javax.inject.Inject;
import org.hypertrace.core.dashboard.query.service.Backend;
import org.hypertrace.core.dashboard.query.service.BackendBuilder;
import org.hypertrace.core.dashboard.query.service.DashboardQueryServiceConfig.BackendConfig;

public class GrafanaBackendBuilder implements BackendBuilder {
  static final String GRAFANA_BACKEND_TYPE = "grafana";

  private final GrafanaRestClientFactory grafanaRestClientFactory;

  @Inject
  GrafanaBackendBuilder(GrafanaRestClientFactory grafanaRestClientFactory) {
    this.grafanaRestClientFactory = grafanaRestClientFactory;
  }

  @Override
  public boolean canBuild(BackendConfig config) {
    return GRAFANA_BACKEND_TYPE.equals(config.getType());
  }

  @Override
  public Backend build(BackendConfig config) {
    GrafanaRestClient restClient =
        grafanaRestClientFactory.getGrafanaClient(new GrafanaBackendConfig(config));
    return new Backend(
        config.getName(),
        new GrafanaBackendClient(restClient),
        new GrafanaDashboardStore(restClient));
  }
}

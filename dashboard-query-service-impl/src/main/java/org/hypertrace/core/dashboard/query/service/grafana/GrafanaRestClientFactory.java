package org.hypertrace.core.dashboard.query.service.grafana;

import java.util.concurrent.ConcurrentHashMap;
import javax.inject.Singleton;

@Singleton
class GrafanaRestClientFactory {

  private final ConcurrentHashMap<GrafanaBackendConfig, GrafanaRestClient> clientMap =
      new ConcurrentHashMap<>();

  GrafanaRestClient getGrafanaClient(GrafanaBackendConfig config) {
    return this.clientMap.computeIfAbsent(config, GrafanaRestClient::new);
  }
}

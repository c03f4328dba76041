package org.hypertrace.core.dashboard.query.service.grafana;

import static org.hypertrace.core.dashboard.query.service.grafana.GrafanaTestSupport.backendConfig;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.when;

import org.hypertrace.core.dashboard.query.service.Backend;
import org.hypertrace.core.dashboard.query.service.DashboardQueryServiceConfig.BackendConfig;
import org.junit.jupiter.api.Test;

class GrafanaBackendBuilderTest {
  private final GrafanaRestClientFactory restClientFactory = new GrafanaRestClientFactory();
  private final GrafanaBackendBuilder backendBuilder = new GrafanaBackendBuilder(restClientFactory);

  @Test
  void buildsOnlyGrafanaBackends() {
    assertTrue(backendBuilder.canBuild(grafana("ops", "http://grafana:3000")));
    BackendConfig other = backendConfig("http://prometheus:9090", "");
    when(other.getType()).thenReturn("prometheus");
    assertFalse(backendBuilder.canBuild(other));
  }

  @Test
  void buildsNamedBackends() {
    Backend backend = backendBuilder.build(grafana("ops", "http://grafana:3000"));

    assertEquals("ops", backend.getName());
    assertInstanceOf(GrafanaBackendClient.class, backend.getClient());
    assertInstanceOf(GrafanaDashboardStore.class, backend.getDashboardStore());
  }

  @Test
  void sharesRestClientsPerConnection() {
    GrafanaBackendConfig first =
        new GrafanaBackendConfig(grafana("ops", "http://grafana:3000/"));
    GrafanaBackendConfig second = new GrafanaBackendConfig(grafana("ops", "http://grafana:3000"));
    GrafanaBackendConfig elsewhere =
        new GrafanaBackendConfig(grafana("lab", "http://grafana-lab:3000"));

    assertSame(
        restClientFactory.getGrafanaClient(first), restClientFactory.getGrafanaClient(second));
    assertNotSame(
        restClientFactory.getGrafanaClient(first), restClientFactory.getGrafanaClient(elsewhere));
  }

  private static BackendConfig grafana(String name, String url) {
    BackendConfig config = backendConfig(url, "apiKey = secret");
    when(config.getName()).thenReturn(name);
    when(config.getType()).thenReturn(GrafanaBackendBuilder.GRAFANA_BACKEND_TYPE);
    return config;
  }
}

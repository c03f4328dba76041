package org.hypertrace.core.dashboard.query.service.grafana;

import static org.hypertrace.core.dashboard.query.service.grafana.GrafanaTestSupport.backendConfig;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class GrafanaBackendConfigTest {

  @Test
  void readsBackendInfo() {
    GrafanaBackendConfig config =
        new GrafanaBackendConfig(
            backendConfig(
                "https://grafana.example.com/",
                "apiKey = glsa_123\nrequestTimeout = 10s\nretry.maxAttempts = 5"));

    assertEquals("https://grafana.example.com", config.getBaseUrl());
    assertEquals(Optional.of("glsa_123"), config.getApiKeyOptional());
    assertEquals(Duration.ofSeconds(10), config.getRequestTimeout());
    assertEquals(5, config.getRetryMaxAttempts());
    assertEquals(Duration.ofSeconds(1), config.getRetryFallbackDelay());
  }

  @Test
  void defaultsWithoutBackendInfo() {
    GrafanaBackendConfig config =
        new GrafanaBackendConfig(backendConfig("http://localhost:3000", ""));

    assertEquals(Optional.empty(), config.getApiKeyOptional());
    assertEquals(Duration.ofSeconds(30), config.getRequestTimeout());
    assertEquals(3, config.getRetryMaxAttempts());
  }

  @Test
  void rejectsNonPositiveAttempts() {
    assertThrows(
        IllegalArgumentException.class,
        () ->
            new GrafanaBackendConfig(
                backendConfig("http://localhost:3000", "retry.maxAttempts = 0")));
  }
}

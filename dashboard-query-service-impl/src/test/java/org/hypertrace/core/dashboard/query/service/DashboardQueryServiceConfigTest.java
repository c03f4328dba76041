package org.hypertrace.core.dashboard.query.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import java.time.Duration;
import java.util.Map;
import org.hypertrace.core.dashboard.query.service.DashboardQueryServiceConfig.BackendConfig;
import org.junit.jupiter.api.Test;

class DashboardQueryServiceConfigTest {

  @Test
  void readsTheApplicationConfig() {
    DashboardQueryServiceConfig config = new DashboardQueryServiceConfig(loadApplicationConfig());

    assertEquals(100, config.getIntervalConfig().getTargetPointCount());
    assertEquals(Duration.ofSeconds(30), config.getIntervalConfig().getMinimumBucket());
    assertEquals("ABCDEFGH", config.getRefIdAlphabet());
    assertEquals(4, config.getVariableQueryParallelism());
    assertEquals(Duration.ofSeconds(20), config.getExecutionDeadline());

    assertEquals(2, config.getBackendConfigs().size());
    BackendConfig primary = config.getBackendConfigs().get(0);
    assertEquals("primary", primary.getName());
    assertEquals("grafana", primary.getType());
    assertEquals("http://localhost:3000", primary.getConnectionString());
    assertEquals("test-key", primary.getBackendInfo().getString("apiKey"));
    BackendConfig secondary = config.getBackendConfigs().get(1);
    assertEquals("secondary", secondary.getName());
    assertTrue(secondary.getBackendInfo().isEmpty());
  }

  @Test
  void fallsBackToReferenceDefaults() {
    DashboardQueryServiceConfig config = new DashboardQueryServiceConfig(ConfigFactory.empty());

    assertEquals(70, config.getIntervalConfig().getTargetPointCount());
    assertEquals("ABCDEFGHIJKLMNOPQRSTUVWXYZ", config.getRefIdAlphabet());
    assertEquals(Duration.ofSeconds(60), config.getExecutionDeadline());
    assertTrue(config.getBackendConfigs().isEmpty());
  }

  @Test
  void rejectsInvalidValues() {
    assertThrows(
        IllegalArgumentException.class,
        () ->
            new DashboardQueryServiceConfig(
                ConfigFactory.parseMap(Map.of("dashboard.query.refIdAlphabet", ""))));
    assertThrows(
        IllegalArgumentException.class,
        () ->
            new DashboardQueryServiceConfig(
                ConfigFactory.parseMap(
                    Map.of("dashboard.query.variables.queryParallelism", 0))));
  }

  static Config loadApplicationConfig() {
    return ConfigFactory.parseURL(
        DashboardQueryServiceConfigTest.class.getClassLoader().getResource("application.conf"));
  }
}

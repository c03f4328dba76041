package org.hypertrace.core.dashboard.query.service.grafana;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.typesafe.config.ConfigFactory;
import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import org.hypertrace.core.dashboard.query.api.TimeRange;
import org.hypertrace.core.dashboard.query.service.DashboardQueryServiceConfig.BackendConfig;

final class GrafanaTestSupport {
  static final TimeRange TIME_RANGE = TimeRange.ofEpochSeconds(1_700_000_000L, 1_700_003_600L);

  private GrafanaTestSupport() {}

  static String readResource(String path) throws IOException, URISyntaxException {
    return new String(
        Files.readAllBytes(
            Paths.get(GrafanaTestSupport.class.getClassLoader().getResource(path).toURI())),
        StandardCharsets.UTF_8);
  }

  static BackendConfig backendConfig(String url, String backendInfo) {
    BackendConfig backendConfig = mock(BackendConfig.class);
    when(backendConfig.getConnectionString()).thenReturn(url);
    when(backendConfig.getBackendInfo()).thenReturn(ConfigFactory.parseString(backendInfo));
    return backendConfig;
  }

  static GrafanaBackendConfig grafanaConfig(String url) {
    return new GrafanaBackendConfig(
        backendConfig(
            url,
            "apiKey = secret\n"
                + "requestTimeout = 5s\n"
                + "retry { maxAttempts = 2, fallbackDelay = 10ms }"));
  }
}

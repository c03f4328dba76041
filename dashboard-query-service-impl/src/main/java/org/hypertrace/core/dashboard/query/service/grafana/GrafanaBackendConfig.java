package org.hypertrace.core.dashboard.query.service.grafana;

import com.google.common.base.Preconditions;
import com.typesafe.config.Config;
import java.time.Duration;
import java.util.Optional;
import javax.annotation.Nullable;
import lombok.Value;
import org.hypertrace.core.dashboard.query.service.DashboardQueryServiceConfig.BackendConfig;

@Value
class GrafanaBackendConfig {
  private static final String CONFIG_PATH_API_KEY = "apiKey";
  private static final String CONFIG_PATH_REQUEST_TIMEOUT = "requestTimeout";
  private static final String CONFIG_PATH_RETRY_MAX_ATTEMPTS = "retry.maxAttempts";
  private static final String CONFIG_PATH_RETRY_FALLBACK_DELAY = "retry.fallbackDelay";

  private static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);
  private static final int DEFAULT_RETRY_MAX_ATTEMPTS = 3;
  private static final Duration DEFAULT_RETRY_FALLBACK_DELAY = Duration.ofSeconds(1);

  String baseUrl;
  @Nullable String apiKey;
  Duration requestTimeout;
  int retryMaxAttempts;
  Duration retryFallbackDelay;

  GrafanaBackendConfig(BackendConfig backendConfig) {
    Config info = backendConfig.getBackendInfo();
    this.baseUrl = stripTrailingSlash(backendConfig.getConnectionString());
    this.apiKey = info.hasPath(CONFIG_PATH_API_KEY) ? info.getString(CONFIG_PATH_API_KEY) : null;
    this.requestTimeout =
        info.hasPath(CONFIG_PATH_REQUEST_TIMEOUT)
            ? info.getDuration(CONFIG_PATH_REQUEST_TIMEOUT)
            : DEFAULT_REQUEST_TIMEOUT;
    this.retryMaxAttempts =
        info.hasPath(CONFIG_PATH_RETRY_MAX_ATTEMPTS)
            ? info.getInt(CONFIG_PATH_RETRY_MAX_ATTEMPTS)
            : DEFAULT_RETRY_MAX_ATTEMPTS;
    this.retryFallbackDelay =
        info.hasPath(CONFIG_PATH_RETRY_FALLBACK_DELAY)
            ? info.getDuration(CONFIG_PATH_RETRY_FALLBACK_DELAY)
            : DEFAULT_RETRY_FALLBACK_DELAY;
    Preconditions.checkArgument(
        this.retryMaxAttempts > 0, "%s must be positive", CONFIG_PATH_RETRY_MAX_ATTEMPTS);
  }

  Optional<String> getApiKeyOptional() {
    return Optional.ofNullable(apiKey).filter(key -> !key.isBlank());
  }

  private static String stripTrailingSlash(String url) {
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }
}

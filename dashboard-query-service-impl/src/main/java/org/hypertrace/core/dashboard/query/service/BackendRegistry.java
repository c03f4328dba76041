package org.hypertrace.core.dashboard.query.service;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.hypertrace.core.dashboard.query.service.DashboardQueryServiceConfig.BackendConfig;

@Singleton
public class BackendRegistry {
  private final List<Backend> backends;

  @Inject
  BackendRegistry(DashboardQueryServiceConfig config, Set<BackendBuilder> backendBuilders) {
    this.backends =
        config.getBackendConfigs().stream()
            .map(backendConfig -> buildFromMatchingBuilder(backendBuilders, backendConfig))
            .collect(Collectors.toUnmodifiableList());
  }

  /** All backends in configuration order. */
  public List<Backend> getAll() {
    return backends;
  }

  /** The first configured backend, used for ad-hoc queries. */
  public Backend getDefault() {
    return backends.stream()
        .findFirst()
        .orElseThrow(() -> new DashboardQueryException("No backend configured"));
  }

  private Backend buildFromMatchingBuilder(Set<BackendBuilder> builders, BackendConfig config) {
    return builders.stream()
        .filter(builder -> builder.canBuild(config))
        .findFirst()
        .map(builder -> builder.build(config))
        .orElseThrow(
            () ->
                new UnsupportedOperationException(
                    "No builder registered matching provided config: " + config.toString()));
  }
}

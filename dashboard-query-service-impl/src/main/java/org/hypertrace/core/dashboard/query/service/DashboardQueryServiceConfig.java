package org.hypertrace.core.dashboard.query.service;

import com.google.common.base.Preconditions;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;
import lombok.Value;
import lombok.experimental.NonFinal;

@Value
@NonFinal
public class DashboardQueryServiceConfig {

  private static final String CONFIG_PATH_ROOT = "dashboard.query";
  private static final String CONFIG_PATH_INTERVAL = "interval";
  private static final String CONFIG_PATH_REF_ID_ALPHABET = "refIdAlphabet";
  private static final String CONFIG_PATH_VARIABLE_QUERY_PARALLELISM =
      "variables.queryParallelism";
  private static final String CONFIG_PATH_EXECUTION_DEADLINE = "execution.deadline";
  private static final String CONFIG_PATH_BACKENDS = "backends";

  IntervalConfig intervalConfig;
  String refIdAlphabet;
  int variableQueryParallelism;
  Duration executionDeadline;
  List<BackendConfig> backendConfigs;

  DashboardQueryServiceConfig(Config config) {
    Config resolved =
        config.withFallback(ConfigFactory.defaultReference()).resolve().getConfig(CONFIG_PATH_ROOT);
    this.intervalConfig = new IntervalConfig(resolved.getConfig(CONFIG_PATH_INTERVAL));
    this.refIdAlphabet = resolved.getString(CONFIG_PATH_REF_ID_ALPHABET);
    this.variableQueryParallelism = resolved.getInt(CONFIG_PATH_VARIABLE_QUERY_PARALLELISM);
    this.executionDeadline = resolved.getDuration(CONFIG_PATH_EXECUTION_DEADLINE);
    this.backendConfigs =
        resolved.getConfigList(CONFIG_PATH_BACKENDS).stream()
            .map(BackendConfig::new)
            .collect(Collectors.toUnmodifiableList());
    Preconditions.checkArgument(
        !this.refIdAlphabet.isEmpty(), "%s must not be empty", CONFIG_PATH_REF_ID_ALPHABET);
    Preconditions.checkArgument(
        this.variableQueryParallelism > 0,
        "%s must be positive",
        CONFIG_PATH_VARIABLE_QUERY_PARALLELISM);
  }

  @Value
  @NonFinal
  public static class IntervalConfig {
    private static final String CONFIG_PATH_TARGET_POINT_COUNT = "targetPointCount";
    private static final String CONFIG_PATH_MINIMUM_BUCKET = "minimumBucket";

    int targetPointCount;
    Duration minimumBucket;

    private IntervalConfig(Config config) {
      this.targetPointCount = config.getInt(CONFIG_PATH_TARGET_POINT_COUNT);
      this.minimumBucket = config.getDuration(CONFIG_PATH_MINIMUM_BUCKET);
    }
  }

  @Value
  @NonFinal
  public static class BackendConfig {
    private static final String CONFIG_PATH_NAME = "name";
    private static final String CONFIG_PATH_TYPE = "type";
    private static final String CONFIG_PATH_CONNECTION_STRING = "connectionString";
    private static final String CONFIG_PATH_BACKEND_INFO = "backendInfo";

    String name;
    String type;
    String connectionString;
    Config backendInfo;

    private BackendConfig(Config config) {
      this.name = config.getString(CONFIG_PATH_NAME);
      this.type = config.getString(CONFIG_PATH_TYPE);
      this.connectionString = config.getString(CONFIG_PATH_CONNECTION_STRING);
      this.backendInfo =
          config.hasPath(CONFIG_PATH_BACKEND_INFO)
              ? config.getConfig(CONFIG_PATH_BACKEND_INFO)
              : ConfigFactory.empty();
    }
  }
}

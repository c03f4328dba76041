package org.hypertrace.core.dashboard.query.api;

import javax.annotation.Nullable;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/** A backend-ready data query, unique by {@code refId} within one execution request. */
@Value
@Builder(toBuilder = true)
public class Query {
  @NonNull String refId;
  @NonNull String expression;
  @NonNull DatasourceRef datasource;
  boolean disabled;
  @Nullable String legend;
  boolean raw;
  long intervalSeconds;
  int maxDataPoints;
}

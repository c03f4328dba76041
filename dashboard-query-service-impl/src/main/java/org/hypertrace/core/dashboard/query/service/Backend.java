package org.hypertrace.core.dashboard.query.service;

import lombok.NonNull;
import lombok.Value;

/** A configured monitoring backend: where dashboards are stored and where queries run. */
@Value
public class Backend {
  @NonNull String name;
  @NonNull BackendClient client;
  @NonNull DashboardStore dashboardStore;
}

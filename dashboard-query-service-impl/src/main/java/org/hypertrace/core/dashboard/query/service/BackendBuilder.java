package org.hypertrace.core.dashboard.query.service;

import org.hypertrace.core.dashboard.query.service.DashboardQueryServiceConfig.BackendConfig;

public interface BackendBuilder {

  boolean canBuild(BackendConfig config);

  Backend build(BackendConfig config);
}

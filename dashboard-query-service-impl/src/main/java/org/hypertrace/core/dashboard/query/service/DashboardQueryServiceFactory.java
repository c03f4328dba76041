package org.hypertrace.core.dashboard.query.service;

import com.google.inject.Guice;
import com.typesafe.config.Config;

public class DashboardQueryServiceFactory {

  private DashboardQueryServiceFactory() {}

  /** Builds a service from a config holding a {@code dashboard.query} section. */
  public static DashboardQueryService build(Config config) {
    return Guice.createInjector(new DashboardQueryModule(config))
        .getInstance(DashboardQueryService.class);
  }
}

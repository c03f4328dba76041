package org.hypertrace.core.dashboard.query.service;

import com.google.inject.AbstractModule;
import com.google.inject.multibindings.Multibinder;
import com.typesafe.config.Config;
import org.hypertrace.core.dashboard.query.service.grafana.GrafanaModule;
import org.hypertrace.core.dashboard.query.service.normalizer.FrameParser;
import org.hypertrace.core.dashboard.query.service.normalizer.LogListFrameParser;
import org.hypertrace.core.dashboard.query.service.normalizer.ScalarFrameParser;
import org.hypertrace.core.dashboard.query.service.normalizer.TableFrameParser;
import org.hypertrace.core.dashboard.query.service.normalizer.TimeSeriesFrameParser;

class DashboardQueryModule extends AbstractModule {

  private final DashboardQueryServiceConfig config;

  DashboardQueryModule(Config config) {
    this.config = new DashboardQueryServiceConfig(config);
  }

  @Override
  protected void configure() {
    bind(DashboardQueryServiceConfig.class).toInstance(this.config);
    bind(DashboardQueryService.class).to(DashboardQueryServiceImpl.class);
    Multibinder.newSetBinder(binder(), BackendBuilder.class);
    Multibinder<FrameParser> frameParsers = Multibinder.newSetBinder(binder(), FrameParser.class);
    frameParsers.addBinding().to(TimeSeriesFrameParser.class);
    frameParsers.addBinding().to(TableFrameParser.class);
    frameParsers.addBinding().to(ScalarFrameParser.class);
    frameParsers.addBinding().to(LogListFrameParser.class);
    install(new GrafanaModule());
  }
}

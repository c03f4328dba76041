package org.hypertrace.core.dashboard.query.service.grafana;

import com.google.inject.AbstractModule;
import com.google.inject.multibindings.Multibinder;
import org.hypertrace.core.dashboard.query.service.BackendBuilder;

public class GrafanaModule extends AbstractModule {

  @Override
  protected void configure() {
    Multibinder.newSetBinder(binder(), BackendBuilder.class)
        .addBinding()
        .to(GrafanaBackendBuilder.class);
  }
}

package org.hypertrace.core.dashboard.query.api;

import java.util.List;
import java.util.Optional;
import javax.annotation.Nullable;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/** Raw dashboard definition as returned by a dashboard store. */
@Value
@Builder
public class DashboardDefinition {
  @NonNull String id;
  @Nullable String title;
  @Nullable DatasourceRef defaultDatasource;
  @Singular List<PanelDefinition> panels;
  @Singular List<VariableDefinition> variables;

  public Optional<DatasourceRef> getDefaultDatasourceOptional() {
    return Optional.ofNullable(defaultDatasource);
  }
}

package org.hypertrace.core.dashboard.query.api;

import java.util.List;
import java.util.Optional;
import javax.annotation.Nullable;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

@Value
@Builder
public class PanelDefinition {
  public static final String DEFAULT_PANEL_TYPE = "timeseries";

  @NonNull String id;
  @Nullable String title;
  @Nullable String type;
  @Nullable DatasourceRef datasource;
  @Singular List<SubQueryDefinition> subQueries;
  @Singular List<FormulaDefinition> formulas;

  public String getTitleOrId() {
    return title == null || title.isBlank() ? id : title;
  }

  public String getTypeOrDefault() {
    return type == null || type.isBlank() ? DEFAULT_PANEL_TYPE : type;
  }

  public Optional<DatasourceRef> getDatasourceOptional() {
    return Optional.ofNullable(datasource);
  }
}

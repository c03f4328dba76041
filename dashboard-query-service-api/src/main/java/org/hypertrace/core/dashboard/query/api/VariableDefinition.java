package org.hypertrace.core.dashboard.query.api;

import java.util.List;
import java.util.Optional;
import javax.annotation.Nullable;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A dashboard template variable as declared by the dashboard. Only {@link VariableKind#QUERY}
 * variables carry a definition query; the names it references through placeholders are the
 * variable's dependencies.
 */
@Value
@Builder(toBuilder = true)
public class VariableDefinition {
  public static final String ALL_VALUE = "$__all";

  @NonNull String name;
  @NonNull VariableKind kind;
  boolean multiValue;

  /** Currently selected value(s); empty when nothing is selected. */
  @Singular List<String> values;

  /** Declared options of a static variable, used to expand an "All" selection. */
  @Singular List<String> options;

  @Nullable String definitionQuery;
  @Nullable DatasourceRef datasource;
  @Nullable String regex;

  public Optional<String> getDefinitionQueryOptional() {
    return Optional.ofNullable(definitionQuery).filter(query -> !query.isBlank());
  }

  public Optional<DatasourceRef> getDatasourceOptional() {
    return Optional.ofNullable(datasource);
  }

  public Optional<String> getRegexOptional() {
    return Optional.ofNullable(regex).filter(pattern -> !pattern.isBlank());
  }

  public boolean isAllSelected() {
    return values.size() == 1
        && (ALL_VALUE.equals(values.get(0)) || "All".equalsIgnoreCase(values.get(0)));
  }
}

package org.hypertrace.core.dashboard.query.api;

import java.util.Optional;
import javax.annotation.Nullable;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/** One query target declared by a panel, before variable substitution. */
@Value
@Builder
public class SubQueryDefinition {
  /** Reference name used by the panel's own formulas, e.g. a target's refId. */
  @Nullable String localRefId;

  @NonNull String expression;
  @Nullable DatasourceRef datasource;
  boolean disabled;
  @Nullable String legend;

  /** Sent to the backend as a raw query rather than an expression. */
  boolean raw;

  public Optional<String> getLocalRefIdOptional() {
    return Optional.ofNullable(localRefId).filter(id -> !id.isBlank());
  }

  public Optional<DatasourceRef> getDatasourceOptional() {
    return Optional.ofNullable(datasource);
  }
}

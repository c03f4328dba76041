package org.hypertrace.core.dashboard.query.api;

import java.util.Optional;
import javax.annotation.Nullable;
import lombok.NonNull;
import lombok.Value;

/**
 * Arithmetic over the panel's sub-queries, referenced by their local reference names, e.g. {@code
 * A*100/B} or {@code $A*100/$B}.
 */
@Value
public class FormulaDefinition {
  /** Name other formulas of the same panel may use to reference this one. */
  @Nullable String localRefId;

  @NonNull String expression;
  @Nullable String legend;

  public static FormulaDefinition of(String expression) {
    return new FormulaDefinition(null, expression, null);
  }

  public Optional<String> getLocalRefIdOptional() {
    return Optional.ofNullable(localRefId).filter(id -> !id.isBlank());
  }
}

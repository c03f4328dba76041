package org.hypertrace.core.dashboard.query.api;

import java.util.List;
import javax.annotation.Nullable;
import lombok.NonNull;
import lombok.Value;

/**
 * A derived query over other queries' refIds, e.g. {@code A*100/B}. It is never executed as a data
 * query on its own.
 */
@Value
public class Formula {
  @NonNull String refId;
  @NonNull String expression;
  @Nullable String legend;
  @NonNull List<String> referencedRefIds;
}

package org.hypertrace.core.dashboard.query.api;

import java.util.List;
import lombok.NonNull;
import lombok.Value;

/** A single instant value per field, as shown by stat and gauge panels. */
@Value
public class ScalarResult implements NormalizedResult {
  @NonNull String refId;
  @NonNull PanelInfo panelInfo;
  @NonNull List<Entry> entries;

  @Override
  public ResultType getResultType() {
    return ResultType.SCALAR;
  }

  @Override
  public boolean isEmpty() {
    return entries.isEmpty();
  }

  @Value(staticConstructor = "of")
  public static class Entry {
    @NonNull String name;
    @NonNull String formattedValue;
  }
}

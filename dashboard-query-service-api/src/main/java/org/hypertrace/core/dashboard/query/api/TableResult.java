package org.hypertrace.core.dashboard.query.api;

import java.util.List;
import lombok.NonNull;
import lombok.Value;

@Value
public class TableResult implements NormalizedResult {
  @NonNull String refId;
  @NonNull PanelInfo panelInfo;
  @NonNull List<Column> columns;

  /** Stringified cells, one inner list per row with one cell per column. */
  @NonNull List<List<String>> rows;

  @Override
  public ResultType getResultType() {
    return ResultType.TABLE;
  }

  @Override
  public boolean isEmpty() {
    return columns.isEmpty();
  }

  @Value(staticConstructor = "of")
  public static class Column {
    @NonNull String name;
    @NonNull FieldType type;
  }
}

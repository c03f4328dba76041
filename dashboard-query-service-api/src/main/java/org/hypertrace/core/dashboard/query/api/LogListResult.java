package org.hypertrace.core.dashboard.query.api;

import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

@Value
public class LogListResult implements NormalizedResult {
  @NonNull String refId;
  @NonNull PanelInfo panelInfo;
  @NonNull List<LogEntry> entries;

  @Override
  public ResultType getResultType() {
    return ResultType.LOG_LIST;
  }

  @Override
  public boolean isEmpty() {
    return entries.isEmpty();
  }

  @Value
  @Builder
  public static class LogEntry {
    @NonNull @Builder.Default String timestamp = "";
    @NonNull @Builder.Default String level = "";
    @NonNull @Builder.Default String message = "";
    @Singular Map<String, String> attributes;
  }
}

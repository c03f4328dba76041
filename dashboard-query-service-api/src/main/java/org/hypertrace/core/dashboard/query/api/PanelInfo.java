package org.hypertrace.core.dashboard.query.api;

import lombok.NonNull;
import lombok.Value;

/** What a refId was built from, used to label and dispatch its results. */
@Value
public class PanelInfo {
  @NonNull String panelId;
  @NonNull String panelTitle;
  @NonNull String panelType;
  @NonNull String originalExpression;
}

package org.hypertrace.core.dashboard.query.api;

import java.util.Optional;
import javax.annotation.Nullable;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/** A non-fatal problem found while executing a dashboard, attached to the run's result. */
@Value
@Builder
public class Diagnostic {
  @NonNull DiagnosticType type;
  @NonNull String message;
  @Nullable String panelId;
  @Nullable String refId;
  @Nullable String variableName;

  public Optional<String> getPanelIdOptional() {
    return Optional.ofNullable(panelId);
  }

  public Optional<String> getRefIdOptional() {
    return Optional.ofNullable(refId);
  }

  public Optional<String> getVariableNameOptional() {
    return Optional.ofNullable(variableName);
  }

  public static Diagnostic forRefId(
      DiagnosticType type, String refId, @Nullable PanelInfo panelInfo, String message) {
    return Diagnostic.builder()
        .type(type)
        .refId(refId)
        .panelId(panelInfo == null ? null : panelInfo.getPanelId())
        .message(message)
        .build();
  }

  public static Diagnostic forPanel(DiagnosticType type, String panelId, String message) {
    return Diagnostic.builder().type(type).panelId(panelId).message(message).build();
  }

  public static Diagnostic forVariable(DiagnosticType type, String variableName, String message) {
    return Diagnostic.builder().type(type).variableName(variableName).message(message).build();
  }
}

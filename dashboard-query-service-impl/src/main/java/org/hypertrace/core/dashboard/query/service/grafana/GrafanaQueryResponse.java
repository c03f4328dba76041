package org.hypertrace.core.dashboard.query.service.grafana;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import javax.annotation.Nullable;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import org.hypertrace.core.dashboard.query.api.Field;
import org.hypertrace.core.dashboard.query.api.FieldType;
import org.hypertrace.core.dashboard.query.api.Frame;
import org.hypertrace.core.dashboard.query.api.RawResult;

/**
 * Response of {@code /api/ds/query}. Collections are left null when absent so that a result
 * without frames stays distinguishable from one with an empty frame list.
 */
@Value
@Jacksonized
@Builder
class GrafanaQueryResponse {
  private static final ObjectMapper OBJECT_MAPPER =
      new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  private static final String DEFAULT_FIELD_TYPE = "string";

  @JsonProperty("results")
  @Nullable
  Map<String, GrafanaResult> results;

  @Value
  @Jacksonized
  @Builder
  static class GrafanaResult {
    @JsonProperty("status")
    @Nullable
    Integer status;

    @JsonProperty("error")
    @Nullable
    String error;

    @JsonProperty("frames")
    @Nullable
    List<GrafanaFrame> frames;
  }

  @Value
  @Jacksonized
  @Builder
  static class GrafanaFrame {
    @JsonProperty("schema")
    @Nullable
    GrafanaSchema schema;

    @JsonProperty("data")
    @Nullable
    GrafanaData data;
  }

  @Value
  @Jacksonized
  @Builder
  static class GrafanaSchema {
    @JsonProperty("name")
    @Nullable
    String name;

    @JsonProperty("fields")
    @Nullable
    List<GrafanaField> fields;
  }

  @Value
  @Jacksonized
  @Builder
  static class GrafanaField {
    @JsonProperty("name")
    @Nullable
    String name;

    @JsonProperty("type")
    @Nullable
    String type;

    @JsonProperty("labels")
    @Nullable
    Map<String, String> labels;
  }

  @Value
  @Jacksonized
  @Builder
  static class GrafanaData {
    @JsonProperty("values")
    @Nullable
    List<List<Object>> values;
  }

  static GrafanaQueryResponse fromJson(String json) throws IOException {
    return OBJECT_MAPPER.readValue(json, GrafanaQueryResponse.class);
  }

  /** Converts every result keyed by refId, keeping the response order. */
  Map<String, RawResult> toRawResults() {
    Map<String, RawResult> rawResults = new LinkedHashMap<>();
    if (results != null) {
      results.forEach(
          (refId, result) -> rawResults.put(refId, result == null ? null : toRawResult(result)));
    }
    return rawResults;
  }

  private static RawResult toRawResult(GrafanaResult result) {
    List<Frame> frames =
        result.getFrames() == null
            ? null
            : result.getFrames().stream()
                .filter(Objects::nonNull)
                .map(GrafanaQueryResponse::toFrame)
                .collect(Collectors.toList());
    if (result.getError() != null && !result.getError().isBlank()) {
      return RawResult.withError(frames, result.getError(), result.getStatus());
    }
    return frames == null
        ? RawResult.missing(null, result.getStatus())
        : RawResult.of(frames, result.getStatus());
  }

  private static Frame toFrame(GrafanaFrame grafanaFrame) {
    Frame.FrameBuilder frame = Frame.builder();
    GrafanaSchema schema = grafanaFrame.getSchema();
    if (schema != null) {
      frame.name(schema.getName());
      if (schema.getFields() != null) {
        schema.getFields().forEach(field -> frame.field(toField(field)));
      }
    }
    GrafanaData data = grafanaFrame.getData();
    if (data != null && data.getValues() != null) {
      data.getValues().forEach(column -> frame.column(column == null ? List.of() : column));
    }
    return frame.build();
  }

  private static Field toField(GrafanaField grafanaField) {
    String typeName = Objects.requireNonNullElse(grafanaField.getType(), DEFAULT_FIELD_TYPE);
    Field.FieldBuilder field =
        Field.builder()
            .name(Objects.requireNonNullElse(grafanaField.getName(), ""))
            .type(FieldType.fromTypeName(typeName))
            .typeName(typeName);
    if (grafanaField.getLabels() != null) {
      field.labels(grafanaField.getLabels());
    }
    return field.build();
  }
}

package org.hypertrace.core.dashboard.query.api;

import java.util.Locale;
import java.util.Map;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

@Value
@Builder
public class Field {
  @NonNull String name;
  @NonNull FieldType type;

  /** Type name as reported by the backend, e.g. "string" or "number". */
  @NonNull String typeName;

  /** Labels attached to the whole field, e.g. the series labels of a value column. */
  @Singular Map<String, String> labels;

  public static Field of(String name, FieldType type) {
    return Field.builder()
        .name(name)
        .type(type)
        .typeName(type.name().toLowerCase(Locale.ROOT))
        .build();
  }
}

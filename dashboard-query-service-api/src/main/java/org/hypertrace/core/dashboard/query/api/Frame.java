package org.hypertrace.core.dashboard.query.api;

import java.util.List;
import java.util.Optional;
import javax.annotation.Nullable;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * One columnar block of data sharing a single schema. There is one column per field and row {@code
 * i} across all columns is one observation. Columns may hold nulls.
 */
@Value
@Builder
public class Frame {
  @Nullable String name;
  @Singular List<Field> fields;
  @Singular List<List<?>> columns;

  public Optional<String> getNameOptional() {
    return Optional.ofNullable(name).filter(frameName -> !frameName.isBlank());
  }

  public int getRowCount() {
    return columns.isEmpty() ? 0 : columns.get(0).size();
  }
}

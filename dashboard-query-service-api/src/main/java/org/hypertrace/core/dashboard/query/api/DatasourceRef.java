package org.hypertrace.core.dashboard.query.api;

import java.util.Optional;
import javax.annotation.Nullable;
import lombok.Value;

@Value
public class DatasourceRef {
  String uid;
  @Nullable String type;

  public static DatasourceRef of(String uid) {
    return new DatasourceRef(uid, null);
  }

  public static DatasourceRef of(String uid, @Nullable String type) {
    return new DatasourceRef(uid, type);
  }

  public Optional<String> getTypeOptional() {
    return Optional.ofNullable(type);
  }
}

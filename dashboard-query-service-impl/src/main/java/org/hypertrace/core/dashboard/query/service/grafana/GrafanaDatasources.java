package org.hypertrace.core.dashboard.query.service.grafana;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableMap;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import javax.annotation.Nullable;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import org.hypertrace.core.dashboard.query.api.DatasourceRef;
import org.hypertrace.core.dashboard.query.service.ResolutionContext;

/** Builds the datasource directory from {@code /api/datasources}. */
class GrafanaDatasources {
  private static final ObjectMapper OBJECT_MAPPER =
      new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  private GrafanaDatasources() {}

  @Value
  @Jacksonized
  @Builder
  static class GrafanaDatasource {
    @JsonProperty("uid")
    String uid;

    @JsonProperty("name")
    @Nullable
    String name;

    @JsonProperty("type")
    @Nullable
    String type;

    @JsonProperty("isDefault")
    boolean isDefault;

    DatasourceRef toRef() {
      return DatasourceRef.of(uid, type);
    }
  }

  /**
   * Keys every datasource by uid and by name. The default alias points at the datasource Grafana
   * marks as default, else the first Prometheus datasource, else the first one listed.
   */
  static Map<String, DatasourceRef> parseDirectory(String json) throws IOException {
    List<GrafanaDatasource> datasources =
        OBJECT_MAPPER.readValue(json, new TypeReference<List<GrafanaDatasource>>() {});
    ImmutableMap.Builder<String, DatasourceRef> directory = ImmutableMap.builder();
    for (GrafanaDatasource datasource : datasources) {
      if (datasource.getUid() == null || datasource.getUid().isBlank()) {
        continue;
      }
      directory.put(datasource.getUid(), datasource.toRef());
      if (datasource.getName() != null && !datasource.getName().isBlank()) {
        directory.put(datasource.getName(), datasource.toRef());
      }
    }
    defaultDatasource(datasources)
        .ifPresent(
            datasource ->
                directory.put(ResolutionContext.DEFAULT_DATASOURCE_ALIAS, datasource.toRef()));
    return directory.buildKeepingLast();
  }

  private static Optional<GrafanaDatasource> defaultDatasource(
      List<GrafanaDatasource> datasources) {
    return datasources.stream()
        .filter(GrafanaDatasource::isDefault)
        .findFirst()
        .or(
            () ->
                datasources.stream()
                    .filter(
                        datasource ->
                            GrafanaVariableQueries.PROMETHEUS_TYPE.equals(datasource.getType()))
                    .findFirst())
        .or(() -> datasources.stream().findFirst())
        .filter(datasource -> datasource.getUid() != null && !datasource.getUid().isBlank());
  }
}

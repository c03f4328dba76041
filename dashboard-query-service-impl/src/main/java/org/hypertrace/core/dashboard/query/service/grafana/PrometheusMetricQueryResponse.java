package org.hypertrace.core.dashboard.query.service.grafana;

import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.Singular;

/** Prometheus API envelope as returned through the Grafana datasource proxy. */
@Getter
@Builder
@AllArgsConstructor(access = AccessLevel.PRIVATE)
class PrometheusMetricQueryResponse {
  static final String STATUS_SUCCESS = "success";

  @NonNull private String status;
  @Nullable private String resultType;
  @Nullable private String error;

  /** Label sets of a vector or matrix result. */
  @Singular private List<Map<String, String>> metrics;

  /** Plain string data, as returned by the label values endpoint. */
  @Singular private List<String> labelValues;

  boolean isSuccess() {
    return STATUS_SUCCESS.equals(status);
  }
}

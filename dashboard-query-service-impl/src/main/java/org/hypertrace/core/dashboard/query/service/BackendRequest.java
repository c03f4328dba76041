package org.hypertrace.core.dashboard.query.service;

import java.util.List;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import org.hypertrace.core.dashboard.query.api.Formula;
import org.hypertrace.core.dashboard.query.api.Query;
import org.hypertrace.core.dashboard.query.api.TimeRange;

/** One batched execution: every query of a dashboard run, submitted together. */
@Value
@Builder
public class BackendRequest {
  @Singular List<Query> queries;

  /** Formulas to evaluate server side; empty when the backend cannot evaluate them. */
  @Singular List<Formula> formulas;

  @NonNull TimeRange timeRange;
  long bucketSeconds;
  int maxDataPoints;
}

package org.hypertrace.core.dashboard.query.service.normalizer;

import java.time.Duration;
import java.util.Map;
import org.hypertrace.core.dashboard.query.api.DiagnosticType;
import org.hypertrace.core.dashboard.query.api.PanelInfo;
import org.hypertrace.core.dashboard.query.api.TimeRange;
import org.hypertrace.core.dashboard.query.service.ResolutionContext;

final class NormalizerTestSupport {

  private NormalizerTestSupport() {}

  static ResolutionContext newContext() {
    return new ResolutionContext(
        "svc",
        TimeRange.ofEpochSeconds(1_700_000_000L, 1_700_003_600L),
        60,
        70,
        Duration.ofSeconds(10),
        Map.of());
  }

  static PanelInfo panel(String type) {
    return new PanelInfo("1", "Latency", type, "histogram_quantile(0.9, x)");
  }

  static long count(ResolutionContext context, DiagnosticType type) {
    return context.getDiagnostics().stream()
        .filter(diagnostic -> diagnostic.getType() == type)
        .count();
  }
}

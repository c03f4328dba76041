package org.hypertrace.core.dashboard.query.api;

import java.util.List;
import java.util.Optional;
import lombok.NonNull;
import lombok.Value;

@Value
public class TimeSeriesResult implements NormalizedResult {
  @NonNull String refId;
  @NonNull PanelInfo panelInfo;
  @NonNull List<TimeSeries> series;

  @Override
  public ResultType getResultType() {
    return ResultType.TIME_SERIES;
  }

  @Override
  public boolean isEmpty() {
    return series.isEmpty();
  }

  @Value
  public static class TimeSeries {
    /** Ordered label pairs; keys are unique within one series. */
    @NonNull List<Label> labels;

    /** Points in ascending timestamp order. */
    @NonNull List<DataPoint> points;

    public Optional<String> getLabelValue(String key) {
      return labels.stream()
          .filter(label -> label.getKey().equals(key))
          .map(Label::getValue)
          .findFirst();
    }
  }

  @Value(staticConstructor = "of")
  public static class Label {
    @NonNull String key;
    @NonNull String value;
  }

  @Value(staticConstructor = "of")
  public static class DataPoint {
    long timestampMillis;
    double value;
  }
}

package org.hypertrace.core.dashboard.query.service.normalizer;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.hypertrace.core.dashboard.query.api.Field;
import org.hypertrace.core.dashboard.query.api.FieldType;
import org.hypertrace.core.dashboard.query.api.Frame;
import org.hypertrace.core.dashboard.query.api.NormalizedResult;
import org.hypertrace.core.dashboard.query.api.PanelInfo;
import org.hypertrace.core.dashboard.query.api.TimeSeriesResult;
import org.hypertrace.core.dashboard.query.api.TimeSeriesResult.DataPoint;
import org.hypertrace.core.dashboard.query.api.TimeSeriesResult.Label;
import org.hypertrace.core.dashboard.query.api.TimeSeriesResult.TimeSeries;
import org.hypertrace.core.dashboard.query.service.ResolutionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Each frame contributes the rows of one time field and one value field, the first of each type.
 * All other fields are per-point labels. Rows sharing the same labels, within and across frames,
 * form one series. Rows without a timestamp or value are dropped.
 */
public class TimeSeriesFrameParser extends AbstractFrameParser {
  private static final Logger LOG = LoggerFactory.getLogger(TimeSeriesFrameParser.class);

  @Override
  protected Logger getLogger() {
    return LOG;
  }

  @Override
  public Set<String> getPanelTypes() {
    return Set.of("timeseries", "graph", "barchart", "heatmap");
  }

  @Override
  public NormalizedResult parse(
      String refId, PanelInfo panelInfo, List<Frame> frames, ResolutionContext context) {
    Map<List<Label>, List<DataPoint>> pointsBySeries = new LinkedHashMap<>();
    for (Frame frame : frames) {
      parseFrame(refId, panelInfo, frame, context, pointsBySeries);
    }
    List<TimeSeries> series =
        pointsBySeries.entrySet().stream()
            .filter(entry -> !entry.getValue().isEmpty())
            .map(
                entry ->
                    new TimeSeries(
                        List.copyOf(entry.getKey()),
                        entry.getValue().stream()
                            .sorted(Comparator.comparingLong(DataPoint::getTimestampMillis))
                            .collect(Collectors.toUnmodifiableList())))
            .collect(Collectors.toUnmodifiableList());
    return new TimeSeriesResult(refId, panelInfo, series);
  }

  @Override
  public NormalizedResult emptyResult(String refId, PanelInfo panelInfo) {
    return new TimeSeriesResult(refId, panelInfo, List.of());
  }

  private void parseFrame(
      String refId,
      PanelInfo panelInfo,
      Frame frame,
      ResolutionContext context,
      Map<List<Label>, List<DataPoint>> pointsBySeries) {
    int fieldCount = usableFieldCount(refId, panelInfo, frame, context);
    List<Field> fields = frame.getFields().subList(0, fieldCount);
    List<Integer> timeFields = indexesOfType(fields, FieldType.TIME);
    Optional<Integer> valueField = indexesOfType(fields, FieldType.NUMBER).stream().findFirst();
    if (timeFields.isEmpty() || valueField.isEmpty()) {
      reportShapeMismatch(
          refId, panelInfo, "frame has no time field or no numeric field, skipping it", context);
      return;
    }
    if (timeFields.size() > 1) {
      reportShapeMismatch(
          refId,
          panelInfo,
          "frame has "
              + timeFields.size()
              + " time fields, using "
              + fields.get(timeFields.get(0)).getName(),
          context);
    }
    int timeIndex = timeFields.get(0);
    int valueIndex = valueField.get();
    List<Integer> labelIndexes =
        IntStream.range(0, fieldCount)
            .filter(index -> index != timeIndex && index != valueIndex)
            .boxed()
            .collect(Collectors.toList());

    List<Label> seriesLabels = SeriesLabels.bookkeeping(refId, panelInfo);
    frame
        .getNameOptional()
        .ifPresent(name -> SeriesLabels.append(seriesLabels, SeriesLabels.SERIES_NAME, name));
    fields
        .get(valueIndex)
        .getLabels()
        .forEach((key, value) -> SeriesLabels.append(seriesLabels, key, value));

    int rowCount = usableRowCount(refId, panelInfo, frame, fieldCount, context);
    for (int row = 0; row < rowCount; row++) {
      Optional<Long> timestamp = FrameValues.toEpochMillis(cell(frame, timeIndex, row));
      Optional<Double> value = FrameValues.toDouble(cell(frame, valueIndex, row));
      if (timestamp.isEmpty() || value.isEmpty()) {
        continue;
      }
      List<Label> labels = new ArrayList<>(seriesLabels);
      for (int labelIndex : labelIndexes) {
        SeriesLabels.append(
            labels,
            fields.get(labelIndex).getName(),
            FrameValues.stringify(cell(frame, labelIndex, row)));
      }
      pointsBySeries
          .computeIfAbsent(labels, ignored -> new ArrayList<>())
          .add(DataPoint.of(timestamp.get(), value.get()));
    }
  }

  private static List<Integer> indexesOfType(List<Field> fields, FieldType type) {
    return IntStream.range(0, fields.size())
        .filter(index -> fields.get(index).getType() == type)
        .boxed()
        .collect(Collectors.toList());
  }
}

package org.hypertrace.core.dashboard.query.service.formula;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.TreeMap;
import java.util.stream.Collectors;
import javax.inject.Singleton;
import org.hypertrace.core.dashboard.query.api.Formula;
import org.hypertrace.core.dashboard.query.api.PanelInfo;
import org.hypertrace.core.dashboard.query.api.TimeSeriesResult;
import org.hypertrace.core.dashboard.query.api.TimeSeriesResult.DataPoint;
import org.hypertrace.core.dashboard.query.api.TimeSeriesResult.Label;
import org.hypertrace.core.dashboard.query.api.TimeSeriesResult.TimeSeries;
import org.hypertrace.core.dashboard.query.service.InvalidFormulaException;
import org.hypertrace.core.dashboard.query.service.normalizer.SeriesLabels;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates a formula over already normalized time series, for backends that cannot evaluate
 * formulas themselves.
 *
 * <p>Operand series are matched by their labels, ignoring the bookkeeping labels every series
 * carries. When every operand has exactly one series they are matched regardless of labels. Within
 * a match a point is computed for every timestamp present in all operands; a division by zero
 * produces no point.
 */
@Singleton
public class FormulaEvaluator {
  private static final Logger LOG = LoggerFactory.getLogger(FormulaEvaluator.class);

  public TimeSeriesResult evaluate(
      Formula formula, PanelInfo panelInfo, Map<String, TimeSeriesResult> operands) {
    FormulaNode expression = FormulaParser.parse(formula.getExpression());
    Map<String, List<TimeSeries>> seriesByRefId = new LinkedHashMap<>();
    for (String refId : formula.getReferencedRefIds()) {
      TimeSeriesResult operand = operands.get(refId);
      if (operand == null) {
        throw new InvalidFormulaException(
            "Formula "
                + formula.getRefId()
                + " references "
                + refId
                + " which has no time series");
      }
      seriesByRefId.put(refId, operand.getSeries());
    }

    List<TimeSeries> series = new ArrayList<>();
    for (Map<String, TimeSeries> match : match(seriesByRefId)) {
      List<DataPoint> points = combine(expression, match);
      if (!points.isEmpty()) {
        series.add(new TimeSeries(outputLabels(formula, panelInfo, match), points));
      }
    }
    LOG.debug(
        "Formula {} ({}) produced {} series",
        formula.getRefId(),
        formula.getExpression(),
        series.size());
    return new TimeSeriesResult(formula.getRefId(), panelInfo, List.copyOf(series));
  }

  private static List<Map<String, TimeSeries>> match(Map<String, List<TimeSeries>> seriesByRefId) {
    if (seriesByRefId.isEmpty()) {
      return List.of();
    }
    if (seriesByRefId.values().stream().allMatch(series -> series.size() == 1)) {
      Map<String, TimeSeries> single = new LinkedHashMap<>();
      seriesByRefId.forEach((refId, series) -> single.put(refId, series.get(0)));
      return List.of(single);
    }

    Map<List<Label>, Map<String, TimeSeries>> byJoinKey = new LinkedHashMap<>();
    seriesByRefId.forEach(
        (refId, seriesList) ->
            seriesList.forEach(
                series ->
                    byJoinKey
                        .computeIfAbsent(joinKey(series), ignored -> new LinkedHashMap<>())
                        .putIfAbsent(refId, series)));
    return byJoinKey.values().stream()
        .filter(match -> match.size() == seriesByRefId.size())
        .collect(Collectors.toList());
  }

  private static List<DataPoint> combine(FormulaNode expression, Map<String, TimeSeries> match) {
    Map<String, Map<Long, Double>> valuesByRefId = new LinkedHashMap<>();
    match.forEach(
        (refId, series) -> {
          Map<Long, Double> values = new TreeMap<>();
          series
              .getPoints()
              .forEach(point -> values.put(point.getTimestampMillis(), point.getValue()));
          valuesByRefId.put(refId, values);
        });

    List<DataPoint> points = new ArrayList<>();
    Map<Long, Double> first = valuesByRefId.values().iterator().next();
    for (Long timestamp : first.keySet()) {
      if (valuesByRefId.values().stream().allMatch(values -> values.containsKey(timestamp))) {
        Map<String, Double> referenceValues = new LinkedHashMap<>();
        valuesByRefId.forEach(
            (refId, values) -> referenceValues.put(refId, values.get(timestamp)));
        OptionalDouble value = expression.evaluate(referenceValues);
        if (value.isPresent()) {
          points.add(DataPoint.of(timestamp, value.getAsDouble()));
        }
      }
    }
    return List.copyOf(points);
  }

  private static List<Label> outputLabels(
      Formula formula, PanelInfo panelInfo, Map<String, TimeSeries> match) {
    List<Label> labels = SeriesLabels.bookkeeping(formula.getRefId(), panelInfo);
    if (formula.getLegend() != null && !formula.getLegend().isBlank()) {
      SeriesLabels.append(labels, SeriesLabels.SERIES_NAME, formula.getLegend());
    }
    // labels shared by every operand
    List<Label> shared = new ArrayList<>(joinKey(match.values().iterator().next()));
    match.values().forEach(series -> shared.retainAll(joinKey(series)));
    shared.forEach(label -> SeriesLabels.append(labels, label.getKey(), label.getValue()));
    return List.copyOf(labels);
  }

  private static List<Label> joinKey(TimeSeries series) {
    return series.getLabels().stream()
        .filter(label -> !SeriesLabels.BOOKKEEPING.contains(label.getKey()))
        .collect(Collectors.toList());
  }
}

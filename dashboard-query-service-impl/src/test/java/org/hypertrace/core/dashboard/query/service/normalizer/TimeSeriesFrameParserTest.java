package org.hypertrace.core.dashboard.query.service.normalizer;

import static org.hypertrace.core.dashboard.query.service.normalizer.NormalizerTestSupport.count;
import static org.hypertrace.core.dashboard.query.service.normalizer.NormalizerTestSupport.newContext;
import static org.hypertrace.core.dashboard.query.service.normalizer.NormalizerTestSupport.panel;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.List;
import org.hypertrace.core.dashboard.query.api.DiagnosticType;
import org.hypertrace.core.dashboard.query.api.Field;
import org.hypertrace.core.dashboard.query.api.FieldType;
import org.hypertrace.core.dashboard.query.api.Frame;
import org.hypertrace.core.dashboard.query.api.PanelInfo;
import org.hypertrace.core.dashboard.query.api.TimeSeriesResult;
import org.hypertrace.core.dashboard.query.api.TimeSeriesResult.DataPoint;
import org.hypertrace.core.dashboard.query.api.TimeSeriesResult.Label;
import org.hypertrace.core.dashboard.query.api.TimeSeriesResult.TimeSeries;
import org.hypertrace.core.dashboard.query.service.ResolutionContext;
import org.junit.jupiter.api.Test;

class TimeSeriesFrameParserTest {

  private static final PanelInfo PANEL = panel("timeseries");

  private final TimeSeriesFrameParser parser = new TimeSeriesFrameParser();
  private final ResolutionContext context = newContext();

  @Test
  void buildsOneSeriesPerFrameWithBookkeepingLabels() {
    Frame frame =
        Frame.builder()
            .name("p90")
            .field(Field.of("Time", FieldType.TIME))
            .field(
                Field.builder()
                    .name("Value")
                    .type(FieldType.NUMBER)
                    .typeName("number")
                    .label("service", "checkout")
                    .build())
            .column(List.of(2000L, 1000L))
            .column(List.of(0.25, 0.5))
            .build();

    TimeSeriesResult result =
        (TimeSeriesResult) parser.parse("A", PANEL, List.of(frame), context);

    assertEquals(1, result.getSeries().size());
    TimeSeries series = result.getSeries().get(0);
    assertEquals(
        List.of(
            Label.of(SeriesLabels.PANEL_ID, "1"),
            Label.of(SeriesLabels.PANEL_TITLE, "Latency"),
            Label.of(SeriesLabels.REF_ID, "A"),
            Label.of(SeriesLabels.ORIGINAL_EXPR, "histogram_quantile(0.9, x)"),
            Label.of(SeriesLabels.SERIES_NAME, "p90"),
            Label.of("service", "checkout")),
        series.getLabels());
    assertEquals(List.of(DataPoint.of(1000, 0.5), DataPoint.of(2000, 0.25)), series.getPoints());
    assertTrue(context.getDiagnostics().isEmpty());
  }

  @Test
  void splitsLongFramesByLabelColumns() {
    Frame frame =
        Frame.builder()
            .field(Field.of("time", FieldType.TIME))
            .field(Field.of("host", FieldType.LABEL))
            .field(Field.of("cpu", FieldType.NUMBER))
            .column(List.of(1000L, 1000L, 2000L, 2000L))
            .column(List.of("a", "b", "a", "b"))
            .column(List.of(1, 2, 3, "4"))
            .build();

    TimeSeriesResult result =
        (TimeSeriesResult) parser.parse("A", PANEL, List.of(frame), context);

    assertEquals(2, result.getSeries().size());
    assertEquals("a", result.getSeries().get(0).getLabelValue("host").orElseThrow());
    assertEquals(
        List.of(DataPoint.of(1000, 1), DataPoint.of(2000, 3)),
        result.getSeries().get(0).getPoints());
    assertEquals(
        List.of(DataPoint.of(1000, 2), DataPoint.of(2000, 4)),
        result.getSeries().get(1).getPoints());
  }

  @Test
  void dropsRowsWithoutTimestampOrValue() {
    Frame frame =
        Frame.builder()
            .field(Field.of("time", FieldType.TIME))
            .field(Field.of("value", FieldType.NUMBER))
            .column(Arrays.asList(1000L, null, "2023-11-14T22:13:20Z", 4000L))
            .column(Arrays.asList(1.0, 2.0, 3.0, "NaN-ish"))
            .build();

    TimeSeriesResult result =
        (TimeSeriesResult) parser.parse("A", PANEL, List.of(frame), context);

    assertEquals(
        List.of(DataPoint.of(1000, 1.0), DataPoint.of(1_700_000_000_000L, 3.0)),
        result.getSeries().get(0).getPoints());
  }

  @Test
  void skipsFramesWithoutNumericField() {
    Frame frame =
        Frame.builder()
            .field(Field.of("time", FieldType.TIME))
            .field(Field.of("status", FieldType.LABEL))
            .column(List.of(1000L))
            .column(List.of("ok"))
            .build();

    TimeSeriesResult result =
        (TimeSeriesResult) parser.parse("A", PANEL, List.of(frame), context);

    assertTrue(result.isEmpty());
    assertEquals(1, count(context, DiagnosticType.SHAPE_MISMATCH));
  }

  @Test
  void truncatesRaggedColumns() {
    Frame frame =
        Frame.builder()
            .field(Field.of("time", FieldType.TIME))
            .field(Field.of("value", FieldType.NUMBER))
            .column(List.of(1000L, 2000L, 3000L))
            .column(List.of(1.0, 2.0))
            .build();

    TimeSeriesResult result =
        (TimeSeriesResult) parser.parse("A", PANEL, List.of(frame), context);

    assertEquals(2, result.getSeries().get(0).getPoints().size());
    assertEquals(1, count(context, DiagnosticType.SHAPE_MISMATCH));
  }
}

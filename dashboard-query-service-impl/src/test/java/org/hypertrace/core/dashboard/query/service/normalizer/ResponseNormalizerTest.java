package org.hypertrace.core.dashboard.query.service.normalizer;

import static org.hypertrace.core.dashboard.query.service.normalizer.NormalizerTestSupport.count;
import static org.hypertrace.core.dashboard.query.service.normalizer.NormalizerTestSupport.newContext;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.hypertrace.core.dashboard.query.api.Diagnostic;
import org.hypertrace.core.dashboard.query.api.DiagnosticType;
import org.hypertrace.core.dashboard.query.api.Field;
import org.hypertrace.core.dashboard.query.api.FieldType;
import org.hypertrace.core.dashboard.query.api.Frame;
import org.hypertrace.core.dashboard.query.api.NormalizedResult;
import org.hypertrace.core.dashboard.query.api.PanelInfo;
import org.hypertrace.core.dashboard.query.api.RawResult;
import org.hypertrace.core.dashboard.query.api.ResultType;
import org.hypertrace.core.dashboard.query.api.ScalarResult;
import org.hypertrace.core.dashboard.query.api.TableResult;
import org.hypertrace.core.dashboard.query.api.TimeSeriesResult;
import org.hypertrace.core.dashboard.query.service.ResolutionContext;
import org.junit.jupiter.api.Test;

class ResponseNormalizerTest {

  private static final Frame SERIES_FRAME =
      Frame.builder()
          .field(Field.of("time", FieldType.TIME))
          .field(Field.of("value", FieldType.NUMBER))
          .column(List.of(1000L, 2000L))
          .column(List.of(1.0, 2.0))
          .build();

  private final ResponseNormalizer normalizer = ResponseNormalizer.withDefaultParsers();
  private final ResolutionContext context = newContext();

  @Test
  void dispatchesOnPanelTypeInReferenceMapOrder() {
    Map<String, PanelInfo> refMap = new LinkedHashMap<>();
    refMap.put("C", info("3", "table"));
    refMap.put("A", info("1", "timeseries"));
    refMap.put("B", info("2", "Stat"));
    refMap.put("D", info("4", "piechart"));
    Map<String, RawResult> response =
        Map.of(
            "A", RawResult.of(List.of(SERIES_FRAME)),
            "B", RawResult.of(List.of(SERIES_FRAME)),
            "C", RawResult.of(List.of(SERIES_FRAME)),
            "D", RawResult.of(List.of(SERIES_FRAME)));

    List<NormalizedResult> results = normalizer.normalize(response, refMap, context);

    assertEquals(
        List.of("C", "A", "B", "D"),
        results.stream().map(NormalizedResult::getRefId).collect(Collectors.toList()));
    assertInstanceOf(TableResult.class, results.get(0));
    assertInstanceOf(TimeSeriesResult.class, results.get(1));
    assertInstanceOf(ScalarResult.class, results.get(2));
    assertEquals(ResultType.TIME_SERIES, results.get(3).getResultType());
    assertTrue(context.getDiagnostics().isEmpty());
  }

  @Test
  void distinguishesMissingEmptyAndFailedQueries() {
    Map<String, PanelInfo> refMap = new LinkedHashMap<>();
    refMap.put("A", info("1", "timeseries"));
    refMap.put("B", info("1", "timeseries"));
    refMap.put("C", info("1", "timeseries"));
    refMap.put("D", info("1", "timeseries"));
    refMap.put("E", info("1", "timeseries"));
    Map<String, RawResult> response =
        Map.of(
            "A", RawResult.of(List.of(SERIES_FRAME)),
            "B", RawResult.of(List.of()),
            "C", RawResult.missing(null, 200),
            "D", RawResult.withError(List.of(SERIES_FRAME), "parse error at char 4", 400));

    List<NormalizedResult> results = normalizer.normalize(response, refMap, context);

    assertEquals(1, results.size());
    assertEquals("A", results.get(0).getRefId());
    assertEquals(DiagnosticType.EMPTY_DATA, diagnosticFor("B").getType());
    assertEquals(DiagnosticType.MISSING_DATA, diagnosticFor("C").getType());
    assertEquals(DiagnosticType.QUERY_ERROR, diagnosticFor("D").getType());
    assertTrue(diagnosticFor("D").getMessage().contains("parse error at char 4"));
    assertEquals(DiagnosticType.MISSING_DATA, diagnosticFor("E").getType());
    assertEquals("1", diagnosticFor("E").getPanelId());
  }

  @Test
  void keepsEmptyParserResultsAndReportsThem() {
    Frame labelsOnly =
        Frame.builder()
            .field(Field.of("status", FieldType.LABEL))
            .column(List.of("ok"))
            .build();

    List<NormalizedResult> results =
        normalizer.normalize(
            Map.of("A", RawResult.of(List.of(labelsOnly))),
            Map.of("A", info("1", "timeseries")),
            context);

    assertEquals(1, results.size());
    assertTrue(results.get(0).isEmpty());
    assertEquals(1, count(context, DiagnosticType.SHAPE_MISMATCH));
    assertEquals(1, count(context, DiagnosticType.NO_RESULTS));
  }

  @Test
  void leavesOutHiddenRefIds() {
    Map<String, PanelInfo> refMap = new LinkedHashMap<>();
    refMap.put("A", info("1", "timeseries"));
    refMap.put("B", info("1", "timeseries"));

    List<NormalizedResult> results =
        normalizer.normalize(
            Map.of("A", RawResult.of(List.of(SERIES_FRAME))), refMap, Set.of("B"), context);

    assertEquals(1, results.size());
    assertTrue(context.getDiagnostics().isEmpty());
  }

  @Test
  void reportsUnknownRefIds() {
    List<NormalizedResult> results =
        normalizer.normalize(
            Map.of(
                "A", RawResult.of(List.of(SERIES_FRAME)),
                "Z", RawResult.of(List.of(SERIES_FRAME))),
            Map.of("A", info("1", "timeseries")),
            context);

    assertEquals(1, results.size());
    assertEquals(DiagnosticType.UNKNOWN_REF_ID, diagnosticFor("Z").getType());
  }

  private Diagnostic diagnosticFor(String refId) {
    return context.getDiagnostics().stream()
        .filter(diagnostic -> refId.equals(diagnostic.getRefId()))
        .findFirst()
        .orElseThrow();
  }

  private static PanelInfo info(String panelId, String type) {
    return new PanelInfo(panelId, "Panel " + panelId, type, "up");
  }
}

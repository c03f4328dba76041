package org.hypertrace.core.dashboard.query.service.normalizer;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.hypertrace.core.dashboard.query.api.Diagnostic;
import org.hypertrace.core.dashboard.query.api.DiagnosticType;
import org.hypertrace.core.dashboard.query.api.NormalizedResult;
import org.hypertrace.core.dashboard.query.api.PanelInfo;
import org.hypertrace.core.dashboard.query.api.RawResult;
import org.hypertrace.core.dashboard.query.service.ResolutionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses a backend response keyed by refId into canonical results, visiting refIds in the order of
 * the reference map.
 *
 * <p>Per refId: a missing entry or frame collection is reported as missing data, a present but
 * empty frame collection as empty data and a backend error as a query error; none of these produce
 * a result. Otherwise the panel type picks the parser. A parser that finds nothing in non-empty
 * data still yields its empty result, together with a no-results diagnostic.
 */
@Singleton
public class ResponseNormalizer {
  private static final Logger LOG = LoggerFactory.getLogger(ResponseNormalizer.class);

  private final Map<String, FrameParser> parsersByPanelType;
  private final FrameParser defaultParser;

  @Inject
  public ResponseNormalizer(Set<FrameParser> parsers, TimeSeriesFrameParser defaultParser) {
    this.parsersByPanelType =
        parsers.stream()
            .flatMap(
                parser -> parser.getPanelTypes().stream().map(type -> Map.entry(type, parser)))
            .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, Map.Entry::getValue));
    this.defaultParser = defaultParser;
  }

  public static ResponseNormalizer withDefaultParsers() {
    TimeSeriesFrameParser timeSeriesParser = new TimeSeriesFrameParser();
    return new ResponseNormalizer(
        Set.of(
            timeSeriesParser,
            new TableFrameParser(),
            new ScalarFrameParser(),
            new LogListFrameParser()),
        timeSeriesParser);
  }

  public List<NormalizedResult> normalize(
      Map<String, RawResult> response,
      Map<String, PanelInfo> refMap,
      ResolutionContext context) {
    return normalize(response, refMap, Set.of(), context);
  }

  /**
   * @param hiddenRefIds refIds whose data only feeds formulas; their results are not returned
   */
  public List<NormalizedResult> normalize(
      Map<String, RawResult> response,
      Map<String, PanelInfo> refMap,
      Set<String> hiddenRefIds,
      ResolutionContext context) {
    List<NormalizedResult> results = new ArrayList<>();
    refMap.forEach(
        (refId, panelInfo) -> {
          if (!hiddenRefIds.contains(refId)) {
            normalizeRefId(refId, panelInfo, response.get(refId), context)
                .ifPresent(results::add);
          }
        });
    response.keySet().stream()
        .filter(refId -> !refMap.containsKey(refId))
        .forEach(
            refId -> {
              LOG.warn("Backend returned data for unknown refId {}, ignoring it", refId);
              context.addDiagnostic(
                  Diagnostic.forRefId(
                      DiagnosticType.UNKNOWN_REF_ID,
                      refId,
                      null,
                      "Response contains refId " + refId + " which no query was assigned"));
            });
    return results;
  }

  public FrameParser parserFor(String panelType) {
    return parsersByPanelType.getOrDefault(panelType.toLowerCase(Locale.ROOT), defaultParser);
  }

  private Optional<NormalizedResult> normalizeRefId(
      String refId, PanelInfo panelInfo, RawResult rawResult, ResolutionContext context) {
    if (rawResult != null && rawResult.getErrorOptional().isPresent()) {
      String error = rawResult.getErrorOptional().get();
      LOG.warn(
          "Query {} of panel {} failed with status {}: {}",
          refId,
          panelInfo.getPanelId(),
          rawResult.getStatus(),
          error);
      report(context, DiagnosticType.QUERY_ERROR, refId, panelInfo, "Query failed: " + error);
      return Optional.empty();
    }
    if (rawResult == null || rawResult.isMissing()) {
      LOG.warn("No frames received for refId {} of panel {}", refId, panelInfo.getPanelId());
      report(context, DiagnosticType.MISSING_DATA, refId, panelInfo, "No data received");
      return Optional.empty();
    }
    if (rawResult.isEmpty()) {
      LOG.info("Empty frame list for refId {} of panel {}", refId, panelInfo.getPanelId());
      report(context, DiagnosticType.EMPTY_DATA, refId, panelInfo, "Query returned no frames");
      return Optional.empty();
    }

    FrameParser parser = parserFor(panelInfo.getPanelType());
    NormalizedResult result = parser.parse(refId, panelInfo, rawResult.getFrames(), context);
    if (result.isEmpty()) {
      LOG.warn(
          "Frames for refId {} of panel {} produced no {} result",
          refId,
          panelInfo.getPanelId(),
          result.getResultType());
      report(
          context,
          DiagnosticType.NO_RESULTS,
          refId,
          panelInfo,
          "Backend returned data but none of it could be turned into a result");
    }
    return Optional.of(result);
  }

  private static void report(
      ResolutionContext context,
      DiagnosticType type,
      String refId,
      PanelInfo panelInfo,
      String message) {
    context.addDiagnostic(Diagnostic.forRefId(type, refId, panelInfo, message));
  }
}

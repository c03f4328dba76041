package org.hypertrace.core.dashboard.query.service.grafana;

import io.reactivex.rxjava3.core.Single;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.hypertrace.core.dashboard.query.api.DatasourceRef;
import org.hypertrace.core.dashboard.query.api.TimeRange;
import org.hypertrace.core.dashboard.query.api.VariableDefinition;
import org.hypertrace.core.dashboard.query.service.DashboardQueryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves the candidate values of query variables backed by a Prometheus datasource, using the
 * Prometheus API exposed through the Grafana datasource proxy.
 */
class GrafanaVariableQueries {
  private static final Logger LOG = LoggerFactory.getLogger(GrafanaVariableQueries.class);

  static final String PROMETHEUS_TYPE = "prometheus";
  private static final String METRIC_NAME_LABEL = "__name__";

  private static final Pattern LABEL_VALUES =
      Pattern.compile("^\\s*label_values\\(\\s*(?:(.*?)\\s*,\\s*)?(\\w+)\\s*\\)\\s*$");
  private static final Pattern METRICS = Pattern.compile("^\\s*metrics\\((.*)\\)\\s*$");
  private static final Pattern QUERY_RESULT = Pattern.compile("^\\s*query_result\\((.*)\\)\\s*$");

  private final GrafanaRestClient restClient;

  GrafanaVariableQueries(GrafanaRestClient restClient) {
    this.restClient = restClient;
  }

  Single<List<String>> query(
      String definitionQuery, VariableDefinition definition, TimeRange timeRange) {
    DatasourceRef datasource = definition.getDatasource();
    if (datasource == null) {
      return Single.error(
          new DashboardQueryException("Variable " + definition.getName() + " has no datasource"));
    }
    if (datasource.getTypeOptional().filter(type -> !PROMETHEUS_TYPE.equals(type)).isPresent()) {
      return Single.error(
          new DashboardQueryException(
              String.format(
                  "Variable %s uses unsupported datasource type %s",
                  definition.getName(), datasource.getType())));
    }

    Matcher labelValues = LABEL_VALUES.matcher(definitionQuery);
    if (labelValues.matches()) {
      return restClient
          .getLabelValues(
              datasource.getUid(), labelValues.group(2), labelValues.group(1), timeRange)
          .map(PrometheusMetricQueryResponseParser::parse)
          .map(response -> requireSuccess(response, definitionQuery).getLabelValues().stream())
          .map(values -> finish(values, definition));
    }

    Matcher metrics = METRICS.matcher(definitionQuery);
    if (metrics.matches()) {
      Pattern namePattern = Pattern.compile(metrics.group(1).trim());
      return restClient
          .getLabelValues(datasource.getUid(), METRIC_NAME_LABEL, null, timeRange)
          .map(PrometheusMetricQueryResponseParser::parse)
          .map(
              response ->
                  requireSuccess(response, definitionQuery).getLabelValues().stream()
                      .filter(name -> namePattern.matcher(name).find()))
          .map(values -> finish(values, definition));
    }

    Matcher queryResult = QUERY_RESULT.matcher(definitionQuery);
    String promql = queryResult.matches() ? queryResult.group(1).trim() : definitionQuery;
    return restClient
        .instantQuery(datasource.getUid(), promql, timeRange.getTo())
        .map(PrometheusMetricQueryResponseParser::parse)
        .map(
            response ->
                requireSuccess(response, definitionQuery).getMetrics().stream()
                    .map(labels -> metricValue(labels, definition)))
        .map(values -> finish(values, definition));
  }

  /**
   * Without a regex, the value of a series is its only label other than the metric name, else the
   * metric name itself, else the whole series text.
   */
  private static String metricValue(Map<String, String> labels, VariableDefinition definition) {
    if (definition.getRegex() != null && !definition.getRegex().isBlank()) {
      return metricText(labels);
    }
    List<String> otherLabels =
        labels.entrySet().stream()
            .filter(label -> !METRIC_NAME_LABEL.equals(label.getKey()))
            .map(Map.Entry::getValue)
            .collect(Collectors.toList());
    if (otherLabels.size() == 1) {
      return otherLabels.get(0);
    }
    return labels.getOrDefault(METRIC_NAME_LABEL, metricText(labels));
  }

  static String metricText(Map<String, String> labels) {
    return labels.entrySet().stream()
        .map(label -> label.getKey() + "=\"" + label.getValue() + "\"")
        .collect(Collectors.joining(", ", "{", "}"));
  }

  /**
   * Applies the variable's regex, keeping its first capture group or else the whole match, then
   * de-duplicates and sorts.
   */
  static List<String> finish(Stream<String> values, VariableDefinition definition) {
    Stream<String> extracted = values;
    if (definition.getRegex() != null && !definition.getRegex().isBlank()) {
      Pattern regex = Pattern.compile(stripSlashes(definition.getRegex()));
      extracted =
          values
              .map(regex::matcher)
              .filter(Matcher::find)
              .map(match -> match.groupCount() > 0 ? match.group(1) : match.group());
    }
    return extracted
        .filter(value -> value != null && !value.isEmpty())
        .distinct()
        .sorted()
        .collect(Collectors.toUnmodifiableList());
  }

  // Grafana stores variable regexes as /pattern/
  private static String stripSlashes(String regex) {
    String trimmed = regex.trim();
    if (trimmed.length() > 1 && trimmed.startsWith("/") && trimmed.endsWith("/")) {
      return trimmed.substring(1, trimmed.length() - 1);
    }
    return trimmed;
  }

  private static PrometheusMetricQueryResponse requireSuccess(
      PrometheusMetricQueryResponse response, String definitionQuery) {
    if (!response.isSuccess()) {
      LOG.warn("Variable query {} answered with status {}", definitionQuery, response.getStatus());
      throw new DashboardQueryException(
          "Variable query " + definitionQuery + " failed: " + response.getError());
    }
    return response;
  }
}

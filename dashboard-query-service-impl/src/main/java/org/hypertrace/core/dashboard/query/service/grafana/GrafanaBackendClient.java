package org.hypertrace.core.dashboard.query.service.grafana;

import io.reactivex.rxjava3.core.Single;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import org.hypertrace.core.dashboard.query.api.DatasourceRef;
import org.hypertrace.core.dashboard.query.api.RawResult;
import org.hypertrace.core.dashboard.query.api.TimeRange;
import org.hypertrace.core.dashboard.query.api.VariableDefinition;
import org.hypertrace.core.dashboard.query.service.BackendBatchFailureException;
import org.hypertrace.core.dashboard.query.service.BackendClient;
import org.hypertrace.core.dashboard.query.service.BackendRequest;
import org.hypertrace.core.dashboard.query.service.DashboardQueryException;
import org.hypertrace.core.dashboard.query.service.variable.MultiValueMatcherRewriter;
import org.hypertrace.core.dashboard.query.service.variable.RegexMatcherRewriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

class GrafanaBackendClient implements BackendClient {
  private static final Logger LOG = LoggerFactory.getLogger(GrafanaBackendClient.class);

  private final GrafanaRestClient restClient;
  private final GrafanaVariableQueries variableQueries;
  private final MultiValueMatcherRewriter matcherRewriter = new RegexMatcherRewriter();

  GrafanaBackendClient(GrafanaRestClient restClient) {
    this.restClient = restClient;
    this.variableQueries = new GrafanaVariableQueries(restClient);
  }

  @Override
  public Single<Map<String, RawResult>> execute(BackendRequest request) {
    return Single.fromCallable(() -> GrafanaQueryPayload.toJson(request))
        .doOnSuccess(
            payload -> {
              if (LOG.isDebugEnabled()) {
                LOG.debug("Grafana datasource query payload: {}", payload);
              }
            })
        .flatMap(restClient::queryDatasources)
        .map(
            body -> {
              try {
                return GrafanaQueryResponse.fromJson(body).toRawResults();
              } catch (IOException e) {
                throw new BackendBatchFailureException("Unreadable datasource query response", e);
              }
            });
  }

  /** Grafana evaluates math expressions next to the queries they reference. */
  @Override
  public boolean supportsServerSideFormulas() {
    return true;
  }

  @Override
  public Single<List<String>> queryVariableValues(
      String definitionQuery, VariableDefinition definition, TimeRange timeRange) {
    return variableQueries.query(definitionQuery, definition, timeRange);
  }

  @Override
  public Single<Map<String, DatasourceRef>> listDatasources() {
    return restClient
        .getDatasources()
        .map(
            body -> {
              try {
                return GrafanaDatasources.parseDirectory(body);
              } catch (IOException e) {
                throw new DashboardQueryException("Unreadable datasource listing", e);
              }
            });
  }

  @Override
  public MultiValueMatcherRewriter getMatcherRewriter() {
    return matcherRewriter;
  }
}

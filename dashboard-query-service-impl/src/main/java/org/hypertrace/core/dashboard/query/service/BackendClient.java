package org.hypertrace.core.dashboard.query.service;

import io.reactivex.rxjava3.core.Single;
import java.util.List;
import java.util.Map;
import org.hypertrace.core.dashboard.query.api.DatasourceRef;
import org.hypertrace.core.dashboard.query.api.RawResult;
import org.hypertrace.core.dashboard.query.api.TimeRange;
import org.hypertrace.core.dashboard.query.api.VariableDefinition;
import org.hypertrace.core.dashboard.query.service.variable.MultiValueMatcherRewriter;

/** Executes queries against one monitoring backend. */
public interface BackendClient {

  /**
   * Runs all queries of the request in one call. The result is keyed by the refIds of the request;
   * each entry may independently hold data, hold no data or carry an error. A failure of the call
   * as a whole is signalled as an error of the returned {@link Single}.
   */
  Single<Map<String, RawResult>> execute(BackendRequest request);

  boolean supportsServerSideFormulas();

  /** Candidate values of a query variable, after its definition query has been substituted. */
  Single<List<String>> queryVariableValues(
      String definitionQuery, VariableDefinition definition, TimeRange timeRange);

  /**
   * Datasources known to the backend keyed by name and by uid, including the {@link
   * ResolutionContext#DEFAULT_DATASOURCE_ALIAS default} alias.
   */
  Single<Map<String, DatasourceRef>> listDatasources();

  MultiValueMatcherRewriter getMatcherRewriter();
}

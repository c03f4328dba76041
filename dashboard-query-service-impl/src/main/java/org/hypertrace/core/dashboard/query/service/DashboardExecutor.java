package org.hypertrace.core.dashboard.query.service;

import io.reactivex.rxjava3.core.Single;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.hypertrace.core.dashboard.query.api.DashboardDefinition;
import org.hypertrace.core.dashboard.query.api.DashboardExecutionResult;
import org.hypertrace.core.dashboard.query.api.DatasourceRef;
import org.hypertrace.core.dashboard.query.api.Diagnostic;
import org.hypertrace.core.dashboard.query.api.DiagnosticType;
import org.hypertrace.core.dashboard.query.api.Formula;
import org.hypertrace.core.dashboard.query.api.NormalizedResult;
import org.hypertrace.core.dashboard.query.api.PanelDefinition;
import org.hypertrace.core.dashboard.query.api.PanelInfo;
import org.hypertrace.core.dashboard.query.api.Query;
import org.hypertrace.core.dashboard.query.api.RawResult;
import org.hypertrace.core.dashboard.query.api.TimeRange;
import org.hypertrace.core.dashboard.query.api.TimeSeriesResult;
import org.hypertrace.core.dashboard.query.service.builder.BuiltQueries;
import org.hypertrace.core.dashboard.query.service.builder.DashboardQueryBuilder;
import org.hypertrace.core.dashboard.query.service.formula.FormulaEvaluator;
import org.hypertrace.core.dashboard.query.service.interval.IntervalResolver;
import org.hypertrace.core.dashboard.query.service.normalizer.ResponseNormalizer;
import org.hypertrace.core.dashboard.query.service.variable.TemplateVariableResolver;
import org.hypertrace.core.dashboard.query.service.variable.VariableValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one dashboard against the backend holding it: bucket size, variables, query build, a single
 * batched backend call and normalization. Problems local to a sub-query or panel end up as
 * diagnostics of the run; a failure of the batch call fails the run.
 */
@Singleton
public class DashboardExecutor {
  private static final Logger LOG = LoggerFactory.getLogger(DashboardExecutor.class);

  static final String AD_HOC_DASHBOARD_ID = "ad-hoc";
  static final String AD_HOC_REF_ID = "A";

  private final IntervalResolver intervalResolver;
  private final TemplateVariableResolver variableResolver;
  private final DashboardQueryBuilder queryBuilder;
  private final ResponseNormalizer responseNormalizer;
  private final FormulaEvaluator formulaEvaluator;
  private final Duration defaultDeadline;

  @Inject
  DashboardExecutor(
      IntervalResolver intervalResolver,
      TemplateVariableResolver variableResolver,
      DashboardQueryBuilder queryBuilder,
      ResponseNormalizer responseNormalizer,
      FormulaEvaluator formulaEvaluator,
      DashboardQueryServiceConfig config) {
    this(
        intervalResolver,
        variableResolver,
        queryBuilder,
        responseNormalizer,
        formulaEvaluator,
        config.getExecutionDeadline());
  }

  DashboardExecutor(
      IntervalResolver intervalResolver,
      TemplateVariableResolver variableResolver,
      DashboardQueryBuilder queryBuilder,
      ResponseNormalizer responseNormalizer,
      FormulaEvaluator formulaEvaluator,
      Duration defaultDeadline) {
    this.intervalResolver = intervalResolver;
    this.variableResolver = variableResolver;
    this.queryBuilder = queryBuilder;
    this.responseNormalizer = responseNormalizer;
    this.formulaEvaluator = formulaEvaluator;
    this.defaultDeadline = defaultDeadline;
  }

  /** The deadline of a run, the configured one unless the request overrides it. */
  public Duration deadlineOf(ExecutionRequest request) {
    return request.getDeadlineOptional().orElse(defaultDeadline);
  }

  public DashboardExecutionResult execute(
      Backend backend, DashboardDefinition dashboard, ExecutionRequest request) {
    return execute(backend, dashboard, request, Instant.now().plus(deadlineOf(request)));
  }

  /**
   * Runs the dashboard within a deadline whose clock started before this call, typically when
   * the dashboard itself was fetched.
   */
  public DashboardExecutionResult execute(
      Backend backend,
      DashboardDefinition dashboard,
      ExecutionRequest request,
      Instant deadlineInstant) {
    BackendClient client = backend.getClient();
    ResolutionContext context =
        newContext(
            client,
            dashboard.getId(),
            request.getTimeRange(),
            deadlineOf(request),
            deadlineInstant);

    Map<String, VariableValue> variables =
        variableResolver.resolve(
            dashboard.getVariables(),
            request.getVariableOverrides(),
            context,
            (query, definition) ->
                client.queryVariableValues(query, definition, request.getTimeRange()),
            client.getMatcherRewriter());

    BuiltQueries built =
        queryBuilder.build(
            dashboard,
            selectPanels(dashboard, request.getPanelIds()),
            variables,
            context,
            client.getMatcherRewriter());
    if (built.isEmpty()) {
      throw new NoExecutableQueriesException(dashboard.getId());
    }

    boolean serverSideFormulas = client.supportsServerSideFormulas();
    Map<String, RawResult> response =
        executeBatch(
            client,
            BackendRequest.builder()
                .queries(built.getQueries())
                .formulas(serverSideFormulas ? built.getFormulas() : List.of())
                .timeRange(context.getTimeRange())
                .bucketSeconds(context.getBucketSeconds())
                .maxDataPoints(context.getMaxDataPoints())
                .build(),
            context);

    List<NormalizedResult> results =
        serverSideFormulas
            ? responseNormalizer.normalize(
                response, built.getRefMap(), built.getHiddenRefIds(), context)
            : normalizeWithClientSideFormulas(built, response, context);

    LOG.info(
        "Executed dashboard {} on backend {}: {} queries, {} formulas, {} results, {} diagnostics",
        dashboard.getId(),
        backend.getName(),
        built.getQueries().size(),
        built.getFormulas().size(),
        results.size(),
        context.getDiagnostics().size());

    DashboardExecutionResult.DashboardExecutionResultBuilder result =
        DashboardExecutionResult.builder()
            .dashboardId(dashboard.getId())
            .bucketSeconds(context.getBucketSeconds())
            .results(results)
            .diagnostics(context.getDiagnostics());
    variables.forEach((name, value) -> result.variable(name, value.getValues()));
    return result.build();
  }

  /** Runs one expression as a time series query, without variables or panel bookkeeping. */
  public DashboardExecutionResult executeSingleQuery(
      Backend backend, String expression, DatasourceRef datasource, TimeRange timeRange) {
    BackendClient client = backend.getClient();
    ResolutionContext context =
        newContext(
            client,
            AD_HOC_DASHBOARD_ID,
            timeRange,
            defaultDeadline,
            Instant.now().plus(defaultDeadline));
    Query query =
        Query.builder()
            .refId(AD_HOC_REF_ID)
            .expression(expression)
            .datasource(context.resolveDatasource(datasource))
            .intervalSeconds(context.getBucketSeconds())
            .maxDataPoints(context.getMaxDataPoints())
            .build();
    Map<String, RawResult> response =
        executeBatch(
            client,
            BackendRequest.builder()
                .query(query)
                .timeRange(timeRange)
                .bucketSeconds(context.getBucketSeconds())
                .maxDataPoints(context.getMaxDataPoints())
                .build(),
            context);
    PanelInfo panelInfo =
        new PanelInfo(
            AD_HOC_DASHBOARD_ID,
            AD_HOC_DASHBOARD_ID,
            PanelDefinition.DEFAULT_PANEL_TYPE,
            expression);
    return DashboardExecutionResult.builder()
        .dashboardId(AD_HOC_DASHBOARD_ID)
        .bucketSeconds(context.getBucketSeconds())
        .results(
            responseNormalizer.normalize(response, Map.of(AD_HOC_REF_ID, panelInfo), context))
        .diagnostics(context.getDiagnostics())
        .build();
  }

  private ResolutionContext newContext(
      BackendClient client,
      String dashboardId,
      TimeRange timeRange,
      Duration deadline,
      Instant deadlineInstant) {
    return new ResolutionContext(
        dashboardId,
        timeRange,
        intervalResolver.resolve(timeRange),
        intervalResolver.getTargetPointCount(),
        deadline,
        deadlineInstant,
        fetchDatasourceDirectory(client, dashboardId, deadline, deadlineInstant));
  }

  /**
   * Lists the backend's datasources within the time left to the run. Running out of time fails the
   * run, any other error leaves datasource names unresolved.
   */
  private static Map<String, DatasourceRef> fetchDatasourceDirectory(
      BackendClient client, String dashboardId, Duration deadline, Instant deadlineInstant) {
    try {
      return client
          .listDatasources()
          .timeout(remainingMillis(deadlineInstant), TimeUnit.MILLISECONDS)
          .blockingGet();
    } catch (RuntimeException e) {
      if (e.getCause() instanceof TimeoutException) {
        throw new ExecutionTimeoutException(dashboardId, deadline);
      }
      LOG.warn(
          "Unable to list datasources for dashboard {}, datasource names stay unresolved",
          dashboardId,
          e);
      return Map.of();
    }
  }

  static long remainingMillis(Instant deadlineInstant) {
    return Math.max(0, Duration.between(Instant.now(), deadlineInstant).toMillis());
  }

  private static List<PanelDefinition> selectPanels(
      DashboardDefinition dashboard, Set<String> panelIds) {
    if (panelIds.isEmpty()) {
      return dashboard.getPanels();
    }
    List<PanelDefinition> selected =
        dashboard.getPanels().stream()
            .filter(panel -> panelIds.contains(panel.getId()))
            .collect(Collectors.toList());
    if (selected.size() < panelIds.size()) {
      LOG.warn(
          "Dashboard {} has only {} of the requested panels {}",
          dashboard.getId(),
          selected.size(),
          panelIds);
    }
    return selected;
  }

  private static Map<String, RawResult> executeBatch(
      BackendClient client, BackendRequest request, ResolutionContext context) {
    return client
        .execute(request)
        .timeout(context.getRemaining().toMillis(), TimeUnit.MILLISECONDS)
        .onErrorResumeNext(error -> Single.error(toBatchFailure(error, context)))
        .blockingGet();
  }

  private static BackendBatchFailureException toBatchFailure(
      Throwable error, ResolutionContext context) {
    if (error instanceof TimeoutException) {
      return new ExecutionTimeoutException(context.getDashboardId(), context.getDeadline());
    }
    if (error instanceof BackendBatchFailureException) {
      return (BackendBatchFailureException) error;
    }
    return new BackendBatchFailureException(
        "Batch execution failed for dashboard "
            + context.getDashboardId()
            + ": "
            + error.getMessage(),
        error);
  }

  /**
   * Normalizes every data query, hidden ones included since formulas may use them, evaluates the
   * formulas over the resulting series and finally drops the hidden results.
   */
  private List<NormalizedResult> normalizeWithClientSideFormulas(
      BuiltQueries built, Map<String, RawResult> response, ResolutionContext context) {
    List<NormalizedResult> results =
        new ArrayList<>(
            responseNormalizer.normalize(response, built.getQueryRefMap(), context));
    Map<String, TimeSeriesResult> timeSeriesByRefId = new HashMap<>();
    results.stream()
        .filter(TimeSeriesResult.class::isInstance)
        .map(TimeSeriesResult.class::cast)
        .forEach(result -> timeSeriesByRefId.put(result.getRefId(), result));

    for (Formula formula : built.getFormulas()) {
      PanelInfo panelInfo = built.getRefMap().get(formula.getRefId());
      try {
        TimeSeriesResult result = formulaEvaluator.evaluate(formula, panelInfo, timeSeriesByRefId);
        if (result.isEmpty()) {
          context.addDiagnostic(
              Diagnostic.forRefId(
                  DiagnosticType.NO_RESULTS,
                  formula.getRefId(),
                  panelInfo,
                  "Formula " + formula.getExpression() + " produced no points"));
        }
        timeSeriesByRefId.put(formula.getRefId(), result);
        results.add(result);
      } catch (InvalidFormulaException e) {
        LOG.warn("Dropping formula {} of panel {}", formula.getRefId(), panelInfo.getPanelId(), e);
        context.addDiagnostic(
            Diagnostic.forRefId(
                DiagnosticType.FORMULA_DROPPED, formula.getRefId(), panelInfo, e.getMessage()));
      }
    }

    Set<String> hidden = built.getHiddenRefIds();
    Map<String, Integer> position = new LinkedHashMap<>();
    built.getRefMap().keySet().forEach(refId -> position.put(refId, position.size()));
    return results.stream()
        .filter(result -> !hidden.contains(result.getRefId()))
        .sorted(Comparator.comparingInt(result -> position.get(result.getRefId())))
        .collect(Collectors.toUnmodifiableList());
  }
}

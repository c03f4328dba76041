package org.hypertrace.core.dashboard.query.service.variable;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import io.reactivex.rxjava3.core.Observable;
import io.reactivex.rxjava3.core.Single;
import io.reactivex.rxjava3.schedulers.Schedulers;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;
import javax.annotation.Nullable;
import javax.inject.Inject;
import javax.inject.Singleton;
import lombok.Value;
import org.apache.commons.lang3.tuple.ImmutablePair;
import org.hypertrace.core.dashboard.query.api.DatasourceRef;
import org.hypertrace.core.dashboard.query.api.Diagnostic;
import org.hypertrace.core.dashboard.query.api.DiagnosticType;
import org.hypertrace.core.dashboard.query.api.VariableDefinition;
import org.hypertrace.core.dashboard.query.api.VariableKind;
import org.hypertrace.core.dashboard.query.service.DashboardQueryServiceConfig;
import org.hypertrace.core.dashboard.query.service.DependencyUnresolvedException;
import org.hypertrace.core.dashboard.query.service.ExecutionTimeoutException;
import org.hypertrace.core.dashboard.query.service.ResolutionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves a dashboard's variables into concrete values.
 *
 * <p>Built-ins are seeded from the time window, static variables come from the user override, the
 * current selection or the declared options, in that order. Query variables without a selection
 * run their definition query in dependency waves: a wave holds every pending variable whose
 * referenced variables are all resolved, and the queries of one wave run in parallel. A query
 * variable depending on a failed variable, or on itself through a cycle, resolves to no value and
 * its query never runs.
 */
@Singleton
public class TemplateVariableResolver {
  private static final Logger LOG = LoggerFactory.getLogger(TemplateVariableResolver.class);

  private final int queryParallelism;

  @Inject
  TemplateVariableResolver(DashboardQueryServiceConfig config) {
    this(config.getVariableQueryParallelism());
  }

  public TemplateVariableResolver(int queryParallelism) {
    Preconditions.checkArgument(queryParallelism > 0, "query parallelism must be positive");
    this.queryParallelism = queryParallelism;
  }

  /**
   * @return resolved values keyed by variable name, built-ins first and then the declared
   *     variables in declaration order
   */
  public Map<String, VariableValue> resolve(
      List<VariableDefinition> definitions,
      Map<String, List<String>> overrides,
      ResolutionContext context,
      VariableQueryExecutor executor,
      MultiValueMatcherRewriter rewriter) {
    Map<String, VariableValue> resolved = new LinkedHashMap<>(BuiltinVariables.of(context));
    Map<String, VariableDefinition> pending = new LinkedHashMap<>();

    for (VariableDefinition definition : definitions) {
      String name = definition.getName();
      List<String> override = overrides.get(name);
      if (definition.getKind() != VariableKind.QUERY) {
        List<String> selected = override != null ? override : definition.getValues();
        resolved.put(
            name,
            VariableValue.of(
                name,
                isAllSelection(selected) ? definition.getOptions() : selected,
                definition.isMultiValue()));
      } else if (override != null && !isAllSelection(override)) {
        resolved.put(name, VariableValue.of(name, override, definition.isMultiValue()));
      } else if (override == null
          && !definition.getValues().isEmpty()
          && !definition.isAllSelected()) {
        resolved.put(
            name, VariableValue.of(name, definition.getValues(), definition.isMultiValue()));
      } else if (definition.getDefinitionQueryOptional().isEmpty()) {
        LOG.debug("Query variable {} has neither a selection nor a definition query", name);
        resolved.put(name, VariableValue.empty(name));
      } else {
        pending.put(name, definition);
      }
    }

    Set<String> declaredNames =
        definitions.stream().map(VariableDefinition::getName).collect(Collectors.toSet());
    resolveQueryVariables(
        pending, declaredNames, overrides, resolved, context, executor, rewriter);

    Map<String, VariableValue> ordered = new LinkedHashMap<>(BuiltinVariables.of(context));
    definitions.forEach(
        definition -> ordered.put(definition.getName(), resolved.get(definition.getName())));
    return ordered;
  }

  private void resolveQueryVariables(
      Map<String, VariableDefinition> pending,
      Set<String> declaredNames,
      Map<String, List<String>> overrides,
      Map<String, VariableValue> resolved,
      ResolutionContext context,
      VariableQueryExecutor executor,
      MultiValueMatcherRewriter rewriter) {
    Map<String, Set<String>> dependencies = new LinkedHashMap<>();
    pending.forEach(
        (name, definition) ->
            dependencies.put(
                name,
                VariablePlaceholders.referencedNames(definition.getDefinitionQuery()).stream()
                    .filter(declaredNames::contains)
                    .collect(Collectors.toCollection(LinkedHashSet::new))));
    Set<String> failed = new LinkedHashSet<>();
    Set<String> knownNames = new HashSet<>(declaredNames);
    knownNames.addAll(BuiltinVariables.NAMES);

    while (!pending.isEmpty()) {
      List<String> blocked =
          pending.keySet().stream()
              .filter(name -> dependencies.get(name).stream().anyMatch(failed::contains))
              .collect(Collectors.toList());
      if (!blocked.isEmpty()) {
        blocked.forEach(
            name -> {
              Set<String> unresolvedDependencies = new LinkedHashSet<>(dependencies.get(name));
              unresolvedDependencies.retainAll(failed);
              markUnresolved(
                  name,
                  new DependencyUnresolvedException(
                      "Variable "
                          + name
                          + " depends on unresolved variable(s) "
                          + unresolvedDependencies),
                  resolved,
                  context);
              failed.add(name);
              pending.remove(name);
            });
        continue;
      }

      List<VariableDefinition> wave =
          pending.values().stream()
              .filter(
                  definition ->
                      dependencies.get(definition.getName()).stream()
                          .noneMatch(pending::containsKey))
              .collect(Collectors.toList());
      if (wave.isEmpty()) {
        new ArrayList<>(pending.keySet())
            .forEach(
                name -> {
                  markUnresolved(
                      name,
                      new DependencyUnresolvedException(
                          "Variable " + name + " is part of a dependency cycle"),
                      resolved,
                      context);
                  failed.add(name);
                  pending.remove(name);
                });
        break;
      }

      Map<String, VariableValue> snapshot = ImmutableMap.copyOf(resolved);
      for (ImmutablePair<String, QueryOutcome> result :
          executeWave(wave, snapshot, knownNames, context, executor, rewriter)) {
        String name = result.getLeft();
        VariableDefinition definition = pending.remove(name);
        QueryOutcome outcome = result.getRight();
        if (outcome.getError() != null) {
          LOG.warn("Query for variable {} failed", name, outcome.getError());
          context.addDiagnostic(
              Diagnostic.forVariable(
                  DiagnosticType.VARIABLE_QUERY_FAILED,
                  name,
                  "Query for variable " + name + " failed: " + outcome.getError().getMessage()));
          resolved.put(name, VariableValue.empty(name));
          failed.add(name);
        } else {
          resolved.put(
              name,
              VariableValue.of(
                  name,
                  selectValues(definition, overrides.get(name), outcome.getValues()),
                  definition.isMultiValue()));
        }
      }
    }
  }

  private List<ImmutablePair<String, QueryOutcome>> executeWave(
      List<VariableDefinition> wave,
      Map<String, VariableValue> snapshot,
      Set<String> knownNames,
      ResolutionContext context,
      VariableQueryExecutor executor,
      MultiValueMatcherRewriter rewriter) {
    long remainingMillis = context.getRemaining().toMillis();
    return Observable.fromIterable(wave)
        .flatMap(
            definition ->
                executeQuery(definition, snapshot, knownNames, context, executor, rewriter)
                    .toObservable(),
            queryParallelism)
        .toList()
        .timeout(remainingMillis, TimeUnit.MILLISECONDS)
        .onErrorResumeNext(
            error ->
                error instanceof TimeoutException
                    ? Single.error(
                        new ExecutionTimeoutException(
                            context.getDashboardId(), context.getDeadline()))
                    : Single.error(error))
        .blockingGet();
  }

  private Single<ImmutablePair<String, QueryOutcome>> executeQuery(
      VariableDefinition definition,
      Map<String, VariableValue> snapshot,
      Set<String> knownNames,
      ResolutionContext context,
      VariableQueryExecutor executor,
      MultiValueMatcherRewriter rewriter) {
    VariablePlaceholders.Substitution substitution =
        VariablePlaceholders.substitute(definition.getDefinitionQuery(), snapshot, knownNames);
    substitution
        .getUnresolvedNames()
        .forEach(
            unresolvedName -> {
              LOG.warn(
                  "Definition query of variable {} references unresolved variable {}, substituting"
                      + " an empty value",
                  definition.getName(),
                  unresolvedName);
              context.addDiagnostic(
                  Diagnostic.forVariable(
                      DiagnosticType.UNRESOLVED_PLACEHOLDER,
                      definition.getName(),
                      "Unresolved variable " + unresolvedName + " in definition query"));
            });
    String query = rewriter.rewrite(substitution);
    LOG.debug("Resolving variable {} with query {}", definition.getName(), query);
    VariableDefinition executable = withResolvedDatasource(definition, snapshot, context);
    return Single.defer(() -> executor.execute(query, executable))
        .subscribeOn(Schedulers.io())
        .map(QueryOutcome::success)
        .onErrorReturn(QueryOutcome::failure)
        .map(outcome -> ImmutablePair.of(definition.getName(), outcome));
  }

  /**
   * Points the definition at a concrete datasource: placeholders in the uid are substituted, names
   * and aliases looked up in the run's directory. Without a datasource of its own the variable
   * uses the default datasource, when there is one.
   */
  private static VariableDefinition withResolvedDatasource(
      VariableDefinition definition,
      Map<String, VariableValue> snapshot,
      ResolutionContext context) {
    Optional<DatasourceRef> datasource =
        Optional.ofNullable(definition.getDatasource())
            .map(
                ref ->
                    DatasourceRef.of(
                        VariablePlaceholders.substitute(ref.getUid(), snapshot).getText(),
                        ref.getType()))
            .filter(ref -> !ref.getUid().isBlank())
            .map(context::resolveDatasource)
            .or(context::getDefaultDatasource);
    return datasource
        .map(ref -> definition.toBuilder().datasource(ref).build())
        .orElse(definition);
  }

  private static List<String> selectValues(
      VariableDefinition definition, @Nullable List<String> override, List<String> queried) {
    List<String> distinct = queried.stream().distinct().collect(Collectors.toList());
    boolean all = definition.isAllSelected() || (override != null && isAllSelection(override));
    if (all || definition.isMultiValue() || distinct.size() <= 1) {
      return distinct;
    }
    return distinct.subList(0, 1);
  }

  private static void markUnresolved(
      String name,
      DependencyUnresolvedException error,
      Map<String, VariableValue> resolved,
      ResolutionContext context) {
    LOG.warn(error.getMessage());
    context.addDiagnostic(
        Diagnostic.forVariable(DiagnosticType.DEPENDENCY_UNRESOLVED, name, error.getMessage()));
    resolved.put(name, VariableValue.empty(name));
  }

  private static boolean isAllSelection(List<String> values) {
    return values.size() == 1
        && (VariableDefinition.ALL_VALUE.equals(values.get(0))
            || "All".equalsIgnoreCase(values.get(0)));
  }

  @Value
  private static class QueryOutcome {
    List<String> values;
    @Nullable Throwable error;

    static QueryOutcome success(List<String> values) {
      return new QueryOutcome(values, null);
    }

    static QueryOutcome failure(Throwable error) {
      return new QueryOutcome(List.of(), error);
    }
  }
}

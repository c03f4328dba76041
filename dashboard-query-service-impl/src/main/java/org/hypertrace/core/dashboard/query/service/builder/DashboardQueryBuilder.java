package org.hypertrace.core.dashboard.query.service.builder;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.hypertrace.core.dashboard.query.api.DashboardDefinition;
import org.hypertrace.core.dashboard.query.api.DatasourceRef;
import org.hypertrace.core.dashboard.query.api.Diagnostic;
import org.hypertrace.core.dashboard.query.api.DiagnosticType;
import org.hypertrace.core.dashboard.query.api.Formula;
import org.hypertrace.core.dashboard.query.api.FormulaDefinition;
import org.hypertrace.core.dashboard.query.api.PanelDefinition;
import org.hypertrace.core.dashboard.query.api.PanelInfo;
import org.hypertrace.core.dashboard.query.api.Query;
import org.hypertrace.core.dashboard.query.api.SubQueryDefinition;
import org.hypertrace.core.dashboard.query.service.DashboardQueryServiceConfig;
import org.hypertrace.core.dashboard.query.service.DatasourceUnresolvedException;
import org.hypertrace.core.dashboard.query.service.RefIdExhaustedException;
import org.hypertrace.core.dashboard.query.service.ResolutionContext;
import org.hypertrace.core.dashboard.query.service.formula.FormulaReferences;
import org.hypertrace.core.dashboard.query.service.variable.BuiltinVariables;
import org.hypertrace.core.dashboard.query.service.variable.MultiValueMatcherRewriter;
import org.hypertrace.core.dashboard.query.service.variable.VariablePlaceholders;
import org.hypertrace.core.dashboard.query.service.variable.VariablePlaceholders.Substitution;
import org.hypertrace.core.dashboard.query.service.variable.VariableValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns panels into backend-ready queries and formulas.
 *
 * <p>Panels are visited in the given order and sub-queries in declaration order; each one gets the
 * next identifier of the ref id alphabet. A sub-query without a resolvable datasource is skipped.
 * A panel's formulas reference its sub-queries by their local names; these are remapped to the
 * assigned identifiers and a formula referencing an unknown name is dropped. When the alphabet runs
 * out the whole panel is rejected and nothing of it is emitted.
 */
@Singleton
public class DashboardQueryBuilder {
  private static final Logger LOG = LoggerFactory.getLogger(DashboardQueryBuilder.class);

  private final String refIdAlphabet;
  private final DatasourceResolver datasourceResolver;

  @Inject
  DashboardQueryBuilder(DashboardQueryServiceConfig config, DatasourceResolver datasourceResolver) {
    this(config.getRefIdAlphabet(), datasourceResolver);
  }

  public DashboardQueryBuilder(String refIdAlphabet, DatasourceResolver datasourceResolver) {
    this.refIdAlphabet = refIdAlphabet;
    this.datasourceResolver = datasourceResolver;
  }

  public BuiltQueries build(
      DashboardDefinition dashboard,
      List<PanelDefinition> panels,
      Map<String, VariableValue> variables,
      ResolutionContext context,
      MultiValueMatcherRewriter rewriter) {
    RefIdAllocator allocator = new RefIdAllocator(refIdAlphabet);
    Set<String> variableNames = variableNames(dashboard);
    BuiltQueries.BuiltQueriesBuilder built = BuiltQueries.builder();
    for (PanelDefinition panel : panels) {
      int checkpoint = allocator.checkpoint();
      try {
        PanelQueries panelQueries =
            buildPanel(dashboard, panel, variables, variableNames, context, rewriter, allocator);
        built.queries(panelQueries.queries);
        built.formulas(panelQueries.formulas);
        built.refMap(panelQueries.refMap);
      } catch (RefIdExhaustedException e) {
        allocator.rollback(checkpoint);
        LOG.warn("Rejecting panel {}: {}", panel.getId(), e.getMessage());
        context.addDiagnostic(
            Diagnostic.forPanel(
                DiagnosticType.REF_ID_EXHAUSTED,
                panel.getId(),
                "Panel rejected, not enough reference identifiers left: " + e.getMessage()));
      }
    }
    return built.build();
  }

  private PanelQueries buildPanel(
      DashboardDefinition dashboard,
      PanelDefinition panel,
      Map<String, VariableValue> variables,
      Set<String> variableNames,
      ResolutionContext context,
      MultiValueMatcherRewriter rewriter,
      RefIdAllocator allocator) {
    PanelQueries panelQueries = new PanelQueries();
    Map<String, String> localToGlobal = new HashMap<>();

    for (SubQueryDefinition subQuery : panel.getSubQueries()) {
      DatasourceRef datasource;
      try {
        datasource = datasourceResolver.resolve(subQuery, panel, dashboard, variables, context);
      } catch (DatasourceUnresolvedException e) {
        LOG.warn(
            "Skipping sub-query {} of panel {}: {}",
            subQuery.getExpression(),
            panel.getId(),
            e.getMessage());
        context.addDiagnostic(
            Diagnostic.forPanel(
                DiagnosticType.DATASOURCE_UNRESOLVED, panel.getId(), e.getMessage()));
        continue;
      }

      Substitution substitution =
          VariablePlaceholders.substitute(subQuery.getExpression(), variables, variableNames);
      reportUnresolved(panel, substitution, context);
      String refId = allocator.next();
      subQuery.getLocalRefIdOptional().ifPresent(local -> localToGlobal.put(local, refId));
      panelQueries.queries.add(
          Query.builder()
              .refId(refId)
              .expression(rewriter.rewrite(substitution))
              .datasource(datasource)
              .disabled(subQuery.isDisabled())
              .legend(subQuery.getLegend())
              .raw(subQuery.isRaw())
              .intervalSeconds(context.getBucketSeconds())
              .maxDataPoints(context.getMaxDataPoints())
              .build());
      panelQueries.refMap.put(refId, panelInfo(panel, subQuery.getExpression()));
    }

    for (FormulaDefinition formulaDefinition : panel.getFormulas()) {
      String expression = formulaDefinition.getExpression();
      Set<String> references = FormulaReferences.referencedNames(expression);
      List<String> unknown =
          references.stream()
              .filter(reference -> !localToGlobal.containsKey(reference))
              .collect(Collectors.toList());
      if (references.isEmpty() || !unknown.isEmpty()) {
        String reason =
            references.isEmpty()
                ? "references no query"
                : "references unknown queries " + unknown;
        LOG.warn("Dropping formula {} of panel {}: {}", expression, panel.getId(), reason);
        context.addDiagnostic(
            Diagnostic.forPanel(
                DiagnosticType.FORMULA_DROPPED,
                panel.getId(),
                "Formula " + expression + " dropped, it " + reason));
        continue;
      }
      String refId = allocator.next();
      panelQueries.formulas.add(
          new Formula(
              refId,
              FormulaReferences.rewrite(expression, localToGlobal::get),
              formulaDefinition.getLegend(),
              references.stream()
                  .map(localToGlobal::get)
                  .collect(Collectors.toUnmodifiableList())));
      formulaDefinition.getLocalRefIdOptional().ifPresent(local -> localToGlobal.put(local, refId));
      panelQueries.refMap.put(refId, panelInfo(panel, expression));
    }
    return panelQueries;
  }

  private static void reportUnresolved(
      PanelDefinition panel, Substitution substitution, ResolutionContext context) {
    for (String name : substitution.getUnresolvedNames()) {
      LOG.warn(
          "Panel {} references unresolved variable {}, substituting an empty value",
          panel.getId(),
          name);
      context.addDiagnostic(
          Diagnostic.forPanel(
              DiagnosticType.UNRESOLVED_PLACEHOLDER,
              panel.getId(),
              "Unresolved variable " + name + " substituted with an empty value"));
    }
  }

  /** Declared and built-in names; any other {@code $token} is query text. */
  private static Set<String> variableNames(DashboardDefinition dashboard) {
    Set<String> names = new HashSet<>(BuiltinVariables.NAMES);
    dashboard.getVariables().forEach(variable -> names.add(variable.getName()));
    return names;
  }

  private static PanelInfo panelInfo(PanelDefinition panel, String originalExpression) {
    return new PanelInfo(
        panel.getId(), panel.getTitleOrId(), panel.getTypeOrDefault(), originalExpression);
  }

  private static class PanelQueries {
    private final List<Query> queries = new ArrayList<>();
    private final List<Formula> formulas = new ArrayList<>();
    private final Map<String, PanelInfo> refMap = new LinkedHashMap<>();
  }
}

package org.hypertrace.core.dashboard.query.service.builder;

import java.util.LinkedHashMap;
import java.util.Map;
import javax.inject.Singleton;
import org.hypertrace.core.dashboard.query.api.DashboardDefinition;
import org.hypertrace.core.dashboard.query.api.DatasourceRef;
import org.hypertrace.core.dashboard.query.api.PanelDefinition;
import org.hypertrace.core.dashboard.query.api.SubQueryDefinition;
import org.hypertrace.core.dashboard.query.service.DatasourceUnresolvedException;
import org.hypertrace.core.dashboard.query.service.ResolutionContext;
import org.hypertrace.core.dashboard.query.service.variable.VariablePlaceholders;
import org.hypertrace.core.dashboard.query.service.variable.VariableValue;

/**
 * Picks the datasource of a sub-query: its own, else the panel's, else the dashboard default. A
 * datasource given through a variable is substituted with the variable's first value, then names
 * and the default alias are mapped to uids through the run's datasource directory.
 */
@Singleton
public class DatasourceResolver {

  public DatasourceRef resolve(
      SubQueryDefinition subQuery,
      PanelDefinition panel,
      DashboardDefinition dashboard,
      Map<String, VariableValue> variables,
      ResolutionContext context) {
    DatasourceRef declared =
        subQuery
            .getDatasourceOptional()
            .or(panel::getDatasourceOptional)
            .or(dashboard::getDefaultDatasourceOptional)
            .orElseThrow(
                () ->
                    new DatasourceUnresolvedException(
                        "Sub-query of panel "
                            + panel.getId()
                            + " has no datasource and the dashboard declares no default"));

    String uid = declared.getUid();
    if (VariablePlaceholders.containsPlaceholder(uid)) {
      uid = VariablePlaceholders.substitute(uid, firstValues(variables)).getText().trim();
    }
    if (uid.isEmpty()) {
      throw new DatasourceUnresolvedException(
          "Datasource "
              + declared.getUid()
              + " of panel "
              + panel.getId()
              + " resolved to nothing");
    }
    return context.resolveDatasource(DatasourceRef.of(uid, declared.getType()));
  }

  private static Map<String, VariableValue> firstValues(Map<String, VariableValue> variables) {
    Map<String, VariableValue> firstValues = new LinkedHashMap<>();
    variables.forEach(
        (name, value) ->
            firstValues.put(
                name,
                value.getValues().isEmpty()
                    ? value
                    : VariableValue.single(name, value.getValues().get(0))));
    return firstValues;
  }
}

package org.hypertrace.core.dashboard.query.service.grafana;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;
import javax.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;
import org.hypertrace.core.dashboard.query.api.DashboardDefinition;
import org.hypertrace.core.dashboard.query.api.DatasourceRef;
import org.hypertrace.core.dashboard.query.api.FormulaDefinition;
import org.hypertrace.core.dashboard.query.api.PanelDefinition;
import org.hypertrace.core.dashboard.query.api.SubQueryDefinition;
import org.hypertrace.core.dashboard.query.api.VariableDefinition;
import org.hypertrace.core.dashboard.query.api.VariableKind;
import org.hypertrace.core.dashboard.query.service.DashboardQueryException;

/** Maps the JSON model of {@code /api/dashboards/uid/<uid>} onto a dashboard definition. */
@Slf4j
class GrafanaDashboardParser {
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  private static final String ROW_PANEL_TYPE = "row";
  private static final String MIXED_DATASOURCE = "-- Mixed --";
  private static final Set<String> QUERY_HOLDS_VALUE = Set.of("textbox", "constant");

  private GrafanaDashboardParser() {}

  static DashboardDefinition parse(String requestedUid, String json) {
    JsonNode root;
    try {
      root = OBJECT_MAPPER.readTree(json);
    } catch (IOException e) {
      throw new DashboardQueryException("Unreadable dashboard " + requestedUid, e);
    }
    JsonNode dashboard = root.has("dashboard") ? root.get("dashboard") : root;
    DashboardDefinition.DashboardDefinitionBuilder builder =
        DashboardDefinition.builder()
            .id(text(dashboard, "uid").orElse(requestedUid))
            .title(text(dashboard, "title").orElse(null))
            .defaultDatasource(parseDatasource(dashboard.get("datasource")));

    flattenPanels(dashboard).stream()
        .map(GrafanaDashboardParser::parsePanel)
        .flatMap(Optional::stream)
        .forEach(builder::panel);

    elements(dashboard.path("templating").path("list")).stream()
        .map(GrafanaDashboardParser::parseVariable)
        .flatMap(Optional::stream)
        .forEach(builder::variable);

    return builder.build();
  }

  /** Panels in declaration order, with the panels of collapsed rows and legacy rows inlined. */
  private static List<JsonNode> flattenPanels(JsonNode dashboard) {
    List<JsonNode> panels = new ArrayList<>();
    for (JsonNode panel : elements(dashboard.path("panels"))) {
      if (ROW_PANEL_TYPE.equals(panel.path("type").asText())) {
        panels.addAll(elements(panel.path("panels")));
      } else {
        panels.add(panel);
      }
    }
    for (JsonNode row : elements(dashboard.path("rows"))) {
      panels.addAll(elements(row.path("panels")));
    }
    return panels;
  }

  private static Optional<PanelDefinition> parsePanel(JsonNode panel) {
    Optional<String> id = text(panel, "id");
    List<JsonNode> targets = elements(panel.path("targets"));
    if (id.isEmpty() || targets.isEmpty()) {
      return Optional.empty();
    }
    PanelDefinition.PanelDefinitionBuilder builder =
        PanelDefinition.builder()
            .id(id.get())
            .title(text(panel, "title").orElse(null))
            .type(text(panel, "type").orElse(null))
            .datasource(parseDatasource(panel.get("datasource")));

    for (JsonNode target : targets) {
      String refId = text(target, "refId").orElse(null);
      if (isExpression(target.get("datasource"))) {
        if (GrafanaQueryPayload.MATH_EXPRESSION_TYPE.equals(target.path("type").asText())
            && text(target, "expression").isPresent()) {
          builder.formula(
              new FormulaDefinition(refId, text(target, "expression").get(), null));
        } else {
          log.warn(
              "Panel {} target {} uses unsupported expression type {}, skipping",
              id.get(),
              refId,
              target.path("type").asText());
        }
        continue;
      }
      Optional<String> expr = text(target, "expr");
      Optional<String> rawQuery = text(target, "query");
      if (expr.isEmpty() && rawQuery.isEmpty()) {
        log.debug("Panel {} target {} has no expression, skipping", id.get(), refId);
        continue;
      }
      builder.subQuery(
          SubQueryDefinition.builder()
              .localRefId(refId)
              .expression(expr.orElseGet(rawQuery::get))
              .raw(expr.isEmpty())
              .datasource(parseDatasource(target.get("datasource")))
              .disabled(target.path("hide").asBoolean(false))
              .legend(text(target, "legendFormat").orElse(null))
              .build());
    }
    return Optional.of(builder.build());
  }

  private static Optional<VariableDefinition> parseVariable(JsonNode variable) {
    Optional<String> name = text(variable, "name");
    Optional<VariableKind> kind = variableKind(variable.path("type").asText());
    if (name.isEmpty() || kind.isEmpty()) {
      log.debug(
          "Skipping template variable {} of type {}",
          name.orElse("<unnamed>"),
          variable.path("type").asText());
      return Optional.empty();
    }
    VariableDefinition.VariableDefinitionBuilder builder =
        VariableDefinition.builder()
            .name(name.get())
            .kind(kind.get())
            .multiValue(variable.path("multi").asBoolean(false))
            .values(currentValues(variable))
            .options(optionValues(variable))
            .regex(text(variable, "regex").orElse(null));

    if (kind.get() == VariableKind.QUERY) {
      builder
          .definitionQuery(definitionQuery(variable).orElse(null))
          .datasource(parseDatasource(variable.get("datasource")));
    }
    return Optional.of(builder.build());
  }

  private static Optional<VariableKind> variableKind(String grafanaType) {
    switch (grafanaType) {
      case "query":
        return Optional.of(VariableKind.QUERY);
      case "custom":
      case "textbox":
      case "constant":
      case "datasource":
        return Optional.of(VariableKind.STATIC);
      case "interval":
        return Optional.of(VariableKind.BUILTIN);
      default:
        return Optional.empty();
    }
  }

  /** Current selection, Grafana's {@code $__all} marker included. */
  private static List<String> currentValues(JsonNode variable) {
    JsonNode current = variable.path("current").path("value");
    List<String> values =
        current.isArray()
            ? elements(current).stream().map(JsonNode::asText).collect(Collectors.toList())
            : current.isValueNode() && !current.isNull() ? List.of(current.asText()) : List.of();
    List<String> selected =
        values.stream()
            .filter(value -> !value.isEmpty())
            .collect(Collectors.toList());
    // text boxes and constants keep their value in the query field
    if (selected.isEmpty() && QUERY_HOLDS_VALUE.contains(variable.path("type").asText())) {
      return text(variable, "query").map(List::of).orElse(List.of());
    }
    return selected;
  }

  private static List<String> optionValues(JsonNode variable) {
    List<String> options =
        elements(variable.path("options")).stream()
            .map(option -> option.path("value"))
            .filter(JsonNode::isValueNode)
            .map(JsonNode::asText)
            .filter(value -> !VariableDefinition.ALL_VALUE.equals(value) && !value.isEmpty())
            .collect(Collectors.toList());
    if (options.isEmpty() && "custom".equals(variable.path("type").asText())) {
      return text(variable, "query")
          .map(
              query ->
                  List.of(query.split(",")).stream()
                      .map(String::trim)
                      .filter(value -> !value.isEmpty())
                      .collect(Collectors.toList()))
          .orElse(List.of());
    }
    return options;
  }

  /** Newer dashboards nest the query text in an object, older ones store it as a string. */
  private static Optional<String> definitionQuery(JsonNode variable) {
    JsonNode query = variable.path("query");
    if (query.isObject()) {
      return text(query, "query").or(() -> text(variable, "definition"));
    }
    return text(variable, "query").or(() -> text(variable, "definition"));
  }

  @Nullable
  static DatasourceRef parseDatasource(@Nullable JsonNode datasource) {
    if (datasource == null || datasource.isNull() || datasource.isMissingNode()) {
      return null;
    }
    if (datasource.isTextual()) {
      String value = datasource.asText();
      return value.isBlank() || MIXED_DATASOURCE.equals(value) ? null : DatasourceRef.of(value);
    }
    Optional<String> uid = text(datasource, "uid");
    if (uid.isEmpty() || MIXED_DATASOURCE.equals(uid.get())) {
      return null;
    }
    return DatasourceRef.of(uid.get(), text(datasource, "type").orElse(null));
  }

  private static boolean isExpression(@Nullable JsonNode datasource) {
    if (datasource == null) {
      return false;
    }
    if (datasource.isTextual()) {
      return GrafanaQueryPayload.EXPRESSION_DATASOURCE.equals(datasource.asText());
    }
    return GrafanaQueryPayload.EXPRESSION_DATASOURCE.equals(datasource.path("uid").asText())
        || GrafanaQueryPayload.EXPRESSION_DATASOURCE.equals(datasource.path("type").asText());
  }

  private static Optional<String> text(JsonNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null || !value.isValueNode() || value.isNull()) {
      return Optional.empty();
    }
    return Optional.of(value.asText()).filter(text -> !text.isBlank());
  }

  private static List<JsonNode> elements(JsonNode node) {
    if (!node.isArray()) {
      return List.of();
    }
    return StreamSupport.stream(node.spliterator(), false).collect(Collectors.toList());
  }
}

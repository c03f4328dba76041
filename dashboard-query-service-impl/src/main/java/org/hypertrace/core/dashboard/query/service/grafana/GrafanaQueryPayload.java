package org.hypertrace.core.dashboard.query.service.grafana;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.hypertrace.core.dashboard.query.api.DatasourceRef;
import org.hypertrace.core.dashboard.query.api.Formula;
import org.hypertrace.core.dashboard.query.api.Query;
import org.hypertrace.core.dashboard.query.service.BackendBatchFailureException;
import org.hypertrace.core.dashboard.query.service.BackendRequest;
import org.hypertrace.core.dashboard.query.service.formula.FormulaReferences;

/** Serializes a batch into the body of {@code /api/ds/query}. */
class GrafanaQueryPayload {
  static final String EXPRESSION_DATASOURCE = "__expr__";
  static final String MATH_EXPRESSION_TYPE = "math";

  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  private GrafanaQueryPayload() {}

  static String toJson(BackendRequest request) {
    ObjectNode payload = OBJECT_MAPPER.createObjectNode();
    payload.put("from", String.valueOf(request.getTimeRange().getFrom().toEpochMilli()));
    payload.put("to", String.valueOf(request.getTimeRange().getTo().toEpochMilli()));
    ArrayNode queries = payload.putArray("queries");
    request.getQueries().forEach(query -> queries.add(toQueryNode(query)));
    request.getFormulas().forEach(formula -> queries.add(toFormulaNode(formula)));
    try {
      return OBJECT_MAPPER.writeValueAsString(payload);
    } catch (JsonProcessingException e) {
      throw new BackendBatchFailureException("Unable to serialize datasource query", e);
    }
  }

  private static ObjectNode toQueryNode(Query query) {
    ObjectNode node = OBJECT_MAPPER.createObjectNode();
    node.put("refId", query.getRefId());
    node.set("datasource", toDatasourceNode(query.getDatasource()));
    node.put(query.isRaw() ? "query" : "expr", query.getExpression());
    node.put("intervalMs", query.getIntervalSeconds() * 1000);
    node.put("maxDataPoints", query.getMaxDataPoints());
    node.put("hide", query.isDisabled());
    if (query.getLegend() != null) {
      node.put("legendFormat", query.getLegend());
    }
    return node;
  }

  private static ObjectNode toFormulaNode(Formula formula) {
    ObjectNode node = OBJECT_MAPPER.createObjectNode();
    node.put("refId", formula.getRefId());
    node.set(
        "datasource",
        OBJECT_MAPPER
            .createObjectNode()
            .put("type", EXPRESSION_DATASOURCE)
            .put("uid", EXPRESSION_DATASOURCE));
    node.put("type", MATH_EXPRESSION_TYPE);
    node.put("expression", FormulaReferences.rewrite(formula.getExpression(), name -> "$" + name));
    node.put("hide", false);
    return node;
  }

  private static ObjectNode toDatasourceNode(DatasourceRef datasource) {
    ObjectNode node = OBJECT_MAPPER.createObjectNode().put("uid", datasource.getUid());
    datasource.getTypeOptional().ifPresent(type -> node.put("type", type));
    return node;
  }
}

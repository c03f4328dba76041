package org.hypertrace.core.dashboard.query.service.grafana;

import static org.hypertrace.core.dashboard.query.service.grafana.GrafanaTestSupport.TIME_RANGE;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import org.hypertrace.core.dashboard.query.api.DatasourceRef;
import org.hypertrace.core.dashboard.query.api.Formula;
import org.hypertrace.core.dashboard.query.api.Query;
import org.hypertrace.core.dashboard.query.service.BackendRequest;
import org.junit.jupiter.api.Test;

class GrafanaQueryPayloadTest {
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  @Test
  void serializesQueriesThenFormulas() throws Exception {
    BackendRequest request =
        BackendRequest.builder()
            .timeRange(TIME_RANGE)
            .bucketSeconds(60)
            .maxDataPoints(60)
            .query(
                query("A", "sum(rate(http_requests_total[2m]))")
                    .toBuilder()
                    .legend("total")
                    .build())
            .query(query("B", "sum(rate(errors_total[2m]))").toBuilder().disabled(true).build())
            .formula(new Formula("C", "B * 100 / A", null, List.of("B", "A")))
            .build();

    JsonNode payload = OBJECT_MAPPER.readTree(GrafanaQueryPayload.toJson(request));

    assertEquals("1700000000000", payload.get("from").asText());
    assertEquals("1700003600000", payload.get("to").asText());
    JsonNode queries = payload.get("queries");
    assertEquals(3, queries.size());

    JsonNode total = queries.get(0);
    assertEquals("A", total.get("refId").asText());
    assertEquals("prom-main", total.path("datasource").path("uid").asText());
    assertEquals("prometheus", total.path("datasource").path("type").asText());
    assertEquals("sum(rate(http_requests_total[2m]))", total.get("expr").asText());
    assertEquals(60_000, total.get("intervalMs").asLong());
    assertEquals(60, total.get("maxDataPoints").asInt());
    assertEquals("total", total.get("legendFormat").asText());
    assertFalse(total.get("hide").asBoolean());

    JsonNode errors = queries.get(1);
    assertTrue(errors.get("hide").asBoolean());
    assertFalse(errors.has("legendFormat"));

    JsonNode formula = queries.get(2);
    assertEquals("C", formula.get("refId").asText());
    assertEquals("__expr__", formula.path("datasource").path("uid").asText());
    assertEquals("math", formula.get("type").asText());
    assertEquals("$B * 100 / $A", formula.get("expression").asText());
  }

  @Test
  void sendsRawQueriesAsQueryText() throws Exception {
    BackendRequest request =
        BackendRequest.builder()
            .timeRange(TIME_RANGE)
            .query(
                query("A", "SELECT count(*) FROM orders")
                    .toBuilder()
                    .datasource(DatasourceRef.of("pg"))
                    .raw(true)
                    .build())
            .build();

    JsonNode query = OBJECT_MAPPER.readTree(GrafanaQueryPayload.toJson(request)).get("queries");

    assertEquals("SELECT count(*) FROM orders", query.get(0).get("query").asText());
    assertFalse(query.get(0).has("expr"));
    assertFalse(query.get(0).path("datasource").has("type"));
  }

  private static Query query(String refId, String expression) {
    return Query.builder()
        .refId(refId)
        .expression(expression)
        .datasource(DatasourceRef.of("prom-main", "prometheus"))
        .intervalSeconds(60)
        .maxDataPoints(60)
        .build();
  }
}

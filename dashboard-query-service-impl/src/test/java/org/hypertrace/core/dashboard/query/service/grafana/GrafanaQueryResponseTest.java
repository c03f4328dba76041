package org.hypertrace.core.dashboard.query.service.grafana;

import static org.hypertrace.core.dashboard.query.service.grafana.GrafanaTestSupport.readResource;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.hypertrace.core.dashboard.query.api.FieldType;
import org.hypertrace.core.dashboard.query.api.Frame;
import org.hypertrace.core.dashboard.query.api.RawResult;
import org.junit.jupiter.api.Test;

class GrafanaQueryResponseTest {

  @Test
  void convertsFramesKeyedByRefId() throws Exception {
    Map<String, RawResult> results =
        GrafanaQueryResponse.fromJson(readResource("grafana/ds-query-response.json"))
            .toRawResults();

    assertEquals(List.of("A", "B", "C", "D"), List.copyOf(results.keySet()));

    RawResult total = results.get("A");
    assertEquals(200, total.getStatus());
    Frame frame = total.getFrames().get(0);
    assertEquals("total", frame.getName());
    assertEquals(FieldType.TIME, frame.getFields().get(0).getType());
    assertEquals(FieldType.NUMBER, frame.getFields().get(1).getType());
    assertEquals(Map.of("service", "checkout"), frame.getFields().get(1).getLabels());
    assertEquals(2, frame.getRowCount());
    assertEquals(List.of(12.5, 13.0), frame.getColumns().get(1));
  }

  @Test
  void distinguishesEmptyMissingAndFailedResults() throws Exception {
    Map<String, RawResult> results =
        GrafanaQueryResponse.fromJson(readResource("grafana/ds-query-response.json"))
            .toRawResults();

    assertTrue(results.get("B").isEmpty());
    assertTrue(results.get("C").isMissing());
    assertEquals("parse error at char 4", results.get("D").getError());
    assertEquals(400, results.get("D").getStatus());
    assertTrue(results.get("D").isMissing());
  }

  @Test
  void defaultsUntypedFieldsToLabels() throws Exception {
    Map<String, RawResult> results =
        GrafanaQueryResponse.fromJson(
                "{\"results\":{\"A\":{\"frames\":[{\"schema\":{\"fields\":[{\"name\":\"pod\"}]},"
                    + "\"data\":{\"values\":[[\"api-0\",\"api-1\"]]}}]}}}")
            .toRawResults();

    Frame frame = results.get("A").getFrames().get(0);
    assertEquals(FieldType.LABEL, frame.getFields().get(0).getType());
    assertEquals("string", frame.getFields().get(0).getTypeName());
    assertEquals(List.of("api-0", "api-1"), frame.getColumns().get(0));
  }

  @Test
  void answersNothingWithoutResults() throws Exception {
    assertTrue(GrafanaQueryResponse.fromJson("{}").toRawResults().isEmpty());
  }
}

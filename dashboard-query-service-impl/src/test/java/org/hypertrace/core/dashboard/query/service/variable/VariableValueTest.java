package org.hypertrace.core.dashboard.query.service.variable;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class VariableValueTest {

  private final VariableValue services =
      VariableValue.of("service", List.of("api.v1", "worker"), true);

  @Test
  void singleValueIsSubstitutedVerbatim() {
    VariableValue region = VariableValue.single("region", "us-east.1");
    assertEquals("us-east.1", region.format(null));
    assertFalse(region.hasMultipleValues());
  }

  @Test
  void multipleValuesDefaultToAnEscapedAlternation() {
    assertEquals("api\\\\.v1|worker", services.format(null));
    assertTrue(services.hasMultipleValues());
  }

  @Test
  void supportsNamedFormats() {
    assertEquals("api.v1,worker", services.format("csv"));
    assertEquals("api.v1,worker", services.format("raw"));
    assertEquals("api.v1|worker", services.format("pipe"));
    assertEquals("(api\\.v1|worker)", services.format("regex"));
    assertEquals("[\"api.v1\",\"worker\"]", services.format("json"));
    assertEquals("'api.v1','worker'", services.format("singlequote"));
    assertEquals("\"api.v1\",\"worker\"", services.format("doublequote"));
    assertEquals("api.v1,service=worker", services.format("distributed"));
  }

  @Test
  void formatNamesAreCaseInsensitiveAndUnknownOnesFallBack() {
    assertEquals("api.v1|worker", services.format("PIPE"));
    assertEquals("api\\\\.v1|worker", services.format("percentencode"));
  }

  @Test
  void emptyValueFormatsToEmptyText() {
    assertEquals("", VariableValue.empty("service").format("csv"));
    assertEquals("", VariableValue.empty("service").format(null));
  }

  @Test
  void singleValueJsonIsAString() {
    assertEquals("\"eu\"", VariableValue.single("region", "eu").format("json"));
    assertEquals("[\"eu\"]", VariableValue.of("region", List.of("eu"), true).format("json"));
  }
}

package org.hypertrace.core.dashboard.query.service.formula;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import java.util.OptionalDouble;
import org.hypertrace.core.dashboard.query.service.InvalidFormulaException;
import org.junit.jupiter.api.Test;

class FormulaParserTest {

  private static final Map<String, Double> VALUES = Map.of("A", 4.0, "B", 2.0, "C", 0.0);

  @Test
  void honorsOperatorPrecedence() {
    assertEquals(8.0, evaluate("A + B * 2"));
    assertEquals(12.0, evaluate("(A + B) * 2"));
    assertEquals(1.0, evaluate("A - B - 1"));
    assertEquals(1.0, evaluate("A / B / 2"));
    assertEquals(-2.0, evaluate("-B"));
    assertEquals(6.0, evaluate("A - -B"));
  }

  @Test
  void acceptsAllReferenceForms() {
    assertEquals(200.0, evaluate("$A * 100 / ${B} / 1"));
    assertEquals(0.5, evaluate("B/A"));
    assertEquals(2.5, evaluate("2.5"));
  }

  @Test
  void divisionByZeroHasNoValue() {
    assertTrue(FormulaParser.parse("A / C").evaluate(VALUES).isEmpty());
    assertTrue(FormulaParser.parse("(A / C) + 1").evaluate(VALUES).isEmpty());
  }

  @Test
  void missingReferenceHasNoValue() {
    assertTrue(FormulaParser.parse("A + Z").evaluate(VALUES).isEmpty());
  }

  @Test
  void rejectsMalformedFormulas() {
    assertThrows(InvalidFormulaException.class, () -> FormulaParser.parse(""));
    assertThrows(InvalidFormulaException.class, () -> FormulaParser.parse("A +"));
    assertThrows(InvalidFormulaException.class, () -> FormulaParser.parse("(A + B"));
    assertThrows(InvalidFormulaException.class, () -> FormulaParser.parse("A B"));
    assertThrows(InvalidFormulaException.class, () -> FormulaParser.parse("${A + 1"));
    assertThrows(InvalidFormulaException.class, () -> FormulaParser.parse("A % B"));
    assertThrows(InvalidFormulaException.class, () -> FormulaParser.parse("1.2.3"));
  }

  @Test
  void rejectsFunctions() {
    InvalidFormulaException exception =
        assertThrows(InvalidFormulaException.class, () -> FormulaParser.parse("abs(A)"));
    assertTrue(exception.getMessage().contains("abs"));
  }

  private static double evaluate(String expression) {
    OptionalDouble value = FormulaParser.parse(expression).evaluate(VALUES);
    assertTrue(value.isPresent(), expression);
    return value.getAsDouble();
  }
}

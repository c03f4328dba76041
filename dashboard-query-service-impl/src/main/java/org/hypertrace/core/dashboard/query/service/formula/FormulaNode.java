package org.hypertrace.core.dashboard.query.service.formula;

import java.util.Map;
import java.util.OptionalDouble;
import lombok.Value;

/** Parsed arithmetic formula over query references. */
interface FormulaNode {

  /**
   * @return the value at one timestamp, empty when an operand is missing or the result is not a
   *     finite number
   */
  OptionalDouble evaluate(Map<String, Double> referenceValues);

  @Value
  class Constant implements FormulaNode {
    double value;

    @Override
    public OptionalDouble evaluate(Map<String, Double> referenceValues) {
      return OptionalDouble.of(value);
    }
  }

  @Value
  class Reference implements FormulaNode {
    String refId;

    @Override
    public OptionalDouble evaluate(Map<String, Double> referenceValues) {
      Double value = referenceValues.get(refId);
      return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }
  }

  @Value
  class Negation implements FormulaNode {
    FormulaNode operand;

    @Override
    public OptionalDouble evaluate(Map<String, Double> referenceValues) {
      OptionalDouble value = operand.evaluate(referenceValues);
      return value.isPresent() ? OptionalDouble.of(-value.getAsDouble()) : value;
    }
  }

  @Value
  class BinaryOperation implements FormulaNode {
    char operator;
    FormulaNode left;
    FormulaNode right;

    @Override
    public OptionalDouble evaluate(Map<String, Double> referenceValues) {
      OptionalDouble leftValue = left.evaluate(referenceValues);
      OptionalDouble rightValue = right.evaluate(referenceValues);
      if (leftValue.isEmpty() || rightValue.isEmpty()) {
        return OptionalDouble.empty();
      }
      double l = leftValue.getAsDouble();
      double r = rightValue.getAsDouble();
      switch (operator) {
        case '+':
          return finite(l + r);
        case '-':
          return finite(l - r);
        case '*':
          return finite(l * r);
        case '/':
          return r == 0 ? OptionalDouble.empty() : finite(l / r);
        default:
          throw new IllegalStateException("Unsupported operator " + operator);
      }
    }

    private static OptionalDouble finite(double value) {
      return Double.isFinite(value) ? OptionalDouble.of(value) : OptionalDouble.empty();
    }
  }
}

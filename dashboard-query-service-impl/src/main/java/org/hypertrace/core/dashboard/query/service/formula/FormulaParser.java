package org.hypertrace.core.dashboard.query.service.formula;

import org.hypertrace.core.dashboard.query.service.InvalidFormulaException;

/**
 * Recursive descent parser for the arithmetic accepted by client side formula evaluation:
 *
 * <pre>
 * expression := term (('+' | '-') term)*
 * term       := factor (('*' | '/') factor)*
 * factor     := '-' factor | number | reference | '(' expression ')'
 * reference  := name | '$' name | '${' name '}'
 * </pre>
 */
class FormulaParser {
  private final String text;
  private int position;

  private FormulaParser(String text) {
    this.text = text;
  }

  static FormulaNode parse(String expression) {
    FormulaParser parser = new FormulaParser(expression);
    FormulaNode node = parser.parseExpression();
    parser.skipWhitespace();
    if (parser.position < expression.length()) {
      throw parser.error("Unexpected character '" + expression.charAt(parser.position) + "'");
    }
    return node;
  }

  private FormulaNode parseExpression() {
    FormulaNode node = parseTerm();
    while (true) {
      char operator = peek();
      if (operator != '+' && operator != '-') {
        return node;
      }
      position++;
      node = new FormulaNode.BinaryOperation(operator, node, parseTerm());
    }
  }

  private FormulaNode parseTerm() {
    FormulaNode node = parseFactor();
    while (true) {
      char operator = peek();
      if (operator != '*' && operator != '/') {
        return node;
      }
      position++;
      node = new FormulaNode.BinaryOperation(operator, node, parseFactor());
    }
  }

  private FormulaNode parseFactor() {
    char next = peek();
    if (next == '-') {
      position++;
      return new FormulaNode.Negation(parseFactor());
    }
    if (next == '(') {
      position++;
      FormulaNode node = parseExpression();
      if (peek() != ')') {
        throw error("Missing closing parenthesis");
      }
      position++;
      return node;
    }
    if (Character.isDigit(next) || next == '.') {
      return parseNumber();
    }
    if (next == '$' || Character.isLetter(next) || next == '_') {
      return parseReference();
    }
    throw error(next == 0 ? "Unexpected end of formula" : "Unexpected character '" + next + "'");
  }

  private FormulaNode parseNumber() {
    int start = position;
    while (position < text.length()
        && (Character.isDigit(text.charAt(position)) || text.charAt(position) == '.')) {
      position++;
    }
    try {
      return new FormulaNode.Constant(Double.parseDouble(text.substring(start, position)));
    } catch (NumberFormatException e) {
      throw error("Invalid number " + text.substring(start, position));
    }
  }

  private FormulaNode parseReference() {
    boolean braced = false;
    if (text.charAt(position) == '$') {
      position++;
      if (position < text.length() && text.charAt(position) == '{') {
        braced = true;
        position++;
      }
    }
    int start = position;
    while (position < text.length()
        && (Character.isLetterOrDigit(text.charAt(position)) || text.charAt(position) == '_')) {
      position++;
    }
    if (start == position) {
      throw error("Missing reference name");
    }
    String name = text.substring(start, position);
    if (braced) {
      if (position >= text.length() || text.charAt(position) != '}') {
        throw error("Unterminated reference ${" + name);
      }
      position++;
    }
    if (peek() == '(') {
      throw error("Function " + name + " cannot be evaluated client side");
    }
    return new FormulaNode.Reference(name);
  }

  private char peek() {
    skipWhitespace();
    return position < text.length() ? text.charAt(position) : 0;
  }

  private void skipWhitespace() {
    while (position < text.length() && Character.isWhitespace(text.charAt(position))) {
      position++;
    }
  }

  private InvalidFormulaException error(String message) {
    return new InvalidFormulaException(
        message + " at position " + position + " of formula '" + text + "'");
  }
}

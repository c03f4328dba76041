package org.hypertrace.core.dashboard.query.service.formula;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Locates query references inside a formula expression. A reference is written {@code A}, {@code
 * $A} or {@code ${A}}; an identifier directly followed by an opening parenthesis is a function name
 * and not a reference.
 */
public final class FormulaReferences {

  private static final Pattern REFERENCE =
      Pattern.compile("\\$\\{(\\w+)}|\\$?(?<![\\w.])([A-Za-z_]\\w*+)(?!\\s*\\()");

  private FormulaReferences() {}

  public static Set<String> referencedNames(String expression) {
    Set<String> names = new LinkedHashSet<>();
    Matcher matcher = REFERENCE.matcher(expression);
    while (matcher.find()) {
      names.add(name(matcher));
    }
    return names;
  }

  /** Replaces every reference, including its {@code $} or {@code ${}} decoration. */
  public static String rewrite(String expression, Function<String, String> replacement) {
    StringBuilder result = new StringBuilder(expression.length());
    Matcher matcher = REFERENCE.matcher(expression);
    int position = 0;
    while (matcher.find()) {
      result.append(expression, position, matcher.start());
      result.append(replacement.apply(name(matcher)));
      position = matcher.end();
    }
    result.append(expression, position, expression.length());
    return result.toString();
  }

  private static String name(Matcher matcher) {
    return matcher.group(1) != null ? matcher.group(1) : matcher.group(2);
  }
}

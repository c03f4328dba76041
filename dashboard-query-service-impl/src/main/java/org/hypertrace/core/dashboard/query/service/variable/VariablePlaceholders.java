package org.hypertrace.core.dashboard.query.service.variable;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.Value;

/**
 * Finds and substitutes variable placeholders in query text. Recognized forms are {@code $name},
 * {@code ${name}}, {@code ${name:format}} and {@code [[name]]}, where a name starts with a letter
 * or an underscore. Capture group references such as {@code $1} are never placeholders.
 */
public final class VariablePlaceholders {

  private static final Pattern PLACEHOLDER =
      Pattern.compile(
          "\\$\\{([A-Za-z_]\\w*)(?::([^}]+))?}"
              + "|\\[\\[([A-Za-z_]\\w*)(?::(\\w+))?]]"
              + "|\\$([A-Za-z_]\\w*)");

  private VariablePlaceholders() {}

  public static boolean containsPlaceholder(String text) {
    return PLACEHOLDER.matcher(text).find();
  }

  /** Variable names referenced by the text, in order of first appearance. */
  public static Set<String> referencedNames(String text) {
    Set<String> names = new LinkedHashSet<>();
    Matcher matcher = PLACEHOLDER.matcher(text);
    while (matcher.find()) {
      names.add(placeholderName(matcher));
    }
    return names;
  }

  /** Substitutes the placeholders that have a value and leaves every other one untouched. */
  public static Substitution substitute(String text, Map<String, VariableValue> values) {
    return substitute(text, values, values.keySet());
  }

  /**
   * Replaces placeholders in a single pass, so substituted values are never scanned again. A
   * placeholder naming one of {@code knownNames} without a value is replaced by the empty string
   * and reported as unresolved; placeholders naming anything else are kept verbatim.
   */
  public static Substitution substitute(
      String text, Map<String, VariableValue> values, Set<String> knownNames) {
    StringBuilder result = new StringBuilder(text.length());
    List<Span> multiValueSpans = new ArrayList<>();
    Set<String> unresolved = new LinkedHashSet<>();
    Matcher matcher = PLACEHOLDER.matcher(text);
    int position = 0;
    while (matcher.find()) {
      result.append(text, position, matcher.start());
      String name = placeholderName(matcher);
      VariableValue value = values.get(name);
      if (value == null && !knownNames.contains(name)) {
        result.append(matcher.group());
      } else if (value == null) {
        unresolved.add(name);
      } else {
        int start = result.length();
        result.append(value.format(placeholderFormat(matcher)));
        if (value.hasMultipleValues()) {
          multiValueSpans.add(new Span(start, result.length()));
        }
      }
      position = matcher.end();
    }
    result.append(text, position, text.length());
    return new Substitution(result.toString(), multiValueSpans, unresolved);
  }

  private static String placeholderName(Matcher matcher) {
    if (matcher.group(1) != null) {
      return matcher.group(1);
    }
    return matcher.group(3) != null ? matcher.group(3) : matcher.group(5);
  }

  private static String placeholderFormat(Matcher matcher) {
    return matcher.group(2) != null ? matcher.group(2) : matcher.group(4);
  }

  @Value
  public static class Substitution {
    String text;

    /** Regions of {@link #getText()} holding a substituted value with several alternatives. */
    List<Span> multiValueSpans;

    Set<String> unresolvedNames;

    public boolean isComplete() {
      return unresolvedNames.isEmpty();
    }
  }

  /** Half-open character range {@code [start, end)}. */
  @Value
  public static class Span {
    int start;
    int end;

    public boolean overlaps(int otherStart, int otherEnd) {
      return start < otherEnd && otherStart < end;
    }
  }
}

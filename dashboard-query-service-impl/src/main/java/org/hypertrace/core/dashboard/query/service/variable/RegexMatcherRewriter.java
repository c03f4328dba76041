package org.hypertrace.core.dashboard.query.service.variable;

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.hypertrace.core.dashboard.query.service.variable.VariablePlaceholders.Substitution;

/**
 * Label selector rewrite for Prometheus style query languages: {@code label="a|b"} becomes {@code
 * label=~"a|b"} and {@code label!="a|b"} becomes {@code label!~"a|b"}, but only for matchers whose
 * quoted value received a multi-value substitution.
 */
public class RegexMatcherRewriter implements MultiValueMatcherRewriter {

  private static final Pattern LABEL_MATCHER =
      Pattern.compile("[a-zA-Z_][a-zA-Z0-9_]*\\s*(=~|!~|!=|=)\\s*\"((?:[^\"\\\\]|\\\\.)*)\"");

  @Override
  public String rewrite(Substitution substitution) {
    String text = substitution.getText();
    if (substitution.getMultiValueSpans().isEmpty()) {
      return text;
    }
    StringBuilder result = new StringBuilder(text.length() + 4);
    Matcher matcher = LABEL_MATCHER.matcher(text);
    int position = 0;
    while (matcher.find()) {
      String operator = matcher.group(1);
      if (!isEquality(operator) || !isMultiValued(substitution, matcher.start(2), matcher.end(2))) {
        continue;
      }
      result.append(text, position, matcher.start(1));
      result.append("=".equals(operator) ? "=~" : "!~");
      position = matcher.end(1);
    }
    result.append(text, position, text.length());
    return result.toString();
  }

  private static boolean isEquality(String operator) {
    return "=".equals(operator) || "!=".equals(operator);
  }

  private static boolean isMultiValued(Substitution substitution, int start, int end) {
    return substitution.getMultiValueSpans().stream().anyMatch(span -> span.overlaps(start, end));
  }
}

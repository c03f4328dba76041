package org.hypertrace.core.dashboard.query.service.variable;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import javax.annotation.Nullable;
import lombok.NonNull;
import lombok.Value;

/** A resolved template variable: zero, one or several concrete values. */
@Value
public class VariableValue {
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
  private static final Pattern REGEX_SPECIAL_CHARACTERS =
      Pattern.compile("[\\\\^$.|?*+(){}\\[\\]]");

  @NonNull String name;
  @NonNull List<String> values;
  boolean multiValue;

  public static VariableValue single(String name, String value) {
    return new VariableValue(name, List.of(value), false);
  }

  public static VariableValue of(String name, List<String> values, boolean multiValue) {
    return new VariableValue(name, List.copyOf(values), multiValue);
  }

  public static VariableValue empty(String name) {
    return new VariableValue(name, List.of(), false);
  }

  /** True when substituting this value produces a set of alternatives rather than one literal. */
  public boolean hasMultipleValues() {
    return values.size() > 1;
  }

  public String format(@Nullable String format) {
    if (values.isEmpty()) {
      return "";
    }
    if (format == null) {
      return formatDefault();
    }
    switch (format.toLowerCase(Locale.ROOT)) {
      case "csv":
      case "raw":
        return String.join(",", values);
      case "pipe":
        return String.join("|", values);
      case "regex":
        return values.size() == 1
            ? escapeRegex(values.get(0), "\\")
            : values.stream()
                .map(value -> escapeRegex(value, "\\"))
                .collect(Collectors.joining("|", "(", ")"));
      case "json":
        return toJson();
      case "singlequote":
        return values.stream().map(value -> "'" + value + "'").collect(Collectors.joining(","));
      case "doublequote":
        return values.stream()
            .map(value -> "\"" + value + "\"")
            .collect(Collectors.joining(","));
      case "distributed":
        return values.get(0)
            + values.stream()
                .skip(1)
                .map(value -> "," + name + "=" + value)
                .collect(Collectors.joining());
      default:
        return formatDefault();
    }
  }

  // Multiple values become an alternation, escaped to survive inside a quoted query string.
  private String formatDefault() {
    if (values.size() == 1) {
      return values.get(0);
    }
    return values.stream()
        .map(value -> escapeRegex(value, "\\\\"))
        .collect(Collectors.joining("|"));
  }

  private String toJson() {
    try {
      return values.size() == 1 && !multiValue
          ? OBJECT_MAPPER.writeValueAsString(values.get(0))
          : OBJECT_MAPPER.writeValueAsString(values);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Unable to serialize values of variable " + name, e);
    }
  }

  private static String escapeRegex(String value, String escape) {
    return REGEX_SPECIAL_CHARACTERS
        .matcher(value)
        .replaceAll(match -> Matcher.quoteReplacement(escape + match.group()));
  }
}

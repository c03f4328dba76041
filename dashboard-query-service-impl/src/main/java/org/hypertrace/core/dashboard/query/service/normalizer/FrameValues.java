package org.hypertrace.core.dashboard.query.service.normalizer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Collection;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import javax.annotation.Nullable;

/** Conversions of raw frame cells, which arrive as whatever the backend's JSON decoded to. */
final class FrameValues {
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  private FrameValues() {}

  static String stringify(@Nullable Object value) {
    if (value == null) {
      return "";
    }
    if (value instanceof Double || value instanceof Float) {
      double number = ((Number) value).doubleValue();
      return Double.isFinite(number)
          ? BigDecimal.valueOf(number).toPlainString()
          : String.valueOf(number);
    }
    if (value instanceof Map || value instanceof Collection) {
      try {
        return OBJECT_MAPPER.writeValueAsString(value);
      } catch (JsonProcessingException e) {
        return value.toString();
      }
    }
    return value.toString();
  }

  /** Two decimals at most, trailing zeros removed, e.g. {@code 12.5} or {@code 3}. */
  static String formatScalar(@Nullable Object value) {
    Optional<Double> number = value instanceof Number ? toDouble(value) : Optional.empty();
    if (number.isEmpty() || !Double.isFinite(number.get())) {
      return stringify(value);
    }
    String formatted = String.format(Locale.ROOT, "%.2f", number.get());
    formatted = formatted.replaceAll("0+$", "").replaceAll("\\.$", "");
    return "-0".equals(formatted) ? "0" : formatted;
  }

  static Optional<Double> toDouble(@Nullable Object value) {
    if (value instanceof Number) {
      return Optional.of(((Number) value).doubleValue());
    }
    if (value instanceof String) {
      try {
        return Optional.of(Double.parseDouble(((String) value).trim()));
      } catch (NumberFormatException e) {
        return Optional.empty();
      }
    }
    return Optional.empty();
  }

  static Optional<Long> toEpochMillis(@Nullable Object value) {
    if (value instanceof Number) {
      return Optional.of(((Number) value).longValue());
    }
    if (value instanceof String) {
      String text = ((String) value).trim();
      try {
        return Optional.of((long) Double.parseDouble(text));
      } catch (NumberFormatException e) {
        try {
          return Optional.of(Instant.parse(text).toEpochMilli());
        } catch (DateTimeParseException parseException) {
          return Optional.empty();
        }
      }
    }
    return Optional.empty();
  }
}

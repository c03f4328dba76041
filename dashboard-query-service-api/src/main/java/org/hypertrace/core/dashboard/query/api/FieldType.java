package org.hypertrace.core.dashboard.query.api;

import java.util.Locale;

public enum FieldType {
  TIME,
  NUMBER,
  LABEL;

  /** Maps a backend field type name; anything that is neither time nor number is a label. */
  public static FieldType fromTypeName(String typeName) {
    if (typeName == null) {
      return LABEL;
    }
    switch (typeName.toLowerCase(Locale.ROOT)) {
      case "time":
        return TIME;
      case "number":
        return NUMBER;
      default:
        return LABEL;
    }
  }
}

package org.hypertrace.core.dashboard.query.api;

public enum DiagnosticType {
  /** The backend response has no entry, or no frame collection, for a refId. */
  MISSING_DATA,
  /** The frame collection is present but holds no frames. */
  EMPTY_DATA,
  /** Raw data was present but produced no result. */
  NO_RESULTS,
  QUERY_ERROR,
  UNKNOWN_REF_ID,
  SHAPE_MISMATCH,
  DATASOURCE_UNRESOLVED,
  DEPENDENCY_UNRESOLVED,
  VARIABLE_QUERY_FAILED,
  UNRESOLVED_PLACEHOLDER,
  REF_ID_EXHAUSTED,
  FORMULA_DROPPED
}

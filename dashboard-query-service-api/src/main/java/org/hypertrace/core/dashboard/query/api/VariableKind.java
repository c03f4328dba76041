package org.hypertrace.core.dashboard.query.api;

public enum VariableKind {
  /** Derived from the time range or bucket size, never queried. */
  BUILTIN,
  /** Value comes from the current selection, a default or the declared options. */
  STATIC,
  /** Allowed values come from executing the definition query against the backend. */
  QUERY
}

package org.hypertrace.core.dashboard.query.api;

public enum ResultType {
  TIME_SERIES,
  TABLE,
  SCALAR,
  LOG_LIST
}

package org.hypertrace.core.dashboard.query.api;

/**
 * Canonical result for one refId, independent of the backend's native response shape. The concrete
 * variant is identified by {@link #getResultType()}.
 */
public interface NormalizedResult {

  String getRefId();

  PanelInfo getPanelInfo();

  ResultType getResultType();

  /** True when the refId had raw data but nothing in it could be turned into a result. */
  boolean isEmpty();
}

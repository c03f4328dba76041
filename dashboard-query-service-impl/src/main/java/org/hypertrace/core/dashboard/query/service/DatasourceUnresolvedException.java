package org.hypertrace.core.dashboard.query.service;

/** A sub-query has neither its own datasource nor a dashboard-level default. */
public class DatasourceUnresolvedException extends DashboardQueryException {

  public DatasourceUnresolvedException(String message) {
    super(message);
  }
}

package org.hypertrace.core.dashboard.query.service;

/** A query variable references a variable that could not be resolved. */
public class DependencyUnresolvedException extends DashboardQueryException {

  public DependencyUnresolvedException(String message) {
    super(message);
  }
}

package org.hypertrace.core.dashboard.query.service;

/** Root of every failure raised by the dashboard query pipeline. */
public class DashboardQueryException extends RuntimeException {

  public DashboardQueryException(String message) {
    super(message);
  }

  public DashboardQueryException(String message, Throwable cause) {
    super(message, cause);
  }
}

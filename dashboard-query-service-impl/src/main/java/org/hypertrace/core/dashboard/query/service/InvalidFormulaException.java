package org.hypertrace.core.dashboard.query.service;

public class InvalidFormulaException extends DashboardQueryException {

  public InvalidFormulaException(String message) {
    super(message);
  }
}

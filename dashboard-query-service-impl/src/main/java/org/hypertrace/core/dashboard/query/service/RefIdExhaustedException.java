package org.hypertrace.core.dashboard.query.service;

public class RefIdExhaustedException extends DashboardQueryException {

  public RefIdExhaustedException(int alphabetSize) {
    super("All " + alphabetSize + " reference identifiers are already assigned in this request");
  }
}

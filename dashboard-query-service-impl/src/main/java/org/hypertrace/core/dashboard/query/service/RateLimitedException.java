package org.hypertrace.core.dashboard.query.service;

import java.time.Duration;
import java.util.Optional;
import javax.annotation.Nullable;

/** The backend answered with a rate limit response, optionally advertising when to retry. */
public class RateLimitedException extends DashboardQueryException {

  @Nullable private final Duration retryAfter;

  public RateLimitedException(String message, @Nullable Duration retryAfter) {
    super(message);
    this.retryAfter = retryAfter;
  }

  public Optional<Duration> getRetryAfter() {
    return Optional.ofNullable(retryAfter);
  }
}

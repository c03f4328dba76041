package org.hypertrace.core.dashboard.query.service.grafana;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.reactivex.rxjava3.core.Single;
import io.reactivex.rxjava3.schedulers.Schedulers;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import javax.annotation.Nullable;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.commons.lang3.tuple.ImmutablePair;
import org.hypertrace.core.dashboard.query.api.TimeRange;
import org.hypertrace.core.dashboard.query.service.BackendBatchFailureException;
import org.hypertrace.core.dashboard.query.service.DashboardNotFoundException;
import org.hypertrace.core.dashboard.query.service.RateLimitedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thin HTTP client over the Grafana API. Every call runs on the io scheduler and is retried while
 * Grafana answers 429, waiting as long as the response asks for.
 */
class GrafanaRestClient {
  private static final Logger LOG = LoggerFactory.getLogger(GrafanaRestClient.class);

  private static final String DATASOURCE_QUERY = "api/ds/query";
  private static final String DASHBOARD_BY_UID = "api/dashboards/uid";
  private static final String DATASOURCES = "api/datasources";
  private static final String DATASOURCE_PROXY = "api/datasources/proxy/uid";
  private static final String PROMETHEUS_LABEL = "api/v1/label";
  private static final String PROMETHEUS_LABEL_VALUES = "values";
  private static final String PROMETHEUS_INSTANT_QUERY = "api/v1/query";

  private static final String RETRY_AFTER_HEADER = "Retry-After";
  private static final String RATE_LIMIT_RESET_HEADER = "X-RateLimit-Reset";
  private static final int TOO_MANY_REQUESTS = 429;
  private static final int NOT_FOUND = 404;
  private static final int MAX_ERROR_BODY_LENGTH = 512;
  private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

  private final GrafanaBackendConfig config;
  private final OkHttpClient okHttpClient;
  private final Retry retry;
  private final Clock clock;

  GrafanaRestClient(GrafanaBackendConfig config) {
    this(config, Clock.systemUTC());
  }

  GrafanaRestClient(GrafanaBackendConfig config, Clock clock) {
    this.config = config;
    this.clock = clock;
    this.okHttpClient = new OkHttpClient.Builder().callTimeout(config.getRequestTimeout()).build();
    this.retry = Retry.of("grafana-" + config.getBaseUrl(), buildRetryConfig(config));
  }

  /** Posts one batch of queries to the unified query endpoint. */
  Single<String> queryDatasources(String payload) {
    Request request =
        newRequest(url(DATASOURCE_QUERY).build())
            .post(RequestBody.create(payload, JSON))
            .build();
    return call(request).map(response -> requireSuccess(response, "Datasource query"));
  }

  Single<String> getDashboard(String uid) {
    Request request = newRequest(url(DASHBOARD_BY_UID).addPathSegment(uid).build()).build();
    return call(request)
        .map(
            response -> {
              if (response.getLeft() == NOT_FOUND) {
                throw new DashboardNotFoundException(uid);
              }
              return requireSuccess(response, "Dashboard lookup of " + uid);
            });
  }

  Single<String> getDatasources() {
    Request request = newRequest(url(DATASOURCES).build()).build();
    return call(request).map(response -> requireSuccess(response, "Datasource listing"));
  }

  /** Prometheus label values through the datasource proxy, optionally restricted by a selector. */
  Single<String> getLabelValues(
      String datasourceUid, String label, @Nullable String selector, TimeRange timeRange) {
    HttpUrl.Builder urlBuilder =
        proxyUrl(datasourceUid)
            .addPathSegments(PROMETHEUS_LABEL)
            .addPathSegment(label)
            .addPathSegment(PROMETHEUS_LABEL_VALUES)
            .addQueryParameter("start", String.valueOf(timeRange.getFrom().getEpochSecond()))
            .addQueryParameter("end", String.valueOf(timeRange.getTo().getEpochSecond()));
    if (selector != null && !selector.isBlank()) {
      urlBuilder.addQueryParameter("match[]", selector);
    }
    return call(newRequest(urlBuilder.build()).build())
        .map(response -> requireSuccess(response, "Label values of " + label));
  }

  /** Prometheus instant query through the datasource proxy. */
  Single<String> instantQuery(String datasourceUid, String query, Instant evalTime) {
    HttpUrl url =
        proxyUrl(datasourceUid)
            .addPathSegments(PROMETHEUS_INSTANT_QUERY)
            .addQueryParameter("query", query)
            .addQueryParameter("time", String.valueOf(evalTime.getEpochSecond()))
            .build();
    return call(newRequest(url).build())
        .map(response -> requireSuccess(response, "Instant query " + query));
  }

  private Single<ImmutablePair<Integer, String>> call(Request request) {
    return Single.fromCallable(() -> retry.executeCallable(() -> execute(request)))
        .subscribeOn(Schedulers.io());
  }

  private ImmutablePair<Integer, String> execute(Request request) throws IOException {
    try (Response response = okHttpClient.newCall(request).execute()) {
      if (response.code() == TOO_MANY_REQUESTS) {
        Duration retryAfter = parseRetryAfter(response).orElse(null);
        LOG.info(
            "Grafana rate limited {} {}, retry after {}",
            request.method(),
            request.url().encodedPath(),
            retryAfter);
        throw new RateLimitedException(
            "Grafana rate limited " + request.url().encodedPath(), retryAfter);
      }
      ResponseBody body = response.body();
      return ImmutablePair.of(response.code(), body == null ? "" : body.string());
    }
  }

  /** Reads the advertised reset, as delay seconds or as an epoch second timestamp. */
  Optional<Duration> parseRetryAfter(Response response) {
    Optional<Duration> retryAfter =
        parseLong(response.header(RETRY_AFTER_HEADER)).map(Duration::ofSeconds);
    if (retryAfter.isPresent()) {
      return retryAfter;
    }
    return parseLong(response.header(RATE_LIMIT_RESET_HEADER))
        .map(Instant::ofEpochSecond)
        .map(reset -> Duration.between(clock.instant(), reset))
        .map(delay -> delay.isNegative() ? Duration.ZERO : delay);
  }

  private static Optional<Long> parseLong(@Nullable String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.of(Long.parseLong(value.trim()));
    } catch (NumberFormatException e) {
      return Optional.empty();
    }
  }

  private static String requireSuccess(ImmutablePair<Integer, String> response, String what) {
    int status = response.getLeft();
    if (status < 200 || status >= 300) {
      String body = response.getRight();
      throw new BackendBatchFailureException(
          String.format(
              "%s failed with status %d: %s",
              what,
              status,
              body.length() > MAX_ERROR_BODY_LENGTH
                  ? body.substring(0, MAX_ERROR_BODY_LENGTH)
                  : body));
    }
    return response.getRight();
  }

  private Request.Builder newRequest(HttpUrl url) {
    Request.Builder builder = new Request.Builder().url(url).header("Accept", "application/json");
    config.getApiKeyOptional().ifPresent(key -> builder.header("Authorization", "Bearer " + key));
    return builder;
  }

  private HttpUrl.Builder url(String path) {
    return HttpUrl.get(config.getBaseUrl()).newBuilder().addPathSegments(path);
  }

  private HttpUrl.Builder proxyUrl(String datasourceUid) {
    return url(DATASOURCE_PROXY).addPathSegment(datasourceUid);
  }

  private static RetryConfig buildRetryConfig(GrafanaBackendConfig config) {
    long fallbackMillis = config.getRetryFallbackDelay().toMillis();
    return RetryConfig.<ImmutablePair<Integer, String>>custom()
        .maxAttempts(config.getRetryMaxAttempts())
        .retryExceptions(RateLimitedException.class)
        .intervalBiFunction(
            (attempt, outcome) ->
                outcome.isLeft() && outcome.getLeft() instanceof RateLimitedException
                    ? ((RateLimitedException) outcome.getLeft())
                        .getRetryAfter()
                        .map(Duration::toMillis)
                        .orElse(fallbackMillis)
                    : fallbackMillis)
        .build();
  }
}

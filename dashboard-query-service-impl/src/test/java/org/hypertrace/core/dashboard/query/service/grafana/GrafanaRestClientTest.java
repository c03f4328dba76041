package org.hypertrace.core.dashboard.query.service.grafana;

import static org.hypertrace.core.dashboard.query.service.grafana.GrafanaTestSupport.TIME_RANGE;
import static org.hypertrace.core.dashboard.query.service.grafana.GrafanaTestSupport.grafanaConfig;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import okhttp3.HttpUrl;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.hypertrace.core.dashboard.query.service.BackendBatchFailureException;
import org.hypertrace.core.dashboard.query.service.DashboardNotFoundException;
import org.hypertrace.core.dashboard.query.service.RateLimitedException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class GrafanaRestClientTest {

  private MockWebServer server;
  private GrafanaRestClient restClient;

  @BeforeEach
  void setUp() throws Exception {
    server = new MockWebServer();
    server.start();
    restClient = new GrafanaRestClient(grafanaConfig(server.url("/").toString()));
  }

  @AfterEach
  void tearDown() throws Exception {
    server.shutdown();
  }

  @Test
  void postsQueriesWithCredentials() throws Exception {
    server.enqueue(new MockResponse().setBody("{\"results\":{}}"));

    assertEquals("{\"results\":{}}", restClient.queryDatasources("{\"queries\":[]}").blockingGet());

    RecordedRequest request = server.takeRequest();
    assertEquals("POST", request.getMethod());
    assertEquals("/api/ds/query", request.getPath());
    assertEquals("Bearer secret", request.getHeader("Authorization"));
    assertEquals("application/json", request.getHeader("Accept"));
    assertEquals("{\"queries\":[]}", request.getBody().readUtf8());
  }

  @Test
  void retriesRateLimitedCalls() throws Exception {
    server.enqueue(new MockResponse().setResponseCode(429).setHeader("Retry-After", "0"));
    server.enqueue(new MockResponse().setBody("[]"));

    assertEquals("[]", restClient.getDatasources().blockingGet());
    assertEquals(2, server.getRequestCount());
  }

  @Test
  void givesUpAfterTheConfiguredAttempts() {
    server.enqueue(new MockResponse().setResponseCode(429));
    server.enqueue(new MockResponse().setResponseCode(429));
    server.enqueue(new MockResponse().setBody("[]"));

    assertThrows(RateLimitedException.class, () -> restClient.getDatasources().blockingGet());
    assertEquals(2, server.getRequestCount());
  }

  @Test
  void mapsMissingDashboards() {
    server.enqueue(new MockResponse().setResponseCode(404).setBody("{\"message\":\"not found\"}"));

    assertThrows(
        DashboardNotFoundException.class, () -> restClient.getDashboard("nope").blockingGet());
  }

  @Test
  void failsOnServerErrors() {
    server.enqueue(new MockResponse().setResponseCode(502).setBody("bad gateway"));

    BackendBatchFailureException exception =
        assertThrows(
            BackendBatchFailureException.class,
            () -> restClient.queryDatasources("{}").blockingGet());
    assertTrue(exception.getMessage().contains("502"), exception.getMessage());
    assertTrue(exception.getMessage().contains("bad gateway"), exception.getMessage());
  }

  @Test
  void queriesLabelValuesThroughTheDatasourceProxy() throws Exception {
    server.enqueue(new MockResponse().setBody("{\"status\":\"success\",\"data\":[]}"));

    restClient.getLabelValues("prom-main", "service", "up{job=\"api\"}", TIME_RANGE).blockingGet();

    HttpUrl url = server.takeRequest().getRequestUrl();
    assertEquals(
        "/api/datasources/proxy/uid/prom-main/api/v1/label/service/values", url.encodedPath());
    assertEquals("1700000000", url.queryParameter("start"));
    assertEquals("1700003600", url.queryParameter("end"));
    assertEquals("up{job=\"api\"}", url.queryParameter("match[]"));
  }

  @Test
  void runsInstantQueriesThroughTheDatasourceProxy() throws Exception {
    server.enqueue(new MockResponse().setBody("{\"status\":\"success\",\"data\":{}}"));

    restClient.instantQuery("prom-main", "up", TIME_RANGE.getTo()).blockingGet();

    HttpUrl url = server.takeRequest().getRequestUrl();
    assertEquals("/api/datasources/proxy/uid/prom-main/api/v1/query", url.encodedPath());
    assertEquals("up", url.queryParameter("query"));
    assertEquals("1700003600", url.queryParameter("time"));
  }

  @Test
  void readsTheAdvertisedRateLimitReset() {
    GrafanaRestClient clockedClient =
        new GrafanaRestClient(
            grafanaConfig("http://localhost:3000"),
            Clock.fixed(Instant.ofEpochSecond(1_700_000_000L), ZoneOffset.UTC));

    assertEquals(
        Optional.of(Duration.ofSeconds(7)),
        clockedClient.parseRetryAfter(rateLimited("Retry-After", "7")));
    assertEquals(
        Optional.of(Duration.ofSeconds(30)),
        clockedClient.parseRetryAfter(rateLimited("X-RateLimit-Reset", "1700000030")));
    assertEquals(
        Optional.of(Duration.ZERO),
        clockedClient.parseRetryAfter(rateLimited("X-RateLimit-Reset", "1600000000")));
    assertEquals(
        Optional.empty(), clockedClient.parseRetryAfter(rateLimited("Retry-After", "soon")));
  }

  private static Response rateLimited(String header, String value) {
    return new Response.Builder()
        .request(new Request.Builder().url("http://localhost:3000/api/ds/query").build())
        .protocol(Protocol.HTTP_1_1)
        .code(429)
        .message("Too Many Requests")
        .header(header, value)
        .build();
  }
}

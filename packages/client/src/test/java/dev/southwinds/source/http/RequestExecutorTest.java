package dev.southwinds.source.http;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.junit.jupiter.api.Assertions.*;

import com.github.tomakehurst.wiremock.client.WireMock;
import com.github.tomakehurst.wiremock.http.Fault;
import com.github.tomakehurst.wiremock.junit5.WireMockRuntimeInfo;
import com.github.tomakehurst.wiremock.junit5.WireMockTest;
import com.github.tomakehurst.wiremock.stubbing.Scenario;
import dev.southwinds.source.SourceClientOptions;
import dev.southwinds.source.exception.ConfigException;
import dev.southwinds.source.exception.RemoteException;
import dev.southwinds.source.exception.SourceErrorCode;
import dev.southwinds.source.exception.TransportException;
import java.io.InterruptedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okio.Buffer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

@WireMockTest
class RequestExecutorTest {
  private static final SourceClientOptions OPTIONS =
      new SourceClientOptions(false, Duration.ofSeconds(30));

  private WireMock wireMock;
  private String baseUrl;
  private RequestExecutor executor;

  @BeforeEach
  void setUp(WireMockRuntimeInfo info) {
    wireMock = info.getWireMock();
    baseUrl = info.getHttpBaseUrl();
    executor =
        new RequestExecutor(
            baseUrl, OkHttpFactory.create("admin", "adm1n", OPTIONS, new RetryPolicy(3, 1, 5, 0.1)));
  }

  @AfterEach
  void tearDown() {
    executor.close();
  }

  @Test
  void fetchReturnsBodyOfSuccessfulCall() {
    wireMock.register(get(urlPathEqualTo("/item/OPT_1")).willReturn(okJson("{\"key\":\"OPT_1\"}")));

    byte[] body = executor.fetch(Route.LOAD_ITEM, "OPT_1");

    assertEquals("{\"key\":\"OPT_1\"}", new String(body, StandardCharsets.UTF_8));
    wireMock.verifyThat(
        getRequestedFor(urlPathEqualTo("/item/OPT_1"))
            .withHeader("Authorization", equalTo("Basic YWRtaW46YWRtMW4="))
            .withHeader("User-Agent", matching("SW-SOURCE-CLIENT-.+")));
  }

  @Test
  void sendPutsJsonBodyAndSourceType() {
    wireMock.register(put(urlPathEqualTo("/item/OPT_1")).willReturn(ok()));

    executor.send(
        Route.SAVE_ITEM, "{\"a\":1}".getBytes(StandardCharsets.UTF_8), "AAA", "OPT_1");

    wireMock.verifyThat(
        putRequestedFor(urlPathEqualTo("/item/OPT_1"))
            .withHeader(RequestExecutor.SOURCE_TYPE_HEADER, equalTo("AAA"))
            .withHeader("Content-Type", containing("application/json"))
            .withRequestBody(equalToJson("{\"a\":1}")));
  }

  @Test
  void recoversFromTransientFailures() {
    wireMock.register(
        delete(urlPathEqualTo("/item/OPT_1"))
            .inScenario("flaky")
            .whenScenarioStateIs(Scenario.STARTED)
            .willReturn(aResponse().withStatus(503))
            .willSetStateTo("recovered"));
    wireMock.register(
        delete(urlPathEqualTo("/item/OPT_1"))
            .inScenario("flaky")
            .whenScenarioStateIs("recovered")
            .willReturn(ok()));

    executor.send(Route.DELETE_ITEM, "OPT_1");

    wireMock.verifyThat(2, deleteRequestedFor(urlPathEqualTo("/item/OPT_1")));
  }

  @Test
  void exhaustedRetriesSurfaceLastStatus() {
    wireMock.register(
        get(urlPathEqualTo("/item/OPT_1"))
            .willReturn(aResponse().withStatus(503).withBody("database unavailable")));

    RemoteException ex =
        assertThrows(RemoteException.class, () -> executor.fetch(Route.LOAD_ITEM, "OPT_1"));

    assertEquals(503, ex.getStatus());
    assertEquals("database unavailable", ex.getBody());
    assertTrue(ex.getMessage().startsWith("cannot get item, source server responded with: 503"));
    assertTrue(ex.getMessage().endsWith(", database unavailable"));
    assertEquals(SourceErrorCode.REMOTE_ERROR, ex.getCode());
    wireMock.verifyThat(3, getRequestedFor(urlPathEqualTo("/item/OPT_1")));
  }

  @Test
  void permanentErrorsAreNotRetried() {
    wireMock.register(
        put(urlPathEqualTo("/item/OPT_1"))
            .willReturn(aResponse().withStatus(400).withBody("item does not match schema")));

    RemoteException ex =
        assertThrows(
            RemoteException.class,
            () ->
                executor.send(
                    Route.SAVE_ITEM, "{}".getBytes(StandardCharsets.UTF_8), "AAA", "OPT_1"));

    assertEquals(400, ex.getStatus());
    assertTrue(ex.getMessage().contains("item does not match schema"));
    wireMock.verifyThat(1, putRequestedFor(urlPathEqualTo("/item/OPT_1")));
  }

  @Test
  void notFoundIsEmptyOnlyWhenAsked() {
    wireMock.register(delete(urlPathEqualTo("/item/pop/oldest/AAA")).willReturn(notFound()));
    wireMock.register(get(urlPathEqualTo("/item/MISSING")).willReturn(notFound()));

    assertTrue(executor.fetchIfPresent(Route.POP_OLDEST, "AAA").isEmpty());
    RemoteException ex =
        assertThrows(RemoteException.class, () -> executor.fetch(Route.LOAD_ITEM, "MISSING"));
    assertEquals(404, ex.getStatus());
  }

  @Test
  void connectionFailuresBecomeTransportErrors() {
    wireMock.register(
        get(urlPathEqualTo("/item/OPT_1"))
            .willReturn(aResponse().withFault(Fault.CONNECTION_RESET_BY_PEER)));

    TransportException ex =
        assertThrows(TransportException.class, () -> executor.fetch(Route.LOAD_ITEM, "OPT_1"));

    assertEquals(SourceErrorCode.NETWORK_ERROR, ex.getCode());
    assertEquals("GET", ex.getContext().get("method"));
    assertTrue(ex.getMessage().startsWith("cannot get item"));
  }

  @Test
  void callTimeoutBoundsTheWholeCall() {
    wireMock.register(
        get(urlPathEqualTo("/item/SLOW")).willReturn(ok().withFixedDelay(2000)));
    OkHttpClient http =
        OkHttpFactory.create("admin", "adm1n", OPTIONS, RetryPolicy.defaults())
            .newBuilder()
            .callTimeout(300, TimeUnit.MILLISECONDS)
            .build();

    try (RequestExecutor fast = new RequestExecutor(baseUrl, http)) {
      assertThrows(TransportException.class, () -> fast.fetch(Route.LOAD_ITEM, "SLOW"));
    }
  }

  @Test
  void callTimeoutCutsRetryBackoffShort() {
    wireMock.register(
        get(urlPathEqualTo("/item/BUSY")).willReturn(aResponse().withStatus(503)));
    OkHttpClient http =
        OkHttpFactory.create("admin", "adm1n", OPTIONS, new RetryPolicy(20, 4000, 4000, 0.0))
            .newBuilder()
            .callTimeout(500, TimeUnit.MILLISECONDS)
            .build();

    try (RequestExecutor bounded = new RequestExecutor(baseUrl, http)) {
      long start = System.nanoTime();
      TransportException ex =
          assertThrows(TransportException.class, () -> bounded.fetch(Route.LOAD_ITEM, "BUSY"));
      long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

      assertTrue(elapsedMs < 1500, "call took " + elapsedMs + " ms");
      assertInstanceOf(InterruptedIOException.class, ex.getCause());
    }
    wireMock.verifyThat(1, getRequestedFor(urlPathEqualTo("/item/BUSY")));
  }

  @Test
  void putWithoutPayloadSendsEmptyBody() throws Exception {
    Request request = executor.buildRequest(Route.TAG_ITEM, null, null, "OPT_1", "status");

    assertEquals("PUT", request.method());
    assertNotNull(request.body());
    Buffer buffer = new Buffer();
    request.body().writeTo(buffer);
    assertEquals(0, buffer.size());
    assertNull(request.header(RequestExecutor.SOURCE_TYPE_HEADER));
  }

  @Test
  void getHasNoBody() {
    Request request = executor.buildRequest(Route.LOAD_ITEM, null, null, "OPT_1");

    assertEquals("GET", request.method());
    assertNull(request.body());
  }

  @Test
  void invalidHostIsAConfigurationError() {
    OkHttpClient http = new OkHttpClient();

    assertThrows(ConfigException.class, () -> new RequestExecutor("not a url", http));
    assertThrows(ConfigException.class, () -> new RequestExecutor(null, http));
  }
}

package dev.southwinds.source.http;

import dev.southwinds.source.exception.ConfigException;
import dev.southwinds.source.exception.RemoteException;
import dev.southwinds.source.exception.TransportException;
import java.io.Closeable;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Executes one request per call against the source service and classifies the outcome.
 *
 * <ul>
 *   <li>status {@code <= 299}: success, the body is handed back as bytes
 *   <li>status 404 on calls made with {@link #fetchIfPresent}: empty result
 *   <li>any other status {@code > 299}: {@link RemoteException} with status line and body
 *   <li>I/O failure once the retry budget is spent, or timeout: {@link TransportException}
 * </ul>
 *
 * <p>Authentication, retries and logging are applied by the interceptors of the {@link
 * OkHttpClient} passed in (see {@link OkHttpFactory}). The executor holds no per-call state and is
 * safe for concurrent use.
 */
public final class RequestExecutor implements Closeable {
  private static final org.slf4j.Logger log =
      dev.southwinds.source.logging.LoggingService.getLogger(RequestExecutor.class);

  public static final String SOURCE_TYPE_HEADER = "Source-Type";

  private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
  private static final byte[] NO_CONTENT = new byte[0];

  private final HttpUrl host;
  private final OkHttpClient http;

  public RequestExecutor(String host, OkHttpClient http) {
    this.host = parseHost(host);
    this.http = Objects.requireNonNull(http, "http");
  }

  /** Sends a request without body and discards the response body. */
  public void send(Route route, String... args) {
    call(route, null, null, false, args);
  }

  /**
   * Sends {@code body} as JSON, with a {@code Source-Type} header when {@code sourceType} is not
   * null.
   */
  public void send(Route route, byte[] body, String sourceType, String... args) {
    call(route, body, sourceType, false, args);
  }

  /** Returns the response body of a successful call. */
  public byte[] fetch(Route route, String... args) {
    return call(route, null, null, false, args).orElse(NO_CONTENT);
  }

  /** Like {@link #fetch} but maps a 404 answer to an empty result. */
  public Optional<byte[]> fetchIfPresent(Route route, String... args) {
    return call(route, null, null, true, args);
  }

  private Optional<byte[]> call(
      Route route, byte[] body, String sourceType, boolean notFoundIsEmpty, String... args) {
    Request request = buildRequest(route, body, sourceType, args);
    try (Response response = http.newCall(request).execute()) {
      if (notFoundIsEmpty && response.code() == 404) {
        log.debug("{} {} found nothing", request.method(), request.url());
        return Optional.empty();
      }
      if (response.code() > 299) {
        throw new RemoteException(
            route.action(), response.code(), statusLine(response), bodyText(response));
      }
      ResponseBody responseBody = response.body();
      return Optional.of(responseBody == null ? NO_CONTENT : responseBody.bytes());
    } catch (IOException e) {
      Map<String, Object> ctx = new LinkedHashMap<>();
      ctx.put("method", request.method());
      ctx.put("url", request.url().toString());
      throw new TransportException(
          "cannot %s, request to the source server failed: %s".formatted(route.action(), e),
          ctx,
          e);
    }
  }

  Request buildRequest(Route route, byte[] body, String sourceType, String... args) {
    RequestBody requestBody = null;
    if (body != null) {
      requestBody = RequestBody.create(body, JSON);
    } else if ("PUT".equals(route.method()) || "POST".equals(route.method())) {
      // OkHttp requires a body for PUT/POST
      requestBody = RequestBody.create(NO_CONTENT, (MediaType) null);
    }
    Request.Builder builder =
        new Request.Builder().url(route.url(host, args)).method(route.method(), requestBody);
    if (sourceType != null) {
      builder.header(SOURCE_TYPE_HEADER, sourceType);
    }
    return builder.build();
  }

  private static String statusLine(Response response) {
    String message = response.message();
    return message.isEmpty() ? String.valueOf(response.code()) : response.code() + " " + message;
  }

  private static String bodyText(Response response) {
    ResponseBody body = response.body();
    if (body == null) return null;
    try {
      String text = body.string();
      return text.isEmpty() ? null : text;
    } catch (IOException e) {
      log.debug("Cannot read error body of {}", response.request().url(), e);
      return null;
    }
  }

  private static HttpUrl parseHost(String host) {
    HttpUrl url = host == null ? null : HttpUrl.parse(host);
    if (url == null) {
      throw new ConfigException("invalid source host URL: '%s'".formatted(host));
    }
    return url;
  }

  /** Releases the connection pool and dispatcher threads of the underlying client. */
  @Override
  public void close() {
    http.dispatcher().executorService().shutdown();
    http.connectionPool().evictAll();
  }
}

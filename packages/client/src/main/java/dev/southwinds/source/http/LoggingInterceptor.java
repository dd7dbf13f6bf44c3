package dev.southwinds.source.http;

import java.io.IOException;
import okhttp3.Headers;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.Buffer;
import org.jetbrains.annotations.NotNull;

public class LoggingInterceptor implements Interceptor {
  private static final org.slf4j.Logger log =
      dev.southwinds.source.logging.LoggingService.getLogger(LoggingInterceptor.class);

  @NotNull
  @Override
  public Response intercept(Chain chain) throws IOException {
    Request request = chain.request();
    if (!log.isDebugEnabled()) {
      return chain.proceed(request);
    }

    long startTime = System.nanoTime();
    log.debug(
        "➡️ Sending {} {}\nHeaders:\n{}\nBody:\n{}\n",
        request.method(),
        request.url(),
        masked(request.headers()),
        bodyToString(request));

    Response response = chain.proceed(request);

    long endTime = System.nanoTime();
    log.debug(
        "⬅️ Received response for {} in {} ms\nStatus: {}\nHeaders:\n{}\n",
        response.request().url(),
        String.format("%.1f", (endTime - startTime) / 1e6d),
        response.code(),
        response.headers());

    if (log.isTraceEnabled()) {
      // peek so the caller can still consume the body
      ResponseBody responseBody = response.peekBody(Long.MAX_VALUE);
      log.trace("Response body:\n{}\n", responseBody.string());
    }
    return response;
  }

  static Headers masked(Headers headers) {
    if (headers.get("Authorization") == null) return headers;
    return headers.newBuilder().set("Authorization", "Basic ****").build();
  }

  private static String bodyToString(Request request) {
    try {
      Buffer buffer = new Buffer();
      if (request.body() != null) request.body().writeTo(buffer);
      return buffer.readUtf8();
    } catch (IOException e) {
      return "(error reading body)";
    }
  }
}

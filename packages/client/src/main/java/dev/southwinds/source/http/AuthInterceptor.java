package dev.southwinds.source.http;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import okhttp3.Credentials;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;
import org.jetbrains.annotations.NotNull;

/** Stamps every request with the basic-auth token and the client's user agent. */
public class AuthInterceptor implements Interceptor {
  private final String token;
  private final String userAgent;

  public AuthInterceptor(String user, String password, String userAgent) {
    this.token = Credentials.basic(user, password, StandardCharsets.UTF_8);
    this.userAgent = userAgent;
  }

  @NotNull
  @Override
  public Response intercept(Chain chain) throws IOException {
    Request original = chain.request();
    Request request =
        original
            .newBuilder()
            .header("Authorization", token)
            .header("User-Agent", userAgent)
            .build();
    return chain.proceed(request);
  }
}

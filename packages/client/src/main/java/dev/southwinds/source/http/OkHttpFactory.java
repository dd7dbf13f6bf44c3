package dev.southwinds.source.http;

import dev.southwinds.source.SourceClientOptions;
import dev.southwinds.source.Version;
import dev.southwinds.source.exception.ConfigException;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.util.concurrent.TimeUnit;
import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;
import okhttp3.OkHttpClient;

public class OkHttpFactory {

  /**
   * Builds the HTTP client shared by every call of one source client: authentication, retry and
   * logging interceptors, plus a call timeout equal to {@code requestTimeout} that bounds the whole
   * retry sequence.
   */
  public static OkHttpClient create(
      String user, String password, SourceClientOptions options, RetryPolicy retryPolicy) {
    long timeoutMs = options.getRequestTimeout().toMillis();
    OkHttpClient.Builder builder =
        new OkHttpClient.Builder()
            .connectTimeout(10, TimeUnit.SECONDS)
            .readTimeout(timeoutMs, TimeUnit.MILLISECONDS)
            .writeTimeout(timeoutMs, TimeUnit.MILLISECONDS)
            .callTimeout(timeoutMs, TimeUnit.MILLISECONDS)
            // retries are owned by RetryInterceptor
            .retryOnConnectionFailure(false)
            .addInterceptor(new AuthInterceptor(user, password, Version.USER_AGENT))
            .addInterceptor(new RetryInterceptor(retryPolicy))
            .addInterceptor(new LoggingInterceptor());
    if (options.isInsecureTransport()) {
      trustAllCertificates(builder);
    }
    return builder.build();
  }

  private static void trustAllCertificates(OkHttpClient.Builder builder) {
    X509TrustManager trustAll =
        new X509TrustManager() {
          @Override
          public void checkClientTrusted(X509Certificate[] chain, String authType) {}

          @Override
          public void checkServerTrusted(X509Certificate[] chain, String authType) {}

          @Override
          public X509Certificate[] getAcceptedIssuers() {
            return new X509Certificate[0];
          }
        };
    try {
      SSLContext ssl = SSLContext.getInstance("TLS");
      ssl.init(null, new TrustManager[] {trustAll}, new SecureRandom());
      builder.sslSocketFactory(ssl.getSocketFactory(), trustAll).hostnameVerifier((h, s) -> true);
    } catch (GeneralSecurityException e) {
      throw new ConfigException("cannot set up insecure TLS transport", e);
    }
  }
}

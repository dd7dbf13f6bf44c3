package dev.southwinds.source.http;

import java.io.IOException;
import java.net.UnknownServiceException;
import java.security.cert.CertificateException;
import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.regex.Pattern;
import javax.net.ssl.SSLHandshakeException;
import javax.net.ssl.SSLPeerUnverifiedException;

/**
 * Bounded exponential backoff with jitter.
 *
 * <p>Delay before retry {@code n} (1-based):
 *
 * <pre>
 * exponential = min(baseDelay * 2^(n-1), maxDelay)
 * delay       = min(exponential + random(0, exponential * jitterFactor), maxDelay)
 * </pre>
 *
 * <p>{@link #maxAttempts()} counts every attempt, the first one included.
 */
public final class RetryPolicy {
  public static final int DEFAULT_MAX_ATTEMPTS = 20;
  public static final long DEFAULT_BASE_DELAY_MS = 1000;
  public static final long DEFAULT_MAX_DELAY_MS = 30000;
  public static final double DEFAULT_JITTER_FACTOR = 0.1;

  private static final Pattern RETRY_AFTER_SECONDS = Pattern.compile("\\d{1,9}");

  private final int maxAttempts;
  private final long baseDelayMs;
  private final long maxDelayMs;
  private final double jitterFactor;

  public RetryPolicy(int maxAttempts, long baseDelayMs, long maxDelayMs, double jitterFactor) {
    if (maxAttempts <= 0) {
      throw new IllegalArgumentException(
          "maxAttempts must be positive (current: " + maxAttempts + ")");
    }
    if (baseDelayMs < 0) {
      throw new IllegalArgumentException(
          "baseDelayMs must not be negative (current: " + baseDelayMs + ")");
    }
    if (maxDelayMs < baseDelayMs) {
      throw new IllegalArgumentException(
          "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")");
    }
    if (jitterFactor < 0.0 || jitterFactor > 1.0) {
      throw new IllegalArgumentException(
          "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")");
    }
    this.maxAttempts = maxAttempts;
    this.baseDelayMs = baseDelayMs;
    this.maxDelayMs = maxDelayMs;
    this.jitterFactor = jitterFactor;
  }

  public static RetryPolicy defaults() {
    return new RetryPolicy(
        DEFAULT_MAX_ATTEMPTS, DEFAULT_BASE_DELAY_MS, DEFAULT_MAX_DELAY_MS, DEFAULT_JITTER_FACTOR);
  }

  /** Single attempt, no retry. */
  public static RetryPolicy none() {
    return new RetryPolicy(1, 0, 0, 0.0);
  }

  public int maxAttempts() {
    return maxAttempts;
  }

  public long baseDelayMs() {
    return baseDelayMs;
  }

  public long maxDelayMs() {
    return maxDelayMs;
  }

  public double jitterFactor() {
    return jitterFactor;
  }

  /** 429 and 5xx except 501 are worth another attempt. */
  public boolean isRetryable(int status) {
    return status == 429 || (status >= 500 && status != 501);
  }

  /** Transport failures are retried unless they come from certificate or protocol setup. */
  public boolean isRetryable(IOException failure) {
    if (failure instanceof SSLPeerUnverifiedException) return false;
    if (failure instanceof SSLHandshakeException
        && failure.getCause() instanceof CertificateException) return false;
    return !(failure instanceof UnknownServiceException);
  }

  /**
   * Delay before retry number {@code retry} (1-based).
   *
   * @throws IllegalArgumentException if {@code retry} is not positive
   */
  public long delayMs(int retry) {
    if (retry <= 0) {
      throw new IllegalArgumentException("retry must be positive (current: " + retry + ")");
    }
    // shift capped to avoid overflow on long retry chains
    long exponential = Math.min(baseDelayMs * (1L << Math.min(retry - 1, 30)), maxDelayMs);
    long jitter = (long) (exponential * jitterFactor * ThreadLocalRandom.current().nextDouble());
    return Math.min(exponential + jitter, maxDelayMs);
  }

  /**
   * Delay before retry {@code retry}, honouring a {@code Retry-After} value in seconds when the
   * service sent one.
   */
  public long delayMs(int retry, String retryAfter) {
    // HTTP-date form falls back to backoff
    if (retryAfter != null && RETRY_AFTER_SECONDS.matcher(retryAfter.trim()).matches()) {
      long seconds = Long.parseLong(retryAfter.trim());
      return Math.min(Duration.ofSeconds(seconds).toMillis(), maxDelayMs);
    }
    return delayMs(retry);
  }

  @Override
  public String toString() {
    return "RetryPolicy{maxAttempts=%d, baseDelayMs=%d, maxDelayMs=%d, jitterFactor=%s}"
        .formatted(maxAttempts, baseDelayMs, maxDelayMs, jitterFactor);
  }
}

package dev.southwinds.source.http;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;
import org.jetbrains.annotations.NotNull;

/**
 * Re-sends a request on transient failures following a {@link RetryPolicy}.
 *
 * <p>Registered as an application interceptor so that the whole retry sequence, sleeps included,
 * runs inside a single OkHttp call and is bounded by the client's call timeout. A backoff sleep is
 * cut short at the end of that timeout, and once the call is cancelled or timed out no further
 * attempt is made. When the attempts are exhausted on a retryable status, the last response is
 * returned to the caller for classification.
 */
public class RetryInterceptor implements Interceptor {
  private static final org.slf4j.Logger log =
      dev.southwinds.source.logging.LoggingService.getLogger(RetryInterceptor.class);

  private final RetryPolicy policy;

  public RetryInterceptor(RetryPolicy policy) {
    this.policy = Objects.requireNonNull(policy, "policy");
  }

  @NotNull
  @Override
  public Response intercept(Chain chain) throws IOException {
    Request request = chain.request();
    long startNanos = System.nanoTime();
    for (int attempt = 1; ; attempt++) {
      long delay;
      try {
        Response response = chain.proceed(request);
        if (attempt >= policy.maxAttempts() || !policy.isRetryable(response.code())) {
          return response;
        }
        delay = policy.delayMs(attempt, response.header("Retry-After"));
        log.debug(
            "{} {} answered {} (attempt {}/{}), retrying in {} ms",
            request.method(),
            request.url(),
            response.code(),
            attempt,
            policy.maxAttempts(),
            delay);
        response.close();
      } catch (IOException e) {
        if (chain.call().isCanceled()
            || attempt >= policy.maxAttempts()
            || !policy.isRetryable(e)) {
          throw e;
        }
        delay = policy.delayMs(attempt);
        log.warn(
            "{} {} failed (attempt {}/{}): {}, retrying in {} ms",
            request.method(),
            request.url(),
            attempt,
            policy.maxAttempts(),
            e.toString(),
            delay);
      }
      pause(chain, startNanos, delay);
      if (chain.call().isCanceled()) {
        throw new InterruptedIOException("call cancelled while waiting to retry " + request.url());
      }
    }
  }

  /**
   * Sleeps before the next attempt. The sleep never outlasts the call timeout: when the delay would
   * reach past it, the remaining budget is slept and the call fails with a timeout.
   */
  private static void pause(Chain chain, long startNanos, long delayMs)
      throws InterruptedIOException {
    long budgetNanos = chain.call().timeout().timeoutNanos();
    long sleepMs = delayMs;
    boolean exhausted = false;
    if (budgetNanos > 0) {
      long leftMs =
          TimeUnit.NANOSECONDS.toMillis(budgetNanos - (System.nanoTime() - startNanos));
      if (leftMs <= delayMs) {
        sleepMs = Math.max(leftMs, 0);
        exhausted = true;
      }
    }
    sleep(sleepMs);
    if (exhausted) {
      throw new InterruptedIOException("timeout");
    }
  }

  private static void sleep(long delayMs) throws InterruptedIOException {
    if (delayMs <= 0) return;
    try {
      Thread.sleep(delayMs);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      InterruptedIOException ex = new InterruptedIOException("interrupted while waiting to retry");
      ex.initCause(e);
      throw ex;
    }
  }
}

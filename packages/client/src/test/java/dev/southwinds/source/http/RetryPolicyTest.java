package dev.southwinds.source.http;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.net.UnknownServiceException;
import java.security.cert.CertificateException;
import javax.net.ssl.SSLHandshakeException;
import javax.net.ssl.SSLPeerUnverifiedException;
import org.junit.jupiter.api.Test;

class RetryPolicyTest {

  @Test
  void transientStatusesAreRetryable() {
    RetryPolicy policy = RetryPolicy.defaults();

    assertTrue(policy.isRetryable(429));
    assertTrue(policy.isRetryable(500));
    assertTrue(policy.isRetryable(502));
    assertTrue(policy.isRetryable(503));
    assertTrue(policy.isRetryable(504));
    assertFalse(policy.isRetryable(501));
    assertFalse(policy.isRetryable(400));
    assertFalse(policy.isRetryable(401));
    assertFalse(policy.isRetryable(404));
    assertFalse(policy.isRetryable(409));
    assertFalse(policy.isRetryable(200));
  }

  @Test
  void certificateAndProtocolFailuresAreNotRetried() {
    RetryPolicy policy = RetryPolicy.defaults();

    assertTrue(policy.isRetryable(new IOException("connection reset")));
    assertTrue(policy.isRetryable(new SocketTimeoutException("read timed out")));
    assertFalse(policy.isRetryable(new SSLPeerUnverifiedException("bad host")));
    assertFalse(policy.isRetryable(new UnknownServiceException("CLEARTEXT not permitted")));

    SSLHandshakeException badCert = new SSLHandshakeException("handshake");
    badCert.initCause(new CertificateException("untrusted"));
    assertFalse(policy.isRetryable(badCert));
    assertTrue(policy.isRetryable(new SSLHandshakeException("remote closed")));
  }

  @Test
  void delaysGrowExponentiallyUpToTheCap() {
    RetryPolicy policy = new RetryPolicy(10, 100, 1000, 0.0);

    assertEquals(100, policy.delayMs(1));
    assertEquals(200, policy.delayMs(2));
    assertEquals(400, policy.delayMs(3));
    assertEquals(800, policy.delayMs(4));
    assertEquals(1000, policy.delayMs(5));
    assertEquals(1000, policy.delayMs(64));
  }

  @Test
  void jitterStaysWithinBounds() {
    RetryPolicy policy = new RetryPolicy(10, 1000, 30000, 0.1);

    for (int i = 0; i < 200; i++) {
      long delay = policy.delayMs(2);
      assertTrue(delay >= 2000 && delay <= 2200, "delay out of range: " + delay);
    }
  }

  @Test
  void retryAfterSecondsIsHonouredAndCapped() {
    RetryPolicy policy = new RetryPolicy(10, 100, 5000, 0.0);

    assertEquals(2000, policy.delayMs(1, "2"));
    assertEquals(5000, policy.delayMs(1, "120"));
    assertEquals(100, policy.delayMs(1, "Wed, 21 Oct 2015 07:28:00 GMT"));
    assertEquals(100, policy.delayMs(1, null));
  }

  @Test
  void invalidSettingsAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(0, 1, 2, 0.1));
    assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(1, -1, 2, 0.1));
    assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(1, 10, 2, 0.1));
    assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(1, 1, 2, 1.5));
    assertThrows(IllegalArgumentException.class, () -> RetryPolicy.defaults().delayMs(0));
  }

  @Test
  void defaultsMatchDocumentedValues() {
    RetryPolicy policy = RetryPolicy.defaults();

    assertEquals(20, policy.maxAttempts());
    assertEquals(1000, policy.baseDelayMs());
    assertEquals(30000, policy.maxDelayMs());
    assertEquals(0.1, policy.jitterFactor());
    assertEquals(1, RetryPolicy.none().maxAttempts());
  }
}

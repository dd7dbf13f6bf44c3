package dev.southwinds.source;

import dev.southwinds.source.exception.ValidationException;
import dev.southwinds.source.model.Validatable;
import java.time.Duration;
import java.util.Objects;

/**
 * Transport options of a {@link SourceClient}.
 *
 * <p>Plain mutable bean so it can also be stored in the source service as a configuration item.
 */
public class SourceClientOptions implements Validatable {
  public static final Duration MIN_REQUEST_TIMEOUT = Duration.ofSeconds(30);

  /** Skip TLS certificate and host name verification. */
  private boolean insecureTransport;

  /** Bound of a whole call, retries included. */
  private Duration requestTimeout;

  public SourceClientOptions() {}

  public SourceClientOptions(boolean insecureTransport, Duration requestTimeout) {
    this.insecureTransport = insecureTransport;
    this.requestTimeout = requestTimeout;
  }

  /** Insecure transport with a 60 second timeout. */
  public static SourceClientOptions defaults() {
    return new SourceClientOptions(true, Duration.ofSeconds(60));
  }

  public boolean isInsecureTransport() {
    return insecureTransport;
  }

  public void setInsecureTransport(boolean insecureTransport) {
    this.insecureTransport = insecureTransport;
  }

  public Duration getRequestTimeout() {
    return requestTimeout;
  }

  public void setRequestTimeout(Duration requestTimeout) {
    this.requestTimeout = requestTimeout;
  }

  @Override
  public void validate() {
    if (requestTimeout == null || requestTimeout.compareTo(MIN_REQUEST_TIMEOUT) < 0) {
      throw new ValidationException(
          "timeout must be at least %d secs, got %s"
              .formatted(MIN_REQUEST_TIMEOUT.toSeconds(), requestTimeout));
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof SourceClientOptions that)) return false;
    return insecureTransport == that.insecureTransport
        && Objects.equals(requestTimeout, that.requestTimeout);
  }

  @Override
  public int hashCode() {
    return Objects.hash(insecureTransport, requestTimeout);
  }

  @Override
  public String toString() {
    return "SourceClientOptions{insecureTransport=%s, requestTimeout=%s}"
        .formatted(insecureTransport, requestTimeout);
  }
}

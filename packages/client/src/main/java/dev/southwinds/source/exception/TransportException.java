package dev.southwinds.source.exception;

import java.util.Map;

/** Network-level failure that outlived the retry budget, or a call that ran out of time. */
public class TransportException extends SourceException {
  public TransportException(String message, Throwable cause) {
    super(SourceErrorCode.NETWORK_ERROR, message, cause);
  }

  public TransportException(String message, Map<String, ?> context, Throwable cause) {
    super(SourceErrorCode.NETWORK_ERROR, message, context, cause);
  }
}

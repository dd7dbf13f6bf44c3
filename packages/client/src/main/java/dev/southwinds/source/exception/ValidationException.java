package dev.southwinds.source.exception;

/**
 * Raised by {@link dev.southwinds.source.model.Validatable#validate()} when an item rejects its own
 * state. Propagates to the caller unchanged and before any request is sent.
 */
public class ValidationException extends SourceException {
  public ValidationException(String message) {
    super(SourceErrorCode.INVALID_ARGUMENT, message);
  }

  public ValidationException(String message, Throwable cause) {
    super(SourceErrorCode.INVALID_ARGUMENT, message, cause);
  }
}

package dev.southwinds.source.exception;

/** The caller broke a client-side contract (missing type, missing tag name, bad prototype). */
public class UsageException extends SourceException {
  public UsageException(String message) {
    super(SourceErrorCode.FAILED_PRECONDITION, message);
  }
}

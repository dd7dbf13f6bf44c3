package dev.southwinds.source.exception;

/** JSON serialization or deserialization error. */
public class SerializationException extends SourceException {
  public SerializationException(String message) {
    super(SourceErrorCode.SERIALIZATION_ERROR, message);
  }

  public SerializationException(String message, Throwable cause) {
    super(SourceErrorCode.SERIALIZATION_ERROR, message, cause);
  }
}

package dev.southwinds.source.exception;

/** A JSON payload did not match the shape of the requested type. */
public class DecodeException extends SerializationException {
  public DecodeException(String message, Throwable cause) {
    super(message, cause);
  }
}

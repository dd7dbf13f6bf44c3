package dev.southwinds.source.exception;

/** A value could not be written as JSON. */
public class EncodeException extends SerializationException {
  public EncodeException(String message, Throwable cause) {
    super(message, cause);
  }
}

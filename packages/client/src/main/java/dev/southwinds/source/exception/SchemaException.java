package dev.southwinds.source.exception;

/** A JSON schema could not be derived from an example value. */
public class SchemaException extends SourceException {
  public SchemaException(String message, Throwable cause) {
    super(SourceErrorCode.SCHEMA_ERROR, message, cause);
  }
}

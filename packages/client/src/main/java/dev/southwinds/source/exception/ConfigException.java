package dev.southwinds.source.exception;

/** Invalid client options or configuration file. */
public class ConfigException extends SourceException {
  public ConfigException(String message) {
    super(SourceErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(SourceErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}

package dev.southwinds.source.exception;

/**
 * Stable error codes carried by every {@link SourceException}. Codes are suitable for logs and for
 * callers that branch on the failure origin rather than on the exception type.
 */
public enum SourceErrorCode {
  // Generic
  UNKNOWN,
  INVALID_ARGUMENT,
  FAILED_PRECONDITION,

  // I/O and configuration
  CONFIGURATION_ERROR,
  SERIALIZATION_ERROR,
  SCHEMA_ERROR,

  // Remote interaction
  NETWORK_ERROR,
  REMOTE_ERROR,
}

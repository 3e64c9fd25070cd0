package dev.jane.mcp.exception;

/**
 * Canonical error codes for Jane. Codes are stable and suitable for downstream services and logs.
 * Prefer choosing the most specific code that reflects the failure origin and actionability.
 */
public enum JaneErrorCode {
  // Generic
  INVALID_ARGUMENT,
  FAILED_PRECONDITION,
  NOT_FOUND,
  ALREADY_EXISTS,
  PERMISSION_DENIED,

  // I/O and configuration
  CONFIGURATION_ERROR,
  IO_ERROR,
  SERIALIZATION_ERROR,
  NETWORK_ERROR,

  // Knowledge base
  DATA_LOSS,
  INDEX_CORRUPTION,
}

package io.safeagents.core.exception;

/**
 * Stable error codes attached to every {@link SafeAgentsException}. Suitable for logs and for
 * callers that branch on the failure origin rather than on exception types.
 */
public enum ErrorCode {
  CONFIGURATION_ERROR,
  UNSUPPORTED_FRAMEWORK,
  CLIENT_CONSTRUCTION_ERROR,
}

package io.safeagents.core.exception;

import java.util.Map;

/** A framework selector outside the supported set reached the client factory. */
public class UnsupportedFrameworkException extends SafeAgentsException {
  public UnsupportedFrameworkException(String framework) {
    super(
        ErrorCode.UNSUPPORTED_FRAMEWORK,
        "Unsupported framework: " + framework,
        Map.of("framework", String.valueOf(framework)));
  }
}

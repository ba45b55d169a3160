package io.safeagents.core.exception;

import io.safeagents.core.framework.Framework;
import java.util.Map;

/**
 * Building a framework client failed, either because the configuration was rejected or because
 * the underlying SDK builder threw. The original failure, if any, is kept as the cause.
 */
public class ClientConstructionException extends SafeAgentsException {
  private final Framework framework;

  public ClientConstructionException(Framework framework, String message) {
    this(framework, message, null);
  }

  public ClientConstructionException(Framework framework, String message, Throwable cause) {
    super(
        ErrorCode.CLIENT_CONSTRUCTION_ERROR,
        "[%s] %s".formatted(framework.label(), message),
        Map.of("framework", framework.label()),
        cause);
    this.framework = framework;
  }

  public Framework framework() {
    return framework;
  }
}

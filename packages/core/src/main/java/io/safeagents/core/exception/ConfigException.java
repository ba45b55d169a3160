package io.safeagents.core.exception;

/** Configuration or environment problem detected while loading settings. */
public class ConfigException extends SafeAgentsException {
  public ConfigException(String message) {
    super(ErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(ErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}

package io.safeagents.core.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Base runtime exception carrying an {@link ErrorCode} and an optional, unmodifiable context map.
 */
public class SafeAgentsException extends RuntimeException {
  private final ErrorCode code;
  private final Map<String, Object> context;

  public SafeAgentsException(ErrorCode code, String message) {
    this(code, message, null, null);
  }

  public SafeAgentsException(ErrorCode code, String message, Throwable cause) {
    this(code, message, null, cause);
  }

  public SafeAgentsException(ErrorCode code, String message, Map<String, ?> context) {
    this(code, message, context, null);
  }

  public SafeAgentsException(
      ErrorCode code, String message, Map<String, ?> context, Throwable cause) {
    super(message, cause);
    this.code = Objects.requireNonNull(code, "code");
    this.context = copy(context);
  }

  public ErrorCode getCode() {
    return code;
  }

  /** Key/value details that help diagnosing the error. */
  public Map<String, Object> getContext() {
    return context;
  }

  private static Map<String, Object> copy(Map<String, ?> input) {
    if (input == null || input.isEmpty()) return Collections.emptyMap();
    Map<String, Object> m = new LinkedHashMap<>();
    input.forEach(m::put);
    return Collections.unmodifiableMap(m);
  }

  @Override
  public String toString() {
    return getClass().getSimpleName()
        + "{code="
        + code
        + ", message="
        + getMessage()
        + (context.isEmpty() ? "" : ", context=" + context)
        + (getCause() == null ? "" : ", cause=" + getCause().getClass().getSimpleName())
        + '}';
  }
}

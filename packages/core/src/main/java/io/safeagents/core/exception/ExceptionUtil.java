package io.safeagents.core.exception;

import java.util.function.Function;

/** Helpers for translating arbitrary throwables into the {@link SafeAgentsException} family. */
public final class ExceptionUtil {
  private ExceptionUtil() {}

  /**
   * Returns {@code t} unchanged when it already belongs to the hierarchy, otherwise the exception
   * produced by {@code supplier}.
   */
  public static SafeAgentsException rethrowIfUnchecked(
      Throwable t, Function<Throwable, ? extends SafeAgentsException> supplier) {
    if (t instanceof SafeAgentsException ex) {
      return ex;
    }
    return supplier.apply(t);
  }
}

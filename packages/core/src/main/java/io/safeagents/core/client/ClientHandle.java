package io.safeagents.core.client;

import io.safeagents.core.framework.Framework;
import java.util.Map;

/**
 * Opaque, framework-shaped client produced by {@link io.safeagents.core.framework.ClientFactory}.
 *
 * <p>Callers hand the handle to the orchestration layer of {@link #framework()}. {@link
 * #constructorArguments()} exposes the keyword arguments the client was built from, in the naming
 * convention of that framework (see {@link ClientArguments}).
 */
public interface ClientHandle extends AutoCloseable {

  Framework framework();

  /** Immutable, insertion-ordered view of the arguments this client was constructed with. */
  Map<String, Object> constructorArguments();

  /** Releases the underlying SDK client (connection pool, dispatcher threads). */
  @Override
  void close();
}

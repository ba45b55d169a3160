package io.safeagents.core.model;

/**
 * Supplies bearer tokens for the Azure OpenAI endpoint.
 *
 * <p>Instances come from an identity collaborator outside this library. The client factory never
 * calls {@link #token()} itself; it forwards the same instance to the provider SDK, which asks
 * for a fresh token per request.
 */
@FunctionalInterface
public interface TokenProvider {
  String token();
}

package io.safeagents.core.framework;

import io.safeagents.core.client.OpenAiAgentsClient;
import io.safeagents.core.logging.LoggingService;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Default-provider state of the OpenAI Agents runtime: which client agents use when none is given,
 * which request API they speak, whether tracing is on, and the {@code OPENAI_*} settings helper
 * libraries read.
 *
 * <p>The runtime keeps this state process-wide. Here it lives in an instance so that independent
 * configurations can coexist and tests stay isolated; share one registry between the factories
 * that must agree on a default.
 *
 * <p>Every registration replaces the previous one as a unit under a single lock. Registering the
 * same settings again is harmless. Registering a different client overwrites the earlier default,
 * so only the most recent configuration stays in effect.
 */
public final class OpenAiAgentsRegistry {
  private static final org.slf4j.Logger log = LoggingService.getLogger(OpenAiAgentsRegistry.class);

  public static final String CHAT_COMPLETIONS_API = "chat_completions";
  public static final String RESPONSES_API = "responses";

  public static final String ENV_API_TYPE = "OPENAI_API_TYPE";
  public static final String ENV_API_BASE = "OPENAI_API_BASE";
  public static final String ENV_API_VERSION = "OPENAI_API_VERSION";

  private final ReentrantLock lock = new ReentrantLock();
  private final Map<String, String> environment = new LinkedHashMap<>();
  private OpenAiAgentsClient defaultClient;
  private boolean useForTracing;
  private String defaultApi = RESPONSES_API;
  private boolean tracingDisabled;

  /** Immutable view of the registry at one point in time. */
  public record Registration(
      Optional<OpenAiAgentsClient> defaultClient,
      boolean useForTracing,
      String defaultApi,
      boolean tracingDisabled,
      Map<String, String> environment) {}

  /**
   * Makes {@code client} the default, pins the chat-completions API, disables tracing and mirrors
   * the endpoint and API version into the environment map, all in one critical section.
   */
  void registerDefault(OpenAiAgentsClient client) {
    Objects.requireNonNull(client, "client");
    lock.lock();
    try {
      if (defaultClient != null
          && defaultClient != client
          && !defaultClient.constructorArguments().equals(client.constructorArguments())) {
        log.warn(
            "Replacing default OpenAI Agents client for {} with a client for {}",
            defaultClient.endpoint(),
            client.endpoint());
      }
      defaultClient = client;
      useForTracing = false;
      defaultApi = CHAT_COMPLETIONS_API;
      tracingDisabled = true;
      environment.put(ENV_API_TYPE, "azure");
      environment.put(ENV_API_BASE, client.endpoint());
      environment.put(ENV_API_VERSION, client.apiVersion());
      log.debug(
          "Registered default OpenAI Agents client (endpoint={}, apiVersion={})",
          client.endpoint(),
          client.apiVersion());
    } finally {
      lock.unlock();
    }
  }

  public Optional<OpenAiAgentsClient> defaultClient() {
    lock.lock();
    try {
      return Optional.ofNullable(defaultClient);
    } finally {
      lock.unlock();
    }
  }

  public String defaultApi() {
    lock.lock();
    try {
      return defaultApi;
    } finally {
      lock.unlock();
    }
  }

  public boolean isTracingDisabled() {
    lock.lock();
    try {
      return tracingDisabled;
    } finally {
      lock.unlock();
    }
  }

  /** Value of an {@code OPENAI_*} setting mirrored by the last registration, if any. */
  public Optional<String> environment(String key) {
    lock.lock();
    try {
      return Optional.ofNullable(environment.get(key));
    } finally {
      lock.unlock();
    }
  }

  public Registration snapshot() {
    lock.lock();
    try {
      return new Registration(
          Optional.ofNullable(defaultClient),
          useForTracing,
          defaultApi,
          tracingDisabled,
          Collections.unmodifiableMap(new LinkedHashMap<>(environment)));
    } finally {
      lock.unlock();
    }
  }
}

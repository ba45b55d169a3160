package io.safeagents.core.client;

import com.openai.client.OpenAIClientAsync;
import io.safeagents.core.framework.Framework;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Asynchronous Azure OpenAI client as consumed by the OpenAI Agents runtime. The model and
 * deployment are chosen per agent, so only the connection settings are captured here.
 */
public final class OpenAiAgentsClient implements ClientHandle {
  private final Map<String, Object> arguments;
  private final OpenAIClientAsync openAIClient;

  public OpenAiAgentsClient(Map<String, Object> arguments, OpenAIClientAsync openAIClient) {
    this.arguments = Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
    this.openAIClient = Objects.requireNonNull(openAIClient, "openAIClient");
  }

  @Override
  public Framework framework() {
    return Framework.OPENAI_AGENTS;
  }

  @Override
  public Map<String, Object> constructorArguments() {
    return arguments;
  }

  public OpenAIClientAsync openAIClient() {
    return openAIClient;
  }

  public String endpoint() {
    return (String) arguments.get(ClientArguments.AZURE_ENDPOINT);
  }

  public String apiVersion() {
    return (String) arguments.get(ClientArguments.API_VERSION);
  }

  @Override
  public void close() {
    openAIClient.close();
  }

  @Override
  public String toString() {
    return "OpenAiAgentsClient{endpoint=" + endpoint() + ", apiVersion=" + apiVersion() + '}';
  }
}

package io.safeagents.core.client;

import com.openai.client.OpenAIClient;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import io.safeagents.core.framework.Framework;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Common base for the handles backed by a synchronous openai-java {@link OpenAIClient} talking to
 * an Azure OpenAI deployment.
 */
public abstract class AzureChatClient implements ClientHandle {
  private final Framework framework;
  private final Map<String, Object> arguments;
  protected final OpenAIClient openAIClient;

  protected AzureChatClient(
      Framework framework, Map<String, Object> arguments, OpenAIClient openAIClient) {
    this.framework = Objects.requireNonNull(framework, "framework");
    this.arguments = Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
    this.openAIClient = Objects.requireNonNull(openAIClient, "openAIClient");
  }

  @Override
  public Framework framework() {
    return framework;
  }

  @Override
  public Map<String, Object> constructorArguments() {
    return arguments;
  }

  public OpenAIClient openAIClient() {
    return openAIClient;
  }

  public String deployment() {
    return (String) arguments.get(ClientArguments.AZURE_DEPLOYMENT);
  }

  public double temperature() {
    return ((Number) arguments.get(ClientArguments.TEMPERATURE)).doubleValue();
  }

  /**
   * Starts a chat completion request addressed to this deployment with the configured sampling
   * temperature. Callers add messages and call {@code openAIClient().chat().completions()}.
   */
  public ChatCompletionCreateParams.Builder newRequest() {
    return ChatCompletionCreateParams.builder().model(deployment()).temperature(temperature());
  }

  @Override
  public void close() {
    openAIClient.close();
  }

  @Override
  public String toString() {
    return getClass().getSimpleName()
        + "{framework="
        + framework.label()
        + ", deployment="
        + deployment()
        + '}';
  }
}

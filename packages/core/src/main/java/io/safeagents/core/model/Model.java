package io.safeagents.core.model;

import io.safeagents.core.client.AutogenChatCompletionClient;
import io.safeagents.core.client.ClientHandle;
import io.safeagents.core.framework.ClientFactory;
import io.safeagents.core.framework.Framework;

/**
 * The LLM behind an agent: the configuration it came from, the client built from it and the label
 * of the framework that client targets. Obtain instances through the static factory methods.
 */
public final class Model implements AutoCloseable {
  private final ModelConfig config;
  private final ClientHandle client;
  private final String framework;

  private Model(ModelConfig config, ClientHandle client, String framework) {
    this.config = config;
    this.client = client;
    this.framework = framework;
  }

  /**
   * Builds an Autogen client for an Azure OpenAI deployment, advertising function calling, JSON
   * output, vision and structured output.
   *
   * @throws io.safeagents.core.exception.ClientConstructionException if the configuration is
   *     incomplete
   */
  public static Model fromAzureOpenAiForAutogen(ModelConfig config) {
    AutogenChatCompletionClient client =
        new ClientFactory().createAutogenClient(config, ModelCapabilities.all());
    return new Model(config, client, Framework.AUTOGEN.label());
  }

  public ModelConfig config() {
    return config;
  }

  public ClientHandle client() {
    return client;
  }

  /** Label of the target framework, e.g. {@code Autogen}. */
  public String framework() {
    return framework;
  }

  @Override
  public void close() {
    client.close();
  }

  @Override
  public String toString() {
    return "Model{framework=" + framework + ", config=" + config + '}';
  }
}

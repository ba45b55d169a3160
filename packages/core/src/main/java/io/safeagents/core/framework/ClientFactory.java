package io.safeagents.core.framework;

import com.openai.azure.AzureOpenAIServiceVersion;
import com.openai.client.OpenAIClient;
import com.openai.client.OpenAIClientAsync;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import com.openai.client.okhttp.OpenAIOkHttpClientAsync;
import com.openai.credential.BearerTokenCredential;
import io.safeagents.core.client.AutogenChatCompletionClient;
import io.safeagents.core.client.ClientArguments;
import io.safeagents.core.client.ClientHandle;
import io.safeagents.core.client.LangGraphChatClient;
import io.safeagents.core.client.OpenAiAgentsClient;
import io.safeagents.core.exception.ClientConstructionException;
import io.safeagents.core.exception.ExceptionUtil;
import io.safeagents.core.exception.UnsupportedFrameworkException;
import io.safeagents.core.logging.LoggingService;
import io.safeagents.core.model.ModelCapabilities;
import io.safeagents.core.model.ModelConfig;
import io.safeagents.core.model.Tool;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Builds framework-shaped clients from a {@link ModelConfig} and attaches tools where the target
 * framework expects them on the client.
 *
 * <p>Example:
 *
 * <pre>
 *   ClientFactory factory = new ClientFactory();
 *   ClientHandle client = factory.createClient(Framework.LANGGRAPH, config);
 *   client = factory.bindTools(client, Framework.LANGGRAPH, tools);
 * </pre>
 *
 * <p>Construction for {@link Framework#OPENAI_AGENTS} also updates the {@link
 * OpenAiAgentsRegistry} this factory was created with. The other frameworks have no side effects.
 */
public final class ClientFactory {
  private static final org.slf4j.Logger log = LoggingService.getLogger(ClientFactory.class);

  private static final double MAX_TEMPERATURE = 2.0d;

  private final OpenAiAgentsRegistry registry;
  private final Function<ModelConfig, OpenAIClient> syncClients;
  private final Function<ModelConfig, OpenAIClientAsync> asyncClients;

  public ClientFactory() {
    this(new OpenAiAgentsRegistry());
  }

  public ClientFactory(OpenAiAgentsRegistry registry) {
    this(registry, ClientFactory::syncClient, ClientFactory::asyncClient);
  }

  /** Builds SDK clients through the given functions instead of the OkHttp builders. */
  ClientFactory(
      OpenAiAgentsRegistry registry,
      Function<ModelConfig, OpenAIClient> syncClients,
      Function<ModelConfig, OpenAIClientAsync> asyncClients) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.syncClients = Objects.requireNonNull(syncClients, "syncClients");
    this.asyncClients = Objects.requireNonNull(asyncClients, "asyncClients");
  }

  public OpenAiAgentsRegistry registry() {
    return registry;
  }

  /**
   * Creates a client for {@code framework}.
   *
   * @throws UnsupportedFrameworkException when {@code framework} is null
   * @throws ClientConstructionException when the configuration is incomplete or the SDK rejects it
   */
  public ClientHandle createClient(Framework framework, ModelConfig config) {
    if (framework == null) {
      throw new UnsupportedFrameworkException(null);
    }
    return switch (framework) {
      case AUTOGEN -> createAutogenClient(config, null);
      case LANGGRAPH -> createLangGraphClient(config);
      case OPENAI_AGENTS -> createOpenAiAgentsClient(config);
    };
  }

  /**
   * Same as {@link #createClient(Framework, ModelConfig)} for a selector string such as the
   * {@code FRAMEWORK} setting.
   */
  public ClientHandle createClient(String framework, ModelConfig config) {
    return createClient(Framework.fromId(framework), config);
  }

  /**
   * Builds an Autogen client. {@code capabilities} is added to the arguments as {@code
   * model_capabilities} when present.
   */
  public AutogenChatCompletionClient createAutogenClient(
      ModelConfig config, ModelCapabilities capabilities) {
    return construct(
        Framework.AUTOGEN,
        config,
        () -> {
          Map<String, Object> args = new LinkedHashMap<>();
          args.put(ClientArguments.AZURE_ENDPOINT, config.endpoint());
          args.put(ClientArguments.API_VERSION, config.apiVersion());
          if (capabilities != null) {
            args.put(ClientArguments.MODEL_CAPABILITIES, capabilities.asArguments());
          }
          args.put(ClientArguments.AZURE_AD_TOKEN_PROVIDER, config.tokenProvider());
          args.put(ClientArguments.MODEL, config.modelName());
          args.put(ClientArguments.TEMPERATURE, config.temperature());
          args.put(ClientArguments.AZURE_DEPLOYMENT, config.deployment());
          return new AutogenChatCompletionClient(args, syncClients.apply(config));
        });
  }

  private LangGraphChatClient createLangGraphClient(ModelConfig config) {
    return construct(
        Framework.LANGGRAPH,
        config,
        () -> {
          Map<String, Object> args = new LinkedHashMap<>();
          args.put(ClientArguments.NAME, config.modelName());
          args.put(ClientArguments.TEMPERATURE, config.temperature());
          args.put(ClientArguments.AZURE_DEPLOYMENT, config.deployment());
          args.put(ClientArguments.AZURE_ENDPOINT, config.endpoint());
          args.put(ClientArguments.API_VERSION, config.apiVersion());
          args.put(ClientArguments.AZURE_AD_TOKEN_PROVIDER, config.tokenProvider());
          return new LangGraphChatClient(args, syncClients.apply(config));
        });
  }

  private OpenAiAgentsClient createOpenAiAgentsClient(ModelConfig config) {
    OpenAiAgentsClient client =
        construct(
            Framework.OPENAI_AGENTS,
            config,
            () -> {
              Map<String, Object> args = new LinkedHashMap<>();
              args.put(ClientArguments.AZURE_ENDPOINT, config.endpoint());
              args.put(ClientArguments.AZURE_AD_TOKEN_PROVIDER, config.tokenProvider());
              args.put(ClientArguments.API_VERSION, config.apiVersion());
              return new OpenAiAgentsClient(args, asyncClients.apply(config));
            });
    registry.registerDefault(client);
    return client;
  }

  /**
   * Attaches {@code tools} the way {@code framework} expects, allowing parallel tool calls.
   *
   * @see #bindTools(ClientHandle, Framework, List, boolean)
   */
  public ClientHandle bindTools(
      ClientHandle client, Framework framework, List<? extends Tool> tools) {
    return bindTools(client, framework, tools, true);
  }

  /**
   * Attaches {@code tools} to {@code client} the way {@code framework} expects.
   *
   * <p>Only LangGraph binds tools onto the client; the result is a new handle. Autogen and OpenAI
   * Agents attach tools to the agent definition, so the same handle is returned untouched. An
   * unknown (null) framework is also a no-op rather than an error.
   *
   * @throws IllegalArgumentException when LangGraph binding is requested for a client that was not
   *     built for LangGraph
   */
  public ClientHandle bindTools(
      ClientHandle client,
      Framework framework,
      List<? extends Tool> tools,
      boolean parallelToolCalls) {
    if (framework == null) {
      log.debug("No framework given for tool binding; returning client unchanged");
      return client;
    }
    return switch (framework) {
      case LANGGRAPH -> {
        if (!(client instanceof LangGraphChatClient langGraph)) {
          throw new IllegalArgumentException(
              "LangGraph tool binding requires a LangGraphChatClient, got "
                  + (client == null ? "null" : client.getClass().getName()));
        }
        log.debug(
            "Binding {} tool(s) to LangGraph client (parallelToolCalls={})",
            tools == null ? 0 : tools.size(),
            parallelToolCalls);
        yield langGraph.bindTools(tools == null ? List.of() : tools, parallelToolCalls);
      }
      case AUTOGEN, OPENAI_AGENTS -> client;
    };
  }

  private <T extends ClientHandle> T construct(
      Framework framework, ModelConfig config, Supplier<T> routine) {
    validate(framework, config);
    try {
      T client = routine.get();
      log.info(
          "Created {} client (endpoint={}, deployment={}, apiVersion={})",
          framework.label(),
          config.endpoint(),
          config.deployment(),
          config.apiVersion());
      return client;
    } catch (Exception e) {
      throw ExceptionUtil.rethrowIfUnchecked(
          e,
          ex ->
              new ClientConstructionException(
                  framework, "Failed to construct client: " + ex.getMessage(), ex));
    }
  }

  private static void validate(Framework framework, ModelConfig config) {
    if (config == null) {
      throw new ClientConstructionException(framework, "Missing model configuration");
    }
    requireText(framework, config.endpoint(), "endpoint");
    requireText(framework, config.deployment(), "deployment");
    requireText(framework, config.modelName(), "model name");
    requireText(framework, config.apiVersion(), "API version");
    if (config.tokenProvider() == null) {
      throw new ClientConstructionException(framework, "Missing token provider");
    }
    double temperature = config.temperature();
    if (Double.isNaN(temperature) || temperature < 0 || temperature > MAX_TEMPERATURE) {
      throw new ClientConstructionException(
          framework,
          "Temperature must be between 0 and %s, got %s".formatted(MAX_TEMPERATURE, temperature));
    }
    try {
      URI uri = new URI(config.endpoint().trim());
      String scheme = uri.getScheme();
      if (scheme == null
          || !(scheme.equalsIgnoreCase("https") || scheme.equalsIgnoreCase("http"))
          || uri.getHost() == null) {
        throw new ClientConstructionException(
            framework, "Endpoint must be an absolute http(s) URL: " + config.endpoint());
      }
    } catch (URISyntaxException e) {
      throw new ClientConstructionException(
          framework, "Malformed endpoint: " + config.endpoint(), e);
    }
  }

  private static void requireText(Framework framework, String value, String field) {
    if (value == null || value.isBlank()) {
      throw new ClientConstructionException(framework, "Missing " + field);
    }
  }

  private static OpenAIClient syncClient(ModelConfig config) {
    return OpenAIOkHttpClient.builder()
        .baseUrl(config.endpoint().trim())
        .credential(BearerTokenCredential.create(tokenSupplier(config)))
        .azureServiceVersion(AzureOpenAIServiceVersion.fromString(config.apiVersion()))
        .build();
  }

  private static OpenAIClientAsync asyncClient(ModelConfig config) {
    return OpenAIOkHttpClientAsync.builder()
        .baseUrl(config.endpoint().trim())
        .credential(BearerTokenCredential.create(tokenSupplier(config)))
        .azureServiceVersion(AzureOpenAIServiceVersion.fromString(config.apiVersion()))
        .build();
  }

  private static Supplier<String> tokenSupplier(ModelConfig config) {
    return config.tokenProvider()::token;
  }
}

package io.safeagents.core.config;

import io.safeagents.core.framework.Framework;
import io.safeagents.core.logging.LoggingService;
import io.safeagents.core.model.ModelConfig;
import io.safeagents.core.model.TokenProvider;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.commons.configuration2.Configuration;

/**
 * Runtime settings of a multi-agent run: the Azure backend, the target framework and the
 * experiment type. Reads the keys below from a {@link Configuration}; the bundled {@code
 * application.yaml} maps each of them to the environment variable in parentheses.
 *
 * <ul>
 *   <li>{@code azure.endpoint} ({@code AZURE_ENDPOINT})
 *   <li>{@code azure.deployment} ({@code AZURE_DEPLOYMENT})
 *   <li>{@code azure.model-name} ({@code AZURE_MODEL_NAME})
 *   <li>{@code azure.api-version} ({@code AZURE_API_VERSION})
 *   <li>{@code framework} ({@code FRAMEWORK})
 *   <li>{@code experiment.type} ({@code EXP_TYPE})
 * </ul>
 *
 * Placeholders that could not be resolved read as absent.
 */
public final class EnvironmentSetup {
  private final Configuration configuration;

  public EnvironmentSetup() {
    this(new ConfigurationProvider().config());
  }

  public EnvironmentSetup(Configuration configuration) {
    this.configuration = configuration;
    LoggingService.applyConfiguration(configuration);
  }

  public String endpoint() {
    return value("azure.endpoint");
  }

  public String deployment() {
    return value("azure.deployment");
  }

  public String modelName() {
    return value("azure.model-name");
  }

  public String apiVersion() {
    return value("azure.api-version");
  }

  /**
   * @throws io.safeagents.core.exception.ConfigException when {@code azure.temperature} is not a
   *     number
   */
  public double temperature() {
    return ConfigValues.decimal(
        configuration, "azure.temperature", ModelConfig.DEFAULT_TEMPERATURE);
  }

  /** Raw framework selector, or {@code null} when unset. */
  public String frameworkId() {
    return value("framework");
  }

  /**
   * @throws io.safeagents.core.exception.UnsupportedFrameworkException when the selector is unset
   *     or unknown
   */
  public Framework framework() {
    return Framework.fromId(frameworkId());
  }

  public String experimentType() {
    return value("experiment.type");
  }

  /** Backend settings keyed like {@code endpoint}, {@code deployment}, {@code model_name}. */
  public Map<String, Object> azureConfig(TokenProvider tokenProvider) {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("endpoint", endpoint());
    m.put("deployment", deployment());
    m.put("model_name", modelName());
    m.put("api_version", apiVersion());
    m.put("token_provider", tokenProvider);
    return Collections.unmodifiableMap(m);
  }

  public ModelConfig modelConfig(TokenProvider tokenProvider) {
    return ModelConfig.builder()
        .endpoint(endpoint())
        .deployment(deployment())
        .modelName(modelName())
        .apiVersion(apiVersion())
        .temperature(temperature())
        .tokenProvider(tokenProvider)
        .build();
  }

  private String value(String key) {
    return ConfigValues.text(configuration, key);
  }
}

package io.safeagents.core.model;

import io.safeagents.core.config.ConfigValues;
import java.util.Objects;
import org.apache.commons.configuration2.Configuration;

/**
 * Framework-agnostic description of an Azure OpenAI backend and its sampling parameters.
 *
 * <p>Instances are immutable. The builder accepts empty values on purpose: whether a
 * configuration is complete is decided by {@link io.safeagents.core.framework.ClientFactory} at
 * the moment a client is requested.
 */
public final class ModelConfig {
  public static final double DEFAULT_TEMPERATURE = 0.0d;

  private final String endpoint;
  private final String deployment;
  private final String modelName;
  private final String apiVersion;
  private final TokenProvider tokenProvider;
  private final double temperature;

  private ModelConfig(Builder builder) {
    this.endpoint = builder.endpoint;
    this.deployment = builder.deployment;
    this.modelName = builder.modelName;
    this.apiVersion = builder.apiVersion;
    this.tokenProvider = builder.tokenProvider;
    this.temperature = builder.temperature;
  }

  public String endpoint() {
    return endpoint;
  }

  public String deployment() {
    return deployment;
  }

  public String modelName() {
    return modelName;
  }

  public String apiVersion() {
    return apiVersion;
  }

  public TokenProvider tokenProvider() {
    return tokenProvider;
  }

  public double temperature() {
    return temperature;
  }

  /** Copy of this configuration as a builder, for deriving variants. */
  public Builder toBuilder() {
    return builder()
        .endpoint(endpoint)
        .deployment(deployment)
        .modelName(modelName)
        .apiVersion(apiVersion)
        .tokenProvider(tokenProvider)
        .temperature(temperature);
  }

  /**
   * Reads a configuration from a commons-configuration subset such as {@code azure.*}.
   *
   * <p>Recognized keys: {@code endpoint}, {@code deployment}, {@code model-name}, {@code
   * api-version} and {@code temperature}. Blank values and unresolved placeholders are read as
   * absent, so an incomplete environment is rejected when a client is requested.
   *
   * @throws io.safeagents.core.exception.ConfigException when {@code temperature} is not a number
   */
  public static ModelConfig fromConfiguration(Configuration cfg, TokenProvider tokenProvider) {
    Objects.requireNonNull(cfg, "cfg");
    return builder()
        .endpoint(ConfigValues.text(cfg, "endpoint"))
        .deployment(ConfigValues.text(cfg, "deployment"))
        .modelName(ConfigValues.text(cfg, "model-name"))
        .apiVersion(ConfigValues.text(cfg, "api-version"))
        .temperature(ConfigValues.decimal(cfg, "temperature", DEFAULT_TEMPERATURE))
        .tokenProvider(tokenProvider)
        .build();
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof ModelConfig that)) return false;
    return Double.compare(temperature, that.temperature) == 0
        && Objects.equals(endpoint, that.endpoint)
        && Objects.equals(deployment, that.deployment)
        && Objects.equals(modelName, that.modelName)
        && Objects.equals(apiVersion, that.apiVersion)
        && tokenProvider == that.tokenProvider;
  }

  @Override
  public int hashCode() {
    return Objects.hash(endpoint, deployment, modelName, apiVersion, temperature);
  }

  // Token provider is deliberately left out.
  @Override
  public String toString() {
    return "ModelConfig{endpoint="
        + endpoint
        + ", deployment="
        + deployment
        + ", modelName="
        + modelName
        + ", apiVersion="
        + apiVersion
        + ", temperature="
        + temperature
        + '}';
  }

  public static final class Builder {
    private String endpoint;
    private String deployment;
    private String modelName;
    private String apiVersion;
    private TokenProvider tokenProvider;
    private double temperature = DEFAULT_TEMPERATURE;

    private Builder() {}

    public Builder endpoint(String endpoint) {
      this.endpoint = endpoint;
      return this;
    }

    public Builder deployment(String deployment) {
      this.deployment = deployment;
      return this;
    }

    public Builder modelName(String modelName) {
      this.modelName = modelName;
      return this;
    }

    public Builder apiVersion(String apiVersion) {
      this.apiVersion = apiVersion;
      return this;
    }

    public Builder tokenProvider(TokenProvider tokenProvider) {
      this.tokenProvider = tokenProvider;
      return this;
    }

    public Builder temperature(double temperature) {
      this.temperature = temperature;
      return this;
    }

    public ModelConfig build() {
      return new ModelConfig(this);
    }
  }
}

package io.safeagents.core.client;

/** Keyword names used in the captured constructor arguments of every {@link ClientHandle}. */
public final class ClientArguments {
  public static final String MODEL = "model";
  public static final String NAME = "name";
  public static final String AZURE_ENDPOINT = "azure_endpoint";
  public static final String API_VERSION = "api_version";
  public static final String AZURE_DEPLOYMENT = "azure_deployment";
  public static final String AZURE_AD_TOKEN_PROVIDER = "azure_ad_token_provider";
  public static final String TEMPERATURE = "temperature";
  public static final String MODEL_CAPABILITIES = "model_capabilities";

  private ClientArguments() {}
}

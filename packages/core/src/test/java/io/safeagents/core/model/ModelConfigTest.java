package io.safeagents.core.model;

import static org.junit.jupiter.api.Assertions.*;

import io.safeagents.core.exception.ClientConstructionException;
import io.safeagents.core.exception.ConfigException;
import io.safeagents.core.framework.ClientFactory;
import io.safeagents.core.framework.Framework;
import java.io.StringReader;
import org.apache.commons.configuration2.BaseConfiguration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.junit.jupiter.api.Test;

class ModelConfigTest {

  @Test
  void temperatureDefaultsToZero() {
    ModelConfig config = ModelConfig.builder().endpoint("https://contoso.openai.azure.com").build();

    assertEquals(0.0, config.temperature());
    assertNull(config.deployment());
  }

  @Test
  void toBuilderCopiesEveryField() {
    TokenProvider tokens = () -> "token";
    ModelConfig original =
        ModelConfig.builder()
            .endpoint("https://contoso.openai.azure.com")
            .deployment("gpt-4o-eval")
            .modelName("gpt-4o")
            .apiVersion("2024-10-21")
            .tokenProvider(tokens)
            .temperature(0.7)
            .build();

    ModelConfig copy = original.toBuilder().build();

    assertEquals(original, copy);
    assertSame(tokens, copy.tokenProvider());
    assertNotEquals(original, original.toBuilder().temperature(0.1).build());
  }

  @Test
  void readsFromConfigurationSubset() {
    BaseConfiguration cfg = new BaseConfiguration();
    cfg.addProperty("azure.endpoint", "https://contoso.openai.azure.com");
    cfg.addProperty("azure.deployment", "gpt-4o-eval");
    cfg.addProperty("azure.model-name", "gpt-4o");
    cfg.addProperty("azure.api-version", "2024-10-21");
    cfg.addProperty("azure.temperature", "0.5");
    TokenProvider tokens = () -> "token";

    ModelConfig config = ModelConfig.fromConfiguration(cfg.subset("azure"), tokens);

    assertEquals("https://contoso.openai.azure.com", config.endpoint());
    assertEquals("gpt-4o-eval", config.deployment());
    assertEquals("gpt-4o", config.modelName());
    assertEquals("2024-10-21", config.apiVersion());
    assertEquals(0.5, config.temperature());
    assertSame(tokens, config.tokenProvider());
  }

  @Test
  void missingTemperatureInConfigurationUsesDefault() {
    BaseConfiguration cfg = new BaseConfiguration();
    cfg.addProperty("endpoint", "https://contoso.openai.azure.com");

    ModelConfig config = ModelConfig.fromConfiguration(cfg, null);

    assertEquals(ModelConfig.DEFAULT_TEMPERATURE, config.temperature());
    assertNull(config.modelName());
  }

  @Test
  void unresolvedPlaceholderReadsAsAbsentAndIsRejected() throws Exception {
    YAMLConfiguration yaml = new YAMLConfiguration();
    yaml.read(
        new StringReader(
            String.join(
                "\n",
                "azure:",
                "  endpoint: https://contoso.openai.azure.com",
                "  deployment: ${env:SAFEAGENTS_TEST_UNSET_DEPLOYMENT}",
                "  model-name: gpt-4o",
                "  api-version: \"2024-10-21\"",
                "")));

    ModelConfig config = ModelConfig.fromConfiguration(yaml.subset("azure"), () -> "token");

    assertNull(config.deployment());
    assertEquals("gpt-4o", config.modelName());
    ClientConstructionException ex =
        assertThrows(
            ClientConstructionException.class,
            () -> new ClientFactory().createClient(Framework.AUTOGEN, config));
    assertEquals("[Autogen] Missing deployment", ex.getMessage());
  }

  @Test
  void blankValuesReadAsAbsent() {
    BaseConfiguration cfg = new BaseConfiguration();
    cfg.addProperty("endpoint", "  https://contoso.openai.azure.com  ");
    cfg.addProperty("api-version", "   ");

    ModelConfig config = ModelConfig.fromConfiguration(cfg, null);

    assertEquals("https://contoso.openai.azure.com", config.endpoint());
    assertNull(config.apiVersion());
  }

  @Test
  void nonNumericTemperatureIsConfigError() {
    BaseConfiguration cfg = new BaseConfiguration();
    cfg.addProperty("temperature", "warm");

    ConfigException ex =
        assertThrows(ConfigException.class, () -> ModelConfig.fromConfiguration(cfg, null));

    assertInstanceOf(NumberFormatException.class, ex.getCause());
  }

  @Test
  void toStringOmitsTokenProvider() {
    ModelConfig config =
        ModelConfig.builder().modelName("gpt-4o").tokenProvider(() -> "secret-token").build();

    assertFalse(config.toString().contains("secret"));
    assertTrue(config.toString().contains("gpt-4o"));
  }
}

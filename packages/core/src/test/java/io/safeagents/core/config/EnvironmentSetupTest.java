package io.safeagents.core.config;

import static org.junit.jupiter.api.Assertions.*;

import io.safeagents.core.exception.ConfigException;
import io.safeagents.core.exception.UnsupportedFrameworkException;
import io.safeagents.core.framework.Framework;
import io.safeagents.core.model.ModelConfig;
import io.safeagents.core.model.TokenProvider;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class EnvironmentSetupTest {

  private static final String LOCATION = "classpath:test-application.yaml";

  @TempDir Path tempDir;

  private EnvironmentSetup setup() {
    return new EnvironmentSetup(
        new ConfigurationProvider(LOCATION, tempDir.resolve("missing.env")).config());
  }

  @Test
  void readsAzureSettingsFromYaml() {
    EnvironmentSetup env = setup();

    assertEquals("https://contoso.openai.azure.com", env.endpoint());
    assertEquals("gpt-4o-eval", env.deployment());
    assertEquals("gpt-4o", env.modelName());
    assertEquals("2024-10-21", env.apiVersion());
    assertEquals(0.3, env.temperature());
    assertEquals(Framework.LANGGRAPH, env.framework());
  }

  @Test
  void unresolvedPlaceholderReadsAsAbsent() {
    assertNull(setup().experimentType());
  }

  @Test
  void dotEnvFileBacksMissingEnvironmentVariables() throws IOException {
    Path dotEnv = tempDir.resolve(".env");
    Files.writeString(
        dotEnv,
        "# local overrides\nexport SAFEAGENTS_TEST_UNSET_EXP_TYPE=\"baseline\"\n",
        StandardCharsets.UTF_8);

    EnvironmentSetup env =
        new EnvironmentSetup(new ConfigurationProvider(LOCATION, dotEnv).config());

    assertEquals("baseline", env.experimentType());
  }

  @Test
  void buildsModelConfigWithGivenTokenProvider() {
    TokenProvider tokens = () -> "token";

    ModelConfig config = setup().modelConfig(tokens);

    assertEquals("https://contoso.openai.azure.com", config.endpoint());
    assertEquals("gpt-4o-eval", config.deployment());
    assertEquals("gpt-4o", config.modelName());
    assertEquals("2024-10-21", config.apiVersion());
    assertEquals(0.3, config.temperature());
    assertSame(tokens, config.tokenProvider());
  }

  @Test
  void azureConfigExposesBackendSettings() {
    TokenProvider tokens = () -> "token";

    Map<String, Object> azure = setup().azureConfig(tokens);

    assertEquals("gpt-4o-eval", azure.get("deployment"));
    assertEquals("gpt-4o", azure.get("model_name"));
    assertSame(tokens, azure.get("token_provider"));
  }

  @Test
  void unknownFrameworkSelectorIsRejected() {
    BaseConfiguration cfg = new BaseConfiguration();
    cfg.addProperty("framework", "crewai");

    EnvironmentSetup env = new EnvironmentSetup(cfg);

    assertEquals("crewai", env.frameworkId());
    assertThrows(UnsupportedFrameworkException.class, env::framework);
  }

  @Test
  void missingFrameworkSelectorIsRejected() {
    EnvironmentSetup env = new EnvironmentSetup(new BaseConfiguration());

    assertNull(env.frameworkId());
    assertThrows(UnsupportedFrameworkException.class, env::framework);
    assertEquals(ModelConfig.DEFAULT_TEMPERATURE, env.temperature());
  }

  @Test
  void missingConfigurationFileFails() {
    assertThrows(
        ConfigException.class,
        () -> new ConfigurationProvider(tempDir.resolve("nope.yaml").toString()));
  }

  @Test
  void missingClasspathResourceYieldsEmptyConfiguration() {
    ConfigurationProvider provider = new ConfigurationProvider("classpath:does-not-exist.yaml");

    assertTrue(provider.config().isEmpty());
  }

  @Test
  void readsConfigurationFromFileSystem() throws IOException {
    Path yaml = tempDir.resolve("app.yaml");
    Files.writeString(
        yaml, "azure:\n  deployment: from-file\nframework: autogen\n", StandardCharsets.UTF_8);

    EnvironmentSetup env =
        new EnvironmentSetup(new ConfigurationProvider(yaml.toString()).config());

    assertEquals("from-file", env.deployment());
    assertEquals(Framework.AUTOGEN, env.framework());
  }

  @Test
  void nonNumericTemperatureIsConfigError() {
    BaseConfiguration cfg = new BaseConfiguration();
    cfg.addProperty("azure.temperature", "warm");
    EnvironmentSetup env = new EnvironmentSetup(cfg);

    ConfigException ex = assertThrows(ConfigException.class, env::temperature);

    assertEquals("Invalid azure.temperature: warm", ex.getMessage());
    assertInstanceOf(NumberFormatException.class, ex.getCause());
    assertThrows(ConfigException.class, () -> env.modelConfig(() -> "token"));
  }
}

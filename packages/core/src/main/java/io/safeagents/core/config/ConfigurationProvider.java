package io.safeagents.core.config;

import io.safeagents.core.exception.ConfigException;
import io.safeagents.core.logging.LoggingService;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Map;
import java.util.stream.Collectors;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.apache.commons.configuration2.interpol.Lookup;

/**
 * Loads YAML configuration into an Apache Commons {@link Configuration}.
 *
 * <p>Locations are either {@code classpath:some/file.yaml} or a file system path; a blank
 * location means {@code classpath:application.yaml}. Values may reference the environment with
 * {@code ${env:NAME}}; names missing from the process environment are looked up in a {@code .env}
 * file in the working directory.
 */
public final class ConfigurationProvider {
  private static final org.slf4j.Logger log =
      LoggingService.getLogger(ConfigurationProvider.class);

  public static final String DEFAULT_LOCATION = "classpath:application.yaml";

  private final Configuration configuration;

  public ConfigurationProvider() {
    this(DEFAULT_LOCATION);
  }

  public ConfigurationProvider(String location) {
    this(location, Path.of(".env"));
  }

  ConfigurationProvider(String location, Path dotEnv) {
    YAMLConfiguration config = load(location);
    config.getInterpolator().registerLookup("env", new DotEnvLookup(dotEnv));
    this.configuration = config;
  }

  public Configuration config() {
    return configuration;
  }

  private static YAMLConfiguration load(String location) {
    String loc = location == null || location.isBlank() ? DEFAULT_LOCATION : location.trim();
    if (loc.startsWith("classpath:")) {
      String resource = loc.substring("classpath:".length());
      InputStream input =
          Thread.currentThread().getContextClassLoader().getResourceAsStream(resource);
      if (input == null) {
        log.warn("Configuration resource {} not found; using empty configuration", resource);
        return new YAMLConfiguration();
      }
      log.info("Loading configuration from classpath resource: {}", resource);
      try (Reader reader = new InputStreamReader(input, StandardCharsets.UTF_8)) {
        return read(reader, loc);
      } catch (IOException e) {
        throw new ConfigException("Failed to read configuration " + loc, e);
      }
    }
    Path path = Path.of(loc);
    if (!Files.isRegularFile(path)) {
      throw new ConfigException("Configuration file not found: " + path.toAbsolutePath());
    }
    log.info("Loading configuration from file: {}", path.toAbsolutePath());
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return read(reader, loc);
    } catch (IOException e) {
      throw new ConfigException("Failed to read configuration " + loc, e);
    }
  }

  private static YAMLConfiguration read(Reader reader, String location) throws IOException {
    YAMLConfiguration config = new YAMLConfiguration();
    try {
      config.read(reader);
    } catch (ConfigurationException e) {
      throw new ConfigException("Invalid YAML in " + location, e);
    }
    return config;
  }

  /** {@code env:} lookup backed by the process environment, then by a dotenv file. */
  static final class DotEnvLookup implements Lookup {
    private final Path dotEnv;
    private volatile Map<String, String> fallback;

    DotEnvLookup(Path dotEnv) {
      this.dotEnv = dotEnv;
    }

    @Override
    public Object lookup(String key) {
      String val = System.getenv(key);
      if (val != null && !val.isEmpty()) {
        return val;
      }
      return fallback().get(key);
    }

    private Map<String, String> fallback() {
      Map<String, String> m = fallback;
      if (m == null) {
        synchronized (this) {
          m = fallback;
          if (m == null) {
            m = readDotEnv(dotEnv);
            fallback = m;
          }
        }
      }
      return m;
    }

    static Map<String, String> readDotEnv(Path path) {
      if (path == null || !Files.isRegularFile(path)) {
        log.debug("No dotenv file at {}", path);
        return Collections.emptyMap();
      }
      log.info("Reading environment fallback from {}", path.toAbsolutePath());
      try (BufferedReader br = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
        return br.lines()
            .map(String::trim)
            .filter(line -> !line.isEmpty() && !line.startsWith("#"))
            .map(line -> line.startsWith("export ") ? line.substring(7).trim() : line)
            .filter(line -> line.indexOf('=') > 0)
            .collect(
                Collectors.toMap(
                    line -> line.substring(0, line.indexOf('=')).trim(),
                    line -> unquote(line.substring(line.indexOf('=') + 1).trim()),
                    (a, b) -> b));
      } catch (IOException e) {
        throw new ConfigException("Failed to read " + path, e);
      }
    }

    private static String unquote(String value) {
      if (value.length() >= 2
          && ((value.startsWith("\"") && value.endsWith("\""))
              || (value.startsWith("'") && value.endsWith("'")))) {
        return value.substring(1, value.length() - 1);
      }
      return value;
    }
  }
}

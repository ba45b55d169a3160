package io.safeagents.core.config;

import io.safeagents.core.exception.ConfigException;
import org.apache.commons.configuration2.Configuration;

/**
 * Reads single settings the way every consumer in this module expects them: blank values and
 * {@code ${...}} placeholders that interpolation could not resolve count as absent.
 */
public final class ConfigValues {
  private ConfigValues() {}

  /** Trimmed value of {@code key}, or {@code null} when unset, blank or unresolved. */
  public static String text(Configuration cfg, String key) {
    String v = cfg.getString(key, null);
    if (v == null || v.isBlank() || v.contains("${")) {
      return null;
    }
    return v.trim();
  }

  /**
   * Decimal value of {@code key}, or {@code defaultValue} when absent.
   *
   * @throws ConfigException when the value is present but not a number
   */
  public static double decimal(Configuration cfg, String key, double defaultValue) {
    String raw = text(cfg, key);
    if (raw == null) {
      return defaultValue;
    }
    try {
      return Double.parseDouble(raw);
    } catch (NumberFormatException e) {
      throw new ConfigException("Invalid " + key + ": " + raw, e);
    }
  }
}

package io.safeagents.core.framework;

import io.safeagents.core.exception.UnsupportedFrameworkException;
import java.util.Locale;

/** Agent-orchestration ecosystems the {@link ClientFactory} can build clients for. */
public enum Framework {
  AUTOGEN("autogen", "Autogen"),
  LANGGRAPH("langgraph", "LangGraph"),
  OPENAI_AGENTS("openai_agents", "OpenAI Agents");

  private final String id;
  private final String label;

  Framework(String id, String label) {
    this.id = id;
    this.label = label;
  }

  /** Stable lowercase identifier, e.g. {@code openai_agents}. */
  public String id() {
    return id;
  }

  /** Human readable name, e.g. {@code OpenAI Agents}. */
  public String label() {
    return label;
  }

  /**
   * Resolves a framework from a selector string such as the {@code FRAMEWORK} environment value.
   * Matching ignores case and treats {@code '-'}, {@code ' '} and {@code '_'} alike, so {@code
   * "OpenAI Agents"}, {@code "openai-agents"} and {@code "OPENAI_AGENTS"} all resolve.
   *
   * @throws UnsupportedFrameworkException when the value is blank or names no known framework
   */
  public static Framework fromId(String value) {
    if (value == null || value.isBlank()) {
      throw new UnsupportedFrameworkException(value);
    }
    String key = normalize(value);
    for (Framework f : values()) {
      if (key.equals(f.id) || key.equals(normalize(f.label)) || key.equals(normalize(f.name()))) {
        return f;
      }
    }
    throw new UnsupportedFrameworkException(value);
  }

  private static String normalize(String value) {
    return value.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
  }
}

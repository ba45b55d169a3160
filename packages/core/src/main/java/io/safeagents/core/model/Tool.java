package io.safeagents.core.model;

import java.util.Map;

/** A callable function an LLM may invoke during generation. */
public interface Tool {
  String name();

  ToolDefinition definition();

  String execute(Map<String, Object> args);
}

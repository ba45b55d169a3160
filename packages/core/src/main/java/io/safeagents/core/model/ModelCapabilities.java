package io.safeagents.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Feature flags advertised to Autogen about the deployed model. */
public record ModelCapabilities(
    boolean functionCalling, boolean jsonOutput, boolean vision, boolean structuredOutput) {

  public static ModelCapabilities all() {
    return new ModelCapabilities(true, true, true, true);
  }

  /** Keyword form used in the client's constructor arguments. */
  public Map<String, Boolean> asArguments() {
    Map<String, Boolean> m = new LinkedHashMap<>();
    m.put("function_calling", functionCalling);
    m.put("json_output", jsonOutput);
    m.put("vision", vision);
    m.put("structured_output", structuredOutput);
    return Collections.unmodifiableMap(m);
  }
}

package io.safeagents.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Provider-agnostic description of a tool. Parameters are kept as a JSON-Schema object, e.g.
 * {@code {"type": "object", "properties": {...}, "required": [...]}}.
 */
public final class ToolDefinition {
  private final String name;
  private final String description;
  private final Map<String, Object> parameters;

  public ToolDefinition(String name, String description, Map<String, Object> parameters) {
    this.name = Objects.requireNonNull(name, "name");
    this.description = Objects.requireNonNull(description, "description");
    this.parameters =
        parameters == null
            ? Map.of("type", "object", "properties", Map.of())
            : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
  }

  public String name() {
    return name;
  }

  public String description() {
    return description;
  }

  public Map<String, Object> parameters() {
    return parameters;
  }

  @Override
  public String toString() {
    return "ToolDefinition{name=" + name + '}';
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {
    private String name;
    private String description;
    private final Map<String, Object> properties = new LinkedHashMap<>();
    private final List<String> required = new ArrayList<>();

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder description(String description) {
      this.description = description;
      return this;
    }

    /**
     * Adds a scalar parameter.
     *
     * @param type JSON-Schema type name ({@code string}, {@code number}, {@code boolean}, ...)
     */
    public Builder parameter(String name, String type, String description, boolean isRequired) {
      Map<String, Object> property = new LinkedHashMap<>();
      property.put("type", type);
      property.put("description", description);
      properties.put(name, Collections.unmodifiableMap(property));
      if (isRequired) {
        required.add(name);
      }
      return this;
    }

    public ToolDefinition build() {
      Map<String, Object> schema = new LinkedHashMap<>();
      schema.put("type", "object");
      schema.put("properties", Collections.unmodifiableMap(new LinkedHashMap<>(properties)));
      schema.put("required", List.copyOf(required));
      schema.put("additionalProperties", false);
      return new ToolDefinition(name, description, schema);
    }
  }
}

package dev.jane.mcp.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.jane.mcp.exception.ValidationException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Typed read access to the already validated arguments of a tool call. */
public final class ToolArguments {
  private final ObjectNode node;

  public ToolArguments(ObjectNode node) {
    this.node = node == null ? JsonNodeFactory.instance.objectNode() : node;
  }

  public boolean has(String name) {
    JsonNode value = node.get(name);
    return value != null && !value.isNull();
  }

  public String string(String name) {
    String value = optionalString(name);
    if (value == null) {
      throw new ValidationException(
          "'" + name + "' is required", Map.of("field", name, "constraint", "required"));
    }
    return value;
  }

  public String optionalString(String name) {
    return has(name) ? node.get(name).asText() : null;
  }

  public boolean optionalBoolean(String name, boolean defaultValue) {
    return has(name) ? node.get(name).asBoolean(defaultValue) : defaultValue;
  }

  /** String list, or {@code null} when the argument was not supplied. */
  public List<String> optionalStringList(String name) {
    if (!has(name)) return null;
    List<String> values = new ArrayList<>();
    node.get(name).forEach(item -> values.add(item.asText()));
    return values;
  }
}

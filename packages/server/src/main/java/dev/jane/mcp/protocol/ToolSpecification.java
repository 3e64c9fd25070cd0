package dev.jane.mcp.protocol;

import java.util.Objects;

public record ToolSpecification(ToolDefinition definition, ToolHandler handler) {
  public ToolSpecification {
    Objects.requireNonNull(definition, "definition");
    Objects.requireNonNull(handler, "handler");
  }

  public String name() {
    return definition.name();
  }
}

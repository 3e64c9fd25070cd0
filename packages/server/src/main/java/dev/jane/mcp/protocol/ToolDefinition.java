package dev.jane.mcp.protocol;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** Name, description and argument schema of a callable tool. */
public final class ToolDefinition {
  private final String name;
  private final String title;
  private final String description;

  /** Always an {@link ToolProperty.Type#OBJECT} node; its members are the tool arguments. */
  private final ToolProperty schema;

  public ToolDefinition(String name, String title, String description, ToolProperty schema) {
    this.name = Objects.requireNonNull(name, "name");
    this.title = title;
    this.description = Objects.requireNonNull(description, "description");
    this.schema =
        schema != null ? schema : ToolProperty.builder().type(ToolProperty.Type.OBJECT).build();
    if (this.schema.getType() != ToolProperty.Type.OBJECT) {
      throw new IllegalArgumentException("Tool '" + name + "' schema must be an object");
    }
  }

  public String name() {
    return name;
  }

  public String title() {
    return title;
  }

  public String description() {
    return description;
  }

  public ToolProperty schema() {
    return schema;
  }

  /** Descriptor entry of {@code tools/list}. */
  public Map<String, Object> toDescriptor() {
    Map<String, Object> descriptor = new LinkedHashMap<>();
    descriptor.put("name", name);
    if (title != null) descriptor.put("title", title);
    descriptor.put("description", description);
    descriptor.put("inputSchema", schema.toJsonSchema());
    return descriptor;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {
    private String name;
    private String title;
    private String description;
    private final ToolProperty.Builder schema =
        ToolProperty.builder().type(ToolProperty.Type.OBJECT);

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder title(String title) {
      this.title = title;
      return this;
    }

    public Builder description(String description) {
      this.description = description;
      return this;
    }

    public Builder argument(ToolProperty argument) {
      this.schema.property(argument);
      return this;
    }

    public ToolDefinition build() {
      return new ToolDefinition(name, title, description, schema.build());
    }
  }
}

package dev.jane.mcp.protocol;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One node of a tool's JSON-Schema-like argument description. An {@link Type#OBJECT} node lists its
 * members in {@code properties}; an {@link Type#ARRAY} node describes its elements in {@code
 * items}.
 */
public class ToolProperty {
  public enum Type {
    STRING("string"),
    BOOLEAN("boolean"),
    INTEGER("integer"),
    NUMBER("number"),
    OBJECT("object"),
    ARRAY("array");

    private final String jsonName;

    Type(String jsonName) {
      this.jsonName = jsonName;
    }

    public String jsonName() {
      return jsonName;
    }
  }

  private final String name;
  private final String description;
  private final boolean required;
  private final Type type;
  private final ToolProperty items;
  private final List<ToolProperty> properties;
  private final List<String> enumValues;
  private final Object defaultValue;

  public ToolProperty(String name, String description, boolean required, Type type) {
    this(name, description, required, type, null, null, null, null);
  }

  public ToolProperty(
      String name,
      String description,
      boolean required,
      Type type,
      ToolProperty items,
      List<ToolProperty> properties,
      List<String> enumValues,
      Object defaultValue) {
    this.name = name;
    this.description = description;
    this.required = required;
    this.type = Objects.requireNonNull(type, "type");
    this.items = items;
    this.properties = properties == null ? List.of() : List.copyOf(properties);
    this.enumValues = enumValues == null ? List.of() : List.copyOf(enumValues);
    this.defaultValue = defaultValue;
  }

  public String getName() {
    return name;
  }

  public String getDescription() {
    return description;
  }

  public boolean isRequired() {
    return required;
  }

  public Type getType() {
    return type;
  }

  public ToolProperty getItems() {
    return items;
  }

  public List<ToolProperty> getProperties() {
    return properties;
  }

  public List<String> getEnumValues() {
    return enumValues;
  }

  public Object getDefaultValue() {
    return defaultValue;
  }

  public ToolProperty property(String propertyName) {
    for (ToolProperty p : properties) {
      if (p.getName().equals(propertyName)) return p;
    }
    return null;
  }

  /** Render as a JSON Schema fragment, as advertised by {@code tools/list}. */
  public Map<String, Object> toJsonSchema() {
    Map<String, Object> schema = new LinkedHashMap<>();
    schema.put("type", type.jsonName());
    if (description != null) schema.put("description", description);
    if (!enumValues.isEmpty()) schema.put("enum", enumValues);
    if (defaultValue != null) schema.put("default", defaultValue);
    if (type == Type.ARRAY && items != null) schema.put("items", items.toJsonSchema());
    if (type == Type.OBJECT) {
      Map<String, Object> members = new LinkedHashMap<>();
      List<String> requiredNames = new ArrayList<>();
      for (ToolProperty p : properties) {
        members.put(p.getName(), p.toJsonSchema());
        if (p.isRequired()) requiredNames.add(p.getName());
      }
      schema.put("properties", members);
      if (!requiredNames.isEmpty()) schema.put("required", requiredNames);
      schema.put("additionalProperties", false);
    }
    return schema;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof ToolProperty that)) return false;
    return isRequired() == that.isRequired()
        && Objects.equals(getName(), that.getName())
        && Objects.equals(getDescription(), that.getDescription())
        && getType() == that.getType()
        && Objects.equals(getEnumValues(), that.getEnumValues());
  }

  @Override
  public int hashCode() {
    return Objects.hash(getName(), getDescription(), isRequired(), getType(), getEnumValues());
  }

  public static Builder builder() {
    return new Builder();
  }

  public static ToolProperty string(String name, String description, boolean required) {
    return new ToolProperty(name, description, required, Type.STRING);
  }

  public static class Builder {
    private String name;
    private String description;
    private boolean required;
    private Type type;
    private ToolProperty items;
    private List<ToolProperty> properties;
    private List<String> enumValues;
    private Object defaultValue;

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder description(String description) {
      this.description = description;
      return this;
    }

    public Builder required(boolean required) {
      this.required = required;
      return this;
    }

    public Builder type(Type type) {
      this.type = type;
      return this;
    }

    public Builder items(ToolProperty items) {
      this.items = items;
      return this;
    }

    public Builder properties(List<ToolProperty> properties) {
      this.properties = properties;
      return this;
    }

    public Builder property(ToolProperty property) {
      if (this.properties == null) {
        this.properties = new ArrayList<>();
      }
      this.properties.add(property);
      return this;
    }

    public Builder enumValues(List<String> enumValues) {
      this.enumValues = enumValues;
      return this;
    }

    public Builder defaultValue(Object defaultValue) {
      this.defaultValue = defaultValue;
      return this;
    }

    public ToolProperty build() {
      return new ToolProperty(
          name, description, required, type, items, properties, enumValues, defaultValue);
    }
  }
}

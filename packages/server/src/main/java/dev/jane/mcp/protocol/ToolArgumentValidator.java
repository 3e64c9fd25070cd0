package dev.jane.mcp.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import dev.jane.mcp.exception.ValidationException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Checks tool arguments against a {@link ToolProperty} schema before the handler runs. The first
 * violation wins and is reported as a {@link ValidationException} whose context names the offending
 * {@code field} and the violated {@code constraint}.
 */
public final class ToolArgumentValidator {
  private ToolArgumentValidator() {}

  public static void validate(ToolProperty schema, JsonNode arguments) {
    validateNode(schema, arguments, "");
  }

  private static void validateNode(ToolProperty schema, JsonNode value, String field) {
    switch (schema.getType()) {
      case OBJECT -> validateObject(schema, value, field);
      case ARRAY -> {
        if (!value.isArray()) throw violation(field, "type", "must be an array");
        if (schema.getItems() != null) {
          for (int i = 0; i < value.size(); i++) {
            validateNode(schema.getItems(), value.get(i), field + "[" + i + "]");
          }
        }
      }
      case STRING -> {
        if (!value.isTextual()) throw violation(field, "type", "must be a string");
        if (!schema.getEnumValues().isEmpty()
            && !schema.getEnumValues().contains(value.asText())) {
          throw violation(field, "enum", "must be one of " + schema.getEnumValues());
        }
      }
      case BOOLEAN -> {
        if (!value.isBoolean()) throw violation(field, "type", "must be a boolean");
      }
      case INTEGER -> {
        if (!value.isIntegralNumber()) throw violation(field, "type", "must be an integer");
      }
      case NUMBER -> {
        if (!value.isNumber()) throw violation(field, "type", "must be a number");
      }
    }
  }

  private static void validateObject(ToolProperty schema, JsonNode value, String field) {
    if (!value.isObject()) {
      throw violation(field.isEmpty() ? "params" : field, "type", "must be an object");
    }
    for (ToolProperty member : schema.getProperties()) {
      JsonNode memberValue = value.get(member.getName());
      String memberField = qualify(field, member.getName());
      if (memberValue == null || memberValue.isNull()) {
        if (member.isRequired()) {
          throw violation(memberField, "required", "is required");
        }
        continue;
      }
      validateNode(member, memberValue, memberField);
    }
    Iterator<String> names = value.fieldNames();
    while (names.hasNext()) {
      String name = names.next();
      if (schema.property(name) == null) {
        throw violation(qualify(field, name), "additionalProperties", "is not a known argument");
      }
    }
  }

  private static String qualify(String parent, String name) {
    return parent.isEmpty() ? name : parent + "." + name;
  }

  private static ValidationException violation(String field, String constraint, String message) {
    Map<String, Object> context = new LinkedHashMap<>();
    context.put("field", field);
    context.put("constraint", constraint);
    return new ValidationException("'" + field + "' " + message, context);
  }
}

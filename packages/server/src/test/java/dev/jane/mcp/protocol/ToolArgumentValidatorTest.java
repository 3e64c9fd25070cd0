package dev.jane.mcp.protocol;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import dev.jane.mcp.exception.ValidationException;
import dev.jane.mcp.utility.JacksonUtility;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ToolArgumentValidatorTest {

  private final ToolProperty schema =
      ToolDefinition.builder()
          .name("t")
          .description("test")
          .argument(
              ToolProperty.builder()
                  .name("type")
                  .type(ToolProperty.Type.STRING)
                  .required(true)
                  .enumValues(List.of("stdlib", "spec"))
                  .build())
          .argument(ToolProperty.string("path", "path", true))
          .argument(
              ToolProperty.builder()
                  .name("tags")
                  .type(ToolProperty.Type.ARRAY)
                  .items(new ToolProperty(null, null, false, ToolProperty.Type.STRING))
                  .build())
          .argument(
              ToolProperty.builder().name("includeContent").type(ToolProperty.Type.BOOLEAN).build())
          .build()
          .schema();

  private static JsonNode json(String text) throws Exception {
    return JacksonUtility.getJsonMapper().readTree(text);
  }

  private Map<String, Object> violation(String args) throws Exception {
    JsonNode node = json(args);
    ValidationException e =
        assertThrows(ValidationException.class, () -> ToolArgumentValidator.validate(schema, node));
    return e.getContext();
  }

  @Test
  @DisplayName("valid arguments pass")
  void valid() throws Exception {
    JsonNode full =
        json("{\"type\":\"spec\",\"path\":\"a.md\",\"tags\":[\"x\"],\"includeContent\":true}");
    JsonNode nullTags = json("{\"type\":\"stdlib\",\"path\":\"a.md\",\"tags\":null}");

    assertDoesNotThrow(() -> ToolArgumentValidator.validate(schema, full));
    assertDoesNotThrow(() -> ToolArgumentValidator.validate(schema, nullTags));
  }

  @Test
  @DisplayName("each violation names its field and constraint")
  void violations() throws Exception {
    assertEquals(
        Map.of("field", "path", "constraint", "required"), violation("{\"type\":\"spec\"}"));
    assertEquals(
        Map.of("field", "type", "constraint", "enum"),
        violation("{\"type\":\"blog\",\"path\":\"a.md\"}"));
    assertEquals(
        Map.of("field", "path", "constraint", "type"), violation("{\"type\":\"spec\",\"path\":3}"));
    assertEquals(
        Map.of("field", "tags[1]", "constraint", "type"),
        violation("{\"type\":\"spec\",\"path\":\"a.md\",\"tags\":[\"a\",2]}"));
    assertEquals(
        Map.of("field", "includeContent", "constraint", "type"),
        violation("{\"type\":\"spec\",\"path\":\"a.md\",\"includeContent\":\"yes\"}"));
    assertEquals(
        Map.of("field", "extra", "constraint", "additionalProperties"),
        violation("{\"type\":\"spec\",\"path\":\"a.md\",\"extra\":1}"));
    assertEquals(Map.of("field", "params", "constraint", "type"), violation("[1]"));
  }

  @Test
  @DisplayName("the advertised JSON Schema mirrors the validation rules")
  void jsonSchema() {
    Map<String, Object> rendered = schema.toJsonSchema();

    assertEquals("object", rendered.get("type"));
    assertEquals(List.of("type", "path"), rendered.get("required"));
    assertEquals(false, rendered.get("additionalProperties"));
    @SuppressWarnings("unchecked")
    Map<String, Object> properties = (Map<String, Object>) rendered.get("properties");
    @SuppressWarnings("unchecked")
    Map<String, Object> type = (Map<String, Object>) properties.get("type");
    assertEquals(List.of("stdlib", "spec"), type.get("enum"));
  }
}

package dev.jane.mcp.document;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.jane.mcp.exception.MalformedDocumentException;
import dev.jane.mcp.exception.SerializationException;
import dev.jane.mcp.exception.ValidationException;
import dev.jane.mcp.utility.JacksonUtility;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Encodes and decodes the on-disk document format:
 *
 * <pre>
 * ---
 * title: Array methods
 * tags:
 * - arrays
 * createdAt: 2024-05-01T10:00:00Z
 * updatedAt: 2024-05-01T10:00:00Z
 * ---
 *
 * # Body
 * </pre>
 *
 * <p>Line endings are normalized to {@code \n} before parsing. Exactly one blank line separates
 * the closing delimiter from the body, so {@code parse(encode(m, b))} returns {@code b} unchanged.
 */
public class FrontmatterCodec {
  public static final String DELIMITER = "---";

  private static final String OPENING = DELIMITER + "\n";
  private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE =
      new TypeReference<>() {};

  private final ObjectMapper yamlMapper;

  public FrontmatterCodec() {
    this(JacksonUtility.getYamlMapper());
  }

  public FrontmatterCodec(ObjectMapper yamlMapper) {
    this.yamlMapper = yamlMapper;
  }

  public ParsedDocument parse(String raw) {
    String text = normalizeLineEndings(raw == null ? "" : raw);
    if (text.startsWith("\uFEFF")) {
      text = text.substring(1);
    }
    if (!text.startsWith(OPENING)) {
      throw new MalformedDocumentException(
          "missing frontmatter block; title, createdAt and updatedAt are required");
    }

    int blockStart = OPENING.length();
    int lineStart = blockStart;
    int closing = -1;
    int bodyStart = -1;
    while (lineStart <= text.length()) {
      int lineEnd = text.indexOf('\n', lineStart);
      if (lineEnd < 0) lineEnd = text.length();
      if (text.substring(lineStart, lineEnd).stripTrailing().equals(DELIMITER)) {
        closing = lineStart;
        bodyStart = Math.min(lineEnd + 1, text.length());
        break;
      }
      lineStart = lineEnd + 1;
    }
    if (closing < 0) {
      throw new MalformedDocumentException("frontmatter block is not closed with '---'");
    }

    String body = text.substring(bodyStart);
    if (body.startsWith("\n")) {
      body = body.substring(1);
    }
    return new ParsedDocument(toMetadata(readYaml(text.substring(blockStart, closing))), body);
  }

  /** Frontmatter block including both delimiters, without a trailing newline. */
  public String generate(DocumentMetadata metadata) {
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("title", metadata.title());
    if (metadata.description() != null) fields.put("description", metadata.description());
    if (metadata.author() != null) fields.put("author", metadata.author());
    if (!metadata.tags().isEmpty()) fields.put("tags", metadata.tags());
    fields.put("createdAt", metadata.createdAt().toString());
    fields.put("updatedAt", metadata.updatedAt().toString());
    metadata.extra().forEach(fields::putIfAbsent);

    String yaml;
    try {
      yaml = yamlMapper.writeValueAsString(fields);
    } catch (JsonProcessingException e) {
      throw new SerializationException("Failed to serialize frontmatter", e);
    }
    if (!yaml.endsWith("\n")) {
      yaml = yaml + "\n";
    }
    return OPENING + yaml + DELIMITER;
  }

  public String encode(DocumentMetadata metadata, String body) {
    return generate(metadata) + "\n\n" + normalizeLineEndings(body == null ? "" : body);
  }

  public static String normalizeLineEndings(String text) {
    return text.replace("\r\n", "\n").replace('\r', '\n');
  }

  private Map<String, Object> readYaml(String yaml) {
    if (yaml.isBlank()) {
      return new LinkedHashMap<>();
    }
    try {
      Map<String, Object> fields = yamlMapper.readValue(yaml, MAP_TYPE);
      return fields == null ? new LinkedHashMap<>() : fields;
    } catch (JsonProcessingException e) {
      throw new MalformedDocumentException(
          "frontmatter is not a valid YAML mapping: " + e.getOriginalMessage(), e);
    }
  }

  private DocumentMetadata toMetadata(Map<String, Object> fields) {
    Map<String, Object> extra = new LinkedHashMap<>(fields);
    String title = scalar(extra.remove("title"), "title");
    String description = scalar(extra.remove("description"), "description");
    String author = scalar(extra.remove("author"), "author");
    List<String> tags = tags(extra.remove("tags"));
    Instant createdAt = timestamp(extra.remove("createdAt"), "createdAt");
    Instant updatedAt = timestamp(extra.remove("updatedAt"), "updatedAt");

    if (title == null || title.isBlank()) {
      throw new MalformedDocumentException("frontmatter field 'title' is required");
    }
    if (updatedAt.isBefore(createdAt)) {
      throw new MalformedDocumentException(
          "updatedAt (%s) is before createdAt (%s)".formatted(updatedAt, createdAt));
    }
    try {
      return new DocumentMetadata(title, description, author, tags, createdAt, updatedAt, extra);
    } catch (ValidationException e) {
      throw new MalformedDocumentException(e.getMessage(), e);
    }
  }

  private static String scalar(Object value, String field) {
    if (value == null) return null;
    if (value instanceof Map || value instanceof Collection) {
      throw new MalformedDocumentException(
          "frontmatter field '%s' must be a scalar".formatted(field));
    }
    return String.valueOf(value);
  }

  private static List<String> tags(Object value) {
    if (value == null) return List.of();
    if (value instanceof Collection<?> items) {
      List<String> tags = new ArrayList<>();
      for (Object item : items) {
        String tag = scalar(item, "tags");
        if (tag != null && !tag.isBlank()) tags.add(tag);
      }
      return tags;
    }
    String single = scalar(value, "tags");
    return single.isBlank() ? List.of() : List.of(single);
  }

  static Instant timestamp(Object value, String field) {
    if (value == null) {
      throw new MalformedDocumentException(
          "frontmatter field '%s' is required".formatted(field));
    }
    if (value instanceof Date date) {
      return date.toInstant().truncatedTo(ChronoUnit.MILLIS);
    }
    String text = String.valueOf(value).trim();
    try {
      return Instant.parse(text).truncatedTo(ChronoUnit.MILLIS);
    } catch (DateTimeParseException ignored) {
      // fall through to the more lenient ISO-8601 shapes
    }
    try {
      return OffsetDateTime.parse(text).toInstant().truncatedTo(ChronoUnit.MILLIS);
    } catch (DateTimeParseException ignored) {
      // not an offset date-time
    }
    try {
      return LocalDateTime.parse(text).toInstant(ZoneOffset.UTC).truncatedTo(ChronoUnit.MILLIS);
    } catch (DateTimeParseException ignored) {
      // not a local date-time
    }
    try {
      return LocalDate.parse(text).atStartOfDay().toInstant(ZoneOffset.UTC);
    } catch (DateTimeParseException e) {
      throw new MalformedDocumentException(
          "frontmatter field '%s' is not an ISO-8601 timestamp: %s".formatted(field, text), e);
    }
  }
}

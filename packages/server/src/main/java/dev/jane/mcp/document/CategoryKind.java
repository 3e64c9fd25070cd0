package dev.jane.mcp.document;

import dev.jane.mcp.exception.ValidationException;
import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * The two partitions of the knowledge base.
 *
 * <p>Each kind knows its wire name (used both as the {@code type} tool argument and as the resource
 * URI scheme), the directory holding its categories below the store root, and the name of the tool
 * argument that selects a category of that kind.
 */
public enum CategoryKind {
  STDLIB("stdlib", "stdlib", "language"),
  SPEC("spec", "specs", "project");

  private final String wireName;
  private final String directory;
  private final String parameterName;

  CategoryKind(String wireName, String directory, String parameterName) {
    this.wireName = wireName;
    this.directory = directory;
    this.parameterName = parameterName;
  }

  public String wireName() {
    return wireName;
  }

  public String directory() {
    return directory;
  }

  public String parameterName() {
    return parameterName;
  }

  public static CategoryKind fromWireName(String value) {
    if (value != null) {
      String normalized = value.trim().toLowerCase(Locale.ROOT);
      for (CategoryKind kind : values()) {
        if (kind.wireName.equals(normalized)) {
          return kind;
        }
      }
    }
    throw new ValidationException(
        "Unknown document type '%s', expected one of: %s".formatted(value, wireNames()),
        Map.of("field", "type", "constraint", "enum"));
  }

  public static String wireNames() {
    return Arrays.stream(values()).map(CategoryKind::wireName).collect(Collectors.joining(", "));
  }
}

package dev.jane.mcp.document;

import java.util.Objects;

/**
 * A stored knowledge-base document. {@code (category, path)} is its identity; {@code path} is
 * relative to the category directory and always uses {@code /} as separator.
 */
public record Document(Category category, String path, DocumentMetadata metadata, String content) {

  public Document {
    Objects.requireNonNull(category, "category");
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(metadata, "metadata");
    content = content == null ? "" : content;
  }

  public String uri() {
    return category.uri(path);
  }
}

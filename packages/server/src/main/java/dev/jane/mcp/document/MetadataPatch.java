package dev.jane.mcp.document;

import java.util.List;

/**
 * Caller-supplied metadata fields. A {@code null} component means "not supplied": on create the
 * field stays unset, on update the stored value is kept.
 */
public record MetadataPatch(String title, String description, String author, List<String> tags) {

  public MetadataPatch {
    tags = tags == null ? null : List.copyOf(tags);
  }

  public static MetadataPatch empty() {
    return new MetadataPatch(null, null, null, null);
  }

  public static MetadataPatch titled(String title) {
    return new MetadataPatch(title, null, null, null);
  }

  public boolean isEmpty() {
    return title == null && description == null && author == null && tags == null;
  }
}

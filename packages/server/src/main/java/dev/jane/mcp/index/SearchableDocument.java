package dev.jane.mcp.index;

import dev.jane.mcp.document.Category;
import dev.jane.mcp.document.Document;
import java.time.Instant;
import java.util.List;

/** Projection of a document kept in the search index. */
public record SearchableDocument(
    Category category,
    String path,
    String title,
    String description,
    String author,
    List<String> tags,
    String content,
    Instant createdAt,
    Instant updatedAt) {

  public SearchableDocument {
    tags = tags == null ? List.of() : List.copyOf(tags);
    content = content == null ? "" : content;
  }

  public static SearchableDocument from(Document document) {
    var m = document.metadata();
    return new SearchableDocument(
        document.category(),
        document.path(),
        m.title(),
        m.description(),
        m.author(),
        m.tags(),
        document.content(),
        m.createdAt(),
        m.updatedAt());
  }

  public String uri() {
    return category.uri(path);
  }
}

package dev.jane.mcp.tools;

import dev.jane.mcp.document.CategoryKind;
import dev.jane.mcp.document.Document;
import dev.jane.mcp.document.DocumentMetadata;
import java.util.List;

/** Full document as returned by {@code get_stdlib} and {@code get_spec}. */
public record DocumentView(
    boolean found,
    String type,
    String language,
    String project,
    String path,
    String uri,
    String title,
    String description,
    String author,
    List<String> tags,
    String content,
    String createdAt,
    String updatedAt) {

  public static DocumentView of(Document document) {
    DocumentMetadata m = document.metadata();
    CategoryKind kind = document.category().kind();
    return new DocumentView(
        true,
        kind.wireName(),
        kind == CategoryKind.STDLIB ? document.category().name() : null,
        kind == CategoryKind.SPEC ? document.category().name() : null,
        document.path(),
        document.uri(),
        m.title(),
        m.description(),
        m.author(),
        m.tags(),
        document.content(),
        m.createdAt().toString(),
        m.updatedAt().toString());
  }
}

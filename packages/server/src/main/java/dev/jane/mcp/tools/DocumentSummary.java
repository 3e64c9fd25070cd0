package dev.jane.mcp.tools;

import dev.jane.mcp.document.CategoryKind;
import dev.jane.mcp.document.Document;
import dev.jane.mcp.document.DocumentMetadata;
import java.util.List;

/** Result of {@code create_document} and {@code update_document}: metadata without the body. */
public record DocumentSummary(
    String type,
    String language,
    String project,
    String path,
    String uri,
    String title,
    String description,
    String author,
    List<String> tags,
    String createdAt,
    String updatedAt) {

  public static DocumentSummary of(Document document) {
    DocumentMetadata m = document.metadata();
    CategoryKind kind = document.category().kind();
    return new DocumentSummary(
        kind.wireName(),
        kind == CategoryKind.STDLIB ? document.category().name() : null,
        kind == CategoryKind.SPEC ? document.category().name() : null,
        document.path(),
        document.uri(),
        m.title(),
        m.description(),
        m.author(),
        m.tags(),
        m.createdAt().toString(),
        m.updatedAt().toString());
  }
}

package dev.jane.mcp.tools;

import dev.jane.mcp.document.CategoryKind;
import dev.jane.mcp.index.SearchHit;
import dev.jane.mcp.index.SearchableDocument;
import java.util.List;

public record SearchResultItem(
    String type,
    String language,
    String project,
    String path,
    String uri,
    String title,
    String description,
    List<String> tags,
    int score,
    String updatedAt,
    List<String> matches,
    String content) {

  public static SearchResultItem of(SearchHit hit, boolean includeContent) {
    SearchableDocument d = hit.document();
    CategoryKind kind = d.category().kind();
    return new SearchResultItem(
        kind.wireName(),
        kind == CategoryKind.STDLIB ? d.category().name() : null,
        kind == CategoryKind.SPEC ? d.category().name() : null,
        d.path(),
        d.uri(),
        d.title(),
        d.description(),
        d.tags(),
        hit.score(),
        d.updatedAt().toString(),
        includeContent ? hit.matches() : null,
        includeContent ? d.content() : null);
  }
}

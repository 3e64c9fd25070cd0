package dev.jane.mcp.index;

import dev.jane.mcp.document.CategoryKind;

/**
 * Narrows search candidates. {@code kind} restricts the partition; {@code language} admits stdlib
 * documents of that language and {@code project} admits spec documents of that project. When both
 * names are given a document passes if either admits it. {@code null} means "no constraint".
 */
public record SearchFilter(CategoryKind kind, String language, String project) {

  private static final SearchFilter NONE = new SearchFilter(null, null, null);

  public static SearchFilter none() {
    return NONE;
  }

  public boolean accepts(SearchableDocument doc) {
    CategoryKind docKind = doc.category().kind();
    if (kind != null && kind != docKind) {
      return false;
    }
    if (language == null && project == null) {
      return true;
    }
    boolean languageMatch =
        language != null
            && docKind == CategoryKind.STDLIB
            && language.equals(doc.category().name());
    boolean projectMatch =
        project != null && docKind == CategoryKind.SPEC && project.equals(doc.category().name());
    return languageMatch || projectMatch;
  }
}

package dev.jane.mcp.index;

import java.util.List;

/**
 * A ranked search result. {@code matches} holds one excerpt line per query token that occurs in the
 * body and is only filled when content was requested.
 */
public record SearchHit(SearchableDocument document, int score, List<String> matches) {
  public SearchHit {
    matches = matches == null ? List.of() : List.copyOf(matches);
  }
}

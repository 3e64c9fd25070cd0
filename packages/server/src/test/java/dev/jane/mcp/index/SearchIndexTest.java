package dev.jane.mcp.index;

import static org.junit.jupiter.api.Assertions.*;

import dev.jane.mcp.document.Category;
import dev.jane.mcp.document.CategoryKind;
import dev.jane.mcp.document.Document;
import dev.jane.mcp.document.DocumentMetadata;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SearchIndexTest {

  private static final Category JS = Category.stdlib("javascript");
  private static final Category PY = Category.stdlib("python");
  private static final Category JANE = Category.spec("jane");

  private SearchIndex index;

  private static Document doc(
      Category category, String path, String title, List<String> tags, String content, int day) {
    Instant at = Instant.parse("2024-05-01T00:00:00Z").plusSeconds(day * 86_400L);
    return new Document(
        category, path, new DocumentMetadata(title, null, null, tags, at, at), content);
  }

  private static List<String> paths(List<SearchHit> hits) {
    return hits.stream().map(h -> h.document().path()).toList();
  }

  @BeforeEach
  void setUp() {
    index = new SearchIndex();
    index.upsert(doc(JS, "array-methods.md", "Array Methods", List.of(), "map filter reduce", 1));
    index.upsert(doc(JS, "intro.md", "Intro", List.of(), "array methods are useful", 2));
  }

  @Test
  @DisplayName("title matches outrank body matches")
  void ranking() {
    List<SearchHit> hits = index.search("array methods", SearchFilter.none(), false);

    assertEquals(List.of("array-methods.md", "intro.md"), paths(hits));
    assertEquals(6, hits.get(0).score());
    assertEquals(2, hits.get(1).score());
    assertTrue(hits.get(0).matches().isEmpty());
  }

  @Test
  @DisplayName("every token must match some field, case-insensitively")
  void andSemantics() {
    assertEquals(List.of("array-methods.md"), paths(index.search("ARRAY reduce", null, false)));
    assertEquals(List.of(), paths(index.search("array zebra", null, false)));
  }

  @Test
  @DisplayName("tags and descriptions contribute to the score")
  void fieldWeights() {
    index.upsert(
        new Document(
            PY,
            "lists.md",
            new DocumentMetadata(
                "Lists",
                "sequence types",
                null,
                List.of("sequence"),
                Instant.parse("2024-05-01T00:00:00Z"),
                Instant.parse("2024-05-01T00:00:00Z")),
            "body"));

    List<SearchHit> hits = index.search("sequence", null, false);

    assertEquals(1, hits.size());
    assertEquals(SearchIndex.DESCRIPTION_WEIGHT + SearchIndex.TAG_WEIGHT, hits.get(0).score());
  }

  @Test
  @DisplayName("equal scores order by most recent update, then by path")
  void tieBreak() {
    index.upsert(doc(JANE, "b.md", "Same", List.of(), "", 5));
    index.upsert(doc(JANE, "a.md", "Same", List.of(), "", 5));
    index.upsert(doc(JANE, "c.md", "Same", List.of(), "", 9));

    assertEquals(List.of("c.md", "a.md", "b.md"), paths(index.search("same", null, false)));
  }

  @Test
  @DisplayName("wildcard lists every filtered document ordered by title")
  void wildcard() {
    index.upsert(doc(JANE, "overview.md", "Bravo", List.of(), "", 3));

    List<SearchHit> all = index.search("*", null, false);
    assertEquals(List.of("array-methods.md", "overview.md", "intro.md"), paths(all));
    assertTrue(all.stream().allMatch(h -> h.score() == 0));

    assertEquals(3, index.search("  ", null, false).size());
  }

  @Test
  @DisplayName("filters restrict kind, language and project")
  void filters() {
    index.upsert(doc(PY, "arrays.md", "Array module", List.of(), "", 3));
    index.upsert(doc(JANE, "arrays.md", "Array plan", List.of(), "", 4));

    assertEquals(
        List.of(JANE.uri("arrays.md")),
        index.search("array", new SearchFilter(CategoryKind.SPEC, null, null), false).stream()
            .map(h -> h.document().uri())
            .toList());
    assertEquals(
        List.of("arrays.md"),
        paths(index.search("array", new SearchFilter(null, "python", null), false)));
    assertEquals(
        2, index.search("array", new SearchFilter(null, "python", "jane"), false).size());
    assertEquals(
        0,
        index.search("array", new SearchFilter(CategoryKind.STDLIB, null, "jane"), false).size());
  }

  @Test
  @DisplayName("includeContent adds the first matching body line per token")
  void excerpts() {
    List<SearchHit> hits = index.search("useful", null, true);

    assertEquals(List.of("array methods are useful"), hits.get(0).matches());
  }

  @Test
  @DisplayName("upsert replaces the previous entry for the same document")
  void upsertReplaces() {
    index.upsert(doc(JS, "intro.md", "Intro", List.of(), "closures explained", 3));

    assertEquals(2, index.size());
    assertEquals(List.of("intro.md"), paths(index.search("closures", null, false)));
    assertEquals(List.of(), paths(index.search("useful", null, false)));
    assertEquals("closures explained", index.get(JS, "intro.md").orElseThrow().content());
  }

  @Test
  @DisplayName("shutdown drops every entry")
  void shutdown() {
    index.shutdown();
    assertEquals(0, index.size());
    assertFalse(index.isInitialized());
  }
}

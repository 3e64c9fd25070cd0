package dev.jane.mcp.index;

import dev.jane.mcp.document.Category;
import dev.jane.mcp.document.Document;
import dev.jane.mcp.document.DocumentStore;
import dev.jane.mcp.exception.JaneException;
import dev.jane.mcp.logging.LoggingService;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;

/**
 * In-memory full-text index over every document in a {@link DocumentStore}.
 *
 * <p>Matching is case-insensitive substring matching: every query token must occur in at least one
 * of title, description, tags or body. Each occurrence scores by field: title 3, description 2,
 * tag 2, body 1. Results are ordered by score, then most recently updated, then path.
 *
 * <p>A query that is blank or {@code *} lists all filtered documents with score 0, ordered by
 * title.
 */
public class SearchIndex {
  private static final Logger log = LoggingService.getLogger(SearchIndex.class);

  public static final String WILDCARD = "*";

  static final int TITLE_WEIGHT = 3;
  static final int DESCRIPTION_WEIGHT = 2;
  static final int TAG_WEIGHT = 2;
  static final int CONTENT_WEIGHT = 1;

  private static final Comparator<SearchHit> RELEVANCE =
      Comparator.comparingInt(SearchHit::score)
          .reversed()
          .thenComparing((SearchHit h) -> h.document().updatedAt(), Comparator.reverseOrder())
          .thenComparing(h -> h.document().path())
          .thenComparing(h -> h.document().uri());

  private static final Comparator<SearchHit> BY_TITLE =
      Comparator.comparing((SearchHit h) -> h.document().title(), String.CASE_INSENSITIVE_ORDER)
          .thenComparing(h -> h.document().path())
          .thenComparing(h -> h.document().uri());

  private volatile Map<String, Entry> entries = new ConcurrentHashMap<>();
  private volatile boolean initialized;

  /**
   * Rebuild the index from scratch by scanning every category of the store. Documents that fail to
   * decode are logged and left out.
   *
   * @return number of indexed documents
   */
  public int initialize(DocumentStore store) {
    long start = System.currentTimeMillis();
    Map<String, Entry> fresh = new ConcurrentHashMap<>();
    int skipped = 0;
    for (Category category : store.listAllCategories()) {
      for (String path : store.list(category)) {
        try {
          Document doc = store.read(category, path);
          fresh.put(doc.uri(), new Entry(SearchableDocument.from(doc)));
        } catch (JaneException e) {
          skipped++;
          log.warn("Skipping {} while indexing: {}", category.uri(path), e.getMessage());
        }
      }
    }
    entries = fresh;
    initialized = true;
    log.info(
        "Indexed {} document(s) in {} ms ({} skipped)",
        fresh.size(),
        System.currentTimeMillis() - start,
        skipped);
    return fresh.size();
  }

  public boolean isInitialized() {
    return initialized;
  }

  public void upsert(Document document) {
    entries.put(document.uri(), new Entry(SearchableDocument.from(document)));
  }

  public Optional<SearchableDocument> get(Category category, String path) {
    Entry entry = entries.get(category.uri(path));
    return entry == null ? Optional.empty() : Optional.of(entry.document);
  }

  public int size() {
    return entries.size();
  }

  public List<SearchHit> search(String query, SearchFilter filter, boolean includeContent) {
    SearchFilter effective = filter == null ? SearchFilter.none() : filter;
    List<SearchHit> hits = new ArrayList<>();

    if (isWildcard(query)) {
      for (Entry entry : entries.values()) {
        if (effective.accepts(entry.document)) {
          hits.add(new SearchHit(entry.document, 0, List.of()));
        }
      }
      hits.sort(BY_TITLE);
      return hits;
    }

    List<String> tokens = Tokenizer.tokenize(query);
    for (Entry entry : entries.values()) {
      if (!effective.accepts(entry.document)) continue;
      int score = entry.score(tokens);
      if (score < 0) continue;
      List<String> matches = includeContent ? entry.excerpts(tokens) : List.of();
      hits.add(new SearchHit(entry.document, score, matches));
    }
    hits.sort(RELEVANCE);
    return hits;
  }

  public void shutdown() {
    entries = new ConcurrentHashMap<>();
    initialized = false;
  }

  static boolean isWildcard(String query) {
    return query == null || query.isBlank() || WILDCARD.equals(query.trim());
  }

  /** Indexed document with its case-folded fields. */
  private static final class Entry {
    final SearchableDocument document;
    final String title;
    final String description;
    final List<String> tags;
    final String content;

    Entry(SearchableDocument document) {
      this.document = document;
      this.title = Tokenizer.fold(document.title());
      this.description = Tokenizer.fold(document.description());
      this.tags = document.tags().stream().map(Tokenizer::fold).toList();
      this.content = Tokenizer.fold(document.content());
    }

    /** Weighted score, or -1 when some token matches no field. */
    int score(List<String> tokens) {
      int total = 0;
      for (String token : tokens) {
        int t = Tokenizer.countOccurrences(title, token);
        int d = Tokenizer.countOccurrences(description, token);
        int g = 0;
        for (String tag : tags) {
          g += Tokenizer.countOccurrences(tag, token);
        }
        int c = Tokenizer.countOccurrences(content, token);
        if (t + d + g + c == 0) {
          return -1;
        }
        total += TITLE_WEIGHT * t + DESCRIPTION_WEIGHT * d + TAG_WEIGHT * g + CONTENT_WEIGHT * c;
      }
      return total;
    }

    List<String> excerpts(List<String> tokens) {
      Set<String> lines = new LinkedHashSet<>();
      for (String token : tokens) {
        String line = Tokenizer.firstMatchingLine(document.content(), token);
        if (line != null) lines.add(line);
      }
      return List.copyOf(lines);
    }
  }
}

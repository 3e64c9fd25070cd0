package dev.jane.mcp.kb;

import dev.jane.mcp.document.Category;
import dev.jane.mcp.document.CategoryKind;
import dev.jane.mcp.document.Document;
import dev.jane.mcp.document.DocumentStore;
import dev.jane.mcp.document.MetadataPatch;
import dev.jane.mcp.exception.IndexCorruptionException;
import dev.jane.mcp.index.IndexInitialization;
import dev.jane.mcp.index.SearchFilter;
import dev.jane.mcp.index.SearchHit;
import dev.jane.mcp.index.SearchIndex;
import dev.jane.mcp.index.SearchableDocument;
import dev.jane.mcp.logging.LoggingService;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;

/**
 * Coordinates the {@link DocumentStore} and the {@link SearchIndex}.
 *
 * <p>Mutations hold the write lock for the whole disk-write plus index-update sequence, so a reader
 * never observes the file and its index entry out of step. Reads, listings and searches share the
 * read lock; a read that finds its index entry missing or stale refreshes it under the write lock.
 */
public class KnowledgeBaseService {
  private static final Logger log = LoggingService.getLogger(KnowledgeBaseService.class);

  private final DocumentStore store;
  private final SearchIndex index;
  private final IndexInitialization initialization;
  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

  public KnowledgeBaseService(
      DocumentStore store, SearchIndex index, IndexInitialization initialization) {
    this.store = store;
    this.index = index;
    this.initialization = initialization;
  }

  public void init() {
    if (initialization == IndexInitialization.EAGER) {
      rebuildIndex();
    } else {
      log.info("Search index will be built on first use");
    }
  }

  public void shutdown() {
    lock.writeLock().lock();
    try {
      index.shutdown();
    } finally {
      lock.writeLock().unlock();
    }
  }

  public DocumentStore store() {
    return store;
  }

  public int rebuildIndex() {
    lock.writeLock().lock();
    try {
      return index.initialize(store);
    } finally {
      lock.writeLock().unlock();
    }
  }

  public Document create(Category category, String path, MetadataPatch fields, String content) {
    lock.writeLock().lock();
    try {
      ensureIndexLocked();
      Document document = store.create(category, path, fields, content);
      index.upsert(document);
      log.info("Created document {}", document.uri());
      return document;
    } finally {
      lock.writeLock().unlock();
    }
  }

  public Document update(Category category, String path, MetadataPatch patch, String content) {
    lock.writeLock().lock();
    try {
      ensureIndexLocked();
      Document document = store.update(category, path, patch, content);
      index.upsert(document);
      log.info("Updated document {}", document.uri());
      return document;
    } finally {
      lock.writeLock().unlock();
    }
  }

  public Document read(Category category, String path) {
    Document document;
    lock.readLock().lock();
    try {
      document = store.read(category, path);
      if (!isStale(document)) return document;
    } finally {
      lock.readLock().unlock();
    }
    // A read lock cannot be upgraded; re-read under the write lock before refreshing.
    lock.writeLock().lock();
    try {
      document = store.read(category, path);
      if (isStale(document)) {
        log.debug("Index entry for {} was stale; refreshing", document.uri());
        index.upsert(document);
      }
      return document;
    } finally {
      lock.writeLock().unlock();
    }
  }

  private boolean isStale(Document document) {
    if (!index.isInitialized()) return false;
    Optional<SearchableDocument> indexed = index.get(document.category(), document.path());
    return indexed.isEmpty()
        || !indexed.get().updatedAt().equals(document.metadata().updatedAt());
  }

  public List<String> list(Category category) {
    lock.readLock().lock();
    try {
      return store.list(category);
    } finally {
      lock.readLock().unlock();
    }
  }

  public List<String> listCategories(CategoryKind kind) {
    lock.readLock().lock();
    try {
      return store.listCategories(kind);
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Ranked search. When a hit points at a file that no longer exists the index is rebuilt once and
   * the search repeated.
   */
  public List<SearchHit> search(String query, SearchFilter filter, boolean includeContent) {
    ensureIndex();
    try {
      return searchVerified(query, filter, includeContent);
    } catch (IndexCorruptionException e) {
      log.warn("Search index out of sync with disk ({}); rebuilding", e.getMessage());
      rebuildIndex();
      return searchVerified(query, filter, includeContent);
    }
  }

  public int documentCount() {
    ensureIndex();
    return index.size();
  }

  private List<SearchHit> searchVerified(
      String query, SearchFilter filter, boolean includeContent) {
    lock.readLock().lock();
    try {
      List<SearchHit> hits = index.search(query, filter, includeContent);
      for (SearchHit hit : hits) {
        SearchableDocument doc = hit.document();
        if (!store.exists(doc.category(), doc.path())) {
          throw new IndexCorruptionException(
              "Indexed document is missing on disk: " + doc.uri(), Map.of("uri", doc.uri()));
        }
      }
      return hits;
    } finally {
      lock.readLock().unlock();
    }
  }

  private void ensureIndex() {
    if (index.isInitialized()) return;
    lock.writeLock().lock();
    try {
      ensureIndexLocked();
    } finally {
      lock.writeLock().unlock();
    }
  }

  private void ensureIndexLocked() {
    if (!index.isInitialized()) {
      index.initialize(store);
    }
  }
}

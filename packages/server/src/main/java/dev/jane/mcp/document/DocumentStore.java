package dev.jane.mcp.document;

import dev.jane.mcp.exception.AlreadyExistsException;
import dev.jane.mcp.exception.IoException;
import dev.jane.mcp.exception.MalformedDocumentException;
import dev.jane.mcp.exception.NotFoundException;
import dev.jane.mcp.exception.PathSecurityException;
import dev.jane.mcp.exception.ValidationException;
import dev.jane.mcp.logging.LoggingService;
import dev.jane.mcp.utility.FileUtility;
import java.io.IOException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;

/**
 * Filesystem-backed document repository.
 *
 * <p>Layout below the root:
 *
 * <pre>
 * &lt;root&gt;/stdlib/&lt;language&gt;/&lt;path&gt;.md
 * &lt;root&gt;/specs/&lt;project&gt;/&lt;path&gt;.md
 * </pre>
 *
 * <p>Every user-supplied path goes through {@link #resolve(Category, String)}, which guarantees the
 * result lies strictly inside the category directory. Writes are atomic per file. The store does
 * no locking of its own; concurrent callers are serialized by {@code KnowledgeBaseService}.
 */
public class DocumentStore {
  private static final Logger log = LoggingService.getLogger(DocumentStore.class);

  public static final String DOCUMENT_EXTENSION = ".md";
  private static final int MAX_DECODE_ROUNDS = 5;

  private final Path root;
  private final FrontmatterCodec codec;
  private final Clock clock;

  public DocumentStore(Path root) {
    this(root, new FrontmatterCodec(), Clock.systemUTC());
  }

  public DocumentStore(Path root, FrontmatterCodec codec, Clock clock) {
    this.root = root.toAbsolutePath().normalize();
    this.codec = codec;
    this.clock = clock;
  }

  public Path root() {
    return root;
  }

  /** Create the partition directories and any bootstrap categories that are missing. */
  public void ensureStructure(Collection<String> languages, Collection<String> projects) {
    try {
      for (CategoryKind kind : CategoryKind.values()) {
        Files.createDirectories(root.resolve(kind.directory()));
      }
      for (String language : languages) {
        Files.createDirectories(categoryRoot(Category.stdlib(language)));
      }
      for (String project : projects) {
        Files.createDirectories(categoryRoot(Category.spec(project)));
      }
    } catch (IOException e) {
      throw new IoException("Failed to prepare document root " + root, e);
    }
    log.info("Document root ready at {}", root);
  }

  public Path categoryRoot(Category category) {
    return root.resolve(category.kind().directory()).resolve(category.name());
  }

  /**
   * Map a caller-supplied relative path to a file inside the category directory.
   *
   * <p>The input is percent-decoded until stable, so encoded traversal sequences such as {@code
   * %2e%2e%2f} are treated like their literal form. Absolute paths, NUL bytes and anything that
   * normalizes outside the category directory (directly or through a symlink) are rejected.
   */
  public Path resolve(Category category, String path) {
    if (path == null || path.isBlank()) {
      throw new ValidationException(
          "path must not be blank", Map.of("field", "path", "constraint", "required"));
    }
    String decoded = decode(path).replace('\\', '/');
    if (decoded.indexOf('\0') >= 0) {
      throw pathEscape(path, "contains a NUL byte");
    }
    if (decoded.startsWith("/") || decoded.matches("^[A-Za-z]:.*")) {
      throw pathEscape(path, "is absolute");
    }

    Path base = categoryRoot(category);
    Path resolved;
    try {
      resolved = base.resolve(decoded).normalize();
    } catch (InvalidPathException e) {
      throw new ValidationException(
          "path '%s' is not a valid file path".formatted(path),
          Map.of("field", "path", "constraint", "format"));
    }
    if (!resolved.startsWith(base) || resolved.equals(base)) {
      throw pathEscape(path, "escapes its category directory");
    }

    try {
      if (Files.exists(resolved)) {
        Path realBase = base.toRealPath();
        if (!resolved.toRealPath().startsWith(realBase)) {
          throw pathEscape(path, "links outside its category directory");
        }
      }
    } catch (IOException e) {
      throw new IoException("Failed to resolve " + category.uri(path), e);
    }
    return resolved;
  }

  public boolean exists(Category category, String path) {
    return Files.isRegularFile(resolve(category, path));
  }

  public Document read(Category category, String path) {
    String relative = relativeKey(category, path);
    Path file = resolve(category, relative);
    String uri = category.uri(relative);
    if (!Files.isRegularFile(file)) {
      throw new NotFoundException("Document not found: " + uri, Map.of("uri", uri));
    }
    String raw;
    try {
      raw = Files.readString(file, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new IoException("Failed to read " + uri, e);
    }
    try {
      ParsedDocument parsed = codec.parse(raw);
      return new Document(category, relative, parsed.metadata(), parsed.body());
    } catch (MalformedDocumentException e) {
      throw new MalformedDocumentException(
          "Malformed document %s: %s".formatted(uri, e.getMessage()), Map.of("uri", uri));
    }
  }

  public Document create(Category category, String path, MetadataPatch fields, String content) {
    String relative = relativeKey(category, path);
    if (!relative.endsWith(DOCUMENT_EXTENSION)) {
      throw new ValidationException(
          "path '%s' must end with %s".formatted(path, DOCUMENT_EXTENSION),
          Map.of("field", "path", "constraint", "extension"));
    }
    Path file = resolve(category, relative);
    String uri = category.uri(relative);
    if (Files.exists(file)) {
      throw new AlreadyExistsException("Document already exists: " + uri, Map.of("uri", uri));
    }

    DocumentMetadata metadata = DocumentMetadata.create(fields, now());
    Document document = new Document(category, relative, metadata, normalize(content));
    write(file, document);
    log.debug("Created {}", uri);
    return document;
  }

  /**
   * Merge {@code patch} into the stored metadata and optionally replace the body. {@code
   * updatedAt} always moves forward, even when the clock has not.
   */
  public Document update(Category category, String path, MetadataPatch patch, String content) {
    Document existing = read(category, path);
    Path file = resolve(category, existing.path());

    DocumentMetadata metadata =
        existing.metadata().merge(patch, nextUpdatedAt(existing.metadata().updatedAt()));
    String body = content != null ? normalize(content) : existing.content();
    Document updated = new Document(category, existing.path(), metadata, body);
    write(file, updated);
    log.debug("Updated {}", updated.uri());
    return updated;
  }

  /** Relative paths of every document in the category, sorted. Missing categories are empty. */
  public List<String> list(Category category) {
    Path base = categoryRoot(category);
    if (!Files.isDirectory(base)) {
      return List.of();
    }
    try (Stream<Path> files = Files.walk(base)) {
      return files
          .filter(Files::isRegularFile)
          .filter(p -> p.getFileName().toString().endsWith(DOCUMENT_EXTENSION))
          .map(p -> toKey(base.relativize(p)))
          .sorted()
          .collect(Collectors.toList());
    } catch (IOException e) {
      throw new IoException("Failed to list " + category.uri(""), e);
    }
  }

  /** Sorted names of the existing categories of one kind. */
  public List<String> listCategories(CategoryKind kind) {
    Path dir = root.resolve(kind.directory());
    if (!Files.isDirectory(dir)) {
      return List.of();
    }
    try (Stream<Path> children = Files.list(dir)) {
      return children
          .filter(Files::isDirectory)
          .map(p -> p.getFileName().toString())
          .filter(name -> !name.startsWith("."))
          .filter(name -> Category.NAME_PATTERN.matcher(name).matches())
          .sorted()
          .collect(Collectors.toList());
    } catch (IOException e) {
      throw new IoException("Failed to list " + kind.directory() + " categories", e);
    }
  }

  /** Every category of every kind, stdlib first. */
  public List<Category> listAllCategories() {
    List<Category> categories = new ArrayList<>();
    for (CategoryKind kind : CategoryKind.values()) {
      for (String name : listCategories(kind)) {
        categories.add(Category.of(kind, name));
      }
    }
    return categories;
  }

  private void write(Path file, Document document) {
    FileUtility.writeAtomically(file, codec.encode(document.metadata(), document.content()));
  }

  private Instant now() {
    return clock.instant().truncatedTo(ChronoUnit.MILLIS);
  }

  private Instant nextUpdatedAt(Instant previous) {
    Instant now = now();
    Instant floor = previous.truncatedTo(ChronoUnit.MILLIS).plusMillis(1);
    return now.isBefore(floor) ? floor : now;
  }

  /** Canonical form of a path used in URIs and index keys: decoded, forward slashes, relative. */
  private String relativeKey(Category category, String path) {
    Path resolved = resolve(category, path);
    return toKey(categoryRoot(category).relativize(resolved));
  }

  private static String toKey(Path relative) {
    List<String> parts = new ArrayList<>();
    relative.forEach(segment -> parts.add(segment.toString()));
    return String.join("/", parts);
  }

  private static String normalize(String content) {
    return content == null ? "" : FrontmatterCodec.normalizeLineEndings(content);
  }

  static String decode(String path) {
    String current = path;
    for (int i = 0; i < MAX_DECODE_ROUNDS; i++) {
      String next;
      try {
        next = URLDecoder.decode(current.replace("+", "%2B"), StandardCharsets.UTF_8);
      } catch (IllegalArgumentException e) {
        throw new ValidationException(
            "path '%s' contains malformed percent-encoding".formatted(path),
            Map.of("field", "path", "constraint", "encoding"));
      }
      if (next.equals(current)) {
        return next;
      }
      current = next;
    }
    return current;
  }

  private static PathSecurityException pathEscape(String path, String reason) {
    return new PathSecurityException(
        "path '%s' %s".formatted(path, reason),
        Map.of("field", "path", "constraint", "path-security"));
  }
}

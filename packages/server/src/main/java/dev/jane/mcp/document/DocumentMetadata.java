package dev.jane.mcp.document;

import dev.jane.mcp.exception.ValidationException;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Frontmatter of a stored document.
 *
 * <p>{@code title}, {@code createdAt} and {@code updatedAt} are mandatory and {@code updatedAt} is
 * never before {@code createdAt}. Both timestamps are truncated to milliseconds, the precision
 * of the file format. Tags behave as a set: duplicates are dropped, first occurrence order is
 * kept. Keys that this class does not model are carried in {@code extra} so that a read-update
 * cycle never loses them.
 */
public record DocumentMetadata(
    String title,
    String description,
    String author,
    List<String> tags,
    Instant createdAt,
    Instant updatedAt,
    Map<String, Object> extra) {

  public DocumentMetadata {
    if (title == null || title.isBlank()) {
      throw new ValidationException(
          "title must not be blank", Map.of("field", "title", "constraint", "required"));
    }
    Objects.requireNonNull(createdAt, "createdAt");
    Objects.requireNonNull(updatedAt, "updatedAt");
    createdAt = createdAt.truncatedTo(ChronoUnit.MILLIS);
    updatedAt = updatedAt.truncatedTo(ChronoUnit.MILLIS);
    if (updatedAt.isBefore(createdAt)) {
      throw new ValidationException(
          "updatedAt (%s) must not be before createdAt (%s)".formatted(updatedAt, createdAt));
    }
    tags = tags == null ? List.of() : List.copyOf(new LinkedHashSet<>(tags));
    extra =
        extra == null || extra.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(extra));
  }

  public DocumentMetadata(
      String title,
      String description,
      String author,
      List<String> tags,
      Instant createdAt,
      Instant updatedAt) {
    this(title, description, author, tags, createdAt, updatedAt, Map.of());
  }

  /** Metadata of a brand-new document, stamped with {@code now} for both timestamps. */
  public static DocumentMetadata create(MetadataPatch fields, Instant now) {
    return new DocumentMetadata(
        fields.title(), fields.description(), fields.author(), fields.tags(), now, now, Map.of());
  }

  /** Apply the supplied fields of {@code patch} and move {@code updatedAt} to the given time. */
  public DocumentMetadata merge(MetadataPatch patch, Instant updatedAt) {
    MetadataPatch p = patch == null ? MetadataPatch.empty() : patch;
    return new DocumentMetadata(
        p.title() != null ? p.title() : title,
        p.description() != null ? p.description() : description,
        p.author() != null ? p.author() : author,
        p.tags() != null ? p.tags() : tags,
        createdAt,
        updatedAt,
        extra);
  }
}
